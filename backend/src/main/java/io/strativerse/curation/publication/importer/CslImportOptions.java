package io.strativerse.curation.publication.importer;

/**
 * Optional steps of a CSL-JSON import.
 *
 * @param regenerateSlugs recompute the slug of updated publications from their authors and year
 * @param tagResidual store fields the importer does not map as {@code meta} tags
 */
public record CslImportOptions(boolean regenerateSlugs, boolean tagResidual) {

  public static CslImportOptions defaults() {
    return new CslImportOptions(false, true);
  }
}
