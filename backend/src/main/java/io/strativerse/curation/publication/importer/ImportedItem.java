package io.strativerse.curation.publication.importer;

import io.strativerse.curation.publication.Publication;

/** A publication written by an import, and whether the import created it. */
public record ImportedItem(Publication publication, boolean created) {}
