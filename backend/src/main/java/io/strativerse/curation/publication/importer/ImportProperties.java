package io.strativerse.curation.publication.importer;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for bibliographic imports.
 *
 * @param chunkSize CSL-JSON items imported per transaction; 50 when unset
 */
@ConfigurationProperties(prefix = "curation.import")
public record ImportProperties(int chunkSize) {

  public static final int DEFAULT_CHUNK_SIZE = 50;

  public ImportProperties {
    if (chunkSize <= 0) {
      chunkSize = DEFAULT_CHUNK_SIZE;
    }
  }
}
