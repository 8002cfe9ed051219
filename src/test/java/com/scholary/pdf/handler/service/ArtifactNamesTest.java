package com.scholary.pdf.handler.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ArtifactNamesTest {

  @Test
  void artifactFilename_shouldReplaceExtensionAndDropDirectories() {
    assertThat(ArtifactNames.artifactFilename("reports/2024/q3.pdf", "txt")).isEqualTo("q3.txt");
    assertThat(ArtifactNames.artifactFilename("invoice.final.PDF", "json"))
        .isEqualTo("invoice.final.json");
  }

  @Test
  void artifactFilename_shouldFallBackForMissingName() {
    assertThat(ArtifactNames.artifactFilename(null, "txt")).isEqualTo("document.txt");
    assertThat(ArtifactNames.artifactFilename("folder/", "txt")).isEqualTo("document.txt");
    assertThat(ArtifactNames.artifactFilename(".pdf", "txt")).isEqualTo(".pdf.txt");
  }

  @Test
  void outputKey_shouldPrefixArtifactFilename() {
    assertThat(ArtifactNames.outputKey("processed/", "incoming/a.pdf", "txt"))
        .isEqualTo("processed/a.txt");
  }
}
