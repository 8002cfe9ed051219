package com.scholary.pdf.handler.service;

import com.scholary.pdf.handler.processor.ProcessedArtifact;

/**
 * Successful outcome of a single-document job.
 *
 * <p>Exists only for the request that produced it; results are never cached or reused.
 */
public record ProcessingResult(
    String jobId,
    String processor,
    String source,
    ProcessedArtifact artifact,
    long processingTimeMillis) {

  /** Download name for the artifact: the source's base name with the artifact's extension. */
  public String artifactFilename() {
    return ArtifactNames.artifactFilename(source, artifact.fileExtension());
  }
}
