package com.scholary.pdf.handler.processor;

import java.util.Objects;

/** Output of a processor: bytes plus what the client needs to save them. */
public record ProcessedArtifact(byte[] content, String contentType, String fileExtension) {

  public ProcessedArtifact {
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(contentType, "contentType");
    Objects.requireNonNull(fileExtension, "fileExtension");
  }

  public int size() {
    return content.length;
  }
}
