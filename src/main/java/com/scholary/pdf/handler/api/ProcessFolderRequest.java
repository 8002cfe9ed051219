package com.scholary.pdf.handler.api;

import java.util.Map;

/**
 * Request for processing every PDF under an object-store prefix.
 *
 * <p>When {@code outputPrefix} is set, each artifact is written to the same bucket under {@code
 * outputPrefix + <base name>.<ext>}.
 */
public record ProcessFolderRequest(
    String bucket,
    String prefix,
    String processor,
    Map<String, String> options,
    String outputPrefix) {

  public ProcessFolderRequest {
    if (prefix == null) {
      prefix = "";
    }
    if (options == null) {
      options = Map.of();
    }
  }
}
