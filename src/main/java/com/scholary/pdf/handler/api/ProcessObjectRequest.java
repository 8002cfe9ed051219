package com.scholary.pdf.handler.api;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/**
 * Request for processing one document stored in the object store.
 *
 * <p>{@code bucket} defaults to the configured bucket, {@code processor} to the default processor.
 */
public record ProcessObjectRequest(
    String bucket, @NotBlank String key, String processor, Map<String, String> options) {

  public ProcessObjectRequest {
    if (options == null) {
      options = Map.of();
    }
  }
}
