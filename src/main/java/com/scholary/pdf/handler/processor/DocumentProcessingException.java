package com.scholary.pdf.handler.processor;

/**
 * Thrown when a processor cannot produce an artifact for its input.
 *
 * <p>Covers malformed or unsupported documents, bad options and failures inside the processing
 * library. It is reported to the caller as a processing failure and never takes the worker down.
 */
public class DocumentProcessingException extends RuntimeException {

  public DocumentProcessingException(String message) {
    super(message);
  }

  public DocumentProcessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
