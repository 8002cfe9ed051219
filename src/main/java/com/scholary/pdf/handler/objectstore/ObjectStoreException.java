package com.scholary.pdf.handler.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Reported to the caller as a transport failure: the document could not be read, or the artifact
 * could not be written, for reasons outside the processor.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
