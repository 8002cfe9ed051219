package com.scholary.pdf.handler.objectstore;

/** Thrown when an object-store endpoint is called but no object store is configured. */
public class ObjectStoreUnavailableException extends ObjectStoreException {

  public ObjectStoreUnavailableException() {
    super("Object store is not configured (set objectstore.enabled=true)");
  }
}
