package com.scholary.pdf.handler.processor;

import java.util.Collection;

/** Thrown when a request names a processor that is not registered. */
public class UnknownProcessorException extends RuntimeException {

  public UnknownProcessorException(String name, Collection<String> available) {
    super(String.format("Unknown processor '%s', available: %s", name, available));
  }
}
