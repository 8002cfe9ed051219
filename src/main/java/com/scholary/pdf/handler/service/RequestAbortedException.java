package com.scholary.pdf.handler.service;

/**
 * Thrown when the request thread is interrupted while waiting for its job, typically during
 * shutdown. The job has already been cancelled.
 */
public class RequestAbortedException extends RuntimeException {

  public RequestAbortedException(String message, Throwable cause) {
    super(message, cause);
  }
}
