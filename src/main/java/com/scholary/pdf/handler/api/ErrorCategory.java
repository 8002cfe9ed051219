package com.scholary.pdf.handler.api;

/** What kind of failure an error response reports. */
public enum ErrorCategory {
  /** The job exceeded the processing deadline. */
  TIMEOUT,
  /** The processor rejected or failed on the input. */
  PROCESSING_FAILURE,
  /** The request could not be read, or the document could not be fetched or written. */
  TRANSPORT_FAILURE,
  /** No worker became free in time. */
  REJECTED,
  /** The request itself is invalid. */
  INVALID_REQUEST
}
