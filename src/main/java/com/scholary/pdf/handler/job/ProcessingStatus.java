package com.scholary.pdf.handler.job;

/** Final outcome of a processing job. */
public enum ProcessingStatus {
  SUCCESS,
  FAILED,
  TIMEOUT,
  REJECTED
}
