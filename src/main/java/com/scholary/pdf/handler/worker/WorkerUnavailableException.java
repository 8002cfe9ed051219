package com.scholary.pdf.handler.worker;

import java.time.Duration;

/** Thrown when no worker became free within the admission timeout. */
public class WorkerUnavailableException extends RuntimeException {

  private final String jobId;
  private final Duration waited;

  public WorkerUnavailableException(String jobId, Duration waited) {
    super(
        String.format(
            "No worker available for job %s after waiting %d ms", jobId, waited.toMillis()));
    this.jobId = jobId;
    this.waited = waited;
  }

  public String getJobId() {
    return jobId;
  }

  public Duration getWaited() {
    return waited;
  }
}
