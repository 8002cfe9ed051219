package com.scholary.pdf.handler.worker;

import java.time.Duration;

/**
 * Thrown when a job does not finish within the request deadline.
 *
 * <p>Distinct from a processing failure: a timeout points at slow or pathological input rather than
 * at a fault in the processor.
 */
public class ProcessingTimeoutException extends RuntimeException {

  private final String jobId;
  private final Duration timeout;

  public ProcessingTimeoutException(String jobId, Duration timeout) {
    super(
        String.format(
            "Job %s did not finish within the %d ms processing deadline",
            jobId, timeout.toMillis()));
    this.jobId = jobId;
    this.timeout = timeout;
  }

  public String getJobId() {
    return jobId;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
