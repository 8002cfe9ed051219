package com.scholary.pdf.handler.service;

/**
 * A job ran and failed.
 *
 * <p>Carries the job id together with the underlying failure, which is either a {@link
 * com.scholary.pdf.handler.processor.DocumentProcessingException} or an {@link
 * com.scholary.pdf.handler.objectstore.ObjectStoreException}.
 */
public class JobFailedException extends RuntimeException {

  private final String jobId;

  public JobFailedException(String jobId, RuntimeException failure) {
    super(failure.getMessage(), failure);
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }

  public RuntimeException getFailure() {
    return (RuntimeException) getCause();
  }
}
