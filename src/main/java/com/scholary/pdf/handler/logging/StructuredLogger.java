package com.scholary.pdf.handler.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method tags one job lifecycle event with an {@code event_type} and its fields, so the
 * events can be filtered in the log pipeline.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log job accepted event. */
  public void logJobAccepted(String jobId, String source, String processor, long documentBytes) {
    try {
      MDC.put("event_type", "job_accepted");
      MDC.put("documentBytes", String.valueOf(documentBytes));

      logger.info(
          "Job accepted: jobId={}, source={}, processor={}, size={} bytes",
          jobId,
          source,
          processor,
          documentBytes);
    } finally {
      clearEventFields();
    }
  }

  /** Log job completed event. */
  public void logJobCompleted(String jobId, long elapsedMs) {
    try {
      MDC.put("event_type", "job_completed");
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info("Job completed: jobId={}, elapsed={}ms", jobId, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log job failed event. */
  public void logJobFailed(String jobId, String errorType, String message, long elapsedMs) {
    try {
      MDC.put("event_type", "job_failed");
      MDC.put("errorType", errorType);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.warn(
          "Job failed: jobId={}, error={}, message={}, elapsed={}ms",
          jobId,
          errorType,
          message,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log job timed out event. */
  public void logJobTimedOut(String jobId, long timeoutMs, long elapsedMs) {
    try {
      MDC.put("event_type", "job_timed_out");
      MDC.put("timeoutMs", String.valueOf(timeoutMs));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.error(
          "Job timed out: jobId={}, deadline={}ms, elapsed={}ms", jobId, timeoutMs, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log job rejected event. */
  public void logJobRejected(String jobId, long waitedMs) {
    try {
      MDC.put("event_type", "job_rejected");
      MDC.put("waitedMs", String.valueOf(waitedMs));

      logger.warn("Job rejected, no free worker: jobId={}, waited={}ms", jobId, waitedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log batch progress event. */
  public void logBatchProgress(String jobId, int filesProcessed, int totalFiles, int failed) {
    try {
      MDC.put("event_type", "batch_progress");
      MDC.put("filesProcessed", String.valueOf(filesProcessed));
      MDC.put("totalFiles", String.valueOf(totalFiles));

      logger.info(
          "Batch progress: jobId={}, files={}/{}, failed={}",
          jobId,
          filesProcessed,
          totalFiles,
          failed);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String processor, String source) {
    MDC.put("jobId", jobId);
    MDC.put("processor", processor);
    MDC.put("source", source);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("processor");
    MDC.remove("source");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("documentBytes");
    MDC.remove("elapsedMs");
    MDC.remove("errorType");
    MDC.remove("timeoutMs");
    MDC.remove("waitedMs");
    MDC.remove("filesProcessed");
    MDC.remove("totalFiles");
  }
}
