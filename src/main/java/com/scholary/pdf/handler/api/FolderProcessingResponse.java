package com.scholary.pdf.handler.api;

import com.scholary.pdf.handler.job.ProcessingStatus;
import java.util.List;

/**
 * Response for a folder (prefix) batch.
 *
 * <p>Per-file failures are listed in {@code files} and do not fail the batch.
 */
public record FolderProcessingResponse(
    String jobId,
    String bucket,
    String prefix,
    String processor,
    int totalFiles,
    int successful,
    int failed,
    long processingTimeMs,
    List<FileResult> files) {

  public record FileResult(
      String key, ProcessingStatus status, long artifactBytes, String outputKey, String error) {

    public static FileResult success(String key, long artifactBytes, String outputKey) {
      return new FileResult(key, ProcessingStatus.SUCCESS, artifactBytes, outputKey, null);
    }

    public static FileResult failure(String key, String error) {
      return new FileResult(key, ProcessingStatus.FAILED, 0, null, error);
    }
  }
}
