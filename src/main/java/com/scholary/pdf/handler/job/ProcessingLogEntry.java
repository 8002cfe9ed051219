package com.scholary.pdf.handler.job;

import java.time.Instant;

/**
 * Record of one finished job, kept for the dashboard and stats endpoints.
 *
 * @param artifactBytes size of the produced artifact, 0 unless the job succeeded
 * @param processingTimeMillis wall-clock time from admission to outcome
 */
public record ProcessingLogEntry(
    String jobId,
    String source,
    String processor,
    ProcessingStatus status,
    String errorMessage,
    long artifactBytes,
    long processingTimeMillis,
    Instant createdAt) {}
