package com.scholary.pdf.handler.api;

import java.time.Instant;

/** Body of every error response. {@code jobId} is null when the failure happened before a job. */
public record ErrorResponse(
    String jobId, ErrorCategory category, String message, Instant timestamp) {}
