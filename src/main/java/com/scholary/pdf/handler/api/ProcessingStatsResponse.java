package com.scholary.pdf.handler.api;

/** Today's processing totals. */
public record ProcessingStatsResponse(
    int totalProcessedToday,
    int successfulToday,
    int failedToday,
    int timedOutToday,
    int rejectedToday,
    int processorsConfigured,
    double averageProcessingSeconds) {}
