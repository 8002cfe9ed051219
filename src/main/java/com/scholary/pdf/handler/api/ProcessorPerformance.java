package com.scholary.pdf.handler.api;

import java.time.Instant;

/** Success rate and timing of one processor over the history retention window. */
public record ProcessorPerformance(
    String name,
    int totalAttempts,
    int successful,
    double successRate,
    double averageProcessingSeconds,
    Instant lastProcessed) {}
