package com.scholary.pdf.handler.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for document processing.
 *
 * <p>Controls the worker pool size, the per-request deadline and how long the processing history is
 * kept.
 */
@ConfigurationProperties(prefix = "processing")
@Validated
public record ProcessingProperties(
    @Positive int workers,
    @NotNull Duration requestTimeout,
    @NotNull Duration admissionTimeout,
    @NotNull Duration terminationGrace,
    @NotBlank String defaultProcessor,
    @Valid @NotNull HistoryProperties history) {

  public record HistoryProperties(@Positive int maxEntries, @NotNull Duration retention) {}
}
