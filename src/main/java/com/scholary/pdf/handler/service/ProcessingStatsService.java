package com.scholary.pdf.handler.service;

import com.scholary.pdf.handler.api.ProcessingStatsResponse;
import com.scholary.pdf.handler.api.ProcessorPerformance;
import com.scholary.pdf.handler.job.ProcessingLogEntry;
import com.scholary.pdf.handler.job.ProcessingLogRepository;
import com.scholary.pdf.handler.job.ProcessingStatus;
import com.scholary.pdf.handler.processor.DocumentProcessorRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

/** Aggregates the processing log for the dashboard and stats endpoints. */
@Service
public class ProcessingStatsService {

  private final ProcessingLogRepository logRepository;
  private final DocumentProcessorRegistry registry;
  private final Clock clock;

  public ProcessingStatsService(
      ProcessingLogRepository logRepository, DocumentProcessorRegistry registry, Clock clock) {
    this.logRepository = logRepository;
    this.registry = registry;
    this.clock = clock;
  }

  /** Totals for the current calendar day in the server's time zone. */
  public ProcessingStatsResponse todayStats() {
    Instant startOfDay = LocalDate.now(clock).atStartOfDay(clock.getZone()).toInstant();
    List<ProcessingLogEntry> today = logRepository.findSince(startOfDay);

    double averageSeconds =
        today.stream().mapToLong(ProcessingLogEntry::processingTimeMillis).average().orElse(0)
            / 1000.0;

    return new ProcessingStatsResponse(
        today.size(),
        count(today, ProcessingStatus.SUCCESS),
        count(today, ProcessingStatus.FAILED),
        count(today, ProcessingStatus.TIMEOUT),
        count(today, ProcessingStatus.REJECTED),
        registry.size(),
        round2(averageSeconds));
  }

  public List<ProcessingLogEntry> recentJobs(int limit) {
    return logRepository.findRecent(limit);
  }

  /** Per-processor success rate and timing over everything still in the log, by name. */
  public List<ProcessorPerformance> processorPerformance() {
    Map<String, List<ProcessingLogEntry>> byProcessor =
        logRepository.findAll().stream()
            .collect(
                Collectors.groupingBy(ProcessingLogEntry::processor, TreeMap::new, Collectors.toList()));

    return byProcessor.entrySet().stream()
        .map(
            e -> {
              List<ProcessingLogEntry> entries = e.getValue();
              int attempts = entries.size();
              int successful = count(entries, ProcessingStatus.SUCCESS);
              double averageSeconds =
                  entries.stream()
                          .mapToLong(ProcessingLogEntry::processingTimeMillis)
                          .average()
                          .orElse(0)
                      / 1000.0;
              Instant lastProcessed =
                  entries.stream()
                      .map(ProcessingLogEntry::createdAt)
                      .max(Comparator.naturalOrder())
                      .orElse(null);
              return new ProcessorPerformance(
                  e.getKey(),
                  attempts,
                  successful,
                  attempts > 0 ? (double) successful / attempts : 0,
                  round2(averageSeconds),
                  lastProcessed);
            })
        .toList();
  }

  private static int count(List<ProcessingLogEntry> entries, ProcessingStatus status) {
    return (int) entries.stream().filter(e -> e.status() == status).count();
  }

  private static double round2(double value) {
    return Math.round(value * 100) / 100.0;
  }
}
