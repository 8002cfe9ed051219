package com.scholary.pdf.handler.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.pdf.handler.config.ProcessingProperties;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Repository;

/**
 * In-memory log of processing outcomes.
 *
 * <p>Uses a Caffeine cache bounded by entry count and age, so the log never grows without limit.
 * Entries are write-once; the log is only read by the stats endpoints and never feeds back into
 * processing.
 */
@Repository
public class ProcessingLogRepository {

  private static final Comparator<ProcessingLogEntry> NEWEST_FIRST =
      Comparator.comparing(ProcessingLogEntry::createdAt).reversed();

  private final Cache<String, ProcessingLogEntry> cache;

  public ProcessingLogRepository(ProcessingProperties properties) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(properties.history().maxEntries())
            .expireAfterWrite(properties.history().retention())
            .build();
  }

  public void save(ProcessingLogEntry entry) {
    cache.put(entry.jobId() + ":" + entry.source(), entry);
  }

  public List<ProcessingLogEntry> findRecent(int limit) {
    return cache.asMap().values().stream().sorted(NEWEST_FIRST).limit(limit).toList();
  }

  public List<ProcessingLogEntry> findSince(Instant since) {
    return cache.asMap().values().stream()
        .filter(e -> !e.createdAt().isBefore(since))
        .sorted(NEWEST_FIRST)
        .toList();
  }

  public List<ProcessingLogEntry> findAll() {
    return cache.asMap().values().stream().sorted(NEWEST_FIRST).toList();
  }
}
