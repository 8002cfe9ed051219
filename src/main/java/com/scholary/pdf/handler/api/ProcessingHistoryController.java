package com.scholary.pdf.handler.api;

import com.scholary.pdf.handler.job.ProcessingLogEntry;
import com.scholary.pdf.handler.processor.DocumentProcessorRegistry;
import com.scholary.pdf.handler.processor.ProcessorInfo;
import com.scholary.pdf.handler.service.ProcessingStatsService;
import com.scholary.pdf.handler.worker.WorkerPool;
import com.scholary.pdf.handler.worker.WorkerPoolStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Read-only views of the processing history, the processors and the worker pool. */
@RestController
@Tag(name = "History", description = "Processing statistics, recent jobs and worker status")
public class ProcessingHistoryController {

  private static final int MAX_RECENT_JOBS = 500;

  private final ProcessingStatsService statsService;
  private final DocumentProcessorRegistry registry;
  private final WorkerPool workerPool;

  public ProcessingHistoryController(
      ProcessingStatsService statsService,
      DocumentProcessorRegistry registry,
      WorkerPool workerPool) {
    this.statsService = statsService;
    this.registry = registry;
    this.workerPool = workerPool;
  }

  @GetMapping("/api/processing-stats")
  @Operation(summary = "Today's processing totals")
  public ProcessingStatsResponse processingStats() {
    return statsService.todayStats();
  }

  @GetMapping("/api/recent-jobs")
  @Operation(summary = "Most recent job outcomes, newest first")
  public List<ProcessingLogEntry> recentJobs(
      @RequestParam(name = "limit", defaultValue = "10") int limit) {
    return statsService.recentJobs(Math.max(1, Math.min(limit, MAX_RECENT_JOBS)));
  }

  @GetMapping("/api/processor-performance")
  @Operation(summary = "Success rate and timing per processor")
  public List<ProcessorPerformance> processorPerformance() {
    return statsService.processorPerformance();
  }

  @GetMapping("/api/processors")
  @Operation(summary = "Registered processors")
  public List<ProcessorInfo> processors() {
    return registry.list();
  }

  @GetMapping("/api/worker-status")
  @Operation(summary = "Worker pool status")
  public WorkerPoolStatus workerStatus() {
    return workerPool.status();
  }
}
