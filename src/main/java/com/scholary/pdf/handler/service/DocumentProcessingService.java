package com.scholary.pdf.handler.service;

import com.scholary.pdf.handler.api.FolderProcessingResponse;
import com.scholary.pdf.handler.api.FolderProcessingResponse.FileResult;
import com.scholary.pdf.handler.job.ProcessingJob;
import com.scholary.pdf.handler.job.ProcessingLogEntry;
import com.scholary.pdf.handler.job.ProcessingLogRepository;
import com.scholary.pdf.handler.job.ProcessingStatus;
import com.scholary.pdf.handler.logging.StructuredLogger;
import com.scholary.pdf.handler.objectstore.ObjectStoreClient;
import com.scholary.pdf.handler.objectstore.ObjectStoreException;
import com.scholary.pdf.handler.objectstore.ObjectStoreProperties;
import com.scholary.pdf.handler.objectstore.ObjectStoreUnavailableException;
import com.scholary.pdf.handler.processor.DocumentProcessingException;
import com.scholary.pdf.handler.processor.DocumentProcessor;
import com.scholary.pdf.handler.processor.DocumentProcessorRegistry;
import com.scholary.pdf.handler.processor.ProcessedArtifact;
import com.scholary.pdf.handler.worker.ProcessingTimeoutException;
import com.scholary.pdf.handler.worker.WorkerPool;
import com.scholary.pdf.handler.worker.WorkerUnavailableException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Runs processing jobs through the worker pool.
 *
 * <p>For every job this service:
 *
 * <ul>
 *   <li>resolves the processor and assigns a job id
 *   <li>runs the job on a worker under the request deadline
 *   <li>classifies the outcome (success, processing failure, transport failure, timeout, rejected)
 *   <li>records the outcome in the processing log
 * </ul>
 *
 * <p>Documents are never cached: two identical requests are processed independently.
 */
@Service
public class DocumentProcessingService {

  private static final Logger LOGGER = LoggerFactory.getLogger(DocumentProcessingService.class);
  private static final StructuredLogger EVENTS = new StructuredLogger(LOGGER);

  private final WorkerPool workerPool;
  private final DocumentProcessorRegistry registry;
  private final ProcessingLogRepository logRepository;
  private final ObjectProvider<ObjectStoreClient> objectStoreClient;
  private final ObjectProvider<ObjectStoreProperties> objectStoreProperties;
  private final Clock clock;

  public DocumentProcessingService(
      WorkerPool workerPool,
      DocumentProcessorRegistry registry,
      ProcessingLogRepository logRepository,
      ObjectProvider<ObjectStoreClient> objectStoreClient,
      ObjectProvider<ObjectStoreProperties> objectStoreProperties,
      Clock clock) {
    this.workerPool = workerPool;
    this.registry = registry;
    this.logRepository = logRepository;
    this.objectStoreClient = objectStoreClient;
    this.objectStoreProperties = objectStoreProperties;
    this.clock = clock;
  }

  /** Process an uploaded document. */
  public ProcessingResult process(
      String filename, byte[] document, String processorName, Map<String, String> options) {
    DocumentProcessor processor = registry.resolve(processorName);
    ProcessingJob job = ProcessingJob.create(filename, processor.name(), options);

    long started = System.nanoTime();
    ProcessedArtifact artifact =
        execute(job, document.length, () -> processor.process(document, job.options()));
    return succeeded(job, artifact, started);
  }

  /** Process one document read from the object store. The read counts against the deadline. */
  public ProcessingResult processObject(
      String bucket, String key, String processorName, Map<String, String> options) {
    ObjectStoreClient client = requireObjectStore();
    String resolvedBucket = resolveBucket(bucket);
    DocumentProcessor processor = registry.resolve(processorName);
    ProcessingJob job = ProcessingJob.create(resolvedBucket + "/" + key, processor.name(), options);

    long started = System.nanoTime();
    ProcessedArtifact artifact =
        execute(
            job,
            -1,
            () -> processor.process(client.getObjectBytes(resolvedBucket, key), job.options()));
    return succeeded(job, artifact, started);
  }

  /**
   * Process every PDF under a prefix as one job.
   *
   * <p>Files are processed in listing order. A file that fails is recorded and skipped; the batch
   * itself only fails if listing fails, the deadline passes or no worker is free.
   */
  public FolderProcessingResponse processFolder(
      String bucket,
      String prefix,
      String processorName,
      Map<String, String> options,
      String outputPrefix) {
    ObjectStoreClient client = requireObjectStore();
    String resolvedBucket = resolveBucket(bucket);
    DocumentProcessor processor = registry.resolve(processorName);
    ProcessingJob job =
        ProcessingJob.create(resolvedBucket + "/" + prefix, processor.name(), options);

    return execute(
        job,
        -1,
        () -> runBatch(job, client, resolvedBucket, prefix, processor, outputPrefix));
  }

  private FolderProcessingResponse runBatch(
      ProcessingJob job,
      ObjectStoreClient client,
      String bucket,
      String prefix,
      DocumentProcessor processor,
      String outputPrefix) {
    long batchStarted = System.nanoTime();

    List<String> keys =
        client.listObjectKeys(bucket, prefix).stream()
            .filter(k -> k.toLowerCase(Locale.ROOT).endsWith(".pdf"))
            .toList();
    LOGGER.info("Found {} PDF files under {}/{}", keys.size(), bucket, prefix);

    List<FileResult> files = new ArrayList<>();
    int successful = 0;
    int failed = 0;

    for (String key : keys) {
      if (Thread.currentThread().isInterrupted()) {
        throw new DocumentProcessingException(
            String.format("Batch interrupted after %d of %d files", files.size(), keys.size()));
      }

      long fileStarted = System.nanoTime();
      String source = bucket + "/" + key;
      try {
        byte[] document = client.getObjectBytes(bucket, key);
        ProcessedArtifact artifact = processor.process(document, job.options());

        String outputKey = null;
        if (outputPrefix != null && !outputPrefix.isBlank()) {
          outputKey = ArtifactNames.outputKey(outputPrefix, key, artifact.fileExtension());
          client.putObject(bucket, outputKey, artifact.content(), artifact.contentType());
        }

        files.add(FileResult.success(key, artifact.size(), outputKey));
        successful++;
        record(job, source, ProcessingStatus.SUCCESS, null, artifact.size(), fileStarted);

      } catch (RuntimeException e) {
        if (Thread.currentThread().isInterrupted()) {
          // deadline passed mid-file: the batch is recorded as TIMEOUT by the caller
          LOGGER.info("Batch {} cancelled while processing {}", job.jobId(), source);
          throw e;
        }
        if (!(e instanceof DocumentProcessingException) && !(e instanceof ObjectStoreException)) {
          LOGGER.error("Unexpected failure processing {}", source, e);
        } else {
          LOGGER.warn("Failed to process {}: {}", source, e.getMessage());
        }
        files.add(FileResult.failure(key, e.getMessage()));
        failed++;
        record(job, source, ProcessingStatus.FAILED, e.getMessage(), 0, fileStarted);
      }

      EVENTS.logBatchProgress(job.jobId(), files.size(), keys.size(), failed);
    }

    return new FolderProcessingResponse(
        job.jobId(),
        bucket,
        prefix,
        processor.name(),
        keys.size(),
        successful,
        failed,
        elapsedMillis(batchStarted),
        files);
  }

  /**
   * Run a job body on the worker pool and translate its outcome.
   *
   * <p>Failed, timed out and rejected outcomes are recorded here; callers record successes.
   *
   * @param documentBytes size of the input, or -1 when it is read inside the job
   */
  private <T> T execute(ProcessingJob job, long documentBytes, Callable<T> body) {
    StructuredLogger.setJobContext(job.jobId(), job.processor(), job.source());
    long started = System.nanoTime();
    try {
      EVENTS.logJobAccepted(job.jobId(), job.source(), job.processor(), documentBytes);
      T result = workerPool.execute(job.jobId(), withMdc(body));
      EVENTS.logJobCompleted(job.jobId(), elapsedMillis(started));
      return result;

    } catch (ProcessingTimeoutException e) {
      EVENTS.logJobTimedOut(job.jobId(), e.getTimeout().toMillis(), elapsedMillis(started));
      record(job, job.source(), ProcessingStatus.TIMEOUT, e.getMessage(), 0, started);
      throw e;

    } catch (WorkerUnavailableException e) {
      EVENTS.logJobRejected(job.jobId(), e.getWaited().toMillis());
      record(job, job.source(), ProcessingStatus.REJECTED, e.getMessage(), 0, started);
      throw e;

    } catch (ExecutionException e) {
      RuntimeException failure = classify(e.getCause());
      EVENTS.logJobFailed(
          job.jobId(),
          e.getCause().getClass().getSimpleName(),
          failure.getMessage(),
          elapsedMillis(started));
      record(job, job.source(), ProcessingStatus.FAILED, failure.getMessage(), 0, started);
      throw new JobFailedException(job.jobId(), failure);

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      record(job, job.source(), ProcessingStatus.FAILED, "Request aborted", 0, started);
      throw new RequestAbortedException("Request aborted while job " + job.jobId() + " ran", e);

    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private RuntimeException classify(Throwable cause) {
    if (cause instanceof DocumentProcessingException || cause instanceof ObjectStoreException) {
      return (RuntimeException) cause;
    }
    LOGGER.error("Processor failed unexpectedly", cause);
    return new DocumentProcessingException("Processor failed unexpectedly: " + cause, cause);
  }

  private ProcessingResult succeeded(ProcessingJob job, ProcessedArtifact artifact, long started) {
    long elapsed = elapsedMillis(started);
    record(job, job.source(), ProcessingStatus.SUCCESS, null, artifact.size(), started);
    return new ProcessingResult(job.jobId(), job.processor(), job.source(), artifact, elapsed);
  }

  private void record(
      ProcessingJob job,
      String source,
      ProcessingStatus status,
      String errorMessage,
      long artifactBytes,
      long startedNanos) {
    logRepository.save(
        new ProcessingLogEntry(
            job.jobId(),
            source,
            job.processor(),
            status,
            errorMessage,
            artifactBytes,
            elapsedMillis(startedNanos),
            clock.instant()));
  }

  private ObjectStoreClient requireObjectStore() {
    ObjectStoreClient client = objectStoreClient.getIfAvailable();
    if (client == null) {
      throw new ObjectStoreUnavailableException();
    }
    return client;
  }

  private String resolveBucket(String bucket) {
    if (bucket != null && !bucket.isBlank()) {
      return bucket;
    }
    ObjectStoreProperties properties = objectStoreProperties.getIfAvailable();
    if (properties == null) {
      throw new ObjectStoreUnavailableException();
    }
    return properties.bucket();
  }

  /** Carry the caller's MDC (job id, processor, source) onto the worker thread. */
  private static <T> Callable<T> withMdc(Callable<T> body) {
    Map<String, String> context = MDC.getCopyOfContextMap();
    return () -> {
      if (context != null) {
        MDC.setContextMap(context);
      }
      try {
        return body.call();
      } finally {
        MDC.clear();
      }
    };
  }

  private static long elapsedMillis(long startedNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
  }
}
