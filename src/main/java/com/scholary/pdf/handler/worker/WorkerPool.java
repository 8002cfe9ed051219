package com.scholary.pdf.handler.worker;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Bounded pool of long-lived workers with a per-job deadline.
 *
 * <p>Each call to {@link #execute} borrows one idle worker, runs the job on it and waits for the
 * result on the calling thread. With a pool of size one, jobs are strictly serialized.
 *
 * <p>Deadline handling:
 *
 * <ul>
 *   <li>When the deadline passes, the job is cancelled with an interrupt.
 *   <li>If the job stops within the termination grace period, the worker is reused.
 *   <li>Otherwise the worker is abandoned and a fresh one takes its slot, so a job stuck in
 *       non-interruptible code cannot block the pool.
 * </ul>
 *
 * <p>The borrowed slot is returned on every exit path.
 */
public class WorkerPool implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkerPool.class);

  private final int size;
  private final Duration requestTimeout;
  private final Duration admissionTimeout;
  private final Duration terminationGrace;

  private final BlockingQueue<Worker> idleWorkers;
  private final Set<Worker> allWorkers = ConcurrentHashMap.newKeySet();
  private final Set<Worker> orphans = ConcurrentHashMap.newKeySet();

  private final AtomicLong completed = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();
  private final AtomicLong timedOut = new AtomicLong();
  private final AtomicLong replaced = new AtomicLong();

  private volatile boolean closed;

  public WorkerPool(
      int size, Duration requestTimeout, Duration admissionTimeout, Duration terminationGrace) {
    if (size < 1) {
      throw new IllegalArgumentException("worker pool size must be >= 1, got " + size);
    }
    if (requestTimeout.isNegative() || requestTimeout.isZero()) {
      throw new IllegalArgumentException("request timeout must be positive");
    }
    this.size = size;
    this.requestTimeout = requestTimeout;
    this.admissionTimeout = admissionTimeout;
    this.terminationGrace = terminationGrace;
    this.idleWorkers = new ArrayBlockingQueue<>(size, true);

    for (int slot = 1; slot <= size; slot++) {
      Worker worker = new Worker(slot, 1);
      allWorkers.add(worker);
      idleWorkers.add(worker);
    }

    LOGGER.info(
        "Initialized worker pool: workers={}, requestTimeout={}, admissionTimeout={}, grace={}",
        size,
        requestTimeout,
        admissionTimeout,
        terminationGrace);
  }

  /**
   * Run a job on the next free worker and wait for its result.
   *
   * @param jobId id used in logs and exceptions
   * @param task the job body
   * @return the job's result
   * @throws WorkerUnavailableException if no worker frees up within the admission timeout
   * @throws ProcessingTimeoutException if the job exceeds the request timeout
   * @throws ExecutionException if the job itself threw
   * @throws InterruptedException if the calling thread is interrupted; the job is cancelled
   */
  public <T> T execute(String jobId, Callable<T> task)
      throws ExecutionException, InterruptedException {
    if (closed) {
      throw new IllegalStateException("Worker pool is closed");
    }

    Worker worker = idleWorkers.poll(admissionTimeout.toMillis(), TimeUnit.MILLISECONDS);
    if (worker == null) {
      throw new WorkerUnavailableException(jobId, admissionTimeout);
    }

    Worker slotHolder = worker;
    try {
      LOGGER.debug("Job {} assigned to {}", jobId, worker.name());
      Future<T> future = worker.submit(task);
      try {
        T result = future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        completed.incrementAndGet();
        return result;
      } catch (ExecutionException e) {
        failed.incrementAndGet();
        throw e;
      } catch (TimeoutException e) {
        timedOut.incrementAndGet();
        slotHolder = reclaim(worker, future, jobId);
        throw new ProcessingTimeoutException(jobId, requestTimeout);
      } catch (InterruptedException e) {
        LOGGER.warn("Caller interrupted while waiting for job {}, cancelling", jobId);
        slotHolder = reclaim(worker, future, jobId);
        throw e;
      }
    } finally {
      idleWorkers.offer(slotHolder);
    }
  }

  /**
   * Cancel the job on a worker and decide whether the worker can be reused.
   *
   * @return the worker that should go back into the slot
   */
  private Worker reclaim(Worker worker, Future<?> future, String jobId) {
    future.cancel(true);

    if (worker.awaitFinished(terminationGrace)) {
      LOGGER.info("Job {} stopped after interrupt, reusing {}", jobId, worker.name());
      return worker;
    }

    Worker replacement = worker.replacement();
    worker.abandon();
    allWorkers.remove(worker);
    allWorkers.add(replacement);
    pruneOrphans();
    orphans.add(worker);
    replaced.incrementAndGet();

    try {
      MDC.put("event_type", "worker_replaced");
      MDC.put("worker", replacement.name());
      LOGGER.warn(
          "Job {} ignored interrupt for {} ms, abandoned {} and started {}",
          jobId,
          terminationGrace.toMillis(),
          worker.name(),
          replacement.name());
    } finally {
      MDC.remove("event_type");
      MDC.remove("worker");
    }
    return replacement;
  }

  public WorkerPoolStatus status() {
    pruneOrphans();
    return new WorkerPoolStatus(
        size,
        size - idleWorkers.size(),
        completed.get(),
        failed.get(),
        timedOut.get(),
        replaced.get(),
        orphans.size());
  }

  /** Abandoned workers still tracked, without pruning finished ones first. */
  int trackedOrphans() {
    return orphans.size();
  }

  private void pruneOrphans() {
    orphans.removeIf(w -> !w.isThreadAlive());
  }

  @Override
  public void close() {
    closed = true;
    LOGGER.info("Shutting down worker pool");
    allWorkers.forEach(Worker::abandon);
    orphans.forEach(Worker::abandon);
  }
}
