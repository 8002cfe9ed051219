package com.scholary.pdf.handler.worker;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;

/**
 * A long-lived worker backed by a single daemon thread.
 *
 * <p>Runs at most one job at a time. The pool never submits a second job before the first one has
 * finished or the worker has been abandoned.
 */
final class Worker {

  private final int slot;
  private final int generation;
  private final ExecutorService executor;

  private volatile Thread thread;
  private volatile CountDownLatch finished = new CountDownLatch(0);

  Worker(int slot, int generation) {
    this.slot = slot;
    this.generation = generation;
    this.executor =
        Executors.newSingleThreadExecutor(
            runnable -> {
              Thread t = new Thread(runnable, name());
              t.setDaemon(true);
              this.thread = t;
              return t;
            });
  }

  String name() {
    return generation == 1 ? "doc-worker-" + slot : "doc-worker-" + slot + "-r" + (generation - 1);
  }

  /** Submit a job. The returned future can be cancelled; {@link #awaitFinished} tracks the thread. */
  <T> Future<T> submit(Callable<T> task) {
    FutureTask<T> future = new FutureTask<>(task);
    CountDownLatch done = new CountDownLatch(1);
    finished = done;
    executor.execute(
        () -> {
          try {
            future.run();
          } finally {
            // a late cancel interrupt must not leak into the next job
            Thread.interrupted();
            done.countDown();
          }
        });
    return future;
  }

  /**
   * Wait until the current job has really stopped running.
   *
   * @return true if the thread left the job within the grace period
   */
  boolean awaitFinished(Duration grace) {
    try {
      return finished.await(grace.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /** A fresh worker for the same slot. */
  Worker replacement() {
    return new Worker(slot, generation + 1);
  }

  /** Stop accepting work and interrupt whatever is still running. */
  void abandon() {
    executor.shutdownNow();
  }

  boolean isThreadAlive() {
    Thread t = thread;
    return t != null && t.isAlive();
  }
}
