package com.scholary.pdf.handler.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.LockSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class WorkerPoolTest {

  private WorkerPool pool;

  @AfterEach
  void tearDown() {
    if (pool != null) {
      pool.close();
    }
  }

  @Test
  void execute_shouldReturnJobResult() throws Exception {
    pool = new WorkerPool(1, Duration.ofSeconds(5), Duration.ofSeconds(5), Duration.ofSeconds(1));

    String result = pool.execute("job-1", () -> "done");

    assertThat(result).isEqualTo("done");
    assertThat(pool.status().completed()).isEqualTo(1);
    assertThat(pool.status().busy()).isZero();
  }

  @Test
  void execute_shouldNeverRunTwoJobsAtOnceWithOneWorker() throws Exception {
    pool = new WorkerPool(1, Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofSeconds(1));
    AtomicInteger running = new AtomicInteger();
    AtomicInteger maxRunning = new AtomicInteger();

    ExecutorService callers = Executors.newFixedThreadPool(5);
    try {
      List<Future<Integer>> results = new ArrayList<>();
      for (int i = 0; i < 5; i++) {
        int n = i;
        results.add(
            callers.submit(
                () ->
                    pool.execute(
                        "job-" + n,
                        () -> {
                          int now = running.incrementAndGet();
                          maxRunning.accumulateAndGet(now, Math::max);
                          Thread.sleep(50);
                          running.decrementAndGet();
                          return n;
                        })));
      }
      for (Future<Integer> result : results) {
        result.get(10, TimeUnit.SECONDS);
      }
    } finally {
      callers.shutdownNow();
    }

    assertThat(maxRunning.get()).isEqualTo(1);
    assertThat(pool.status().completed()).isEqualTo(5);
  }

  @Test
  void execute_shouldTimeOutAndReuseWorkerWhenJobStopsOnInterrupt() throws Exception {
    pool =
        new WorkerPool(1, Duration.ofMillis(200), Duration.ofSeconds(5), Duration.ofSeconds(2));

    assertThatThrownBy(
            () ->
                pool.execute(
                    "slow",
                    () -> {
                      Thread.sleep(10_000);
                      return "never";
                    }))
        .isInstanceOf(ProcessingTimeoutException.class)
        .satisfies(
            e -> {
              ProcessingTimeoutException timeout = (ProcessingTimeoutException) e;
              assertThat(timeout.getJobId()).isEqualTo("slow");
              assertThat(timeout.getTimeout()).isEqualTo(Duration.ofMillis(200));
            });

    String worker = pool.execute("next", () -> Thread.currentThread().getName());

    assertThat(worker).isEqualTo("doc-worker-1");
    WorkerPoolStatus status = pool.status();
    assertThat(status.timedOut()).isEqualTo(1);
    assertThat(status.replaced()).isZero();
    assertThat(status.completed()).isEqualTo(1);
  }

  @Test
  void execute_shouldNotLeakCancelInterruptIntoNextJob() throws Exception {
    pool =
        new WorkerPool(1, Duration.ofMillis(100), Duration.ofSeconds(5), Duration.ofSeconds(2));

    assertThatThrownBy(
            () ->
                pool.execute(
                    "slow",
                    () -> {
                      Thread.sleep(5_000);
                      return null;
                    }))
        .isInstanceOf(ProcessingTimeoutException.class);

    Boolean interrupted = pool.execute("next", () -> Thread.currentThread().isInterrupted());

    assertThat(interrupted).isFalse();
  }

  @Test
  void execute_shouldReplaceWorkerWhenJobIgnoresInterrupt() throws Exception {
    pool =
        new WorkerPool(1, Duration.ofMillis(200), Duration.ofSeconds(5), Duration.ofMillis(200));
    AtomicBoolean release = new AtomicBoolean();

    try {
      assertThatThrownBy(
              () ->
                  pool.execute(
                      "stuck",
                      () -> {
                        while (!release.get()) {
                          LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(10));
                        }
                        return "late";
                      }))
          .isInstanceOf(ProcessingTimeoutException.class);

      String worker = pool.execute("next", () -> Thread.currentThread().getName());

      assertThat(worker).isEqualTo("doc-worker-1-r1");
      WorkerPoolStatus status = pool.status();
      assertThat(status.replaced()).isEqualTo(1);
      assertThat(status.orphaned()).isEqualTo(1);
      assertThat(status.workers()).isEqualTo(1);
    } finally {
      release.set(true);
    }

    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (pool.status().orphaned() > 0 && System.nanoTime() < deadline) {
      Thread.sleep(20);
    }
    assertThat(pool.status().orphaned()).isZero();
  }

  @Test
  void execute_shouldDropFinishedOrphansWhenReplacingAnotherWorker() throws Exception {
    pool =
        new WorkerPool(1, Duration.ofMillis(200), Duration.ofSeconds(5), Duration.ofMillis(200));
    AtomicBoolean releaseFirst = new AtomicBoolean();
    AtomicBoolean releaseSecond = new AtomicBoolean();
    AtomicReference<Thread> firstThread = new AtomicReference<>();

    try {
      assertThatThrownBy(
              () ->
                  pool.execute(
                      "stuck-1",
                      () -> {
                        firstThread.set(Thread.currentThread());
                        while (!releaseFirst.get()) {
                          LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(10));
                        }
                        return null;
                      }))
          .isInstanceOf(ProcessingTimeoutException.class);
      assertThat(pool.trackedOrphans()).isEqualTo(1);

      releaseFirst.set(true);
      firstThread.get().join(5_000);
      assertThat(firstThread.get().isAlive()).isFalse();

      assertThatThrownBy(
              () ->
                  pool.execute(
                      "stuck-2",
                      () -> {
                        while (!releaseSecond.get()) {
                          LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(10));
                        }
                        return null;
                      }))
          .isInstanceOf(ProcessingTimeoutException.class);

      assertThat(pool.trackedOrphans()).isEqualTo(1);
    } finally {
      releaseFirst.set(true);
      releaseSecond.set(true);
    }
  }

  @Test
  void execute_shouldKeepWorkerUsableAfterJobFailure() throws Exception {
    pool = new WorkerPool(1, Duration.ofSeconds(5), Duration.ofSeconds(5), Duration.ofSeconds(1));

    assertThatThrownBy(
            () ->
                pool.execute(
                    "bad",
                    () -> {
                      throw new IllegalStateException("boom");
                    }))
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(IllegalStateException.class)
        .hasRootCauseMessage("boom");

    assertThat(pool.execute("good", () -> 42)).isEqualTo(42);
    assertThat(pool.status().failed()).isEqualTo(1);
    assertThat(pool.status().completed()).isEqualTo(1);
  }

  @Test
  void execute_shouldRejectWhenNoWorkerFreesUpInTime() throws Exception {
    pool =
        new WorkerPool(1, Duration.ofSeconds(10), Duration.ofMillis(100), Duration.ofSeconds(1));
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);

    ExecutorService caller = Executors.newSingleThreadExecutor();
    try {
      Future<String> first =
          caller.submit(
              () ->
                  pool.execute(
                      "first",
                      () -> {
                        started.countDown();
                        release.await();
                        return "first-done";
                      }));
      assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
      assertThat(pool.status().busy()).isEqualTo(1);

      assertThatThrownBy(() -> pool.execute("second", () -> "second-done"))
          .isInstanceOf(WorkerUnavailableException.class)
          .satisfies(
              e -> assertThat(((WorkerUnavailableException) e).getJobId()).isEqualTo("second"));

      release.countDown();
      assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo("first-done");
    } finally {
      caller.shutdownNow();
    }

    assertThat(pool.execute("third", () -> "third-done")).isEqualTo("third-done");
  }

  @Test
  void constructor_shouldRejectEmptyPool() {
    assertThatThrownBy(
            () -> new WorkerPool(0, Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void execute_shouldFailAfterClose() {
    pool = new WorkerPool(1, Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofSeconds(1));
    pool.close();

    assertThatThrownBy(() -> pool.execute("late", () -> "x"))
        .isInstanceOf(IllegalStateException.class);
  }
}
