package com.gentoro.lingoqueue.worker;

import com.gentoro.lingoqueue.backend.TranslationBackend;
import com.gentoro.lingoqueue.backend.spi.TranslationBackendProvider;
import com.gentoro.lingoqueue.exception.ConfigException;
import com.gentoro.lingoqueue.exception.ExceptionUtil;
import com.gentoro.lingoqueue.exception.StartupException;
import com.gentoro.lingoqueue.queue.JobSource;
import com.gentoro.lingoqueue.queue.RedisJobSource;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.apache.commons.configuration2.Configuration;

/**
 * Runs {@code worker.concurrency} {@link WorkerLoop}s on a fixed thread pool. Each worker gets its
 * own queue connection and its own backend instance; the {@link JobProcessor} and the throughput
 * counters are shared.
 */
public class WorkerPool implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.lingoqueue.logging.LoggingService.getLogger(WorkerPool.class);

  public static final int DEFAULT_CONCURRENCY = 100;

  private final int concurrency;
  private final Supplier<JobSource> sourceFactory;
  private final Supplier<TranslationBackend> backendFactory;
  private final JobProcessor processor;
  private final ThroughputCounters counters = new ThroughputCounters();
  private final ThroughputReporter reporter;
  private final Duration claimTimeout;
  private final Duration errorBackoff;
  private final Duration shutdownTimeout;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private ExecutorService executor;

  public WorkerPool(
      int concurrency,
      Supplier<JobSource> sourceFactory,
      Supplier<TranslationBackend> backendFactory,
      JobProcessor processor,
      Duration claimTimeout,
      Duration errorBackoff,
      Duration shutdownTimeout,
      Duration metricsInterval) {
    if (concurrency < 1) {
      throw new ConfigException("worker.concurrency must be at least 1, was " + concurrency);
    }
    if (claimTimeout.isZero() || claimTimeout.isNegative()) {
      // BLMOVE treats 0 as wait forever
      throw new ConfigException(
          "queue.claim-timeout-ms must be positive, was " + claimTimeout.toMillis());
    }
    this.concurrency = concurrency;
    this.sourceFactory = sourceFactory;
    this.backendFactory = backendFactory;
    this.processor = processor;
    this.claimTimeout = claimTimeout;
    this.errorBackoff = errorBackoff;
    this.shutdownTimeout = shutdownTimeout;
    this.reporter = new ThroughputReporter(counters, metricsInterval);
  }

  /** Wires a pool against Redis from {@code worker.*}, {@code queue.*} and {@code metrics.*}. */
  public static WorkerPool create(
      Configuration configuration, TranslationBackendProvider provider, JobProcessor processor) {
    return new WorkerPool(
        configuration.getInt("worker.concurrency", DEFAULT_CONCURRENCY),
        () -> RedisJobSource.connect(configuration),
        () -> provider.create(configuration),
        processor,
        Duration.ofMillis(configuration.getLong("queue.claim-timeout-ms", 100L)),
        Duration.ofMillis(configuration.getLong("queue.error-backoff-ms", 1000L)),
        Duration.ofMillis(configuration.getLong("worker.shutdown-timeout-ms", 10_000L)),
        Duration.ofMillis(configuration.getLong("metrics.interval-ms", 1000L)));
  }

  /**
   * Creates one backend per worker and starts the workers.
   *
   * @throws StartupException when a backend cannot be created; backends created so far are closed
   */
  public synchronized void start() {
    if (running.get()) {
      return;
    }
    List<TranslationBackend> backends = new ArrayList<>(concurrency);
    try {
      for (int i = 0; i < concurrency; i++) {
        backends.add(backendFactory.get());
      }
    } catch (RuntimeException e) {
      backends.forEach(WorkerPool::closeQuietly);
      throw new StartupException(
          "Could not create translation backend for worker "
              + (backends.size() + 1)
              + ": "
              + ExceptionUtil.extractErrorMessage(e),
          e);
    }

    running.set(true);
    AtomicInteger threadIndex = new AtomicInteger();
    executor =
        Executors.newFixedThreadPool(
            concurrency, r -> new Thread(r, "worker-" + threadIndex.incrementAndGet()));
    for (int i = 0; i < concurrency; i++) {
      executor.submit(
          new WorkerLoop(
              "worker-" + (i + 1),
              sourceFactory,
              backends.get(i),
              processor,
              counters,
              claimTimeout,
              errorBackoff,
              running::get));
    }
    reporter.start();
    log.info("Started {} workers", concurrency);
  }

  /** Signals the workers to stop after their current job and waits up to the shutdown timeout. */
  public synchronized void stop() {
    if (!running.getAndSet(false)) {
      return;
    }
    log.info("Stopping {} workers", concurrency);
    executor.shutdown();
    try {
      if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn(
            "Workers did not finish within {}ms, interrupting", shutdownTimeout.toMillis());
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    } finally {
      reporter.close();
    }
    ThroughputCounters.Snapshot totals = counters.totals();
    log.info(
        "Workers stopped: {} started, {} completed, {} failed",
        totals.started(),
        totals.completed(),
        totals.failed());
  }

  public boolean isRunning() {
    return running.get();
  }

  public int concurrency() {
    return concurrency;
  }

  public ThroughputCounters counters() {
    return counters;
  }

  public ThroughputReporter reporter() {
    return reporter;
  }

  private static void closeQuietly(TranslationBackend backend) {
    try {
      backend.close();
    } catch (Exception e) {
      log.debug("Failed to close backend {}", backend.id(), e);
    }
  }

  @Override
  public void close() {
    stop();
  }
}
