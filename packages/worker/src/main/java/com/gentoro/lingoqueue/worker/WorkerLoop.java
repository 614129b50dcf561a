package com.gentoro.lingoqueue.worker;

import com.gentoro.lingoqueue.backend.TranslationBackend;
import com.gentoro.lingoqueue.exception.ExceptionUtil;
import com.gentoro.lingoqueue.exception.PayloadException;
import com.gentoro.lingoqueue.model.TranslationJob;
import com.gentoro.lingoqueue.model.TranslationResult;
import com.gentoro.lingoqueue.queue.JobSource;
import java.time.Duration;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * One worker: claims jobs one at a time and resolves each claimed job exactly once, as completed
 * or failed.
 *
 * <p>Queue errors while claiming never end the loop; the connection is reopened after a backoff.
 * Resolving is retried on a fresh connection up to {@link #RESOLVE_ATTEMPTS} times. The loop owns
 * its job source and backend and closes both when it exits.
 */
public class WorkerLoop implements Runnable {
  private static final org.slf4j.Logger log =
      com.gentoro.lingoqueue.logging.LoggingService.getLogger(WorkerLoop.class);

  static final int RESOLVE_ATTEMPTS = 3;

  private final String name;
  private final Supplier<JobSource> sourceFactory;
  private final TranslationBackend backend;
  private final JobProcessor processor;
  private final ThroughputCounters counters;
  private final Duration claimTimeout;
  private final Duration errorBackoff;
  private final BooleanSupplier running;
  private JobSource source;

  public WorkerLoop(
      String name,
      Supplier<JobSource> sourceFactory,
      TranslationBackend backend,
      JobProcessor processor,
      ThroughputCounters counters,
      Duration claimTimeout,
      Duration errorBackoff,
      BooleanSupplier running) {
    this.name = name;
    this.sourceFactory = sourceFactory;
    this.backend = backend;
    this.processor = processor;
    this.counters = counters;
    this.claimTimeout = claimTimeout;
    this.errorBackoff = errorBackoff;
    this.running = running;
  }

  @Override
  public void run() {
    log.debug("{} started", name);
    try {
      while (running.getAsBoolean() && !Thread.currentThread().isInterrupted()) {
        runOnce();
      }
    } catch (RuntimeException | Error e) {
      log.error("{} stopped unexpectedly", name, e);
      throw e;
    } finally {
      closeSource();
      try {
        backend.close();
      } catch (Exception e) {
        log.debug("{} failed to close backend", name, e);
      }
      log.debug("{} stopped", name);
    }
  }

  /**
   * Claims and handles at most one job.
   *
   * @return true when a job was claimed
   */
  boolean runOnce() {
    Optional<String> claimed;
    try {
      if (source == null) {
        source = sourceFactory.get();
      }
      claimed = source.claim(claimTimeout);
    } catch (RuntimeException e) {
      log.warn(
          "{} could not claim from queue, retrying in {}ms: {}",
          name,
          errorBackoff.toMillis(),
          ExceptionUtil.extractErrorMessage(e));
      closeSource();
      backoff();
      return false;
    }
    if (claimed.isEmpty()) {
      return false;
    }
    handle(claimed.get());
    return true;
  }

  private void handle(String jobId) {
    counters.jobStarted();
    TranslationResult result = null;
    String failure = "Worker error";
    try {
      TranslationJob job =
          source
              .fetch(jobId)
              .orElseThrow(() -> new PayloadException("No payload stored for job " + jobId));
      result = processor.process(job, backend);
    } catch (RuntimeException e) {
      failure = ExceptionUtil.extractErrorMessage(e);
      log.warn("{} job {} failed: {}", name, jobId, failure);
      if (log.isDebugEnabled()) {
        log.debug("{} job {} failure trace: {}", name, jobId, ExceptionUtil.formatCompactStackTrace(e, 8));
      }
    } catch (Error e) {
      failure = ExceptionUtil.extractErrorMessage(e);
      log.error("{} job {} failed: {}", name, jobId, failure, e);
    } finally {
      resolve(jobId, result, failure);
    }
  }

  private void resolve(String jobId, TranslationResult result, String failure) {
    for (int attempt = 1; attempt <= RESOLVE_ATTEMPTS; attempt++) {
      try {
        if (source == null) {
          source = sourceFactory.get();
        }
        if (result != null) {
          source.resolveOk(jobId, result);
          counters.jobCompleted();
        } else {
          source.resolveFail(jobId, failure);
          counters.jobFailed();
        }
        return;
      } catch (RuntimeException e) {
        closeSource();
        if (attempt == RESOLVE_ATTEMPTS) {
          log.error(
              "{} could not resolve job {} after {} attempts, it remains in the active list: {}",
              name,
              jobId,
              RESOLVE_ATTEMPTS,
              ExceptionUtil.extractErrorMessage(e));
        } else {
          log.warn(
              "{} could not resolve job {}, retrying in {}ms: {}",
              name,
              jobId,
              errorBackoff.toMillis(),
              ExceptionUtil.extractErrorMessage(e));
          backoff();
        }
      }
    }
  }

  private void backoff() {
    try {
      Thread.sleep(errorBackoff.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void closeSource() {
    if (source != null) {
      try {
        source.close();
      } catch (RuntimeException e) {
        log.debug("{} failed to close job source", name, e);
      } finally {
        source = null;
      }
    }
  }
}
