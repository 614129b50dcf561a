package com.gentoro.lingoqueue.worker;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/** Samples and resets {@link ThroughputCounters} at a fixed interval and logs the rates. */
public class ThroughputReporter implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.lingoqueue.logging.LoggingService.getLogger(ThroughputReporter.class);

  private final ThroughputCounters counters;
  private final Duration interval;
  private volatile ThroughputCounters.Snapshot lastSnapshot =
      new ThroughputCounters.Snapshot(0, 0, 0);
  private ScheduledExecutorService scheduler;

  public ThroughputReporter(ThroughputCounters counters, Duration interval) {
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    this.counters = counters;
    this.interval = interval;
  }

  public synchronized void start() {
    if (scheduler != null) {
      return;
    }
    scheduler =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "throughput-reporter");
              t.setDaemon(true);
              return t;
            });
    scheduler.scheduleAtFixedRate(
        this::report, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
  }

  /** Reads and resets the interval counters, then logs them as per-second rates. */
  public ThroughputCounters.Snapshot report() {
    ThroughputCounters.Snapshot snapshot = counters.snapshotAndReset();
    lastSnapshot = snapshot;
    double seconds = interval.toMillis() / 1000.0d;
    log.info(
        "[METRIC] WORKER | job_processing_rps={} | job_complete_rps={} | job_failed_rps={}",
        rate(snapshot.started(), seconds),
        rate(snapshot.completed(), seconds),
        rate(snapshot.failed(), seconds));
    return snapshot;
  }

  public ThroughputCounters.Snapshot lastSnapshot() {
    return lastSnapshot;
  }

  public Duration interval() {
    return interval;
  }

  private static String rate(long count, double seconds) {
    double value = count / seconds;
    if (value == Math.rint(value)) {
      return Long.toString((long) value);
    }
    return String.format(Locale.ROOT, "%.2f", value);
  }

  @Override
  public synchronized void close() {
    if (scheduler != null) {
      scheduler.shutdownNow();
      scheduler = null;
    }
  }
}
