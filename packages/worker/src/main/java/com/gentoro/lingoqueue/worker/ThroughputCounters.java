package com.gentoro.lingoqueue.worker;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide job counters shared by all worker loops. Interval counters are read and reset by a
 * single reporter; totals only grow. Best effort: increments racing a reset may land in either
 * interval.
 */
public class ThroughputCounters {

  /** Counts for one reporting interval. */
  public record Snapshot(long started, long completed, long failed) {}

  private final AtomicLong started = new AtomicLong();
  private final AtomicLong completed = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();

  private final AtomicLong totalStarted = new AtomicLong();
  private final AtomicLong totalCompleted = new AtomicLong();
  private final AtomicLong totalFailed = new AtomicLong();

  public void jobStarted() {
    started.incrementAndGet();
    totalStarted.incrementAndGet();
  }

  public void jobCompleted() {
    completed.incrementAndGet();
    totalCompleted.incrementAndGet();
  }

  public void jobFailed() {
    failed.incrementAndGet();
    totalFailed.incrementAndGet();
  }

  public Snapshot snapshotAndReset() {
    return new Snapshot(started.getAndSet(0), completed.getAndSet(0), failed.getAndSet(0));
  }

  public Snapshot totals() {
    return new Snapshot(totalStarted.get(), totalCompleted.get(), totalFailed.get());
  }
}
