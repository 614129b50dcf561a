package com.gentoro.lingoqueue.worker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ThroughputCountersTest {

  @Test
  void snapshotResetsIntervalButNotTotals() {
    ThroughputCounters counters = new ThroughputCounters();
    counters.jobStarted();
    counters.jobStarted();
    counters.jobCompleted();
    counters.jobFailed();

    assertEquals(new ThroughputCounters.Snapshot(2, 1, 1), counters.snapshotAndReset());
    assertEquals(new ThroughputCounters.Snapshot(0, 0, 0), counters.snapshotAndReset());
    assertEquals(new ThroughputCounters.Snapshot(2, 1, 1), counters.totals());
  }

  @Test
  void concurrentIncrementsAreNotLost() throws Exception {
    ThroughputCounters counters = new ThroughputCounters();
    ExecutorService pool = Executors.newFixedThreadPool(8);
    for (int i = 0; i < 8; i++) {
      pool.submit(
          () -> {
            for (int j = 0; j < 1000; j++) {
              counters.jobStarted();
              counters.jobCompleted();
            }
          });
    }
    pool.shutdown();
    pool.awaitTermination(10, TimeUnit.SECONDS);

    assertEquals(new ThroughputCounters.Snapshot(8000, 8000, 0), counters.snapshotAndReset());
  }

  @Test
  void reporterPublishesLastSnapshot() {
    ThroughputCounters counters = new ThroughputCounters();
    ThroughputReporter reporter = new ThroughputReporter(counters, Duration.ofSeconds(2));
    counters.jobStarted();
    counters.jobStarted();
    counters.jobCompleted();

    ThroughputCounters.Snapshot snapshot = reporter.report();

    assertEquals(new ThroughputCounters.Snapshot(2, 1, 0), snapshot);
    assertEquals(snapshot, reporter.lastSnapshot());
    assertEquals(new ThroughputCounters.Snapshot(0, 0, 0), counters.snapshotAndReset());
  }

  @Test
  void reporterRejectsZeroInterval() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new ThroughputReporter(new ThroughputCounters(), Duration.ZERO));
  }
}
