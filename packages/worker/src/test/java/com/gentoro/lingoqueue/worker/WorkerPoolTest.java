package com.gentoro.lingoqueue.worker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.gentoro.lingoqueue.backend.TranslationBackend;
import com.gentoro.lingoqueue.exception.ConfigException;
import com.gentoro.lingoqueue.exception.StartupException;
import com.gentoro.lingoqueue.exception.TranslationException;
import com.gentoro.lingoqueue.queue.JobSource;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

class WorkerPoolTest {

  private static WorkerPool pool(
      int concurrency,
      Supplier<JobSource> sources,
      Supplier<TranslationBackend> backends) {
    return new WorkerPool(
        concurrency,
        sources,
        backends,
        mock(JobProcessor.class),
        Duration.ofMillis(10),
        Duration.ZERO,
        Duration.ofSeconds(5),
        Duration.ofSeconds(1));
  }

  @Test
  void eachWorkerGetsItsOwnSourceAndBackend() throws Exception {
    List<JobSource> sources = new CopyOnWriteArrayList<>();
    Set<JobSource> claimed = ConcurrentHashMap.newKeySet();
    List<TranslationBackend> backends = new CopyOnWriteArrayList<>();
    WorkerPool workers =
        pool(
            3,
            () -> {
              JobSource source = mock(JobSource.class);
              when(source.claim(any()))
                  .thenAnswer(
                      invocation -> {
                        claimed.add(source);
                        return Optional.empty();
                      });
              sources.add(source);
              return source;
            },
            () -> {
              TranslationBackend backend = mock(TranslationBackend.class);
              backends.add(backend);
              return backend;
            });

    workers.start();
    assertTrue(workers.isRunning());
    assertEquals(3, backends.size());
    long deadline = System.currentTimeMillis() + 5000;
    while (claimed.size() < 3 && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }

    workers.stop();
    assertFalse(workers.isRunning());
    assertEquals(3, sources.size());
    for (JobSource source : sources) {
      verify(source, atLeastOnce()).claim(Duration.ofMillis(10));
      verify(source).close();
    }
    for (TranslationBackend backend : backends) {
      verify(backend).close();
    }
  }

  @Test
  void backendFailureAbortsStartAndClosesCreatedBackends() {
    AtomicInteger created = new AtomicInteger();
    List<TranslationBackend> backends = new CopyOnWriteArrayList<>();
    WorkerPool workers =
        pool(
            3,
            () -> mock(JobSource.class),
            () -> {
              if (created.incrementAndGet() == 3) {
                throw new TranslationException("gRPC health check failed: UNAVAILABLE");
              }
              TranslationBackend backend = mock(TranslationBackend.class);
              backends.add(backend);
              return backend;
            });

    assertThrows(StartupException.class, workers::start);
    assertFalse(workers.isRunning());
    assertEquals(2, backends.size());
    backends.forEach(backend -> verify(backend).close());
  }

  @Test
  void rejectsNonPositiveConcurrency() {
    assertThrows(ConfigException.class, () -> pool(0, () -> null, () -> null));
  }

  @Test
  void rejectsClaimTimeoutThatWouldBlockForever() {
    for (Duration timeout : List.of(Duration.ZERO, Duration.ofMillis(-1))) {
      assertThrows(
          ConfigException.class,
          () ->
              new WorkerPool(
                  1,
                  () -> null,
                  () -> null,
                  mock(JobProcessor.class),
                  timeout,
                  Duration.ZERO,
                  Duration.ofSeconds(5),
                  Duration.ofSeconds(1)));
    }
  }
}
