package com.gentoro.lingoqueue;

import com.gentoro.lingoqueue.actuator.ActuatorService;
import com.gentoro.lingoqueue.backend.TranslationBackendFactory;
import com.gentoro.lingoqueue.backend.spi.TranslationBackendProvider;
import com.gentoro.lingoqueue.exception.ConfigException;
import com.gentoro.lingoqueue.exception.StartupException;
import com.gentoro.lingoqueue.http.EmbeddedJettyServer;
import com.gentoro.lingoqueue.logging.LoggingService;
import com.gentoro.lingoqueue.logging.TranslationAuditLogger;
import com.gentoro.lingoqueue.preprocess.LanguageDetector;
import com.gentoro.lingoqueue.preprocess.TextPreprocessor;
import com.gentoro.lingoqueue.queue.QueueKeys;
import com.gentoro.lingoqueue.queue.QueueMaintenance;
import com.gentoro.lingoqueue.queue.RedisJobSource;
import com.gentoro.lingoqueue.worker.JobProcessor;
import com.gentoro.lingoqueue.worker.WorkerPool;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;
import redis.clients.jedis.Jedis;

/**
 * Application root. Depending on {@code --mode} it either runs the translation workers until a
 * shutdown signal arrives, or runs one queue maintenance command and shuts down.
 */
public class LingoQueue {

  private static final org.slf4j.Logger log = LoggingService.getLogger(LingoQueue.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private TranslationBackendProvider backendProvider;
  private TranslationAuditLogger auditLogger;
  private WorkerPool workerPool;
  private EmbeddedJettyServer httpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public LingoQueue(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());

    String mode = startupParameters.mode();
    switch (mode) {
      case StartupParameters.MODE_WORKER:
        startWorkers();
        break;
      case StartupParameters.MODE_QUEUE_STATS:
        runMaintenance(
            maintenance -> {
              QueueMaintenance.QueueStats stats = maintenance.stats();
              log.info(
                  "Queue '{}': waiting={}, active={}, completed={}, failed={}",
                  queueName(),
                  stats.waiting(),
                  stats.active(),
                  stats.completed(),
                  stats.failed());
            });
        break;
      case StartupParameters.MODE_CLEANUP_ACTIVE:
        boolean requeue = startupParameters.isEnabled("requeue");
        runMaintenance(
            maintenance -> {
              int count = maintenance.recoverActive(requeue);
              log.info(
                  "Cleared {} job(s) from the active list of '{}' ({})",
                  count,
                  queueName(),
                  requeue ? "requeued" : "marked completed");
            });
        break;
      default:
        shutdown();
        throw new ConfigException("Invalid mode: " + mode);
    }
  }

  private void startWorkers() {
    try {
      TextPreprocessor preprocessor = TextPreprocessor.create(configuration());
      this.backendProvider = TranslationBackendFactory.select(configuration());
      this.auditLogger = TranslationAuditLogger.create(configuration());
      JobProcessor processor = new JobProcessor(preprocessor, new LanguageDetector(), auditLogger);

      this.workerPool = WorkerPool.create(configuration(), backendProvider, processor);
      workerPool.start();

      if (configuration().getBoolean("http.enabled", false)) {
        this.httpServer = new EmbeddedJettyServer(configuration());
        httpServer.prepare();
        new ActuatorService(
                httpServer, workerPool, processor, backendProvider.create(configuration()))
            .register();
        httpServer.start();
      }
      log.info(
          "LingoQueue worker consuming '{}' with backend '{}'",
          queueName(),
          backendProvider.id());
    } catch (RuntimeException e) {
      shutdown();
      throw e instanceof StartupException
          ? e
          : new StartupException("Could not start the worker: " + e.getMessage(), e);
    }
  }

  private void runMaintenance(Consumer<QueueMaintenance> command) {
    try (Jedis jedis = RedisJobSource.openConnection(configuration())) {
      command.accept(new QueueMaintenance(jedis, new QueueKeys(queueName())));
    } finally {
      shutdown();
    }
  }

  private String queueName() {
    return configuration().getString("queue.name", "translation-jobs");
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "lingoqueue-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        closeQuietly(httpServer);
        closeQuietly(workerPool);
        closeQuietly(auditLogger);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.debug("Failed to close {}", closeable.getClass().getSimpleName(), e);
      }
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StartupException("LingoQueue not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }
}
