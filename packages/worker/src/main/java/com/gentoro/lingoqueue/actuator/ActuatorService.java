package com.gentoro.lingoqueue.actuator;

import com.gentoro.lingoqueue.backend.TranslationBackend;
import com.gentoro.lingoqueue.http.EmbeddedJettyServer;
import com.gentoro.lingoqueue.worker.JobProcessor;
import com.gentoro.lingoqueue.worker.WorkerPool;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/** Registers the health, metrics and synchronous translation endpoints on the shared server. */
public class ActuatorService {
  private static final org.slf4j.Logger log =
      com.gentoro.lingoqueue.logging.LoggingService.getLogger(ActuatorService.class);

  private final EmbeddedJettyServer server;
  private final WorkerPool pool;
  private final JobProcessor processor;
  private final TranslationBackend backend;

  public ActuatorService(
      EmbeddedJettyServer server,
      WorkerPool pool,
      JobProcessor processor,
      TranslationBackend backend) {
    this.server = server;
    this.pool = pool;
    this.processor = processor;
    this.backend = backend;
  }

  public void register() {
    ServletContextHandler context = server.getContextHandler();
    context.addServlet(new ServletHolder(new HealthServlet(backend.id(), pool)), "/health");
    context.addServlet(
        new ServletHolder(new MetricsServlet(pool.reporter(), pool.counters())), "/metrics");
    context.addServlet(new ServletHolder(new TranslateServlet(processor, backend)), "/translate");
    log.debug("Registered actuator endpoints /health, /metrics and /translate");
  }
}
