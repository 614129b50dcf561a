package com.gentoro.lingoqueue.http;

import jakarta.servlet.http.HttpServlet;
import org.apache.commons.configuration2.BaseConfiguration;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/** {@link EmbeddedJettyServer} on an ephemeral loopback port, for tests of HTTP clients. */
public final class TestHttpServer implements AutoCloseable {
  private final EmbeddedJettyServer server;

  public TestHttpServer() {
    BaseConfiguration configuration = new BaseConfiguration();
    configuration.setProperty("http.port", 0);
    configuration.setProperty("http.hostname", "127.0.0.1");
    server = new EmbeddedJettyServer(configuration);
    server.prepare();
  }

  public TestHttpServer addServlet(HttpServlet servlet, String pathSpec) {
    server.getContextHandler().addServlet(new ServletHolder(servlet), pathSpec);
    return this;
  }

  public TestHttpServer start() {
    server.start();
    return this;
  }

  public String baseUrl() {
    return "http://127.0.0.1:" + server.getPort();
  }

  @Override
  public void close() {
    server.stop();
  }
}
