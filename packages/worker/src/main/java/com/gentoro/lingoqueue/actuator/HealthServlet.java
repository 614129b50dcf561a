package com.gentoro.lingoqueue.actuator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.lingoqueue.utility.JacksonUtility;
import com.gentoro.lingoqueue.worker.WorkerPool;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** GET /health: 200 while the workers run, 503 once they are stopping. */
public final class HealthServlet extends HttpServlet {
  private final String backendId;
  private final WorkerPool pool;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public HealthServlet(String backendId, WorkerPool pool) {
    this.backendId = backendId;
    this.pool = pool;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    boolean running = pool.isRunning();
    ObjectNode node = mapper.createObjectNode();
    node.put("status", running ? "healthy" : "stopping");
    node.put("backend", backendId);
    node.put("workers", pool.concurrency());

    resp.setStatus(running ? 200 : 503);
    resp.setContentType("application/json");
    resp.getWriter().write(mapper.writeValueAsString(node));
  }
}
