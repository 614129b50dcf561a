package com.gentoro.lingoqueue.actuator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.lingoqueue.utility.JacksonUtility;
import com.gentoro.lingoqueue.worker.ThroughputCounters;
import com.gentoro.lingoqueue.worker.ThroughputReporter;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** GET /metrics: the last reported throughput interval and the running totals. */
public final class MetricsServlet extends HttpServlet {
  private final ThroughputReporter reporter;
  private final ThroughputCounters counters;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public MetricsServlet(ThroughputReporter reporter, ThroughputCounters counters) {
    this.reporter = reporter;
    this.counters = counters;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    ThroughputCounters.Snapshot last = reporter.lastSnapshot();
    ThroughputCounters.Snapshot totals = counters.totals();

    ObjectNode node = mapper.createObjectNode();
    node.put("intervalMs", reporter.interval().toMillis());
    ObjectNode interval = node.putObject("lastInterval");
    interval.put("started", last.started());
    interval.put("completed", last.completed());
    interval.put("failed", last.failed());
    ObjectNode total = node.putObject("totals");
    total.put("started", totals.started());
    total.put("completed", totals.completed());
    total.put("failed", totals.failed());

    resp.setStatus(200);
    resp.setContentType("application/json");
    resp.getWriter().write(mapper.writeValueAsString(node));
  }
}
