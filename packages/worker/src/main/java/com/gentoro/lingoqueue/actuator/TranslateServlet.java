package com.gentoro.lingoqueue.actuator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.lingoqueue.backend.TranslationBackend;
import com.gentoro.lingoqueue.exception.ExceptionUtil;
import com.gentoro.lingoqueue.model.TranslationJob;
import com.gentoro.lingoqueue.model.TranslationResult;
import com.gentoro.lingoqueue.utility.JacksonUtility;
import com.gentoro.lingoqueue.worker.JobProcessor;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;

/**
 * POST /translate: runs one job body through the {@link JobProcessor} synchronously and returns
 * the {@link TranslationResult}. Nothing is read from or written to the queue.
 *
 * <p>The servlet owns a single backend instance; requests are processed one at a time.
 */
public final class TranslateServlet extends HttpServlet {
  private static final org.slf4j.Logger log =
      com.gentoro.lingoqueue.logging.LoggingService.getLogger(TranslateServlet.class);

  private final JobProcessor processor;
  private final TranslationBackend backend;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public TranslateServlet(JobProcessor processor, TranslationBackend backend) {
    this.processor = processor;
    this.backend = backend;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    TranslationJob job;
    try {
      job = mapper.readValue(req.getInputStream(), TranslationJob.class);
    } catch (JsonProcessingException e) {
      writeError(resp, 400, "Invalid request body: " + e.getOriginalMessage());
      return;
    }
    if (job == null || job.text() == null) {
      writeError(resp, 400, "Missing text");
      return;
    }
    if (job.targetLanguages().isEmpty()) {
      writeError(resp, 400, "Missing targetLanguages");
      return;
    }
    if (job.id() == null || job.id().isBlank()) {
      job = job.withId("http-" + UUID.randomUUID());
    }

    TranslationResult result;
    try {
      synchronized (backend) {
        result = processor.process(job, backend);
      }
    } catch (RuntimeException e) {
      String message = ExceptionUtil.extractErrorMessage(e);
      log.warn("Synchronous translation {} failed: {}", job.id(), message);
      writeError(resp, 500, message);
      return;
    }

    resp.setStatus(200);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    resp.getWriter().write(mapper.writeValueAsString(result));
  }

  private void writeError(HttpServletResponse resp, int status, String message)
      throws IOException {
    ObjectNode node = mapper.createObjectNode();
    node.put("error", message);
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    resp.getWriter().write(mapper.writeValueAsString(node));
  }

  @Override
  public void destroy() {
    backend.close();
  }
}
