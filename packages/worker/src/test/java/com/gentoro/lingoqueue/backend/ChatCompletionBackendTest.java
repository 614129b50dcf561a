package com.gentoro.lingoqueue.backend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.lingoqueue.exception.TranslationException;
import com.gentoro.lingoqueue.http.TestHttpServer;
import com.gentoro.lingoqueue.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChatCompletionBackendTest {

  /** OpenAI compatible endpoint that answers per target language and fails for Thai. */
  private static final class FakeCompletions extends HttpServlet {
    final List<JsonNode> requests = new CopyOnWriteArrayList<>();
    final Map<String, String> replies =
        Map.of("English", "  Hello.  ", "Japanese", "こんにちは。");

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      JsonNode body = JacksonUtility.getJsonMapper().readTree(req.getInputStream());
      requests.add(body);
      String system = body.path("messages").path(0).path("content").asText();
      String target = system.replaceAll("^Translate from .+ to (.+)\\. Only.*$", "$1");

      if (!replies.containsKey(target)) {
        resp.setStatus(500);
        resp.setContentType("application/json");
        resp.getWriter().write("{\"error\":{\"message\":\"model crashed\",\"type\":\"server_error\"}}");
        return;
      }

      ObjectNode completion = JacksonUtility.getJsonMapper().createObjectNode();
      completion.put("id", "chatcmpl-1");
      completion.put("object", "chat.completion");
      completion.put("created", 1700000000L);
      completion.put("model", body.path("model").asText());
      ObjectNode choice = completion.putArray("choices").addObject();
      choice.put("index", 0);
      choice.put("finish_reason", "stop");
      choice.putNull("logprobs");
      ObjectNode message = choice.putObject("message");
      message.put("role", "assistant");
      message.put("content", replies.get(target));
      message.putNull("refusal");

      resp.setStatus(200);
      resp.setContentType("application/json");
      resp.setCharacterEncoding("UTF-8");
      resp.getWriter().write(completion.toString());
    }
  }

  private final FakeCompletions completions = new FakeCompletions();
  private TestHttpServer server;
  private ChatCompletionBackend backend;

  @BeforeEach
  void setUp() {
    server = new TestHttpServer().addServlet(completions, "/v1/chat/completions").start();
    BaseConfiguration configuration = new BaseConfiguration();
    configuration.setProperty("backend.chat.url", server.baseUrl() + "/v1");
    configuration.setProperty("backend.chat.model", "test-translator");
    configuration.setProperty("backend.chat.timeout-ms", 5000);
    backend = ChatCompletionBackend.create(configuration);
  }

  @AfterEach
  void tearDown() {
    backend.close();
    server.close();
  }

  @Test
  void translatesEachLanguageWithItsOwnPrompt() {
    BackendResponse response = backend.translate("안녕하세요", "ko", List.of("en", "ja"));

    assertEquals("Hello.", response.translations().get("en"));
    assertEquals("こんにちは。", response.translations().get("ja"));
    assertEquals(2, completions.requests.size());

    JsonNode first = completions.requests.get(0);
    assertEquals("test-translator", first.path("model").asText());
    assertEquals(
        "Translate from Korean to English. Only output the translated text, nothing else.",
        first.path("messages").path(0).path("content").asText());
    assertEquals("안녕하세요", first.path("messages").path(1).path("content").asText());
    assertTrue(response.processingTimeMs() >= 0);
  }

  @Test
  void failingLanguageGetsMarkerOthersSucceed() {
    BackendResponse response = backend.translate("안녕하세요", "ko", List.of("en", "th"));

    assertEquals("Hello.", response.translations().get("en"));
    assertTrue(response.translations().get("th").startsWith("[Translation Error:"));
  }

  @Test
  void everyLanguageFailingThrows() {
    assertThrows(
        TranslationException.class, () -> backend.translate("안녕하세요", "ko", List.of("th", "vi")));
  }

  @Test
  void duplicateLanguagesTranslatedOnce() {
    BackendResponse response = backend.translate("안녕", "ko", List.of("en", "en"));

    assertEquals(1, response.translations().size());
    assertEquals(1, completions.requests.size());
  }
}
