package com.gentoro.lingoqueue.backend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.gentoro.lingoqueue.backend.spi.TranslationBackendProvider;
import com.gentoro.lingoqueue.exception.StartupException;
import com.gentoro.lingoqueue.exception.TranslationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;

class TranslationBackendFactoryTest {

  private final List<String> closed = new ArrayList<>();

  private TranslationBackendProvider provider(String id, boolean works) {
    return new TranslationBackendProvider() {
      @Override
      public String id() {
        return id;
      }

      @Override
      public TranslationBackend create(Configuration configuration) {
        if (!works) {
          throw new TranslationException(id + " unreachable");
        }
        return new TranslationBackend() {
          @Override
          public String id() {
            return id;
          }

          @Override
          public BackendResponse translate(String text, String sourceLang, List<String> targets) {
            return new BackendResponse(Map.of(), 0, 0, 0);
          }

          @Override
          public void close() {
            closed.add(id);
          }
        };
      }
    };
  }

  @Test
  void firstWorkingBackendInOrderWins() {
    BaseConfiguration configuration = new BaseConfiguration();
    configuration.setProperty("backend.order", "cache-grpc, cache-http, chat");

    TranslationBackendProvider selected =
        TranslationBackendFactory.select(
            configuration,
            List.of(provider("chat", true), provider("cache-http", true), provider("cache-grpc", false)));

    assertEquals("cache-http", selected.id());
    assertEquals(List.of("cache-http"), closed);
  }

  @Test
  void disabledAndUnknownEntriesAreSkipped() {
    BaseConfiguration configuration = new BaseConfiguration();
    configuration.setProperty("backend.order", "nope, cache-http, chat");
    configuration.setProperty("backend.cache-http.enabled", false);

    TranslationBackendProvider selected =
        TranslationBackendFactory.select(
            configuration, List.of(provider("cache-http", true), provider("chat", true)));

    assertEquals("chat", selected.id());
  }

  @Test
  void defaultOrderPrefersGrpc() {
    TranslationBackendProvider selected =
        TranslationBackendFactory.select(
            new BaseConfiguration(),
            List.of(provider("chat", true), provider("cache-grpc", true)));

    assertEquals("cache-grpc", selected.id());
  }

  @Test
  void noUsableBackendIsStartupError() {
    BaseConfiguration configuration = new BaseConfiguration();
    configuration.setProperty("backend.order", "cache-grpc, chat");

    assertThrows(
        StartupException.class,
        () ->
            TranslationBackendFactory.select(
                configuration, List.of(provider("cache-grpc", false), provider("chat", false))));
  }

  @Test
  void serviceLoaderFindsBundledProviders() {
    BaseConfiguration configuration = new BaseConfiguration();
    configuration.setProperty("backend.order", "chat");
    configuration.setProperty("backend.chat.url", "http://127.0.0.1:9/v1");

    // creating the chat client does not contact the server
    assertEquals(ChatCompletionBackend.ID, TranslationBackendFactory.select(configuration).id());
  }
}
