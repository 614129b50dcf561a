package com.gentoro.lingoqueue.backend;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * Translates through a local model served behind an OpenAI compatible chat completion API (vLLM,
 * Ollama). One completion is requested per target language; the trimmed reply is the
 * translation.
 */
public class ChatCompletionBackend extends AbstractTranslationBackend {
  private static final org.slf4j.Logger log =
      com.gentoro.lingoqueue.logging.LoggingService.getLogger(ChatCompletionBackend.class);

  public static final String ID = "chat";
  static final String SYSTEM_PROMPT =
      "Translate from %s to %s. Only output the translated text, nothing else.";

  /** Sampling settings applied to every completion. */
  public record Settings(String model, double temperature, long maxTokens, long seed) {}

  private final OpenAIClient client;
  private final Settings settings;

  public ChatCompletionBackend(OpenAIClient client, Settings settings) {
    super(ID);
    this.client = client;
    this.settings = settings;
  }

  public static ChatCompletionBackend create(Configuration configuration) {
    String url = configuration.getString("backend.chat.url", "http://localhost:8000/v1");
    OpenAIClient client =
        OpenAIOkHttpClient.builder()
            .baseUrl(url)
            .apiKey(configuration.getString("backend.chat.api-key", "none"))
            .timeout(Duration.ofMillis(configuration.getLong("backend.chat.timeout-ms", 30000L)))
            .maxRetries(configuration.getInt("backend.chat.max-retries", 0))
            .build();
    Settings settings =
        new Settings(
            configuration.getString("backend.chat.model", "zongwei/gemma3-translator:1b"),
            configuration.getDouble("backend.chat.temperature", 0.3d),
            configuration.getLong("backend.chat.max-tokens", 512L),
            configuration.getLong("backend.chat.seed", 42L));
    log.debug("Chat completion backend at {} using model {}", url, settings.model());
    return new ChatCompletionBackend(client, settings);
  }

  @Override
  protected LanguageResult translateSingle(String text, String sourceLang, String targetLang) {
    ChatCompletionCreateParams params =
        ChatCompletionCreateParams.builder()
            .model(settings.model())
            .addSystemMessage(
                SYSTEM_PROMPT.formatted(LanguageNames.of(sourceLang), LanguageNames.of(targetLang)))
            .addUserMessage(text)
            .temperature(settings.temperature())
            .maxTokens(settings.maxTokens())
            .seed(settings.seed())
            .build();

    long start = System.nanoTime();
    ChatCompletion completion = client.chat().completions().create(params);
    double elapsedMs = (System.nanoTime() - start) / 1_000_000.0d;

    if (completion.choices().isEmpty()) {
      throw new IllegalStateException("Model returned no choices");
    }
    String translation =
        completion.choices().get(0).message().content().map(String::trim).orElse("");
    if (translation.isEmpty()) {
      throw new IllegalStateException("Model returned an empty translation");
    }
    log.debug("[chat] {} -> {}: '{}' -> '{}'", sourceLang, targetLang, text, translation);
    return new LanguageResult(translation, elapsedMs, elapsedMs, 0);
  }

  @Override
  public void close() {
    client.close();
  }
}
