package com.gentoro.lingoqueue.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.lingoqueue.exception.TranslationException;
import com.gentoro.lingoqueue.http.OkHttpFactory;
import com.gentoro.lingoqueue.utility.JacksonUtility;
import java.io.IOException;
import java.time.Duration;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.configuration2.Configuration;

/**
 * Client of the cache-augmented translation service's JSON API ({@code POST
 * /api/v1/translate?translator=<name>}).
 *
 * <p>A non-2xx status, a body with {@code success=false} or a body without the requested
 * language fails that language.
 */
public class CacheHttpBackend extends AbstractTranslationBackend {
  private static final org.slf4j.Logger log =
      com.gentoro.lingoqueue.logging.LoggingService.getLogger(CacheHttpBackend.class);

  public static final String ID = "cache-http";
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  /** Request options sent with every call. */
  public record Settings(String translator, String cacheStrategy, boolean useCache) {}

  private final OkHttpClient client;
  private final HttpUrl endpoint;
  private final Settings settings;

  public CacheHttpBackend(OkHttpClient client, String baseUrl, Settings settings) {
    super(ID);
    HttpUrl base = HttpUrl.parse(baseUrl);
    if (base == null) {
      throw new IllegalArgumentException("Invalid backend.cache-http.url: " + baseUrl);
    }
    this.client = client;
    this.settings = settings;
    this.endpoint =
        base.newBuilder()
            .addPathSegments("api/v1/translate")
            .addQueryParameter("translator", settings.translator())
            .build();
  }

  public static CacheHttpBackend create(Configuration configuration) {
    Duration timeout =
        Duration.ofMillis(configuration.getLong("backend.cache-http.timeout-ms", 30000L));
    return new CacheHttpBackend(
        OkHttpFactory.create(timeout),
        configuration.getString("backend.cache-http.url", "http://localhost:8080"),
        new Settings(
            configuration.getString("backend.cache-http.translator", "vllm"),
            configuration.getString("backend.cache-http.cache-strategy", "hybrid"),
            configuration.getBoolean("backend.cache-http.use-cache", true)));
  }

  @Override
  protected LanguageResult translateSingle(String text, String sourceLang, String targetLang)
      throws IOException {
    ObjectNode body = JacksonUtility.getJsonMapper().createObjectNode();
    body.put("text", text);
    body.put("source_lang", sourceLang);
    body.putArray("target_langs").add(targetLang);
    body.put("use_cache", settings.useCache());
    body.put("cache_strategy", settings.cacheStrategy());
    body.put("translator_name", settings.translator());

    Request request =
        new Request.Builder()
            .url(endpoint)
            .post(RequestBody.create(body.toString(), JSON))
            .build();

    JsonNode result;
    try (Response response = client.newCall(request).execute()) {
      ResponseBody responseBody = response.body();
      if (!response.isSuccessful()) {
        throw new TranslationException("HTTP " + response.code() + " from " + endpoint.encodedPath());
      }
      if (responseBody == null) {
        throw new TranslationException("Empty response body");
      }
      result = JacksonUtility.getJsonMapper().readTree(responseBody.string());
    }

    if (result.has("success") && !result.path("success").asBoolean(false)) {
      String error = result.path("error_message").asText("");
      throw new TranslationException(
          "Server error: " + (error.isBlank() ? "Unknown server error" : error));
    }
    JsonNode translation = result.path("translations").path(targetLang);
    if (!translation.isTextual()) {
      throw new TranslationException("No translation for " + targetLang + " in response");
    }

    String translated = translation.asText().trim();
    log.debug("[cache-http] {} -> {}: '{}' -> '{}'", sourceLang, targetLang, text, translated);
    return new LanguageResult(
        translated,
        result.path("processing_time_ms").asDouble(-1),
        result.path("llm_response_time_ms").path(targetLang).asDouble(0),
        result.path("cache_lookup_time_ms").asDouble(0));
  }

  /** Releases this worker's dispatcher threads and pooled connections. */
  @Override
  public void close() {
    client.dispatcher().executorService().shutdown();
    client.connectionPool().evictAll();
  }
}
