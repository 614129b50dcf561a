package com.gentoro.lingoqueue.preprocess;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.lingoqueue.exception.PreprocessingException;
import com.gentoro.lingoqueue.utility.JacksonUtility;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Client for an external normalizer service exposing the Korean spelling, spacing and sentence
 * segmentation models over JSON:
 *
 * <ul>
 *   <li>{@code POST /spell {"word": ...}} returns {@code {"result": ...}}
 *   <li>{@code POST /spacing {"text": ...}} returns {@code {"result": ...}}
 *   <li>{@code POST /sentences {"text": ...}} returns {@code {"sentences": [...]}}
 * </ul>
 */
public class HttpLinguisticNormalizer implements LinguisticNormalizer {
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient client;
  private final HttpUrl baseUrl;

  public HttpLinguisticNormalizer(OkHttpClient client, String baseUrl) {
    this.client = client;
    HttpUrl parsed = HttpUrl.parse(baseUrl);
    if (parsed == null) {
      throw new IllegalArgumentException("Invalid normalizer url: " + baseUrl);
    }
    this.baseUrl = parsed;
  }

  @Override
  public String correctWord(String word) {
    ObjectNode body = JacksonUtility.getJsonMapper().createObjectNode().put("word", word);
    return call("spell", body).path("result").asText(word);
  }

  @Override
  public String correctSpacing(String text) {
    ObjectNode body = JacksonUtility.getJsonMapper().createObjectNode().put("text", text);
    return call("spacing", body).path("result").asText(text);
  }

  @Override
  public List<String> splitSentences(String text) {
    ObjectNode body = JacksonUtility.getJsonMapper().createObjectNode().put("text", text);
    JsonNode sentences = call("sentences", body).path("sentences");
    if (!sentences.isArray()) {
      throw new PreprocessingException("Normalizer returned no 'sentences' array");
    }
    List<String> result = new ArrayList<>(sentences.size());
    sentences.forEach(n -> result.add(n.asText()));
    return result;
  }

  private JsonNode call(String operation, ObjectNode body) {
    Request request =
        new Request.Builder()
            .url(baseUrl.newBuilder().addPathSegment(operation).build())
            .post(RequestBody.create(body.toString(), JSON))
            .build();
    try (Response response = client.newCall(request).execute()) {
      ResponseBody responseBody = response.body();
      if (!response.isSuccessful() || responseBody == null) {
        throw new PreprocessingException(
            "Normalizer '" + operation + "' failed: HTTP " + response.code());
      }
      return JacksonUtility.getJsonMapper().readTree(responseBody.string());
    } catch (IOException e) {
      throw new PreprocessingException("Normalizer '" + operation + "' unreachable", e);
    }
  }
}
