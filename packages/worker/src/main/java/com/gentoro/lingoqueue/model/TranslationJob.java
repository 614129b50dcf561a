package com.gentoro.lingoqueue.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * A translation request as stored in the {@code data} field of a Bull job hash.
 *
 * @param id job id; payloads without one take the id they were claimed under
 * @param text raw chat text
 * @param targetLanguages requested target language codes, never empty, duplicates allowed
 * @param options preprocessing switches, defaults when absent
 * @param createdAt submission time in epoch milliseconds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranslationJob(
    @JsonProperty("id") String id,
    @JsonProperty("text") String text,
    @JsonProperty("targetLanguages") @JsonAlias("target_languages") List<String> targetLanguages,
    @JsonProperty("options") PreprocessOptions options,
    @JsonProperty("createdAt") @JsonAlias("created_at") long createdAt) {

  public TranslationJob {
    targetLanguages = targetLanguages == null ? List.of() : List.copyOf(targetLanguages);
    options = options == null ? PreprocessOptions.DEFAULTS : options;
  }

  public TranslationJob withId(String newId) {
    return new TranslationJob(newId, text, targetLanguages, options, createdAt);
  }
}
