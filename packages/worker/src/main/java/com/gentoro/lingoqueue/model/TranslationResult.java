package com.gentoro.lingoqueue.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Final outcome of a job, published as the {@code result} of a completion event.
 *
 * <p>{@code processingTime} is in seconds and measured from the start of the job, so it includes
 * the filter checks for filtered jobs as well. The {@code translate*} timings are reported by the
 * backend in milliseconds and are zero for filtered jobs.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record TranslationResult(
    @JsonProperty("id") String id,
    @JsonProperty("original_text") String originalText,
    @JsonProperty("preprocessed_text") String preprocessedText,
    @JsonProperty("translations") Map<String, String> translations,
    @JsonProperty("detected_language") String detectedLanguage,
    @JsonProperty("processing_time") double processingTime,
    @JsonProperty("filtered") boolean filtered,
    @JsonProperty("filter_reason") String filterReason,
    @JsonProperty("translate_processing_time_ms") double translateProcessingTimeMs,
    @JsonProperty("translate_llm_time_ms") double translateLlmTimeMs,
    @JsonProperty("translate_cache_hit_time_ms") double translateCacheHitTimeMs) {

  public TranslationResult {
    translations =
        translations == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(translations));
  }
}
