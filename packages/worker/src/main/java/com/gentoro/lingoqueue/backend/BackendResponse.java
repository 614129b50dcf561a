package com.gentoro.lingoqueue.backend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Translations keyed by target language plus the timings reported for the call. Timings are in
 * milliseconds and {@code -1} when no language succeeded in reporting them.
 */
public record BackendResponse(
    Map<String, String> translations,
    double processingTimeMs,
    double llmTimeMs,
    double cacheHitTimeMs) {

  public BackendResponse {
    translations =
        translations == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(translations));
  }
}
