package com.gentoro.lingoqueue.utility;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/** Shared, pre-configured Jackson mapper. {@link ObjectMapper} is thread-safe once configured. */
public final class JacksonUtility {
  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

  private JacksonUtility() {}

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }
}
