package com.gentoro.lingoqueue.backend;

import java.util.Map;

/** English display names of language codes, used in model prompts. */
public final class LanguageNames {
  private static final Map<String, String> NAMES =
      Map.ofEntries(
          Map.entry("ko", "Korean"),
          Map.entry("en", "English"),
          Map.entry("th", "Thai"),
          Map.entry("zh-CN", "Simplified Chinese"),
          Map.entry("zh-TW", "Traditional Chinese"),
          Map.entry("ja", "Japanese"),
          Map.entry("es", "Spanish"),
          Map.entry("fr", "French"),
          Map.entry("de", "German"),
          Map.entry("ru", "Russian"));

  private LanguageNames() {}

  /** Display name for {@code code}, or the code itself when unknown. */
  public static String of(String code) {
    return NAMES.getOrDefault(code, code);
  }
}
