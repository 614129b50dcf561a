package com.gentoro.lingoqueue.preprocess;

import java.lang.Character.UnicodeScript;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Script based language guess for chat text. Counts letters per Unicode script and maps the
 * dominant one to a language code; Han text containing kana is reported as Japanese.
 */
public class LanguageDetector {
  public static final String DEFAULT_LANGUAGE = "ko";
  static final int MIN_LETTERS = 3;

  /** Returns the detected language code, or empty when the text has too few letters. */
  public Optional<String> detect(String text) {
    if (text == null) {
      return Optional.empty();
    }
    Map<UnicodeScript, Integer> counts = new EnumMap<>(UnicodeScript.class);
    int letters = 0;
    for (int i = 0; i < text.length(); ) {
      int cp = text.codePointAt(i);
      i += Character.charCount(cp);
      if (!Character.isLetterOrDigit(cp)) {
        continue;
      }
      letters++;
      if (Character.isLetter(cp)) {
        counts.merge(UnicodeScript.of(cp), 1, Integer::sum);
      }
    }
    if (letters < MIN_LETTERS || counts.isEmpty()) {
      return Optional.empty();
    }

    int kana =
        counts.getOrDefault(UnicodeScript.HIRAGANA, 0)
            + counts.getOrDefault(UnicodeScript.KATAKANA, 0);
    if (kana > 0) {
      return Optional.of("ja");
    }

    UnicodeScript dominant =
        counts.entrySet().stream().max(Map.Entry.comparingByValue()).get().getKey();
    switch (dominant) {
      case HANGUL:
        return Optional.of("ko");
      case HAN:
        return Optional.of("zh-CN");
      case THAI:
        return Optional.of("th");
      case CYRILLIC:
        return Optional.of("ru");
      case LATIN:
        return Optional.of("en");
      default:
        return Optional.empty();
    }
  }

  /** Detected language, falling back to {@link #DEFAULT_LANGUAGE}. */
  public String detectOrDefault(String text) {
    return detect(text).orElse(DEFAULT_LANGUAGE);
  }
}
