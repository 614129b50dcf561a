package com.gentoro.lingoqueue.preprocess;

import com.gentoro.lingoqueue.exception.ConfigException;

/**
 * A pair of tokens that spacing correction must not separate. After spacing correction every
 * occurrence of {@code spaced} is replaced by {@code joined}.
 */
public record SpacingRule(String spaced, String joined) {
  static final String SEPARATOR = "=>";

  /** Parses the {@code "<spaced> => <joined>"} form used in configuration. */
  public static SpacingRule parse(String value) {
    int idx = value == null ? -1 : value.indexOf(SEPARATOR);
    if (idx <= 0) {
      throw new ConfigException("Invalid spacing rule, expected '<spaced> => <joined>': " + value);
    }
    String spaced = value.substring(0, idx).trim();
    String joined = value.substring(idx + SEPARATOR.length()).trim();
    if (spaced.isEmpty() || joined.isEmpty()) {
      throw new ConfigException("Invalid spacing rule, empty side: " + value);
    }
    return new SpacingRule(spaced, joined);
  }

  String apply(String text) {
    return text.replace(spaced, joined);
  }
}
