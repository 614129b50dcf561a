package com.gentoro.lingoqueue.preprocess;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collapses repeated characters and tokens typical of chat messages ({@code ㅋㅋㅋㅋ}, {@code
 * !!!!}, {@code 노노노노}, {@code hahahaha}).
 *
 * <p>Rules run in a fixed order. Oscillating pairs such as {@code ㅋㅌㅋㅌ} go first so that the
 * single character rule cannot leave half of a pair behind.
 */
final class RepeatNormalizer {

  private record Rule(Pattern pattern, String replacement) {
    String apply(String text) {
      return pattern.matcher(text).replaceAll(replacement);
    }
  }

  private static final List<Rule> RULES =
      List.of(
          // oscillating pairs
          new Rule(Pattern.compile("(?:ㅋㅌ)+"), "ㅋㅋ"),
          new Rule(Pattern.compile("(?:ㅎㅌ)+"), "ㅎㅎ"),
          new Rule(Pattern.compile("(?:ㅋㅎ)+"), "ㅋㅋ"),
          // jamo
          new Rule(Pattern.compile("([ㄱ-ㅎㅏ-ㅣ])\\1{2,}"), "$1$1"),
          // punctuation
          new Rule(Pattern.compile("([!?~])\\1{2,}"), "$1$1"),
          new Rule(Pattern.compile("\\.{4,}"), Matcher.quoteReplacement("...")),
          // multi-character tokens
          new Rule(Pattern.compile("([가-힣]{2,})\\1{2,}"), "$1$1"),
          new Rule(Pattern.compile("([a-zA-Z]{2,})\\1{2,}"), "$1$1"),
          // single letters
          new Rule(Pattern.compile("([가-힣])\\1{2,}"), "$1$1"),
          new Rule(Pattern.compile("([a-zA-Z])\\1{2,}"), "$1$1"),
          new Rule(Pattern.compile("(\\d)\\1{2,}"), "$1$1"));

  private RepeatNormalizer() {}

  static String normalize(String text) {
    String result = text;
    for (Rule rule : RULES) {
      result = rule.apply(result);
    }
    return result;
  }
}
