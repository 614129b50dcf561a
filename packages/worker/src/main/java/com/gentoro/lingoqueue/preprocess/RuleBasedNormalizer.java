package com.gentoro.lingoqueue.preprocess;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Local normalizer without statistical models. Spelling and spacing are left untouched; sentences
 * end after a run of terminal punctuation followed by whitespace.
 */
public class RuleBasedNormalizer implements LinguisticNormalizer {
  private static final Pattern SENTENCE_END = Pattern.compile("[.!?。！？]+\\s+");

  @Override
  public String correctWord(String word) {
    return word;
  }

  @Override
  public String correctSpacing(String text) {
    return text;
  }

  @Override
  public List<String> splitSentences(String text) {
    List<String> sentences = new ArrayList<>();
    Matcher m = SENTENCE_END.matcher(text);
    int start = 0;
    while (m.find()) {
      String sentence = text.substring(start, m.end()).trim();
      if (!sentence.isEmpty()) {
        sentences.add(sentence);
      }
      start = m.end();
    }
    String tail = text.substring(start).trim();
    if (!tail.isEmpty()) {
      sentences.add(tail);
    }
    return sentences;
  }
}
