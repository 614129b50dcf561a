package com.gentoro.lingoqueue.preprocess;

import java.util.List;

/**
 * Spelling, spacing and sentence segmentation capabilities used by {@link TextPreprocessor}.
 *
 * <p>Implementations must be thread-safe; one instance is shared by every worker. Failures are
 * reported by throwing, the pipeline decides whether a failure fails the job (spelling, spacing)
 * or is tolerated (segmentation).
 */
public interface LinguisticNormalizer {

  /** Returns the best correction for a single word, or the word itself. */
  String correctWord(String word);

  /** Returns {@code text} with word spacing corrected. */
  String correctSpacing(String text);

  /** Splits {@code text} into sentence units, in order. */
  List<String> splitSentences(String text);
}
