package com.gentoro.lingoqueue.preprocess;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gentoro.lingoqueue.exception.ConfigException;
import com.gentoro.lingoqueue.exception.PreprocessingException;
import com.gentoro.lingoqueue.model.PipelineOutcome;
import com.gentoro.lingoqueue.model.PreprocessOptions;
import java.util.List;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import org.junit.jupiter.api.Test;

class TextPreprocessorTest {

  private static final PreprocessOptions ALL_ON =
      new PreprocessOptions(true, true, true, true, true, true);
  private static final PreprocessOptions ALL_OFF =
      new PreprocessOptions(false, false, false, false, false, false);

  /** Normalizer with pluggable behavior; identity by default. */
  private static final class FakeNormalizer implements LinguisticNormalizer {
    UnaryOperator<String> word = UnaryOperator.identity();
    UnaryOperator<String> spacing = UnaryOperator.identity();
    Function<String, List<String>> sentences = List::of;

    @Override
    public String correctWord(String w) {
      return word.apply(w);
    }

    @Override
    public String correctSpacing(String text) {
      return spacing.apply(text);
    }

    @Override
    public List<String> splitSentences(String text) {
      return sentences.apply(text);
    }
  }

  private final FakeNormalizer normalizer = new FakeNormalizer();

  private TextPreprocessor preprocessor(SpacingRule... rules) {
    return new TextPreprocessor(normalizer, 500, List.of(rules));
  }

  @Test
  void laughterOnlyIsFilteredAsJamo() {
    PipelineOutcome outcome = preprocessor().preprocess("ㅋㅋㅋㅋㅋㅋ", PreprocessOptions.DEFAULTS);

    assertTrue(outcome.filtered());
    assertEquals(TextPreprocessor.REASON_JAMO_ONLY, outcome.filterReason());
  }

  @Test
  void rejectsShortLongAndSymbolOnlyText() {
    TextPreprocessor p = new TextPreprocessor(normalizer, 10, List.of());

    assertEquals(TextPreprocessor.REASON_TOO_SHORT, p.preprocess("a", ALL_ON).filterReason());
    assertEquals(TextPreprocessor.REASON_TOO_SHORT, p.preprocess("   ", ALL_ON).filterReason());
    assertEquals(TextPreprocessor.REASON_TOO_SHORT, p.preprocess(null, ALL_ON).filterReason());
    assertEquals(
        TextPreprocessor.REASON_TOO_LONG, p.preprocess("가나다라마바사아자차카", ALL_ON).filterReason());
    assertEquals(TextPreprocessor.REASON_SPECIAL_ONLY, p.preprocess("!!??~", ALL_ON).filterReason());
  }

  @Test
  void filtersBeforeExpandingAnything() {
    // the checks see the text after markup removal only
    PipelineOutcome outcome = preprocessor().preprocess("<b>ㅠ</b>", ALL_ON);

    assertTrue(outcome.filtered());
    assertEquals(TextPreprocessor.REASON_TOO_SHORT, outcome.filterReason());
    assertEquals("ㅠ", outcome.text());
  }

  @Test
  void spacingRejoinsProtectedPairs() {
    normalizer.spacing = text -> "오늘 날씨가 좋네요";
    TextPreprocessor p = preprocessor(SpacingRule.parse("오늘 날씨 => 오늘날씨"));

    PipelineOutcome outcome = p.preprocess("오늘날씨가좋네요", PreprocessOptions.DEFAULTS);

    assertFalse(outcome.filtered());
    assertEquals("오늘날씨가 좋네요", outcome.text());
  }

  @Test
  void typoTableRunsAfterSpellCorrection() {
    normalizer.word = w -> w;
    PipelineOutcome outcome = preprocessor().preprocess("됬어요", PreprocessOptions.DEFAULTS);

    assertEquals("됐어요", outcome.text());
    assertNull(outcome.filterReason());
  }

  @Test
  void typoTableWinsOverNormalizerOutput() {
    normalizer.word = w -> w.equals("됬어요") ? "됫어요" : w;
    PipelineOutcome outcome = preprocessor().preprocess("잘 됬어요", PreprocessOptions.DEFAULTS);

    assertEquals("잘 됐어요", outcome.text());
  }

  @Test
  void repeatedDigitsCollapseToTwo() {
    PreprocessOptions repeatsOnly = new PreprocessOptions(false, false, true, false, false, false);

    assertEquals("112", preprocessor().preprocess("1112", repeatsOnly).text());
    assertEquals("112", preprocessor().preprocess("11112", repeatsOnly).text());
  }

  @Test
  void spellCorrectionOnlyTouchesHangulWords() {
    normalizer.word = w -> w + "!";
    PipelineOutcome outcome =
        preprocessor().preprocess("game 좋아", new PreprocessOptions(false, false, false, false, true, false));

    assertEquals("game 좋아!", outcome.text());
  }

  @Test
  void expandsAbbreviationsAsWholeTokens() {
    PipelineOutcome outcome =
        preprocessor().preprocess("ㄱㄱ 가자", new PreprocessOptions(true, false, false, false, false, false));
    assertEquals("고고 가자", outcome.text());

    // inside a longer jamo run the abbreviation is not a token of its own
    outcome =
        preprocessor().preprocess("ㄱㄱㅎ 가자", new PreprocessOptions(true, false, false, false, false, false));
    assertEquals("ㄱㄱㅎ 가자", outcome.text());
  }

  @Test
  void stripsMarkupNicknamesTagsAndEmoticons() {
    PipelineOutcome outcome =
        preprocessor().preprocess("<i>[공지]</i> 철수(2) /웃음/ 안녕하세요", PreprocessOptions.DEFAULTS);

    assertEquals("철수 안녕하세요", outcome.text());
  }

  @Test
  void profanityIsMaskedNotFiltered() {
    PipelineOutcome outcome = preprocessor().preprocess("아 시발 진짜", ALL_ON);

    assertFalse(outcome.filtered());
    assertEquals("아 *** 진짜", outcome.text());
  }

  @Test
  void textEmptiedByCleanupIsFiltered() {
    PipelineOutcome outcome = preprocessor().preprocess("/웃음/", PreprocessOptions.DEFAULTS);

    assertTrue(outcome.filtered());
    assertEquals(TextPreprocessor.REASON_EMPTY, outcome.filterReason());
  }

  @Test
  void sentencesJoinedWithSeparator() {
    TextPreprocessor p = new TextPreprocessor(new RuleBasedNormalizer(), 500, List.of());

    PipelineOutcome outcome = p.preprocess("안녕하세요. 반갑습니다!   또 봐요", ALL_OFF);

    assertEquals("안녕하세요.|||반갑습니다!|||또 봐요", outcome.text());
  }

  @Test
  void segmentationFailureKeepsUnsplitText() {
    normalizer.sentences =
        text -> {
          throw new IllegalStateException("segmenter down");
        };

    PipelineOutcome outcome = preprocessor().preprocess("안녕하세요. 반갑습니다", ALL_OFF);

    assertFalse(outcome.filtered());
    assertEquals("안녕하세요. 반갑습니다", outcome.text());
  }

  @Test
  void spacingFailureFailsPreprocessing() {
    normalizer.spacing =
        text -> {
          throw new IllegalStateException("spacing model unavailable");
        };

    assertThrows(
        PreprocessingException.class,
        () -> preprocessor().preprocess("오늘날씨가좋네요", PreprocessOptions.DEFAULTS));
  }

  @Test
  void disabledStagesAreSkipped() {
    normalizer.spacing =
        text -> {
          throw new IllegalStateException("must not be called");
        };

    PipelineOutcome outcome = preprocessor().preprocess("ㄱㄱ 됬어요!!!!", ALL_OFF);

    assertEquals("ㄱㄱ 됬어요!!!!", outcome.text());
  }

  @Test
  void sameInputSameOutput() {
    TextPreprocessor p = preprocessor(SpacingRule.parse("오늘 날씨 => 오늘날씨"));
    String input = "ㅎㅇ 오늘 날씨 좋네요ㅋㅋㅋㅋ 됬어요!!!";

    assertEquals(p.preprocess(input, ALL_ON), p.preprocess(input, ALL_ON));
  }

  @Test
  void rejectsInvalidConfiguration() {
    assertThrows(ConfigException.class, () -> new TextPreprocessor(normalizer, 1, List.of()));
    assertThrows(ConfigException.class, () -> SpacingRule.parse("no separator"));
  }
}
