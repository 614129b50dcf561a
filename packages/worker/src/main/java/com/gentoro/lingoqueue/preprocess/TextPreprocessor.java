package com.gentoro.lingoqueue.preprocess;

import com.gentoro.lingoqueue.ConfigurationProvider;
import com.gentoro.lingoqueue.exception.ConfigException;
import com.gentoro.lingoqueue.exception.PreprocessingException;
import com.gentoro.lingoqueue.http.OkHttpFactory;
import com.gentoro.lingoqueue.model.PipelineOutcome;
import com.gentoro.lingoqueue.model.PreprocessOptions;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

/**
 * Normalizes a chat message and decides whether it is worth translating.
 *
 * <p>Stages run in this order, the switches of {@link PreprocessOptions} enabling the optional
 * ones:
 *
 * <ol>
 *   <li>strip markup tags;
 *   <li>reject too short, too long, symbol-only and jamo-only text;
 *   <li>strip {@code (2)} nickname suffixes and {@code [tag]} groups;
 *   <li>collapse repeats ({@code normalizeRepeats});
 *   <li>remove {@code /emoticon/} tokens ({@code removeEmoticons});
 *   <li>expand consonant abbreviations then slang, whole tokens only ({@code expandAbbreviations});
 *   <li>spell correction per Hangul word, then the fixed typo table ({@code fixTypos});
 *   <li>spacing correction, then re-join protected pairs ({@code addSpacing});
 *   <li>mask profanity with {@code ***} ({@code filterProfanity}), never rejects;
 *   <li>collapse whitespace;
 *   <li>reject text that became empty;
 *   <li>split sentences and join them with {@link #SENTENCE_SEPARATOR}, keeping the unsplit text
 *       when segmentation fails.
 * </ol>
 *
 * <p>Instances are immutable and thread-safe.
 */
public class TextPreprocessor {
  private static final org.slf4j.Logger log =
      com.gentoro.lingoqueue.logging.LoggingService.getLogger(TextPreprocessor.class);

  public static final String SENTENCE_SEPARATOR = "|||";
  public static final int DEFAULT_MAX_LENGTH = 500;

  public static final String REASON_TOO_SHORT = "Too short";
  public static final String REASON_TOO_LONG = "Too long";
  public static final String REASON_SPECIAL_ONLY = "Only special characters";
  public static final String REASON_JAMO_ONLY = "Only consonants/vowels";
  public static final String REASON_EMPTY = "Too short after preprocessing";

  private static final Pattern MARKUP = Pattern.compile("<[^>]+>");
  private static final Pattern SPECIAL_ONLY = Pattern.compile("[^\\p{L}\\p{N}_]+");
  private static final Pattern JAMO_ONLY = Pattern.compile("[ㄱ-ㅎㅏ-ㅣ\\s]+");
  private static final Pattern NICKNAME_SUFFIX = Pattern.compile("\\(\\d+\\)");
  private static final Pattern TAG_GROUP = Pattern.compile("\\[[^\\]]+\\]");
  private static final Pattern EMOTICON = Pattern.compile("/[^/]+/");
  private static final Pattern HANGUL_SYLLABLE = Pattern.compile("[가-힣]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private static final Map<Pattern, String> ABBREVIATION_RULES =
      NormalizationTables.wholeTokenRules(NormalizationTables.CONSONANT_ABBREVIATIONS);
  private static final Map<Pattern, String> SLANG_RULES =
      NormalizationTables.wholeTokenRules(NormalizationTables.SLANG);
  private static final Map<Pattern, String> TYPO_RULES =
      NormalizationTables.wholeTokenRules(NormalizationTables.TYPOS);

  private final LinguisticNormalizer normalizer;
  private final int maxLength;
  private final List<SpacingRule> spacingRules;

  public TextPreprocessor(
      LinguisticNormalizer normalizer, int maxLength, List<SpacingRule> spacingRules) {
    if (maxLength < 2) {
      throw new ConfigException("preprocess.max-length must be at least 2, was " + maxLength);
    }
    this.normalizer = normalizer;
    this.maxLength = maxLength;
    this.spacingRules = List.copyOf(spacingRules);
  }

  /** Builds the preprocessor and its normalizer from {@code preprocess.*} and {@code normalizer.*}. */
  public static TextPreprocessor create(Configuration configuration) {
    int maxLength = configuration.getInt("preprocess.max-length", DEFAULT_MAX_LENGTH);
    List<SpacingRule> rules = new ArrayList<>();
    for (String rule :
        ConfigurationProvider.getList(configuration, "preprocess.spacing.protect", List.of())) {
      rules.add(SpacingRule.parse(rule));
    }

    String type = configuration.getString("normalizer.type", "rule-based").trim();
    LinguisticNormalizer normalizer;
    switch (type) {
      case "rule-based":
        normalizer = new RuleBasedNormalizer();
        break;
      case "http":
        String url = configuration.getString("normalizer.http.url", null);
        if (StringUtils.isBlank(url)) {
          throw new ConfigException("normalizer.http.url is required for normalizer.type=http");
        }
        Duration timeout =
            Duration.ofMillis(configuration.getLong("normalizer.http.timeout-ms", 2000L));
        normalizer = new HttpLinguisticNormalizer(OkHttpFactory.create(timeout), url.trim());
        break;
      default:
        throw new ConfigException("Unknown normalizer.type: " + type);
    }
    log.info(
        "Preprocessor ready (normalizer: {}, max length: {}, protected pairs: {})",
        type,
        maxLength,
        rules.size());
    return new TextPreprocessor(normalizer, maxLength, rules);
  }

  public PipelineOutcome preprocess(String input, PreprocessOptions options) {
    PreprocessOptions opts = options == null ? PreprocessOptions.DEFAULTS : options;
    String text = MARKUP.matcher(input == null ? "" : input).replaceAll("");

    String rejection = rejectionReason(text);
    if (rejection != null) {
      return PipelineOutcome.rejected(text, rejection);
    }

    text = NICKNAME_SUFFIX.matcher(text).replaceAll("");
    text = TAG_GROUP.matcher(text).replaceAll("").strip();

    if (opts.normalizeRepeats()) {
      text = RepeatNormalizer.normalize(text);
    }
    if (opts.removeEmoticons()) {
      text = EMOTICON.matcher(text).replaceAll("");
    }
    if (opts.expandAbbreviations()) {
      text = applyRules(ABBREVIATION_RULES, text);
      text = applyRules(SLANG_RULES, text).strip();
    }
    if (opts.fixTypos()) {
      text = fixTypos(text);
    }
    if (opts.addSpacing()) {
      text = correctSpacing(text);
    }
    if (opts.filterProfanity()) {
      for (Pattern p : NormalizationTables.PROFANITY) {
        text = p.matcher(text).replaceAll("***");
      }
    }

    text = WHITESPACE.matcher(text).replaceAll(" ").strip();
    if (text.isEmpty()) {
      return PipelineOutcome.rejected(text, REASON_EMPTY);
    }
    return PipelineOutcome.accepted(segment(text));
  }

  private String rejectionReason(String text) {
    String trimmed = text.strip();
    if (trimmed.length() <= 1) {
      return REASON_TOO_SHORT;
    }
    if (trimmed.length() > maxLength) {
      return REASON_TOO_LONG;
    }
    if (SPECIAL_ONLY.matcher(text).matches()) {
      return REASON_SPECIAL_ONLY;
    }
    if (JAMO_ONLY.matcher(text).matches()) {
      return REASON_JAMO_ONLY;
    }
    return null;
  }

  private String fixTypos(String text) {
    String[] words = WHITESPACE.split(text.strip());
    List<String> corrected = new ArrayList<>(words.length);
    for (String word : words) {
      String fromTable = applyRules(TYPO_RULES, word);
      if (!fromTable.equals(word)) {
        // a known typo keeps its table correction whatever the normalizer would return
        corrected.add(fromTable);
      } else if (HANGUL_SYLLABLE.matcher(word).find()) {
        corrected.add(invokeNormalizer("spelling", () -> normalizer.correctWord(word)));
      } else {
        corrected.add(word);
      }
    }
    // the fixed table runs after the normalizer
    return applyRules(TYPO_RULES, String.join(" ", corrected));
  }

  private String correctSpacing(String text) {
    String spaced = invokeNormalizer("spacing", () -> normalizer.correctSpacing(text));
    for (SpacingRule rule : spacingRules) {
      spaced = rule.apply(spaced);
    }
    return spaced;
  }

  private String segment(String text) {
    try {
      List<String> sentences = normalizer.splitSentences(text);
      if (sentences == null || sentences.isEmpty()) {
        return text;
      }
      return String.join(SENTENCE_SEPARATOR, sentences);
    } catch (RuntimeException e) {
      log.warn("Sentence splitting failed, using unsplit text: {}", e.getMessage());
      return text;
    }
  }

  private static String invokeNormalizer(String capability, Supplier<String> call) {
    try {
      String result = call.get();
      if (result == null) {
        throw new PreprocessingException("Normalizer returned no " + capability + " result");
      }
      return result;
    } catch (PreprocessingException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new PreprocessingException(capability + " correction failed: " + e.getMessage(), e);
    }
  }

  private static String applyRules(Map<Pattern, String> rules, String text) {
    String result = text;
    for (Map.Entry<Pattern, String> rule : rules.entrySet()) {
      result =
          rule.getKey()
              .matcher(result)
              .replaceAll(Matcher.quoteReplacement(rule.getValue()));
    }
    return result;
  }
}
