package com.gentoro.lingoqueue.worker;

import com.gentoro.lingoqueue.backend.BackendResponse;
import com.gentoro.lingoqueue.backend.TranslationBackend;
import com.gentoro.lingoqueue.logging.TranslationAuditLogger;
import com.gentoro.lingoqueue.model.PipelineOutcome;
import com.gentoro.lingoqueue.model.TranslationJob;
import com.gentoro.lingoqueue.model.TranslationResult;
import com.gentoro.lingoqueue.preprocess.LanguageDetector;
import com.gentoro.lingoqueue.preprocess.TextPreprocessor;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns one job into its {@link TranslationResult}: preprocessing, language detection and
 * translation. Filtered jobs never reach the backend.
 *
 * <p>Shared by all workers; the backend is passed per call since each worker owns its own.
 */
public class JobProcessor {
  private static final org.slf4j.Logger log =
      com.gentoro.lingoqueue.logging.LoggingService.getLogger(JobProcessor.class);

  public static final String UNKNOWN_LANGUAGE = "unknown";
  static final String MISSING_TRANSLATION = "[Translation Error: missing translation]";

  private final TextPreprocessor preprocessor;
  private final LanguageDetector languageDetector;
  private final TranslationAuditLogger auditLogger;

  public JobProcessor(
      TextPreprocessor preprocessor,
      LanguageDetector languageDetector,
      TranslationAuditLogger auditLogger) {
    this.preprocessor = preprocessor;
    this.languageDetector = languageDetector;
    this.auditLogger = auditLogger;
  }

  /**
   * Processes {@code job} with {@code backend}.
   *
   * @throws com.gentoro.lingoqueue.exception.PreprocessingException when normalization fails
   * @throws com.gentoro.lingoqueue.exception.TranslationException when every language failed
   */
  public TranslationResult process(TranslationJob job, TranslationBackend backend) {
    long start = System.nanoTime();
    PipelineOutcome outcome = preprocessor.preprocess(job.text(), job.options());

    if (outcome.filtered()) {
      log.debug("Job {} filtered: {}", job.id(), outcome.filterReason());
      return audit(
          new TranslationResult(
              job.id(),
              job.text(),
              outcome.text(),
              Map.of(),
              UNKNOWN_LANGUAGE,
              elapsedSeconds(start),
              true,
              outcome.filterReason(),
              0,
              0,
              0));
    }

    String detected =
        languageDetector.detectOrDefault(
            outcome.text().replace(TextPreprocessor.SENTENCE_SEPARATOR, " "));
    BackendResponse response = backend.translate(outcome.text(), detected, job.targetLanguages());

    Map<String, String> translations = new LinkedHashMap<>(response.translations());
    for (String lang : job.targetLanguages()) {
      if (translations.putIfAbsent(lang, MISSING_TRANSLATION) == null) {
        log.warn("Backend '{}' returned no translation for {} in job {}", backend.id(), lang, job.id());
      }
    }

    TranslationResult result =
        new TranslationResult(
            job.id(),
            job.text(),
            outcome.text(),
            translations,
            detected,
            elapsedSeconds(start),
            false,
            null,
            response.processingTimeMs(),
            response.llmTimeMs(),
            response.cacheHitTimeMs());
    log.debug(
        "Job {} translated {} -> {} in {}s",
        job.id(),
        detected,
        translations.keySet(),
        result.processingTime());
    return audit(result);
  }

  private TranslationResult audit(TranslationResult result) {
    if (auditLogger != null) {
      auditLogger.record(result);
    }
    return result;
  }

  private static double elapsedSeconds(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000_000.0d;
  }
}
