package com.gentoro.lingoqueue.backend;

import com.gentoro.lingoqueue.exception.ExceptionUtil;
import com.gentoro.lingoqueue.exception.TranslationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Base class that fans a translation out into one call per target language.
 *
 * <p>A failing language is logged and recorded with {@link #errorMarker(Exception)}; iteration
 * continues with the next language. Reported timings are those of the last successful language.
 * Duplicate target languages are translated once.
 */
public abstract class AbstractTranslationBackend implements TranslationBackend {
  private static final org.slf4j.Logger log =
      com.gentoro.lingoqueue.logging.LoggingService.getLogger(AbstractTranslationBackend.class);

  /** Outcome of translating into a single language. */
  protected record LanguageResult(
      String translation, double processingTimeMs, double llmTimeMs, double cacheHitTimeMs) {}

  private final String id;

  protected AbstractTranslationBackend(String id) {
    this.id = id;
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public BackendResponse translate(String text, String sourceLang, List<String> targetLangs) {
    Set<String> languages = new LinkedHashSet<>(targetLangs);
    Map<String, String> translations = new LinkedHashMap<>();
    List<String> errors = new ArrayList<>();
    double processingTimeMs = -1;
    double llmTimeMs = -1;
    double cacheHitTimeMs = -1;

    for (String targetLang : languages) {
      try {
        LanguageResult result = translateSingle(text, sourceLang, targetLang);
        translations.put(targetLang, result.translation());
        processingTimeMs = result.processingTimeMs();
        llmTimeMs = result.llmTimeMs();
        cacheHitTimeMs = result.cacheHitTimeMs();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new TranslationException("Interrupted while translating to " + targetLang, e);
      } catch (Exception e) {
        String message = ExceptionUtil.extractErrorMessage(e);
        log.warn("[{}] translation {} -> {} failed: {}", id, sourceLang, targetLang, message);
        errors.add(targetLang + ": " + message);
        translations.put(targetLang, errorMarker(e));
      }
    }

    if (!languages.isEmpty() && errors.size() == languages.size()) {
      throw new TranslationException("All translations failed: " + String.join("; ", errors));
    }
    return new BackendResponse(translations, processingTimeMs, llmTimeMs, cacheHitTimeMs);
  }

  /** Translates {@code text} into one language; any exception marks only this language failed. */
  protected abstract LanguageResult translateSingle(
      String text, String sourceLang, String targetLang) throws Exception;

  /** Placeholder stored for a language whose translation failed. */
  protected String errorMarker(Exception e) {
    return "[Translation Error: " + ExceptionUtil.extractErrorMessage(e) + "]";
  }
}
