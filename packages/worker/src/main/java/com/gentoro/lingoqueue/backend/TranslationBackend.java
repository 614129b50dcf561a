package com.gentoro.lingoqueue.backend;

import java.util.List;

/**
 * Translates one preprocessed text into several target languages.
 *
 * <p>Every requested language gets an entry in the response; languages that failed carry a
 * visible error marker instead of a translation. When every language fails the call throws
 * {@link com.gentoro.lingoqueue.exception.TranslationException}.
 *
 * <p>An instance is owned by a single worker and need not be thread-safe.
 */
public interface TranslationBackend extends AutoCloseable {

  /** Provider id this backend was created by, e.g. "cache-grpc". */
  String id();

  BackendResponse translate(String text, String sourceLang, List<String> targetLangs);

  @Override
  default void close() {}
}
