package com.gentoro.lingoqueue.queue;

import com.gentoro.lingoqueue.model.TranslationJob;
import com.gentoro.lingoqueue.model.TranslationResult;
import java.time.Duration;
import java.util.Optional;

/**
 * Connection-bound view of the job queue owned by a single worker. Implementations are not
 * required to be thread-safe.
 */
public interface JobSource extends AutoCloseable {

  /**
   * Atomically moves one job id from the waiting list to the active list, blocking up to {@code
   * timeout}. Returns empty on timeout without side effects.
   */
  Optional<String> claim(Duration timeout);

  /**
   * Reads the payload of a claimed job. Empty when the job has no stored payload.
   *
   * @throws com.gentoro.lingoqueue.exception.PayloadException when the payload cannot be decoded
   */
  Optional<TranslationJob> fetch(String jobId);

  /** Publishes a completion event and removes the id from the active list. */
  void resolveOk(String jobId, TranslationResult result);

  /** Publishes a failure event and removes the id from the active list. */
  void resolveFail(String jobId, String reason);

  @Override
  void close();
}
