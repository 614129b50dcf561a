package com.gentoro.lingoqueue.exception;

/** Backend failures that leave a job without any usable translation. */
public class TranslationException extends LingoQueueException {
  public TranslationException(String message) {
    super(LingoQueueErrorCode.TRANSLATION_ERROR, message);
  }

  public TranslationException(String message, Throwable cause) {
    super(LingoQueueErrorCode.TRANSLATION_ERROR, message, cause);
  }
}
