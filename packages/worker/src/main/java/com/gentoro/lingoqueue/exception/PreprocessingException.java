package com.gentoro.lingoqueue.exception;

/** Errors raised while normalizing job text, typically by an external normalizer. */
public class PreprocessingException extends LingoQueueException {
  public PreprocessingException(String message) {
    super(LingoQueueErrorCode.PREPROCESSING_ERROR, message);
  }

  public PreprocessingException(String message, Throwable cause) {
    super(LingoQueueErrorCode.PREPROCESSING_ERROR, message, cause);
  }
}
