package com.gentoro.lingoqueue.exception;

/** Base runtime exception of the worker. Carries an error code for logs and HTTP responses. */
public class LingoQueueException extends RuntimeException {
  private final LingoQueueErrorCode code;

  public LingoQueueException(LingoQueueErrorCode code, String message) {
    super(message);
    this.code = code == null ? LingoQueueErrorCode.UNKNOWN : code;
  }

  public LingoQueueException(LingoQueueErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code == null ? LingoQueueErrorCode.UNKNOWN : code;
  }

  public LingoQueueErrorCode getCode() {
    return code;
  }
}
