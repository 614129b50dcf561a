package com.gentoro.lingoqueue.exception;

/** Unrecoverable problems while bootstrapping the worker process. */
public class StartupException extends LingoQueueException {
  public StartupException(String message) {
    super(LingoQueueErrorCode.STARTUP_ERROR, message);
  }

  public StartupException(String message, Throwable cause) {
    super(LingoQueueErrorCode.STARTUP_ERROR, message, cause);
  }
}
