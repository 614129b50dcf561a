package com.gentoro.lingoqueue.exception;

/** Invalid or missing configuration values. */
public class ConfigException extends LingoQueueException {
  public ConfigException(String message) {
    super(LingoQueueErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(LingoQueueErrorCode.CONFIG_ERROR, message, cause);
  }
}
