package com.gentoro.lingoqueue.exception;

/** Stable error codes attached to every {@link LingoQueueException}. */
public enum LingoQueueErrorCode {
  UNKNOWN,
  CONFIG_ERROR,
  STARTUP_ERROR,
  QUEUE_ERROR,
  PAYLOAD_ERROR,
  PREPROCESSING_ERROR,
  TRANSLATION_ERROR,
  NETWORK_ERROR
}
