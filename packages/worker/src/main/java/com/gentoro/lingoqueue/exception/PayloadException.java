package com.gentoro.lingoqueue.exception;

/** A claimed job whose stored payload is missing or cannot be decoded. */
public class PayloadException extends LingoQueueException {
  public PayloadException(String message) {
    super(LingoQueueErrorCode.PAYLOAD_ERROR, message);
  }

  public PayloadException(String message, Throwable cause) {
    super(LingoQueueErrorCode.PAYLOAD_ERROR, message, cause);
  }
}
