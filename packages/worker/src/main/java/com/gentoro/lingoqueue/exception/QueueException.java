package com.gentoro.lingoqueue.exception;

/** Failures talking to the Redis job queue. */
public class QueueException extends LingoQueueException {
  public QueueException(String message) {
    super(LingoQueueErrorCode.QUEUE_ERROR, message);
  }

  public QueueException(String message, Throwable cause) {
    super(LingoQueueErrorCode.QUEUE_ERROR, message, cause);
  }
}
