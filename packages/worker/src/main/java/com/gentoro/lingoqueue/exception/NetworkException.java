package com.gentoro.lingoqueue.exception;

/** Problems opening or serving network listeners. */
public class NetworkException extends LingoQueueException {
  public NetworkException(String message) {
    super(LingoQueueErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(LingoQueueErrorCode.NETWORK_ERROR, message, cause);
  }
}
