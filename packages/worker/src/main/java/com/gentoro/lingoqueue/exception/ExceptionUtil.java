package com.gentoro.lingoqueue.exception;

import java.util.function.Function;

/** Utility helpers for turning exceptions into short, log and event friendly strings. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Extract a single-line error message from a throwable, without stack trace information.
   *
   * <p>Wrapper exceptions that only repeat their cause (for example {@code ExecutionException} or
   * a message equal to {@code cause.toString()}) are unwrapped so that the message of the root
   * problem is reported. Messages are trimmed to their first line.
   *
   * @param t the throwable to extract the message from
   * @return the error message, or the simple class name when no message is available
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    Throwable current = unwrap(t);
    String message = current.getMessage();
    if (message == null || message.isBlank()) {
      return current.getClass().getSimpleName();
    }
    int newline = message.indexOf('\n');
    return (newline > 0 ? message.substring(0, newline) : message).trim();
  }

  /**
   * Produce a compact, single-line representation of a throwable's top stack frames, joined in
   * call order with {@code " > "}.
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of frames to include; if <= 0, includes all frames
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName()).append('.').append(e.getMethodName()).append(" (");
      sb.append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  public static LingoQueueException rethrowIfUnchecked(
      Throwable t, Function<Throwable, LingoQueueException> supplier) {
    if (t instanceof LingoQueueException) {
      return (LingoQueueException) t;
    } else {
      return supplier.apply(t);
    }
  }

  private static Throwable unwrap(Throwable t) {
    Throwable current = t;
    while (current.getCause() != null && current.getCause() != current) {
      String message = current.getMessage();
      boolean repeatsCause =
          message == null
              || message.isBlank()
              || message.equals(current.getCause().toString())
              || current instanceof java.util.concurrent.ExecutionException
              || current instanceof java.util.concurrent.CompletionException;
      if (!repeatsCause) {
        break;
      }
      current = current.getCause();
    }
    return current;
  }
}
