package com.gentoro.lingoqueue.http;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

/** Logs outbound requests at DEBUG, bodies at TRACE, and transport failures at WARN. */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.lingoqueue.logging.LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    long startTime = System.nanoTime();
    if (log.isTraceEnabled()) {
      log.trace("Request body for {} {}:\n{}", request.method(), request.url(), bodyToString(request));
    }

    Response response;
    try {
      response = chain.proceed(request);
    } catch (SocketTimeoutException e) {
      log.warn(
          "Request timed out: {} {} ({}ms)", request.method(), request.url(), elapsedMs(startTime));
      throw e;
    } catch (ConnectException e) {
      log.warn(
          "Connection error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsedMs(startTime),
          e.getMessage());
      throw e;
    } catch (IOException e) {
      log.warn(
          "IO error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsedMs(startTime),
          e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
      throw e;
    }

    log.debug(
        "{} {} -> {} in {}ms",
        request.method(),
        request.url(),
        response.code(),
        elapsedMs(startTime));
    if (log.isTraceEnabled()) {
      try {
        log.trace("Response body:\n{}", response.peekBody(Long.MAX_VALUE).string());
      } catch (IOException e) {
        log.trace("Could not read response body", e);
      }
    }
    return response;
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }

  private static String bodyToString(Request request) {
    try {
      Buffer buffer = new Buffer();
      if (request.body() != null) request.body().writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}
