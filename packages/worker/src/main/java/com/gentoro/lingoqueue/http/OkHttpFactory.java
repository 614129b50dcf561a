package com.gentoro.lingoqueue.http;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;

public class OkHttpFactory {
  static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

  private OkHttpFactory() {}

  /**
   * Creates a client whose whole call (connect, write, read) is bounded by {@code callTimeout}.
   * Instances are thread-safe and meant to be shared by all workers.
   */
  public static OkHttpClient create(Duration callTimeout) {
    if (callTimeout == null || callTimeout.isNegative() || callTimeout.isZero()) {
      throw new IllegalArgumentException("callTimeout must be positive");
    }
    long connectMs = Math.min(CONNECT_TIMEOUT.toMillis(), callTimeout.toMillis());
    return new OkHttpClient.Builder()
        .connectTimeout(connectMs, TimeUnit.MILLISECONDS)
        .readTimeout(callTimeout.toMillis(), TimeUnit.MILLISECONDS)
        .callTimeout(callTimeout.toMillis(), TimeUnit.MILLISECONDS)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
