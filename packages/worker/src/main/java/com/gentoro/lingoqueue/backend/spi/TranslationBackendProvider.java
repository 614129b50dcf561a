package com.gentoro.lingoqueue.backend.spi;

import com.gentoro.lingoqueue.backend.TranslationBackend;
import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface for pluggable translation backends.
 *
 * <p>Implementations must register using ServiceLoader by adding their fully qualified class name
 * to: META-INF/services/com.gentoro.lingoqueue.backend.spi.TranslationBackendProvider
 */
public interface TranslationBackendProvider {
  /** Unique backend id used in {@code backend.order}, e.g. "cache-grpc", "cache-http", "chat". */
  String id();

  /** Whether the backend may be used; by default controlled by {@code backend.<id>.enabled}. */
  default boolean isAvailable(Configuration configuration) {
    return configuration.getBoolean("backend." + id() + ".enabled", true);
  }

  /**
   * Create a new backend instance. Called once per worker, and once more at startup to probe the
   * backend; implementations throw when the backend cannot be set up.
   */
  TranslationBackend create(Configuration configuration);
}
