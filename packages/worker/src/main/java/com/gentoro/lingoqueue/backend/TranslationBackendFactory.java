package com.gentoro.lingoqueue.backend;

import com.gentoro.lingoqueue.ConfigurationProvider;
import com.gentoro.lingoqueue.backend.spi.TranslationBackendProvider;
import com.gentoro.lingoqueue.exception.ExceptionUtil;
import com.gentoro.lingoqueue.exception.StartupException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/**
 * Chooses the translation backend once at startup.
 *
 * <p>Providers are discovered with {@link ServiceLoader} and tried in {@code backend.order}. A
 * provider is chosen when it is enabled and a probe instance can be created; otherwise the next
 * one is tried. Workers then create their own instances from the chosen provider.
 */
public final class TranslationBackendFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.lingoqueue.logging.LoggingService.getLogger(TranslationBackendFactory.class);

  public static final List<String> DEFAULT_ORDER =
      List.of(CacheGrpcBackend.ID, CacheHttpBackend.ID, ChatCompletionBackend.ID);

  private TranslationBackendFactory() {}

  public static TranslationBackendProvider select(Configuration configuration) {
    return select(
        configuration, ServiceLoader.load(TranslationBackendProvider.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList());
  }

  public static TranslationBackendProvider select(
      Configuration configuration, List<TranslationBackendProvider> discovered) {
    Map<String, TranslationBackendProvider> providers = new LinkedHashMap<>();
    for (TranslationBackendProvider provider : discovered) {
      providers.putIfAbsent(provider.id(), provider);
    }
    List<String> order = ConfigurationProvider.getList(configuration, "backend.order", DEFAULT_ORDER);

    for (String id : order) {
      TranslationBackendProvider provider = providers.get(id);
      if (provider == null) {
        log.warn("Unknown translation backend '{}' in backend.order, skipping", id);
        continue;
      }
      if (!provider.isAvailable(configuration)) {
        log.info("Translation backend '{}' is disabled, skipping", id);
        continue;
      }
      try (TranslationBackend probe = provider.create(configuration)) {
        log.info("Using translation backend '{}'", probe.id());
        return provider;
      } catch (Exception e) {
        log.warn(
            "Translation backend '{}' could not be set up, trying next: {}",
            id,
            ExceptionUtil.extractErrorMessage(e));
      }
    }
    throw new StartupException(
        "No usable translation backend among " + order + " (available: " + providers.keySet() + ")");
  }
}
