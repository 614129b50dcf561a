package com.gentoro.lingoqueue.backend;

import com.gentoro.lingoqueue.backend.grpc.HealthCheckRequest;
import com.gentoro.lingoqueue.backend.grpc.HealthCheckResponse;
import com.gentoro.lingoqueue.backend.grpc.TranslateRequest;
import com.gentoro.lingoqueue.backend.grpc.TranslateResponse;
import com.gentoro.lingoqueue.backend.grpc.TranslationServiceGrpc;
import com.gentoro.lingoqueue.exception.TranslationException;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.StatusRuntimeException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.commons.configuration2.Configuration;

/**
 * Client of the cache-augmented translation service over gRPC ({@code
 * translation.TranslationService}).
 *
 * <p>Calls use the blocking stub, or the future stub when {@code async} is set; both carry the same
 * deadline and produce the same results. Cache hits report a nominal lookup time and no model time.
 */
public class CacheGrpcBackend extends AbstractTranslationBackend {
  private static final org.slf4j.Logger log =
      com.gentoro.lingoqueue.logging.LoggingService.getLogger(CacheGrpcBackend.class);

  public static final String ID = "cache-grpc";
  static final double CACHE_LOOKUP_TIME_MS = 0.1d;

  /** Request and transport options. */
  public record Settings(
      String translator, String cacheStrategy, boolean useCache, Duration timeout, boolean async) {}

  private final ManagedChannel channel;
  private final Settings settings;
  private final TranslationServiceGrpc.TranslationServiceBlockingStub blockingStub;
  private final TranslationServiceGrpc.TranslationServiceFutureStub futureStub;

  public CacheGrpcBackend(ManagedChannel channel, Settings settings) {
    super(ID);
    this.channel = channel;
    this.settings = settings;
    this.blockingStub = TranslationServiceGrpc.newBlockingStub(channel);
    this.futureStub = TranslationServiceGrpc.newFutureStub(channel);
  }

  public static CacheGrpcBackend create(Configuration configuration) {
    String target = configuration.getString("backend.cache-grpc.target", "localhost:50051");
    ManagedChannel channel = ManagedChannelBuilder.forTarget(target).usePlaintext().build();
    CacheGrpcBackend backend =
        new CacheGrpcBackend(
            channel,
            new Settings(
                configuration.getString("backend.cache-grpc.translator", "vllm"),
                configuration.getString("backend.cache-grpc.cache-strategy", "hybrid"),
                configuration.getBoolean("backend.cache-grpc.use-cache", true),
                Duration.ofMillis(configuration.getLong("backend.cache-grpc.timeout-ms", 30000L)),
                configuration.getBoolean("backend.cache-grpc.async", false)));
    if (configuration.getBoolean("backend.cache-grpc.health-check", true)) {
      try {
        backend.checkHealth();
      } catch (RuntimeException e) {
        backend.close();
        throw e;
      }
    }
    log.debug("gRPC backend connected to {}", target);
    return backend;
  }

  /** Calls {@code HealthCheck}; throws when the call fails or the service reports unhealthy. */
  public HealthCheckResponse checkHealth() {
    HealthCheckResponse response;
    try {
      response =
          blockingStub
              .withDeadlineAfter(settings.timeout().toMillis(), TimeUnit.MILLISECONDS)
              .healthCheck(HealthCheckRequest.getDefaultInstance());
    } catch (StatusRuntimeException e) {
      throw new TranslationException(
          "gRPC health check failed: " + e.getStatus().getCode().name(), e);
    }
    if (!response.getHealthy()) {
      throw new TranslationException("gRPC service unhealthy: " + response.getStatus());
    }
    return response;
  }

  @Override
  protected LanguageResult translateSingle(String text, String sourceLang, String targetLang)
      throws InterruptedException, ExecutionException, TimeoutException {
    TranslateRequest request =
        TranslateRequest.newBuilder()
            .setText(text)
            .setSourceLang(sourceLang)
            .addTargetLangs(targetLang)
            .setUseCache(settings.useCache())
            .setCacheStrategy(settings.cacheStrategy())
            .setTranslatorName(settings.translator())
            .build();

    TranslateResponse response;
    if (settings.async()) {
      try {
        response =
            futureStub
                .withDeadlineAfter(settings.timeout().toMillis(), TimeUnit.MILLISECONDS)
                .translate(request)
                .get(settings.timeout().toMillis(), TimeUnit.MILLISECONDS);
      } catch (ExecutionException e) {
        if (e.getCause() instanceof StatusRuntimeException sre) {
          throw sre;
        }
        throw e;
      }
    } else {
      response =
          blockingStub
              .withDeadlineAfter(settings.timeout().toMillis(), TimeUnit.MILLISECONDS)
              .translate(request);
    }

    if (!response.getSuccess()) {
      String error = response.getErrorMessage();
      throw new TranslationException(
          "Server error: " + (error.isBlank() ? "Unknown server error" : error));
    }
    String translation = response.getTranslationsOrDefault(targetLang, "");
    if (translation.isEmpty()) {
      log.warn("[cache-grpc] empty translation for {}", targetLang);
    }
    boolean cacheHit = response.getCacheHitsOrDefault(targetLang, false);
    double processingMs = response.getProcessingTimeMs();
    return new LanguageResult(
        translation,
        processingMs,
        cacheHit ? 0 : processingMs,
        cacheHit ? CACHE_LOOKUP_TIME_MS : 0);
  }

  @Override
  protected String errorMarker(Exception e) {
    if (e instanceof StatusRuntimeException sre) {
      return "[gRPC Error: " + sre.getStatus().getCode().name() + "]";
    }
    return "[Error: " + e.getClass().getSimpleName() + "]";
  }

  @Override
  public void close() {
    channel.shutdown();
    try {
      if (!channel.awaitTermination(2, TimeUnit.SECONDS)) {
        channel.shutdownNow();
      }
    } catch (InterruptedException e) {
      channel.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
