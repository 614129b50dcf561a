package com.gentoro.lingoqueue.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.gentoro.lingoqueue.exception.PayloadException;
import com.gentoro.lingoqueue.exception.QueueException;
import com.gentoro.lingoqueue.model.JobEvent;
import com.gentoro.lingoqueue.model.JobStatus;
import com.gentoro.lingoqueue.model.TranslationJob;
import com.gentoro.lingoqueue.model.TranslationResult;
import com.gentoro.lingoqueue.utility.JacksonUtility;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.configuration2.Configuration;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.args.ListDirection;
import redis.clients.jedis.exceptions.JedisException;

/**
 * {@link JobSource} over a Bull queue layout in Redis.
 *
 * <p>Claiming uses {@code BLMOVE wait active RIGHT LEFT}, the same atomic move Bull performs with
 * {@code BRPOPLPUSH}. Results are published as {@link JobEvent} JSON on the results channel; the
 * id is removed from the active list whether or not publishing succeeded.
 */
public class RedisJobSource implements JobSource {
  private static final org.slf4j.Logger log =
      com.gentoro.lingoqueue.logging.LoggingService.getLogger(RedisJobSource.class);

  public static final String DEFAULT_RESULTS_CHANNEL = "bull:translation-results:jobId";
  static final String DATA_FIELD = "data";

  private final Jedis jedis;
  private final QueueKeys keys;
  private final String resultsChannel;

  public RedisJobSource(Jedis jedis, QueueKeys keys, String resultsChannel) {
    this.jedis = jedis;
    this.keys = keys;
    this.resultsChannel = resultsChannel;
  }

  /** Opens a dedicated connection configured from {@code redis.*} and {@code queue.*}. */
  public static RedisJobSource connect(Configuration configuration) {
    return new RedisJobSource(
        openConnection(configuration),
        new QueueKeys(configuration.getString("queue.name", "translation-jobs")),
        configuration.getString("queue.results-channel", DEFAULT_RESULTS_CHANNEL));
  }

  public static Jedis openConnection(Configuration configuration) {
    String host = configuration.getString("redis.host", "localhost");
    int port = configuration.getInt("redis.port", 6379);
    String password = configuration.getString("redis.password", null);
    int timeoutMs = configuration.getInt("redis.timeout-ms", 2000);
    DefaultJedisClientConfig.Builder config =
        DefaultJedisClientConfig.builder()
            .database(configuration.getInt("redis.database", 0))
            .connectionTimeoutMillis(timeoutMs)
            .socketTimeoutMillis(timeoutMs);
    if (password != null && !password.isBlank()) {
      config.password(password);
    }
    try {
      return new Jedis(new HostAndPort(host, port), config.build());
    } catch (JedisException e) {
      throw new QueueException("Could not connect to Redis at " + host + ":" + port, e);
    }
  }

  @Override
  public Optional<String> claim(Duration timeout) {
    try {
      String jobId =
          jedis.blmove(
              keys.waiting(),
              keys.active(),
              ListDirection.RIGHT,
              ListDirection.LEFT,
              timeout.toMillis() / 1000.0d);
      if (jobId != null) {
        log.debug("Claimed job {}", jobId);
      }
      return Optional.ofNullable(jobId);
    } catch (JedisException e) {
      throw new QueueException("Failed to claim from " + keys.waiting(), e);
    }
  }

  @Override
  public Optional<TranslationJob> fetch(String jobId) {
    String raw;
    try {
      raw = jedis.hget(keys.job(jobId), DATA_FIELD);
    } catch (JedisException e) {
      throw new QueueException("Failed to read payload of job " + jobId, e);
    }
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }

    TranslationJob job;
    try {
      job = JacksonUtility.getJsonMapper().readValue(raw, TranslationJob.class);
    } catch (JsonProcessingException e) {
      throw new PayloadException("Malformed payload for job " + jobId + ": " + e.getOriginalMessage(), e);
    }
    if (job.text() == null) {
      throw new PayloadException("Payload of job " + jobId + " has no text");
    }
    if (job.targetLanguages().isEmpty()) {
      throw new PayloadException("Payload of job " + jobId + " has no target languages");
    }
    if (job.id() == null || job.id().isBlank()) {
      job = job.withId(jobId);
    }
    return Optional.of(job);
  }

  @Override
  public void resolveOk(String jobId, TranslationResult result) {
    resolve(jobId, new JobEvent(jobId, result, JobStatus.COMPLETED));
  }

  @Override
  public void resolveFail(String jobId, String reason) {
    Map<String, Object> partial = new LinkedHashMap<>();
    partial.put("id", jobId);
    partial.put("error", reason);
    partial.put("filter_reason", reason);
    resolve(jobId, new JobEvent(jobId, partial, JobStatus.FAILED));
  }

  private void resolve(String jobId, JobEvent event) {
    try {
      jedis.publish(resultsChannel, JacksonUtility.getJsonMapper().writeValueAsString(event));
    } catch (JsonProcessingException e) {
      throw new PayloadException("Could not serialize result of job " + jobId, e);
    } catch (JedisException e) {
      throw new QueueException("Failed to publish result of job " + jobId, e);
    } finally {
      removeFromActive(jobId);
    }
    log.debug("Resolved job {} as {}", jobId, event.status().wireName());
  }

  private void removeFromActive(String jobId) {
    try {
      jedis.lrem(keys.active(), 0, jobId);
    } catch (JedisException e) {
      throw new QueueException("Failed to remove job " + jobId + " from " + keys.active(), e);
    }
  }

  @Override
  public void close() {
    try {
      jedis.close();
    } catch (JedisException e) {
      log.debug("Error closing Redis connection", e);
    }
  }
}
