package com.gentoro.lingoqueue.queue;

import com.gentoro.lingoqueue.exception.QueueException;
import java.time.Clock;
import java.util.List;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.args.ListDirection;
import redis.clients.jedis.exceptions.JedisException;

/**
 * Operator tasks over the queue: reporting its depth and recovering ids leaked in the active list
 * by workers that died mid-job.
 */
public class QueueMaintenance {
  private static final org.slf4j.Logger log =
      com.gentoro.lingoqueue.logging.LoggingService.getLogger(QueueMaintenance.class);

  public record QueueStats(long waiting, long active, long completed, long failed) {}

  private final Jedis jedis;
  private final QueueKeys keys;
  private final Clock clock;

  public QueueMaintenance(Jedis jedis, QueueKeys keys) {
    this(jedis, keys, Clock.systemUTC());
  }

  QueueMaintenance(Jedis jedis, QueueKeys keys, Clock clock) {
    this.jedis = jedis;
    this.keys = keys;
    this.clock = clock;
  }

  public QueueStats stats() {
    try {
      return new QueueStats(
          jedis.llen(keys.waiting()),
          jedis.llen(keys.active()),
          jedis.zcard(keys.completed()),
          jedis.zcard(keys.failed()));
    } catch (JedisException e) {
      throw new QueueException("Failed to read queue statistics for " + keys.queueName(), e);
    }
  }

  /**
   * Empties the active list. With {@code requeue} every id is moved back to the consuming end of
   * the waiting list so it is claimed again next; otherwise ids are recorded in the completed set
   * and dropped.
   *
   * <p>Must only run while no worker consumes the queue, since in-flight jobs are indistinguishable
   * from leaked ones.
   *
   * @return number of recovered ids
   */
  public int recoverActive(boolean requeue) {
    try {
      int count = 0;
      if (requeue) {
        while (jedis.lmove(keys.active(), keys.waiting(), ListDirection.RIGHT, ListDirection.RIGHT)
            != null) {
          count++;
        }
      } else {
        List<String> ids = jedis.lrange(keys.active(), 0, -1);
        for (String id : ids) {
          jedis.lrem(keys.active(), 0, id);
          jedis.zadd(keys.completed(), clock.millis(), id);
          count++;
        }
      }
      log.info(
          "Recovered {} stuck job(s) from {} ({})",
          count,
          keys.active(),
          requeue ? "requeued" : "marked completed");
      return count;
    } catch (JedisException e) {
      throw new QueueException("Failed to recover active jobs of " + keys.queueName(), e);
    }
  }
}
