package com.gentoro.lingoqueue.queue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.gentoro.lingoqueue.exception.QueueException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.args.ListDirection;
import redis.clients.jedis.exceptions.JedisConnectionException;

class QueueMaintenanceTest {

  private final Jedis jedis = mock(Jedis.class);
  private final Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);
  private final QueueMaintenance maintenance =
      new QueueMaintenance(jedis, new QueueKeys("translation-jobs"), clock);

  @Test
  void statsReadsListsAndSets() {
    when(jedis.llen("bull:translation-jobs:wait")).thenReturn(12L);
    when(jedis.llen("bull:translation-jobs:active")).thenReturn(3L);
    when(jedis.zcard("bull:translation-jobs:completed")).thenReturn(100L);
    when(jedis.zcard("bull:translation-jobs:failed")).thenReturn(4L);

    assertEquals(new QueueMaintenance.QueueStats(12, 3, 100, 4), maintenance.stats());
  }

  @Test
  void requeueMovesActiveBackToWait() {
    when(jedis.lmove(
            "bull:translation-jobs:active",
            "bull:translation-jobs:wait",
            ListDirection.RIGHT,
            ListDirection.RIGHT))
        .thenReturn("1", "2", null);

    assertEquals(2, maintenance.recoverActive(true));
    verify(jedis, never()).zadd(anyString(), anyDouble(), anyString());
  }

  @Test
  void cleanupMarksActiveCompleted() {
    when(jedis.lrange("bull:translation-jobs:active", 0, -1)).thenReturn(List.of("a", "b"));

    assertEquals(2, maintenance.recoverActive(false));
    verify(jedis).lrem("bull:translation-jobs:active", 0, "a");
    verify(jedis).lrem("bull:translation-jobs:active", 0, "b");
    verify(jedis).zadd("bull:translation-jobs:completed", 1_700_000_000_000d, "a");
    verify(jedis).zadd("bull:translation-jobs:completed", 1_700_000_000_000d, "b");
  }

  @Test
  void redisErrorsAreQueueExceptions() {
    when(jedis.llen(anyString())).thenThrow(new JedisConnectionException("refused"));

    assertThrows(QueueException.class, maintenance::stats);
  }
}
