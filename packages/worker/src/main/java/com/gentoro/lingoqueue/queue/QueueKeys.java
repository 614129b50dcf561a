package com.gentoro.lingoqueue.queue;

/** Redis key layout of a Bull queue. */
public record QueueKeys(String queueName) {
  private static final String PREFIX = "bull:";

  public QueueKeys {
    if (queueName == null || queueName.isBlank()) {
      throw new IllegalArgumentException("queueName must not be blank");
    }
  }

  public String waiting() {
    return PREFIX + queueName + ":wait";
  }

  public String active() {
    return PREFIX + queueName + ":active";
  }

  public String completed() {
    return PREFIX + queueName + ":completed";
  }

  public String failed() {
    return PREFIX + queueName + ":failed";
  }

  /** Hash holding the job payload in its {@code data} field. */
  public String job(String jobId) {
    return PREFIX + queueName + ":" + jobId;
  }
}
