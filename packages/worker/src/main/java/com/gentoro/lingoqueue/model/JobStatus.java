package com.gentoro.lingoqueue.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Terminal states a job can be resolved with. */
public enum JobStatus {
  COMPLETED("completed"),
  FAILED("failed");

  private final String wireName;

  JobStatus(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}
