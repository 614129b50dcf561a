package com.gentoro.lingoqueue.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Message published on the results channel when a job is resolved. {@code result} is a {@link
 * TranslationResult} for completed jobs and a partial map with the failure reason otherwise.
 */
public record JobEvent(
    @JsonProperty("jobId") String jobId,
    @JsonProperty("result") Object result,
    @JsonProperty("status") JobStatus status) {}
