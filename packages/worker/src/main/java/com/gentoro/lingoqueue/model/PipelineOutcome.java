package com.gentoro.lingoqueue.model;

/**
 * Result of running the preprocessing pipeline over one text.
 *
 * <p>When {@code filtered} is true, {@code text} holds the partially processed string at the point
 * of rejection and the text must not be translated.
 */
public record PipelineOutcome(String text, boolean filtered, String filterReason) {

  public static PipelineOutcome accepted(String text) {
    return new PipelineOutcome(text, false, null);
  }

  public static PipelineOutcome rejected(String text, String reason) {
    return new PipelineOutcome(text, true, reason);
  }
}
