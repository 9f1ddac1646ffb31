package com.github.adamzv.kafkakit.domain;

public record HandlerOutcome(
    Kind kind,
    String reason
) {

  public enum Kind {
    ACK,
    RETRYABLE,
    PERMANENT
  }

  private static final HandlerOutcome ACK = new HandlerOutcome(Kind.ACK, null);

  public static HandlerOutcome ack() {
    return ACK;
  }

  public static HandlerOutcome retryable(String reason) {
    return new HandlerOutcome(Kind.RETRYABLE, reason);
  }

  public static HandlerOutcome permanent(String reason) {
    return new HandlerOutcome(Kind.PERMANENT, reason);
  }
}
