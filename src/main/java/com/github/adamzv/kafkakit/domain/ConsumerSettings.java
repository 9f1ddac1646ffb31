package com.github.adamzv.kafkakit.domain;

import java.time.Duration;

public record ConsumerSettings(
    String topic,
    String groupId,
    int maxBatch,
    Duration pollTimeout,
    int parallelism,
    DeliveryPolicy retryPolicy,
    String deadLetterTopic,
    boolean skipOnPermanentFailure
) {

  public static final String DEAD_LETTER_SUFFIX = "-dlt";

  public boolean hasDeadLetterTopic() {
    return deadLetterTopic != null && !deadLetterTopic.isBlank();
  }

  /**
   * Number of handler invocations allowed for one record before it is dead-lettered.
   */
  public int retryCeiling() {
    return retryPolicy.maxAttempts();
  }
}
