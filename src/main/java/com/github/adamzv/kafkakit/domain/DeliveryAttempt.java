package com.github.adamzv.kafkakit.domain;

import java.util.Map;

/**
 * Bookkeeping for one produce attempt. Lives only for the duration of a single send.
 */
public record DeliveryAttempt(
    Envelope envelope,
    int attemptNumber,
    Problem lastError
) {

  public DeliveryAttempt {
    if (attemptNumber < 1) {
      throw Problems.invalidArgument("Attempt number must be >= 1", Map.of("attempt", attemptNumber));
    }
  }

  public static DeliveryAttempt first(Envelope envelope) {
    return new DeliveryAttempt(envelope, 1, null);
  }

  public DeliveryAttempt next(Problem failure) {
    return new DeliveryAttempt(envelope, attemptNumber + 1, failure);
  }
}
