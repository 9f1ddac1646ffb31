package com.github.adamzv.kafkakit.domain;

/**
 * Outcome of a send. Transport failures are reported here instead of being thrown.
 */
public record DeliveryResult(
    Status status,
    String topic,
    int partition,
    long offset,
    int attempts,
    Problem error
) {

  public enum Status {
    DELIVERED,
    SCHEMA_FAILED,
    EXHAUSTED
  }

  public static DeliveryResult delivered(TransportReceipt receipt, int attempts) {
    return new DeliveryResult(Status.DELIVERED, receipt.topic(), receipt.partition(), receipt.offset(), attempts, null);
  }

  public static DeliveryResult schemaFailed(String topic, Problem error) {
    return new DeliveryResult(Status.SCHEMA_FAILED, topic, -1, -1L, 0, error);
  }

  public static DeliveryResult exhausted(String topic, int attempts, Problem lastError) {
    return new DeliveryResult(Status.EXHAUSTED, topic, -1, -1L, attempts, lastError);
  }

  public boolean isDelivered() {
    return status == Status.DELIVERED;
  }
}
