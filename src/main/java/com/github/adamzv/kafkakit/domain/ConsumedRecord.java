package com.github.adamzv.kafkakit.domain;

import java.time.Instant;

public record ConsumedRecord(
    Envelope envelope,
    int partition,
    long offset,
    Instant receiveTime
) {

  public String topic() {
    return envelope.topic();
  }
}
