package com.github.adamzv.kafkakit.domain;

public record TransportReceipt(
    String topic,
    int partition,
    long offset,
    long timestamp
) {}
