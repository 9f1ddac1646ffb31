package com.github.adamzv.kafkakit.domain;

public record KeyedMessage(
    String key,
    Object value
) {}
