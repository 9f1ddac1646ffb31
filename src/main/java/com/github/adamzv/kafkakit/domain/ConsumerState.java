package com.github.adamzv.kafkakit.domain;

public enum ConsumerState {
  IDLE,
  POLLING,
  PROCESSING,
  COMMITTING,
  REBALANCING,
  STOPPED
}
