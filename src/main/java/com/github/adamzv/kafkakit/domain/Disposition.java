package com.github.adamzv.kafkakit.domain;

public enum Disposition {
  HANDLED(true),
  SKIPPED(true),
  DEAD_LETTERED(true),
  // dead-letter publish failed; the record must be redelivered
  STALLED(false),
  // loop stopped before the record was finished
  ABANDONED(false);

  private final boolean terminal;

  Disposition(boolean terminal) {
    this.terminal = terminal;
  }

  public boolean isTerminal() {
    return terminal;
  }
}
