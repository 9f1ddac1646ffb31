package com.github.adamzv.kafkakit.ports;

import com.github.adamzv.kafkakit.domain.HandlerOutcome;
import com.github.adamzv.kafkakit.domain.RecordContext;

/**
 * Application callback for one message type. Exceptions thrown from {@link #handle} are treated
 * like {@link HandlerOutcome#retryable(String)}.
 */
@FunctionalInterface
public interface MessageHandler<T> {

  HandlerOutcome handle(T value, RecordContext context) throws Exception;
}
