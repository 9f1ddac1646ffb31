package com.github.adamzv.kafkakit.application;

import com.github.adamzv.kafkakit.domain.Problems;
import com.github.adamzv.kafkakit.ports.MessageHandler;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps message types to the handler that consumes them. Handlers are registered explicitly
 * together with the Java type they expect, which is what the codec decodes into.
 */
public final class HandlerRegistry {

  public record Registration<T>(
      String messageType,
      Class<T> expectedType,
      MessageHandler<? super T> handler
  ) {}

  private final Map<String, Registration<?>> registrations;

  private HandlerRegistry(Map<String, Registration<?>> registrations) {
    this.registrations = registrations;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<Registration<?>> lookup(String messageType) {
    if (messageType == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(registrations.get(messageType));
  }

  public static final class Builder {

    private final Map<String, Registration<?>> registrations = new LinkedHashMap<>();

    private Builder() {
    }

    public <T> Builder register(String messageType, Class<T> expectedType, MessageHandler<? super T> handler) {
      if (messageType == null || messageType.isBlank()) {
        throw Problems.invalidArgument("Message type must not be blank", Map.of());
      }
      if (registrations.containsKey(messageType)) {
        throw Problems.invalidArgument("Handler already registered", Map.of("messageType", messageType));
      }
      registrations.put(messageType, new Registration<>(messageType, expectedType, handler));
      return this;
    }

    public HandlerRegistry build() {
      return new HandlerRegistry(Collections.unmodifiableMap(new LinkedHashMap<>(registrations)));
    }
  }
}
