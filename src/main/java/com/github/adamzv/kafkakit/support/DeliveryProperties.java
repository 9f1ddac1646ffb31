package com.github.adamzv.kafkakit.support;

import com.github.adamzv.kafkakit.domain.DeliveryPolicy;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "messaging.delivery")
public record DeliveryProperties(
    @DefaultValue("3")
    @Positive(message = "messaging.delivery.maxAttempts must be > 0")
    int maxAttempts,
    @DefaultValue("100ms")
    @NotNull
    Duration baseBackoff,
    @DefaultValue("2.0")
    @DecimalMin(value = "1.0", message = "messaging.delivery.multiplier must be >= 1")
    double multiplier,
    @DefaultValue("5s")
    @NotNull
    Duration maxBackoff,
    @DefaultValue("10s")
    @NotNull
    Duration perAttemptTimeout,
    @DefaultValue("0.2")
    @DecimalMin(value = "0.0", message = "messaging.delivery.jitter must be >= 0")
    @DecimalMax(value = "1.0", message = "messaging.delivery.jitter must be <= 1")
    double jitter
) {

  public DeliveryPolicy toDomain() {
    return new DeliveryPolicy(maxAttempts, baseBackoff, multiplier, maxBackoff, perAttemptTimeout, jitter);
  }

  @AssertTrue(message = "messaging.delivery.maxBackoff must be >= messaging.delivery.baseBackoff")
  public boolean isBackoffRangeValid() {
    return baseBackoff == null || maxBackoff == null || maxBackoff.compareTo(baseBackoff) >= 0;
  }
}
