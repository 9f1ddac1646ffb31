package com.github.adamzv.kafkakit.domain;

import java.time.Duration;
import java.util.Map;
import java.util.function.DoubleSupplier;

/**
 * Retry budget and backoff curve for one send (or one in-place consumer retry sequence).
 *
 * <p>The wait after failed attempt {@code n} is
 * {@code min(baseBackoff * multiplier^(n-1), maxBackoff)}. Jitter only ever lengthens a wait,
 * never shortens it below the nominal curve, and never past {@code maxBackoff}.
 */
public record DeliveryPolicy(
    int maxAttempts,
    Duration baseBackoff,
    double multiplier,
    Duration maxBackoff,
    Duration perAttemptTimeout,
    double jitter
) {

  public static final DeliveryPolicy DEFAULT = new DeliveryPolicy(
      3,
      Duration.ofMillis(100),
      2.0,
      Duration.ofSeconds(5),
      Duration.ofSeconds(10),
      0.0
  );

  public DeliveryPolicy {
    if (maxAttempts < 1) {
      throw Problems.invalidArgument("maxAttempts must be >= 1", Map.of("maxAttempts", maxAttempts));
    }
    if (baseBackoff == null || baseBackoff.isNegative()) {
      throw Problems.invalidArgument("baseBackoff must be non-negative", Map.of());
    }
    if (multiplier < 1.0 || Double.isNaN(multiplier)) {
      throw Problems.invalidArgument("multiplier must be >= 1", Map.of("multiplier", multiplier));
    }
    if (maxBackoff == null || maxBackoff.compareTo(baseBackoff) < 0) {
      throw Problems.invalidArgument("maxBackoff must be >= baseBackoff", Map.of());
    }
    if (perAttemptTimeout == null || perAttemptTimeout.isNegative() || perAttemptTimeout.isZero()) {
      throw Problems.invalidArgument("perAttemptTimeout must be positive", Map.of());
    }
    if (jitter < 0.0 || jitter > 1.0 || Double.isNaN(jitter)) {
      throw Problems.invalidArgument("jitter must be within [0, 1]", Map.of("jitter", jitter));
    }
  }

  public static DeliveryPolicy of(int maxAttempts, Duration baseBackoff, double multiplier) {
    double uncapped = baseBackoff.toNanos() * Math.pow(multiplier, Math.max(0, maxAttempts - 1));
    Duration max = Duration.ofNanos((long) Math.min(uncapped, (double) Long.MAX_VALUE / 2));
    return new DeliveryPolicy(maxAttempts, baseBackoff, multiplier, max, DEFAULT.perAttemptTimeout(), 0.0);
  }

  public DeliveryPolicy withJitter(double newJitter) {
    return new DeliveryPolicy(maxAttempts, baseBackoff, multiplier, maxBackoff, perAttemptTimeout, newJitter);
  }

  public boolean hasAttemptsAfter(int attemptNumber) {
    return attemptNumber < maxAttempts;
  }

  /**
   * Nominal wait after failed attempt {@code attemptNumber} (1-based), without jitter.
   */
  public Duration backoffAfter(int attemptNumber) {
    if (attemptNumber < 1) {
      throw Problems.invalidArgument("Attempt number must be >= 1", Map.of("attempt", attemptNumber));
    }
    double scaled = baseBackoff.toNanos() * Math.pow(multiplier, attemptNumber - 1);
    long capped = (long) Math.min(scaled, (double) maxBackoff.toNanos());
    return Duration.ofNanos(capped);
  }

  /**
   * Wait after failed attempt {@code attemptNumber} with jitter applied; {@code random} yields
   * values in {@code [0, 1)}.
   */
  public Duration backoffAfter(int attemptNumber, DoubleSupplier random) {
    Duration nominal = backoffAfter(attemptNumber);
    if (jitter == 0.0) {
      return nominal;
    }
    long extra = (long) (nominal.toNanos() * jitter * random.getAsDouble());
    long jittered = Math.min(nominal.toNanos() + extra, maxBackoff.toNanos());
    return Duration.ofNanos(Math.max(jittered, nominal.toNanos()));
  }
}
