package com.github.adamzv.kafkakit.support;

import com.github.adamzv.kafkakit.domain.ConsumerSettings;
import com.github.adamzv.kafkakit.domain.DeliveryPolicy;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "messaging.consumer")
public record ConsumerProperties(
    String topic,
    @DefaultValue("kafka-kit")
    @NotBlank(message = "messaging.consumer.groupId must not be blank")
    String groupId,
    @DefaultValue("500")
    @Positive(message = "messaging.consumer.maxBatch must be > 0")
    int maxBatch,
    @DefaultValue("500ms")
    @NotNull
    Duration pollTimeout,
    @DefaultValue("4")
    @Positive(message = "messaging.consumer.parallelism must be > 0")
    int parallelism,
    @DefaultValue("3")
    @Positive(message = "messaging.consumer.retryCeiling must be > 0")
    int retryCeiling,
    @DefaultValue("200ms")
    @NotNull
    Duration retryBaseBackoff,
    @DefaultValue("2.0")
    @DecimalMin(value = "1.0", message = "messaging.consumer.retryMultiplier must be >= 1")
    double retryMultiplier,
    @DefaultValue("10s")
    @NotNull
    Duration retryMaxBackoff,
    String deadLetterTopic,
    @DefaultValue("false")
    boolean skipOnPermanentFailure,
    @DefaultValue("6s")
    @NotNull
    Duration sessionTimeout,
    @DefaultValue("earliest")
    @NotBlank
    String autoOffsetReset
) {

  public ConsumerSettings toDomain() {
    return toDomain(topic);
  }

  /**
   * Settings for {@code consumedTopic}; the dead-letter topic defaults to the topic name with a
   * {@code -dlt} suffix unless skipping is enabled.
   */
  public ConsumerSettings toDomain(String consumedTopic) {
    DeliveryPolicy retryPolicy = new DeliveryPolicy(
        retryCeiling,
        retryBaseBackoff,
        retryMultiplier,
        retryMaxBackoff,
        DeliveryPolicy.DEFAULT.perAttemptTimeout(),
        0.0
    );
    String deadLetter = deadLetterTopic;
    if ((deadLetter == null || deadLetter.isBlank()) && !skipOnPermanentFailure) {
      deadLetter = consumedTopic + ConsumerSettings.DEAD_LETTER_SUFFIX;
    }
    return new ConsumerSettings(
        consumedTopic,
        groupId,
        maxBatch,
        pollTimeout,
        parallelism,
        retryPolicy,
        deadLetter,
        skipOnPermanentFailure
    );
  }

  @AssertTrue(message = "messaging.consumer.retryMaxBackoff must be >= messaging.consumer.retryBaseBackoff")
  public boolean isRetryRangeValid() {
    return retryBaseBackoff == null || retryMaxBackoff == null || retryMaxBackoff.compareTo(retryBaseBackoff) >= 0;
  }
}
