package com.github.adamzv.kafkakit.application;

import com.github.adamzv.kafkakit.domain.DeliveryResult;
import com.github.adamzv.kafkakit.domain.Disposition;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Meters for the producer and consumer loop, plus the set of partitions currently stalled on a
 * failed dead-letter publish.
 */
public class MessagingMetrics {

  private final MeterRegistry meterRegistry;
  private final Set<String> stalledPartitions = ConcurrentHashMap.newKeySet();

  public MessagingMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder("kafka_kit_partitions_stalled", stalledPartitions, Set::size)
        .description("Partitions whose offset cannot advance because a dead-letter publish failed")
        .register(meterRegistry);
  }

  public void recordProduceAttempt(String topic) {
    meterRegistry.counter("kafka_kit_produce_attempts_total", "topic", topic).increment();
  }

  public void recordDelivery(DeliveryResult result) {
    meterRegistry.counter(
            "kafka_kit_produce_results_total",
            "topic", result.topic(),
            "status", result.status().name().toLowerCase())
        .increment();
  }

  public Timer.Sample startHandlerTimer() {
    return Timer.start(meterRegistry);
  }

  public void recordHandled(Timer.Sample sample, String topic, String messageType) {
    sample.stop(meterRegistry.timer(
        "kafka_kit_handler_duration_seconds",
        "topic", topic,
        "messageType", messageType == null ? "unknown" : messageType));
  }

  public void recordRetry(String topic) {
    meterRegistry.counter("kafka_kit_consume_retries_total", "topic", topic).increment();
  }

  public void recordDisposition(String topic, Disposition disposition) {
    meterRegistry.counter(
            "kafka_kit_consume_records_total",
            "topic", topic,
            "disposition", disposition.name().toLowerCase())
        .increment();
  }

  public void recordCommit(String topic, int partitions) {
    meterRegistry.counter("kafka_kit_commits_total", "topic", topic).increment();
    meterRegistry.counter("kafka_kit_committed_partitions_total", "topic", topic).increment(partitions);
  }

  public void markStalled(String groupId, String topic, int partition) {
    stalledPartitions.add(stallKey(groupId, topic, partition));
  }

  public void clearStalled(String groupId, String topic, int partition) {
    stalledPartitions.remove(stallKey(groupId, topic, partition));
  }

  /**
   * Stalled partitions as {@code group:topic-partition}, sorted.
   */
  public Set<String> stalledPartitions() {
    return Collections.unmodifiableSet(new TreeSet<>(stalledPartitions));
  }

  private static String stallKey(String groupId, String topic, int partition) {
    return groupId + ":" + topic + "-" + partition;
  }
}
