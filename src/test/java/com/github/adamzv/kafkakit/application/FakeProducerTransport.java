package com.github.adamzv.kafkakit.application;

import com.github.adamzv.kafkakit.domain.Problems;
import com.github.adamzv.kafkakit.domain.TransportReceipt;
import com.github.adamzv.kafkakit.ports.ProducerTransportPort;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;
import org.apache.kafka.common.utils.Utils;

/**
 * In-memory producer transport. Partitions keyed records the way Kafka's default partitioner
 * does and can be told to fail a number of sends first.
 */
class FakeProducerTransport implements ProducerTransportPort {

  record Sent(String topic, byte[] key, byte[] value, Map<String, String> headers, long atNanos, int partition) {}

  private final int partitions;
  private final List<Sent> sent = Collections.synchronizedList(new ArrayList<>());
  private final Map<String, Long> nextOffsets = new HashMap<>();
  private final List<String> events;
  private volatile int failuresLeft;
  private volatile Predicate<String> alwaysFailTopic = topic -> false;
  private volatile boolean neverComplete;
  private volatile int flushes;

  FakeProducerTransport(int partitions) {
    this(partitions, Collections.synchronizedList(new ArrayList<>()));
  }

  FakeProducerTransport(int partitions, List<String> events) {
    this.partitions = partitions;
    this.events = events;
  }

  void failNext(int count) {
    failuresLeft = count;
  }

  void failTopic(String topic) {
    alwaysFailTopic = topic::equals;
  }

  void hang() {
    neverComplete = true;
  }

  List<Sent> sent() {
    synchronized (sent) {
      return List.copyOf(sent);
    }
  }

  List<Sent> sentTo(String topic) {
    return sent().stream().filter(record -> record.topic().equals(topic)).toList();
  }

  int flushes() {
    return flushes;
  }

  @Override
  public synchronized CompletableFuture<TransportReceipt> produce(String topic,
                                                                  byte[] key,
                                                                  byte[] value,
                                                                  Map<String, String> headers,
                                                                  Duration timeout) {
    int partition = key == null ? 0 : Utils.toPositive(Utils.murmur2(key)) % partitions;
    sent.add(new Sent(topic, key, value, Map.copyOf(headers), System.nanoTime(), partition));
    if (neverComplete) {
      return new CompletableFuture<>();
    }
    if (alwaysFailTopic.test(topic) || failuresLeft > 0) {
      failuresLeft = Math.max(0, failuresLeft - 1);
      events.add("produce-failed:" + topic);
      return CompletableFuture.failedFuture(
          Problems.transportError("Broker unavailable", Map.of("topic", topic)));
    }
    long offset = nextOffsets.merge(topic + "-" + partition, 1L, Long::sum) - 1;
    events.add("produced:" + topic);
    return CompletableFuture.completedFuture(new TransportReceipt(topic, partition, offset, 0L));
  }

  @Override
  public void flush() {
    flushes++;
  }
}
