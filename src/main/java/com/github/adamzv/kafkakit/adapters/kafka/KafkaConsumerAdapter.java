package com.github.adamzv.kafkakit.adapters.kafka;

import com.github.adamzv.kafkakit.domain.ConsumedRecord;
import com.github.adamzv.kafkakit.domain.Envelope;
import com.github.adamzv.kafkakit.domain.Problems;
import com.github.adamzv.kafkakit.ports.ConsumerTransportPort;
import com.github.adamzv.kafkakit.support.KafkaProperties;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.header.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class KafkaConsumerAdapter implements ConsumerTransportPort {

  private static final Logger log = LoggerFactory.getLogger(KafkaConsumerAdapter.class);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final Consumer<byte[], byte[]> consumer;
  private final KafkaProperties kafkaProperties;
  private final Clock clock;

  public KafkaConsumerAdapter(Consumer<byte[], byte[]> consumer, KafkaProperties kafkaProperties) {
    this(consumer, kafkaProperties, Clock.systemUTC());
  }

  public KafkaConsumerAdapter(Consumer<byte[], byte[]> consumer, KafkaProperties kafkaProperties, Clock clock) {
    this.consumer = consumer;
    this.kafkaProperties = kafkaProperties;
    this.clock = clock;
  }

  @Override
  public void subscribe(String topic, RebalanceListener listener) {
    try {
      consumer.subscribe(List.of(topic), new ConsumerRebalanceListener() {
        @Override
        public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
          listener.onPartitionsRevoked(partitionNumbers(partitions));
        }

        @Override
        public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
          listener.onPartitionsAssigned(partitionNumbers(partitions));
        }

        @Override
        public void onPartitionsLost(Collection<TopicPartition> partitions) {
          log.warn("partitions_lost topic={} partitions={}", topic, partitionNumbers(partitions));
          listener.onPartitionsRevoked(partitionNumbers(partitions));
        }
      });
    } catch (KafkaException ex) {
      throw Problems.transportError("Kafka subscribe failed", errorDetails(topic, ex), ex);
    }
  }

  @Override
  public List<ConsumedRecord> poll(int maxBatch, Duration timeout) {
    ConsumerRecords<byte[], byte[]> records;
    try {
      records = consumer.poll(timeout);
    } catch (WakeupException ex) {
      return List.of();
    } catch (KafkaException ex) {
      throw Problems.transportError("Kafka poll failed", errorDetails(null, ex), ex);
    }
    if (records.isEmpty()) {
      return List.of();
    }

    Instant receivedAt = clock.instant();
    List<ConsumedRecord> batch = new ArrayList<>(Math.min(records.count(), maxBatch));
    for (TopicPartition partition : records.partitions()) {
      List<ConsumerRecord<byte[], byte[]>> partitionRecords = records.records(partition);
      for (ConsumerRecord<byte[], byte[]> record : partitionRecords) {
        if (batch.size() >= maxBatch) {
          // hand back the rest so it is fetched again on the next poll
          consumer.seek(partition, record.offset());
          break;
        }
        batch.add(toConsumedRecord(record, receivedAt));
      }
    }
    return List.copyOf(batch);
  }

  @Override
  public void commit(String topic, Map<Integer, Long> nextOffsets) {
    Map<TopicPartition, OffsetAndMetadata> offsets = new HashMap<>();
    nextOffsets.forEach((partition, offset) ->
        offsets.put(new TopicPartition(topic, partition), new OffsetAndMetadata(offset)));
    try {
      commitSync(offsets);
    } catch (WakeupException ex) {
      // a stop request raced with the commit; the wakeup is consumed, so commit once more
      commitSync(offsets);
    }
  }

  private void commitSync(Map<TopicPartition, OffsetAndMetadata> offsets) {
    try {
      consumer.commitSync(offsets);
      log.debug("committed offsets={}", offsets);
    } catch (WakeupException ex) {
      throw ex;
    } catch (KafkaException ex) {
      log.info("commit outcome=error offsets={} error={}", offsets, ex.toString());
      throw Problems.transportError("Kafka commit failed", errorDetails(null, ex), ex);
    }
  }

  @Override
  public void rewind(String topic, int partition, long offset) {
    try {
      consumer.seek(new TopicPartition(topic, partition), offset);
    } catch (IllegalStateException ex) {
      // partition no longer assigned; the new owner resumes from the committed offset
      log.info("rewind outcome=skipped topic={} partition={} offset={} reason={}", topic, partition, offset, ex.getMessage());
    }
  }

  @Override
  public void wakeup() {
    consumer.wakeup();
  }

  @Override
  public void close() {
    try {
      consumer.close(CLOSE_TIMEOUT);
    } catch (KafkaException ex) {
      throw Problems.transportError("Kafka consumer close failed", errorDetails(null, ex), ex);
    }
  }

  static ConsumedRecord toConsumedRecord(ConsumerRecord<byte[], byte[]> record, Instant receivedAt) {
    Map<String, String> headers = new LinkedHashMap<>();
    String messageType = null;
    int schemaVersion = -1;
    for (Header header : record.headers()) {
      byte[] valueBytes = header.value();
      String value = valueBytes == null ? null : new String(valueBytes, StandardCharsets.UTF_8);
      if (Envelope.MESSAGE_TYPE_HEADER.equals(header.key())) {
        messageType = value;
      } else if (Envelope.SCHEMA_VERSION_HEADER.equals(header.key())) {
        schemaVersion = parseVersion(value);
      } else {
        headers.put(header.key(), value);
      }
    }
    Envelope envelope = new Envelope(
        record.topic(),
        record.key(),
        messageType,
        schemaVersion,
        record.value(),
        headers
    );
    return new ConsumedRecord(envelope, record.partition(), record.offset(), receivedAt);
  }

  private static int parseVersion(String value) {
    if (value == null) {
      return -1;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      return -1;
    }
  }

  private static List<Integer> partitionNumbers(Collection<TopicPartition> partitions) {
    return partitions.stream().map(TopicPartition::partition).sorted().toList();
  }

  private Map<String, Object> errorDetails(String topic, Exception cause) {
    Map<String, Object> details = new HashMap<>();
    if (topic != null) {
      details.put("topic", topic);
    }
    details.put("bootstrapServers", kafkaProperties.bootstrapServers());
    details.put("error", cause.getClass().getSimpleName());
    if (cause.getMessage() != null) {
      details.put("message", cause.getMessage());
    }
    return details;
  }
}
