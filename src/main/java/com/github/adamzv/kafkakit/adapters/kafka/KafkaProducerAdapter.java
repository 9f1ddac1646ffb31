package com.github.adamzv.kafkakit.adapters.kafka;

import com.github.adamzv.kafkakit.domain.ProblemException;
import com.github.adamzv.kafkakit.domain.Problems;
import com.github.adamzv.kafkakit.domain.TransportReceipt;
import com.github.adamzv.kafkakit.ports.ProducerTransportPort;
import com.github.adamzv.kafkakit.support.KafkaProperties;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.header.internals.RecordHeader;

public class KafkaProducerAdapter implements ProducerTransportPort {

  private final Producer<byte[], byte[]> producer;
  private final KafkaProperties kafkaProperties;

  public KafkaProducerAdapter(Producer<byte[], byte[]> producer, KafkaProperties kafkaProperties) {
    this.producer = producer;
    this.kafkaProperties = kafkaProperties;
  }

  @Override
  public CompletableFuture<TransportReceipt> produce(String topic,
                                                    byte[] key,
                                                    byte[] value,
                                                    Map<String, String> headers,
                                                    Duration timeout) {
    ProducerRecord<byte[], byte[]> record = new ProducerRecord<>(topic, key, value);
    if (headers != null && !headers.isEmpty()) {
      headers.forEach((name, headerValue) -> {
        byte[] bytes = headerValue == null ? new byte[0] : headerValue.getBytes(StandardCharsets.UTF_8);
        record.headers().add(new RecordHeader(name, bytes));
      });
    }

    CompletableFuture<TransportReceipt> receipt = new CompletableFuture<>();
    try {
      producer.send(record, (metadata, exception) -> {
        if (exception != null) {
          receipt.completeExceptionally(translateSendFailure(topic, exception));
          return;
        }
        receipt.complete(new TransportReceipt(
            metadata.topic(),
            metadata.partition(),
            metadata.offset(),
            metadata.timestamp()
        ));
      });
    } catch (KafkaException ex) {
      // send() itself throws for serialization, buffer exhaustion and metadata timeouts
      receipt.completeExceptionally(translateSendFailure(topic, ex));
    }
    return receipt;
  }

  @Override
  public void flush() {
    try {
      producer.flush();
    } catch (InterruptException ex) {
      throw Problems.operationFailed("Interrupted while flushing", Map.of(), ex);
    } catch (KafkaException ex) {
      throw translateSendFailure("*", ex);
    }
  }

  private ProblemException translateSendFailure(String topic, Throwable cause) {
    if (cause instanceof RecordTooLargeException || cause instanceof SerializationException) {
      return Problems.schemaError(
          "Kafka rejected message because it exceeds broker limits or cannot be serialized",
          buildErrorDetails(topic, cause, false),
          cause
      );
    }
    if (cause instanceof KafkaException) {
      return Problems.transportError(
          "Kafka produce failed",
          buildErrorDetails(topic, cause, true),
          cause
      );
    }
    return Problems.transportError(
        "Unexpected error during produce",
        buildErrorDetails(topic, cause, false),
        cause
    );
  }

  private Map<String, Object> buildErrorDetails(String topic, Throwable cause, boolean includeBootstrap) {
    Map<String, Object> details = new HashMap<>();
    details.put("topic", topic);
    if (includeBootstrap) {
      details.put("bootstrapServers", kafkaProperties.bootstrapServers());
    }
    if (cause != null) {
      details.put("error", cause.getClass().getSimpleName());
      if (cause.getMessage() != null) {
        details.put("message", cause.getMessage());
      }
    }
    return Collections.unmodifiableMap(details);
  }
}
