package com.github.adamzv.kafkakit.application;

import com.github.adamzv.kafkakit.domain.DeliveryAttempt;
import com.github.adamzv.kafkakit.domain.DeliveryPolicy;
import com.github.adamzv.kafkakit.domain.DeliveryResult;
import com.github.adamzv.kafkakit.domain.Envelope;
import com.github.adamzv.kafkakit.domain.KeyedMessage;
import com.github.adamzv.kafkakit.domain.Problem;
import com.github.adamzv.kafkakit.domain.ProblemCodes;
import com.github.adamzv.kafkakit.domain.ProblemException;
import com.github.adamzv.kafkakit.domain.Problems;
import com.github.adamzv.kafkakit.domain.TransportReceipt;
import com.github.adamzv.kafkakit.ports.ProducerTransportPort;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes typed values and delivers them with retries. Encoding happens once per send; every
 * retry reuses the same envelope. Malformed input is never retried.
 */
public class MessageProducer {

  private static final Logger log = LoggerFactory.getLogger(MessageProducer.class);

  private final ProducerTransportPort transport;
  private final MessageCodec codec;
  private final MessagingContext context;
  private final DeliveryPolicy defaultPolicy;

  public MessageProducer(ProducerTransportPort transport,
                         MessageCodec codec,
                         MessagingContext context,
                         DeliveryPolicy defaultPolicy) {
    this.transport = transport;
    this.codec = codec;
    this.context = context;
    this.defaultPolicy = defaultPolicy;
  }

  public DeliveryResult send(String topic, String key, Object value) {
    return send(topic, key, value, defaultPolicy);
  }

  public DeliveryResult send(String topic, String key, Object value, DeliveryPolicy policy) {
    return sendAsync(topic, key, value, Map.of(), policy).join();
  }

  public CompletableFuture<DeliveryResult> sendAsync(String topic, String key, Object value) {
    return sendAsync(topic, key, value, Map.of(), defaultPolicy);
  }

  public CompletableFuture<DeliveryResult> sendAsync(String topic,
                                                     String key,
                                                     Object value,
                                                     Map<String, String> headers,
                                                     DeliveryPolicy policy) {
    requireTopic(topic);
    Envelope envelope;
    try {
      envelope = codec.encode(topic, key, value, headers);
    } catch (ProblemException ex) {
      DeliveryResult result = DeliveryResult.schemaFailed(topic, ex.problem());
      log.warn(
          "produce outcome=schema_failed topic={} code={} message={} details={}",
          topic,
          ex.problem().code(),
          ex.problem().message(),
          ex.problem().details()
      );
      context.metrics().recordDelivery(result);
      return CompletableFuture.completedFuture(result);
    }
    return publish(envelope, policy);
  }

  /**
   * Sends every message, in order, to {@code topic}. A value that fails to encode does not stop the
   * others; results line up with the input list.
   */
  public List<DeliveryResult> sendAll(String topic, List<KeyedMessage> messages, DeliveryPolicy policy) {
    List<CompletableFuture<DeliveryResult>> pending = new ArrayList<>(messages.size());
    for (KeyedMessage message : messages) {
      pending.add(sendAsync(topic, message.key(), message.value(), Map.of(), policy));
    }
    CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).join();
    List<DeliveryResult> results = new ArrayList<>(pending.size());
    for (CompletableFuture<DeliveryResult> future : pending) {
      results.add(future.join());
    }
    return List.copyOf(results);
  }

  /**
   * Delivers an already encoded envelope, e.g. a dead-letter copy of a consumed record.
   */
  public CompletableFuture<DeliveryResult> publish(Envelope envelope, DeliveryPolicy policy) {
    requireTopic(envelope.topic());
    return attempt(DeliveryAttempt.first(envelope), policy)
        .whenComplete((result, failure) -> {
          if (result != null) {
            context.metrics().recordDelivery(result);
          }
        });
  }

  public void flush() {
    transport.flush();
  }

  private CompletableFuture<DeliveryResult> attempt(DeliveryAttempt attempt, DeliveryPolicy policy) {
    Envelope envelope = attempt.envelope();
    context.metrics().recordProduceAttempt(envelope.topic());

    CompletableFuture<TransportReceipt> sent;
    try {
      sent = transport.produce(
              envelope.topic(),
              envelope.partitionKey(),
              envelope.payload(),
              envelope.wireHeaders(),
              policy.perAttemptTimeout()
          )
          .orTimeout(policy.perAttemptTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (RuntimeException ex) {
      sent = CompletableFuture.failedFuture(ex);
    }

    return sent
        .handle((receipt, failure) -> {
          if (failure == null) {
            if (attempt.attemptNumber() > 1) {
              log.info(
                  "produce outcome=delivered_after_retry topic={} attempts={} partition={} offset={}",
                  envelope.topic(),
                  attempt.attemptNumber(),
                  receipt.partition(),
                  receipt.offset()
              );
            }
            return CompletableFuture.completedFuture(DeliveryResult.delivered(receipt, attempt.attemptNumber()));
          }
          return retryOrGiveUp(attempt, policy, toProblem(envelope.topic(), failure));
        })
        .thenCompose(Function.identity());
  }

  private CompletableFuture<DeliveryResult> retryOrGiveUp(DeliveryAttempt attempt,
                                                          DeliveryPolicy policy,
                                                          Problem problem) {
    String topic = attempt.envelope().topic();
    if (problem.is(ProblemCodes.SCHEMA_ERROR)) {
      log.warn("produce outcome=rejected topic={} code={} message={}", topic, problem.code(), problem.message());
      return CompletableFuture.completedFuture(DeliveryResult.schemaFailed(topic, problem));
    }
    if (!policy.hasAttemptsAfter(attempt.attemptNumber())) {
      log.error(
          "produce outcome=exhausted topic={} attempts={} code={} message={}",
          topic,
          attempt.attemptNumber(),
          problem.code(),
          problem.message()
      );
      return CompletableFuture.completedFuture(
          DeliveryResult.exhausted(topic, attempt.attemptNumber(), problem)
      );
    }

    Duration wait = policy.backoffAfter(attempt.attemptNumber(), context.random());
    log.warn(
        "produce outcome=retry topic={} attempt={} backoffMs={} code={} message={}",
        topic,
        attempt.attemptNumber(),
        wait.toMillis(),
        problem.code(),
        problem.message()
    );
    DeliveryAttempt next = attempt.next(problem);
    return CompletableFuture
        .supplyAsync(() -> next, context.after(wait))
        .thenCompose(scheduled -> attempt(scheduled, policy));
  }

  private Problem toProblem(String topic, Throwable failure) {
    Throwable cause = Problems.unwrap(failure);
    if (cause instanceof TimeoutException) {
      return Problems.transportError(
          "Timed out waiting for produce acknowledgement",
          Map.of("topic", topic)
      ).problem();
    }
    return Problems.from(cause).problem();
  }

  private void requireTopic(String topic) {
    if (topic == null || topic.isBlank()) {
      throw Problems.invalidArgument("Topic must not be blank", Map.of());
    }
  }
}
