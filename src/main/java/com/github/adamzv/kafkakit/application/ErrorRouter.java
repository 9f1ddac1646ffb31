package com.github.adamzv.kafkakit.application;

import com.github.adamzv.kafkakit.domain.ConsumedRecord;
import com.github.adamzv.kafkakit.domain.ConsumerSettings;
import com.github.adamzv.kafkakit.domain.DeadLetterRecord;
import com.github.adamzv.kafkakit.domain.DeliveryPolicy;
import com.github.adamzv.kafkakit.domain.Disposition;
import com.github.adamzv.kafkakit.domain.Problem;
import com.github.adamzv.kafkakit.domain.ProblemCodes;
import com.github.adamzv.kafkakit.domain.Problems;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides what happens to a record whose decode or handling failed, and carries out dead-letter
 * publication. A record only reaches a terminal disposition once the dead-letter copy is
 * acknowledged; if that publish fails the record is reported {@link Disposition#STALLED}.
 */
public class ErrorRouter {

  private static final Logger log = LoggerFactory.getLogger(ErrorRouter.class);

  public enum Route {
    RETRY,
    DEAD_LETTER,
    SKIP
  }

  private final MessageProducer producer;
  private final ConsumerSettings settings;
  private final DeliveryPolicy deadLetterPolicy;
  private final MessagingContext context;

  public ErrorRouter(MessageProducer producer,
                     ConsumerSettings settings,
                     DeliveryPolicy deadLetterPolicy,
                     MessagingContext context) {
    if (!settings.hasDeadLetterTopic() && !settings.skipOnPermanentFailure()) {
      throw Problems.invalidArgument(
          "Either a dead-letter topic or skipOnPermanentFailure is required",
          Map.of("topic", settings.topic())
      );
    }
    this.producer = producer;
    this.settings = settings;
    this.deadLetterPolicy = deadLetterPolicy;
    this.context = context;
  }

  /**
   * Classifies a failure seen on handler invocation {@code attempt} (1-based).
   */
  public Route classify(Problem failure, int attempt) {
    String code = failure.code();
    boolean retryable = ProblemCodes.HANDLER_RETRYABLE.equals(code)
        || ProblemCodes.OPERATION_FAILED.equals(code)
        || ProblemCodes.TRANSPORT_ERROR.equals(code);
    if (retryable && attempt < settings.retryCeiling()) {
      return Route.RETRY;
    }
    return settings.hasDeadLetterTopic() ? Route.DEAD_LETTER : Route.SKIP;
  }

  public Duration retryDelay(int attempt) {
    return settings.retryPolicy().backoffAfter(attempt, context.random());
  }

  public Disposition skip(ConsumedRecord record, Problem failure, int failureCount) {
    log.warn(
        "record_skipped topic={} partition={} offset={} failures={} code={} message={}",
        record.topic(),
        record.partition(),
        record.offset(),
        failureCount,
        failure.code(),
        failure.message()
    );
    return Disposition.SKIPPED;
  }

  public CompletableFuture<Disposition> deadLetter(ConsumedRecord record, Problem failure, int failureCount) {
    DeadLetterRecord deadLetter = new DeadLetterRecord(record, failure, failureCount);
    String destination = settings.deadLetterTopic();
    return producer.publish(deadLetter.toEnvelope(destination), deadLetterPolicy)
        .handle((result, error) -> {
          if (error == null && result.isDelivered()) {
            log.warn(
                "record_dead_lettered topic={} partition={} offset={} failures={} code={} destination={} dltPartition={} dltOffset={}",
                record.topic(),
                record.partition(),
                record.offset(),
                failureCount,
                failure.code(),
                destination,
                result.partition(),
                result.offset()
            );
            context.metrics().clearStalled(settings.groupId(), record.topic(), record.partition());
            return Disposition.DEAD_LETTERED;
          }
          Problem publishProblem = error != null ? Problems.from(error).problem() : result.error();
          log.error(
              "record_stalled topic={} partition={} offset={} destination={} code={} message={}",
              record.topic(),
              record.partition(),
              record.offset(),
              destination,
              publishProblem == null ? null : publishProblem.code(),
              publishProblem == null ? null : publishProblem.message()
          );
          context.metrics().markStalled(settings.groupId(), record.topic(), record.partition());
          return Disposition.STALLED;
        });
  }
}
