package com.github.adamzv.kafkakit.application;

import com.github.adamzv.kafkakit.domain.ConsumedRecord;
import com.github.adamzv.kafkakit.domain.Disposition;
import com.github.adamzv.kafkakit.domain.HandlerOutcome;
import com.github.adamzv.kafkakit.domain.Problem;
import com.github.adamzv.kafkakit.domain.ProblemCodes;
import com.github.adamzv.kafkakit.domain.ProblemException;
import com.github.adamzv.kafkakit.domain.RecordContext;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Takes consumed records of one partition through decode, handler invocation and error routing,
 * strictly one record at a time.
 */
class RecordProcessor {

  private static final Logger log = LoggerFactory.getLogger(RecordProcessor.class);

  private final MessageCodec codec;
  private final HandlerRegistry registry;
  private final ErrorRouter router;
  private final MessagingContext context;
  private final BooleanSupplier stopRequested;

  RecordProcessor(MessageCodec codec,
                  HandlerRegistry registry,
                  ErrorRouter router,
                  MessagingContext context,
                  BooleanSupplier stopRequested) {
    this.codec = codec;
    this.registry = registry;
    this.router = router;
    this.context = context;
    this.stopRequested = stopRequested;
  }

  /**
   * Processes {@code records} (one partition, ascending offsets) in order. The returned list holds
   * the disposition of each processed record; processing ends early after the first non-terminal
   * disposition or once a stop is requested, so the list may be shorter than the input.
   */
  CompletableFuture<List<Disposition>> processInOrder(List<ConsumedRecord> records) {
    return processFrom(records, 0, new ArrayList<>(records.size()));
  }

  private CompletableFuture<List<Disposition>> processFrom(List<ConsumedRecord> records,
                                                           int index,
                                                           List<Disposition> done) {
    if (index >= records.size() || stopRequested.getAsBoolean()) {
      return CompletableFuture.completedFuture(done);
    }
    return process(records.get(index))
        .exceptionally(failure -> {
          ConsumedRecord record = records.get(index);
          log.error(
              "record_processing outcome=failed topic={} partition={} offset={}",
              record.topic(),
              record.partition(),
              record.offset(),
              failure
          );
          return Disposition.ABANDONED;
        })
        .thenComposeAsync(disposition -> {
          done.add(disposition);
          context.metrics().recordDisposition(records.get(index).topic(), disposition);
          if (!disposition.isTerminal()) {
            return CompletableFuture.completedFuture(done);
          }
          return processFrom(records, index + 1, done);
        }, context.workers());
  }

  CompletableFuture<Disposition> process(ConsumedRecord record) {
    HandlerRegistry.Registration<?> registration = registry.lookup(record.envelope().messageType()).orElse(null);
    if (registration == null) {
      Problem missing = new Problem(
          ProblemCodes.HANDLER_PERMANENT,
          "No handler registered for message type",
          Map.of("messageType", String.valueOf(record.envelope().messageType()))
      );
      return route(record, missing, 1);
    }
    return decodeAndHandle(record, registration);
  }

  private <T> CompletableFuture<Disposition> decodeAndHandle(ConsumedRecord record,
                                                             HandlerRegistry.Registration<T> registration) {
    T value;
    try {
      value = codec.decode(record.envelope(), registration.expectedType());
    } catch (ProblemException ex) {
      return route(record, ex.problem(), 1);
    }
    return handle(record, registration, value, 1);
  }

  private <T> CompletableFuture<Disposition> handle(ConsumedRecord record,
                                                    HandlerRegistry.Registration<T> registration,
                                                    T value,
                                                    int attempt) {
    Problem failure = invoke(record, registration, value, attempt);
    if (failure == null) {
      return CompletableFuture.completedFuture(Disposition.HANDLED);
    }

    ErrorRouter.Route route = router.classify(failure, attempt);
    if (route != ErrorRouter.Route.RETRY) {
      return finish(record, failure, attempt, route);
    }
    if (stopRequested.getAsBoolean()) {
      return abandon(record, attempt);
    }

    context.metrics().recordRetry(record.topic());
    Duration delay = router.retryDelay(attempt);
    log.debug(
        "record_retry topic={} partition={} offset={} attempt={} backoffMs={} reason={}",
        record.topic(),
        record.partition(),
        record.offset(),
        attempt,
        delay.toMillis(),
        failure.message()
    );
    // the delay fires on the scheduler; the next invocation goes back to the workers
    return CompletableFuture
        .supplyAsync(() -> attempt + 1, context.after(delay))
        .thenComposeAsync(next -> stopRequested.getAsBoolean()
            ? abandon(record, attempt)
            : handle(record, registration, value, next), context.workers());
  }

  private CompletableFuture<Disposition> abandon(ConsumedRecord record, int attempt) {
    log.info(
        "record_retry outcome=abandoned_on_stop topic={} partition={} offset={} attempt={}",
        record.topic(),
        record.partition(),
        record.offset(),
        attempt
    );
    return CompletableFuture.completedFuture(Disposition.ABANDONED);
  }

  private CompletableFuture<Disposition> route(ConsumedRecord record, Problem failure, int attempt) {
    return finish(record, failure, attempt, router.classify(failure, attempt));
  }

  private CompletableFuture<Disposition> finish(ConsumedRecord record,
                                                Problem failure,
                                                int failureCount,
                                                ErrorRouter.Route route) {
    if (route == ErrorRouter.Route.SKIP) {
      return CompletableFuture.completedFuture(router.skip(record, failure, failureCount));
    }
    return router.deadLetter(record, failure, failureCount);
  }

  /**
   * Runs the handler once; returns {@code null} on ack, otherwise the failure to route.
   */
  private <T> Problem invoke(ConsumedRecord record,
                             HandlerRegistry.Registration<T> registration,
                             T value,
                             int attempt) {
    RecordContext recordContext = RecordContext.of(record, attempt);
    Map<String, String> diagnostics = diagnosticContext(record, recordContext);
    diagnostics.forEach(MDC::put);
    Timer.Sample sample = context.metrics().startHandlerTimer();
    try {
      HandlerOutcome outcome = registration.handler().handle(value, recordContext);
      if (outcome == null) {
        return handlerProblem(ProblemCodes.HANDLER_PERMANENT, "Handler returned no outcome", record);
      }
      return switch (outcome.kind()) {
        case ACK -> null;
        case RETRYABLE -> handlerProblem(ProblemCodes.HANDLER_RETRYABLE, outcome.reason(), record);
        case PERMANENT -> handlerProblem(ProblemCodes.HANDLER_PERMANENT, outcome.reason(), record);
      };
    } catch (Exception ex) {
      log.warn(
          "handler_failed topic={} partition={} offset={} attempt={} error={}",
          record.topic(),
          record.partition(),
          record.offset(),
          attempt,
          ex.toString()
      );
      return handlerProblem(ProblemCodes.HANDLER_RETRYABLE, ex.getClass().getSimpleName() + ": " + ex.getMessage(), record);
    } finally {
      context.metrics().recordHandled(sample, record.topic(), record.envelope().messageType());
      diagnostics.keySet().forEach(MDC::remove);
    }
  }

  private Map<String, String> diagnosticContext(ConsumedRecord record, RecordContext recordContext) {
    Map<String, String> diagnostics = new LinkedHashMap<>();
    diagnostics.put("kafka.topic", record.topic());
    diagnostics.put("kafka.partition", Integer.toString(record.partition()));
    diagnostics.put("kafka.offset", Long.toString(record.offset()));
    if (recordContext.traceParent() != null) {
      diagnostics.put(RecordContext.TRACEPARENT_HEADER, recordContext.traceParent());
    }
    if (recordContext.traceState() != null) {
      diagnostics.put(RecordContext.TRACESTATE_HEADER, recordContext.traceState());
    }
    return diagnostics;
  }

  private Problem handlerProblem(String code, String reason, ConsumedRecord record) {
    Map<String, Object> details = new HashMap<>();
    details.put("partition", record.partition());
    details.put("offset", record.offset());
    return new Problem(code, reason == null ? "unspecified" : reason, details);
  }
}
