package com.github.adamzv.kafkakit.application;

import com.github.adamzv.kafkakit.domain.ConsumedRecord;
import com.github.adamzv.kafkakit.domain.ConsumerSettings;
import com.github.adamzv.kafkakit.domain.ConsumerState;
import com.github.adamzv.kafkakit.domain.Disposition;
import com.github.adamzv.kafkakit.domain.OffsetCursor;
import com.github.adamzv.kafkakit.domain.Problem;
import com.github.adamzv.kafkakit.domain.ProblemException;
import com.github.adamzv.kafkakit.ports.ConsumerTransportPort;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Poll, process, commit loop for one topic and consumer group.
 *
 * <p>The thread running {@link #run()} owns the transport and the {@link OffsetCursor}. Records of
 * one partition are processed one after another in offset order; different partitions are
 * processed concurrently on the context's workers, at most {@code parallelism} at a time. Offsets
 * are committed only for the contiguous prefix of records that reached a terminal disposition.
 */
public class ConsumerLoop implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(ConsumerLoop.class);

  private final ConsumerTransportPort transport;
  private final ConsumerSettings settings;
  private final MessagingContext context;
  private final RecordProcessor processor;
  private final OffsetCursor cursor = new OffsetCursor();
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean stopRequested = new AtomicBoolean(false);
  private final CountDownLatch terminated = new CountDownLatch(1);
  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private final AtomicInteger consecutivePollFailures = new AtomicInteger();

  private volatile Problem lastPollFailure;

  private volatile ConsumerState state = ConsumerState.IDLE;
  private volatile Map<Integer, Long> committedSnapshot = Map.of();

  public ConsumerLoop(ConsumerTransportPort transport,
                      MessageCodec codec,
                      HandlerRegistry registry,
                      ErrorRouter router,
                      ConsumerSettings settings,
                      MessagingContext context) {
    this.transport = transport;
    this.settings = settings;
    this.context = context;
    this.processor = new RecordProcessor(codec, registry, router, context, stopRequested::get);
  }

  public Thread runAsync() {
    Thread thread = new Thread(this, "kafka-kit-consumer-" + settings.topic());
    thread.start();
    return thread;
  }

  @Override
  public void run() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Consumer loop already started or stopped");
    }
    log.info(
        "consumer_loop_started topic={} group={} maxBatch={} parallelism={} retryCeiling={} deadLetterTopic={}",
        settings.topic(),
        settings.groupId(),
        settings.maxBatch(),
        settings.parallelism(),
        settings.retryCeiling(),
        settings.deadLetterTopic()
    );
    try {
      transport.subscribe(settings.topic(), new CursorRebalanceListener());
      while (!stopRequested.get()) {
        state = ConsumerState.POLLING;
        List<ConsumedRecord> batch;
        try {
          batch = transport.poll(settings.maxBatch(), settings.pollTimeout());
        } catch (ProblemException ex) {
          pauseAfterPollFailure(ex);
          continue;
        }
        if (consecutivePollFailures.getAndSet(0) > 0) {
          lastPollFailure = null;
          log.info("consumer_poll outcome=recovered topic={} group={}", settings.topic(), settings.groupId());
        }
        if (batch.isEmpty()) {
          continue;
        }
        processAndCommit(batch);
      }
    } catch (RuntimeException ex) {
      log.error("consumer_loop outcome=failed topic={} group={}", settings.topic(), settings.groupId(), ex);
      throw ex;
    } finally {
      state = ConsumerState.STOPPED;
      closeTransport();
      terminated.countDown();
      log.info("consumer_loop_stopped topic={} group={} committed={}", settings.topic(), settings.groupId(), committedSnapshot);
    }
  }

  /**
   * Requests a cooperative stop. Records already pulled finish their current disposition, the
   * finished prefix is committed and the transport is released.
   */
  public void stop() {
    if (stopRequested.compareAndSet(false, true)) {
      log.info("consumer_loop_stop_requested topic={} group={}", settings.topic(), settings.groupId());
      stopSignal.countDown();
      if (started.compareAndSet(false, true)) {
        state = ConsumerState.STOPPED;
        closeTransport();
        terminated.countDown();
        return;
      }
      transport.wakeup();
    }
  }

  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  public ConsumerState state() {
    return state;
  }

  public ConsumerSettings settings() {
    return settings;
  }

  /**
   * Number of polls that failed in a row; reset by the next successful poll.
   */
  public int consecutivePollFailures() {
    return consecutivePollFailures.get();
  }

  public Optional<Problem> lastPollFailure() {
    return Optional.ofNullable(lastPollFailure);
  }

  /**
   * Offsets committed so far, as next-offset-to-read per partition.
   */
  public Map<Integer, Long> committedOffsets() {
    return committedSnapshot;
  }

  /**
   * Waits before the next poll, growing with the retry policy's backoff; a stop ends the wait.
   */
  private void pauseAfterPollFailure(ProblemException failure) {
    int failures = consecutivePollFailures.incrementAndGet();
    lastPollFailure = failure.problem();
    Duration backoff = settings.retryPolicy().backoffAfter(failures);
    Duration pause = backoff.compareTo(settings.pollTimeout()) > 0 ? backoff : settings.pollTimeout();
    log.warn(
        "consumer_poll outcome=failed topic={} group={} failures={} pauseMs={} code={} message={}",
        settings.topic(),
        settings.groupId(),
        failures,
        pause.toMillis(),
        failure.code(),
        failure.getMessage()
    );
    try {
      stopSignal.await(pause.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      stopRequested.set(true);
    }
  }

  private void processAndCommit(List<ConsumedRecord> batch) {
    state = ConsumerState.PROCESSING;
    Map<Integer, List<ConsumedRecord>> byPartition = groupByPartition(batch);
    Map<Integer, List<Disposition>> dispositions = process(byPartition);

    state = ConsumerState.COMMITTING;
    commit(byPartition, dispositions);
  }

  private Map<Integer, List<ConsumedRecord>> groupByPartition(List<ConsumedRecord> batch) {
    Map<Integer, List<ConsumedRecord>> byPartition = new TreeMap<>();
    for (ConsumedRecord record : batch) {
      byPartition.computeIfAbsent(record.partition(), key -> new ArrayList<>()).add(record);
    }
    byPartition.values().forEach(records -> records.sort((a, b) -> Long.compare(a.offset(), b.offset())));
    return byPartition;
  }

  /**
   * Spreads partitions over {@code parallelism} lanes; each lane handles its partitions one after
   * another, so no partition is ever worked on by two tasks.
   */
  private Map<Integer, List<Disposition>> process(Map<Integer, List<ConsumedRecord>> byPartition) {
    int lanes = Math.max(1, Math.min(settings.parallelism(), byPartition.size()));
    List<List<Integer>> assignment = new ArrayList<>(lanes);
    for (int i = 0; i < lanes; i++) {
      assignment.add(new ArrayList<>());
    }
    int next = 0;
    for (Integer partition : byPartition.keySet()) {
      assignment.get(next++ % lanes).add(partition);
    }

    Map<Integer, List<Disposition>> results = new ConcurrentHashMap<>();
    List<CompletableFuture<Void>> inFlight = new ArrayList<>(lanes);
    for (List<Integer> lane : assignment) {
      CompletableFuture<Void> laneFuture = CompletableFuture.completedFuture(null);
      for (Integer partition : lane) {
        List<ConsumedRecord> records = byPartition.get(partition);
        laneFuture = laneFuture
            .thenComposeAsync(ignored -> processor.processInOrder(records), context.workers())
            .thenAccept(done -> results.put(partition, done));
      }
      inFlight.add(laneFuture);
    }

    for (CompletableFuture<Void> lane : inFlight) {
      try {
        lane.join();
      } catch (RuntimeException ex) {
        log.error("partition_lane outcome=failed topic={}", settings.topic(), ex);
      }
    }
    return results;
  }

  private void commit(Map<Integer, List<ConsumedRecord>> byPartition, Map<Integer, List<Disposition>> dispositions) {
    Map<Integer, Long> toCommit = new LinkedHashMap<>();
    List<CommitPlan> incomplete = new ArrayList<>();
    for (Map.Entry<Integer, List<ConsumedRecord>> entry : byPartition.entrySet()) {
      int partition = entry.getKey();
      CommitPlan plan = CommitPlan.of(partition, entry.getValue(), dispositions.getOrDefault(partition, List.of()));
      plan.commitOffset().ifPresent(offset -> {
        Long current = cursor.committed(partition).orElse(null);
        if (current == null || offset > current) {
          toCommit.put(partition, offset);
        }
      });
      if (!plan.fullyTerminal()) {
        incomplete.add(plan);
      } else {
        context.metrics().clearStalled(settings.groupId(), settings.topic(), partition);
      }
    }

    if (!toCommit.isEmpty()) {
      try {
        transport.commit(settings.topic(), toCommit);
        toCommit.forEach(cursor::advance);
        committedSnapshot = cursor.snapshot();
        context.metrics().recordCommit(settings.topic(), toCommit.size());
        log.debug("offsets_committed topic={} offsets={}", settings.topic(), toCommit);
      } catch (ProblemException ex) {
        // uncommitted records are redelivered after restart or rebalance
        log.error(
            "offsets_commit outcome=failed topic={} offsets={} code={} message={}",
            settings.topic(),
            toCommit,
            ex.code(),
            ex.getMessage()
        );
      }
    }

    if (stopRequested.get()) {
      return;
    }
    for (CommitPlan plan : incomplete) {
      long resumeAt = plan.resumeOffset().getAsLong();
      log.warn(
          "partition_rewound topic={} partition={} offset={} reason=non_terminal_disposition",
          settings.topic(),
          plan.partition(),
          resumeAt
      );
      transport.rewind(settings.topic(), plan.partition(), resumeAt);
    }
  }

  private void closeTransport() {
    try {
      transport.close();
    } catch (RuntimeException ex) {
      log.warn("consumer_transport_close outcome=failed topic={} error={}", settings.topic(), ex.toString());
    }
  }

  private final class CursorRebalanceListener implements ConsumerTransportPort.RebalanceListener {

    @Override
    public void onPartitionsRevoked(Collection<Integer> partitions) {
      state = ConsumerState.REBALANCING;
      log.info("partitions_revoked topic={} partitions={}", settings.topic(), partitions);
      cursor.forget(partitions);
      committedSnapshot = cursor.snapshot();
      partitions.forEach(partition -> context.metrics().clearStalled(settings.groupId(), settings.topic(), partition));
    }

    @Override
    public void onPartitionsAssigned(Collection<Integer> partitions) {
      state = ConsumerState.REBALANCING;
      log.info("partitions_assigned topic={} partitions={}", settings.topic(), partitions);
      state = ConsumerState.POLLING;
    }
  }
}
