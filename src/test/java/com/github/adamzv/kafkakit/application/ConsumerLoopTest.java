package com.github.adamzv.kafkakit.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.adamzv.kafkakit.application.TestMessages.UserCreatedV1;
import com.github.adamzv.kafkakit.domain.ConsumerSettings;
import com.github.adamzv.kafkakit.domain.ConsumerState;
import com.github.adamzv.kafkakit.domain.DeadLetterRecord;
import com.github.adamzv.kafkakit.domain.DeliveryPolicy;
import com.github.adamzv.kafkakit.domain.Envelope;
import com.github.adamzv.kafkakit.domain.HandlerOutcome;
import com.github.adamzv.kafkakit.domain.ProblemCodes;
import com.github.adamzv.kafkakit.ports.MessageHandler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class ConsumerLoopTest {

  private static final String TOPIC = "users";
  private static final String DLT = "users-dlt";
  private static final DeliveryPolicy DLT_POLICY = DeliveryPolicy.of(1, Duration.ofMillis(5), 1.0);

  private final List<String> events = Collections.synchronizedList(new ArrayList<>());
  private SimpleMeterRegistry registry;
  private MessagingContext context;
  private MessageCodec codec;
  private FakeProducerTransport producerTransport;
  private FakeConsumerTransport consumerTransport;
  private ConsumerLoop loop;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    context = new MessagingContext(registry, 4);
    codec = new MessageCodec(TestMessages.catalog(), new ObjectMapper());
    producerTransport = new FakeProducerTransport(3, events);
    consumerTransport = new FakeConsumerTransport(events);
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    if (loop != null) {
      loop.stop();
      loop.awaitTermination(Duration.ofSeconds(5));
    }
    context.close();
  }

  @Test
  void permanentFailureIsDeadLetteredOnceAndCommittedAfterPublish() {
    consumerTransport.append(0, user("u-0"));
    consumerTransport.append(0, user("u-1"));
    AtomicInteger calls = new AtomicInteger();

    start(settings(4, false), (value, ctx) -> {
      calls.incrementAndGet();
      return ctx.offset() == 0 ? HandlerOutcome.permanent("unknown account") : HandlerOutcome.ack();
    });
    awaitCommitted(0, 2L);

    assertEquals(2, calls.get());
    List<FakeProducerTransport.Sent> deadLetters = producerTransport.sentTo(DLT);
    assertEquals(1, deadLetters.size());
    assertEquals("0", deadLetters.get(0).headers().get(DeadLetterRecord.ORIGINAL_OFFSET_HEADER));
    assertEquals(ProblemCodes.HANDLER_PERMANENT, deadLetters.get(0).headers().get(DeadLetterRecord.ERROR_CODE_HEADER));
    assertTrue(events.indexOf("produced:" + DLT) < firstCommitIndex(), "commit happened before dead-letter publish");
  }

  @Test
  void retryableTwiceThenAckCommitsWithoutDeadLetter() {
    consumerTransport.append(0, user("u-0"));
    AtomicInteger calls = new AtomicInteger();
    List<Integer> attempts = Collections.synchronizedList(new ArrayList<>());

    start(settings(4, false), (value, ctx) -> {
      attempts.add(ctx.attempt());
      return calls.incrementAndGet() <= 2 ? HandlerOutcome.retryable("db busy") : HandlerOutcome.ack();
    });
    awaitCommitted(0, 1L);

    assertEquals(3, calls.get());
    assertEquals(List.of(1, 2, 3), attempts);
    assertTrue(producerTransport.sentTo(DLT).isEmpty());
    assertTrue(consumerTransport.rewinds().isEmpty());
  }

  @Test
  void throwingHandlerIsRetriedThenDeadLettered() {
    consumerTransport.append(0, user("u-0"));
    AtomicInteger calls = new AtomicInteger();

    start(settings(4, false), (value, ctx) -> {
      calls.incrementAndGet();
      throw new IllegalStateException("boom");
    });
    awaitCommitted(0, 1L);

    assertEquals(3, calls.get());
    FakeProducerTransport.Sent deadLetter = producerTransport.sentTo(DLT).get(0);
    assertEquals("3", deadLetter.headers().get(DeadLetterRecord.FAILURE_COUNT_HEADER));
    assertEquals(ProblemCodes.HANDLER_RETRYABLE, deadLetter.headers().get(DeadLetterRecord.ERROR_CODE_HEADER));
  }

  @Test
  void keepsPartitionOrderUnderConcurrency() {
    int partitions = 4;
    int perPartition = 40;
    for (int offset = 0; offset < perPartition; offset++) {
      for (int partition = 0; partition < partitions; partition++) {
        consumerTransport.append(partition, user("u-" + offset));
      }
    }
    Map<Integer, List<Long>> seen = new ConcurrentHashMap<>();
    Map<Integer, AtomicInteger> inFlight = new ConcurrentHashMap<>();
    AtomicInteger overlaps = new AtomicInteger();

    start(settings(25, false), (value, ctx) -> {
      AtomicInteger active = inFlight.computeIfAbsent(ctx.partition(), key -> new AtomicInteger());
      if (active.incrementAndGet() > 1) {
        overlaps.incrementAndGet();
      }
      try {
        Thread.sleep(ThreadLocalRandom.current().nextInt(2));
        seen.computeIfAbsent(ctx.partition(), key -> Collections.synchronizedList(new ArrayList<>()))
            .add(ctx.offset());
        return ThreadLocalRandom.current().nextInt(10) == 0
            ? HandlerOutcome.permanent("sampled")
            : HandlerOutcome.ack();
      } finally {
        active.decrementAndGet();
      }
    });
    for (int partition = 0; partition < partitions; partition++) {
      awaitCommitted(partition, (long) perPartition);
    }

    assertEquals(0, overlaps.get());
    for (int partition = 0; partition < partitions; partition++) {
      List<Long> offsets = seen.get(partition);
      assertEquals(perPartition, offsets.size());
      for (int i = 0; i < perPartition; i++) {
        assertEquals((long) i, offsets.get(i));
      }
    }
    for (Map<Integer, Long> commit : consumerTransport.commits()) {
      commit.values().forEach(offset -> assertTrue(offset <= perPartition));
    }
  }

  @Test
  void failedDeadLetterPublishStallsPartitionWithoutCommit() {
    producerTransport.failTopic(DLT);
    consumerTransport.append(0, user("u-0"));
    consumerTransport.append(0, user("u-1"));
    consumerTransport.append(0, user("u-2"));
    List<Long> handled = Collections.synchronizedList(new ArrayList<>());

    start(settings(10, false), (value, ctx) -> {
      handled.add(ctx.offset());
      return ctx.offset() == 1 ? HandlerOutcome.permanent("rejected") : HandlerOutcome.ack();
    });
    awaitCommitted(0, 1L);
    await(() -> consumerTransport.rewinds().size() >= 2);

    assertEquals(Long.valueOf(1L), consumerTransport.committed().get(0));
    assertFalse(handled.contains(2L));
    assertTrue(consumerTransport.rewinds().contains(new FakeConsumerTransport.Rewind(0, 1)));
    assertEquals(Set.of("test-group:users-0"), context.metrics().stalledPartitions());
    for (Map<Integer, Long> commit : consumerTransport.commits()) {
      assertTrue(commit.getOrDefault(0, 0L) <= 1L);
    }
  }

  @Test
  void undecodableRecordIsDeadLetteredWithoutCallingHandler() {
    consumerTransport.append(0, new Envelope(
        TOPIC, Envelope.keyOf("k"), TestMessages.USER_CREATED, 9, "{}".getBytes(StandardCharsets.UTF_8), Map.of()));
    consumerTransport.append(0, new Envelope(
        TOPIC, Envelope.keyOf("k"), "unregistered", 1, "{}".getBytes(StandardCharsets.UTF_8), Map.of()));
    AtomicInteger calls = new AtomicInteger();

    start(settings(10, false), (value, ctx) -> {
      calls.incrementAndGet();
      return HandlerOutcome.ack();
    });
    awaitCommitted(0, 2L);

    assertEquals(0, calls.get());
    List<FakeProducerTransport.Sent> deadLetters = producerTransport.sentTo(DLT);
    assertEquals(2, deadLetters.size());
    assertEquals(ProblemCodes.SCHEMA_ERROR, deadLetters.get(0).headers().get(DeadLetterRecord.ERROR_CODE_HEADER));
    assertEquals(ProblemCodes.HANDLER_PERMANENT, deadLetters.get(1).headers().get(DeadLetterRecord.ERROR_CODE_HEADER));
  }

  @Test
  void skipsPermanentFailuresWhenConfigured() {
    consumerTransport.append(0, user("u-0"));

    start(settings(10, true), (value, ctx) -> HandlerOutcome.permanent("ignored"));
    awaitCommitted(0, 1L);

    assertTrue(producerTransport.sent().isEmpty());
  }

  @Test
  void exposesTraceHeadersToHandlerDiagnostics() {
    consumerTransport.append(0, user("u-0").withHeaders(Map.of("traceparent", "00-4bf92f-00f067-01")));
    List<String> traceParents = Collections.synchronizedList(new ArrayList<>());

    start(settings(10, false), (value, ctx) -> {
      traceParents.add(ctx.traceParent());
      traceParents.add(MDC.get("traceparent"));
      return HandlerOutcome.ack();
    });
    awaitCommitted(0, 1L);

    assertEquals(List.of("00-4bf92f-00f067-01", "00-4bf92f-00f067-01"), traceParents);
  }

  @Test
  void stopClosesTransportAndReportsStopped() throws InterruptedException {
    start(settings(10, false), (value, ctx) -> HandlerOutcome.ack());
    await(() -> consumerTransport.subscribedTopic() != null);

    loop.stop();

    assertTrue(loop.awaitTermination(Duration.ofSeconds(5)));
    assertEquals(ConsumerState.STOPPED, loop.state());
    assertTrue(consumerTransport.closed());
  }

  @Test
  void stopBeforeStartTerminatesImmediately() throws InterruptedException {
    loop = newLoop(settings(10, false), (value, ctx) -> HandlerOutcome.ack());

    loop.stop();

    assertTrue(loop.awaitTermination(Duration.ofMillis(100)));
    assertTrue(consumerTransport.closed());
  }

  @Test
  void handlerSendingSynchronouslyWhileProducerRetriesDoesNotBlockTheLoop() {
    context.close();
    context = new MessagingContext(registry, 2);
    MessageProducer audit = new MessageProducer(
        producerTransport, codec, context, DeliveryPolicy.of(3, Duration.ofMillis(20), 1.0));
    producerTransport.failNext(2);
    consumerTransport.append(0, user("u-0"));
    consumerTransport.append(1, user("u-1"));
    List<Boolean> delivered = Collections.synchronizedList(new ArrayList<>());

    start(settings(2, DeliveryPolicy.of(3, Duration.ofMillis(10), 2.0)), (value, ctx) -> {
      delivered.add(audit.send("audit", value.userId(), value).isDelivered());
      return HandlerOutcome.ack();
    });
    awaitCommitted(0, 1L);
    awaitCommitted(1, 1L);

    assertEquals(List.of(true, true), delivered);
    assertEquals(4, producerTransport.sentTo("audit").size());
    assertTrue(producerTransport.sentTo(DLT).isEmpty());
  }

  @Test
  void pausesBetweenFailedPolls() throws InterruptedException {
    consumerTransport.failPolls(true);

    start(settings(1, DeliveryPolicy.of(3, Duration.ofMillis(50), 2.0)), (value, ctx) -> HandlerOutcome.ack());
    Thread.sleep(500);

    int polls = consumerTransport.polls();
    assertTrue(polls >= 2 && polls <= 12, "unexpected poll count " + polls);
    assertTrue(loop.consecutivePollFailures() >= 2);
    assertEquals(ProblemCodes.TRANSPORT_ERROR, loop.lastPollFailure().orElseThrow().code());

    consumerTransport.append(0, user("u-0"));
    consumerTransport.failPolls(false);
    awaitCommitted(0, 1L);

    assertEquals(0, loop.consecutivePollFailures());
    assertTrue(loop.lastPollFailure().isEmpty());
  }

  @Test
  void stopDuringPollBackoffEndsThePauseEarly() throws InterruptedException {
    consumerTransport.failPolls(true);
    start(settings(1, DeliveryPolicy.of(3, Duration.ofSeconds(30), 1.0)), (value, ctx) -> HandlerOutcome.ack());
    await(() -> loop.consecutivePollFailures() >= 1);

    loop.stop();

    assertTrue(loop.awaitTermination(Duration.ofSeconds(2)));
    assertEquals(1, consumerTransport.polls());
  }

  @Test
  void stopLetsInFlightHandlerFinishAndCommitsIt() throws InterruptedException {
    consumerTransport.append(0, user("u-0"));
    consumerTransport.append(0, user("u-1"));
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    List<Long> handled = Collections.synchronizedList(new ArrayList<>());

    start(settings(10, false), (value, ctx) -> {
      if (ctx.offset() == 0) {
        entered.countDown();
        release.await(5, TimeUnit.SECONDS);
      }
      handled.add(ctx.offset());
      return HandlerOutcome.ack();
    });
    assertTrue(entered.await(5, TimeUnit.SECONDS));

    loop.stop();
    assertFalse(loop.awaitTermination(Duration.ofMillis(50)));
    release.countDown();

    assertTrue(loop.awaitTermination(Duration.ofSeconds(5)));
    assertEquals(List.of(0L), handled);
    assertEquals(Map.of(0, 1L), consumerTransport.committed());
    assertTrue(consumerTransport.rewinds().isEmpty());
    assertEquals(ConsumerState.STOPPED, loop.state());
  }

  @Test
  void stopDuringRetryBackoffAbandonsRecordAndCommitsFinishedPrefix() throws InterruptedException {
    consumerTransport.append(0, user("u-0"));
    consumerTransport.append(0, user("u-1"));
    consumerTransport.append(0, user("u-2"));
    CountDownLatch firstFailure = new CountDownLatch(1);
    Map<Long, AtomicInteger> calls = new ConcurrentHashMap<>();

    start(settings(1, DeliveryPolicy.of(3, Duration.ofMillis(300), 1.0)), (value, ctx) -> {
      calls.computeIfAbsent(ctx.offset(), key -> new AtomicInteger()).incrementAndGet();
      if (ctx.offset() == 1) {
        firstFailure.countDown();
        return HandlerOutcome.retryable("db busy");
      }
      return HandlerOutcome.ack();
    });
    assertTrue(firstFailure.await(5, TimeUnit.SECONDS));

    loop.stop();

    assertTrue(loop.awaitTermination(Duration.ofSeconds(5)));
    assertEquals(1, calls.get(1L).get());
    assertFalse(calls.containsKey(2L));
    assertEquals(Map.of(0, 1L), consumerTransport.committed());
    assertTrue(consumerTransport.rewinds().isEmpty());
    assertTrue(producerTransport.sentTo(DLT).isEmpty());
    assertEquals(1.0, registry.get("kafka_kit_consume_records_total")
        .tag("disposition", "abandoned").counter().count());
  }

  @Test
  void revokedPartitionsAreForgottenAndTheirStallCleared() {
    producerTransport.failTopic(DLT);
    consumerTransport.append(0, user("u-0"));
    consumerTransport.append(1, user("u-1"));

    start(settings(2, DeliveryPolicy.of(1, Duration.ofMillis(10), 1.0)),
        (value, ctx) -> ctx.partition() == 1 ? HandlerOutcome.permanent("rejected") : HandlerOutcome.ack());
    awaitCommitted(0, 1L);
    await(() -> context.metrics().stalledPartitions().contains("test-group:users-1"));
    await(() -> loop.committedOffsets().equals(Map.of(0, 1L)));

    List<ConsumerState> duringRevoke = Collections.synchronizedList(new ArrayList<>());
    consumerTransport.revokeOnNextPoll(List.of(0, 1), () -> duringRevoke.add(loop.state()));
    await(() -> !duringRevoke.isEmpty());

    assertEquals(List.of(ConsumerState.REBALANCING), duringRevoke);
    assertTrue(loop.committedOffsets().isEmpty());
    assertTrue(context.metrics().stalledPartitions().isEmpty());
  }

  private void start(ConsumerSettings settings, MessageHandler<UserCreatedV1> handler) {
    loop = newLoop(settings, handler);
    loop.runAsync();
  }

  private ConsumerLoop newLoop(ConsumerSettings settings, MessageHandler<UserCreatedV1> handler) {
    HandlerRegistry registry = HandlerRegistry.builder()
        .register(TestMessages.USER_CREATED, UserCreatedV1.class, handler)
        .build();
    MessageProducer producer = new MessageProducer(producerTransport, codec, context, DLT_POLICY);
    ErrorRouter router = new ErrorRouter(producer, settings, DLT_POLICY, context);
    return new ConsumerLoop(consumerTransport, codec, registry, router, settings, context);
  }

  private ConsumerSettings settings(int maxBatch, boolean skip) {
    return new ConsumerSettings(
        TOPIC,
        "test-group",
        maxBatch,
        Duration.ofMillis(20),
        4,
        DeliveryPolicy.of(3, Duration.ofMillis(10), 2.0),
        skip ? null : DLT,
        skip
    );
  }

  private ConsumerSettings settings(int parallelism, DeliveryPolicy retryPolicy) {
    return new ConsumerSettings(TOPIC, "test-group", 10, Duration.ofMillis(20), parallelism, retryPolicy, DLT, false);
  }

  private Envelope user(String userId) {
    return codec.encode(TOPIC, userId, new UserCreatedV1(userId, userId + "@example.com"));
  }

  private int firstCommitIndex() {
    synchronized (events) {
      for (int i = 0; i < events.size(); i++) {
        if (events.get(i).startsWith("commit:")) {
          return i;
        }
      }
    }
    return Integer.MAX_VALUE;
  }

  private void awaitCommitted(int partition, long nextOffset) {
    await(() -> consumerTransport.committed().getOrDefault(partition, -1L) >= nextOffset);
  }

  private static void await(BooleanSupplier condition) {
    long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        fail("condition not met within 10s");
      }
      try {
        Thread.sleep(5);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        fail("interrupted while waiting");
      }
    }
  }
}
