package com.github.adamzv.kafkakit.application;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared runtime resources for producers and consumer loops. Create one at startup, pass it to
 * every {@link MessageProducer} and {@link ConsumerLoop}, and close it at shutdown.
 *
 * <p>Handlers run on the worker pool. Delayed continuations (produce retries, handler retry
 * backoff) fire on a separate scheduler thread, so a handler blocked on a synchronous send never
 * holds up the retry it is waiting for.
 */
public final class MessagingContext implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(MessagingContext.class);
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

  private final ExecutorService workers;
  private final ScheduledExecutorService scheduler;
  private final MessagingMetrics metrics;
  private final DoubleSupplier random;

  public MessagingContext(MeterRegistry meterRegistry, int workerThreads) {
    this(meterRegistry, workerThreads, () -> ThreadLocalRandom.current().nextDouble());
  }

  public MessagingContext(MeterRegistry meterRegistry, int workerThreads, DoubleSupplier random) {
    if (workerThreads < 1) {
      throw new IllegalArgumentException("workerThreads must be >= 1");
    }
    this.workers = Executors.newFixedThreadPool(workerThreads, new NamedThreadFactory("kafka-kit-worker-"));
    this.scheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("kafka-kit-scheduler-"));
    this.metrics = new MessagingMetrics(meterRegistry);
    this.random = random;
  }

  public Executor workers() {
    return workers;
  }

  /**
   * Executor that runs its task on the scheduler thread after {@code delay}. Tasks must not block;
   * hop back to {@link #workers()} before running handler code.
   */
  public Executor after(Duration delay) {
    long nanos = Math.max(0L, delay.toNanos());
    return task -> scheduler.schedule(task, nanos, TimeUnit.NANOSECONDS);
  }

  public MessagingMetrics metrics() {
    return metrics;
  }

  public DoubleSupplier random() {
    return random;
  }

  @Override
  public void close() {
    scheduler.shutdownNow();
    workers.shutdown();
    try {
      if (!workers.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("messaging_context_shutdown outcome=timeout pending tasks cancelled");
        workers.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      workers.shutdownNow();
    }
  }

  private static final class NamedThreadFactory implements ThreadFactory {

    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger();

    private NamedThreadFactory(String prefix) {
      this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable task) {
      Thread thread = new Thread(task, prefix + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
