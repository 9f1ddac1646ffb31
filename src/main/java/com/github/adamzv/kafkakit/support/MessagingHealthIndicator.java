package com.github.adamzv.kafkakit.support;

import com.github.adamzv.kafkakit.application.ConsumerLoop;
import com.github.adamzv.kafkakit.application.MessagingMetrics;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * DOWN while any partition is stalled on a dead-letter publish failure, or while a consumer loop
 * keeps failing to poll.
 */
public class MessagingHealthIndicator implements HealthIndicator {

  static final int POLL_FAILURE_THRESHOLD = 3;

  private final MessagingMetrics metrics;
  private final ConsumerLoopFactory loopFactory;

  public MessagingHealthIndicator(MessagingMetrics metrics, ConsumerLoopFactory loopFactory) {
    this.metrics = metrics;
    this.loopFactory = loopFactory;
  }

  @Override
  public Health health() {
    Set<String> stalled = new TreeSet<>(metrics.stalledPartitions());
    Map<String, Object> consumers = new LinkedHashMap<>();
    boolean pollFailing = false;
    for (ConsumerLoop loop : loopFactory.loops()) {
      Map<String, Object> detail = new LinkedHashMap<>();
      detail.put("state", loop.state().name());
      detail.put("committedOffsets", loop.committedOffsets());
      int pollFailures = loop.consecutivePollFailures();
      if (pollFailures > 0) {
        detail.put("consecutivePollFailures", pollFailures);
        loop.lastPollFailure().ifPresent(problem -> detail.put("lastPollFailure", problem.code() + ": " + problem.message()));
      }
      pollFailing |= pollFailures >= POLL_FAILURE_THRESHOLD;
      consumers.put(loop.settings().groupId() + ":" + loop.settings().topic(), detail);
    }

    Health.Builder builder = stalled.isEmpty() && !pollFailing ? Health.up() : Health.down();
    return builder
        .withDetail("stalledPartitions", stalled)
        .withDetail("consumers", consumers)
        .build();
  }
}
