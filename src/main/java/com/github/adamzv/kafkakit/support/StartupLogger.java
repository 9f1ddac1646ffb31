package com.github.adamzv.kafkakit.support;

import com.github.adamzv.kafkakit.domain.DeliveryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;

public class StartupLogger implements ApplicationListener<ApplicationReadyEvent> {

  private static final Logger log = LoggerFactory.getLogger(StartupLogger.class);

  private final KafkaProperties kafkaProperties;
  private final DeliveryPolicy deliveryPolicy;
  private final ConsumerProperties consumerProperties;

  public StartupLogger(KafkaProperties kafkaProperties,
                       DeliveryPolicy deliveryPolicy,
                       ConsumerProperties consumerProperties) {
    this.kafkaProperties = kafkaProperties;
    this.deliveryPolicy = deliveryPolicy;
    this.consumerProperties = consumerProperties;
  }

  @Override
  public void onApplicationEvent(ApplicationReadyEvent event) {
    log.info(
        "messaging_ready bootstrapServers={} securityProtocol={} clientId={} "
            + "delivery={{maxAttempts={}, baseBackoff={}, multiplier={}, maxBackoff={}, perAttemptTimeout={}}} "
            + "consumer={{topic={}, group={}, maxBatch={}, parallelism={}, retryCeiling={}}}",
        kafkaProperties.bootstrapServers(),
        kafkaProperties.securityProtocol(),
        kafkaProperties.clientId(),
        deliveryPolicy.maxAttempts(),
        deliveryPolicy.baseBackoff(),
        deliveryPolicy.multiplier(),
        deliveryPolicy.maxBackoff(),
        deliveryPolicy.perAttemptTimeout(),
        consumerProperties.topic(),
        consumerProperties.groupId(),
        consumerProperties.maxBatch(),
        consumerProperties.parallelism(),
        consumerProperties.retryCeiling()
    );
  }
}
