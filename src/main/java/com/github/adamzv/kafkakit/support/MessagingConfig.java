package com.github.adamzv.kafkakit.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.adamzv.kafkakit.adapters.kafka.KafkaProducerAdapter;
import com.github.adamzv.kafkakit.application.MessageCodec;
import com.github.adamzv.kafkakit.application.MessageProducer;
import com.github.adamzv.kafkakit.application.MessagingContext;
import com.github.adamzv.kafkakit.domain.DeliveryPolicy;
import com.github.adamzv.kafkakit.domain.SchemaCatalog;
import com.github.adamzv.kafkakit.ports.ProducerTransportPort;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Properties;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(afterName = {
    "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration",
    "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@ConditionalOnProperty(prefix = "kafka", name = "bootstrap-servers")
@EnableConfigurationProperties({KafkaProperties.class, DeliveryProperties.class, ConsumerProperties.class})
public class MessagingConfig {

  @Bean
  @ConditionalOnMissingBean
  public DeliveryPolicy deliveryPolicy(DeliveryProperties deliveryProperties) {
    return deliveryProperties.toDomain();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public MessagingContext messagingContext(ObjectProvider<MeterRegistry> meterRegistry,
                                           ConsumerProperties consumerProperties) {
    return new MessagingContext(
        meterRegistry.getIfAvailable(SimpleMeterRegistry::new),
        consumerProperties.parallelism()
    );
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Producer<byte[], byte[]> kafkaProducer(KafkaProperties kafkaProperties) {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaProperties.bootstrapServers());
    props.put(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, kafkaProperties.securityProtocol());
    props.put(ProducerConfig.CLIENT_ID_CONFIG, kafkaProperties.clientId());
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
    props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 1);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return new KafkaProducer<>(props);
  }

  @Bean
  @ConditionalOnMissingBean
  public ProducerTransportPort producerTransport(Producer<byte[], byte[]> kafkaProducer,
                                                 KafkaProperties kafkaProperties) {
    return new KafkaProducerAdapter(kafkaProducer, kafkaProperties);
  }

  @Bean
  @ConditionalOnMissingBean
  public MessageCodec messageCodec(ObjectProvider<SchemaCatalog> schemaCatalog,
                                   ObjectProvider<ObjectMapper> objectMapper) {
    return new MessageCodec(
        schemaCatalog.getIfAvailable(() -> SchemaCatalog.builder().build()),
        objectMapper.getIfAvailable(ObjectMapper::new)
    );
  }

  @Bean
  @ConditionalOnMissingBean
  public MessageProducer messageProducer(ProducerTransportPort producerTransport,
                                         MessageCodec messageCodec,
                                         MessagingContext messagingContext,
                                         DeliveryPolicy deliveryPolicy) {
    return new MessageProducer(producerTransport, messageCodec, messagingContext, deliveryPolicy);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public ConsumerLoopFactory consumerLoopFactory(KafkaProperties kafkaProperties,
                                                 ConsumerProperties consumerProperties,
                                                 MessageCodec messageCodec,
                                                 MessageProducer messageProducer,
                                                 DeliveryPolicy deliveryPolicy,
                                                 MessagingContext messagingContext) {
    return new ConsumerLoopFactory(
        kafkaProperties,
        consumerProperties,
        messageCodec,
        messageProducer,
        deliveryPolicy,
        messagingContext
    );
  }

  @Bean
  public MessagingHealthIndicator messagingHealthIndicator(MessagingContext messagingContext,
                                                           ConsumerLoopFactory consumerLoopFactory) {
    return new MessagingHealthIndicator(messagingContext.metrics(), consumerLoopFactory);
  }

  @Bean
  public StartupLogger messagingStartupLogger(KafkaProperties kafkaProperties,
                                              DeliveryPolicy deliveryPolicy,
                                              ConsumerProperties consumerProperties) {
    return new StartupLogger(kafkaProperties, deliveryPolicy, consumerProperties);
  }
}
