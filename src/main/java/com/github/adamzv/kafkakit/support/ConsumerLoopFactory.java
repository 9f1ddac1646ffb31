package com.github.adamzv.kafkakit.support;

import com.github.adamzv.kafkakit.adapters.kafka.KafkaConsumerAdapter;
import com.github.adamzv.kafkakit.application.ConsumerLoop;
import com.github.adamzv.kafkakit.application.ErrorRouter;
import com.github.adamzv.kafkakit.application.HandlerRegistry;
import com.github.adamzv.kafkakit.application.MessageCodec;
import com.github.adamzv.kafkakit.application.MessageProducer;
import com.github.adamzv.kafkakit.application.MessagingContext;
import com.github.adamzv.kafkakit.domain.ConsumerSettings;
import com.github.adamzv.kafkakit.domain.DeliveryPolicy;
import com.github.adamzv.kafkakit.domain.Problems;
import com.github.adamzv.kafkakit.ports.ConsumerTransportPort;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds consumer loops backed by their own {@link KafkaConsumer} and keeps track of them so they
 * can be reported on and stopped together.
 */
public class ConsumerLoopFactory implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ConsumerLoopFactory.class);
  private static final Duration STOP_TIMEOUT = Duration.ofSeconds(30);

  private final ConsumerProperties consumerProperties;
  private final MessageCodec codec;
  private final MessageProducer producer;
  private final DeliveryPolicy deadLetterPolicy;
  private final MessagingContext context;
  private final Function<ConsumerSettings, ConsumerTransportPort> transports;
  private final List<ConsumerLoop> loops = new CopyOnWriteArrayList<>();

  public ConsumerLoopFactory(KafkaProperties kafkaProperties,
                             ConsumerProperties consumerProperties,
                             MessageCodec codec,
                             MessageProducer producer,
                             DeliveryPolicy deadLetterPolicy,
                             MessagingContext context) {
    this(consumerProperties, codec, producer, deadLetterPolicy, context,
        settings -> new KafkaConsumerAdapter(
            new KafkaConsumer<>(consumerConfig(kafkaProperties, consumerProperties, settings)),
            kafkaProperties
        ));
  }

  ConsumerLoopFactory(ConsumerProperties consumerProperties,
                      MessageCodec codec,
                      MessageProducer producer,
                      DeliveryPolicy deadLetterPolicy,
                      MessagingContext context,
                      Function<ConsumerSettings, ConsumerTransportPort> transports) {
    this.consumerProperties = consumerProperties;
    this.codec = codec;
    this.producer = producer;
    this.deadLetterPolicy = deadLetterPolicy;
    this.context = context;
    this.transports = transports;
  }

  /**
   * Creates a loop for the configured {@code messaging.consumer.topic}.
   */
  public ConsumerLoop create(HandlerRegistry handlers) {
    String topic = consumerProperties.topic();
    if (topic == null || topic.isBlank()) {
      throw Problems.invalidArgument("messaging.consumer.topic must be set", Map.of());
    }
    return create(consumerProperties.toDomain(topic), handlers);
  }

  public ConsumerLoop create(ConsumerSettings settings, HandlerRegistry handlers) {
    ErrorRouter router = new ErrorRouter(producer, settings, deadLetterPolicy, context);
    ConsumerLoop loop = new ConsumerLoop(transports.apply(settings), codec, handlers, router, settings, context);
    loops.add(loop);
    log.info(
        "consumer_loop_created topic={} group={} parallelism={} deadLetterTopic={}",
        settings.topic(),
        settings.groupId(),
        settings.parallelism(),
        settings.deadLetterTopic()
    );
    return loop;
  }

  public List<ConsumerLoop> loops() {
    return List.copyOf(loops);
  }

  @Override
  public void close() {
    loops.forEach(ConsumerLoop::stop);
    for (ConsumerLoop loop : loops) {
      try {
        if (!loop.awaitTermination(STOP_TIMEOUT)) {
          log.warn("consumer_loop_stop outcome=timeout topic={}", loop.settings().topic());
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return;
      }
    }
  }

  static Properties consumerConfig(KafkaProperties kafkaProperties,
                                   ConsumerProperties consumerProperties,
                                   ConsumerSettings settings) {
    Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaProperties.bootstrapServers());
    props.put(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, kafkaProperties.securityProtocol());
    props.put(ConsumerConfig.CLIENT_ID_CONFIG, kafkaProperties.clientId() + "-" + settings.topic());
    props.put(ConsumerConfig.GROUP_ID_CONFIG, settings.groupId());
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, consumerProperties.autoOffsetReset());
    props.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG,
        Math.toIntExact(consumerProperties.sessionTimeout().toMillis()));
    props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, settings.maxBatch());
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    return props;
  }
}
