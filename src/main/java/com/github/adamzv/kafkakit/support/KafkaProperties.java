package com.github.adamzv.kafkakit.support;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "kafka")
public record KafkaProperties(
    @NotBlank(message = "kafka.bootstrapServers must not be blank")
    String bootstrapServers,
    @DefaultValue("SSL")
    @NotBlank(message = "kafka.securityProtocol must not be blank")
    String securityProtocol,
    @DefaultValue("kafka-kit")
    String clientId
) {}
