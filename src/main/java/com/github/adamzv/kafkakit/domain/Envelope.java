package com.github.adamzv.kafkakit.domain;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transport-level form of a message: payload bytes tagged with the message type and schema
 * version the codec used to produce them.
 */
public record Envelope(
    String topic,
    byte[] partitionKey,
    String messageType,
    int schemaVersion,
    byte[] payload,
    Map<String, String> headers
) {

  public static final String SCHEMA_VERSION_HEADER = "x-schema-version";
  public static final String MESSAGE_TYPE_HEADER = "x-message-type";

  public Envelope {
    headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
  }

  public static byte[] keyOf(String key) {
    return key == null ? null : key.getBytes(StandardCharsets.UTF_8);
  }

  public String keyAsString() {
    return partitionKey == null ? null : new String(partitionKey, StandardCharsets.UTF_8);
  }

  public Envelope withTopic(String newTopic) {
    return new Envelope(newTopic, partitionKey, messageType, schemaVersion, payload, headers);
  }

  public Envelope withHeaders(Map<String, String> extraHeaders) {
    Map<String, String> merged = new LinkedHashMap<>(headers);
    merged.putAll(extraHeaders);
    return new Envelope(topic, partitionKey, messageType, schemaVersion, payload, merged);
  }

  /**
   * Headers as written to the wire, including the message type and schema version tags.
   */
  public Map<String, String> wireHeaders() {
    Map<String, String> wire = new LinkedHashMap<>(headers);
    wire.put(MESSAGE_TYPE_HEADER, messageType);
    wire.put(SCHEMA_VERSION_HEADER, Integer.toString(schemaVersion));
    return wire;
  }
}
