package com.github.adamzv.kafkakit.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.github.adamzv.kafkakit.domain.Envelope;
import com.github.adamzv.kafkakit.domain.Problems;
import com.github.adamzv.kafkakit.domain.SchemaCatalog;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Converts typed values to and from {@link Envelope}s using JSON payloads and the versions
 * registered in a {@link SchemaCatalog}. Stateless apart from its configuration.
 */
public class MessageCodec {

  private final SchemaCatalog catalog;
  private final ObjectMapper objectMapper;

  public MessageCodec(SchemaCatalog catalog, ObjectMapper objectMapper) {
    this.catalog = catalog;
    this.objectMapper = objectMapper.copy()
        .findAndRegisterModules()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
        .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true)
        .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true)
        .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, true)
        .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
  }

  public Envelope encode(String topic, String key, Object value) {
    return encode(topic, key, value, Map.of());
  }

  public Envelope encode(String topic, String key, Object value, Map<String, String> headers) {
    if (value == null) {
      throw Problems.schemaError("Cannot encode a null value", Map.of("topic", String.valueOf(topic)));
    }
    SchemaCatalog.Entry entry = catalog.latestFor(value.getClass())
        .orElseThrow(() -> Problems.schemaError(
            "Type is not registered in the schema catalog",
            Map.of("type", value.getClass().getName())
        ));

    JsonNode tree;
    try {
      tree = objectMapper.valueToTree(value);
    } catch (IllegalArgumentException ex) {
      throw Problems.schemaError(
          "Value cannot be represented in the wire schema",
          context(entry, ex),
          ex
      );
    }
    if (tree == null || !tree.isObject()) {
      throw Problems.schemaError("Value must serialize to a JSON object", context(entry, null));
    }
    requireFields(entry, tree);

    byte[] payload;
    try {
      payload = objectMapper.writeValueAsBytes(tree);
    } catch (JsonProcessingException ex) {
      throw Problems.schemaError("Value cannot be written as JSON", context(entry, ex), ex);
    }
    return new Envelope(topic, Envelope.keyOf(key), entry.messageType(), entry.version(), payload, headers);
  }

  /**
   * Decodes the payload into {@code expectedType}. Either a fully built value is returned or a
   * {@code SCHEMA_ERROR} / {@code VERSION_MISMATCH} problem is thrown.
   */
  public <T> T decode(Envelope envelope, Class<T> expectedType) {
    SchemaCatalog.Entry entry = catalog.lookup(envelope.messageType(), envelope.schemaVersion())
        .orElseThrow(() -> Problems.schemaError(
            "Unrecognized schema version",
            Map.of(
                "messageType", String.valueOf(envelope.messageType()),
                "version", envelope.schemaVersion()
            )
        ));

    if (!expectedType.isAssignableFrom(entry.javaType())) {
      throw Problems.versionMismatch(
          "Schema version is not compatible with the expected type",
          Map.of(
              "messageType", entry.messageType(),
              "version", entry.version(),
              "registeredType", entry.javaType().getName(),
              "expectedType", expectedType.getName()
          )
      );
    }

    byte[] payload = envelope.payload();
    if (payload == null || payload.length == 0) {
      throw Problems.schemaError("Payload is empty", context(entry, null));
    }

    try {
      JsonNode tree = objectMapper.readTree(payload);
      if (tree == null || !tree.isObject()) {
        throw Problems.schemaError("Payload is not a JSON object", context(entry, null));
      }
      requireFields(entry, tree);
      Object value = objectMapper.treeToValue(tree, entry.javaType());
      return expectedType.cast(value);
    } catch (IOException ex) {
      throw Problems.schemaError("Payload does not match the wire schema", context(entry, ex), ex);
    }
  }

  private void requireFields(SchemaCatalog.Entry entry, JsonNode tree) {
    for (String field : entry.requiredFields()) {
      JsonNode node = tree.get(field);
      if (node == null || node.isNull()) {
        Map<String, Object> details = context(entry, null);
        details.put("field", field);
        throw Problems.schemaError("Missing required field", details);
      }
    }
  }

  private Map<String, Object> context(SchemaCatalog.Entry entry, Exception cause) {
    Map<String, Object> details = new HashMap<>();
    details.put("messageType", entry.messageType());
    details.put("version", entry.version());
    if (cause != null) {
      details.put("error", cause.getClass().getSimpleName());
      if (cause instanceof JsonProcessingException json && json.getOriginalMessage() != null) {
        details.put("message", json.getOriginalMessage());
      } else if (cause.getMessage() != null) {
        details.put("message", cause.getMessage());
      }
    }
    return details;
  }
}
