package com.github.adamzv.kafkakit.domain;

import java.time.Instant;
import java.util.Map;

/**
 * Record metadata handed to a handler next to the decoded value.
 */
public record RecordContext(
    String topic,
    int partition,
    long offset,
    String key,
    Map<String, String> headers,
    Instant receiveTime,
    int attempt
) {

  public static final String TRACEPARENT_HEADER = "traceparent";
  public static final String TRACESTATE_HEADER = "tracestate";

  public static RecordContext of(ConsumedRecord record, int attempt) {
    Envelope envelope = record.envelope();
    return new RecordContext(
        envelope.topic(),
        record.partition(),
        record.offset(),
        envelope.keyAsString(),
        envelope.headers(),
        record.receiveTime(),
        attempt
    );
  }

  public String traceParent() {
    return headers.get(TRACEPARENT_HEADER);
  }

  public String traceState() {
    return headers.get(TRACESTATE_HEADER);
  }
}
