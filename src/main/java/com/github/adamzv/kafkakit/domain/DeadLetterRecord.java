package com.github.adamzv.kafkakit.domain;

import java.util.LinkedHashMap;
import java.util.Map;

public record DeadLetterRecord(
    ConsumedRecord original,
    Problem failureReason,
    int failureCount
) {

  public static final String ORIGINAL_TOPIC_HEADER = "x-dlt-original-topic";
  public static final String ORIGINAL_PARTITION_HEADER = "x-dlt-original-partition";
  public static final String ORIGINAL_OFFSET_HEADER = "x-dlt-original-offset";
  public static final String REASON_HEADER = "x-dlt-reason";
  public static final String ERROR_CODE_HEADER = "x-dlt-error-code";
  public static final String FAILURE_COUNT_HEADER = "x-dlt-failure-count";

  /**
   * Envelope to publish on the dead-letter topic. Key and payload are kept as received so the
   * record can be replayed.
   */
  public Envelope toEnvelope(String deadLetterTopic) {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put(ORIGINAL_TOPIC_HEADER, original.topic());
    headers.put(ORIGINAL_PARTITION_HEADER, Integer.toString(original.partition()));
    headers.put(ORIGINAL_OFFSET_HEADER, Long.toString(original.offset()));
    headers.put(ERROR_CODE_HEADER, failureReason.code());
    headers.put(REASON_HEADER, failureReason.message() == null ? "" : failureReason.message());
    headers.put(FAILURE_COUNT_HEADER, Integer.toString(failureCount));
    return original.envelope().withTopic(deadLetterTopic).withHeaders(headers);
  }
}
