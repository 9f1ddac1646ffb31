package com.github.adamzv.kafkakit.ports;

import com.github.adamzv.kafkakit.domain.TransportReceipt;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

public interface ProducerTransportPort {

  /**
   * Hands one record to the broker. The key is forwarded untouched; a {@code null} key stays
   * {@code null}. Failures complete the future with a {@code TRANSPORT_ERROR} problem.
   */
  CompletableFuture<TransportReceipt> produce(String topic,
                                             byte[] key,
                                             byte[] value,
                                             Map<String, String> headers,
                                             Duration timeout);

  /**
   * Blocks until every record handed to {@link #produce} so far has been acknowledged or failed.
   */
  void flush();
}
