package com.github.adamzv.kafkakit.ports;

import com.github.adamzv.kafkakit.domain.ConsumedRecord;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Consumer side of the broker client. Not thread-safe: every method except {@link #wakeup()}
 * must be called from the thread that owns the consumer loop.
 */
public interface ConsumerTransportPort extends AutoCloseable {

  void subscribe(String topic, RebalanceListener listener);

  /**
   * Returns at most {@code maxBatch} records, ordered by offset within each partition. Returns an
   * empty list when woken up.
   */
  List<ConsumedRecord> poll(int maxBatch, Duration timeout);

  /**
   * Commits, per partition, the offset of the next record to read.
   */
  void commit(String topic, Map<Integer, Long> nextOffsets);

  /**
   * Moves the fetch position of a partition back so {@code offset} is delivered again.
   */
  void rewind(String topic, int partition, long offset);

  void wakeup();

  @Override
  void close();

  interface RebalanceListener {

    void onPartitionsRevoked(Collection<Integer> partitions);

    void onPartitionsAssigned(Collection<Integer> partitions);
  }
}
