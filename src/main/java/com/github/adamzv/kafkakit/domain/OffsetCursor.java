package com.github.adamzv.kafkakit.domain;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Last committed offset per partition for one consumer group member. Only the consumer loop
 * thread touches it, so it is not synchronized.
 *
 * <p>Values follow Kafka's convention: the stored number is the offset of the next record to
 * read, i.e. one past the last record whose disposition is final.
 */
public final class OffsetCursor {

  private final Map<Integer, Long> committed = new TreeMap<>();

  public Optional<Long> committed(int partition) {
    return Optional.ofNullable(committed.get(partition));
  }

  /**
   * Records a commit. Commits never move a partition backwards.
   *
   * @return true if the cursor advanced
   */
  public boolean advance(int partition, long nextOffset) {
    Long current = committed.get(partition);
    if (current != null && current >= nextOffset) {
      return false;
    }
    committed.put(partition, nextOffset);
    return true;
  }

  public void forget(Collection<Integer> partitions) {
    partitions.forEach(committed::remove);
  }

  public Map<Integer, Long> snapshot() {
    return Map.copyOf(committed);
  }
}
