package com.github.adamzv.kafkakit.application;

import com.github.adamzv.kafkakit.domain.ConsumedRecord;
import com.github.adamzv.kafkakit.domain.Disposition;
import java.util.List;
import java.util.OptionalLong;

/**
 * Commit decision for one partition's batch: the offset to commit covers only the contiguous
 * prefix of records whose disposition is terminal; the first record outside that prefix is where
 * consumption resumes.
 */
record CommitPlan(
    int partition,
    OptionalLong commitOffset,
    OptionalLong resumeOffset
) {

  static CommitPlan of(int partition, List<ConsumedRecord> records, List<Disposition> dispositions) {
    int prefix = 0;
    while (prefix < dispositions.size() && prefix < records.size() && dispositions.get(prefix).isTerminal()) {
      prefix++;
    }
    OptionalLong commit = prefix == 0
        ? OptionalLong.empty()
        : OptionalLong.of(records.get(prefix - 1).offset() + 1);
    OptionalLong resume = prefix < records.size()
        ? OptionalLong.of(records.get(prefix).offset())
        : OptionalLong.empty();
    return new CommitPlan(partition, commit, resume);
  }

  boolean fullyTerminal() {
    return resumeOffset.isEmpty();
  }
}
