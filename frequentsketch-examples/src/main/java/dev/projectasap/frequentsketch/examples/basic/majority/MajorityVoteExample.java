/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.examples.basic.majority;

import com.google.common.collect.ImmutableList;
import dev.projectasap.frequentsketch.summary.FrequencySummary;
import dev.projectasap.frequentsketch.summary.FrequentElements;
import dev.projectasap.frequentsketch.summary.NoMajorityElementException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plain Java example of Boyer-Moore majority vote and its generalization, without Flink. Shows a
 * verified majority, a tie that has none, and the k-frequent query on the same data.
 */
public class MajorityVoteExample {
  private static final Logger LOG = LoggerFactory.getLogger(MajorityVoteExample.class);

  public static void main(String[] args) {
    List<String> votes = ImmutableList.of("red", "blue", "red", "green", "red", "red", "blue");
    LOG.info("Majority of {}: {}", votes, FrequentElements.majorityElement(votes));

    List<String> tied = ImmutableList.of("red", "blue", "red", "blue");
    try {
      FrequentElements.majorityElement(tied);
    } catch (NoMajorityElementException e) {
      LOG.info("{} (threshold {})", e.getMessage(), e.getThreshold());
    }

    // The summary alone can propose a spurious candidate
    List<Integer> readings = ImmutableList.of(1, 2, 3, 4, 5, 5);
    FrequencySummary<Integer> summary = FrequencySummary.fromSequence(readings, 3);
    LOG.info(
        "Candidates for k=3: {} after {} fights", summary.candidateCounts(), summary.fightCount());
    LOG.info("Verified for k=3: {}", FrequentElements.frequentCounts(readings, 3));
  }
}
