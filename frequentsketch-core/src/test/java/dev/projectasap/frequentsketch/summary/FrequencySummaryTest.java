/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.summary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class FrequencySummaryTest {

  @ParameterizedTest
  @EnumSource(EvictionPolicy.class)
  void rejectsCapacityBelowOne(EvictionPolicy policy) {
    assertThatThrownBy(() -> new FrequencySummary<Integer>(0, policy))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("k (0)");
    assertThatThrownBy(() -> new FrequencySummary<Integer>(-3, policy))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @ParameterizedTest
  @EnumSource(EvictionPolicy.class)
  void capacityOneRetainsNothing(EvictionPolicy policy) {
    FrequencySummary<Integer> summary =
        FrequencySummary.fromSequence(List.of(7, 7, 7, 7, 1), 1, policy);

    assertThat(summary.capacity()).isZero();
    assertThat(summary.candidates()).isEmpty();
    assertThat(summary.observedCount()).isEqualTo(5);
    assertThat(summary.fightCount()).isEqualTo(5);
  }

  @ParameterizedTest
  @EnumSource(EvictionPolicy.class)
  void majorityVoteCancelsTiedElements(EvictionPolicy policy) {
    FrequencySummary<Integer> summary =
        FrequencySummary.fromSequence(List.of(1, 1, 2, 2, 1, 2), 2, policy);

    assertThat(summary.candidates()).isEmpty();
  }

  @ParameterizedTest
  @EnumSource(EvictionPolicy.class)
  void majorityVoteKeepsMajorityCandidate(EvictionPolicy policy) {
    FrequencySummary<Integer> summary =
        FrequencySummary.fromSequence(List.of(1, 1, 1, 2, 2), 2, policy);

    assertThat(summary.candidateCounts()).containsExactly(entry(1, 1L));
  }

  @ParameterizedTest
  @EnumSource(EvictionPolicy.class)
  void fightDecrementsEveryCandidate(EvictionPolicy policy) {
    FrequencySummary<Integer> summary =
        FrequencySummary.fromSequence(List.of(1, 1, 1, 2, 2, 2, 3), 3, policy);

    assertThat(summary.candidateCounts()).containsOnly(entry(1, 2L), entry(2, 2L));
    assertThat(summary.estimate(3)).isZero();
    assertThat(summary.fightCount()).isEqualTo(1);
  }

  @Test
  void groupDecrementEvictsEveryExhaustedCandidate() {
    FrequencySummary<String> summary =
        FrequencySummary.fromSequence(List.of("a", "b", "c"), 3, EvictionPolicy.GROUP_DECREMENT);

    assertThat(summary.candidates()).isEmpty();
  }

  @Test
  void singleEvictKeepsLaterExhaustedCandidates() {
    FrequencySummary<String> summary =
        FrequencySummary.fromSequence(List.of("a", "b", "c"), 3, EvictionPolicy.SINGLE_EVICT);

    assertThat(summary.candidateCounts()).containsExactly(entry("b", 0L));
  }

  @Test
  void singleEvictReclaimsZeroCountSlotWithoutFighting() {
    FrequencySummary<String> summary = new FrequencySummary<>(3, EvictionPolicy.SINGLE_EVICT);
    summary.observeAll(List.of("a", "b", "c", "d"));
    assertThat(summary.candidateCounts()).containsOnly(entry("b", 0L), entry("d", 1L));

    summary.observe("e");

    assertThat(summary.candidateCounts()).containsOnly(entry("e", 1L), entry("d", 1L));
    assertThat(summary.fightCount()).isEqualTo(1);
  }

  @ParameterizedTest
  @EnumSource(EvictionPolicy.class)
  void fromSequenceMatchesManualObservation(EvictionPolicy policy) {
    List<Integer> sequence = randomSequence(new Random(11L), 500, 20);
    FrequencySummary<Integer> manual = new FrequencySummary<>(5, policy);
    for (Integer element : sequence) {
      manual.observe(element);
    }

    FrequencySummary<Integer> batch = FrequencySummary.fromSequence(sequence, 5, policy);

    assertThat(batch.candidateCounts()).isEqualTo(manual.candidateCounts());
    assertThat(batch.fightCount()).isEqualTo(manual.fightCount());
  }

  @ParameterizedTest
  @EnumSource(EvictionPolicy.class)
  void neverTracksMoreThanCapacity(EvictionPolicy policy) {
    Random random = new Random(3L);
    for (int k = 1; k <= 8; k++) {
      FrequencySummary<Integer> summary = new FrequencySummary<>(k, policy);
      for (Integer element : randomSequence(random, 400, 30)) {
        summary.observe(element);
        assertThat(summary.size()).isLessThanOrEqualTo(k - 1);
        assertThat(summary.candidates()).hasSizeLessThanOrEqualTo(k - 1);
      }
    }
  }

  @ParameterizedTest
  @EnumSource(EvictionPolicy.class)
  void retainsEveryElementAboveFloorNOverK(EvictionPolicy policy) {
    Random random = new Random(42L);
    for (int trial = 0; trial < 200; trial++) {
      int k = 2 + random.nextInt(9);
      int n = 50 + random.nextInt(500);
      List<Integer> sequence = plantedSequence(random, n, k);

      FrequencySummary<Integer> summary = FrequencySummary.fromSequence(sequence, k, policy);

      for (Map.Entry<Integer, Long> exact : exactCounts(sequence).entrySet()) {
        if (exact.getValue() > n / k) {
          assertThat(summary.candidates())
              .as("k=%d n=%d trial=%d", k, n, trial)
              .contains(exact.getKey());
        }
      }
    }
  }

  @ParameterizedTest
  @EnumSource(EvictionPolicy.class)
  void estimatesStayWithinErrorBound(EvictionPolicy policy) {
    Random random = new Random(7L);
    for (int trial = 0; trial < 50; trial++) {
      int k = 2 + random.nextInt(6);
      List<Integer> sequence = plantedSequence(random, 300, k);

      FrequencySummary<Integer> summary = FrequencySummary.fromSequence(sequence, k, policy);

      assertThat(summary.fightCount()).isLessThanOrEqualTo(sequence.size() / k);
      for (Map.Entry<Integer, Long> exact : exactCounts(sequence).entrySet()) {
        long estimate = summary.estimate(exact.getKey());
        assertThat(estimate).isLessThanOrEqualTo(exact.getValue());
        assertThat(estimate).isGreaterThanOrEqualTo(exact.getValue() - summary.fightCount());
      }
    }
  }

  @Test
  void candidatesAreASnapshot() {
    FrequencySummary<String> summary = new FrequencySummary<>(3);
    summary.observe("a");
    ImmutableSet<String> before = summary.candidates();

    summary.observe("b");

    assertThat(before).containsExactly("a");
    assertThat(summary.candidates()).containsExactlyInAnyOrder("a", "b");
  }

  @Test
  void hugeCapacityOnlyAllocatesForTrackedElements() {
    FrequencySummary<String> summary = new FrequencySummary<>(Integer.MAX_VALUE);
    summary.observeAll(List.of("a", "b", "a"));

    assertThat(summary.capacity()).isEqualTo(Integer.MAX_VALUE - 1);
    assertThat(summary.candidateCounts()).containsExactly(entry("a", 2L), entry("b", 1L));
    assertThat(summary.fightCount()).isZero();
  }

  @Test
  void rejectsNullElements() {
    FrequencySummary<String> summary = new FrequencySummary<>(3);

    assertThatThrownBy(() -> summary.observe(null)).isInstanceOf(NullPointerException.class);
    assertThat(summary.observedCount()).isZero();
  }

  static List<Integer> randomSequence(Random random, int n, int distinct) {
    List<Integer> sequence = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      sequence.add(random.nextInt(distinct));
    }
    return sequence;
  }

  /** Random sequence with one element (-1) planted just above floor(n/k) times, then shuffled. */
  static List<Integer> plantedSequence(Random random, int n, int k) {
    int planted = n / k + 1;
    List<Integer> sequence = new ArrayList<>(n);
    for (int i = 0; i < planted; i++) {
      sequence.add(-1);
    }
    int distinct = 1 + random.nextInt(4 * k);
    while (sequence.size() < n) {
      sequence.add(random.nextInt(distinct));
    }
    Collections.shuffle(sequence, random);
    return sequence;
  }

  static Map<Integer, Long> exactCounts(List<Integer> sequence) {
    Map<Integer, Long> counts = new HashMap<>();
    for (Integer element : sequence) {
      counts.merge(element, 1L, Long::sum);
    }
    return counts;
  }
}
