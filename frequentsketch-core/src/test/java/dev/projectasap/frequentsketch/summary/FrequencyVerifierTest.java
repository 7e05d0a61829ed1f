/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.summary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class FrequencyVerifierTest {

  @Test
  void thresholdDividesByKPlusOne() {
    assertThat(FrequencyVerifier.threshold(7, 3)).isEqualTo(1);
    assertThat(FrequencyVerifier.threshold(100, 4)).isEqualTo(20);
    assertThat(FrequencyVerifier.threshold(6, 2)).isEqualTo(2);
    assertThat(FrequencyVerifier.majorityThreshold(6)).isEqualTo(3);
    assertThat(FrequencyVerifier.majorityThreshold(5)).isEqualTo(2);
  }

  @Test
  void keepsOnlyCandidatesAboveThreshold() {
    List<Integer> sequence = List.of(1, 1, 1, 2, 2, 2, 3);

    ImmutableMap<Integer, Long> verified = FrequencyVerifier.verify(sequence, Set.of(1, 2, 3), 3);

    assertThat(verified).containsOnly(entry(1, 3L), entry(2, 3L));
  }

  @Test
  void ignoresElementsOutsideTheCandidateSet() {
    List<Integer> sequence = List.of(1, 1, 1, 2, 2, 2, 3);

    ImmutableMap<Integer, Long> verified = FrequencyVerifier.verify(sequence, Set.of(2), 3);

    assertThat(verified).containsExactly(entry(2, 3L));
  }

  @Test
  void rejectsSpuriousCandidate() {
    // 4 survives the summary pass with k=3 but occurs only once
    List<Integer> sequence = List.of(1, 2, 3, 4, 5, 5);

    assertThat(FrequencyVerifier.verify(sequence, Set.of(4, 5), 3)).containsExactly(entry(5, 2L));
  }

  @Test
  void emptySequenceFailsBeforeCounting() {
    assertThatThrownBy(() -> FrequencyVerifier.verify(List.of(), Set.of(1), 2))
        .isInstanceOf(EmptyInputException.class);
    assertThatThrownBy(() -> FrequencyVerifier.verifyAbove(List.of(), Set.of(1), 0))
        .isInstanceOf(EmptyInputException.class);
  }

  @Test
  void rejectsInvalidArguments() {
    assertThatThrownBy(() -> FrequencyVerifier.verify(List.of(1), Set.of(1), 0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> FrequencyVerifier.verifyAbove(List.of(1), Set.of(1), -1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void exactCountsReportsAbsentCandidatesAsZero() {
    assertThat(FrequencyVerifier.exactCounts(List.of("a", "a", "b"), List.of("a", "z")))
        .containsExactly(entry("a", 2L), entry("z", 0L));
  }

  @Test
  void repeatedVerificationIsDeterministic() {
    List<Integer> sequence = FrequencySummaryTest.randomSequence(new Random(5L), 300, 6);
    Set<Integer> candidates = Set.of(0, 1, 2, 3);

    ImmutableMap<Integer, Long> first = FrequencyVerifier.verify(sequence, candidates, 4);
    ImmutableMap<Integer, Long> second = FrequencyVerifier.verify(sequence, candidates, 4);

    assertThat(second).isEqualTo(first);
    assertThat(sequence).hasSize(300);
  }

  @ParameterizedTest
  @EnumSource(EvictionPolicy.class)
  void neverReportsElementAtOrBelowThreshold(EvictionPolicy policy) {
    Random random = new Random(19L);
    for (int trial = 0; trial < 200; trial++) {
      int k = 1 + random.nextInt(8);
      int n = 1 + random.nextInt(400);
      int distinct = 1 + random.nextInt(12);
      List<Integer> sequence = FrequencySummaryTest.randomSequence(random, n, distinct);
      Map<Integer, Long> exact = FrequencySummaryTest.exactCounts(sequence);

      FrequencySummary<Integer> summary = FrequencySummary.fromSequence(sequence, k, policy);
      ImmutableMap<Integer, Long> verified =
          FrequencyVerifier.verify(sequence, summary.candidates(), k);

      for (Map.Entry<Integer, Long> result : verified.entrySet()) {
        assertThat(result.getValue()).isGreaterThan(FrequencyVerifier.threshold(n, k));
        assertThat(result.getValue()).isEqualTo(exact.get(result.getKey()));
      }
    }
  }
}
