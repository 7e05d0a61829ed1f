/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.summary;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import java.util.Collection;
import java.util.Iterator;
import java.util.Set;

/**
 * Two-pass frequent elements queries: a {@link FrequencySummary} pass producing candidates, then a
 * {@link FrequencyVerifier} pass confirming them. The sequence must be re-iterable.
 */
public final class FrequentElements {

  private FrequentElements() {}

  /**
   * Elements occurring more than {@code floor(n/(k+1))} times, as far as the summary retains them.
   * Every element occurring more than {@code floor(n/k)} times is always included.
   *
   * @return the verified elements, possibly empty
   * @throws EmptyInputException if {@code sequence} is empty
   * @throws IllegalArgumentException if {@code k < 1}
   */
  public static <T> Set<T> mostFrequent(Iterable<? extends T> sequence, int k) {
    return mostFrequent(sequence, k, EvictionPolicy.GROUP_DECREMENT);
  }

  public static <T> Set<T> mostFrequent(
      Iterable<? extends T> sequence, int k, EvictionPolicy policy) {
    return FrequentElements.<T>verifiedPasses(sequence, k, policy).counts.keySet();
  }

  /** Like {@link #mostFrequent(Iterable, int)}, paired with the exact counts. */
  public static <T> ImmutableMap<T, Long> frequentCounts(Iterable<? extends T> sequence, int k) {
    return frequentCounts(sequence, k, EvictionPolicy.GROUP_DECREMENT);
  }

  public static <T> ImmutableMap<T, Long> frequentCounts(
      Iterable<? extends T> sequence, int k, EvictionPolicy policy) {
    return FrequentElements.<T>verifiedPasses(sequence, k, policy).counts;
  }

  /**
   * Like {@link #mostFrequent(Iterable, int)} but treats an empty result as a failure.
   *
   * @throws NoFrequentElementsException if no element passes verification
   */
  public static <T> Set<T> requireMostFrequent(Iterable<? extends T> sequence, int k) {
    return requireMostFrequent(sequence, k, EvictionPolicy.GROUP_DECREMENT);
  }

  public static <T> Set<T> requireMostFrequent(
      Iterable<? extends T> sequence, int k, EvictionPolicy policy) {
    Verified<T> verified = verifiedPasses(sequence, k, policy);
    if (verified.counts.isEmpty()) {
      throw new NoFrequentElementsException(
          verified.sequenceLength, FrequencyVerifier.threshold(verified.sequenceLength, k));
    }
    return verified.counts.keySet();
  }

  /**
   * Boyer-Moore majority vote: the element occurring more than {@code floor(n/2)} times.
   *
   * @throws EmptyInputException if {@code sequence} is empty
   * @throws NoMajorityElementException if no element has a strict majority
   */
  public static <T> T majorityElement(Iterable<? extends T> sequence) {
    Preconditions.checkNotNull(sequence, "sequence");

    FrequencySummary<T> summary = summarize(sequence, 2, EvictionPolicy.GROUP_DECREMENT);
    long n = summary.observedCount();
    ImmutableMap<T, Long> verified =
        FrequencyVerifier.verifyAbove(
            sequence, summary.candidates(), FrequencyVerifier.majorityThreshold(n));
    if (verified.isEmpty()) {
      throw new NoMajorityElementException(n);
    }
    return Iterables.getOnlyElement(verified.keySet());
  }

  /** One summary pass and one verification pass over {@code sequence}. */
  private static <T> Verified<T> verifiedPasses(
      Iterable<? extends T> sequence, int k, EvictionPolicy policy) {
    Preconditions.checkNotNull(sequence, "sequence");
    if (k < 1) {
      throw new IllegalArgumentException("k (" + k + ") must be at least 1");
    }

    Set<T> candidates;
    long n;
    if (sequence instanceof Collection && k > ((Collection<?>) sequence).size()) {
      // k - 1 slots hold every distinct element, so the summary would never fight
      if (((Collection<?>) sequence).isEmpty()) {
        throw new EmptyInputException();
      }
      n = ((Collection<?>) sequence).size();
      candidates = ImmutableSet.copyOf(sequence);
    } else {
      FrequencySummary<T> summary = summarize(sequence, k, policy);
      n = summary.observedCount();
      candidates = summary.candidates();
    }
    ImmutableMap<T, Long> counts = FrequencyVerifier.verify(sequence, candidates, k);
    return new Verified<>(counts, n);
  }

  /** Summary pass that rejects an empty sequence before the summary is built. */
  private static <T> FrequencySummary<T> summarize(
      Iterable<? extends T> sequence, int k, EvictionPolicy policy) {
    Iterator<? extends T> elements = sequence.iterator();
    if (!elements.hasNext()) {
      throw new EmptyInputException();
    }
    FrequencySummary<T> summary = new FrequencySummary<>(k, policy);
    while (elements.hasNext()) {
      summary.observe(elements.next());
    }
    return summary;
  }

  private static final class Verified<T> {
    final ImmutableMap<T, Long> counts;
    final long sequenceLength;

    Verified(ImmutableMap<T, Long> counts, long sequenceLength) {
      this.counts = counts;
      this.sequenceLength = sequenceLength;
    }
  }
}
