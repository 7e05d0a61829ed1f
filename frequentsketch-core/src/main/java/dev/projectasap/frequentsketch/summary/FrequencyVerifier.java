/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.summary;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.function.LongUnaryOperator;

/**
 * Exact counting pass that confirms or rejects the candidates of a {@link FrequencySummary}. Only
 * candidates are counted, so one pass over the sequence costs O(n) time and O(candidates) space.
 *
 * <p>All methods are pure: the sequence is only iterated, never modified, and nothing is retained
 * between calls.
 */
public final class FrequencyVerifier {

  private FrequencyVerifier() {}

  /**
   * Threshold for the generalized case. The divisor is {@code k + 1}, not {@code k}.
   *
   * @param n sequence length
   * @param k capacity parameter of the summary that produced the candidates
   * @return {@code floor(n / (k + 1))}
   */
  public static long threshold(long n, int k) {
    if (k < 1) {
      throw new IllegalArgumentException("k (" + k + ") must be at least 1");
    }
    return n / (k + 1L);
  }

  /** Threshold for plain majority vote, {@code floor(n / 2)}. */
  public static long majorityThreshold(long n) {
    return n / 2;
  }

  /**
   * Counts every candidate in {@code sequence} and keeps those occurring more than {@code
   * floor(n/(k+1))} times.
   *
   * @param sequence the full original sequence, re-iterable
   * @param candidates candidates from the summary
   * @param k capacity parameter
   * @return candidate to exact count, only for candidates above the threshold
   * @throws EmptyInputException if {@code sequence} is empty
   * @throws IllegalArgumentException if {@code k < 1}
   */
  public static <T> ImmutableMap<T, Long> verify(
      Iterable<? extends T> sequence, Collection<? extends T> candidates, int k) {
    if (k < 1) {
      throw new IllegalArgumentException("k (" + k + ") must be at least 1");
    }
    return countAndFilter(sequence, candidates, n -> threshold(n, k));
  }

  /**
   * Counts every candidate in {@code sequence} and keeps those occurring more than {@code
   * threshold} times.
   *
   * @throws EmptyInputException if {@code sequence} is empty
   */
  public static <T> ImmutableMap<T, Long> verifyAbove(
      Iterable<? extends T> sequence, Collection<? extends T> candidates, long threshold) {
    Preconditions.checkArgument(threshold >= 0, "threshold (%s) must not be negative", threshold);
    return countAndFilter(sequence, candidates, n -> threshold);
  }

  /**
   * Exact counts of {@code candidates} in {@code sequence}, without filtering.
   *
   * @throws EmptyInputException if {@code sequence} is empty
   */
  public static <T> ImmutableMap<T, Long> exactCounts(
      Iterable<? extends T> sequence, Collection<? extends T> candidates) {
    return countAndFilter(sequence, candidates, n -> -1L);
  }

  private static <T> ImmutableMap<T, Long> countAndFilter(
      Iterable<? extends T> sequence,
      Collection<? extends T> candidates,
      LongUnaryOperator thresholdFunction) {
    Preconditions.checkNotNull(sequence, "sequence");
    Preconditions.checkNotNull(candidates, "candidates");
    Iterator<? extends T> elements = sequence.iterator();
    if (!elements.hasNext()) {
      throw new EmptyInputException();
    }

    Map<T, Long> exactCounts = new HashMap<>();
    for (T candidate : candidates) {
      exactCounts.put(candidate, 0L);
    }

    long n = 0;
    while (elements.hasNext()) {
      T element = elements.next();
      n++;
      // Elements that are not candidates are skipped
      exactCounts.computeIfPresent(element, (key, count) -> count + 1);
    }

    long threshold = thresholdFunction.applyAsLong(n);
    ImmutableMap.Builder<T, Long> verified = ImmutableMap.builder();
    for (T candidate : candidates) {
      long count = exactCounts.get(candidate);
      if (count > threshold) {
        verified.put(candidate, count);
      }
    }
    return verified.buildKeepingLast();
  }
}
