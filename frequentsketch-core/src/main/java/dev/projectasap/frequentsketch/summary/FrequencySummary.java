/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.summary;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Misra-Gries frequent elements summary. Tracks at most {@code k - 1} candidates with approximate
 * counts and guarantees that every element occurring more than {@code floor(n/k)} times in the
 * observed stream is a candidate once the stream ends. Candidates may be spurious and must be
 * confirmed with {@link FrequencyVerifier}.
 *
 * <p>With {@code k = 2} this is Boyer-Moore majority vote. With {@code k = 1} the capacity is zero
 * and no element is ever retained.
 *
 * <p>Elements are compared with {@code equals}/{@code hashCode}; {@code null} is rejected. Not
 * thread-safe.
 *
 * @param <T> element type
 */
public class FrequencySummary<T> {
  private static final Logger LOG = LoggerFactory.getLogger(FrequencySummary.class);

  private final int k;
  private final EvictionPolicy policy;
  private final BoundedCounterMap<T> counters;
  private long observedCount;
  private long fightCount;

  /**
   * Creates an empty summary using {@link EvictionPolicy#GROUP_DECREMENT}.
   *
   * @param k capacity parameter, at least 1
   * @throws IllegalArgumentException if {@code k < 1}
   */
  public FrequencySummary(int k) {
    this(k, EvictionPolicy.GROUP_DECREMENT);
  }

  /**
   * Creates an empty summary.
   *
   * @param k capacity parameter, at least 1
   * @param policy what to do when a full summary meets an untracked element
   * @throws IllegalArgumentException if {@code k < 1}
   */
  public FrequencySummary(int k, EvictionPolicy policy) {
    if (k < 1) {
      throw new IllegalArgumentException("k (" + k + ") must be at least 1");
    }
    this.k = k;
    this.policy = Preconditions.checkNotNull(policy, "policy");
    this.counters = new BoundedCounterMap<>(k - 1);
    this.observedCount = 0;
    this.fightCount = 0;
  }

  /** Builds a summary of {@code elements} using {@link EvictionPolicy#GROUP_DECREMENT}. */
  public static <T> FrequencySummary<T> fromSequence(Iterable<? extends T> elements, int k) {
    return fromSequence(elements, k, EvictionPolicy.GROUP_DECREMENT);
  }

  /** Builds a summary by observing every element of {@code elements} in order. */
  public static <T> FrequencySummary<T> fromSequence(
      Iterable<? extends T> elements, int k, EvictionPolicy policy) {
    FrequencySummary<T> summary = new FrequencySummary<>(k, policy);
    summary.observeAll(elements);
    return summary;
  }

  /**
   * Feeds the next element of the stream.
   *
   * @param element the element, not null
   */
  public void observe(T element) {
    Preconditions.checkNotNull(element, "element");
    observedCount++;

    if (counters.increment(element)) {
      return;
    }
    if (!counters.isFull()) {
      counters.insert(element, 1L);
      return;
    }

    // A zero-count slot left behind by SINGLE_EVICT is free space
    int zeroSlot = counters.firstZeroSlot();
    if (zeroSlot >= 0) {
      counters.replace(zeroSlot, element, 1L);
      return;
    }

    fightCount++;
    int evicted = policy.fight(counters);
    if (LOG.isDebugEnabled()) {
      LOG.debug(
          "Fight #{} at element {} evicted {} of {} candidates ({})",
          fightCount,
          observedCount,
          evicted,
          counters.capacity(),
          policy);
    }
  }

  /** Feeds every element of {@code elements} in iteration order. */
  public void observeAll(Iterable<? extends T> elements) {
    for (T element : elements) {
      observe(element);
    }
  }

  /**
   * Returns the tracked elements. Only meaningful as the candidate set once the whole stream has
   * been observed.
   *
   * @return an immutable snapshot with at most {@code k - 1} elements
   */
  public ImmutableSet<T> candidates() {
    return counters.snapshot().keySet();
  }

  /** Tracked elements with their retained counts, in slot order. */
  public ImmutableMap<T, Long> candidateCounts() {
    return counters.snapshot();
  }

  /**
   * Retained count of {@code element}. Never more than its true count, and never less than its
   * true count minus {@link #fightCount()}.
   *
   * @return the retained count, 0 when the element is not tracked
   */
  public long estimate(T element) {
    return counters.get(element);
  }

  public int k() {
    return k;
  }

  public EvictionPolicy policy() {
    return policy;
  }

  /** Maximum number of tracked elements, {@code k - 1}. */
  public int capacity() {
    return counters.capacity();
  }

  /** Number of currently tracked elements. */
  public int size() {
    return counters.size();
  }

  /** Number of elements observed so far. */
  public long observedCount() {
    return observedCount;
  }

  /**
   * Number of times a full summary met an untracked element. Each fight lowers every count by at
   * most one, so this bounds the underestimate of {@link #estimate}. It never exceeds {@code
   * observedCount() / k}.
   */
  public long fightCount() {
    return fightCount;
  }

  @Override
  public String toString() {
    return "FrequencySummary{"
        + "k="
        + k
        + ", policy="
        + policy
        + ", observed="
        + observedCount
        + ", candidates="
        + counters.snapshot()
        + '}';
  }
}
