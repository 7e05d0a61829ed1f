/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.summary;

import java.util.Locale;

/**
 * What a full {@link FrequencySummary} does when it meets an element it does not track. Both
 * policies decrement every tracked count by one and never admit the new element, so they retain
 * the same guaranteed candidates. They differ only in which spurious candidates survive.
 */
public enum EvictionPolicy {
  /** Decrement every count and evict all entries that reach zero. */
  GROUP_DECREMENT {
    @Override
    <T> int fight(BoundedCounterMap<T> counters) {
      counters.decrementAll();
      return counters.evictZeros();
    }
  },

  /**
   * Decrement every count and evict only the first entry (in slot order) that reaches zero. Other
   * zero-count entries stay tracked until an untracked element reclaims their slot.
   */
  SINGLE_EVICT {
    @Override
    <T> int fight(BoundedCounterMap<T> counters) {
      counters.decrementAll();
      return counters.evictFirstZero() ? 1 : 0;
    }
  };

  /**
   * Applies the fight to a full counter map.
   *
   * @return the number of evicted entries
   */
  abstract <T> int fight(BoundedCounterMap<T> counters);

  /**
   * Parses a policy name as written in configuration files, e.g. {@code group_decrement}.
   *
   * @param name the policy name, case-insensitive
   * @return the matching policy
   * @throws IllegalArgumentException if the name matches no policy
   */
  public static EvictionPolicy fromName(String name) {
    if (name == null) {
      throw new IllegalArgumentException("Eviction policy name must not be null");
    }
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Unknown eviction policy '" + name + "', expected group_decrement or single_evict", e);
    }
  }

  /** Name as written in configuration files. */
  public String configName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
