/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.summary;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.Arrays;
import java.util.Map;

/**
 * Fixed-capacity map from element to count. Keys and counts live in parallel arrays that grow on
 * demand but never past the capacity, so the number of tracked elements can never exceed it. A
 * slot index gives O(1) lookup by key.
 *
 * <p>Slots are kept dense: removing a slot moves the last slot into its place. "Slot order" below
 * means increasing slot index.
 *
 * @param <T> element type, compared with {@code equals}/{@code hashCode}
 */
final class BoundedCounterMap<T> {
  static final int INITIAL_SLOTS = 16;

  private final int capacity;
  private Object[] keys;
  private long[] counts;
  private final Map<T, Integer> slotIndex;
  private int size;

  BoundedCounterMap(int capacity) {
    Preconditions.checkArgument(capacity >= 0, "capacity (%s) must not be negative", capacity);
    this.capacity = capacity;
    int initialSlots = Math.min(capacity, INITIAL_SLOTS);
    this.keys = new Object[initialSlots];
    this.counts = new long[initialSlots];
    this.slotIndex = Maps.newHashMapWithExpectedSize(initialSlots);
    this.size = 0;
  }

  int capacity() {
    return capacity;
  }

  int size() {
    return size;
  }

  boolean isFull() {
    return size == capacity;
  }

  boolean contains(T key) {
    return slotIndex.containsKey(key);
  }

  /** Returns the count stored for {@code key}, or 0 when it is not tracked. */
  long get(T key) {
    Integer slot = slotIndex.get(key);
    return slot == null ? 0L : counts[slot];
  }

  /**
   * Adds one to the count of {@code key} if it is tracked.
   *
   * @return false when {@code key} is not tracked
   */
  boolean increment(T key) {
    Integer slot = slotIndex.get(key);
    if (slot == null) {
      return false;
    }
    counts[slot]++;
    return true;
  }

  /** Tracks a new key with the given count in the next free slot. */
  void insert(T key, long count) {
    if (isFull()) {
      throw new IllegalStateException(
          "Cannot insert into a full counter map (capacity " + capacity() + ")");
    }
    Preconditions.checkArgument(!contains(key), "Key %s is already tracked", key);
    if (size == keys.length) {
      grow();
    }
    keys[size] = key;
    counts[size] = count;
    slotIndex.put(key, size);
    size++;
  }

  /** Replaces whatever occupies {@code slot} with {@code key} at the given count. */
  @SuppressWarnings("unchecked")
  void replace(int slot, T key, long count) {
    Preconditions.checkElementIndex(slot, size);
    Preconditions.checkArgument(!contains(key), "Key %s is already tracked", key);
    slotIndex.remove((T) keys[slot]);
    keys[slot] = key;
    counts[slot] = count;
    slotIndex.put(key, slot);
  }

  /** Subtracts one from every positive count. Counts never go below zero. */
  void decrementAll() {
    for (int slot = 0; slot < size; slot++) {
      if (counts[slot] > 0) {
        counts[slot]--;
      }
    }
  }

  /**
   * Returns the lowest slot holding a zero count.
   *
   * @return the slot, or -1 when every count is positive
   */
  int firstZeroSlot() {
    for (int slot = 0; slot < size; slot++) {
      if (counts[slot] == 0) {
        return slot;
      }
    }
    return -1;
  }

  /**
   * Removes every slot whose count is zero.
   *
   * @return the number of evicted keys
   */
  int evictZeros() {
    int evicted = 0;
    int slot = 0;
    while (slot < size) {
      if (counts[slot] == 0) {
        // The last slot moves here and is examined on the next pass of the loop
        removeSlot(slot);
        evicted++;
      } else {
        slot++;
      }
    }
    return evicted;
  }

  /**
   * Removes the lowest slot whose count is zero.
   *
   * @return false when no count is zero
   */
  boolean evictFirstZero() {
    int slot = firstZeroSlot();
    if (slot < 0) {
      return false;
    }
    removeSlot(slot);
    return true;
  }

  /** Snapshot of tracked keys and counts in slot order. */
  @SuppressWarnings("unchecked")
  ImmutableMap<T, Long> snapshot() {
    ImmutableMap.Builder<T, Long> builder = ImmutableMap.builderWithExpectedSize(size);
    for (int slot = 0; slot < size; slot++) {
      builder.put((T) keys[slot], counts[slot]);
    }
    return builder.build();
  }

  /** Doubles the slot arrays, capped at the capacity. */
  private void grow() {
    int newLength = (int) Math.min(capacity, Math.max(INITIAL_SLOTS, 2L * keys.length));
    keys = Arrays.copyOf(keys, newLength);
    counts = Arrays.copyOf(counts, newLength);
  }

  @SuppressWarnings("unchecked")
  private void removeSlot(int slot) {
    int last = size - 1;
    slotIndex.remove((T) keys[slot]);
    if (slot != last) {
      keys[slot] = keys[last];
      counts[slot] = counts[last];
      slotIndex.put((T) keys[slot], slot);
    }
    keys[last] = null;
    counts[last] = 0L;
    size--;
  }
}
