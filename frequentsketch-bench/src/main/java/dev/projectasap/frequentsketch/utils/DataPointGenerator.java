/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.utils;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import dev.projectasap.frequentsketch.datamodel.DataPoint;
import org.apache.flink.connector.datagen.source.GeneratorFunction;

/**
 * Generates keyed data points with one planted heavy key. Each index is mapped to an event time so
 * that exactly {@code itemsPerWindow} points fall in each tumbling window. With probability {@code
 * heavyKeyFraction} a point carries {@link #HEAVY_KEY}; otherwise its key cycles through {@code
 * keyCardinality} keys, or is unique when the cardinality is -1.
 *
 * <p>Every point depends only on its index and the seed, so parallel readers and restarted
 * readers produce the same points for the same indices.
 */
public class DataPointGenerator implements GeneratorFunction<Long, DataPoint> {
  private static final long serialVersionUID = 1L;

  public static final String HEAVY_KEY = "hot";
  public static final long BASE_TIMESTAMP = 1000000000000L;

  private static final HashFunction DRAW_HASH = Hashing.murmur3_128();

  private final long itemsPerWindow;
  private final long millisecondTumblingWindow;
  private final int keyCardinality;
  private final double heavyKeyFraction;
  private final long seed;

  /**
   * Constructs a DataPointGenerator.
   *
   * @param itemsPerWindow number of items per tumbling window
   * @param tumblingWindowSizeSeconds tumbling window size in seconds
   * @param keyCardinality number of distinct background keys, -1 for unbounded
   * @param heavyKeyFraction probability of emitting the heavy key, in [0, 1]
   * @param seed seed mixed into the heavy key draw of every index
   */
  public DataPointGenerator(
      long itemsPerWindow,
      long tumblingWindowSizeSeconds,
      int keyCardinality,
      double heavyKeyFraction,
      long seed) {
    if (itemsPerWindow <= 0) {
      throw new IllegalArgumentException(
          "Items per window (" + itemsPerWindow + ") must be positive");
    }
    if (keyCardinality == 0 || keyCardinality < -1) {
      throw new IllegalArgumentException(
          "Key cardinality (" + keyCardinality + ") must be positive or -1 for unbounded");
    }
    if (heavyKeyFraction < 0.0 || heavyKeyFraction > 1.0) {
      throw new IllegalArgumentException(
          "Heavy key fraction (" + heavyKeyFraction + ") must be within [0, 1]");
    }
    this.itemsPerWindow = itemsPerWindow;
    this.millisecondTumblingWindow = tumblingWindowSizeSeconds * 1000;
    this.keyCardinality = keyCardinality;
    this.heavyKeyFraction = heavyKeyFraction;
    this.seed = seed;
  }

  @Override
  public DataPoint map(Long index) {
    // Calculate timestamp so that N items fit into each tumbling window
    long timestamp = BASE_TIMESTAMP + (index / itemsPerWindow) * millisecondTumblingWindow;

    String key;
    if (draw(index) < heavyKeyFraction) {
      key = HEAVY_KEY;
    } else if (keyCardinality == -1) {
      key = "key" + index;
    } else {
      key = "key" + ((index % keyCardinality) + 1);
    }
    return new DataPoint(timestamp, key);
  }

  /** Uniform value in [0, 1) derived from the seed and {@code index}. */
  double draw(long index) {
    long bits = DRAW_HASH.newHasher().putLong(seed).putLong(index).hash().asLong();
    return (bits >>> 11) * 0x1.0p-53;
  }
}
