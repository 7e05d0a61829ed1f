/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.sketches.misragries;

import dev.projectasap.frequentsketch.datamodel.DataPoint;
import dev.projectasap.frequentsketch.datamodel.Summary;
import dev.projectasap.frequentsketch.summary.EvictionPolicy;
import java.util.HashMap;
import java.util.Map;
import org.apache.flink.api.common.functions.AggregateFunction;

/**
 * Aggregate function for the Misra-Gries frequent elements summary. Produces, per window, the at
 * most {@code k - 1} candidate keys that may occur more than {@code floor(n/k)} times.
 */
public class MisraGriesSketch
    implements AggregateFunction<DataPoint, MisraGriesAccumulator, Summary> {

  private final int k;
  private final EvictionPolicy policy;

  /**
   * Constructs a MisraGriesSketch aggregate function.
   *
   * @param subType the aggregation subtype, only "count" is supported
   * @param parameters configuration parameters including "k" and optionally "policy"
   */
  public MisraGriesSketch(String subType, Map<String, String> parameters) {
    if (!"count".equals(subType)) {
      throw new IllegalArgumentException(
          "Unsupported aggregation subtype '" + subType + "', Misra-Gries only counts");
    }
    if (!parameters.containsKey("k")) {
      throw new IllegalArgumentException("Missing required parameter 'k'");
    }
    this.k = Integer.parseInt(parameters.get("k"));
    if (this.k < 1) {
      throw new IllegalArgumentException("k (" + this.k + ") must be at least 1");
    }
    this.policy =
        parameters.containsKey("policy")
            ? EvictionPolicy.fromName(parameters.get("policy"))
            : EvictionPolicy.GROUP_DECREMENT;
  }

  @Override
  public MisraGriesAccumulator createAccumulator() {
    Map<String, String> params = new HashMap<>();
    params.put("k", String.valueOf(k));
    params.put("policy", policy.configName());
    return new MisraGriesAccumulator(params);
  }

  @Override
  public MisraGriesAccumulator add(DataPoint value, MisraGriesAccumulator acc) {
    acc.add(value.key);
    return acc;
  }

  /** Only merging windows (session windows) call this, and those are not supported. */
  @Override
  public MisraGriesAccumulator merge(MisraGriesAccumulator a, MisraGriesAccumulator b) {
    throw new UnsupportedOperationException(
        "Misra-Gries summaries are built from one ordered stream and cannot be merged");
  }

  @Override
  public Summary getResult(MisraGriesAccumulator acc) {
    return acc;
  }
}
