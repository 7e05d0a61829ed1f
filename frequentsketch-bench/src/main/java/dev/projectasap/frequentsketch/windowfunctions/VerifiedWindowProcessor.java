/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.windowfunctions;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import dev.projectasap.frequentsketch.datamodel.DataPoint;
import dev.projectasap.frequentsketch.datamodel.PrecomputedOutput;
import dev.projectasap.frequentsketch.datamodel.VerifiedFrequencies;
import dev.projectasap.frequentsketch.summary.EmptyInputException;
import dev.projectasap.frequentsketch.summary.EvictionPolicy;
import dev.projectasap.frequentsketch.summary.FrequencySummary;
import dev.projectasap.frequentsketch.summary.FrequencyVerifier;
import dev.projectasap.frequentsketch.utils.AggregationConfig;
import org.apache.flink.streaming.api.functions.windowing.ProcessWindowFunction;
import org.apache.flink.streaming.api.windowing.windows.TimeWindow;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process function running both passes over the elements Flink retained for a window: a
 * Misra-Gries summary pass for candidates, then an exact verification pass over the same elements.
 * Emits only verified frequent keys.
 */
public class VerifiedWindowProcessor
    extends ProcessWindowFunction<DataPoint, PrecomputedOutput, Integer, TimeWindow> {
  private static final Logger logger = LoggerFactory.getLogger(VerifiedWindowProcessor.class);

  private final AggregationConfig config;
  private final String pipeline;
  private final int k;
  private final EvictionPolicy policy;

  public VerifiedWindowProcessor(AggregationConfig config, String pipeline) {
    this.config = config;
    this.pipeline = pipeline;
    this.k = config.getK();
    this.policy = config.getPolicy();
  }

  @Override
  public void process(
      Integer key,
      Context context,
      Iterable<DataPoint> elements,
      Collector<PrecomputedOutput> out) {
    long start = context.window().getStart();
    long end = context.window().getEnd();

    VerifiedFrequencies result;
    try {
      result = verifyWindow(elements);
    } catch (EmptyInputException e) {
      logger.error("Failed to verify window [{}, {}]: {}", start, end, e.getMessage());
      return;
    }
    logger.info(
        "Window [{}, {}] partition {}: {} elements, threshold {}, frequent keys {}",
        start,
        end,
        key,
        result.getSequenceLength(),
        result.getThreshold(),
        result.getExactCounts());

    out.collect(new PrecomputedOutput(start, end, result, config, String.valueOf(key), pipeline));
  }

  /** Runs the summary pass and the verification pass over one window's elements. */
  VerifiedFrequencies verifyWindow(Iterable<DataPoint> elements) {
    Iterable<String> keys = Iterables.transform(elements, point -> point.key);

    FrequencySummary<String> summary = FrequencySummary.fromSequence(keys, k, policy);
    ImmutableMap<String, Long> verified = FrequencyVerifier.verify(keys, summary.candidates(), k);

    return new VerifiedFrequencies(k, policy, summary.observedCount(), summary.size(), verified);
  }
}
