/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.windowfunctions;

import dev.projectasap.frequentsketch.datamodel.PrecomputedOutput;
import dev.projectasap.frequentsketch.datamodel.Summary;
import dev.projectasap.frequentsketch.utils.AggregationConfig;
import org.apache.flink.streaming.api.functions.windowing.ProcessWindowFunction;
import org.apache.flink.streaming.api.windowing.windows.TimeWindow;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process function that adds window metadata to the aggregated Misra-Gries summary. The candidates
 * it emits are unverified.
 */
public class KeyedWindowProcessor
    extends ProcessWindowFunction<Summary, PrecomputedOutput, Integer, TimeWindow> {
  private static final Logger logger = LoggerFactory.getLogger(KeyedWindowProcessor.class);

  private final AggregationConfig config;
  private final String pipeline;

  public KeyedWindowProcessor(AggregationConfig config, String pipeline) {
    this.config = config;
    this.pipeline = pipeline;
  }

  @Override
  public void process(
      Integer key, Context context, Iterable<Summary> elements, Collector<PrecomputedOutput> out) {
    Summary result = elements.iterator().next();
    long start = context.window().getStart();
    long end = context.window().getEnd();

    logger.debug(
        "Window [{}, {}] partition {}: {} candidates", start, end, key, result.getKeySet().size());

    out.collect(new PrecomputedOutput(start, end, result, config, String.valueOf(key), pipeline));
  }
}
