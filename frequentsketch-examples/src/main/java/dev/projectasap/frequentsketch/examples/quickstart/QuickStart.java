/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.examples.quickstart;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.frequentsketch.datamodel.DataPoint;
import dev.projectasap.frequentsketch.datamodel.PrecomputedOutput;
import dev.projectasap.frequentsketch.datamodel.Summary;
import dev.projectasap.frequentsketch.sketches.misragries.MisraGriesSketch;
import dev.projectasap.frequentsketch.utils.AggregationConfig;
import dev.projectasap.frequentsketch.windowfunctions.KeyedWindowProcessor;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.streaming.api.windowing.assigners.TumblingEventTimeWindows;
import org.apache.flink.streaming.api.windowing.time.Time;

/** Quick start example: Misra-Gries candidates per window, queried by key. */
public class QuickStart {
  public static void main(String[] args) throws Exception {
    StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();

    DataStream<DataPoint> dataStream =
        env.fromElements(
            new DataPoint(1L, "apple"),
            new DataPoint(2L, "banana"),
            new DataPoint(3L, "apple"),
            new DataPoint(4L, "orange"),
            new DataPoint(5L, "banana"),
            new DataPoint(6L, "apple"),
            new DataPoint(7L, "banana"),
            new DataPoint(8L, "apple"));

    dataStream =
        dataStream.assignTimestampsAndWatermarks(
            WatermarkStrategy.<DataPoint>forMonotonousTimestamps()
                .withTimestampAssigner((event, timestamp) -> event.timestamp));

    // At most k - 1 = 2 candidates are tracked
    Map<String, String> sketchParams = new HashMap<>();
    sketchParams.put("k", "3");

    AggregationConfig config = new AggregationConfig();
    config.aggregationId = 1;
    config.aggregationType = "MisraGriesSketch";
    config.aggregationSubType = "count";
    config.aggregationPackage = "misragries";
    config.parameters = sketchParams;
    config.tumblingWindowSize = 5;

    DataStream<PrecomputedOutput> outputStream =
        dataStream
            .keyBy(item -> 0)
            .window(TumblingEventTimeWindows.of(Time.seconds(5)))
            .aggregate(
                new MisraGriesSketch("count", sketchParams),
                new KeyedWindowProcessor(config, "sketch"));

    // Retained counts are lower bounds, untracked keys report 0
    List<String> queryKeys = Arrays.asList("apple", "banana", "orange");
    ObjectMapper objectMapper = new ObjectMapper();

    outputStream
        .map(
            result -> {
              Summary summary = (Summary) result.precompute;
              StringBuilder sb = new StringBuilder("Estimates: ");
              for (String key : queryKeys) {
                ObjectNode queryParams = objectMapper.createObjectNode();
                queryParams.put("key", key);
                JsonNode estimate = summary.query(queryParams);
                sb.append(String.format("%s=%s ", key, estimate.get(key)));
              }
              return sb.toString();
            })
        .print();

    env.execute("Quick Start - Frequent Elements with Misra-Gries");
  }
}
