/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.examples.basic.frequent;

import dev.projectasap.frequentsketch.datamodel.DataPoint;
import dev.projectasap.frequentsketch.datamodel.PrecomputedOutput;
import dev.projectasap.frequentsketch.utils.AggregationConfig;
import dev.projectasap.frequentsketch.windowfunctions.VerifiedWindowProcessor;
import java.util.HashMap;
import java.util.Map;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.streaming.api.windowing.assigners.TumblingEventTimeWindows;
import org.apache.flink.streaming.api.windowing.time.Time;

/** Basic example running the summary and the verification pass over each tumbling window. */
public class VerifiedFrequentKeysExample {
  public static void main(String[] args) throws Exception {
    StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();

    DataStream<DataPoint> inputStream = buildExampleInputStream(env);

    DataStream<PrecomputedOutput> outputStream =
        inputStream
            .keyBy(item -> 0)
            .window(TumblingEventTimeWindows.of(Time.seconds(10)))
            .process(new VerifiedWindowProcessor(createConfig(), "verified"));

    outputStream.map(result -> result.serializeToJson().toString()).print();

    env.execute("Misra-Gries Verified Frequent Keys Example");
  }

  private static AggregationConfig createConfig() {
    Map<String, String> sketchParams = new HashMap<>();
    sketchParams.put("k", "4"); // Keys above floor(n/5) are reported
    sketchParams.put("policy", "single_evict");

    AggregationConfig config = new AggregationConfig();
    config.aggregationId = 1;
    config.aggregationType = "MisraGriesSketch";
    config.aggregationSubType = "count";
    config.aggregationPackage = "misragries";
    config.parameters = sketchParams;
    config.tumblingWindowSize = 10;
    return config;
  }

  private static DataStream<DataPoint> buildExampleInputStream(StreamExecutionEnvironment env) {
    // "apple" appears most frequently, followed by "banana", then "cherry"
    DataStream<DataPoint> inputStream =
        env.fromElements(
            new DataPoint(1L, "apple"),
            new DataPoint(2L, "banana"),
            new DataPoint(3L, "apple"),
            new DataPoint(4L, "cherry"),
            new DataPoint(5L, "banana"),
            new DataPoint(6L, "apple"),
            new DataPoint(7L, "banana"),
            new DataPoint(8L, "apple"),
            new DataPoint(9L, "cherry"),
            new DataPoint(10L, "banana"),
            new DataPoint(11L, "apple"),
            new DataPoint(12L, "date"),
            new DataPoint(13L, "apple"),
            new DataPoint(14L, "elderberry"),
            new DataPoint(15L, "apple"));

    return inputStream.assignTimestampsAndWatermarks(
        WatermarkStrategy.<DataPoint>forMonotonousTimestamps()
            .withTimestampAssigner((event, timestamp) -> event.timestamp));
  }
}
