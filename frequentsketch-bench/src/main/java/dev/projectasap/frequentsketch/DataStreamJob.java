/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch;

import dev.projectasap.frequentsketch.datamodel.DataPoint;
import dev.projectasap.frequentsketch.datamodel.PrecomputedOutput;
import dev.projectasap.frequentsketch.sinks.SinkBuilder;
import dev.projectasap.frequentsketch.utils.AggregationConfig;
import dev.projectasap.frequentsketch.utils.ConfigLoader;
import dev.projectasap.frequentsketch.utils.DataPointGenerator;
import dev.projectasap.frequentsketch.utils.StreamingConfig;
import dev.projectasap.frequentsketch.windowfunctions.KeyedWindowProcessor;
import dev.projectasap.frequentsketch.windowfunctions.VerifiedWindowProcessor;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.Namespace;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.connector.datagen.source.DataGeneratorSource;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.KeyedStream;
import org.apache.flink.streaming.api.datastream.WindowedStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.streaming.api.windowing.assigners.TumblingEventTimeWindows;
import org.apache.flink.streaming.api.windowing.time.Time;
import org.apache.flink.streaming.api.windowing.windows.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink job finding frequent keys per tumbling window. The "sketch" pipeline emits the Misra-Gries
 * candidates of each window; the "verified" pipeline keeps the window's elements and emits only the
 * keys that pass exact verification.
 */
public class DataStreamJob {
  private static final Logger LOG = LoggerFactory.getLogger(DataStreamJob.class);

  static Namespace parseArgs(String[] args) {
    ArgumentParser parser =
        ArgumentParsers.newFor("DataStreamJob")
            .build()
            .defaultHelp(true)
            .description("Misra-Gries frequent elements per window");

    parser
        .addArgument("--configFilePath")
        .type(String.class)
        .required(true)
        .help("Configuration file path");

    parser.addArgument("--outputFilePath").type(String.class).help("Output file path");

    parser
        .addArgument("--outputFormat")
        .type(String.class)
        .choices("byte", "json")
        .setDefault("json")
        .help("Output format: byte or json");

    parser
        .addArgument("--logLevel")
        .type(String.class)
        .choices("TRACE", "DEBUG", "INFO", "WARN", "ERROR")
        .setDefault("INFO")
        .help("Sets the logging level (default: INFO)");

    parser
        .addArgument("--pipeline")
        .type(String.class)
        .choices("sketch", "verified")
        .setDefault("verified")
        .help("Pipeline type: sketch (candidates only) or verified (summary + exact verification)");

    parser
        .addArgument("--datagenKeyCardinality")
        .type(Integer.class)
        .required(true)
        .help("Number of distinct background keys, -1 for unbounded");

    parser
        .addArgument("--datagenItemsPerWindow")
        .type(Long.class)
        .required(true)
        .help("Number of items to fit in each tumbling window");

    parser
        .addArgument("--datagenWindows")
        .type(Long.class)
        .setDefault(10L)
        .help("Number of windows to generate before the source ends (default: 10)");

    parser
        .addArgument("--heavyKeyFraction")
        .type(Double.class)
        .setDefault(0.3)
        .help("Probability that a generated item carries the heavy key (default: 0.3)");

    parser
        .addArgument("--verbose")
        .type(Boolean.class)
        .setDefault(false)
        .help("Write window outputs to the file sink (default: false)");

    parser
        .addArgument("--parallelism")
        .type(Integer.class)
        .setDefault(1)
        .help("Parallelism for the Flink job (default: 1)");

    return parser.parseArgsOrFail(args);
  }

  static void checkArgs(Namespace parsedArgs) {
    if (parsedArgs.getBoolean("verbose") && parsedArgs.getString("outputFilePath") == null) {
      throw new IllegalArgumentException(
          "Output file path is required when verbose mode is enabled");
    }
    if (parsedArgs.getLong("datagenWindows") <= 0) {
      throw new IllegalArgumentException(
          "Number of windows (" + parsedArgs.getLong("datagenWindows") + ") must be positive");
    }
    if (parsedArgs.getInt("parallelism") <= 0) {
      throw new IllegalArgumentException(
          "Parallelism (" + parsedArgs.getInt("parallelism") + ") must be positive");
    }
  }

  private static DataStream<DataPoint> createDataGenStream(
      StreamExecutionEnvironment env,
      int keyCardinality,
      long tumblingWindowSizeSeconds,
      long itemsPerWindow,
      long windows,
      double heavyKeyFraction) {
    DataPointGenerator generator =
        new DataPointGenerator(
            itemsPerWindow, tumblingWindowSizeSeconds, keyCardinality, heavyKeyFraction, 40L);

    DataGeneratorSource<DataPoint> source =
        new DataGeneratorSource<>(
            generator, itemsPerWindow * windows, TypeInformation.of(DataPoint.class));

    return env.fromSource(source, WatermarkStrategy.noWatermarks(), "Generator Source")
        .assignTimestampsAndWatermarks(
            WatermarkStrategy.<DataPoint>forMonotonousTimestamps()
                .withTimestampAssigner((event, timestamp) -> event.timestamp));
  }

  /**
   * Main entry point for the Flink streaming job.
   *
   * @param args command-line arguments for configuration
   * @throws Exception if the job fails to execute
   */
  public static void main(String[] args) throws Exception {
    Namespace parsedArgs = parseArgs(args);

    // Picked up by the log4j2 configuration
    System.setProperty("log.level", parsedArgs.getString("logLevel"));
    LOG.info("Starting with log level: {}", parsedArgs.getString("logLevel"));

    checkArgs(parsedArgs);

    StreamingConfig streamingConfig =
        ConfigLoader.loadConfig(parsedArgs.getString("configFilePath"));

    StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
    int parallelism = parsedArgs.getInt("parallelism");
    env.setParallelism(parallelism);

    String pipeline = parsedArgs.getString("pipeline");
    boolean verbose = parsedArgs.getBoolean("verbose");

    long tumblingWindowSizeSeconds = streamingConfig.aggregationConfigs.get(0).tumblingWindowSize;
    DataStream<DataPoint> inputStream =
        createDataGenStream(
            env,
            parsedArgs.getInt("datagenKeyCardinality"),
            tumblingWindowSizeSeconds,
            parsedArgs.getLong("datagenItemsPerWindow"),
            parsedArgs.getLong("datagenWindows"),
            parsedArgs.getDouble("heavyKeyFraction"));

    for (AggregationConfig config : streamingConfig.aggregationConfigs) {
      LOG.info(
          "Aggregation {}: {} with k={} policy={} window={}s pipeline={}",
          config.aggregationId,
          config.aggregationType,
          config.getK(),
          config.getPolicy().configName(),
          config.tumblingWindowSize,
          pipeline);

      // Each partition is summarized on its own; summaries are never merged
      KeyedStream<DataPoint, Integer> keyedStream =
          inputStream.keyBy(item -> (int) Math.floorMod(item.timestamp, (long) parallelism));

      WindowedStream<DataPoint, Integer, TimeWindow> windowedStream =
          keyedStream.window(TumblingEventTimeWindows.of(Time.seconds(config.tumblingWindowSize)));

      DataStream<PrecomputedOutput> outputStream;
      if ("sketch".equals(pipeline)) {
        outputStream =
            windowedStream.aggregate(
                config.getAggregationFunction(), new KeyedWindowProcessor(config, pipeline));
      } else {
        outputStream = windowedStream.process(new VerifiedWindowProcessor(config, pipeline));
      }

      if (verbose) {
        outputStream.sinkTo(
            SinkBuilder.buildSink(
                parsedArgs.getString("outputFilePath"), parsedArgs.getString("outputFormat")));
      }
    }

    env.execute("Frequent Elements");
  }
}
