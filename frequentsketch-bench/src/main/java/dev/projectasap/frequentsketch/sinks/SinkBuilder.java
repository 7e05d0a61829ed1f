/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.sinks;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.projectasap.frequentsketch.datamodel.PrecomputedOutput;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.apache.flink.api.common.serialization.Encoder;
import org.apache.flink.api.connector.sink2.Sink;
import org.apache.flink.connector.file.sink.FileSink;
import org.apache.flink.core.fs.Path;
import org.apache.flink.streaming.api.functions.sink.filesystem.rollingpolicies.DefaultRollingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builder for the file sink that receives window outputs, as bytes or as JSON lines. */
public class SinkBuilder {
  private static final Logger logger = LoggerFactory.getLogger(SinkBuilder.class);

  /**
   * Builds a row-format file sink.
   *
   * @param outputPath directory the sink writes part files to
   * @param outputFormat "byte" or "json"
   * @return the configured Flink sink
   * @throws IllegalArgumentException if the output format is unknown
   */
  public static Sink<PrecomputedOutput> buildSink(String outputPath, String outputFormat) {
    logger.info("Building sink with output format: {}", outputFormat);
    logger.info("Using file sink with path: {}", outputPath);

    return FileSink.forRowFormat(new Path(outputPath), encoderFor(outputFormat))
        .withRollingPolicy(
            DefaultRollingPolicy.builder()
                .withRolloverInterval(Duration.ofMinutes(15))
                .withInactivityInterval(Duration.ofMinutes(1))
                .withMaxPartSize(1024 * 1024 * 1024)
                .build())
        .build();
  }

  /**
   * Encoder writing each output in the requested format.
   *
   * @throws IllegalArgumentException if the output format is unknown
   */
  public static Encoder<PrecomputedOutput> encoderFor(String outputFormat) {
    if ("byte".equals(outputFormat)) {
      return (data, stream) -> stream.write(data.serializeToBytes());
    }
    if ("json".equals(outputFormat)) {
      ObjectMapper objectMapper = new ObjectMapper();
      return (data, stream) -> {
        stream.write(objectMapper.writeValueAsBytes(data.serializeToJson()));
        stream.write("\n".getBytes(StandardCharsets.UTF_8));
      };
    }
    throw new IllegalArgumentException("Invalid output format: " + outputFormat);
  }
}
