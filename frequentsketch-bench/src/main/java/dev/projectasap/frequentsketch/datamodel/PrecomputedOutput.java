/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.datamodel;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.frequentsketch.utils.AggregationConfig;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Output of one window: either the unverified Misra-Gries summary or the verified frequent keys,
 * with the window bounds and the aggregation that produced it.
 */
public class PrecomputedOutput {
  @JsonProperty("start_timestamp")
  public Long startTimestamp;

  @JsonProperty("end_timestamp")
  public Long endTimestamp;

  public SerializableToSink precompute;
  public AggregationConfig config;
  public String key;
  public String pipeline;

  /**
   * Constructs a PrecomputedOutput.
   *
   * @param startTimestamp the window start timestamp
   * @param endTimestamp the window end timestamp
   * @param precompute the summary or verified result
   * @param config the aggregation configuration
   * @param key the partition key (null for global aggregation)
   * @param pipeline the pipeline mode ("sketch" or "verified")
   */
  public PrecomputedOutput(
      Long startTimestamp,
      Long endTimestamp,
      SerializableToSink precompute,
      AggregationConfig config,
      String key,
      String pipeline) {
    this.startTimestamp = startTimestamp;
    this.endTimestamp = endTimestamp;
    this.precompute = precompute;
    this.config = config;
    this.key = key;
    this.pipeline = pipeline;
  }

  /**
   * Serializes the precomputed output to a byte array. Variable-length sections are prefixed with
   * their length as a big-endian int.
   *
   * @return serialized byte array containing config, timestamps, key, and precompute data
   */
  public byte[] serializeToBytes() {
    byte[] precomputeBytes = this.precompute.serializeToBytes();
    byte[] configBytes = this.config.serializeToBytes();
    byte[] keyBytes =
        this.key == null ? new byte[0] : this.key.getBytes(StandardCharsets.UTF_8);

    ByteBuffer buffer =
        ByteBuffer.allocate(
            Integer.BYTES
                + configBytes.length
                + Long.BYTES
                + Long.BYTES
                + Integer.BYTES
                + keyBytes.length
                + Integer.BYTES
                + precomputeBytes.length);
    buffer.putInt(configBytes.length);
    buffer.put(configBytes);
    buffer.putLong(this.startTimestamp);
    buffer.putLong(this.endTimestamp);
    buffer.putInt(keyBytes.length);
    buffer.put(keyBytes);
    buffer.putInt(precomputeBytes.length);
    buffer.put(precomputeBytes);
    return buffer.array();
  }

  /**
   * Serializes the precomputed output to JSON.
   *
   * @return JsonNode with window metadata, the result and, for summaries, their memory usage
   */
  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode jsonNode = objectMapper.createObjectNode();

    jsonNode.set("config", this.config.serializeToJson());
    jsonNode.put("start_timestamp", this.startTimestamp);
    jsonNode.put("end_timestamp", this.endTimestamp);
    jsonNode.put("key", this.key);
    jsonNode.put("pipeline", this.pipeline);
    jsonNode.set("result", this.precompute.serializeToJson());
    if (this.precompute instanceof Summary) {
      jsonNode.put("memory_bytes", ((Summary) this.precompute).get_memory());
    }
    return jsonNode;
  }
}
