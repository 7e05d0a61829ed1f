/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.sketches.misragries;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.frequentsketch.datamodel.Summary;
import dev.projectasap.frequentsketch.summary.EvictionPolicy;
import dev.projectasap.frequentsketch.summary.FrequencySummary;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;

/**
 * Accumulator for the Misra-Gries summary over string keys. Holds at most {@code k - 1} candidates
 * with their retained counts. The counts are lower bounds; the candidates still need an exact
 * verification pass.
 */
public class MisraGriesAccumulator implements Summary {
  private final FrequencySummary<String> summary;

  /**
   * Constructs a MisraGriesAccumulator.
   *
   * @param parameters configuration parameters including "k" and optionally "policy"
   */
  public MisraGriesAccumulator(Map<String, String> parameters) {
    if (!parameters.containsKey("k")) {
      throw new IllegalArgumentException("Missing required parameter 'k'");
    }
    int k = Integer.parseInt(parameters.get("k"));
    EvictionPolicy policy =
        parameters.containsKey("policy")
            ? EvictionPolicy.fromName(parameters.get("policy"))
            : EvictionPolicy.GROUP_DECREMENT;
    this.summary = new FrequencySummary<>(k, policy);
  }

  @Override
  public void add(String key) {
    summary.observe(key);
  }

  /** The underlying summary. */
  public FrequencySummary<String> getSummary() {
    return summary;
  }

  @Override
  public Set<String> getKeySet() {
    return summary.candidates();
  }

  @Override
  public byte[] serializeToBytes() {
    Map<String, Long> candidates = summary.candidateCounts();
    int totalSize = Integer.BYTES + Byte.BYTES + Long.BYTES + Long.BYTES + Integer.BYTES;
    for (Map.Entry<String, Long> entry : candidates.entrySet()) {
      totalSize +=
          Integer.BYTES
              + entry.getKey().getBytes(StandardCharsets.UTF_8).length
              + Long.BYTES; // key length + key + count
    }

    ByteBuffer buffer = ByteBuffer.allocate(totalSize).order(ByteOrder.LITTLE_ENDIAN);
    buffer.putInt(summary.k());
    buffer.put((byte) summary.policy().ordinal());
    buffer.putLong(summary.observedCount());
    buffer.putLong(summary.fightCount());
    buffer.putInt(candidates.size());
    for (Map.Entry<String, Long> entry : candidates.entrySet()) {
      byte[] keyBytes = entry.getKey().getBytes(StandardCharsets.UTF_8);
      buffer.putInt(keyBytes.length);
      buffer.put(keyBytes);
      buffer.putLong(entry.getValue());
    }
    return buffer.array();
  }

  @Override
  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode jsonNode = objectMapper.createObjectNode();

    jsonNode.put("k", summary.k());
    jsonNode.put("policy", summary.policy().configName());
    jsonNode.put("observed", summary.observedCount());
    jsonNode.put("error_bound", summary.fightCount());
    jsonNode.set("candidates", candidatesNode(objectMapper));
    return jsonNode;
  }

  /**
   * Execute query operations on the summary. {"statistic": "candidates"} returns every candidate
   * with its retained count; {"key": k} returns the retained count of one key (0 if untracked).
   */
  @Override
  public JsonNode query(JsonNode params) {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode queryResult = objectMapper.createObjectNode();

    if (params != null && params.has("key")) {
      String requestedKey = params.get("key").asText();
      queryResult.put(requestedKey, summary.estimate(requestedKey));
      return queryResult;
    }
    if (params != null
        && params.has("statistic")
        && "candidates".equals(params.get("statistic").asText())) {
      queryResult.set("candidates", candidatesNode(objectMapper));
      return queryResult;
    }

    // Error: invalid query parameters
    ObjectNode error = objectMapper.createObjectNode();
    error.put(
        "error",
        "Query must contain either 'key' for a count query or statistic 'candidates'");
    return error;
  }

  @Override
  public long get_memory() {
    // Key characters plus one long counter per tracked candidate
    long approxSize = 0;
    for (String key : summary.candidates()) {
      approxSize += (long) key.length() * Character.BYTES;
      approxSize += Long.BYTES;
    }
    return approxSize;
  }

  private ObjectNode candidatesNode(ObjectMapper objectMapper) {
    ObjectNode candidates = objectMapper.createObjectNode();
    for (Map.Entry<String, Long> entry : summary.candidateCounts().entrySet()) {
      candidates.put(entry.getKey(), entry.getValue());
    }
    return candidates;
  }
}
