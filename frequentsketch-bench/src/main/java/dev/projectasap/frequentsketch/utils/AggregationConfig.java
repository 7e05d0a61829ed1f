/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.frequentsketch.datamodel.DataPoint;
import dev.projectasap.frequentsketch.datamodel.Summary;
import dev.projectasap.frequentsketch.summary.EvictionPolicy;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.apache.flink.api.common.functions.AggregateFunction;

/**
 * Configuration for a single frequent elements aggregation. Contains the sketch type, its
 * parameters and the window size.
 */
public class AggregationConfig implements Serializable {
  private static final long serialVersionUID = 1L;

  public Integer aggregationId;
  public String aggregationType;
  public String aggregationSubType;
  public String aggregationPackage;
  public Map<String, String> parameters;
  public int tumblingWindowSize;

  private String originalYaml;

  public void setOriginalYaml(String originalYaml) {
    this.originalYaml = originalYaml;
  }

  public byte[] serializeToBytes() {
    return originalYaml == null ? new byte[0] : originalYaml.getBytes(StandardCharsets.UTF_8);
  }

  /** Capacity parameter {@code k} of the configured summary. */
  public int getK() {
    if (parameters == null || !parameters.containsKey("k")) {
      throw new IllegalArgumentException(
          "Aggregation " + aggregationId + " is missing required parameter 'k'");
    }
    int k = Integer.parseInt(parameters.get("k"));
    if (k < 1) {
      throw new IllegalArgumentException("k (" + k + ") must be at least 1");
    }
    return k;
  }

  /** Eviction policy of the configured summary, {@code group_decrement} when unset. */
  public EvictionPolicy getPolicy() {
    if (parameters == null || !parameters.containsKey("policy")) {
      return EvictionPolicy.GROUP_DECREMENT;
    }
    return EvictionPolicy.fromName(parameters.get("policy"));
  }

  /**
   * Serializes the aggregation configuration to JSON.
   *
   * @return JsonNode containing the configuration details
   */
  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode jsonNode = objectMapper.createObjectNode();

    jsonNode.put("aggregationId", this.aggregationId);
    jsonNode.put("aggregationType", this.aggregationType);
    jsonNode.put("aggregationSubType", this.aggregationSubType);
    jsonNode.put("aggregationPackage", this.aggregationPackage);
    jsonNode.putPOJO("parameters", this.parameters);
    jsonNode.put("tumblingWindowSize", this.tumblingWindowSize);

    return jsonNode;
  }

  /**
   * Instantiates the aggregation function based on configuration.
   *
   * @return the instantiated aggregation function
   * @throws RuntimeException if function instantiation fails
   */
  @SuppressWarnings("unchecked")
  public AggregateFunction<DataPoint, ?, Summary> getAggregationFunction() {
    try {
      String className =
          "dev.projectasap.frequentsketch.sketches." + aggregationPackage + "." + aggregationType;
      Class<?> clazz = Class.forName(className);
      return (AggregateFunction<DataPoint, ?, Summary>)
          clazz.getConstructor(String.class, Map.class).newInstance(aggregationSubType, parameters);
    } catch (Exception e) {
      throw new RuntimeException("Failed to create aggregation function", e);
    }
  }
}
