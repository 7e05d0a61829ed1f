/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Utility class for loading streaming configuration from YAML files. Parses aggregation
 * configurations and parameters.
 */
public class ConfigLoader {
  /**
   * Loads streaming configuration from a YAML file.
   *
   * @param configFilePath path to the YAML configuration file
   * @return parsed streaming configuration
   * @throws IOException if file reading or parsing fails
   * @throws IllegalArgumentException if a required field is missing
   */
  public static StreamingConfig loadConfig(String configFilePath) throws IOException {
    String yamlContent = Files.readString(Path.of(configFilePath), StandardCharsets.UTF_8);
    return parseConfig(yamlContent);
  }

  /**
   * Parses streaming configuration from YAML text.
   *
   * @param yamlContent the YAML document
   * @return parsed streaming configuration
   * @throws IOException if the YAML cannot be parsed
   */
  public static StreamingConfig parseConfig(String yamlContent) throws IOException {
    ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    ObjectNode rootNode = mapper.readValue(yamlContent, ObjectNode.class);

    JsonNode aggregations = rootNode.get("aggregations");
    if (aggregations == null || !aggregations.isArray() || aggregations.isEmpty()) {
      throw new IllegalArgumentException("Configuration must contain a non-empty 'aggregations'");
    }

    List<AggregationConfig> aggregationConfigs = new ArrayList<>();
    aggregations.forEach(
        node -> {
          AggregationConfig config = new AggregationConfig();
          config.aggregationId = required(node, "aggregationId").asInt();
          config.aggregationType = required(node, "aggregationType").asText();
          config.aggregationSubType =
              node.has("aggregationSubType") ? node.get("aggregationSubType").asText() : "count";
          config.aggregationPackage = required(node, "aggregationPackage").asText();

          Map<String, String> parameters = new HashMap<>();
          required(node, "parameters")
              .fields()
              .forEachRemaining(
                  entry -> {
                    parameters.put(entry.getKey(), entry.getValue().asText());
                  });
          config.parameters = parameters;

          config.tumblingWindowSize = required(node, "tumblingWindowSize").asInt();

          config.setOriginalYaml(node.toString());
          aggregationConfigs.add(config);
        });

    StreamingConfig streamingConfig = new StreamingConfig();
    streamingConfig.aggregationConfigs = aggregationConfigs;
    return streamingConfig;
  }

  private static JsonNode required(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException("Aggregation is missing required field '" + field + "'");
    }
    return value;
  }
}
