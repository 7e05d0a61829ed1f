/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.datamodel;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Set;

/**
 * Output of a windowed frequency aggregation. Summaries are built from a single ordered stream and
 * are not mergeable.
 */
public interface Summary extends SerializableToSink {

  /**
   * Execute a query on the accumulated data.
   *
   * @param params query parameters, e.g. {"statistic": "candidates"} or {"key": "someKey"}
   * @return query result as JsonNode
   */
  JsonNode query(JsonNode params);

  /**
   * Raw memory footprint in bytes, without JVM object overhead.
   *
   * @return memory usage in bytes
   */
  long get_memory();

  /**
   * Feed the next key of the stream.
   *
   * @param key the key to add
   */
  void add(String key);

  /**
   * @return keys currently held by the summary
   */
  Set<String> getKeySet();
}
