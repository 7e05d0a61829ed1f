/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.datamodel;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A single stream element: the key whose frequency is tracked, stamped with its event time. Public
 * fields and a no-argument constructor keep it a Flink POJO.
 */
@JsonPropertyOrder({"timestamp", "key"})
public class DataPoint {
  public Long timestamp;
  public String key;

  public DataPoint() {
    this.timestamp = 0L;
    this.key = "";
  }

  /**
   * Constructs a DataPoint.
   *
   * @param timestamp the event timestamp in milliseconds
   * @param key the element key
   */
  public DataPoint(Long timestamp, String key) {
    this.timestamp = timestamp;
    this.key = key;
  }

  @Override
  public String toString() {
    return "DataPoint{" + "timestamp=" + timestamp + ", key='" + key + '\'' + '}';
  }
}
