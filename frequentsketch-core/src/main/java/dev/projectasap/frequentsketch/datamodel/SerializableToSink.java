/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.datamodel;

import com.fasterxml.jackson.databind.JsonNode;

/** Anything written to a sink, either as little-endian bytes or as JSON. */
public interface SerializableToSink {
  byte[] serializeToBytes();

  JsonNode serializeToJson();

  default String serializeToString() {
    return serializeToJson().toString();
  }
}
