/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.datamodel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.frequentsketch.summary.EvictionPolicy;
import dev.projectasap.frequentsketch.summary.FrequencyVerifier;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of the verification pass over one sequence: the elements whose exact count exceeds
 * {@code floor(n/(k+1))}, with those counts.
 */
public class VerifiedFrequencies implements SerializableToSink {
  private final int k;
  private final EvictionPolicy policy;
  private final long sequenceLength;
  private final int candidateCount;
  private final Map<String, Long> exactCounts;

  /**
   * Constructs a VerifiedFrequencies.
   *
   * @param k capacity parameter of the summary
   * @param policy eviction policy of the summary
   * @param sequenceLength number of elements in the verified sequence
   * @param candidateCount number of candidates the summary proposed
   * @param exactCounts verified elements and their exact counts
   */
  public VerifiedFrequencies(
      int k,
      EvictionPolicy policy,
      long sequenceLength,
      int candidateCount,
      Map<String, Long> exactCounts) {
    this.k = k;
    this.policy = policy;
    this.sequenceLength = sequenceLength;
    this.candidateCount = candidateCount;
    this.exactCounts = new LinkedHashMap<>(exactCounts);
  }

  public int getK() {
    return k;
  }

  public long getSequenceLength() {
    return sequenceLength;
  }

  public long getThreshold() {
    return FrequencyVerifier.threshold(sequenceLength, k);
  }

  /** Number of candidates that verification rejected. */
  public int getFalsePositives() {
    return candidateCount - exactCounts.size();
  }

  public Map<String, Long> getExactCounts() {
    return exactCounts;
  }

  @Override
  public byte[] serializeToBytes() {
    int totalSize = Integer.BYTES + Byte.BYTES + Long.BYTES + Integer.BYTES + Integer.BYTES;
    for (Map.Entry<String, Long> entry : exactCounts.entrySet()) {
      totalSize +=
          Integer.BYTES
              + entry.getKey().getBytes(StandardCharsets.UTF_8).length
              + Long.BYTES; // key length + key + count
    }

    ByteBuffer buffer = ByteBuffer.allocate(totalSize).order(ByteOrder.LITTLE_ENDIAN);
    buffer.putInt(k);
    buffer.put((byte) policy.ordinal());
    buffer.putLong(sequenceLength);
    buffer.putInt(candidateCount);
    buffer.putInt(exactCounts.size());
    for (Map.Entry<String, Long> entry : exactCounts.entrySet()) {
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

    jsonNode.put("k", k);
    jsonNode.put("policy", policy.configName());
    jsonNode.put("n", sequenceLength);
    jsonNode.put("threshold", getThreshold());
    jsonNode.put("false_positives", getFalsePositives());

    ObjectNode frequent = objectMapper.createObjectNode();
    for (Map.Entry<String, Long> entry : exactCounts.entrySet()) {
      frequent.put(entry.getKey(), entry.getValue());
    }
    jsonNode.set("frequent", frequent);
    return jsonNode;
  }
}
