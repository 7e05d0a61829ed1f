/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.datamodel;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;
import dev.projectasap.frequentsketch.summary.EvictionPolicy;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import org.junit.jupiter.api.Test;

class VerifiedFrequenciesTest {

  @Test
  void reportsThresholdAndRejectedCandidates() {
    VerifiedFrequencies result =
        new VerifiedFrequencies(
            3, EvictionPolicy.SINGLE_EVICT, 7, 2, ImmutableMap.of("x", 3L, "y", 3L));

    assertThat(result.getThreshold()).isEqualTo(1);
    assertThat(result.getFalsePositives()).isZero();

    JsonNode json = result.serializeToJson();
    assertThat(json.get("policy").asText()).isEqualTo("single_evict");
    assertThat(json.get("n").asLong()).isEqualTo(7);
    assertThat(json.get("threshold").asLong()).isEqualTo(1);
    assertThat(json.get("frequent").get("x").asLong()).isEqualTo(3);
  }

  @Test
  void emptyResultStillSerializes() {
    VerifiedFrequencies result =
        new VerifiedFrequencies(2, EvictionPolicy.GROUP_DECREMENT, 6, 1, ImmutableMap.of());

    assertThat(result.getFalsePositives()).isEqualTo(1);
    assertThat(result.serializeToJson().get("frequent").size()).isZero();

    ByteBuffer buffer = ByteBuffer.wrap(result.serializeToBytes()).order(ByteOrder.LITTLE_ENDIAN);
    assertThat(buffer.getInt()).isEqualTo(2);
    assertThat(buffer.get()).isEqualTo((byte) 0);
    assertThat(buffer.getLong()).isEqualTo(6);
    assertThat(buffer.getInt()).isEqualTo(1);
    assertThat(buffer.getInt()).isZero();
    assertThat(buffer.hasRemaining()).isFalse();
  }
}
