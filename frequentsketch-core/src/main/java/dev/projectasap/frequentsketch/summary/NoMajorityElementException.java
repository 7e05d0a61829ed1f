/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.summary;

/** Thrown when no element occurs more than {@code floor(n/2)} times. */
public class NoMajorityElementException extends NoFrequentElementsException {
  private static final long serialVersionUID = 1L;

  public NoMajorityElementException(long sequenceLength) {
    super(
        "No majority element in " + sequenceLength + " elements",
        sequenceLength,
        FrequencyVerifier.majorityThreshold(sequenceLength));
  }
}
