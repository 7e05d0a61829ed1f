/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.summary;

/**
 * Thrown when verification finishes with no element above the threshold and the caller asked for
 * at least one. The sequence itself was valid; it simply has no frequent element.
 */
public class NoFrequentElementsException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final long sequenceLength;
  private final long threshold;

  public NoFrequentElementsException(long sequenceLength, long threshold) {
    this(
        "No element occurs more than " + threshold + " times in " + sequenceLength + " elements",
        sequenceLength,
        threshold);
  }

  protected NoFrequentElementsException(String message, long sequenceLength, long threshold) {
    super(message);
    this.sequenceLength = sequenceLength;
    this.threshold = threshold;
  }

  /** Length of the verified sequence. */
  public long getSequenceLength() {
    return sequenceLength;
  }

  /** Count an element had to exceed. */
  public long getThreshold() {
    return threshold;
  }
}
