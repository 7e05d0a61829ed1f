/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.frequentsketch.summary;

/**
 * Thrown when a frequent elements query is made over an empty sequence. No majority or frequent
 * element exists over zero elements, so this is treated as a malformed call.
 */
public class EmptyInputException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public EmptyInputException() {
    super("Input sequence must not be empty");
  }
}
