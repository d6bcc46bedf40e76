// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

/// Settings for [CascadeReconciler].
///
/// @param initialBlockSize block size in bits of the first pass, halved on each later pass down to one
/// @param passes           maximum number of passes
/// @param bisectLimit      blocks at or below this length are compared bit by bit rather than bisected
/// @param earlyStop        stop as soon as a pass corrects nothing. Even counts of errors inside one block are invisible
///                         to parity so disabling this and running until the block size reaches one finds every error
public record CascadeConfig(int initialBlockSize, int passes, int bisectLimit, boolean earlyStop) {
  public static final CascadeConfig DEFAULT = new CascadeConfig(8, 4, 4, true);

  public CascadeConfig {
    if (initialBlockSize < 1) {
      throw new IllegalArgumentException("initialBlockSize must be at least 1");
    }
    if (passes < 1) {
      throw new IllegalArgumentException("passes must be at least 1");
    }
    if (bisectLimit < 1) {
      throw new IllegalArgumentException("bisectLimit must be at least 1");
    }
  }

  /// Block size for a one based pass number.
  public int blockSize(int pass) {
    final int shift = Math.min(pass - 1, 30);
    return Math.max(1, initialBlockSize >> shift);
  }
}
