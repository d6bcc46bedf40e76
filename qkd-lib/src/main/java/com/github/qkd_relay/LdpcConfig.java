// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

/// Settings for [LdpcCode] construction and [LdpcReconciler].
///
/// @param codeLength    codeword length `n` of the first attempt
/// @param codeRate      `k / n` of the first attempt
/// @param rowWeight     ones per row in the sparse block of the parity check matrix
/// @param maxIterations belief propagation rounds per decode
/// @param maxRetries    further attempts at lower code rates for a block that fails to converge
/// @param retryRateStep how much the code rate drops on each retry
/// @param seed          seed for code construction. Both parties must agree on it so they build the same code
/// @param codeCacheSize codes kept per reconciler, least recently used evicted first
public record LdpcConfig(
    int codeLength,
    double codeRate,
    int rowWeight,
    int maxIterations,
    int maxRetries,
    double retryRateStep,
    long seed,
    int codeCacheSize
) {
  public static final LdpcConfig DEFAULT = new LdpcConfig(256, 0.5, 3, 50, 2, 0.1, 0x5EEDL, 16);

  public LdpcConfig {
    if (codeLength < 2) {
      throw new IllegalArgumentException("codeLength must be at least 2");
    }
    if (!(codeRate > 0.0 && codeRate < 1.0)) {
      throw new IllegalArgumentException("codeRate must be in (0, 1)");
    }
    if (rowWeight < 1) {
      throw new IllegalArgumentException("rowWeight must be at least 1");
    }
    if (maxIterations < 1) {
      throw new IllegalArgumentException("maxIterations must be at least 1");
    }
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must not be negative");
    }
    if (retryRateStep < 0.0 || retryRateStep >= 1.0) {
      throw new IllegalArgumentException("retryRateStep must be in [0, 1)");
    }
    if (codeCacheSize < 1) {
      throw new IllegalArgumentException("codeCacheSize must be at least 1");
    }
  }

  /// Message length `k` of the first attempt.
  public int messageLength() {
    return Math.max(1, (int) (codeLength * codeRate));
  }

  /// Code rate of a zero based attempt, never below one tenth.
  public double rateForAttempt(int attempt) {
    return Math.max(0.1, codeRate - attempt * retryRateStep);
  }
}
