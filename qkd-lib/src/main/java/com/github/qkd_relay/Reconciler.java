// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

/// Makes two imperfectly correlated keys identical using only public parity traffic. Implementations are
/// interchangeable behind [QkdSession].
public interface Reconciler {

  /// Reconcile two packed keys. Keys of different lengths are truncated to the shorter.
  ///
  /// @param keyA      the reference party's key
  /// @param keyB      the counterpart's key
  /// @param errorRate the estimated bit error rate from sampling, in `[0, 1]`
  /// @return the corrected keys and statistics; the inputs are not modified
  /// @throws IllegalArgumentException if `errorRate` is not in `[0, 1]`
  ReconciliationResult reconcile(byte[] keyA, byte[] keyB, double errorRate);

  /// Name exchanged in the init handshake so both parties run the same engine.
  String name();

  static double requireErrorRate(double errorRate) {
    if (!(errorRate >= 0.0 && errorRate <= 1.0)) {
      throw new IllegalArgumentException("errorRate must be in [0, 1] but was " + errorRate);
    }
    return errorRate;
  }
}
