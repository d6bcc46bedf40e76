// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

/// Reconciliation did not converge within its pass or iteration budget. The caller may retry with another block size
/// or code rate.
public class ReconciliationDivergenceException extends QkdException {
  private final transient ReconciliationResult result;

  public ReconciliationDivergenceException(String message, ReconciliationResult result) {
    super(message, true);
    this.result = result;
  }

  /// The partial outcome without key material.
  public ReconciliationResult result() {
    return result;
  }
}
