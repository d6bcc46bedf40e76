// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

/// The phases of a key agreement session in the order they must be completed. A session only ever moves to the next
/// phase or to [#ABORTED]. [#CONFIRMED] and [#ABORTED] are terminal.
public enum SessionPhase {
  IDLE,
  AUTHENTICATING,
  KEY_GENERATING,
  ERROR_DETECTING,
  RECONCILING,
  PRIVACY_AMPLIFYING,
  VERIFYING,
  CONFIRMED,
  ABORTED;

  public boolean isTerminal() {
    return this == CONFIRMED || this == ABORTED;
  }

  /// True when `next` is the phase that immediately follows this one.
  public boolean precedes(SessionPhase next) {
    return !isTerminal() && next != ABORTED && next.ordinal() == ordinal() + 1;
  }
}
