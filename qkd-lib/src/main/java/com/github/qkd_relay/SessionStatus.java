// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/// What a session reports about itself. The key length is only present once the key is confirmed and the key value
/// itself is never part of the status.
public record SessionStatus(SessionPhase phase, Optional<String> sessionId, OptionalInt keyLength) {
  public SessionStatus {
    Objects.requireNonNull(phase, "phase required");
    Objects.requireNonNull(sessionId, "sessionId required");
    Objects.requireNonNull(keyLength, "keyLength required");
    if (keyLength.isPresent() && phase != SessionPhase.CONFIRMED) {
      throw new IllegalArgumentException("key length is only reported for a confirmed session");
    }
  }
}
