// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

import java.util.Objects;

/// Output of a [RawKeySource].
///
/// @param bytes    the raw key, correlated with but not necessarily equal to the peer's
/// @param fidelity the quality the source claims for this key, in `[0, 1]`
/// @param sourceId identifies the device or job that produced the key
public record RawKey(byte[] bytes, double fidelity, String sourceId) {
  public RawKey {
    Objects.requireNonNull(bytes, "bytes required");
    Objects.requireNonNull(sourceId, "sourceId required");
    if (bytes.length == 0) {
      throw new IllegalArgumentException("raw key must not be empty");
    }
    if (!(fidelity >= 0.0 && fidelity <= 1.0)) {
      throw new IllegalArgumentException("fidelity must be in [0, 1] but was " + fidelity);
    }
  }

  @Override
  public String toString() {
    return "RawKey[length=" + bytes.length + " fidelity=" + fidelity + " source=" + sourceId + "]";
  }
}
