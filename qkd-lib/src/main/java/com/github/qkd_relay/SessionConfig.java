// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

import java.time.Duration;
import java.util.Objects;

/// Session tuning.
///
/// @param shotCount          shots requested from the raw key source
/// @param rawKeyTimeout      how long to wait for the raw key source before aborting
/// @param discardSampledBits drop the bits revealed by error detection before reconciliation
/// @param securityBits       security parameter used to compute the safe privacy amplification length
public record SessionConfig(int shotCount, Duration rawKeyTimeout, boolean discardSampledBits, int securityBits) {

  public static final SessionConfig DEFAULT = new SessionConfig(100, Duration.ofSeconds(10), true, 64);

  public SessionConfig {
    Objects.requireNonNull(rawKeyTimeout, "rawKeyTimeout required");
    if (shotCount < 1) {
      throw new IllegalArgumentException("shotCount must be positive");
    }
    if (rawKeyTimeout.isNegative() || rawKeyTimeout.isZero()) {
      throw new IllegalArgumentException("rawKeyTimeout must be positive");
    }
    if (securityBits < 0) {
      throw new IllegalArgumentException("securityBits must not be negative");
    }
  }

  public SessionConfig withRawKeyTimeout(Duration timeout) {
    return new SessionConfig(shotCount, timeout, discardSampledBits, securityBits);
  }
}
