// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

import java.time.Duration;
import java.util.Objects;

/// @param maxHops       longest path considered by discovery
/// @param defaultTtl    lifetime of a delivered key when none is given
/// @param hopKeyLength  length of each hop key in bytes, zero to match the key being relayed
/// @param pathCacheSize number of (source, destination) routes kept in the path cache
public record RelayConfig(int maxHops, Duration defaultTtl, int hopKeyLength, int pathCacheSize) {

  public static final RelayConfig DEFAULT = new RelayConfig(5, Duration.ofHours(1), 0, 256);

  public RelayConfig {
    Objects.requireNonNull(defaultTtl, "defaultTtl required");
    if (maxHops < 1) {
      throw new IllegalArgumentException("maxHops must be at least 1");
    }
    if (defaultTtl.isNegative()) {
      throw new IllegalArgumentException("defaultTtl must not be negative");
    }
    if (hopKeyLength < 0) {
      throw new IllegalArgumentException("hopKeyLength must not be negative");
    }
    if (pathCacheSize < 1) {
      throw new IllegalArgumentException("pathCacheSize must be positive");
    }
  }
}
