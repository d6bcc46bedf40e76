// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/// A software raw key source. Sources made by [#pair(int, double, long)] share a seed: the n-th call on the first
/// source and the n-th call on the second yield the same base key, with each bit of the second flipped independently
/// with the configured error rate.
public final class SimulatedRawKeySource implements RawKeySource {

  private static final long NOISE_SALT = 0x9E3779B97F4A7C15L;

  private final String sourceId;
  private final int keyLength;
  private final double errorRate;
  private final long seed;
  private final AtomicLong round = new AtomicLong();

  private SimulatedRawKeySource(String sourceId, int keyLength, double errorRate, long seed) {
    if (keyLength < 1) {
      throw new IllegalArgumentException("keyLength must be positive");
    }
    if (!(errorRate >= 0.0 && errorRate < 0.5)) {
      throw new IllegalArgumentException("errorRate must be in [0, 0.5)");
    }
    this.sourceId = sourceId;
    this.keyLength = keyLength;
    this.errorRate = errorRate;
    this.seed = seed;
  }

  public record Pair(SimulatedRawKeySource reference, SimulatedRawKeySource noisy) {
  }

  /// Two correlated sources producing `keyLength` byte keys that disagree on about `errorRate` of their bits.
  public static Pair pair(int keyLength, double errorRate, long seed) {
    return new Pair(
        new SimulatedRawKeySource("sim-a-" + Long.toHexString(seed), keyLength, 0.0, seed),
        new SimulatedRawKeySource("sim-b-" + Long.toHexString(seed), keyLength, errorRate, seed));
  }

  @Override
  public RawKey generateRawKey(int shotCount, boolean useHardware) {
    final long n = round.getAndIncrement();
    final byte[] key = new byte[keyLength];
    new Random(seed + n * 1_000_003L).nextBytes(key);
    if (errorRate > 0.0) {
      final Random noise = new Random((seed ^ NOISE_SALT) + n);
      for (int i = 0; i < keyLength * 8; i++) {
        if (noise.nextDouble() < errorRate) {
          key[i >>> 3] ^= (byte) (1 << (i & 7));
        }
      }
    }
    QkdLogger.LOGGER.finer(() -> sourceId + " round " + n + " produced " + keyLength + " bytes for " + shotCount
        + " shots" + (useHardware ? " (hardware requested, simulating)" : ""));
    return new RawKey(key, 1.0 - errorRate, sourceId);
  }
}
