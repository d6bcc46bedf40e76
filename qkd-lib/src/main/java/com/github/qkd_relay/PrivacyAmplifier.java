// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

import java.nio.ByteBuffer;
import java.security.MessageDigest;

/// Compresses a reconciled key through a hash chain so that what leaked during error estimation and reconciliation
/// says almost nothing about the output.
///
/// The output is `H(seed | key | 0) | H(seed | key | 1) | ...` truncated to the requested length, where the counter
/// is a four byte big endian integer and `H` is [QkdCrypto#getMessageDigest()]. The seed is public but must be fresh
/// for every session. Both parties apply the same seed and length to identical input and obtain identical output.
public final class PrivacyAmplifier {

  public static final int SEED_LENGTH = 32;

  private PrivacyAmplifier() {
  }

  public static byte[] newSeed() {
    return QkdCrypto.randomBytes(SEED_LENGTH);
  }

  public static byte[] amplify(byte[] rawKey, int outputLength, byte[] seed) {
    if (outputLength < 0) {
      throw new IllegalArgumentException("outputLength must not be negative");
    }
    final byte[] output = new byte[outputLength];
    final MessageDigest md = QkdCrypto.getMessageDigest();
    final ByteBuffer counter = ByteBuffer.allocate(Integer.BYTES);
    int offset = 0;
    for (int i = 0; offset < outputLength; i++) {
      md.update(seed);
      md.update(rawKey);
      md.update(counter.clear().putInt(i).array());
      final byte[] block = md.digest();
      final int chunk = Math.min(block.length, outputLength - offset);
      System.arraycopy(block, 0, output, offset, chunk);
      offset += chunk;
    }
    return output;
  }

  /// Longest output in bytes that keeps the disclosed information below `2^-securityBits`, estimated as the
  /// reconciled length less what was disclosed and a security margin of twice the security parameter. Never negative.
  ///
  /// @param reconciledBits length of the reconciled key in bits
  /// @param leakedBits     bits disclosed by sampling and reconciliation
  /// @param securityBits   security parameter
  public static int secureLength(int reconciledBits, int leakedBits, int securityBits) {
    final int available = reconciledBits - leakedBits - 2 * securityBits;
    return Math.max(0, available / 8);
  }
}
