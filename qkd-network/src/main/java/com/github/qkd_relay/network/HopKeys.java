// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

import com.github.qkd_relay.BitVector;
import com.github.qkd_relay.QkdCrypto;

import java.nio.charset.StandardCharsets;

/// Pure functions for per hop key wrapping.
public final class HopKeys {

  static final byte[] SALT = "qkd-relay hop key".getBytes(StandardCharsets.UTF_8);

  private HopKeys() {
  }

  /// Derive `length` bytes from a link secret with HKDF-SHA256. The context binds the key to one hop of one relay
  /// session so that no two hops reuse a mask.
  public static byte[] deriveHopKey(byte[] secret, String context, int length) {
    if (secret.length == 0) {
      throw new IllegalArgumentException("secret must not be empty");
    }
    if (length < 1) {
      throw new IllegalArgumentException("length must be positive");
    }
    final byte[] prk = QkdCrypto.extract(SALT, secret);
    try {
      return QkdCrypto.expand(prk, context.getBytes(StandardCharsets.UTF_8), length);
    } finally {
      BitVector.wipe(prk);
    }
  }

  /// XOR `data` with `hopKey`. Masking twice with the same key restores the data.
  public static byte[] mask(byte[] data, byte[] hopKey) {
    return BitVector.xor(data, hopKey);
  }

  /// Context string for hop `index` of a relay session.
  public static String context(String sessionId, int index, NodeId from, NodeId to) {
    return sessionId + "/" + index + "/" + from.id() + "->" + to.id();
  }
}
