// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

/// Hop keys derived deterministically from the link secret.
public final class DerivedHopKeySource implements HopKeySource {

  public static final DerivedHopKeySource INSTANCE = new DerivedHopKeySource();

  private DerivedHopKeySource() {
  }

  @Override
  public byte[] hopKey(NodeId from, NodeId to, byte[] sharedSecret, String context, int length) {
    return HopKeys.deriveHopKey(sharedSecret, context, length);
  }
}
