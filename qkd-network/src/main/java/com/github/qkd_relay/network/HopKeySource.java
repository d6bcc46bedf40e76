// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

/// Supplies the key that masks the relayed key across one hop. Both endpoints of the hop must arrive at the same key.
@FunctionalInterface
public interface HopKeySource {

  /// @param from         the sending node
  /// @param to           the receiving node
  /// @param sharedSecret the secret provisioned on the link
  /// @param context      unique per hop of a relay session
  /// @param length       bytes required
  byte[] hopKey(NodeId from, NodeId to, byte[] sharedSecret, String context, int length);
}
