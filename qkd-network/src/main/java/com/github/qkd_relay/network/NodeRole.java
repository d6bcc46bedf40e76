// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

/// What a node does in the network. The trust factor weighs a path each time it passes through the node as an
/// intermediate hop.
public enum NodeRole {
  SOURCE(0.7),
  DESTINATION(0.7),
  RELAY(0.7),
  TRUSTED_RELAY(0.9);

  private final double trustFactor;

  NodeRole(double trustFactor) {
    this.trustFactor = trustFactor;
  }

  public double trustFactor() {
    return trustFactor;
  }
}
