// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

public class NoPathException extends RelayException {
  public NoPathException(NodeId source, NodeId destination, int maxHops) {
    super("no path from " + source + " to " + destination + " within " + maxHops + " hops");
  }
}
