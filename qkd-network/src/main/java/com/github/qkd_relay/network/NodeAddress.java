// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

import java.util.Objects;

/// Where a node can be reached. Reported by the topology query only; the relay itself runs in process.
public record NodeAddress(String host, int port) {
  public NodeAddress {
    Objects.requireNonNull(host, "host required");
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("Invalid port: " + port);
    }
  }

  public NodeAddress(int port) {
    this("localhost", port);
  }
}
