// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

import java.util.Objects;

public record NodeId(String id) implements Comparable<NodeId> {
  public NodeId {
    Objects.requireNonNull(id, "id required");
    if (id.isBlank()) {
      throw new IllegalArgumentException("Node ID must not be blank");
    }
  }

  @Override
  public int compareTo(NodeId other) {
    return id.compareTo(other.id);
  }

  @Override
  public String toString() {
    return id;
  }
}
