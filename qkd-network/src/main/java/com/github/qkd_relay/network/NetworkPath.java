// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/// A scored simple path.
///
/// @param nodes      the node sequence from source to destination
/// @param hopCount   number of edges, one less than the number of nodes
/// @param trustScore product of the trust factors of the intermediate nodes, 1.0 for a direct edge
/// @param latencyMs  sum of the edge latencies
public record NetworkPath(List<NodeId> nodes, int hopCount, double trustScore, double latencyMs) {

  /// Best first: highest trust, then lowest latency, then fewest hops.
  public static final Comparator<NetworkPath> BEST_FIRST = Comparator
      .comparingDouble((NetworkPath p) -> -p.trustScore())
      .thenComparingDouble(NetworkPath::latencyMs)
      .thenComparingInt(NetworkPath::hopCount);

  public NetworkPath {
    nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes required"));
    if (nodes.size() < 2) {
      throw new IllegalArgumentException("a path needs at least two nodes");
    }
    if (hopCount != nodes.size() - 1) {
      throw new IllegalArgumentException("hopCount " + hopCount + " does not match " + nodes.size() + " nodes");
    }
    if (!(trustScore >= 0.0 && trustScore <= 1.0)) {
      throw new IllegalArgumentException("trustScore must be in [0, 1]");
    }
  }

  public NodeId source() {
    return nodes.get(0);
  }

  public NodeId destination() {
    return nodes.get(nodes.size() - 1);
  }

  public List<NodeId> relays() {
    return nodes.subList(1, nodes.size() - 1);
  }
}
