// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

import java.util.List;
import java.util.Set;

/// Read-only snapshot of the topology. Secrets are never part of the view.
public record TopologyView(List<NodeView> nodes, List<Link> edges, boolean connected) {
  public TopologyView {
    nodes = List.copyOf(nodes);
    edges = List.copyOf(edges);
  }

  public record NodeView(NodeId id, NodeRole role, NodeAddress address, Set<NodeId> neighbors) {
    public NodeView {
      neighbors = Set.copyOf(neighbors);
    }
  }
}
