// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/// A node and the secrets it shares with its neighbours. Mutated only by [KeyRelayNetwork] under its write lock.
public final class NetworkNode {
  private final NodeId id;
  private final NodeRole role;
  private final NodeAddress address;
  private final Map<NodeId, byte[]> sharedSecrets = new TreeMap<>();

  NetworkNode(NodeId id, NodeRole role, NodeAddress address) {
    this.id = Objects.requireNonNull(id, "id required");
    this.role = Objects.requireNonNull(role, "role required");
    this.address = Objects.requireNonNull(address, "address required");
  }

  public NodeId id() {
    return id;
  }

  public NodeRole role() {
    return role;
  }

  public NodeAddress address() {
    return address;
  }

  /// Snapshot of the neighbours this node shares a secret with.
  public Set<NodeId> neighborIds() {
    return Set.copyOf(sharedSecrets.keySet());
  }

  public boolean hasSecretWith(NodeId neighbor) {
    return sharedSecrets.containsKey(neighbor);
  }

  Optional<byte[]> sharedSecret(NodeId neighbor) {
    return Optional.ofNullable(sharedSecrets.get(neighbor)).map(byte[]::clone);
  }

  /// Live view for walks under the network's lock.
  Set<NodeId> neighbors() {
    return sharedSecrets.keySet();
  }

  void putSecret(NodeId neighbor, byte[] secret) {
    sharedSecrets.put(neighbor, secret.clone());
  }

  void removeSecret(NodeId neighbor) {
    final byte[] secret = sharedSecrets.remove(neighbor);
    if (secret != null) {
      Arrays.fill(secret, (byte) 0);
    }
  }

  @Override
  public String toString() {
    return "NetworkNode[" + id + " " + role + " neighbours=" + sharedSecrets.keySet() + "]";
  }
}
