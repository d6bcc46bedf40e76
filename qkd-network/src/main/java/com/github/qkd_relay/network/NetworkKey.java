// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/// A key delivered to its destination.
///
/// @param key         the key material
/// @param sessionId   the relay session that delivered it
/// @param source      the originating node
/// @param destination the node holding the key
/// @param path        the path it travelled
/// @param createdAt   when it was stored
/// @param ttl         how long it stays valid
public record NetworkKey(byte[] key,
                         String sessionId,
                         NodeId source,
                         NodeId destination,
                         NetworkPath path,
                         Instant createdAt,
                         Duration ttl) {
  public NetworkKey {
    Objects.requireNonNull(key, "key required");
    Objects.requireNonNull(sessionId, "sessionId required");
    Objects.requireNonNull(source, "source required");
    Objects.requireNonNull(destination, "destination required");
    Objects.requireNonNull(path, "path required");
    Objects.requireNonNull(createdAt, "createdAt required");
    Objects.requireNonNull(ttl, "ttl required");
    if (ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must not be negative");
    }
  }

  /// True once more than `ttl` has passed since creation.
  public boolean isExpired(Instant now) {
    return Duration.between(createdAt, now).compareTo(ttl) > 0;
  }

  /// Copy with its own key array.
  public NetworkKey copy() {
    return new NetworkKey(key.clone(), sessionId, source, destination, path, createdAt, ttl);
  }

  public Instant expiresAt() {
    return createdAt.plus(ttl);
  }

  @Override
  public String toString() {
    return "NetworkKey[session=" + sessionId + " " + source + "->" + destination + " length=" + key.length
        + " hops=" + path.hopCount() + " createdAt=" + createdAt + " ttl=" + ttl + "]";
  }
}
