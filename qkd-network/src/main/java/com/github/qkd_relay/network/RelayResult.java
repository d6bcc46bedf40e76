// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Outcome of a relay.
///
/// @param success true when the destination recovered exactly the key the source sent
/// @param key     the key as stored at the destination, present on success
/// @param path    the path used
/// @param hops    what crossed each link, in order
public record RelayResult(boolean success, Optional<NetworkKey> key, NetworkPath path, List<Hop> hops) {
  public RelayResult {
    Objects.requireNonNull(key, "key required");
    Objects.requireNonNull(path, "path required");
    hops = List.copyOf(hops);
    if (success != key.isPresent()) {
      throw new IllegalArgumentException("a key is present exactly when the relay succeeded");
    }
  }

  /// One link traversal. Only the masked key crossed the link; its fingerprint is kept for audit.
  public record Hop(int index, NodeId from, NodeId to, String maskedFingerprint) {
  }
}
