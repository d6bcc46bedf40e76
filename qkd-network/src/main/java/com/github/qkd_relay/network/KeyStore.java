// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

import java.util.Optional;
import java.util.Set;

/// Where a destination keeps delivered keys, by relay session id. Expiry is decided by the caller.
public interface KeyStore extends AutoCloseable {

  void put(NetworkKey key);

  Optional<NetworkKey> get(String sessionId);

  /// @return true if a key was removed
  boolean remove(String sessionId);

  Set<String> sessionIds();

  int size();

  @Override
  default void close() {
  }
}
