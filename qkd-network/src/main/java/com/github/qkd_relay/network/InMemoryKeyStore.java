// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.github.qkd_relay.network.RelayLogger.LOGGER;

/// Bounded in-memory store that evicts the least recently used key once full.
public class InMemoryKeyStore implements KeyStore {

  private final Map<String, NetworkKey> keys;

  public InMemoryKeyStore(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.keys = new LinkedHashMap<>(16, 0.75f, true) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, NetworkKey> eldest) {
        if (size() > capacity) {
          LOGGER.fine(() -> "evicting key for session " + eldest.getKey());
          Arrays.fill(eldest.getValue().key(), (byte) 0);
          return true;
        }
        return false;
      }
    };
  }

  @Override
  public synchronized void put(NetworkKey key) {
    keys.put(key.sessionId(), key.copy());
  }

  @Override
  public synchronized Optional<NetworkKey> get(String sessionId) {
    return Optional.ofNullable(keys.get(sessionId)).map(NetworkKey::copy);
  }

  @Override
  public synchronized boolean remove(String sessionId) {
    final NetworkKey removed = keys.remove(sessionId);
    if (removed != null) {
      Arrays.fill(removed.key(), (byte) 0);
      return true;
    }
    return false;
  }

  @Override
  public synchronized Set<String> sessionIds() {
    return Set.copyOf(keys.keySet());
  }

  @Override
  public synchronized int size() {
    return keys.size();
  }
}
