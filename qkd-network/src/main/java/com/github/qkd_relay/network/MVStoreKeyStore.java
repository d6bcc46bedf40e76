// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;

import java.util.Optional;
import java.util.Set;

/// Delivered keys kept in an H2 [MVStore]. Each write is committed before returning. The store is not closed by
/// this class unless [#close()] is called.
public class MVStoreKeyStore implements KeyStore {
  private final MVStore store;
  private final MVMap<String, byte[]> keys;

  public MVStoreKeyStore(MVStore store) {
    this.store = store;
    this.keys = store.openMap("com.github.qkd_relay.network#keys");
  }

  @Override
  public void put(NetworkKey key) {
    keys.put(key.sessionId(), NetworkKeyPickler.INSTANCE.toBytes(key));
    store.commit();
  }

  @Override
  public Optional<NetworkKey> get(String sessionId) {
    return Optional.ofNullable(keys.get(sessionId)).map(NetworkKeyPickler.INSTANCE::fromBytes);
  }

  @Override
  public boolean remove(String sessionId) {
    final boolean removed = keys.remove(sessionId) != null;
    if (removed) {
      store.commit();
    }
    return removed;
  }

  @Override
  public Set<String> sessionIds() {
    return Set.copyOf(keys.keySet());
  }

  @Override
  public int size() {
    return keys.size();
  }

  @Override
  public void close() {
    store.close();
  }
}
