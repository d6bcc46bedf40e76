// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InMemoryKeyStoreTest {

  static NetworkKey key(String sessionId, byte fill) {
    final NodeId source = new NodeId("a");
    final NodeId destination = new NodeId("b");
    final byte[] material = new byte[16];
    Arrays.fill(material, fill);
    return new NetworkKey(material, sessionId, source, destination,
        new NetworkPath(List.of(source, destination), 1, 1.0, 2.5),
        Instant.parse("2025-01-01T00:00:00Z"), Duration.ofMinutes(5));
  }

  @Test
  public void evictsLeastRecentlyUsed() {
    final InMemoryKeyStore store = new InMemoryKeyStore(2);
    store.put(key("one", (byte) 1));
    store.put(key("two", (byte) 2));
    assertTrue(store.get("one").isPresent());
    store.put(key("three", (byte) 3));

    assertEquals(2, store.size());
    assertThat(store.sessionIds()).containsExactlyInAnyOrder("one", "three");
    assertFalse(store.get("two").isPresent());
  }

  @Test
  public void returnsCopies() {
    final InMemoryKeyStore store = new InMemoryKeyStore(4);
    final NetworkKey original = key("one", (byte) 9);
    store.put(original);
    original.key()[0] = 0;

    final NetworkKey fetched = store.get("one").orElseThrow();
    assertEquals(9, fetched.key()[0]);
    fetched.key()[1] = 0;
    assertEquals(9, store.get("one").orElseThrow().key()[1]);
  }

  @Test
  public void removeReportsWhetherPresent() {
    final InMemoryKeyStore store = new InMemoryKeyStore(4);
    store.put(key("one", (byte) 1));
    assertTrue(store.remove("one"));
    assertFalse(store.remove("one"));
    assertEquals(0, store.size());
  }
}
