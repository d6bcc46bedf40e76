// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

import com.github.qkd_relay.QkdCrypto;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class KeyRelayNetworkTest {

  @BeforeAll
  static void setupLogging() {
    LoggerConfig.initialize();
  }

  /// A clock the test can move forward.
  static final class SteppingClock extends Clock {
    private Instant now;

    SteppingClock(Instant start) {
      this.now = start;
    }

    void advance(Duration step) {
      now = now.plus(step);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }

  static final NodeId SOURCE = new NodeId("source");
  static final NodeId R1 = new NodeId("r1");
  static final NodeId R2 = new NodeId("r2");
  static final NodeId R3 = new NodeId("r3");
  static final NodeId DESTINATION = new NodeId("destination");

  final SteppingClock clock = new SteppingClock(Instant.parse("2025-01-01T00:00:00Z"));

  KeyRelayNetwork network(HopKeySource hopKeys) {
    return new KeyRelayNetwork(RelayConfig.DEFAULT, new InMemoryKeyStore(64), hopKeys, clock);
  }

  /// source - r1 - r2 - r3 - destination
  KeyRelayNetwork chain(HopKeySource hopKeys) {
    final KeyRelayNetwork network = network(hopKeys);
    network.addNode(SOURCE, NodeRole.SOURCE);
    network.addNode(R1, NodeRole.RELAY);
    network.addNode(R2, NodeRole.TRUSTED_RELAY);
    network.addNode(R3, NodeRole.RELAY);
    network.addNode(DESTINATION, NodeRole.DESTINATION);
    network.addLink(SOURCE, R1, QkdCrypto.randomBytes(32), 1.0);
    network.addLink(R1, R2, QkdCrypto.randomBytes(32), 2.0);
    network.addLink(R2, R3, QkdCrypto.randomBytes(32), 3.0);
    network.addLink(R3, DESTINATION, QkdCrypto.randomBytes(32), 4.0);
    return network;
  }

  @Test
  public void relaysOverFourHops() {
    final KeyRelayNetwork network = chain(DerivedHopKeySource.INSTANCE);
    final byte[] key = QkdCrypto.randomBytes(32);

    final RelayResult result = network.distributeKey(SOURCE, DESTINATION, key);

    assertTrue(result.success());
    assertEquals(4, result.path().hopCount());
    assertThat(result.path().relays()).containsExactly(R1, R2, R3);
    assertEquals(0.7 * 0.9 * 0.7, result.path().trustScore(), 1e-12);
    assertEquals(10.0, result.path().latencyMs(), 1e-12);
    assertThat(result.hops()).extracting(RelayResult.Hop::from).containsExactly(SOURCE, R1, R2, R3);
    assertThat(result.hops()).extracting(RelayResult.Hop::maskedFingerprint)
        .doesNotContain(QkdCrypto.fingerprint(key))
        .doesNotHaveDuplicates();

    final String sessionId = result.key().orElseThrow().sessionId();
    final NetworkKey stored = network.getKey(sessionId).orElseThrow();
    assertArrayEquals(key, stored.key());
    assertEquals(SOURCE, stored.source());
    assertEquals(DESTINATION, stored.destination());
    assertEquals(clock.instant(), stored.createdAt());
    assertEquals(RelayConfig.DEFAULT.defaultTtl(), stored.ttl());
    assertEquals(clock.instant().plus(Duration.ofHours(1)), stored.expiresAt());
  }

  @Test
  public void relaysWithSessionAgreedHopKeys() {
    final KeyRelayNetwork network = chain(SessionHopKeySource.simulated(0.0));
    final byte[] key = QkdCrypto.randomBytes(16);

    final RelayResult result = network.distributeKey(SOURCE, DESTINATION, key);

    assertTrue(result.success());
    assertArrayEquals(key, network.getKey(result.key().orElseThrow().sessionId()).orElseThrow().key());
  }

  @Test
  public void noPathBetweenDisconnectedNodes() {
    final KeyRelayNetwork network = chain(DerivedHopKeySource.INSTANCE);
    final NodeId island = new NodeId("island");
    network.addNode(island, NodeRole.DESTINATION);

    assertThat(network.findPaths(SOURCE, island)).isEmpty();
    assertThatThrownBy(() -> network.distributeKey(SOURCE, island, new byte[16]))
        .isInstanceOf(NoPathException.class);
  }

  @Test
  public void hopLimitHidesLongPaths() {
    final KeyRelayNetwork network = chain(DerivedHopKeySource.INSTANCE);
    assertThat(network.findPaths(SOURCE, DESTINATION, 3)).isEmpty();
    assertThat(network.findPaths(SOURCE, DESTINATION, 4)).hasSize(1);
  }

  @Test
  public void invalidExplicitPathRelaysNothing() {
    final InMemoryKeyStore store = new InMemoryKeyStore(8);
    final KeyRelayNetwork network = new KeyRelayNetwork(RelayConfig.DEFAULT, store,
        DerivedHopKeySource.INSTANCE, clock);
    network.addNode(SOURCE, NodeRole.SOURCE);
    network.addNode(R1, NodeRole.RELAY);
    network.addNode(DESTINATION, NodeRole.DESTINATION);
    network.addLink(SOURCE, R1, QkdCrypto.randomBytes(32), 1.0);
    final byte[] key = new byte[16];

    // r1 and destination share no secret
    assertThatThrownBy(() -> network.distributeKey(SOURCE, DESTINATION, key, List.of(SOURCE, R1, DESTINATION)))
        .isInstanceOf(InvalidPathException.class)
        .hasMessageContaining("r1");
    assertThatThrownBy(() -> network.distributeKey(SOURCE, DESTINATION, key, List.of(SOURCE)))
        .isInstanceOf(InvalidPathException.class);
    assertThatThrownBy(() -> network.distributeKey(SOURCE, DESTINATION, key, List.of(R1, DESTINATION)))
        .isInstanceOf(InvalidPathException.class);
    assertThatThrownBy(() -> network.distributeKey(SOURCE, DESTINATION, key,
        List.of(SOURCE, new NodeId("ghost"), DESTINATION)))
        .isInstanceOf(InvalidPathException.class);
    assertThatThrownBy(() -> network.distributeKey(SOURCE, DESTINATION, key,
        List.of(SOURCE, R1, SOURCE, DESTINATION)))
        .isInstanceOf(InvalidPathException.class);
    assertEquals(0, store.size());
  }

  @Test
  public void explicitPathOverridesBestPath() {
    final KeyRelayNetwork network = chain(DerivedHopKeySource.INSTANCE);
    network.addLink(SOURCE, DESTINATION, QkdCrypto.randomBytes(32), 50.0);
    assertThat(network.findPaths(SOURCE, DESTINATION).get(0).hopCount()).isEqualTo(1);

    final List<NodeId> longWay = List.of(SOURCE, R1, R2, R3, DESTINATION);
    final RelayResult result = network.distributeKey(SOURCE, DESTINATION, QkdCrypto.randomBytes(8), longWay);
    assertTrue(result.success());
    assertEquals(longWay, result.path().nodes());
  }

  @Test
  public void rejectsSameEndpointsAndUnknownNodes() {
    final KeyRelayNetwork network = chain(DerivedHopKeySource.INSTANCE);
    assertThatThrownBy(() -> network.findPaths(SOURCE, SOURCE)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> network.findPaths(SOURCE, new NodeId("ghost")))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> network.addNode(R1, NodeRole.RELAY)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> network.distributeKey(SOURCE, DESTINATION, new byte[0]))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void topologyChangesClearPathCache() {
    final KeyRelayNetwork network = chain(DerivedHopKeySource.INSTANCE);
    network.findPaths(SOURCE, DESTINATION);
    network.findPaths(R1, DESTINATION);
    assertEquals(2, network.cachedRoutes());
    assertThat(network.findPaths(SOURCE, DESTINATION)).isSameAs(network.findPaths(SOURCE, DESTINATION));

    network.addLink(SOURCE, R3, QkdCrypto.randomBytes(32), 1.0);
    assertEquals(0, network.cachedRoutes());
    assertThat(network.findPaths(SOURCE, DESTINATION)).hasSize(2);

    network.findPaths(SOURCE, DESTINATION);
    assertTrue(network.removeLink(R2, R3));
    assertEquals(0, network.cachedRoutes());
    assertThat(network.findPaths(SOURCE, DESTINATION)).hasSize(1);
    assertFalse(network.removeLink(R2, R3));
  }

  @Test
  public void keysExpireAfterTtl() {
    final KeyRelayNetwork network = chain(DerivedHopKeySource.INSTANCE);
    final RelayResult shortLived = network.distributeKey(SOURCE, DESTINATION, QkdCrypto.randomBytes(16),
        Optional.empty(), Duration.ofMinutes(1), "short");
    final RelayResult longLived = network.distributeKey(SOURCE, DESTINATION, QkdCrypto.randomBytes(16),
        Optional.empty(), Duration.ofHours(1), "long");
    assertTrue(shortLived.success());
    assertTrue(longLived.success());

    clock.advance(Duration.ofMinutes(1));
    assertTrue(network.getKey("short").isPresent());

    clock.advance(Duration.ofSeconds(1));
    assertFalse(network.getKey("short").isPresent());
    assertTrue(network.getKey("long").isPresent());

    clock.advance(Duration.ofHours(2));
    assertEquals(1, network.purgeExpired());
    assertFalse(network.getKey("long").isPresent());
  }

  @Test
  public void topologyViewReportsConnectivity() {
    final KeyRelayNetwork network = chain(DerivedHopKeySource.INSTANCE);
    final TopologyView view = network.topology();
    assertTrue(view.connected());
    assertEquals(5, view.nodes().size());
    assertEquals(4, view.edges().size());
    assertThat(view.edges()).anySatisfy(link -> assertTrue(link.joins(R3, R2)));
    assertThat(view.nodes()).filteredOn(n -> n.id().equals(R2))
        .singleElement()
        .satisfies(n -> assertThat(n.neighbors()).containsExactlyInAnyOrder(R1, R3));

    network.removeLink(R2, R3);
    assertFalse(network.topology().connected());
  }

  @Test
  public void lookupsRunWhileTopologyChanges() throws Exception {
    final KeyRelayNetwork network = chain(DerivedHopKeySource.INSTANCE);
    final byte[] shortcutSecret = QkdCrypto.randomBytes(32);
    final ExecutorService workers = Executors.newFixedThreadPool(4);
    final CountDownLatch start = new CountDownLatch(1);
    try {
      final List<Future<Integer>> results = new ArrayList<>();
      for (int w = 0; w < 4; w++) {
        results.add(workers.submit(() -> {
          start.await();
          int delivered = 0;
          for (int i = 0; i < 200; i++) {
            assertThat(network.findPaths(SOURCE, DESTINATION)).isNotEmpty();
            if (network.distributeKey(SOURCE, DESTINATION, QkdCrypto.randomBytes(16)).success()) {
              delivered++;
            }
          }
          return delivered;
        }));
      }
      start.countDown();
      for (int i = 0; i < 100; i++) {
        network.addLink(SOURCE, DESTINATION, shortcutSecret, 0.5);
        assertTrue(network.removeLink(SOURCE, DESTINATION));
        assertThat(network.findPaths(SOURCE, DESTINATION))
            .noneMatch(path -> usesEdge(path, SOURCE, DESTINATION));
      }
      for (Future<Integer> result : results) {
        assertEquals(200, result.get(30, TimeUnit.SECONDS));
      }
    } finally {
      workers.shutdownNow();
    }
    assertThat(network.findPaths(SOURCE, DESTINATION)).singleElement()
        .satisfies(path -> assertEquals(4, path.hopCount()));
  }

  static boolean usesEdge(NetworkPath path, NodeId x, NodeId y) {
    final List<NodeId> nodes = path.nodes();
    for (int i = 0; i + 1 < nodes.size(); i++) {
      if (Link.between(x, y, 0.0).joins(nodes.get(i), nodes.get(i + 1))) {
        return true;
      }
    }
    return false;
  }

  @Test
  public void shortHopKeysStillRelay() {
    final KeyRelayNetwork network = new KeyRelayNetwork(new RelayConfig(5, Duration.ofHours(1), 8, 16),
        new InMemoryKeyStore(8), DerivedHopKeySource.INSTANCE, clock);
    network.addNode(SOURCE, NodeRole.SOURCE);
    network.addNode(DESTINATION, NodeRole.DESTINATION);
    network.addLink(SOURCE, DESTINATION, QkdCrypto.randomBytes(32), 1.0);

    final byte[] key = QkdCrypto.randomBytes(32);
    final RelayResult result = network.distributeKey(SOURCE, DESTINATION, key);
    assertTrue(result.success());
    assertArrayEquals(key, result.key().orElseThrow().key());
  }
}
