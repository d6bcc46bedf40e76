// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/// Ranking of discovered paths over random topologies.
public class PathScoringPropertyTests {

  static final NodeId A = new NodeId("a");
  static final NodeId B = new NodeId("b");

  /// Every intermediate node costs trust, so a direct link wins whatever its latency.
  @Property(tries = 200)
  void directLinkRanksFirst(@ForAll @DoubleRange(min = 0.0, max = 1000.0) double direct,
                            @ForAll @DoubleRange(min = 0.0, max = 1000.0) double viaRelay,
                            @ForAll boolean trusted) {
    final KeyRelayNetwork network = KeyRelayNetwork.inMemory();
    final NodeId relay = new NodeId("relay");
    network.addNode(A, NodeRole.SOURCE);
    network.addNode(B, NodeRole.DESTINATION);
    network.addNode(relay, trusted ? NodeRole.TRUSTED_RELAY : NodeRole.RELAY);
    network.addLink(A, B, new byte[]{1}, direct);
    network.addLink(A, relay, new byte[]{2}, viaRelay / 2);
    network.addLink(relay, B, new byte[]{3}, viaRelay / 2);

    final List<NetworkPath> paths = network.findPaths(A, B);
    assertThat(paths).hasSize(2);
    assertThat(paths.get(0).nodes()).containsExactly(A, B);
    assertThat(paths.get(0).trustScore()).isEqualTo(1.0);
    assertThat(paths.get(1).trustScore()).isEqualTo(trusted ? 0.9 : 0.7);
  }

  /// Results are sorted, simple, within the hop limit and start and end where asked.
  @Property(tries = 100)
  void discoveredPathsAreSimpleAndSorted(@ForAll long seed,
                                         @ForAll @IntRange(min = 3, max = 8) int nodeCount,
                                         @ForAll @IntRange(min = 1, max = 5) int maxHops) {
    final Random random = new Random(seed);
    final KeyRelayNetwork network = KeyRelayNetwork.inMemory();
    final NodeRole[] roles = NodeRole.values();
    for (int i = 0; i < nodeCount; i++) {
      network.addNode(new NodeId("n" + i), roles[random.nextInt(roles.length)]);
    }
    for (int i = 0; i < nodeCount; i++) {
      for (int j = i + 1; j < nodeCount; j++) {
        if (random.nextInt(3) == 0) {
          network.addLink(new NodeId("n" + i), new NodeId("n" + j), new byte[]{(byte) i, (byte) j},
              random.nextInt(100));
        }
      }
    }
    final NodeId source = new NodeId("n0");
    final NodeId destination = new NodeId("n" + (nodeCount - 1));

    final List<NetworkPath> paths = network.findPaths(source, destination, maxHops);

    assertThat(paths).isSortedAccordingTo(NetworkPath.BEST_FIRST);
    for (NetworkPath path : paths) {
      assertThat(path.source()).isEqualTo(source);
      assertThat(path.destination()).isEqualTo(destination);
      assertThat(path.hopCount()).isBetween(1, maxHops);
      assertThat(path.nodes()).doesNotHaveDuplicates();
      assertThat(path.trustScore()).isBetween(0.0, 1.0);
    }
    assertThat(paths).doesNotHaveDuplicates();
  }
}
