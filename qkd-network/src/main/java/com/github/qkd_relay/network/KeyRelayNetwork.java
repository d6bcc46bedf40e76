// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

import com.github.f4b6a3.uuid.UuidCreator;
import com.github.qkd_relay.BitVector;
import com.github.qkd_relay.QkdCrypto;
import com.github.qkd_relay.QkdSession;
import org.jetbrains.annotations.TestOnly;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;

import static com.github.qkd_relay.network.RelayLogger.LOGGER;

/// Relays keys across a graph of nodes that share pairwise secrets.
///
/// The key is masked with a fresh hop key before it crosses each link and unmasked on arrival, so only masked
/// material ever travels between nodes. Hop keys come from a [HopKeySource]: derived from the link secret, or agreed
/// by a nested two party session.
///
/// Path discovery reads the topology under a read lock; adding or removing nodes and links takes the write lock and
/// clears the path cache. A relay holds the read lock from validation to delivery so the topology cannot change under
/// it.
public class KeyRelayNetwork {

  private final RelayConfig config;
  private final KeyStore keyStore;
  private final HopKeySource hopKeySource;
  private final Clock clock;

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<NodeId, NetworkNode> nodes = new TreeMap<>();
  private final Map<Edge, Link> links = new LinkedHashMap<>();
  private final Map<Route, List<NetworkPath>> pathCache;

  /// Unordered pair of node ids used to look up links.
  private record Edge(NodeId a, NodeId b) {
    static Edge of(NodeId x, NodeId y) {
      return x.compareTo(y) < 0 ? new Edge(x, y) : new Edge(y, x);
    }
  }

  private record Route(NodeId source, NodeId destination, int maxHops) {
  }

  public KeyRelayNetwork(RelayConfig config, KeyStore keyStore, HopKeySource hopKeySource, Clock clock) {
    this.config = Objects.requireNonNull(config, "config required");
    this.keyStore = Objects.requireNonNull(keyStore, "keyStore required");
    this.hopKeySource = Objects.requireNonNull(hopKeySource, "hopKeySource required");
    this.clock = Objects.requireNonNull(clock, "clock required");
    final int capacity = config.pathCacheSize();
    this.pathCache = new LinkedHashMap<>(16, 0.75f, true) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<Route, List<NetworkPath>> eldest) {
        return size() > capacity;
      }
    };
  }

  /// An in-memory network with default settings and hop keys derived from link secrets.
  public static KeyRelayNetwork inMemory() {
    return new KeyRelayNetwork(RelayConfig.DEFAULT, new InMemoryKeyStore(1024), DerivedHopKeySource.INSTANCE,
        Clock.systemUTC());
  }

  public RelayConfig config() {
    return config;
  }

  // ---------------------------------------------------------------- topology

  public void addNode(NodeId id, NodeRole role) {
    addNode(id, role, new NodeAddress(0));
  }

  /// @throws IllegalArgumentException if the id is taken
  public void addNode(NodeId id, NodeRole role, NodeAddress address) {
    lock.writeLock().lock();
    try {
      if (nodes.containsKey(id)) {
        throw new IllegalArgumentException("node " + id + " already exists");
      }
      nodes.put(id, new NetworkNode(id, role, address));
      invalidatePaths();
    } finally {
      lock.writeLock().unlock();
    }
    LOGGER.fine(() -> "added node " + id + " as " + role);
  }

  /// Connect two existing nodes, replacing any link between them.
  public void addLink(NodeId x, NodeId y, byte[] sharedSecret, double latencyMs) {
    Objects.requireNonNull(sharedSecret, "sharedSecret required");
    if (sharedSecret.length == 0) {
      throw new IllegalArgumentException("sharedSecret must not be empty");
    }
    final Link link = Link.between(x, y, latencyMs);
    lock.writeLock().lock();
    try {
      final NetworkNode nx = requireNode(x);
      final NetworkNode ny = requireNode(y);
      nx.putSecret(y, sharedSecret);
      ny.putSecret(x, sharedSecret);
      links.put(Edge.of(x, y), link);
      invalidatePaths();
    } finally {
      lock.writeLock().unlock();
    }
    LOGGER.fine(() -> "linked " + x + " and " + y + " latency " + latencyMs + "ms");
  }

  /// Disconnect two nodes and wipe their shared secret.
  ///
  /// @return true if they were linked
  public boolean removeLink(NodeId x, NodeId y) {
    final boolean removed;
    lock.writeLock().lock();
    try {
      removed = links.remove(Edge.of(x, y)) != null;
      if (removed) {
        requireNode(x).removeSecret(y);
        requireNode(y).removeSecret(x);
        invalidatePaths();
      }
    } finally {
      lock.writeLock().unlock();
    }
    if (removed) {
      LOGGER.fine(() -> "removed link " + x + " - " + y);
    }
    return removed;
  }

  /// Only called with the write lock held.
  private void invalidatePaths() {
    synchronized (pathCache) {
      pathCache.clear();
    }
  }

  private NetworkNode requireNode(NodeId id) {
    final NetworkNode node = nodes.get(id);
    if (node == null) {
      throw new IllegalArgumentException("unknown node " + id);
    }
    return node;
  }

  public TopologyView topology() {
    lock.readLock().lock();
    try {
      final List<TopologyView.NodeView> views = new ArrayList<>(nodes.size());
      for (NetworkNode node : nodes.values()) {
        views.add(new TopologyView.NodeView(node.id(), node.role(), node.address(), node.neighborIds()));
      }
      return new TopologyView(views, new ArrayList<>(links.values()), isConnected());
    } finally {
      lock.readLock().unlock();
    }
  }

  private boolean isConnected() {
    if (nodes.isEmpty()) {
      return true;
    }
    final Set<NodeId> seen = new HashSet<>();
    final Deque<NodeId> pending = new ArrayDeque<>();
    final NodeId start = nodes.keySet().iterator().next();
    seen.add(start);
    pending.push(start);
    while (!pending.isEmpty()) {
      for (NodeId next : nodes.get(pending.pop()).neighbors()) {
        if (seen.add(next)) {
          pending.push(next);
        }
      }
    }
    return seen.size() == nodes.size();
  }

  // ---------------------------------------------------------------- path discovery

  public List<NetworkPath> findPaths(NodeId source, NodeId destination) {
    return findPaths(source, destination, config.maxHops());
  }

  /// All simple paths of at most `maxHops` edges, best first by [NetworkPath#BEST_FIRST]. Results are cached per
  /// route until the topology next changes.
  public List<NetworkPath> findPaths(NodeId source, NodeId destination, int maxHops) {
    if (source.equals(destination)) {
      throw new IllegalArgumentException("source and destination are both " + source);
    }
    if (maxHops < 1) {
      throw new IllegalArgumentException("maxHops must be at least 1");
    }
    final Route route = new Route(source, destination, maxHops);
    lock.readLock().lock();
    try {
      synchronized (pathCache) {
        final List<NetworkPath> cached = pathCache.get(route);
        if (cached != null) {
          return cached;
        }
      }
      requireNode(source);
      requireNode(destination);
      final List<NetworkPath> found = new ArrayList<>();
      final List<NodeId> trail = new ArrayList<>();
      trail.add(source);
      final Set<NodeId> visited = new HashSet<>(trail);
      walk(trail, visited, destination, maxHops, found);
      found.sort(NetworkPath.BEST_FIRST);
      final List<NetworkPath> paths = Collections.unmodifiableList(found);
      synchronized (pathCache) {
        pathCache.put(route, paths);
      }
      LOGGER.finer(() -> "found " + paths.size() + " paths " + source + "->" + destination + " within " + maxHops
          + " hops");
      return paths;
    } finally {
      lock.readLock().unlock();
    }
  }

  private void walk(List<NodeId> trail, Set<NodeId> visited, NodeId destination, int maxHops,
                    List<NetworkPath> found) {
    final NodeId here = trail.get(trail.size() - 1);
    if (here.equals(destination)) {
      found.add(score(trail));
      return;
    }
    if (trail.size() - 1 == maxHops) {
      return;
    }
    for (NodeId next : nodes.get(here).neighbors()) {
      if (visited.add(next)) {
        trail.add(next);
        walk(trail, visited, destination, maxHops, found);
        trail.remove(trail.size() - 1);
        visited.remove(next);
      }
    }
  }

  /// Trust multiplies the factor of every intermediate node; latency sums the links.
  private NetworkPath score(List<NodeId> trail) {
    double trust = 1.0;
    for (int i = 1; i < trail.size() - 1; i++) {
      trust *= nodes.get(trail.get(i)).role().trustFactor();
    }
    double latency = 0.0;
    for (int i = 0; i + 1 < trail.size(); i++) {
      latency += links.get(Edge.of(trail.get(i), trail.get(i + 1))).latencyMs();
    }
    return new NetworkPath(trail, trail.size() - 1, trust, latency);
  }

  @TestOnly
  int cachedRoutes() {
    synchronized (pathCache) {
      return pathCache.size();
    }
  }

  // ---------------------------------------------------------------- relay

  /// Relay along the best path with the default ttl and a new session id.
  public RelayResult distributeKey(NodeId source, NodeId destination, byte[] key) {
    return distributeKey(source, destination, key, Optional.empty(), config.defaultTtl(), newSessionId());
  }

  /// Relay along the given node sequence with the default ttl and a new session id.
  public RelayResult distributeKey(NodeId source, NodeId destination, byte[] key, List<NodeId> path) {
    return distributeKey(source, destination, key, Optional.of(path), config.defaultTtl(), newSessionId());
  }

  /// Relay `key` from `source` to `destination` and store it there under `sessionId`.
  ///
  /// Every consecutive pair of the path is checked for a shared secret before anything is sent, so a bad path fails
  /// without partial relaying.
  ///
  /// @param path explicit node sequence, or empty for the best discovered path
  /// @throws NoPathException      when no path is given and none exists within the hop limit
  /// @throws InvalidPathException when the given path is not a usable chain of linked nodes
  public RelayResult distributeKey(NodeId source,
                                   NodeId destination,
                                   byte[] key,
                                   Optional<List<NodeId>> path,
                                   Duration ttl,
                                   String sessionId) {
    Objects.requireNonNull(key, "key required");
    Objects.requireNonNull(ttl, "ttl required");
    Objects.requireNonNull(sessionId, "sessionId required");
    if (key.length == 0) {
      throw new IllegalArgumentException("key must not be empty");
    }
    lock.readLock().lock();
    try {
      final NetworkPath chosen;
      if (path.isPresent()) {
        chosen = validate(source, destination, path.get());
      } else {
        final List<NetworkPath> candidates = findPaths(source, destination);
        if (candidates.isEmpty()) {
          throw new NoPathException(source, destination, config.maxHops());
        }
        chosen = candidates.get(0);
      }
      return relay(chosen, key, ttl, sessionId);
    } finally {
      lock.readLock().unlock();
    }
  }

  private NetworkPath validate(NodeId source, NodeId destination, List<NodeId> sequence) {
    if (sequence.size() < 2) {
      throw new InvalidPathException("path " + sequence + " needs at least two nodes");
    }
    if (!sequence.get(0).equals(source) || !sequence.get(sequence.size() - 1).equals(destination)) {
      throw new InvalidPathException("path " + sequence + " does not run from " + source + " to " + destination);
    }
    if (new HashSet<>(sequence).size() != sequence.size()) {
      throw new InvalidPathException("path " + sequence + " revisits a node");
    }
    for (NodeId id : sequence) {
      if (!nodes.containsKey(id)) {
        throw new InvalidPathException("path " + sequence + " names unknown node " + id);
      }
    }
    for (int i = 0; i + 1 < sequence.size(); i++) {
      final NodeId from = sequence.get(i);
      final NodeId to = sequence.get(i + 1);
      if (!nodes.get(from).hasSecretWith(to)) {
        throw new InvalidPathException("no shared secret between " + from + " and " + to);
      }
    }
    return score(sequence);
  }

  private RelayResult relay(NetworkPath path, byte[] key, Duration ttl, String sessionId) {
    final int hopKeyLength = config.hopKeyLength() == 0 ? key.length : config.hopKeyLength();
    final List<RelayResult.Hop> hops = new ArrayList<>(path.hopCount());
    byte[] inTransit = key.clone();
    for (int i = 0; i < path.hopCount(); i++) {
      final NodeId from = path.nodes().get(i);
      final NodeId to = path.nodes().get(i + 1);
      final byte[] secret = nodes.get(from).sharedSecret(to)
          .orElseThrow(() -> new InvalidPathException("no shared secret between " + from + " and " + to));
      final byte[] hopKey = hopKeySource.hopKey(from, to, secret, HopKeys.context(sessionId, i, from, to),
          hopKeyLength);
      BitVector.wipe(secret);
      final byte[] masked = HopKeys.mask(inTransit, hopKey);
      BitVector.wipe(inTransit);
      final RelayResult.Hop hop = new RelayResult.Hop(i, from, to, QkdCrypto.fingerprint(masked));
      hops.add(hop);
      if (LOGGER.isLoggable(Level.FINER)) {
        LOGGER.finer("session " + sessionId + " " + hop);
      }
      inTransit = HopKeys.mask(masked, hopKey);
      BitVector.wipe(hopKey);
    }

    if (!QkdSession.keysMatch(key, inTransit)) {
      BitVector.wipe(inTransit);
      LOGGER.warning(() -> "session " + sessionId + " delivered a different key over " + path.nodes());
      return new RelayResult(false, Optional.empty(), path, hops);
    }
    final NetworkKey delivered = new NetworkKey(inTransit, sessionId, path.source(), path.destination(), path,
        clock.instant(), ttl);
    keyStore.put(delivered);
    LOGGER.info(() -> "session " + sessionId + " relayed " + key.length + " bytes " + path.source() + "->"
        + path.destination() + " over " + path.hopCount() + " hops");
    return new RelayResult(true, Optional.of(delivered), path, hops);
  }

  private static String newSessionId() {
    return UuidCreator.getTimeOrderedEpoch().toString();
  }

  // ---------------------------------------------------------------- delivered keys

  /// The key delivered under `sessionId`, unless it has expired. An expired key is removed.
  public Optional<NetworkKey> getKey(String sessionId) {
    final Optional<NetworkKey> found = keyStore.get(sessionId);
    if (found.isPresent() && found.get().isExpired(clock.instant())) {
      keyStore.remove(sessionId);
      LOGGER.fine(() -> "key for session " + sessionId + " expired");
      return Optional.empty();
    }
    return found;
  }

  /// Remove every expired key.
  ///
  /// @return how many were removed
  public int purgeExpired() {
    int purged = 0;
    for (String sessionId : keyStore.sessionIds()) {
      final Optional<NetworkKey> key = keyStore.get(sessionId);
      if (key.isPresent() && key.get().isExpired(clock.instant()) && keyStore.remove(sessionId)) {
        purged++;
      }
    }
    return purged;
  }
}
