// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

import com.github.qkd_relay.Pickler;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/// Binary form of a [NetworkKey] for persistent stores.
///
/// ```
/// key (4 byte length + bytes) | session id | source | destination | path node count (2) | path nodes
/// | trust (8) | latency (8) | created at seconds (8) | created at nanos (4) | ttl millis (8)
/// ```
///
/// Strings are a 2 byte length followed by UTF-8.
public final class NetworkKeyPickler implements Pickler<NetworkKey> {

  public static final NetworkKeyPickler INSTANCE = new NetworkKeyPickler();

  private NetworkKeyPickler() {
  }

  @Override
  public void serialize(NetworkKey key, ByteBuffer buffer) {
    buffer.putInt(key.key().length);
    buffer.put(key.key());
    writeString(buffer, key.sessionId());
    writeString(buffer, key.source().id());
    writeString(buffer, key.destination().id());
    final NetworkPath path = key.path();
    buffer.putShort((short) path.nodes().size());
    for (NodeId node : path.nodes()) {
      writeString(buffer, node.id());
    }
    buffer.putDouble(path.trustScore());
    buffer.putDouble(path.latencyMs());
    buffer.putLong(key.createdAt().getEpochSecond());
    buffer.putInt(key.createdAt().getNano());
    buffer.putLong(key.ttl().toMillis());
  }

  @Override
  public NetworkKey deserialize(ByteBuffer buffer) {
    final int keyLength = buffer.getInt();
    if (keyLength < 0 || keyLength > buffer.remaining()) {
      throw new IllegalArgumentException("Invalid key length: " + keyLength);
    }
    final byte[] keyBytes = new byte[keyLength];
    buffer.get(keyBytes);
    final String sessionId = readString(buffer);
    final NodeId source = new NodeId(readString(buffer));
    final NodeId destination = new NodeId(readString(buffer));
    final int nodeCount = buffer.getShort();
    final List<NodeId> nodes = new ArrayList<>(nodeCount);
    for (int i = 0; i < nodeCount; i++) {
      nodes.add(new NodeId(readString(buffer)));
    }
    final double trust = buffer.getDouble();
    final double latency = buffer.getDouble();
    final Instant createdAt = Instant.ofEpochSecond(buffer.getLong(), buffer.getInt());
    final Duration ttl = Duration.ofMillis(buffer.getLong());
    return new NetworkKey(keyBytes, sessionId, source, destination,
        new NetworkPath(nodes, nodes.size() - 1, trust, latency), createdAt, ttl);
  }

  @Override
  public int sizeOf(NetworkKey key) {
    int size = 4 + key.key().length;
    size += stringSize(key.sessionId()) + stringSize(key.source().id()) + stringSize(key.destination().id());
    size += 2;
    for (NodeId node : key.path().nodes()) {
      size += stringSize(node.id());
    }
    return size + 8 + 8 + 8 + 4 + 8;
  }

  private static void writeString(ByteBuffer buffer, String value) {
    final byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    buffer.putShort((short) bytes.length);
    buffer.put(bytes);
  }

  private static String readString(ByteBuffer buffer) {
    final int length = buffer.getShort();
    if (length < 0 || length > buffer.remaining()) {
      throw new IllegalArgumentException("Invalid string length: " + length);
    }
    final byte[] bytes = new byte[length];
    buffer.get(bytes);
    return new String(bytes, StandardCharsets.UTF_8);
  }

  private static int stringSize(String value) {
    return 2 + value.getBytes(StandardCharsets.UTF_8).length;
  }
}
