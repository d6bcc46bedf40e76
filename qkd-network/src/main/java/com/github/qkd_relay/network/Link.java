// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

import java.util.Objects;

/// An undirected edge. The endpoints are held in ascending order so that a link and its reverse are equal.
///
/// @param a         the lesser endpoint
/// @param b         the greater endpoint
/// @param latencyMs estimated one way latency in milliseconds
public record Link(NodeId a, NodeId b, double latencyMs) {
  public Link {
    Objects.requireNonNull(a, "a required");
    Objects.requireNonNull(b, "b required");
    if (a.compareTo(b) >= 0) {
      throw new IllegalArgumentException("endpoints must be distinct and ordered but got " + a + " and " + b);
    }
    if (!(latencyMs >= 0.0) || Double.isInfinite(latencyMs)) {
      throw new IllegalArgumentException("latency must be a non-negative number");
    }
  }

  public static Link between(NodeId x, NodeId y, double latencyMs) {
    return x.compareTo(y) < 0 ? new Link(x, y, latencyMs) : new Link(y, x, latencyMs);
  }

  public boolean joins(NodeId x, NodeId y) {
    return (a.equals(x) && b.equals(y)) || (a.equals(y) && b.equals(x));
  }
}
