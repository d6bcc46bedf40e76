// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

/// The device or service that produces raw key material. How the bits are produced is not the concern of the
/// post-processing pipeline; two cooperating sources only need to yield keys with a bounded disagreement rate.
/// A call may block. The session bounds it with a timeout.
@FunctionalInterface
public interface RawKeySource {

  /// @throws KeyGenerationException when the source is unavailable
  RawKey generateRawKey(int shotCount, boolean useHardware);
}
