// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

/// The raw key source failed or timed out. The caller may retry with a new session.
public class KeyGenerationException extends QkdException {
  public KeyGenerationException(String message, Throwable cause) {
    super(message, true, cause);
  }

  public KeyGenerationException(String message) {
    super(message, true);
  }
}
