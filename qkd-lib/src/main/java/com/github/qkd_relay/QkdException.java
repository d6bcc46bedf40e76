// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

/// Root of the failures raised by the key agreement pipeline and the relay network.
/// Protocol-level failures are never retried automatically. Those marked [#retryable()] may be retried by the caller
/// with a fresh session.
public class QkdException extends RuntimeException {
  private final boolean retryable;

  public QkdException(String message, boolean retryable) {
    super(message);
    this.retryable = retryable;
  }

  public QkdException(String message, boolean retryable, Throwable cause) {
    super(message, cause);
    this.retryable = retryable;
  }

  public boolean retryable() {
    return retryable;
  }
}
