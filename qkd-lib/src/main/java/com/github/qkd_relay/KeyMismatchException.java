// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

/// The final keys differ after privacy amplification. Indicates uncorrected errors or tampering. No key is returned.
public class KeyMismatchException extends QkdException {
  public KeyMismatchException(String message) {
    super(message, false);
  }
}
