// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

/// The challenge response did not match the keyed digest of the challenge. Fatal to the session.
public class AuthenticationException extends QkdException {
  public AuthenticationException(String message) {
    super(message, false);
  }
}
