// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

/// A path was rejected before any relaying started.
public class InvalidPathException extends RelayException {
  public InvalidPathException(String message) {
    super(message);
  }
}
