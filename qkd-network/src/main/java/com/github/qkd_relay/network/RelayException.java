// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

import com.github.qkd_relay.QkdException;

/// A relay attempt failed. Fatal to that attempt only; other paths and sessions are unaffected.
public class RelayException extends QkdException {
  public RelayException(String message) {
    super(message, false);
  }
}
