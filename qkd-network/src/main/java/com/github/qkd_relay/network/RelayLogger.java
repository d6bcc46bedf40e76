// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

import java.util.logging.Logger;

public final class RelayLogger {
  public static final Logger LOGGER = Logger.getLogger("com.github.qkd_relay.network");

  private RelayLogger() {
  }
}
