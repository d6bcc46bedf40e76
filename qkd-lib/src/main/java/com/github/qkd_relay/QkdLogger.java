// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

import java.util.logging.Logger;

/// Shared logger for the key agreement pipeline. Key material is never logged, only lengths, counts and digests.
public final class QkdLogger {
  public static final Logger LOGGER = Logger.getLogger("com.github.qkd_relay");

  private QkdLogger() {
  }
}
