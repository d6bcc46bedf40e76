// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.msg;

import java.util.Arrays;

/// The phase tag carried by every protocol message. The wire id is stable and must not be renumbered.
public enum MessageKind {
  INIT_REQUEST(1),
  INIT_RESPONSE(2),
  AUTH_CHALLENGE(3),
  AUTH_RESPONSE(4),
  KEY_GEN_REQUEST(5),
  KEY_GEN_RESPONSE(6),
  ERROR_DETECT(7),
  ERROR_CORRECT(8),
  PRIVACY_AMP(9),
  KEY_VERIFY(10),
  KEY_CONFIRM(11);

  private final byte id;

  MessageKind(int id) {
    this.id = (byte) id;
  }

  public byte id() {
    return id;
  }

  public static MessageKind fromId(byte id) {
    return Arrays.stream(values())
        .filter(kind -> kind.id == id)
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown message kind: " + id));
  }
}
