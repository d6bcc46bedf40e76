// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.msg;

import java.util.Objects;

/// A protocol message. The signature covers the kind, session id, timestamp and payload as encoded by
/// [MessagePickler#signedContent(QkdMessage)]. An unsigned message has an empty signature; signing returns a new
/// record so a signed message is never mutated.
///
/// @param kind      the phase tag, which must match the payload
/// @param sessionId opaque session token
/// @param timestamp seconds since the epoch
/// @param payload   kind specific content
/// @param signature authentication tag, empty until signed
public record QkdMessage(MessageKind kind, String sessionId, long timestamp, Payload payload, byte[] signature) {

  public QkdMessage {
    Objects.requireNonNull(kind, "kind required");
    Objects.requireNonNull(sessionId, "sessionId required");
    Objects.requireNonNull(payload, "payload required");
    Objects.requireNonNull(signature, "signature required");
    if (payload.kind() != kind) {
      throw new IllegalArgumentException("payload " + payload.kind() + " does not belong to a " + kind + " message");
    }
  }

  public static QkdMessage unsigned(String sessionId, long timestamp, Payload payload) {
    return new QkdMessage(payload.kind(), sessionId, timestamp, payload, new byte[0]);
  }

  public QkdMessage withSignature(byte[] signature) {
    return new QkdMessage(kind, sessionId, timestamp, payload, signature.clone());
  }

  public boolean isSigned() {
    return signature.length > 0;
  }

  /// The payload cast to the type expected for this message.
  public <P extends Payload> P payload(Class<P> type) {
    if (!type.isInstance(payload)) {
      throw new IllegalArgumentException("expected " + type.getSimpleName() + " but message carries " + kind);
    }
    return type.cast(payload);
  }

  @Override
  public String toString() {
    return "QkdMessage[" + kind + " session=" + sessionId + " timestamp=" + timestamp + "]";
  }
}
