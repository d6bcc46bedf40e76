// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.msg;

import com.github.qkd_relay.QkdCrypto;
import com.github.qkd_relay.SignatureVerificationException;

import java.util.Objects;

/// Signs and verifies messages with HMAC-SHA256 under the pre-shared secret. Signing is deterministic so both parties
/// compute the same tag for the same content.
public final class MessageSigner {

  private final byte[] sharedSecret;

  public MessageSigner(byte[] sharedSecret) {
    Objects.requireNonNull(sharedSecret, "sharedSecret required");
    if (sharedSecret.length == 0) {
      throw new IllegalArgumentException("sharedSecret must not be empty");
    }
    this.sharedSecret = sharedSecret.clone();
  }

  public QkdMessage sign(QkdMessage message) {
    return message.withSignature(tag(message));
  }

  public boolean isValid(QkdMessage message) {
    return message.isSigned() && QkdCrypto.constantTimeEquals(tag(message), message.signature());
  }

  /// @throws SignatureVerificationException when the signature is missing or wrong
  public void verify(QkdMessage message) {
    if (!isValid(message)) {
      throw new SignatureVerificationException("bad signature on " + message);
    }
  }

  private byte[] tag(QkdMessage message) {
    return QkdCrypto.hmac(sharedSecret, MessagePickler.INSTANCE.signedContent(message));
  }
}
