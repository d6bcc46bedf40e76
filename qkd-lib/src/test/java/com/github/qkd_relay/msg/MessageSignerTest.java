// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.msg;

import com.github.qkd_relay.QkdCrypto;
import com.github.qkd_relay.SignatureVerificationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class MessageSignerTest {

  final byte[] secret = QkdCrypto.randomBytes(32);
  final MessageSigner signer = new MessageSigner(secret);
  final QkdMessage message = QkdMessage.unsigned("session", 10L, new Payload.PrivacyAmp(new byte[32], 32));

  @Test
  public void signatureIsDeterministicHmac() {
    final QkdMessage signed = signer.sign(message);
    assertThat(signed.signature()).hasSize(QkdCrypto.MAC_LENGTH)
        .isEqualTo(signer.sign(message).signature())
        .isEqualTo(new MessageSigner(secret.clone()).sign(message).signature());
    assertThat(signer.isValid(signed)).isTrue();
    signer.verify(signed);
  }

  @Test
  public void unsignedMessageIsInvalid() {
    assertThat(signer.isValid(message)).isFalse();
    assertThatThrownBy(() -> signer.verify(message)).isInstanceOf(SignatureVerificationException.class);
  }

  @Test
  public void otherSecretIsRejected() {
    final QkdMessage signed = new MessageSigner(QkdCrypto.randomBytes(32)).sign(message);
    assertThat(signer.isValid(signed)).isFalse();
  }

  @Test
  public void anyChangedFieldBreaksTheSignature() {
    final QkdMessage signed = signer.sign(message);
    assertThat(signer.isValid(new QkdMessage(signed.kind(), "other", signed.timestamp(), signed.payload(),
        signed.signature()))).isFalse();
    assertThat(signer.isValid(new QkdMessage(signed.kind(), signed.sessionId(), 11L, signed.payload(),
        signed.signature()))).isFalse();
    assertThat(signer.isValid(new QkdMessage(signed.kind(), signed.sessionId(), signed.timestamp(),
        new Payload.PrivacyAmp(new byte[32], 31), signed.signature()))).isFalse();
  }

  @Test
  public void emptySecretIsRefused() {
    assertThatThrownBy(() -> new MessageSigner(new byte[0])).isInstanceOf(IllegalArgumentException.class);
  }
}
