// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class QkdCryptoTest {

  @Test
  public void hmacMatchesRfc4231() {
    final byte[] mac = QkdCrypto.hmac("Jefe".getBytes(StandardCharsets.US_ASCII),
        "what do ya want for nothing?".getBytes(StandardCharsets.US_ASCII));
    assertEquals("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843", QkdCrypto.toHex(mac));
  }

  @Test
  public void hkdfMatchesRfc5869() {
    final byte[] ikm = QkdCrypto.fromHex("0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b");
    final byte[] salt = QkdCrypto.fromHex("000102030405060708090a0b0c");
    final byte[] info = QkdCrypto.fromHex("f0f1f2f3f4f5f6f7f8f9");
    final byte[] prk = QkdCrypto.extract(salt, ikm);
    assertEquals("077709362c2e32df0ddc3f0dc47bba6390b6c73bb50f9c3122ec844ad7c2b3e5", QkdCrypto.toHex(prk));
    assertEquals("3cb25f25faacd57a90434f64d0362f2a2d2d0a90cf1a5a4c5db02d56ecc4c5bf34007208d5b887185865",
        QkdCrypto.toHex(QkdCrypto.expand(prk, info, 42)));
  }

  @Test
  public void constantTimeEquality() {
    assertThat(QkdCrypto.constantTimeEquals(new byte[]{1, 2}, new byte[]{1, 2})).isTrue();
    assertThat(QkdCrypto.constantTimeEquals(new byte[]{1, 2}, new byte[]{1, 3})).isFalse();
    assertThat(QkdCrypto.constantTimeEquals(new byte[]{1}, new byte[]{1, 2})).isFalse();
  }

  @Test
  public void digestAlgorithmCanBeOverridden() {
    final String property = QkdCrypto.class.getName() + ".useHash";
    try {
      System.setProperty(property, "SHA-512");
      assertThat(QkdCrypto.digest(new byte[]{1})).hasSize(64);
      System.setProperty(property, "NOT-A-HASH");
      assertThatThrownBy(() -> QkdCrypto.digest(new byte[]{1}))
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("NOT-A-HASH");
    } finally {
      System.clearProperty(property);
    }
    assertThat(QkdCrypto.digest(new byte[]{1})).hasSize(32);
  }

  @Test
  public void fingerprintIsShortHex() {
    assertThat(QkdCrypto.fingerprint(new byte[]{9, 9, 9})).hasSize(12).matches("[0-9a-f]+");
  }
}
