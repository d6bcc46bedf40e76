// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.Security;
import java.util.HexFormat;

/// Hashing, keyed digests and key derivation used across the pipeline.
///
/// The digest used for privacy amplification hash chains and key digests defaults to SHA-256. It can be overridden by
/// setting the system property `com.github.qkd_relay.QkdCrypto.useHash` to another [MessageDigest] algorithm such as
/// "SHA3-256". Both parties must use the same algorithm or their amplified keys will differ.
public final class QkdCrypto {

  public static final String DEFAULT_ALGORITHM = "SHA-256";

  public static final String HMAC_ALGORITHM = "HmacSHA256";

  /// Length in bytes of a signature or challenge response.
  public static final int MAC_LENGTH = 32;

  public static final HexFormat HEX_FORMAT = HexFormat.of();

  private static final ThreadLocal<SecureRandom> RANDOM = ThreadLocal.withInitial(SecureRandom::new);

  private QkdCrypto() {
  }

  public static String algorithm() {
    return System.getProperty(QkdCrypto.class.getName() + ".useHash", DEFAULT_ALGORITHM);
  }

  public static MessageDigest getMessageDigest() {
    final var choice = algorithm();
    try {
      return MessageDigest.getInstance(choice);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("Failed to initialize MessageDigest trying to get algorithm '" + choice
          + "' check that there is not a system property override setting a bad id the available ones are: "
          + String.join(",", Security.getAlgorithms("MessageDigest")), e);
    }
  }

  /// One-way digest of the concatenated inputs.
  public static byte[] digest(byte[]... inputs) {
    final MessageDigest md = getMessageDigest();
    for (byte[] input : inputs) {
      md.update(input);
    }
    return md.digest();
  }

  /// HMAC-SHA256 of the concatenated inputs under `key`.
  public static byte[] hmac(byte[] key, byte[]... inputs) {
    try {
      final Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
      for (byte[] input : inputs) {
        mac.update(input);
      }
      return mac.doFinal();
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Required MAC algorithm unavailable", e);
    }
  }

  /// Comparison whose running time does not depend on where the inputs first differ.
  public static boolean constantTimeEquals(byte[] a, byte[] b) {
    return MessageDigest.isEqual(a, b);
  }

  public static byte[] randomBytes(int length) {
    final byte[] bytes = new byte[length];
    RANDOM.get().nextBytes(bytes);
    return bytes;
  }

  public static SecureRandom secureRandom() {
    return RANDOM.get();
  }

  public static String toHex(byte[] bytes) {
    return HEX_FORMAT.formatHex(bytes);
  }

  public static byte[] fromHex(String hex) {
    return HEX_FORMAT.parseHex(hex);
  }

  /// Short fingerprint of key material that is safe to log.
  public static String fingerprint(byte[] key) {
    return toHex(digest(key)).substring(0, 12);
  }

  /// HKDF extract step (RFC 5869) with HMAC-SHA256. A missing salt defaults to 32 zero bytes.
  public static byte[] extract(byte[] salt, byte[] ikm) {
    if (salt == null || salt.length == 0) {
      salt = new byte[32];
    }
    return hmac(salt, ikm);
  }

  /// HKDF expand step (RFC 5869) with HMAC-SHA256.
  public static byte[] expand(byte[] prk, byte[] info, int length) {
    if (length < 0 || length > 255 * MAC_LENGTH) {
      throw new IllegalArgumentException("HKDF output length out of range: " + length);
    }
    try {
      final Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(prk, HMAC_ALGORITHM));

      final byte[] result = new byte[length];
      byte[] t = new byte[0];
      int offset = 0;
      for (int i = 1; offset < length; i++) {
        mac.update(t);
        if (info != null) {
          mac.update(info);
        }
        mac.update((byte) i);
        t = mac.doFinal();
        final int chunkLength = Math.min(t.length, length - offset);
        System.arraycopy(t, 0, result, offset, chunkLength);
        offset += chunkLength;
      }
      return result;
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Required MAC algorithm unavailable", e);
    }
  }
}
