// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class PrivacyAmplifierTest {

  @Property(tries = 100)
  void deterministic(@ForAll @Size(min = 1, max = 128) byte[] rawKey,
                     @ForAll @IntRange(min = 0, max = 200) int outputLength,
                     @ForAll @Size(value = 32) byte[] seed) {
    final byte[] first = PrivacyAmplifier.amplify(rawKey, outputLength, seed);
    final byte[] second = PrivacyAmplifier.amplify(rawKey.clone(), outputLength, seed.clone());
    assertThat(first).hasSize(outputLength).isEqualTo(second);
  }

  @Test
  public void firstBlockIsDigestOfSeedKeyAndCounter() {
    final byte[] seed = {1, 2, 3};
    final byte[] key = {4, 5};
    final byte[] expected = QkdCrypto.digest(seed, key, new byte[]{0, 0, 0, 0});
    assertArrayEquals(expected, PrivacyAmplifier.amplify(key, 32, seed));
  }

  @Test
  public void longerOutputExtendsShorter() {
    final byte[] seed = PrivacyAmplifier.newSeed();
    final byte[] key = QkdCrypto.randomBytes(64);
    final byte[] shorter = PrivacyAmplifier.amplify(key, 20, seed);
    final byte[] longer = PrivacyAmplifier.amplify(key, 100, seed);
    assertArrayEquals(shorter, Arrays.copyOf(longer, 20));
  }

  @Test
  public void seedChangesOutput() {
    final byte[] key = QkdCrypto.randomBytes(32);
    assertThat(PrivacyAmplifier.amplify(key, 32, PrivacyAmplifier.newSeed()))
        .isNotEqualTo(PrivacyAmplifier.amplify(key, 32, PrivacyAmplifier.newSeed()));
  }

  @Test
  public void secureLengthSubtractsLeakageAndMargin() {
    assertEquals((1024 - 300 - 128) / 8, PrivacyAmplifier.secureLength(1024, 300, 64));
    assertEquals(0, PrivacyAmplifier.secureLength(256, 300, 64));
    assertEquals(32, PrivacyAmplifier.secureLength(256, 0, 0));
  }
}
