// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LdpcCodeTest {

  static byte[] randomBits(int length, Random random) {
    final byte[] bits = new byte[length];
    for (int i = 0; i < length; i++) {
      bits[i] = (byte) random.nextInt(2);
    }
    return bits;
  }

  @Test
  public void systematicShape() {
    final LdpcCode code = LdpcCode.generate(16, 8, 3, new Random(1));
    final byte[][] h = code.parityCheckMatrix();
    final byte[][] g = code.generatorMatrix();
    assertEquals(8, h.length);
    assertEquals(16, h[0].length);
    assertEquals(8, g.length);
    for (int row = 0; row < 8; row++) {
      int sparse = 0;
      for (int column = 0; column < 8; column++) {
        sparse += h[row][column];
        assertEquals(row == column ? 1 : 0, g[row][column]);
      }
      assertEquals(3, sparse);
      for (int column = 8; column < 16; column++) {
        assertEquals(row == column - 8 ? 1 : 0, h[row][column]);
      }
    }
    assertEquals(0.5, code.rate());
  }

  @Test
  public void columnsAreBalanced() {
    final byte[][] h = LdpcCode.generate(256, 128, 3, new Random(2)).parityCheckMatrix();
    for (int column = 0; column < 128; column++) {
      int weight = 0;
      for (byte[] row : h) {
        weight += row[column];
      }
      assertEquals(3, weight, "column " + column);
    }
  }

  @Test
  public void encodeAppendsParity() {
    final LdpcCode code = LdpcCode.generate(64, 32, 3, new Random(3));
    final byte[] message = randomBits(32, new Random(4));
    final byte[] codeword = code.encode(message);
    assertArrayEquals(message, Arrays.copyOf(codeword, 32));
    assertTrue(code.isCodeword(codeword));
    assertThat(code.syndrome(codeword)).containsOnly(0);
  }

  @Test
  public void cleanCodewordDecodesWithoutIterating() {
    final LdpcCode code = LdpcCode.generate(64, 32, 3, new Random(5));
    final byte[] message = randomBits(32, new Random(6));
    final LdpcCode.Decoded decoded = code.decode(code.encode(message), 50);
    assertTrue(decoded.converged());
    assertEquals(0, decoded.iterations());
    assertArrayEquals(message, decoded.message());
  }

  @Test
  public void correctsFlippedMessageBit() {
    final LdpcCode code = LdpcCode.generate(256, 128, 3, new Random(7));
    final byte[] message = randomBits(128, new Random(8));
    final byte[] received = code.encode(message);
    received[17] ^= 1;
    assertFalse(code.isCodeword(received));

    final LdpcCode.Decoded decoded = code.decode(received, 50);
    assertTrue(decoded.converged());
    assertThat(decoded.iterations()).isPositive();
    assertArrayEquals(message, decoded.message());
  }

  @Test
  public void correctsFlippedParityBit() {
    final LdpcCode code = LdpcCode.generate(256, 128, 3, new Random(9));
    final byte[] message = randomBits(128, new Random(10));
    final byte[] received = code.encode(message);
    received[200] ^= 1;

    final LdpcCode.Decoded decoded = code.decode(received, 50);
    assertTrue(decoded.converged());
    assertArrayEquals(message, decoded.message());
  }

  @Test
  public void reportsFailureWhenOutOfIterations() {
    final LdpcCode code = LdpcCode.generate(64, 32, 3, new Random(11));
    final byte[] received = code.encode(randomBits(32, new Random(12)));
    received[3] ^= 1;
    final LdpcCode.Decoded decoded = code.decode(received, 0);
    assertFalse(decoded.converged());
    assertEquals(0, decoded.iterations());
    assertArrayEquals(received, decoded.codeword());
  }

  @Test
  public void acceptsOnlySystematicParityCheck() {
    final byte[][] h = {
        {1, 1, 0, 1, 0},
        {0, 1, 1, 0, 1}
    };
    final LdpcCode code = LdpcCode.fromParityCheck(5, 3, h);
    assertTrue(LdpcCode.isOrthogonal(code.generatorMatrix(), code.parityCheckMatrix()));

    final byte[][] notIdentity = {
        {1, 1, 0, 1, 1},
        {0, 1, 1, 0, 1}
    };
    assertThatThrownBy(() -> LdpcCode.fromParityCheck(5, 3, notIdentity))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> LdpcCode.generate(4, 4, 3, new Random()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void channelReliabilityIsClamped() {
    assertEquals(LdpcCode.channelLlr(1e-4), LdpcCode.channelLlr(0.0));
    assertEquals(LdpcCode.channelLlr(0.45), LdpcCode.channelLlr(0.9));
    assertThat(LdpcCode.channelLlr(0.01)).isGreaterThan(LdpcCode.channelLlr(0.1));
  }
}
