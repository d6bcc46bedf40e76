// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Random;

/// Conversions between packed byte buffers and unpacked bit arrays. An unpacked bit array holds one bit per element
/// with the value 0 or 1. Bit `i` of a packed buffer is bit `i % 8` of byte `i / 8`, least significant bit first.
public final class BitVector {

  private BitVector() {
  }

  /// Unpack a byte buffer into a bit array of length `8 * bytes.length`.
  public static byte[] toBits(byte[] bytes) {
    final byte[] bits = new byte[bytes.length * 8];
    for (int i = 0; i < bits.length; i++) {
      bits[i] = (byte) ((bytes[i >>> 3] >>> (i & 7)) & 1);
    }
    return bits;
  }

  /// Pack a bit array into bytes. A trailing partial byte is zero padded in its high bits.
  public static byte[] toBytes(byte[] bits) {
    final byte[] bytes = new byte[(bits.length + 7) / 8];
    for (int i = 0; i < bits.length; i++) {
      if (bits[i] != 0) {
        bytes[i >>> 3] |= (byte) (1 << (i & 7));
      }
    }
    return bytes;
  }

  /// @return bit `index` of a packed buffer
  public static int bit(byte[] bytes, int index) {
    return (bytes[index >>> 3] >>> (index & 7)) & 1;
  }

  /// XOR-sum of `bits[from, to)`.
  public static int parity(byte[] bits, int from, int to) {
    int parity = 0;
    for (int i = from; i < to; i++) {
      parity ^= bits[i];
    }
    return parity;
  }

  /// Number of positions at which two bit arrays differ, compared over the shorter length.
  public static int hammingDistance(byte[] bitsA, byte[] bitsB) {
    final int length = Math.min(bitsA.length, bitsB.length);
    int distance = 0;
    for (int i = 0; i < length; i++) {
      if (bitsA[i] != bitsB[i]) {
        distance++;
      }
    }
    return distance;
  }

  /// XOR `data` with `key`, repeating the key when it is shorter than the data.
  public static byte[] xor(byte[] data, byte[] key) {
    if (key.length == 0) {
      throw new IllegalArgumentException("key must not be empty");
    }
    final byte[] result = new byte[data.length];
    for (int i = 0; i < data.length; i++) {
      result[i] = (byte) (data[i] ^ key[i % key.length]);
    }
    return result;
  }

  /// Copy of a packed buffer with the given bit positions removed. The surviving bits keep their order and are
  /// repacked from position zero.
  ///
  /// @param bytes   the packed key
  /// @param indices bit positions to drop, in any order, duplicates ignored
  public static byte[] discard(byte[] bytes, int[] indices) {
    final int bitLength = bytes.length * 8;
    final boolean[] dropped = new boolean[bitLength];
    int droppedCount = 0;
    for (int index : indices) {
      if (index < 0 || index >= bitLength) {
        throw new IllegalArgumentException("bit index " + index + " outside key of " + bitLength + " bits");
      }
      if (!dropped[index]) {
        dropped[index] = true;
        droppedCount++;
      }
    }
    final byte[] kept = new byte[bitLength - droppedCount];
    int next = 0;
    for (int i = 0; i < bitLength; i++) {
      if (!dropped[i]) {
        kept[next++] = (byte) bit(bytes, i);
      }
    }
    return toBytes(kept);
  }

  /// Choose `count` distinct indices in `[0, bound)` uniformly at random, returned in ascending order.
  /// Uses a partial Fisher-Yates shuffle so sampling is without replacement.
  public static int[] sampleIndices(int bound, int count, Random random) {
    if (count < 0 || count > bound) {
      throw new IllegalArgumentException("cannot sample " + count + " indices from " + bound);
    }
    final int[] pool = new int[bound];
    for (int i = 0; i < bound; i++) {
      pool[i] = i;
    }
    for (int i = 0; i < count; i++) {
      final int j = i + random.nextInt(bound - i);
      final int swap = pool[i];
      pool[i] = pool[j];
      pool[j] = swap;
    }
    final int[] sample = Arrays.copyOf(pool, count);
    Arrays.sort(sample);
    return sample;
  }

  public static int[] sampleIndices(int bound, int count) {
    return sampleIndices(bound, count, new SecureRandom());
  }

  /// Overwrite a buffer with zeros. Null is ignored.
  public static void wipe(byte[] bytes) {
    if (bytes != null) {
      Arrays.fill(bytes, (byte) 0);
    }
  }
}
