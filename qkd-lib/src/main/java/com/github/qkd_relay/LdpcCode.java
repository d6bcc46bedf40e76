// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static com.github.qkd_relay.QkdLogger.LOGGER;

/// A systematic low-density parity-check code over GF(2).
///
/// The parity check matrix has the form `H = [Pt | I]` with shape `(n - k) x n` where the left block `Pt` is sparse
/// with a fixed number of ones per row. The generator matrix is `G = [I | P]` with shape `k x n` where `P` is the
/// transpose of `Pt`, so that `G * transpose(H) = 0 (mod 2)` and a codeword is the message followed by its parity bits.
///
/// Decoding is sum-product belief propagation over the factor graph of `H` with log-likelihood ratios where a
/// positive value favours a zero bit.
public final class LdpcCode {

  /// Channel log-likelihood magnitude used when decoding hard bits without an error rate, about 5% crossover.
  public static final double DEFAULT_CHANNEL_LLR = channelLlr(0.05);

  /// Largest magnitude a tanh product may reach before `atanh` overflows.
  private static final double MAX_TANH = 1.0 - 1e-12;

  private final int n;
  private final int k;
  private final int m;
  private final byte[][] parityCheck;
  private final byte[][] generator;
  private final int[][] checkVariables;

  /// Result of a decode.
  ///
  /// @param message    the first `k` bits of the best codeword estimate
  /// @param codeword   all `n` bits of the estimate
  /// @param converged  true when the estimate has a zero syndrome
  /// @param iterations rounds of belief propagation performed, zero when the input was already a codeword
  public record Decoded(byte[] message, byte[] codeword, boolean converged, int iterations) {
  }

  private LdpcCode(int n, int k, byte[][] parityCheck) {
    this.n = n;
    this.k = k;
    this.m = n - k;
    this.parityCheck = parityCheck;
    this.checkVariables = adjacency(parityCheck);

    // derived from H so G.Ht = 0 holds by construction, the check guards the derivation
    this.generator = deriveGenerator(parityCheck, k);
    if (!isOrthogonal(generator, parityCheck)) {
      throw new IllegalStateException("G.Ht is not zero for the (" + n + ", " + k + ") code");
    }
    LOGGER.finest(() -> String.format("Built (%d, %d) LDPC code", n, k));
  }

  /// Build a random code whose sparse block has `rowWeight` ones per row, spread so that column weights differ by at
  /// most one. Every message bit then takes part in at least one check whenever `(n - k) * rowWeight >= k`.
  public static LdpcCode generate(int n, int k, int rowWeight, Random random) {
    if (k < 1 || k >= n) {
      throw new IllegalArgumentException("need 0 < k < n but k=" + k + " n=" + n);
    }
    if (rowWeight < 1) {
      throw new IllegalArgumentException("rowWeight must be at least 1");
    }
    final int m = n - k;
    final int weight = Math.min(rowWeight, k);
    final byte[][] h = new byte[m][n];
    final int[] columnWeights = new int[k];
    final List<Integer> candidates = new ArrayList<>();

    for (int row = 0; row < m; row++) {
      h[row][k + row] = 1;
      for (int placed = 0; placed < weight; placed++) {
        candidates.clear();
        int lightest = Integer.MAX_VALUE;
        for (int column = 0; column < k; column++) {
          if (h[row][column] != 0) {
            continue;
          }
          if (columnWeights[column] < lightest) {
            lightest = columnWeights[column];
            candidates.clear();
          }
          if (columnWeights[column] == lightest) {
            candidates.add(column);
          }
        }
        final int column = candidates.get(random.nextInt(candidates.size()));
        h[row][column] = 1;
        columnWeights[column]++;
      }
    }
    return new LdpcCode(n, k, h);
  }

  /// Wrap an existing parity check matrix which must already be in systematic form `[Pt | I]`.
  public static LdpcCode fromParityCheck(int n, int k, byte[][] parityCheck) {
    if (k < 1 || k >= n) {
      throw new IllegalArgumentException("need 0 < k < n but k=" + k + " n=" + n);
    }
    if (parityCheck.length != n - k) {
      throw new IllegalArgumentException("expected " + (n - k) + " rows but got " + parityCheck.length);
    }
    final byte[][] copy = new byte[n - k][];
    for (int row = 0; row < copy.length; row++) {
      if (parityCheck[row].length != n) {
        throw new IllegalArgumentException("row " + row + " has length " + parityCheck[row].length);
      }
      for (int column = k; column < n; column++) {
        final int expected = column - k == row ? 1 : 0;
        if (parityCheck[row][column] != expected) {
          throw new IllegalArgumentException("right block of H is not the identity at row " + row);
        }
      }
      copy[row] = parityCheck[row].clone();
    }
    return new LdpcCode(n, k, copy);
  }

  /// `G = [I | P]` where `P[i][j] = H[j][i]` for the first `k` columns of `H`.
  static byte[][] deriveGenerator(byte[][] h, int k) {
    final int m = h.length;
    final int n = k + m;
    final byte[][] g = new byte[k][n];
    for (int i = 0; i < k; i++) {
      g[i][i] = 1;
      for (int j = 0; j < m; j++) {
        g[i][k + j] = (byte) (h[j][i] & 1);
      }
    }
    return g;
  }

  /// True when `G * transpose(H)` is the zero matrix mod 2.
  static boolean isOrthogonal(byte[][] g, byte[][] h) {
    for (byte[] gRow : g) {
      for (byte[] hRow : h) {
        int sum = 0;
        for (int t = 0; t < gRow.length; t++) {
          sum ^= gRow[t] & hRow[t];
        }
        if (sum != 0) {
          return false;
        }
      }
    }
    return true;
  }

  private static int[][] adjacency(byte[][] h) {
    final int[][] result = new int[h.length][];
    for (int row = 0; row < h.length; row++) {
      int count = 0;
      for (byte b : h[row]) {
        count += b;
      }
      result[row] = new int[count];
      int next = 0;
      for (int column = 0; column < h[row].length; column++) {
        if (h[row][column] != 0) {
          result[row][next++] = column;
        }
      }
    }
    return result;
  }

  /// Log-likelihood magnitude of a binary symmetric channel with the given crossover probability, clamped to
  /// `[0.0001, 0.45]` so that an estimate of zero errors still leaves room for correction.
  public static double channelLlr(double errorRate) {
    final double p = Math.min(0.45, Math.max(1e-4, errorRate));
    return Math.log((1.0 - p) / p);
  }

  public int n() {
    return n;
  }

  public int k() {
    return k;
  }

  public double rate() {
    return (double) k / n;
  }

  /// Copy of `H`.
  public byte[][] parityCheckMatrix() {
    return deepCopy(parityCheck);
  }

  /// Copy of `G`.
  public byte[][] generatorMatrix() {
    return deepCopy(generator);
  }

  private static byte[][] deepCopy(byte[][] matrix) {
    final byte[][] copy = new byte[matrix.length][];
    for (int i = 0; i < matrix.length; i++) {
      copy[i] = matrix[i].clone();
    }
    return copy;
  }

  /// `message * G (mod 2)`.
  ///
  /// @param message `k` unpacked bits
  /// @return `n` unpacked bits, the message followed by its parity
  public byte[] encode(byte[] message) {
    if (message.length != k) {
      throw new IllegalArgumentException("message length must be " + k + " but was " + message.length);
    }
    final byte[] codeword = new byte[n];
    for (int row = 0; row < k; row++) {
      if (message[row] == 0) {
        continue;
      }
      final byte[] gRow = generator[row];
      for (int column = 0; column < n; column++) {
        codeword[column] ^= gRow[column];
      }
    }
    return codeword;
  }

  /// `H * bits (mod 2)`, zero for a valid codeword.
  public byte[] syndrome(byte[] bits) {
    if (bits.length != n) {
      throw new IllegalArgumentException("word length must be " + n + " but was " + bits.length);
    }
    final byte[] syndrome = new byte[m];
    for (int check = 0; check < m; check++) {
      int sum = 0;
      for (int variable : checkVariables[check]) {
        sum ^= bits[variable];
      }
      syndrome[check] = (byte) sum;
    }
    return syndrome;
  }

  public boolean isCodeword(byte[] bits) {
    for (byte b : syndrome(bits)) {
      if (b != 0) {
        return false;
      }
    }
    return true;
  }

  /// Decode hard received bits, each trusted with [#DEFAULT_CHANNEL_LLR].
  public Decoded decode(byte[] received, int maxIterations) {
    if (received.length != n) {
      throw new IllegalArgumentException("received length must be " + n + " but was " + received.length);
    }
    final double[] channel = new double[n];
    for (int i = 0; i < n; i++) {
      channel[i] = received[i] == 0 ? DEFAULT_CHANNEL_LLR : -DEFAULT_CHANNEL_LLR;
    }
    return decode(channel, maxIterations);
  }

  /// Sum-product decode from per-bit channel log-likelihood ratios.
  ///
  /// Each round the check nodes send every neighbour `2 atanh(prod tanh(x / 2))` over the other bits of the check, and
  /// each bit's belief becomes its channel value plus all incoming check messages. Decoding stops as soon as the hard
  /// decision has a zero syndrome.
  public Decoded decode(double[] channel, int maxIterations) {
    if (channel.length != n) {
      throw new IllegalArgumentException("channel length must be " + n + " but was " + channel.length);
    }
    byte[] hard = decide(channel);
    if (isCodeword(hard)) {
      return new Decoded(Arrays.copyOf(hard, k), hard, true, 0);
    }

    final double[][] toVariable = new double[m][];
    final double[][] fromVariable = new double[m][];
    for (int check = 0; check < m; check++) {
      final int[] variables = checkVariables[check];
      toVariable[check] = new double[variables.length];
      fromVariable[check] = new double[variables.length];
      for (int p = 0; p < variables.length; p++) {
        fromVariable[check][p] = channel[variables[p]];
      }
    }

    final double[] belief = new double[n];
    for (int iteration = 1; iteration <= maxIterations; iteration++) {
      for (int check = 0; check < m; check++) {
        updateCheck(fromVariable[check], toVariable[check]);
      }

      System.arraycopy(channel, 0, belief, 0, n);
      for (int check = 0; check < m; check++) {
        final int[] variables = checkVariables[check];
        for (int p = 0; p < variables.length; p++) {
          belief[variables[p]] += toVariable[check][p];
        }
      }
      for (int check = 0; check < m; check++) {
        final int[] variables = checkVariables[check];
        for (int p = 0; p < variables.length; p++) {
          fromVariable[check][p] = belief[variables[p]] - toVariable[check][p];
        }
      }

      hard = decide(belief);
      if (isCodeword(hard)) {
        return new Decoded(Arrays.copyOf(hard, k), hard, true, iteration);
      }
    }
    return new Decoded(Arrays.copyOf(hard, k), hard, false, maxIterations);
  }

  private static void updateCheck(double[] incoming, double[] outgoing) {
    final int degree = incoming.length;
    final double[] tanh = new double[degree];
    for (int p = 0; p < degree; p++) {
      tanh[p] = Math.tanh(incoming[p] / 2.0);
    }
    for (int p = 0; p < degree; p++) {
      double product = 1.0;
      for (int q = 0; q < degree; q++) {
        if (q != p) {
          product *= tanh[q];
        }
      }
      product = Math.max(-MAX_TANH, Math.min(MAX_TANH, product));
      outgoing[p] = Math.log((1.0 + product) / (1.0 - product));
    }
  }

  private static byte[] decide(double[] beliefs) {
    final byte[] bits = new byte[beliefs.length];
    for (int i = 0; i < beliefs.length; i++) {
      bits[i] = (byte) (beliefs[i] < 0 ? 1 : 0);
    }
    return bits;
  }
}
