// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

import static com.github.qkd_relay.QkdLogger.LOGGER;

/// Reconciliation with a sparse linear code instead of iterative bisection.
///
/// The keys are cut into blocks of `k` bits. The reference party encodes its block and discloses only the parity half
/// of the codeword. The counterpart joins its own `k` bits to those parity bits and runs belief propagation, trusting
/// its own bits according to the measured error rate and the disclosed parity bits almost completely. The decoded
/// message becomes the counterpart's reconciled block.
///
/// A block that does not converge is retried with codes of lower rate, which disclose more parity. A block that still
/// fails is left as it was and flagged, so the result does not converge.
public class LdpcReconciler implements Reconciler {

  public static final String NAME = "ldpc";

  /// Reliability given to the disclosed parity bits which cross the public channel without error.
  static final double PARITY_LLR = LdpcCode.channelLlr(0.0);

  private final LdpcConfig config;

  private record CodeShape(int n, int k) {
  }

  /// Codes owned by this instance, evicting the least recently used beyond [LdpcConfig#codeCacheSize()].
  private final Map<CodeShape, LdpcCode> codes;

  public LdpcReconciler() {
    this(LdpcConfig.DEFAULT);
  }

  public LdpcReconciler(LdpcConfig config) {
    this.config = Objects.requireNonNull(config, "config required");
    this.codes = new LinkedHashMap<>(16, 0.75f, true) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<CodeShape, LdpcCode> eldest) {
        return size() > config.codeCacheSize();
      }
    };
  }

  @Override
  public String name() {
    return NAME;
  }

  public LdpcConfig config() {
    return config;
  }

  /// The code for a shape, built deterministically from the configured seed so that both parties construct the same
  /// matrices.
  LdpcCode code(int n, int k) {
    synchronized (codes) {
      return codes.computeIfAbsent(new CodeShape(n, k), shape -> LdpcCode.generate(shape.n(), shape.k(),
          config.rowWeight(), new Random(config.seed() * 31L + shape.n() * 1_000_003L + shape.k())));
    }
  }

  @Override
  public ReconciliationResult reconcile(byte[] keyA, byte[] keyB, double errorRate) {
    Reconciler.requireErrorRate(errorRate);
    final int length = Math.min(keyA.length, keyB.length) * 8;
    final byte[] bitsA = Arrays.copyOf(BitVector.toBits(keyA), length);
    final byte[] bitsB = Arrays.copyOf(BitVector.toBits(keyB), length);
    final byte[] outA = new byte[length];
    final byte[] outB = new byte[length];

    final int k = config.messageLength();
    final int attempts = config.maxRetries() + 1;
    final int[] blocksPerAttempt = new int[attempts];
    final int[] correctedPerAttempt = new int[attempts];
    final double messageLlr = LdpcCode.channelLlr(errorRate);

    LOGGER.fine(() -> String.format("LDPC reconciling %d bits in blocks of %d, rate %.2f, estimated error rate %.4f",
        length, k, config.codeRate(), errorRate));

    int leakedBits = 0;
    int divergentBlocks = 0;

    for (int offset = 0; offset < length; offset += k) {
      final int blockLength = Math.min(k, length - offset);
      // padding is zero on both sides so it never disagrees
      final byte[] blockA = Arrays.copyOf(Arrays.copyOfRange(bitsA, offset, offset + blockLength), k);
      final byte[] blockB = Arrays.copyOf(Arrays.copyOfRange(bitsB, offset, offset + blockLength), k);

      byte[] reconciledA = blockA;
      byte[] reconciledB = blockB;
      boolean blockConverged = false;

      for (int attempt = 0; attempt < attempts && !blockConverged; attempt++) {
        final int n = Math.max(k + 1, (int) Math.ceil(k / config.rateForAttempt(attempt)));
        final LdpcCode code = code(n, k);
        final byte[] codewordA = code.encode(blockA);
        leakedBits += n - k;

        final LdpcCode.Decoded decodedA = code.decode(codewordA, config.maxIterations());
        final LdpcCode.Decoded decodedB = code.decode(sideInformation(blockB, codewordA, k, messageLlr),
            config.maxIterations());

        blocksPerAttempt[attempt]++;
        if (decodedB.converged()) {
          reconciledA = decodedA.message();
          reconciledB = decodedB.message();
          correctedPerAttempt[attempt] += BitVector.hammingDistance(blockB, reconciledB);
          blockConverged = true;
        } else {
          final int blockOffset = offset;
          final int attemptNumber = attempt + 1;
          LOGGER.fine(() -> String.format("LDPC block at bit %d did not converge on attempt %d at rate %.2f",
              blockOffset, attemptNumber, code.rate()));
        }
      }

      if (!blockConverged) {
        divergentBlocks++;
        final int blockOffset = offset;
        LOGGER.warning(() -> String.format("LDPC block at bit %d failed to converge after %d attempts",
            blockOffset, attempts));
      }

      System.arraycopy(reconciledA, 0, outA, offset, blockLength);
      System.arraycopy(reconciledB, 0, outB, offset, blockLength);
    }

    final List<ReconciliationResult.Round> rounds = new ArrayList<>();
    for (int attempt = 0; attempt < attempts; attempt++) {
      if (blocksPerAttempt[attempt] > 0) {
        rounds.add(new ReconciliationResult.Round(attempt + 1, k, blocksPerAttempt[attempt],
            correctedPerAttempt[attempt]));
      }
    }

    final int corrected = BitVector.hammingDistance(bitsB, outB);
    final int remaining = BitVector.hammingDistance(outA, outB);
    final int divergent = divergentBlocks;
    final int leaked = leakedBits;
    LOGGER.fine(() -> String.format("LDPC corrected %d bits, %d remaining, %d divergent blocks, %d parity bits disclosed",
        corrected, remaining, divergent, leaked));

    return new ReconciliationResult(
        BitVector.toBytes(outA),
        BitVector.toBytes(outB),
        corrected,
        remaining,
        remaining == 0 && divergentBlocks == 0,
        leakedBits,
        rounds);
  }

  /// Channel beliefs for the counterpart: its own message bits at the measured reliability followed by the reference
  /// party's disclosed parity bits.
  static double[] sideInformation(byte[] ownMessage, byte[] referenceCodeword, int k, double messageLlr) {
    final double[] channel = new double[referenceCodeword.length];
    for (int i = 0; i < k; i++) {
      channel[i] = ownMessage[i] == 0 ? messageLlr : -messageLlr;
    }
    for (int i = k; i < referenceCodeword.length; i++) {
      channel[i] = referenceCodeword[i] == 0 ? PARITY_LLR : -PARITY_LLR;
    }
    return channel;
  }
}
