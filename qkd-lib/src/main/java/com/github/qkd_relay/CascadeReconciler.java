// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

import static com.github.qkd_relay.QkdLogger.LOGGER;

/// Cascade reconciliation: multi-pass block parity comparison with binary search to locate disagreements.
///
/// Each pass partitions the keys into contiguous blocks, halving the block size from the previous pass. A block whose
/// parities differ holds an odd number of disagreements and is bisected. Each half whose parity differs is searched
/// recursively until it is no longer than [CascadeConfig#bisectLimit()] where every bit is compared directly. A
/// found disagreement is fixed by flipping the counterpart's bit. Key A is the reference and is never modified.
///
/// An even number of disagreements inside one block leaves its parity unchanged. These are only seen by a later pass
/// whose smaller blocks separate them, which is why the block size shrinks.
public class CascadeReconciler implements Reconciler {

  public static final String NAME = "cascade";

  private final CascadeConfig config;

  public CascadeReconciler() {
    this(CascadeConfig.DEFAULT);
  }

  public CascadeReconciler(CascadeConfig config) {
    this.config = Objects.requireNonNull(config, "config required");
  }

  @Override
  public String name() {
    return NAME;
  }

  public CascadeConfig config() {
    return config;
  }

  @Override
  public ReconciliationResult reconcile(byte[] keyA, byte[] keyB, double errorRate) {
    Reconciler.requireErrorRate(errorRate);
    final int length = Math.min(keyA.length, keyB.length) * 8;
    final byte[] bitsA = Arrays.copyOf(BitVector.toBits(keyA), length);
    final byte[] bitsB = Arrays.copyOf(BitVector.toBits(keyB), length);

    LOGGER.fine(() -> String.format("Cascade reconciling %d bits, block size %d, %d passes, estimated error rate %.4f",
        length, config.initialBlockSize(), config.passes(), errorRate));

    final BitSet corrected = new BitSet(length);
    final List<ReconciliationResult.Round> rounds = new ArrayList<>();
    int leakedBits = 0;

    for (int pass = 1; pass <= config.passes(); pass++) {
      final int blockSize = config.blockSize(pass);
      final var search = new BlockSearch(bitsA, bitsB, corrected);
      int blocks = 0;

      for (int start = 0; start < length; start += blockSize) {
        final int end = Math.min(start + blockSize, length);
        blocks++;
        search.leaked++;
        if (BitVector.parity(bitsA, start, end) != BitVector.parity(bitsB, start, end)) {
          search.locate(start, end);
        }
      }

      leakedBits += search.leaked;
      rounds.add(new ReconciliationResult.Round(pass, blockSize, blocks, search.correctedThisPass));

      final int passNumber = pass;
      LOGGER.finer(() -> String.format("Cascade pass %d block size %d corrected %d", passNumber, blockSize,
          search.correctedThisPass));

      if (search.correctedThisPass == 0 && config.earlyStop()) {
        break;
      }
    }

    final int remaining = BitVector.hammingDistance(bitsA, bitsB);
    final int totalCorrected = corrected.cardinality();
    final int leaked = leakedBits;
    LOGGER.fine(() -> String.format("Cascade corrected %d bits, %d remaining, %d parity bits disclosed",
        totalCorrected, remaining, leaked));

    return new ReconciliationResult(
        BitVector.toBytes(bitsA),
        BitVector.toBytes(bitsB),
        totalCorrected,
        remaining,
        remaining == 0,
        leakedBits,
        rounds);
  }

  /// Binary search state for one pass. Corrections are recorded in the set shared across passes so that no index is
  /// corrected twice.
  private final class BlockSearch {
    final byte[] reference;
    final byte[] counterpart;
    final BitSet corrected;
    int correctedThisPass;
    int leaked;

    BlockSearch(byte[] reference, byte[] counterpart, BitSet corrected) {
      this.reference = reference;
      this.counterpart = counterpart;
      this.corrected = corrected;
    }

    /// Find every disagreement in `[from, to)`, a range already known to have mismatched parity.
    void locate(int from, int to) {
      if (to - from <= config.bisectLimit()) {
        compareDirectly(from, to);
        return;
      }
      final int mid = from + (to - from) / 2;
      searchHalf(from, mid);
      searchHalf(mid, to);
    }

    private void searchHalf(int from, int to) {
      if (to - from <= config.bisectLimit()) {
        compareDirectly(from, to);
        return;
      }
      leaked++;
      if (BitVector.parity(reference, from, to) != BitVector.parity(counterpart, from, to)) {
        locate(from, to);
      }
    }

    private void compareDirectly(int from, int to) {
      leaked += to - from;
      for (int i = from; i < to; i++) {
        if (reference[i] != counterpart[i] && !corrected.get(i)) {
          counterpart[i] = reference[i];
          corrected.set(i);
          correctedThisPass++;
        }
      }
    }
  }
}
