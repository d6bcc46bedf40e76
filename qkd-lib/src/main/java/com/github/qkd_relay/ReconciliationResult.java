// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

import java.util.List;
import java.util.Objects;

/// Outcome of reconciling two keys. Key A is the reference side and is never modified by Cascade.
///
/// @param correctedKeyA   the reference party's key after reconciliation
/// @param correctedKeyB   the counterpart's key after reconciliation
/// @param errorsCorrected number of bits flipped on the counterpart's side
/// @param remainingErrors disagreements left after reconciliation, by full comparison
/// @param converged       true only when both corrected keys are identical
/// @param leakedBits      parity bits disclosed on the public channel while reconciling
/// @param rounds          one entry per Cascade pass or LDPC code attempt
public record ReconciliationResult(
    byte[] correctedKeyA,
    byte[] correctedKeyB,
    int errorsCorrected,
    int remainingErrors,
    boolean converged,
    int leakedBits,
    List<Round> rounds
) {
  public ReconciliationResult {
    Objects.requireNonNull(correctedKeyA, "correctedKeyA required");
    Objects.requireNonNull(correctedKeyB, "correctedKeyB required");
    rounds = List.copyOf(rounds);
    if (converged && remainingErrors != 0) {
      throw new IllegalArgumentException("cannot converge with " + remainingErrors + " remaining errors");
    }
  }

  /// @param round           one based pass or attempt number
  /// @param blockSize       block size in bits used by the round
  /// @param blocksProcessed number of blocks compared
  /// @param errorsCorrected bits corrected in this round
  public record Round(int round, int blockSize, int blocksProcessed, int errorsCorrected) {
  }

  /// Copy carrying only the statistics, for reporting a failure without exposing either key.
  public ReconciliationResult withoutKeys() {
    return new ReconciliationResult(new byte[0], new byte[0], errorsCorrected, remainingErrors, converged,
        leakedBits, rounds);
  }
}
