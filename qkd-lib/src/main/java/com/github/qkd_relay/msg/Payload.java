// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.msg;

import com.github.qkd_relay.QkdCrypto;

import java.util.Objects;

/// Kind specific message content. Each record validates its fields on construction so that a message can only carry
/// the fields that belong to its kind.
public sealed interface Payload {

  MessageKind kind();

  /// Opens the exchange and names the reconciliation engine the initiator will run.
  record InitRequest(String partyId, String engine) implements Payload {
    public InitRequest {
      Objects.requireNonNull(partyId, "partyId required");
      Objects.requireNonNull(engine, "engine required");
    }

    @Override
    public MessageKind kind() {
      return MessageKind.INIT_REQUEST;
    }
  }

  /// Answers an [InitRequest]; `accepted` is false when the responder runs a different engine.
  record InitResponse(String partyId, boolean accepted) implements Payload {
    public InitResponse {
      Objects.requireNonNull(partyId, "partyId required");
    }

    @Override
    public MessageKind kind() {
      return MessageKind.INIT_RESPONSE;
    }
  }

  record AuthChallenge(byte[] challenge) implements Payload {
    public static final int LENGTH = 32;

    public AuthChallenge {
      Objects.requireNonNull(challenge, "challenge required");
      if (challenge.length != LENGTH) {
        throw new IllegalArgumentException("challenge must be " + LENGTH + " bytes");
      }
    }

    @Override
    public MessageKind kind() {
      return MessageKind.AUTH_CHALLENGE;
    }
  }

  /// Keyed digest of the challenge under the pre-shared secret.
  record AuthResponse(byte[] response) implements Payload {
    public AuthResponse {
      Objects.requireNonNull(response, "response required");
      if (response.length != QkdCrypto.MAC_LENGTH) {
        throw new IllegalArgumentException("response must be " + QkdCrypto.MAC_LENGTH + " bytes");
      }
    }

    @Override
    public MessageKind kind() {
      return MessageKind.AUTH_RESPONSE;
    }
  }

  record KeyGenRequest(int shotCount, boolean useHardware) implements Payload {
    public KeyGenRequest {
      if (shotCount < 1) {
        throw new IllegalArgumentException("shotCount must be positive");
      }
    }

    @Override
    public MessageKind kind() {
      return MessageKind.KEY_GEN_REQUEST;
    }
  }

  /// Describes a generated raw key by digest only. The raw key itself is never sent.
  record KeyGenResponse(String sourceId, double fidelity, byte[] keyDigest, int keyLength) implements Payload {
    public KeyGenResponse {
      Objects.requireNonNull(sourceId, "sourceId required");
      Objects.requireNonNull(keyDigest, "keyDigest required");
      if (!Double.isFinite(fidelity) || fidelity < 0.0) {
        throw new IllegalArgumentException("fidelity must be a non-negative number");
      }
      if (keyLength < 0) {
        throw new IllegalArgumentException("keyLength must not be negative");
      }
    }

    @Override
    public MessageKind kind() {
      return MessageKind.KEY_GEN_RESPONSE;
    }
  }

  /// The sampled bit positions and how many of them disagreed. Both sides discard these positions.
  record ErrorDetect(int[] sampledIndices, int errorCount, double errorRate) implements Payload {
    public ErrorDetect {
      Objects.requireNonNull(sampledIndices, "sampledIndices required");
      if (errorCount < 0 || errorCount > sampledIndices.length) {
        throw new IllegalArgumentException("errorCount " + errorCount + " outside [0, " + sampledIndices.length + "]");
      }
      if (!(errorRate >= 0.0 && errorRate <= 1.0)) {
        throw new IllegalArgumentException("errorRate must be in [0, 1]");
      }
    }

    @Override
    public MessageKind kind() {
      return MessageKind.ERROR_DETECT;
    }
  }

  record ErrorCorrect(String engine, int errorsCorrected, int remainingErrors, int leakedBits, boolean converged)
      implements Payload {
    public ErrorCorrect {
      Objects.requireNonNull(engine, "engine required");
      if (errorsCorrected < 0 || remainingErrors < 0 || leakedBits < 0) {
        throw new IllegalArgumentException("counts must not be negative");
      }
    }

    @Override
    public MessageKind kind() {
      return MessageKind.ERROR_CORRECT;
    }
  }

  /// The public seed and output length both parties feed to the privacy amplifier.
  record PrivacyAmp(byte[] seed, int outputLength) implements Payload {
    public PrivacyAmp {
      Objects.requireNonNull(seed, "seed required");
      if (seed.length == 0) {
        throw new IllegalArgumentException("seed must not be empty");
      }
      if (outputLength < 1) {
        throw new IllegalArgumentException("outputLength must be positive");
      }
    }

    @Override
    public MessageKind kind() {
      return MessageKind.PRIVACY_AMP;
    }
  }

  /// One-way digest of the sender's final key.
  record KeyVerify(byte[] keyDigest) implements Payload {
    public KeyVerify {
      Objects.requireNonNull(keyDigest, "keyDigest required");
    }

    @Override
    public MessageKind kind() {
      return MessageKind.KEY_VERIFY;
    }
  }

  record KeyConfirm(boolean confirmed, int keyLength) implements Payload {
    public KeyConfirm {
      if (keyLength < 0) {
        throw new IllegalArgumentException("keyLength must not be negative");
      }
    }

    @Override
    public MessageKind kind() {
      return MessageKind.KEY_CONFIRM;
    }
  }
}
