// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.network;

import com.github.qkd_relay.BitVector;
import com.github.qkd_relay.CascadeConfig;
import com.github.qkd_relay.CascadeReconciler;
import com.github.qkd_relay.KeyGenerationException;
import com.github.qkd_relay.QkdCrypto;
import com.github.qkd_relay.QkdSession;
import com.github.qkd_relay.RawKeySource;
import com.github.qkd_relay.ReconciliationDivergenceException;
import com.github.qkd_relay.Reconciler;
import com.github.qkd_relay.SessionConfig;
import com.github.qkd_relay.SimulatedRawKeySource;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.LongFunction;

import static com.github.qkd_relay.network.RelayLogger.LOGGER;

/// Hop keys agreed by running a complete two party session between the endpoints of the hop, authenticated with the
/// link secret. When the raw key source fails or reconciliation diverges the hop key is derived from the link secret
/// instead so that the relay still completes. Authentication, signature and key mismatch failures propagate.
public final class SessionHopKeySource implements HopKeySource {

  /// Raw key bytes generated per byte of hop key. Leaves room for the bits spent on sampling and reconciliation.
  static final int RAW_BYTES_PER_KEY_BYTE = 8;
  static final int MIN_RAW_BYTES = 128;

  private final LongFunction<SimulatedRawKeySource.Pair> sources;
  private final Reconciler reconciler;
  private final SessionConfig config;
  private final int sampleSize;
  private final Clock clock;
  private final Executor executor;

  public SessionHopKeySource(LongFunction<SimulatedRawKeySource.Pair> sources,
                             Reconciler reconciler,
                             SessionConfig config,
                             int sampleSize,
                             Clock clock,
                             Executor executor) {
    this.sources = Objects.requireNonNull(sources, "sources required");
    this.reconciler = Objects.requireNonNull(reconciler, "reconciler required");
    this.config = Objects.requireNonNull(config, "config required");
    this.clock = Objects.requireNonNull(clock, "clock required");
    this.executor = Objects.requireNonNull(executor, "executor required");
    if (sampleSize < 0) {
      throw new IllegalArgumentException("sampleSize must not be negative");
    }
    this.sampleSize = sampleSize;
  }

  /// Simulated sources with the given bit error rate, Cascade reconciliation down to single bit blocks and 64
  /// sampled bits per hop.
  public static SessionHopKeySource simulated(double errorRate) {
    return new SessionHopKeySource(
        rawLength -> SimulatedRawKeySource.pair((int) rawLength, errorRate, QkdCrypto.secureRandom().nextLong()),
        new CascadeReconciler(new CascadeConfig(8, 4, 4, false)), SessionConfig.DEFAULT, 64, Clock.systemUTC(),
        ForkJoinPool.commonPool());
  }

  @Override
  public byte[] hopKey(NodeId from, NodeId to, byte[] sharedSecret, String context, int length) {
    final int rawLength = Math.max(MIN_RAW_BYTES, length * RAW_BYTES_PER_KEY_BYTE);
    final SimulatedRawKeySource.Pair pair = sources.apply(rawLength);
    try {
      return agree(from, to, sharedSecret, pair.reference(), pair.noisy(), length);
    } catch (KeyGenerationException | ReconciliationDivergenceException e) {
      LOGGER.warning(() -> "hop " + from + "->" + to + " session failed, deriving hop key from link secret: "
          + e.getMessage());
      return HopKeys.deriveHopKey(sharedSecret, context, length);
    }
  }

  private byte[] agree(NodeId from, NodeId to, byte[] secret, RawKeySource fromSource, RawKeySource toSource,
                       int length) {
    byte[] rawA = null;
    byte[] rawB = null;
    try (QkdSession a = new QkdSession(from.id(), QkdSession.Role.INITIATOR, secret, fromSource, reconciler, config,
        clock, executor);
         QkdSession b = new QkdSession(to.id(), QkdSession.Role.RESPONDER, secret, toSource, reconciler, config,
             clock, executor)) {
      a.acceptInitResponse(b.acceptInit(a.initiate()));
      a.verifyAuthResponse(b.authenticate(a.generateAuthChallenge()));
      b.generateRawKey(a.requestKeyGeneration(config.shotCount(), false));
      a.generateRawKey(false);
      rawA = a.keyMaterial();
      rawB = b.keyMaterial();
      b.acceptErrorDetection(a.detectErrors(rawA, rawB, sampleSize));
      a.reconcile(rawA, rawB);
      b.reconcile(rawA, rawB);
      b.amplifyPrivacy(a.amplifyPrivacy(length));
      a.acceptConfirmation(b.confirmKey(a.keyVerification()));
      LOGGER.fine(() -> "hop " + from + "->" + to + " agreed key in session " + a.sessionId().orElse("?"));
      return a.sessionKey().orElseThrow(() -> new IllegalStateException("confirmed session without a key"));
    } finally {
      BitVector.wipe(rawA);
      BitVector.wipe(rawB);
    }
  }
}
