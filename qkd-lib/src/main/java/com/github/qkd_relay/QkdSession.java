// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

import com.github.qkd_relay.msg.MessageKind;
import com.github.qkd_relay.msg.MessageSigner;
import com.github.qkd_relay.msg.Payload;
import com.github.qkd_relay.msg.QkdMessage;
import org.jetbrains.annotations.TestOnly;

import java.time.Clock;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;

import static com.github.qkd_relay.QkdLogger.LOGGER;

/// One party's side of a two party key agreement.
///
/// The session walks the phases of [SessionPhase] strictly in order. Each operation checks that the session is in the
/// phase it belongs to, does its work, advances, and returns the signed message to hand to the peer. Every inbound
/// message is verified before it is acted upon. Any protocol failure aborts the session, wipes its key material and
/// then throws, so a session that has failed can never be resumed or have its id reused.
///
/// The initiator plays the reference side "A" during reconciliation and the responder the counterpart "B". A typical
/// exchange, with `a` the initiator and `b` the responder:
///
/// ```
/// challenge = a.generateAuthChallenge();
/// a.verifyAuthResponse(b.authenticate(challenge));
/// b.generateRawKey(a.requestKeyGeneration(shots, false));
/// a.generateRawKey(false);
/// b.acceptErrorDetection(a.detectErrors(rawA, rawB, sampleSize));
/// a.reconcile(rawA, rawB); b.reconcile(rawA, rawB);
/// b.amplifyPrivacy(a.amplifyPrivacy(32));
/// a.acceptConfirmation(b.confirmKey(a.keyVerification()));
/// ```
///
/// Instances are not thread safe. Each party owns its session exclusively.
public class QkdSession implements AutoCloseable {

  public enum Role {INITIATOR, RESPONDER}

  private final String partyId;
  private final Role role;
  private final MessageSigner signer;
  private final byte[] sharedSecret;
  private final RawKeySource rawKeySource;
  private final Reconciler reconciler;
  private final SessionConfig config;
  private final Clock clock;
  private final Executor executor;

  private SessionPhase phase = SessionPhase.IDLE;
  private String sessionId;
  private byte[] challenge;
  private byte[] rawKey;
  private byte[] reconciledKey;
  private byte[] finalKey;
  private double measuredErrorRate = Double.NaN;
  private int[] sampledIndices = new int[0];
  private int leakedBits;
  private String peerPartyId;

  public QkdSession(String partyId,
                    Role role,
                    byte[] sharedSecret,
                    RawKeySource rawKeySource,
                    Reconciler reconciler,
                    SessionConfig config,
                    Clock clock,
                    Executor executor) {
    this.partyId = Objects.requireNonNull(partyId, "partyId required");
    this.role = Objects.requireNonNull(role, "role required");
    this.signer = new MessageSigner(sharedSecret);
    this.sharedSecret = sharedSecret.clone();
    this.rawKeySource = Objects.requireNonNull(rawKeySource, "rawKeySource required");
    this.reconciler = Objects.requireNonNull(reconciler, "reconciler required");
    this.config = Objects.requireNonNull(config, "config required");
    this.clock = Objects.requireNonNull(clock, "clock required");
    this.executor = Objects.requireNonNull(executor, "executor required");
  }

  public static QkdSession initiator(String partyId, byte[] sharedSecret, RawKeySource source, Reconciler reconciler) {
    return new QkdSession(partyId, Role.INITIATOR, sharedSecret, source, reconciler, SessionConfig.DEFAULT,
        Clock.systemUTC(), ForkJoinPool.commonPool());
  }

  public static QkdSession responder(String partyId, byte[] sharedSecret, RawKeySource source, Reconciler reconciler) {
    return new QkdSession(partyId, Role.RESPONDER, sharedSecret, source, reconciler, SessionConfig.DEFAULT,
        Clock.systemUTC(), ForkJoinPool.commonPool());
  }

  // ---------------------------------------------------------------- init handshake

  /// Announce this party and the reconciliation engine it will run. Assigns the session id. Optional: a session may
  /// start directly with [#generateAuthChallenge()].
  public QkdMessage initiate() {
    requireRole(Role.INITIATOR);
    require(SessionPhase.IDLE);
    if (sessionId != null) {
      throw new IllegalStateException(partyId + " has already initiated session " + sessionId);
    }
    sessionId = newSessionId();
    LOGGER.fine(() -> partyId + " initiating session " + sessionId + " with engine " + reconciler.name());
    return sign(new Payload.InitRequest(partyId, reconciler.name()));
  }

  /// Answer an [Payload.InitRequest]. The responder adopts the session id and accepts only when both sides run the
  /// same reconciliation engine. A rejected request aborts this session.
  public QkdMessage acceptInit(QkdMessage request) {
    requireRole(Role.RESPONDER);
    require(SessionPhase.IDLE);
    if (sessionId != null) {
      throw new IllegalStateException(partyId + " has already joined session " + sessionId);
    }
    verifySignature(request, MessageKind.INIT_REQUEST);
    final var init = request.payload(Payload.InitRequest.class);
    sessionId = request.sessionId();
    peerPartyId = init.partyId();
    final boolean accepted = reconciler.name().equals(init.engine());
    final QkdMessage response = sign(new Payload.InitResponse(partyId, accepted));
    if (!accepted) {
      abort("peer " + peerPartyId + " runs " + init.engine() + " but this party runs " + reconciler.name());
    }
    return response;
  }

  /// Check the responder's answer to [#initiate()].
  ///
  /// @throws QkdException when the responder declined, after aborting
  public void acceptInitResponse(QkdMessage response) {
    requireRole(Role.INITIATOR);
    require(SessionPhase.IDLE);
    accept(response, MessageKind.INIT_RESPONSE);
    final var init = response.payload(Payload.InitResponse.class);
    peerPartyId = init.partyId();
    if (!init.accepted()) {
      final String reason = "peer " + peerPartyId + " declined engine " + reconciler.name();
      abort(reason);
      throw new QkdException(reason, false);
    }
  }

  // ---------------------------------------------------------------- authentication

  /// Issue a fresh 32 byte challenge. Assigns a new session id unless [#initiate()] already did.
  public QkdMessage generateAuthChallenge() {
    requireRole(Role.INITIATOR);
    require(SessionPhase.IDLE);
    if (sessionId == null) {
      sessionId = newSessionId();
    }
    challenge = QkdCrypto.randomBytes(Payload.AuthChallenge.LENGTH);
    advance(SessionPhase.AUTHENTICATING);
    return sign(new Payload.AuthChallenge(challenge.clone()));
  }

  /// Prove knowledge of the shared secret by answering the challenge with its keyed digest. The challenge carries
  /// a signature under the same secret so a responder with the wrong secret fails here.
  ///
  /// @throws AuthenticationException when the challenge was not signed with this party's secret, after aborting
  public QkdMessage authenticate(QkdMessage challengeMessage) {
    requireRole(Role.RESPONDER);
    require(SessionPhase.IDLE);
    requireKind(challengeMessage, MessageKind.AUTH_CHALLENGE);
    if (sessionId == null) {
      sessionId = challengeMessage.sessionId();
    }
    requireAuthenticSignature(challengeMessage);
    final byte[] received = challengeMessage.payload(Payload.AuthChallenge.class).challenge();
    advance(SessionPhase.AUTHENTICATING);
    final byte[] response = QkdCrypto.hmac(sharedSecret, received);
    advance(SessionPhase.KEY_GENERATING);
    LOGGER.fine(() -> partyId + " answered challenge for session " + sessionId);
    return sign(new Payload.AuthResponse(response));
  }

  /// Check the responder's answer against the expected keyed digest in constant time.
  ///
  /// @throws AuthenticationException on mismatch, after aborting
  public void verifyAuthResponse(QkdMessage responseMessage) {
    requireRole(Role.INITIATOR);
    require(SessionPhase.AUTHENTICATING);
    requireKind(responseMessage, MessageKind.AUTH_RESPONSE);
    requireAuthenticSignature(responseMessage);
    final byte[] expected = QkdCrypto.hmac(sharedSecret, challenge);
    final byte[] actual = responseMessage.payload(Payload.AuthResponse.class).response();
    BitVector.wipe(challenge);
    challenge = null;
    if (!QkdCrypto.constantTimeEquals(expected, actual)) {
      abort("challenge response mismatch");
      throw new AuthenticationException("challenge response mismatch in session " + sessionId);
    }
    advance(SessionPhase.KEY_GENERATING);
    LOGGER.fine(() -> partyId + " authenticated peer for session " + sessionId);
  }

  // ---------------------------------------------------------------- raw key

  /// Ask the responder to generate its half of the raw key.
  public QkdMessage requestKeyGeneration(int shotCount, boolean useHardware) {
    requireRole(Role.INITIATOR);
    require(SessionPhase.KEY_GENERATING);
    return sign(new Payload.KeyGenRequest(shotCount, useHardware));
  }

  /// Generate the raw key with the configured shot count.
  public QkdMessage generateRawKey(boolean useHardware) {
    return generateRawKey(config.shotCount(), useHardware);
  }

  /// Generate the raw key as asked by an inbound [Payload.KeyGenRequest].
  public QkdMessage generateRawKey(QkdMessage request) {
    require(SessionPhase.KEY_GENERATING);
    accept(request, MessageKind.KEY_GEN_REQUEST);
    final var keyGen = request.payload(Payload.KeyGenRequest.class);
    return generateRawKey(keyGen.shotCount(), keyGen.useHardware());
  }

  /// Call the raw key source, bounded by the configured timeout. The outgoing message carries only a digest, the
  /// length and the claimed fidelity of the key, never the key.
  ///
  /// @throws KeyGenerationException when the source fails or times out, after aborting
  public QkdMessage generateRawKey(int shotCount, boolean useHardware) {
    require(SessionPhase.KEY_GENERATING);
    final CompletableFuture<RawKey> future =
        CompletableFuture.supplyAsync(() -> rawKeySource.generateRawKey(shotCount, useHardware), executor);
    final RawKey generated;
    try {
      generated = future.get(config.rawKeyTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      abort("raw key source timed out");
      throw new KeyGenerationException("raw key source timed out after " + config.rawKeyTimeout(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      abort("interrupted waiting for raw key");
      throw new KeyGenerationException("interrupted waiting for raw key", e);
    } catch (ExecutionException e) {
      abort("raw key source failed");
      final Throwable cause = e.getCause();
      if (cause instanceof KeyGenerationException keyGenerationException) {
        throw keyGenerationException;
      }
      throw new KeyGenerationException("raw key source failed: " + cause, cause);
    }
    rawKey = generated.bytes().clone();
    advance(SessionPhase.ERROR_DETECTING);
    LOGGER.fine(() -> partyId + " generated " + generated + " for session " + sessionId);
    return sign(new Payload.KeyGenResponse(generated.sourceId(), generated.fidelity(), QkdCrypto.digest(rawKey),
        rawKey.length));
  }

  // ---------------------------------------------------------------- error detection

  /// Estimate the error rate by comparing `sampleSize` randomly chosen bit positions of the two keys. Positions are
  /// chosen with a [java.security.SecureRandom] without replacement. The positions are remembered so that they can
  /// be discarded before reconciliation, as they are now public.
  ///
  /// @return the signed [Payload.ErrorDetect] carrying the positions, the mismatch count and the rate
  public QkdMessage detectErrors(byte[] keyA, byte[] keyB, int sampleSize) {
    require(SessionPhase.ERROR_DETECTING);
    final int bits = Math.min(keyA.length, keyB.length) * 8;
    final int[] sample = BitVector.sampleIndices(bits, Math.min(sampleSize, bits));
    int errors = 0;
    for (int index : sample) {
      if (BitVector.bit(keyA, index) != BitVector.bit(keyB, index)) {
        errors++;
      }
    }
    final double rate = sample.length == 0 ? 0.0 : (double) errors / sample.length;
    adoptErrorEstimate(sample, rate);
    return sign(new Payload.ErrorDetect(sample, errors, rate));
  }

  /// Adopt the sampled positions and error rate measured by the peer so that both sides discard the same bits.
  ///
  /// @return the measured error rate
  public double acceptErrorDetection(QkdMessage detection) {
    require(SessionPhase.ERROR_DETECTING);
    accept(detection, MessageKind.ERROR_DETECT);
    final var errorDetect = detection.payload(Payload.ErrorDetect.class);
    adoptErrorEstimate(errorDetect.sampledIndices(), errorDetect.errorRate());
    return measuredErrorRate;
  }

  private void adoptErrorEstimate(int[] sample, double rate) {
    sampledIndices = sample.clone();
    measuredErrorRate = rate;
    advance(SessionPhase.RECONCILING);
    LOGGER.fine(() -> String.format("%s measured error rate %.4f over %d sampled bits", partyId, rate, sample.length));
  }

  public double measuredErrorRate() {
    return measuredErrorRate;
  }

  // ---------------------------------------------------------------- reconciliation

  /// Reconcile the two keys with the configured engine after dropping the sampled positions. The initiator keeps
  /// the reference side and the responder the corrected counterpart.
  ///
  /// @throws ReconciliationDivergenceException when the keys could not be made identical, after aborting
  public QkdMessage reconcile(byte[] keyA, byte[] keyB) {
    require(SessionPhase.RECONCILING);
    final byte[] a;
    final byte[] b;
    if (config.discardSampledBits()) {
      final int length = Math.min(keyA.length, keyB.length);
      a = BitVector.discard(Arrays.copyOf(keyA, length), sampledIndices);
      b = BitVector.discard(Arrays.copyOf(keyB, length), sampledIndices);
    } else {
      a = keyA;
      b = keyB;
      leakedBits += sampledIndices.length;
    }
    final ReconciliationResult result = reconciler.reconcile(a, b, measuredErrorRate);
    leakedBits += result.leakedBits();
    if (!result.converged()) {
      final String reason = reconciler.name() + " left " + result.remainingErrors() + " errors";
      abort(reason);
      throw new ReconciliationDivergenceException(reason + " in session " + sessionId, result.withoutKeys());
    }
    reconciledKey = role == Role.INITIATOR ? result.correctedKeyA() : result.correctedKeyB();
    BitVector.wipe(role == Role.INITIATOR ? result.correctedKeyB() : result.correctedKeyA());
    BitVector.wipe(rawKey);
    rawKey = null;
    advance(SessionPhase.PRIVACY_AMPLIFYING);
    LOGGER.fine(() -> partyId + " reconciled " + reconciledKey.length + " bytes with " + reconciler.name() + ", "
        + result.errorsCorrected() + " corrected, " + leakedBits + " bits disclosed");
    return sign(new Payload.ErrorCorrect(reconciler.name(), result.errorsCorrected(), result.remainingErrors(),
        result.leakedBits(), true));
  }

  /// Bits disclosed so far by sampling and reconciliation.
  public int leakedBits() {
    return leakedBits;
  }

  // ---------------------------------------------------------------- privacy amplification

  /// Compress the reconciled key to `outputLength` bytes under a fresh random seed.
  public QkdMessage amplifyPrivacy(int outputLength) {
    return amplifyPrivacy(PrivacyAmplifier.newSeed(), outputLength);
  }

  /// Compress the reconciled key to `outputLength` bytes under the given public seed.
  public QkdMessage amplifyPrivacy(byte[] seed, int outputLength) {
    require(SessionPhase.PRIVACY_AMPLIFYING);
    amplify(seed, outputLength);
    return sign(new Payload.PrivacyAmp(seed.clone(), outputLength));
  }

  /// Apply the seed and length chosen by the peer.
  public void amplifyPrivacy(QkdMessage privacyAmp) {
    require(SessionPhase.PRIVACY_AMPLIFYING);
    accept(privacyAmp, MessageKind.PRIVACY_AMP);
    final var amp = privacyAmp.payload(Payload.PrivacyAmp.class);
    amplify(amp.seed(), amp.outputLength());
  }

  private void amplify(byte[] seed, int outputLength) {
    final int secure = PrivacyAmplifier.secureLength(reconciledKey.length * 8, leakedBits, config.securityBits());
    if (outputLength > secure) {
      LOGGER.warning(() -> partyId + " amplifying to " + outputLength + " bytes exceeds the " + secure
          + " bytes that are safe after disclosing " + leakedBits + " bits");
    }
    finalKey = PrivacyAmplifier.amplify(reconciledKey, outputLength, seed);
    BitVector.wipe(reconciledKey);
    reconciledKey = null;
    advance(SessionPhase.VERIFYING);
    LOGGER.fine(() -> partyId + " amplified to " + outputLength + " bytes, fingerprint "
        + QkdCrypto.fingerprint(finalKey));
  }

  // ---------------------------------------------------------------- verification

  /// Compare two keys by their digests in constant time. Symmetric in its arguments.
  public static boolean keysMatch(byte[] keyA, byte[] keyB) {
    return QkdCrypto.constantTimeEquals(QkdCrypto.digest(keyA), QkdCrypto.digest(keyB));
  }

  /// Confirm the session when both final keys are equal. The key kept is this party's own side.
  ///
  /// @throws KeyMismatchException when the digests differ, after aborting
  public QkdMessage verifyKey(byte[] keyA, byte[] keyB) {
    require(SessionPhase.VERIFYING);
    if (!keysMatch(keyA, keyB)) {
      abort("final keys differ");
      throw new KeyMismatchException("final keys differ in session " + sessionId);
    }
    final byte[] own = role == Role.INITIATOR ? keyA : keyB;
    BitVector.wipe(finalKey);
    finalKey = own.clone();
    return confirm();
  }

  /// Digest of this party's final key for the peer to check with [#confirmKey(QkdMessage)].
  public QkdMessage keyVerification() {
    require(SessionPhase.VERIFYING);
    return sign(new Payload.KeyVerify(QkdCrypto.digest(finalKey)));
  }

  /// Check the peer's key digest against this party's final key.
  ///
  /// @throws KeyMismatchException when the digests differ, after aborting
  public QkdMessage confirmKey(QkdMessage verification) {
    require(SessionPhase.VERIFYING);
    accept(verification, MessageKind.KEY_VERIFY);
    final byte[] peerDigest = verification.payload(Payload.KeyVerify.class).keyDigest();
    if (!QkdCrypto.constantTimeEquals(QkdCrypto.digest(finalKey), peerDigest)) {
      abort("peer key digest differs");
      throw new KeyMismatchException("peer key digest differs in session " + sessionId);
    }
    return confirm();
  }

  /// Complete the session on the peer's [Payload.KeyConfirm].
  ///
  /// @throws KeyMismatchException when the peer did not confirm, after aborting
  public void acceptConfirmation(QkdMessage confirmation) {
    require(SessionPhase.VERIFYING);
    accept(confirmation, MessageKind.KEY_CONFIRM);
    final var keyConfirm = confirmation.payload(Payload.KeyConfirm.class);
    if (!keyConfirm.confirmed() || keyConfirm.keyLength() != finalKey.length) {
      abort("peer did not confirm the key");
      throw new KeyMismatchException("peer did not confirm the key in session " + sessionId);
    }
    advance(SessionPhase.CONFIRMED);
    LOGGER.info(() -> partyId + " confirmed " + finalKey.length + " byte key for session " + sessionId);
  }

  private QkdMessage confirm() {
    advance(SessionPhase.CONFIRMED);
    LOGGER.info(() -> partyId + " confirmed " + finalKey.length + " byte key for session " + sessionId);
    return sign(new Payload.KeyConfirm(true, finalKey.length));
  }

  // ---------------------------------------------------------------- status and lifecycle

  public SessionStatus status() {
    final OptionalInt keyLength = phase == SessionPhase.CONFIRMED && finalKey != null
        ? OptionalInt.of(finalKey.length)
        : OptionalInt.empty();
    return new SessionStatus(phase, Optional.ofNullable(sessionId), keyLength);
  }

  public SessionPhase phase() {
    return phase;
  }

  public Optional<String> sessionId() {
    return Optional.ofNullable(sessionId);
  }

  public String partyId() {
    return partyId;
  }

  public Role role() {
    return role;
  }

  public Optional<String> peerPartyId() {
    return Optional.ofNullable(peerPartyId);
  }

  /// Copy of the agreed key, present only once the session is confirmed.
  public Optional<byte[]> sessionKey() {
    if (phase != SessionPhase.CONFIRMED || finalKey == null) {
      return Optional.empty();
    }
    return Optional.of(finalKey.clone());
  }

  /// Copy of the key material held in the current phase: the raw key until reconciliation, the reconciled key until
  /// amplification, then the final key. Lets one process drive both parties of a simulated exchange.
  public byte[] keyMaterial() {
    if (rawKey != null) {
      return rawKey.clone();
    }
    if (reconciledKey != null) {
      return reconciledKey.clone();
    }
    if (finalKey != null && phase != SessionPhase.ABORTED) {
      return finalKey.clone();
    }
    throw new IllegalStateException(partyId + " holds no key material in phase " + phase);
  }

  /// Move to [SessionPhase#ABORTED] and wipe all key material. Aborting an aborted session does nothing.
  public void abort(String reason) {
    if (phase == SessionPhase.ABORTED) {
      return;
    }
    final SessionPhase from = phase;
    phase = SessionPhase.ABORTED;
    wipe();
    LOGGER.warning(() -> partyId + " aborted session " + sessionId + " in " + from + ": " + reason);
  }

  /// Wipe key material. An unfinished session is aborted.
  @Override
  public void close() {
    if (!phase.isTerminal()) {
      abort("closed");
    } else {
      wipe();
    }
  }

  private void wipe() {
    BitVector.wipe(challenge);
    BitVector.wipe(rawKey);
    BitVector.wipe(reconciledKey);
    BitVector.wipe(finalKey);
    challenge = null;
    rawKey = null;
    reconciledKey = null;
    finalKey = null;
    sampledIndices = new int[0];
  }

  @TestOnly
  int[] sampledIndices() {
    return sampledIndices.clone();
  }

  // ---------------------------------------------------------------- helpers

  private String newSessionId() {
    return QkdCrypto.toHex(QkdCrypto.randomBytes(16));
  }

  private QkdMessage sign(Payload payload) {
    return signer.sign(QkdMessage.unsigned(sessionId, clock.instant().getEpochSecond(), payload));
  }

  private void require(SessionPhase expected) {
    if (phase != expected) {
      throw new IllegalStateException(partyId + " is in phase " + phase + " but the operation needs " + expected);
    }
  }

  private void requireRole(Role expected) {
    if (role != expected) {
      throw new IllegalStateException(partyId + " is the " + role + " but the operation belongs to the " + expected);
    }
  }

  private void advance(SessionPhase next) {
    if (!phase.precedes(next)) {
      throw new IllegalStateException("cannot move from " + phase + " to " + next);
    }
    final SessionPhase from = phase;
    phase = next;
    if (LOGGER.isLoggable(Level.FINEST)) {
      LOGGER.finest(partyId + " " + from + " -> " + next + " session " + sessionId);
    }
  }

  private static void requireKind(QkdMessage message, MessageKind kind) {
    if (message.kind() != kind) {
      throw new IllegalArgumentException("expected " + kind + " but received " + message.kind());
    }
  }

  /// Authentication messages are signed with the secret being proven, so a bad signature means the peer does not
  /// hold it.
  private void requireAuthenticSignature(QkdMessage message) {
    if (!signer.isValid(message) || !message.sessionId().equals(sessionId)) {
      abort("unauthenticated " + message.kind());
      throw new AuthenticationException("peer failed to authenticate " + message);
    }
  }

  private void verifySignature(QkdMessage message, MessageKind kind) {
    requireKind(message, kind);
    if (!signer.isValid(message)) {
      abort("bad signature on " + message.kind());
      throw new SignatureVerificationException("bad signature on " + message);
    }
  }

  /// Verify an inbound message before acting on it: kind, signature and session id.
  private void accept(QkdMessage message, MessageKind kind) {
    verifySignature(message, kind);
    if (!message.sessionId().equals(sessionId)) {
      abort("message for session " + message.sessionId());
      throw new SignatureVerificationException("message for session " + message.sessionId()
          + " delivered to session " + sessionId);
    }
  }
}
