// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay.msg;

import com.github.qkd_relay.Pickler;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/// Wire format of [QkdMessage]:
///
/// ```
/// kind id (1) | session id (2 byte length + UTF-8) | timestamp (8) | payload | signature (4 byte length + bytes)
/// ```
///
/// Payload fields are written in record component order. Byte arrays carry a 4 byte length, strings a 2 byte length,
/// booleans one byte. Everything before the signature is the signed content.
public final class MessagePickler implements Pickler<QkdMessage> {

  public static final MessagePickler INSTANCE = new MessagePickler();

  private MessagePickler() {
  }

  @Override
  public void serialize(QkdMessage message, ByteBuffer buffer) {
    writeContent(message, buffer);
    writeBytes(buffer, message.signature());
  }

  @Override
  public QkdMessage deserialize(ByteBuffer buffer) {
    final MessageKind kind = MessageKind.fromId(buffer.get());
    final String sessionId = readString(buffer);
    final long timestamp = buffer.getLong();
    final Payload payload = readPayload(kind, buffer);
    final byte[] signature = readBytes(buffer);
    return new QkdMessage(kind, sessionId, timestamp, payload, signature);
  }

  @Override
  public int sizeOf(QkdMessage message) {
    return contentSize(message) + 4 + message.signature().length;
  }

  /// The bytes covered by the signature: kind, session id, timestamp and payload.
  public byte[] signedContent(QkdMessage message) {
    final ByteBuffer buffer = ByteBuffer.allocate(contentSize(message));
    writeContent(message, buffer);
    return buffer.array();
  }

  private static void writeContent(QkdMessage message, ByteBuffer buffer) {
    buffer.put(message.kind().id());
    writeString(buffer, message.sessionId());
    buffer.putLong(message.timestamp());
    writePayload(message.payload(), buffer);
  }

  private static int contentSize(QkdMessage message) {
    return 1 + stringSize(message.sessionId()) + 8 + payloadSize(message.payload());
  }

  private static void writePayload(Payload payload, ByteBuffer buffer) {
    switch (payload.kind()) {
      case INIT_REQUEST -> {
        final var p = (Payload.InitRequest) payload;
        writeString(buffer, p.partyId());
        writeString(buffer, p.engine());
      }
      case INIT_RESPONSE -> {
        final var p = (Payload.InitResponse) payload;
        writeString(buffer, p.partyId());
        writeBoolean(buffer, p.accepted());
      }
      case AUTH_CHALLENGE -> writeBytes(buffer, ((Payload.AuthChallenge) payload).challenge());
      case AUTH_RESPONSE -> writeBytes(buffer, ((Payload.AuthResponse) payload).response());
      case KEY_GEN_REQUEST -> {
        final var p = (Payload.KeyGenRequest) payload;
        buffer.putInt(p.shotCount());
        writeBoolean(buffer, p.useHardware());
      }
      case KEY_GEN_RESPONSE -> {
        final var p = (Payload.KeyGenResponse) payload;
        writeString(buffer, p.sourceId());
        buffer.putDouble(p.fidelity());
        writeBytes(buffer, p.keyDigest());
        buffer.putInt(p.keyLength());
      }
      case ERROR_DETECT -> {
        final var p = (Payload.ErrorDetect) payload;
        buffer.putInt(p.sampledIndices().length);
        for (int index : p.sampledIndices()) {
          buffer.putInt(index);
        }
        buffer.putInt(p.errorCount());
        buffer.putDouble(p.errorRate());
      }
      case ERROR_CORRECT -> {
        final var p = (Payload.ErrorCorrect) payload;
        writeString(buffer, p.engine());
        buffer.putInt(p.errorsCorrected());
        buffer.putInt(p.remainingErrors());
        buffer.putInt(p.leakedBits());
        writeBoolean(buffer, p.converged());
      }
      case PRIVACY_AMP -> {
        final var p = (Payload.PrivacyAmp) payload;
        writeBytes(buffer, p.seed());
        buffer.putInt(p.outputLength());
      }
      case KEY_VERIFY -> writeBytes(buffer, ((Payload.KeyVerify) payload).keyDigest());
      case KEY_CONFIRM -> {
        final var p = (Payload.KeyConfirm) payload;
        writeBoolean(buffer, p.confirmed());
        buffer.putInt(p.keyLength());
      }
    }
  }

  private static Payload readPayload(MessageKind kind, ByteBuffer buffer) {
    return switch (kind) {
      case INIT_REQUEST -> new Payload.InitRequest(readString(buffer), readString(buffer));
      case INIT_RESPONSE -> new Payload.InitResponse(readString(buffer), readBoolean(buffer));
      case AUTH_CHALLENGE -> new Payload.AuthChallenge(readBytes(buffer));
      case AUTH_RESPONSE -> new Payload.AuthResponse(readBytes(buffer));
      case KEY_GEN_REQUEST -> new Payload.KeyGenRequest(buffer.getInt(), readBoolean(buffer));
      case KEY_GEN_RESPONSE -> new Payload.KeyGenResponse(readString(buffer), buffer.getDouble(), readBytes(buffer),
          buffer.getInt());
      case ERROR_DETECT -> {
        final int count = buffer.getInt();
        if (count < 0 || count > buffer.remaining() / Integer.BYTES) {
          throw new IllegalArgumentException("Invalid sample count: " + count);
        }
        final int[] indices = new int[count];
        for (int i = 0; i < count; i++) {
          indices[i] = buffer.getInt();
        }
        yield new Payload.ErrorDetect(indices, buffer.getInt(), buffer.getDouble());
      }
      case ERROR_CORRECT -> new Payload.ErrorCorrect(readString(buffer), buffer.getInt(), buffer.getInt(),
          buffer.getInt(), readBoolean(buffer));
      case PRIVACY_AMP -> new Payload.PrivacyAmp(readBytes(buffer), buffer.getInt());
      case KEY_VERIFY -> new Payload.KeyVerify(readBytes(buffer));
      case KEY_CONFIRM -> new Payload.KeyConfirm(readBoolean(buffer), buffer.getInt());
    };
  }

  private static int payloadSize(Payload payload) {
    return switch (payload.kind()) {
      case INIT_REQUEST -> {
        final var p = (Payload.InitRequest) payload;
        yield stringSize(p.partyId()) + stringSize(p.engine());
      }
      case INIT_RESPONSE -> stringSize(((Payload.InitResponse) payload).partyId()) + 1;
      case AUTH_CHALLENGE -> 4 + ((Payload.AuthChallenge) payload).challenge().length;
      case AUTH_RESPONSE -> 4 + ((Payload.AuthResponse) payload).response().length;
      case KEY_GEN_REQUEST -> 4 + 1;
      case KEY_GEN_RESPONSE -> {
        final var p = (Payload.KeyGenResponse) payload;
        yield stringSize(p.sourceId()) + 8 + 4 + p.keyDigest().length + 4;
      }
      case ERROR_DETECT -> 4 + 4 * ((Payload.ErrorDetect) payload).sampledIndices().length + 4 + 8;
      case ERROR_CORRECT -> stringSize(((Payload.ErrorCorrect) payload).engine()) + 4 + 4 + 4 + 1;
      case PRIVACY_AMP -> 4 + ((Payload.PrivacyAmp) payload).seed().length + 4;
      case KEY_VERIFY -> 4 + ((Payload.KeyVerify) payload).keyDigest().length;
      case KEY_CONFIRM -> 1 + 4;
    };
  }

  private static void writeString(ByteBuffer buffer, String value) {
    final byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length > Short.MAX_VALUE) {
      throw new IllegalArgumentException("string too long to encode: " + bytes.length + " bytes");
    }
    buffer.putShort((short) bytes.length);
    buffer.put(bytes);
  }

  private static String readString(ByteBuffer buffer) {
    final int length = buffer.getShort();
    if (length < 0 || length > buffer.remaining()) {
      throw new IllegalArgumentException("Invalid string length: " + length);
    }
    final byte[] bytes = new byte[length];
    buffer.get(bytes);
    return new String(bytes, StandardCharsets.UTF_8);
  }

  private static int stringSize(String value) {
    return 2 + value.getBytes(StandardCharsets.UTF_8).length;
  }

  private static void writeBytes(ByteBuffer buffer, byte[] bytes) {
    buffer.putInt(bytes.length);
    buffer.put(bytes);
  }

  private static byte[] readBytes(ByteBuffer buffer) {
    final int length = buffer.getInt();
    if (length < 0 || length > buffer.remaining()) {
      throw new IllegalArgumentException("Invalid byte array length: " + length);
    }
    final byte[] bytes = new byte[length];
    buffer.get(bytes);
    return bytes;
  }

  private static void writeBoolean(ByteBuffer buffer, boolean value) {
    buffer.put((byte) (value ? 1 : 0));
  }

  private static boolean readBoolean(ByteBuffer buffer) {
    return buffer.get() != 0;
  }
}
