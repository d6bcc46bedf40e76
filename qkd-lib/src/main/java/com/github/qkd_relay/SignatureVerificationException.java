// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.qkd_relay;

/// An inbound message failed its signature check or did not belong to the session. The message is discarded and the
/// session aborted.
public class SignatureVerificationException extends QkdException {
  public SignatureVerificationException(String message) {
    super(message, false);
  }
}
