/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.code;

import io.micronaut.core.annotation.Nullable;

/**
 * The result of checking a candidate one-time code.
 *
 * @param valid whether the candidate matched a pending, unexpired code
 * @param reason the reason the candidate was rejected; {@code null} if the candidate was valid
 */
public record CodeVerificationResult(boolean valid, @Nullable Reason reason) {

  public enum Reason {
    /** No code was pending for the phone number. */
    NOT_FOUND,

    /** A code was pending but had expired; it has been cleared. */
    EXPIRED,

    /** A code was pending but the candidate did not match it; the pending code is unchanged. */
    MISMATCH
  }

  static final CodeVerificationResult VALID = new CodeVerificationResult(true, null);

  static CodeVerificationResult rejected(final Reason reason) {
    return new CodeVerificationResult(false, reason);
  }
}
