/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.identity;

/**
 * Indicates that an identity provider rejected a credential or token.
 */
public class InvalidCredentialException extends Exception {

  public InvalidCredentialException(final String message) {
    super(message, null, true, false);
  }
}
