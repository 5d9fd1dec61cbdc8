/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.dispatch;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * An email directory resolves the email address of the account to which a phone number belongs. The dispatcher
 * consults the directory when a phone number without a session asks to sign in.
 */
public interface EmailDirectory {

  /**
   * Finds the email address registered for the given phone number.
   *
   * @param phoneNumber an E.164-formatted phone number
   *
   * @return a future that yields the registered email address, or empty if the phone number is not registered
   */
  CompletableFuture<Optional<String>> findEmail(String phoneNumber);
}
