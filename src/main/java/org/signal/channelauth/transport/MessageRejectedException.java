/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.transport;

/**
 * Indicates that a messaging provider permanently refused to deliver a message (for example, because the destination
 * is not a valid mobile number or has opted out of messages). Sending the same message again will not succeed.
 */
public class MessageRejectedException extends Exception {

  public MessageRejectedException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
