/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.channel;

/**
 * Indicates that an operation was refused because the session's channel was downgraded from a trusted to an untrusted
 * channel. Callers must start a new authentication cycle; the operation should not be retried as-is.
 */
public class ChannelDowngradedException extends Exception {

  public ChannelDowngradedException() {
    super(null, null, true, false);
  }
}
