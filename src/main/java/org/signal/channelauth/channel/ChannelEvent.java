/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.channel;

/**
 * An observation that may change the channel trust state of a session.
 */
public enum ChannelEvent {

  /**
   * A new authentication cycle started for the session.
   */
  AUTHENTICATION_STARTED,

  /**
   * The provider reported (or an inbound message showed) that the session was reached over a trusted channel.
   */
  TRUSTED_CHANNEL_OBSERVED,

  /**
   * The provider reported (or an inbound message showed) that the session was reached over an untrusted channel.
   */
  UNTRUSTED_CHANNEL_OBSERVED
}
