/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.channel;

/**
 * The transport channel most recently observed for a phone number session.
 */
public enum ChannelType {

  /**
   * No session-level channel observation has been made.
   */
  UNKNOWN,

  /**
   * A session exists, but no delivery report has yet identified the channel used to reach it.
   */
  PENDING,

  /**
   * The provider reported delivery over a rich, provider-verified channel.
   */
  TRUSTED,

  /**
   * The provider reported delivery over the plain, unverified fallback channel.
   */
  UNTRUSTED
}
