/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.channel;

/**
 * The result of applying a {@link ChannelEvent} to a {@link ChannelTrustState}.
 *
 * @param state the state after the event
 * @param revokeAuthentication whether the session's authentication must be cleared in the same update that records
 *                             the new state
 */
public record ChannelTransition(ChannelTrustState state, boolean revokeAuthentication) {

  public boolean isDowngrade() {
    return revokeAuthentication;
  }
}
