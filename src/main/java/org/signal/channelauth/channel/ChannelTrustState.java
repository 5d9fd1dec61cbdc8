/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.channel;

import java.util.Objects;
import org.signal.channelauth.session.ChannelSession;

/**
 * The channel trust state of a session: the channel most recently observed for it and whether a downgrade from a
 * trusted to an untrusted channel has been detected since the session's last authentication cycle began.
 * <p/>
 * All changes to channel trust go through {@link #apply(ChannelEvent, boolean)}:
 * <ul>
 *   <li>Starting an authentication cycle moves any state to {@link ChannelType#PENDING} and clears the downgrade
 *   flag.</li>
 *   <li>Observing a trusted channel moves any state to {@link ChannelType#TRUSTED}.</li>
 *   <li>Observing an untrusted channel moves any state to {@link ChannelType#UNTRUSTED}. If the prior channel was
 *   trusted and the session requires a trusted channel, the transition is a downgrade: the downgrade flag is set and
 *   the session's authentication is revoked.</li>
 * </ul>
 * Once set, the downgrade flag survives every event other than the start of a new authentication cycle.
 *
 * @param channelType the channel most recently observed
 * @param downgraded whether a downgrade has been detected
 */
public record ChannelTrustState(ChannelType channelType, boolean downgraded) {

  public ChannelTrustState {
    Objects.requireNonNull(channelType);
  }

  public static ChannelTrustState of(final ChannelSession session) {
    return new ChannelTrustState(session.channelType(), session.channelDowngradeDetected());
  }

  public ChannelTransition apply(final ChannelEvent event, final boolean trustRequired) {
    return switch (event) {
      case AUTHENTICATION_STARTED -> new ChannelTransition(new ChannelTrustState(ChannelType.PENDING, false), false);
      case TRUSTED_CHANNEL_OBSERVED ->
          new ChannelTransition(new ChannelTrustState(ChannelType.TRUSTED, downgraded), false);
      case UNTRUSTED_CHANNEL_OBSERVED -> {
        final boolean downgrade = trustRequired && channelType == ChannelType.TRUSTED;

        yield new ChannelTransition(new ChannelTrustState(ChannelType.UNTRUSTED, downgraded || downgrade), downgrade);
      }
    };
  }

  /**
   * Applies this state to the given session, clearing its authentication if the state is downgraded.
   *
   * @param session the session to which to apply this state
   *
   * @return a copy of the given session in this state
   */
  public ChannelSession applyTo(final ChannelSession session) {
    final ChannelSession withAuthentication = downgraded ? session.withoutAuthentication() : session;

    return withAuthentication.toBuilder()
        .channelType(channelType)
        .channelDowngradeDetected(downgraded)
        .build();
  }
}
