/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.session;

import jakarta.inject.Singleton;
import java.time.Instant;
import java.util.Optional;

/**
 * A session retention policy decides which stored sessions a maintenance sweep should remove or trim:
 *
 * <ul>
 *   <li>sessions whose authentication expired more than {@code expiredGrace} ago are deleted;</li>
 *   <li>sessions flagged for a channel downgrade and not updated for more than {@code downgradedGrace} are
 *   deleted;</li>
 *   <li>one-time-code material past its own expiration is cleared.</li>
 * </ul>
 */
@Singleton
public class SessionRetentionPolicy {

  private final SessionRetentionConfiguration configuration;

  public enum Outcome {
    RETAINED,
    CODE_CLEARED,
    DELETED
  }

  public SessionRetentionPolicy(final SessionRetentionConfiguration configuration) {
    this.configuration = configuration;
  }

  public SessionUpdate<Outcome> sweep(final Optional<ChannelSession> maybeSession, final Instant now) {
    if (maybeSession.isEmpty()) {
      return SessionUpdate.none(Outcome.RETAINED);
    }

    final ChannelSession session = maybeSession.get();

    if (session.expiresAt() != null && session.expiresAt().isBefore(now.minus(configuration.getExpiredGrace()))) {
      return SessionUpdate.delete(Outcome.DELETED);
    }

    if (session.channelDowngradeDetected()
        && session.updatedAt() != null
        && session.updatedAt().isBefore(now.minus(configuration.getDowngradedGrace()))) {

      return SessionUpdate.delete(Outcome.DELETED);
    }

    if (session.codeExpiresAt() != null && session.codeExpiresAt().isBefore(now)) {
      return SessionUpdate.store(session.withoutPendingCode().toBuilder().updatedAt(now).build(), Outcome.CODE_CLEARED);
    }

    return SessionUpdate.none(Outcome.RETAINED);
  }
}
