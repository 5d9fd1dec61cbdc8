/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.ratelimit;

import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.time.Instant;
import org.signal.channelauth.session.ChannelSession;

/**
 * A rolling attempt window permits a fixed number of authentication attempts per session. The window is measured from
 * the most recent attempt rather than from a fixed clock boundary: if more than one window length has passed since the
 * last recorded attempt, the attempt counter starts over from zero before the new attempt is evaluated.
 * <p/>
 * A rolling attempt window is a pure policy; it computes the next version of a session and leaves storage to callers,
 * which must apply the result as part of a single atomic update.
 */
@Singleton
public class RollingAttemptWindow {

  private final int maxAttempts;
  private final Duration window;

  /**
   * The result of evaluating an attempt against a session.
   *
   * @param result the rate limit decision for the attempt
   * @param updatedSession the session with the attempt recorded, or {@code null} if the attempt was refused and the
   *                       session must not change
   */
  public record Evaluation(RateLimitResult result, @Nullable ChannelSession updatedSession) {
  }

  @Inject
  public RollingAttemptWindow(final AuthenticationRateLimitConfiguration configuration) {
    this(configuration.getMaxAttempts(), configuration.getWindow());
  }

  public RollingAttemptWindow(final int maxAttempts, final Duration window) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("Maximum attempts must be positive");
    }

    this.maxAttempts = maxAttempts;
    this.window = window;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public Evaluation evaluate(final ChannelSession session, final Instant now) {
    final int priorAttempts = getPriorAttemptsInWindow(session, now);

    if (priorAttempts >= maxAttempts) {
      return new Evaluation(RateLimitResult.refused(session.lastAttemptAt().plus(window)), null);
    }

    final int attempts = priorAttempts + 1;

    return new Evaluation(RateLimitResult.permitted(maxAttempts - attempts), session.toBuilder()
        .authAttempts(attempts)
        .lastAttemptAt(now)
        .updatedAt(now)
        .build());
  }

  /**
   * Returns the number of attempts that still count against the given session's budget at the given time.
   */
  int getPriorAttemptsInWindow(final ChannelSession session, final Instant now) {
    if (session.lastAttemptAt() == null || Duration.between(session.lastAttemptAt(), now).compareTo(window) > 0) {
      return 0;
    }

    return session.authAttempts();
  }
}
