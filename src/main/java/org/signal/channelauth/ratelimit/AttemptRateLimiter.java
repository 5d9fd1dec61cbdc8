/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.ratelimit;

import io.micrometer.core.instrument.Metrics;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import org.signal.channelauth.metrics.MetricsUtil;
import org.signal.channelauth.session.SessionRepository;
import org.signal.channelauth.session.SessionUpdate;

/**
 * Counts authentication attempts (for example, one-time code guesses) against a phone number's session. Each check is
 * a single atomic update of the session, so concurrent attempts for the same phone number can never both observe a
 * stale counter and both pass.
 */
@Singleton
public class AttemptRateLimiter {

  private final SessionRepository sessionRepository;
  private final RollingAttemptWindow attemptWindow;
  private final Clock clock;

  private static final String CHECK_COUNTER_NAME = MetricsUtil.name(AttemptRateLimiter.class, "check");
  private static final String LIMITED_TAG_NAME = "limited";

  public AttemptRateLimiter(final SessionRepository sessionRepository,
      final RollingAttemptWindow attemptWindow,
      final Clock clock) {

    this.sessionRepository = sessionRepository;
    this.attemptWindow = attemptWindow;
    this.clock = clock;
  }

  /**
   * Checks whether another authentication attempt is permitted for the given phone number and, if so, records it.
   * Phone numbers without a session are never limited, and nothing is recorded for them.
   *
   * @param phoneNumber the phone number making the attempt
   *
   * @return a future that yields the rate limit decision for the attempt
   */
  public CompletableFuture<RateLimitResult> checkAndRecordAttempt(final String phoneNumber) {
    final Instant now = clock.instant();

    return sessionRepository.updateSession(phoneNumber, maybeSession -> maybeSession
            .map(session -> {
              final RollingAttemptWindow.Evaluation evaluation = attemptWindow.evaluate(session, now);

              return evaluation.updatedSession() != null ?
                  SessionUpdate.store(evaluation.updatedSession(), evaluation.result()) :
                  SessionUpdate.none(evaluation.result());
            })
            .orElseGet(() -> SessionUpdate.none(RateLimitResult.permitted(attemptWindow.getMaxAttempts()))))
        .whenComplete((result, throwable) -> {
          if (result != null) {
            Metrics.counter(CHECK_COUNTER_NAME, LIMITED_TAG_NAME, String.valueOf(result.limited())).increment();
          }
        });
  }
}
