/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.code;

import io.micrometer.core.instrument.Metrics;
import jakarta.inject.Singleton;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.signal.channelauth.metrics.MetricsUtil;
import org.signal.channelauth.session.ChannelSession;
import org.signal.channelauth.session.SessionNotFoundException;
import org.signal.channelauth.session.SessionRepository;
import org.signal.channelauth.session.SessionUpdate;
import org.signal.channelauth.util.Durations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds at most one pending one-time code per phone number. Codes live on the phone number's session and are consumed
 * by the same atomic update that compares them, so a code can be redeemed at most once even if several verification
 * attempts race one another.
 */
@Singleton
public class OneTimeCodeStore {

  private final SessionRepository sessionRepository;
  private final Clock clock;

  private static final String VERIFY_COUNTER_NAME = MetricsUtil.name(OneTimeCodeStore.class, "verify");

  private static final Logger logger = LoggerFactory.getLogger(OneTimeCodeStore.class);

  public OneTimeCodeStore(final SessionRepository sessionRepository, final Clock clock) {
    this.sessionRepository = sessionRepository;
    this.clock = clock;
  }

  /**
   * Stores a code for the given phone number, replacing any code that was already pending.
   *
   * @param phoneNumber the phone number for which to store a code
   * @param code the code to store
   * @param ttl the time after which the code may no longer be redeemed
   *
   * @return a future that completes when the code has been stored or fails with a {@link SessionNotFoundException} if
   * the phone number has no session
   */
  public CompletableFuture<Void> issue(final String phoneNumber, final String code, final Duration ttl) {
    if (!Durations.isPositive(ttl)) {
      throw new IllegalArgumentException("Code lifetime must be positive");
    }

    final Instant now = clock.instant();

    return sessionRepository.<Void>updateSession(phoneNumber, maybeSession -> {
      final ChannelSession session =
          maybeSession.orElseThrow(() -> new CompletionException(new SessionNotFoundException()));

      return SessionUpdate.store(session.toBuilder()
          .pendingCode(code)
          .codeExpiresAt(now.plus(ttl))
          .updatedAt(now)
          .build(), null);
    }).whenComplete((ignored, throwable) -> {
      if (throwable == null) {
        logger.debug("Issued one-time code valid for {}", ttl);
      }
    });
  }

  /**
   * Checks a candidate code for the given phone number. A matching code is cleared as part of the check. An expired
   * code is cleared regardless of the candidate. A mismatched candidate leaves the pending code in place.
   *
   * @param phoneNumber the phone number for which to check a code
   * @param candidate the code presented by the caller
   *
   * @return a future that yields the result of the check
   */
  public CompletableFuture<CodeVerificationResult> verify(final String phoneNumber, final String candidate) {
    final Instant now = clock.instant();

    return sessionRepository.updateSession(phoneNumber, maybeSession -> {
      if (maybeSession.isEmpty() || maybeSession.get().pendingCode() == null) {
        return SessionUpdate.none(CodeVerificationResult.rejected(CodeVerificationResult.Reason.NOT_FOUND));
      }

      final ChannelSession session = maybeSession.get();
      final ChannelSession withoutCode = session.withoutPendingCode().toBuilder().updatedAt(now).build();

      if (now.isAfter(session.codeExpiresAt())) {
        return SessionUpdate.store(withoutCode, CodeVerificationResult.rejected(CodeVerificationResult.Reason.EXPIRED));
      }

      return codesMatch(session.pendingCode(), candidate) ?
          SessionUpdate.store(withoutCode, CodeVerificationResult.VALID) :
          SessionUpdate.none(CodeVerificationResult.rejected(CodeVerificationResult.Reason.MISMATCH));
    }).whenComplete((result, throwable) -> {
      if (result != null) {
        Metrics.counter(VERIFY_COUNTER_NAME, MetricsUtil.OUTCOME_TAG_NAME,
            result.valid() ? "valid" : result.reason().name().toLowerCase()).increment();
      }
    });
  }

  private static boolean codesMatch(final String expected, final String candidate) {
    return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), candidate.getBytes(StandardCharsets.UTF_8));
  }
}
