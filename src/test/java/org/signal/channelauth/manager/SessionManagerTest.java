/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.manager;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.micronaut.context.event.ApplicationEventPublisher;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.signal.channelauth.UpstreamUnavailableException;
import org.signal.channelauth.channel.ChannelDowngradedEvent;
import org.signal.channelauth.channel.ChannelDowngradedException;
import org.signal.channelauth.channel.ChannelPrefixClassifier;
import org.signal.channelauth.channel.ChannelTrustConfiguration;
import org.signal.channelauth.channel.ChannelTrustTracker;
import org.signal.channelauth.channel.ChannelType;
import org.signal.channelauth.code.CodeVerificationResult;
import org.signal.channelauth.code.OneTimeCodeConfiguration;
import org.signal.channelauth.code.OneTimeCodeGenerator;
import org.signal.channelauth.code.OneTimeCodeStore;
import org.signal.channelauth.identity.IdentityProvider;
import org.signal.channelauth.identity.InvalidCredentialException;
import org.signal.channelauth.identity.TokenClaims;
import org.signal.channelauth.ratelimit.AttemptRateLimiter;
import org.signal.channelauth.ratelimit.RateLimitExceededException;
import org.signal.channelauth.ratelimit.RollingAttemptWindow;
import org.signal.channelauth.session.AuthMethod;
import org.signal.channelauth.session.ChannelSession;
import org.signal.channelauth.session.MemorySessionRepository;
import org.signal.channelauth.session.SessionRetentionConfiguration;
import org.signal.channelauth.session.SessionRetentionPolicy;

class SessionManagerTest {

  private Clock clock;
  private MemorySessionRepository sessionRepository;
  private IdentityProvider identityProvider;
  private SessionManager sessionManager;

  private static final String PHONE_NUMBER = "+12025550123";
  private static final String EMAIL = "user@example.com";
  private static final String USER_ID = "user-id";
  private static final String TOKEN = "token";
  private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

  @BeforeEach
  void setUp() {
    clock = mock(Clock.class);
    when(clock.instant()).thenReturn(START);

    sessionRepository =
        new MemorySessionRepository(new SessionRetentionPolicy(new SessionRetentionConfiguration()),
            mock(ApplicationEventPublisher.class), clock);

    identityProvider = mock(IdentityProvider.class);

    final RollingAttemptWindow attemptWindow = new RollingAttemptWindow(3, Duration.ofHours(1));

    //noinspection unchecked
    final ApplicationEventPublisher<ChannelDowngradedEvent> eventPublisher = mock(ApplicationEventPublisher.class);

    sessionManager = new SessionManager(sessionRepository,
        new CaffeineSessionCache(new SessionCacheConfiguration()),
        new AttemptRateLimiter(sessionRepository, attemptWindow, clock),
        attemptWindow,
        new OneTimeCodeStore(sessionRepository, clock),
        new OneTimeCodeGenerator(),
        new OneTimeCodeConfiguration(),
        new ChannelTrustTracker(sessionRepository,
            new ChannelPrefixClassifier(new ChannelTrustConfiguration()), eventPublisher, clock),
        identityProvider,
        new SessionConfiguration(),
        clock);
  }

  @Test
  void createSession() {
    final ChannelSession session =
        sessionManager.createSession(PHONE_NUMBER, EMAIL, USER_ID, TOKEN, AuthMethod.MAGIC_LINK).join();

    assertTrue(session.isAuthenticated(START));
    assertEquals(START.plus(Duration.ofDays(7)), session.expiresAt());
    assertEquals(0, session.authAttempts());
    assertTrue(session.trustRequired());
    assertEquals(session, sessionManager.getSession(PHONE_NUMBER).join());
  }

  @Test
  void createSessionUsesSessionDuration() {
    sessionManager.upsertPendingSession(PHONE_NUMBER, EMAIL, AuthMethod.MAGIC_LINK, true, 14).join();

    final ChannelSession session =
        sessionManager.createSession(PHONE_NUMBER, EMAIL, USER_ID, TOKEN, AuthMethod.MAGIC_LINK).join();

    assertEquals(START.plus(Duration.ofDays(14)), session.expiresAt());
  }

  @Test
  void getSessionMissing() {
    assertNull(sessionManager.getSession(PHONE_NUMBER).join());
  }

  @Test
  void getSessionPending() {
    sessionManager.upsertPendingSession(PHONE_NUMBER, EMAIL, AuthMethod.ONE_TIME_CODE, true, 7).join();

    final ChannelSession session = sessionManager.getSession(PHONE_NUMBER).join();

    assertNotNull(session);
    assertFalse(session.isAuthenticated(START));
    assertEquals(ChannelType.PENDING, session.channelType());
    assertEquals(AuthMethod.ONE_TIME_CODE, session.authMethod());
  }

  @Test
  void getSessionExpired() {
    sessionManager.createSession(PHONE_NUMBER, EMAIL, USER_ID, TOKEN, AuthMethod.MAGIC_LINK).join();

    // Populate the cache before the session expires
    assertNotNull(sessionManager.getSession(PHONE_NUMBER).join());

    when(clock.instant()).thenReturn(START.plus(Duration.ofDays(7)));

    assertNull(sessionManager.getSession(PHONE_NUMBER).join());

    final ChannelSession stored = sessionRepository.getSession(PHONE_NUMBER).join();
    assertNull(stored.sessionToken(), "Expired authentication should be cleared when observed");
    assertEquals(EMAIL, stored.email());
  }

  @Test
  void upsertPendingSession() {
    final ChannelSession created =
        sessionManager.upsertPendingSession(PHONE_NUMBER, EMAIL, AuthMethod.MAGIC_LINK, true, 7).join();

    assertEquals(ChannelType.PENDING, created.channelType());
    assertEquals(0, created.authAttempts());
    assertEquals(START, created.createdAt());

    when(clock.instant()).thenReturn(START.plusSeconds(10));

    final ChannelSession updated =
        sessionManager.upsertPendingSession(PHONE_NUMBER, EMAIL, AuthMethod.MAGIC_LINK, true, 7).join();

    assertEquals(created.toBuilder()
        .authAttempts(1)
        .lastAttemptAt(START.plusSeconds(10))
        .updatedAt(START.plusSeconds(10))
        .build(), updated, "Repeated upserts should differ only in their attempt bookkeeping");
  }

  @Test
  void upsertPendingSessionRateLimited() {
    sessionManager.upsertPendingSession(PHONE_NUMBER, EMAIL, AuthMethod.MAGIC_LINK, true, 7).join();

    for (int i = 0; i < 3; i++) {
      sessionManager.upsertPendingSession(PHONE_NUMBER, EMAIL, AuthMethod.MAGIC_LINK, true, 7).join();
    }

    when(clock.instant()).thenReturn(START.plus(Duration.ofMinutes(15)));

    final CompletionException completionException = assertThrows(CompletionException.class,
        () -> sessionManager.upsertPendingSession(PHONE_NUMBER, EMAIL, AuthMethod.MAGIC_LINK, true, 7).join());

    final RateLimitExceededException rateLimitExceededException =
        assertInstanceOf(RateLimitExceededException.class, completionException.getCause());

    assertEquals(Duration.ofMinutes(45), rateLimitExceededException.getRetryAfterDuration());
    assertEquals(START.plus(Duration.ofHours(1)), rateLimitExceededException.getResetAt());
  }

  @Test
  void downgradeRevokesAndBlocksUntilNewCycle() {
    sessionManager.upsertPendingSession(PHONE_NUMBER, EMAIL, AuthMethod.MAGIC_LINK, true, 7).join();
    sessionManager.createSession(PHONE_NUMBER, EMAIL, USER_ID, TOKEN, AuthMethod.MAGIC_LINK).join();
    sessionManager.recordOutboundMessage(PHONE_NUMBER, "message-1").join();

    assertTrue(sessionManager.applyDeliveryStatus("message-1", "RCS").join().isPresent());
    assertEquals(ChannelType.TRUSTED, sessionManager.getSession(PHONE_NUMBER).join().channelType());

    assertTrue(sessionManager.checkInboundChannel(PHONE_NUMBER, "SM").join());

    final ChannelSession revoked = sessionManager.getSession(PHONE_NUMBER).join();
    assertTrue(revoked.channelDowngradeDetected());
    assertFalse(revoked.isAuthenticated(START));

    final CompletionException completionException = assertThrows(CompletionException.class,
        () -> sessionManager.createSession(PHONE_NUMBER, EMAIL, USER_ID, TOKEN, AuthMethod.MAGIC_LINK).join());

    assertInstanceOf(ChannelDowngradedException.class, completionException.getCause());

    final ChannelSession restarted =
        sessionManager.upsertPendingSession(PHONE_NUMBER, EMAIL, AuthMethod.MAGIC_LINK, true, 7).join();

    assertFalse(restarted.channelDowngradeDetected());
    assertEquals(ChannelType.PENDING, restarted.channelType());
    assertTrue(sessionManager.createSession(PHONE_NUMBER, EMAIL, USER_ID, TOKEN, AuthMethod.MAGIC_LINK).join()
        .isAuthenticated(START));
  }

  @Test
  void deliveryReportInvalidatesCachedSession() {
    sessionManager.createSession(PHONE_NUMBER, EMAIL, USER_ID, TOKEN, AuthMethod.MAGIC_LINK).join();
    sessionManager.recordOutboundMessage(PHONE_NUMBER, "message-1").join();
    sessionManager.applyDeliveryStatus("message-1", "RCS").join();

    // Cache the trusted session, then downgrade it via a delivery report
    assertEquals(ChannelType.TRUSTED, sessionManager.getSession(PHONE_NUMBER).join().channelType());
    sessionManager.applyDeliveryStatus("message-1", "SM").join();

    assertFalse(sessionManager.getSession(PHONE_NUMBER).join().isAuthenticated(START));
  }

  @Test
  void invalidateSession() {
    sessionManager.createSession(PHONE_NUMBER, EMAIL, USER_ID, TOKEN, AuthMethod.MAGIC_LINK).join();
    sessionManager.invalidateSession(PHONE_NUMBER).join();

    final ChannelSession session = sessionManager.getSession(PHONE_NUMBER).join();
    assertFalse(session.isAuthenticated(START));
    assertEquals(EMAIL, session.email());

    // Invalidating a missing session does nothing
    sessionManager.invalidateSession("+12025550199").join();
    assertNull(sessionManager.getSession("+12025550199").join());
  }

  @Test
  void refreshSession() {
    sessionManager.createSession(PHONE_NUMBER, EMAIL, USER_ID, TOKEN, AuthMethod.MAGIC_LINK).join();

    when(clock.instant()).thenReturn(START.plus(Duration.ofDays(3)));

    final ChannelSession refreshed = sessionManager.refreshSession(PHONE_NUMBER).join();
    assertEquals(START.plus(Duration.ofDays(10)), refreshed.expiresAt());

    sessionManager.invalidateSession(PHONE_NUMBER).join();
    assertNull(sessionManager.refreshSession(PHONE_NUMBER).join());
  }

  @Test
  void getUserContext() {
    when(identityProvider.validateToken(TOKEN))
        .thenReturn(CompletableFuture.completedFuture(new TokenClaims(USER_ID, EMAIL, "org-id", "admin")));

    assertNull(sessionManager.getUserContext(PHONE_NUMBER).join());

    sessionManager.createSession(PHONE_NUMBER, EMAIL, USER_ID, TOKEN, AuthMethod.MAGIC_LINK).join();

    final UserContext userContext = sessionManager.getUserContext(PHONE_NUMBER).join();

    assertEquals(USER_ID, userContext.userId());
    assertEquals(EMAIL, userContext.email());
    assertEquals(PHONE_NUMBER, userContext.phoneNumber());
    assertEquals("org-id", userContext.organizationId());
    assertEquals("admin", userContext.role());
    assertEquals(START.plus(Duration.ofDays(7)), userContext.sessionExpiresAt());
  }

  @Test
  void getUserContextTokenRejected() {
    when(identityProvider.validateToken(TOKEN))
        .thenReturn(CompletableFuture.failedFuture(new InvalidCredentialException("expired")));

    sessionManager.createSession(PHONE_NUMBER, EMAIL, USER_ID, TOKEN, AuthMethod.MAGIC_LINK).join();

    assertNull(sessionManager.getUserContext(PHONE_NUMBER).join());
    assertFalse(sessionRepository.getSession(PHONE_NUMBER).join().isAuthenticated(START));
  }

  @Test
  void getUserContextProviderUnavailable() {
    when(identityProvider.validateToken(TOKEN))
        .thenReturn(CompletableFuture.failedFuture(new UpstreamUnavailableException("unavailable")));

    sessionManager.createSession(PHONE_NUMBER, EMAIL, USER_ID, TOKEN, AuthMethod.MAGIC_LINK).join();

    assertNull(sessionManager.getUserContext(PHONE_NUMBER).join());
    assertTrue(sessionRepository.getSession(PHONE_NUMBER).join().isAuthenticated(START),
        "Provider outages should not clear authentication");
  }

  @Test
  void issueAndVerifyCode() {
    sessionManager.upsertPendingSession(PHONE_NUMBER, EMAIL, AuthMethod.ONE_TIME_CODE, true, 7).join();

    final String code = sessionManager.issueCode(PHONE_NUMBER).join();

    assertEquals(CodeVerificationResult.Reason.MISMATCH,
        sessionManager.verifyCode(PHONE_NUMBER, code.equals("000000") ? "111111" : "000000").join().reason());

    assertTrue(sessionManager.verifyCode(PHONE_NUMBER, code).join().valid());
    assertEquals(CodeVerificationResult.Reason.NOT_FOUND,
        sessionManager.verifyCode(PHONE_NUMBER, code).join().reason());
  }

  @Test
  void checkAndRecordAttempt() {
    sessionManager.upsertPendingSession(PHONE_NUMBER, EMAIL, AuthMethod.ONE_TIME_CODE, true, 7).join();

    assertEquals(2, sessionManager.checkAndRecordAttempt(PHONE_NUMBER).join().remainingAttempts());
    assertEquals(1, sessionManager.checkAndRecordAttempt(PHONE_NUMBER).join().remainingAttempts());
    assertEquals(0, sessionManager.checkAndRecordAttempt(PHONE_NUMBER).join().remainingAttempts());
    assertTrue(sessionManager.checkAndRecordAttempt(PHONE_NUMBER).join().limited());
  }

  @Test
  void downgradedSessionsNeverAuthenticated() {
    when(identityProvider.validateToken(any()))
        .thenReturn(CompletableFuture.completedFuture(new TokenClaims(USER_ID, EMAIL, null, null)));

    final Random random = new Random(17);
    final String[] prefixes = {"RCS", "SM", "MM", null};

    for (int step = 0; step < 500; step++) {
      final Instant now = START.plus(Duration.ofMinutes(step * 7L));
      when(clock.instant()).thenReturn(now);

      final String prefix = prefixes[random.nextInt(prefixes.length)];
      final String messageId = "message-" + step;

      final CompletableFuture<?> future = switch (random.nextInt(7)) {
        case 0 -> sessionManager.upsertPendingSession(PHONE_NUMBER, EMAIL, AuthMethod.MAGIC_LINK, true, 7);
        case 1 -> sessionManager.createSession(PHONE_NUMBER, EMAIL, USER_ID, TOKEN, AuthMethod.MAGIC_LINK);
        case 2 -> sessionManager.recordOutboundMessage(PHONE_NUMBER, messageId)
            .thenCompose(ignored -> sessionManager.applyDeliveryStatus(messageId, prefix));
        case 3 -> sessionManager.checkInboundChannel(PHONE_NUMBER, prefix);
        case 4 -> sessionManager.invalidateSession(PHONE_NUMBER);
        case 5 -> sessionManager.refreshSession(PHONE_NUMBER);
        default -> sessionManager.getUserContext(PHONE_NUMBER);
      };

      // Rate limits and downgrade refusals are expected outcomes here
      future.handle((ignored, throwable) -> null).join();

      final ChannelSession session = sessionManager.getSession(PHONE_NUMBER).join();

      if (session != null && session.channelDowngradeDetected()) {
        assertFalse(session.isAuthenticated(now));
        assertNull(sessionManager.getUserContext(PHONE_NUMBER).join());
      }
    }
  }

  @Test
  void summarize() {
    final Instant now = START.plus(Duration.ofDays(2));

    final ChannelSession magicLink = authenticated("+12025550001", AuthMethod.MAGIC_LINK, START);
    final ChannelSession oneTimeCode =
        authenticated("+12025550002", AuthMethod.ONE_TIME_CODE, START.plus(Duration.ofDays(1)));
    final ChannelSession expired =
        authenticated("+12025550003", AuthMethod.MAGIC_LINK, START.minus(Duration.ofDays(30)));
    final ChannelSession pending = ChannelSession.newBuilder("+12025550004").build();

    final SessionStatistics statistics =
        SessionManager.summarize(List.of(magicLink, oneTimeCode, expired, pending), now);

    assertEquals(2, statistics.activeSessions());
    assertEquals(Map.of(AuthMethod.MAGIC_LINK, 1L, AuthMethod.ONE_TIME_CODE, 1L),
        statistics.sessionsByAuthMethod());
    assertEquals(Duration.ofDays(1).plusHours(12), statistics.averageSessionAge());

    assertEquals(0, SessionManager.summarize(List.of(), now).activeSessions());
    assertEquals(Duration.ZERO, SessionManager.summarize(List.of(), now).averageSessionAge());
  }

  @Test
  void getSessionStatistics() {
    sessionManager.createSession(PHONE_NUMBER, EMAIL, USER_ID, TOKEN, AuthMethod.ONE_TIME_CODE).join();

    final SessionStatistics statistics = sessionManager.getSessionStatistics().join();

    assertEquals(1, statistics.activeSessions());
    assertEquals(1L, statistics.sessionsByAuthMethod().get(AuthMethod.ONE_TIME_CODE));
    assertEquals(0L, statistics.sessionsByAuthMethod().get(AuthMethod.MAGIC_LINK));
  }

  private static ChannelSession authenticated(final String phoneNumber,
      final AuthMethod authMethod,
      final Instant authenticatedAt) {

    return ChannelSession.newBuilder(phoneNumber)
        .userId(USER_ID)
        .sessionToken(TOKEN)
        .authMethod(authMethod)
        .authenticatedAt(authenticatedAt)
        .expiresAt(authenticatedAt.plus(Duration.ofDays(7)))
        .build();
  }
}
