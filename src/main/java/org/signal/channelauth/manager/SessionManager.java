/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.manager;

import com.google.common.annotations.VisibleForTesting;
import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.signal.channelauth.channel.ChannelDowngradedException;
import org.signal.channelauth.channel.ChannelEvent;
import org.signal.channelauth.channel.ChannelTrustState;
import org.signal.channelauth.channel.ChannelTrustTracker;
import org.signal.channelauth.code.CodeVerificationResult;
import org.signal.channelauth.code.OneTimeCodeConfiguration;
import org.signal.channelauth.code.OneTimeCodeGenerator;
import org.signal.channelauth.code.OneTimeCodeStore;
import org.signal.channelauth.identity.IdentityProvider;
import org.signal.channelauth.identity.InvalidCredentialException;
import org.signal.channelauth.ratelimit.AttemptRateLimiter;
import org.signal.channelauth.ratelimit.RateLimitExceededException;
import org.signal.channelauth.ratelimit.RateLimitResult;
import org.signal.channelauth.ratelimit.RollingAttemptWindow;
import org.signal.channelauth.session.AuthMethod;
import org.signal.channelauth.session.ChannelSession;
import org.signal.channelauth.session.SessionNotFoundException;
import org.signal.channelauth.session.SessionRepository;
import org.signal.channelauth.session.SessionUpdate;
import org.signal.channelauth.util.CompletionExceptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The session manager is the entry point for everything the messaging layer needs to know or change about a phone
 * number's session: reading it, moving it through an authentication cycle, checking attempts and one-time codes, and
 * applying channel observations.
 * <p/>
 * Every change is a single atomic update through the {@link SessionRepository}. Reads may be served from a
 * {@link SessionCache}, but the cache entry for a phone number is invalidated whenever that phone number's session
 * changes, and decisions that matter for security (attempt counting, code redemption, channel downgrades, and token
 * validation) always go to the repository.
 */
@Singleton
public class SessionManager {

  private final SessionRepository sessionRepository;
  private final SessionCache sessionCache;
  private final AttemptRateLimiter attemptRateLimiter;
  private final RollingAttemptWindow attemptWindow;
  private final OneTimeCodeStore oneTimeCodeStore;
  private final OneTimeCodeGenerator oneTimeCodeGenerator;
  private final OneTimeCodeConfiguration oneTimeCodeConfiguration;
  private final ChannelTrustTracker channelTrustTracker;
  private final IdentityProvider identityProvider;
  private final SessionConfiguration configuration;
  private final Clock clock;

  private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

  public SessionManager(final SessionRepository sessionRepository,
      final SessionCache sessionCache,
      final AttemptRateLimiter attemptRateLimiter,
      final RollingAttemptWindow attemptWindow,
      final OneTimeCodeStore oneTimeCodeStore,
      final OneTimeCodeGenerator oneTimeCodeGenerator,
      final OneTimeCodeConfiguration oneTimeCodeConfiguration,
      final ChannelTrustTracker channelTrustTracker,
      final IdentityProvider identityProvider,
      final SessionConfiguration configuration,
      final Clock clock) {

    this.sessionRepository = sessionRepository;
    this.sessionCache = sessionCache;
    this.attemptRateLimiter = attemptRateLimiter;
    this.attemptWindow = attemptWindow;
    this.oneTimeCodeStore = oneTimeCodeStore;
    this.oneTimeCodeGenerator = oneTimeCodeGenerator;
    this.oneTimeCodeConfiguration = oneTimeCodeConfiguration;
    this.channelTrustTracker = channelTrustTracker;
    this.identityProvider = identityProvider;
    this.configuration = configuration;
    this.clock = clock;
  }

  /**
   * Returns the session for the given phone number. Sessions whose authentication has expired have their
   * authentication cleared as a side effect, and are reported as absent.
   *
   * @param phoneNumber the phone number for which to retrieve a session
   *
   * @return a future that yields the phone number's session (which may be pending rather than authenticated) or
   * {@code null} if the phone number has no session or its authentication has expired
   */
  public CompletableFuture<ChannelSession> getSession(final String phoneNumber) {
    final Instant now = clock.instant();

    final Optional<ChannelSession> maybeCachedSession =
        sessionCache.get(phoneNumber).filter(session -> !session.isExpired(now));

    if (maybeCachedSession.isPresent()) {
      return CompletableFuture.completedFuture(maybeCachedSession.get());
    }

    final long invalidationCount = sessionCache.getInvalidationCount(phoneNumber);

    return sessionRepository.getSession(phoneNumber)
        .thenCompose(session -> {
          if (session.isExpired(now)) {
            logger.info("Clearing expired authentication");
            return invalidateSession(phoneNumber).thenApply(ignored -> (ChannelSession) null);
          }

          sessionCache.put(session, invalidationCount);
          return CompletableFuture.completedFuture(session);
        })
        .exceptionally(throwable -> {
          if (CompletionExceptions.unwrap(throwable) instanceof SessionNotFoundException) {
            sessionCache.invalidate(phoneNumber);
            return null;
          }

          throw CompletionExceptions.wrap(throwable);
        });
  }

  /**
   * Moves the given phone number's session into the authenticated state. The session's attempt counter is reset.
   *
   * @return a future that yields the authenticated session or fails with a {@link ChannelDowngradedException} if the
   * session was downgraded since its authentication cycle started
   */
  public CompletableFuture<ChannelSession> createSession(final String phoneNumber,
      final String email,
      final String userId,
      final String sessionToken,
      final AuthMethod authMethod) {

    final Instant now = clock.instant();

    return updateSession(phoneNumber, maybeSession -> {
      if (maybeSession.map(ChannelSession::channelDowngradeDetected).orElse(false)) {
        throw new CompletionException(new ChannelDowngradedException());
      }

      final ChannelSession.Builder builder = maybeSession.map(ChannelSession::toBuilder)
          .orElseGet(() -> ChannelSession.newBuilder(phoneNumber)
              .trustRequired(configuration.isTrustRequired())
              .sessionDurationDays(configuration.getDurationDays())
              .createdAt(now));

      final int sessionDurationDays = maybeSession.map(ChannelSession::sessionDurationDays)
          .orElse(configuration.getDurationDays());

      final ChannelSession session = builder
          .email(email)
          .userId(userId)
          .sessionToken(sessionToken)
          .authMethod(authMethod)
          .authenticatedAt(now)
          .expiresAt(now.plus(Duration.ofDays(sessionDurationDays)))
          .authAttempts(0)
          .updatedAt(now)
          .build();

      return SessionUpdate.store(session, session);
    }).whenComplete((session, throwable) -> {
      if (session != null) {
        logger.info("Authenticated session via {} until {}", authMethod, session.expiresAt());
      }
    });
  }

  /**
   * Starts (or restarts) an authentication cycle for the given phone number. A new session is created in the pending
   * state if none exists. An existing session is moved to the pending state, has any downgrade flag cleared, and has
   * the attempt recorded against its rolling attempt window.
   *
   * @return a future that yields the pending session or fails with a {@link RateLimitExceededException} if the
   * existing session has exhausted its attempts, in which case the session is not changed
   */
  public CompletableFuture<ChannelSession> upsertPendingSession(final String phoneNumber,
      final String email,
      final AuthMethod authMethod,
      final boolean trustRequired,
      final int sessionDurationDays) {

    final Instant now = clock.instant();

    return updateSession(phoneNumber, maybeSession -> {
      final ChannelSession base;

      if (maybeSession.isPresent()) {
        final RollingAttemptWindow.Evaluation evaluation = attemptWindow.evaluate(maybeSession.get(), now);

        if (evaluation.result().limited()) {
          final Instant resetAt = evaluation.result().resetAt();
          throw new CompletionException(new RateLimitExceededException(Duration.between(now, resetAt), resetAt));
        }

        base = evaluation.updatedSession();
      } else {
        base = ChannelSession.newBuilder(phoneNumber).createdAt(now).build();
      }

      final ChannelSession session = ChannelTrustState.of(base)
          .apply(ChannelEvent.AUTHENTICATION_STARTED, trustRequired)
          .state()
          .applyTo(base)
          .toBuilder()
          .email(email)
          .authMethod(authMethod)
          .trustRequired(trustRequired)
          .sessionDurationDays(sessionDurationDays)
          .updatedAt(now)
          .build();

      return SessionUpdate.store(session, session);
    });
  }

  /**
   * Clears the authentication of the given phone number's session. Does nothing if the phone number has no session.
   */
  public CompletableFuture<Void> invalidateSession(final String phoneNumber) {
    final Instant now = clock.instant();

    return updateSession(phoneNumber, maybeSession -> maybeSession
        .map(session -> SessionUpdate.<Void>store(withoutAuthentication(session, now), null))
        .orElseGet(() -> SessionUpdate.none(null)));
  }

  /**
   * Extends the authentication of the given phone number's session to a full session lifetime from now.
   *
   * @return a future that yields the refreshed session, or {@code null} if the session is not currently authenticated
   */
  public CompletableFuture<ChannelSession> refreshSession(final String phoneNumber) {
    final Instant now = clock.instant();

    return updateSession(phoneNumber, maybeSession -> maybeSession
        .filter(session -> session.isAuthenticated(now))
        .map(session -> {
          final ChannelSession refreshed = session.toBuilder()
              .expiresAt(now.plus(Duration.ofDays(session.sessionDurationDays())))
              .updatedAt(now)
              .build();

          return SessionUpdate.store(refreshed, refreshed);
        })
        .orElseGet(() -> SessionUpdate.none(null)));
  }

  /**
   * Resolves the identity and authorization attributes of the user bound to the given phone number's session by
   * validating the session's token with the identity provider. If the provider rejects the token, the session's
   * authentication is cleared.
   *
   * @return a future that yields the user's context, or {@code null} if the session is not authenticated, its token
   * was rejected, or the identity provider could not be reached
   */
  public CompletableFuture<UserContext> getUserContext(final String phoneNumber) {
    final Instant now = clock.instant();

    return sessionRepository.getSession(phoneNumber)
        .thenCompose(session -> {
          if (!session.isAuthenticated(now) || session.userId() == null) {
            return CompletableFuture.completedFuture((UserContext) null);
          }

          final String sessionToken = session.sessionToken();

          return identityProvider.validateToken(sessionToken)
              .thenApply(claims -> new UserContext(claims.userId(),
                  claims.email() != null ? claims.email() : session.email(),
                  phoneNumber,
                  claims.organizationId(),
                  claims.role(),
                  session.expiresAt(),
                  session.metadata()))
              .exceptionallyCompose(throwable -> {
                final Throwable unwrapped = CompletionExceptions.unwrap(throwable);

                if (unwrapped instanceof InvalidCredentialException) {
                  logger.warn("Identity provider rejected session token; clearing authentication");
                  return invalidateSessionWithToken(phoneNumber, sessionToken).thenApply(ignored -> (UserContext) null);
                }

                logger.warn("Failed to validate session token", unwrapped);
                return CompletableFuture.completedFuture((UserContext) null);
              });
        })
        .exceptionally(throwable -> {
          if (CompletionExceptions.unwrap(throwable) instanceof SessionNotFoundException) {
            return null;
          }

          throw CompletionExceptions.wrap(throwable);
        });
  }

  /**
   * Checks whether another authentication attempt (for example, a one-time code guess) is permitted for the given
   * phone number and, if so, records it.
   */
  public CompletableFuture<RateLimitResult> checkAndRecordAttempt(final String phoneNumber) {
    return attemptRateLimiter.checkAndRecordAttempt(phoneNumber)
        .whenComplete((result, throwable) -> sessionCache.invalidate(phoneNumber));
  }

  /**
   * Generates a new one-time code for the given phone number's session, replacing any code already pending.
   *
   * @return a future that yields the new code
   */
  public CompletableFuture<String> issueCode(final String phoneNumber) {
    final String code = oneTimeCodeGenerator.generateCode();

    return oneTimeCodeStore.issue(phoneNumber, code, oneTimeCodeConfiguration.getTtl())
        .whenComplete((ignored, throwable) -> sessionCache.invalidate(phoneNumber))
        .thenApply(ignored -> code);
  }

  public CompletableFuture<CodeVerificationResult> verifyCode(final String phoneNumber, final String candidate) {
    return oneTimeCodeStore.verify(phoneNumber, candidate)
        .whenComplete((result, throwable) -> sessionCache.invalidate(phoneNumber));
  }

  /**
   * Records the given outbound message as the one whose delivery report should update the session's channel.
   *
   * @return a future that yields {@code true} if the message was recorded or {@code false} if the phone number has no
   * session
   */
  public CompletableFuture<Boolean> recordOutboundMessage(final String phoneNumber, final String messageId) {
    return channelTrustTracker.recordOutboundMessage(phoneNumber, messageId)
        .whenComplete((recorded, throwable) -> sessionCache.invalidate(phoneNumber));
  }

  /**
   * Checks the channel of an inbound message and revokes the sender's authentication if the message reveals a
   * downgrade. Must be called before acting on the message.
   *
   * @return a future that yields {@code true} if the sender's session was revoked
   */
  public CompletableFuture<Boolean> checkInboundChannel(final String phoneNumber,
      @Nullable final String channelPrefix) {

    return channelTrustTracker.checkInbound(phoneNumber, channelPrefix)
        .whenComplete((revoked, throwable) -> sessionCache.invalidate(phoneNumber));
  }

  /**
   * Applies a delivery report for an outbound message to the session that sent it.
   *
   * @return a future that yields the transition that was applied, or empty if the report was ignored
   */
  public CompletableFuture<Optional<ChannelTrustTracker.AppliedTransition>> applyDeliveryStatus(final String messageId,
      @Nullable final String channelPrefix) {

    return channelTrustTracker.onDeliveryStatus(messageId, channelPrefix)
        .whenComplete((maybeTransition, throwable) -> {
          if (maybeTransition != null) {
            maybeTransition.ifPresent(applied -> sessionCache.invalidate(applied.session().phoneNumber()));
          }
        });
  }

  public CompletableFuture<SessionStatistics> getSessionStatistics() {
    final Instant now = clock.instant();

    return sessionRepository.getAllSessions().thenApply(sessions -> summarize(sessions, now));
  }

  @VisibleForTesting
  static SessionStatistics summarize(final List<ChannelSession> sessions, final Instant now) {
    final List<ChannelSession> activeSessions = sessions.stream()
        .filter(session -> session.isAuthenticated(now))
        .toList();

    final Map<AuthMethod, Long> sessionsByAuthMethod = new EnumMap<>(AuthMethod.class);

    for (final AuthMethod authMethod : AuthMethod.values()) {
      sessionsByAuthMethod.put(authMethod, 0L);
    }

    sessionsByAuthMethod.putAll(activeSessions.stream()
        .collect(Collectors.groupingBy(ChannelSession::authMethod, Collectors.counting())));

    final Duration averageSessionAge = activeSessions.isEmpty() ? Duration.ZERO :
        Duration.ofMillis((long) activeSessions.stream()
            .mapToLong(session -> Duration.between(session.authenticatedAt(), now).toMillis())
            .average()
            .orElse(0));

    return new SessionStatistics(activeSessions.size(), Map.copyOf(sessionsByAuthMethod), averageSessionAge);
  }

  private CompletableFuture<Void> invalidateSessionWithToken(final String phoneNumber, final String sessionToken) {
    final Instant now = clock.instant();

    // A newer authentication may have replaced the rejected token in the meantime
    return updateSession(phoneNumber, maybeSession -> maybeSession
        .filter(session -> sessionToken.equals(session.sessionToken()))
        .map(session -> SessionUpdate.<Void>store(withoutAuthentication(session, now), null))
        .orElseGet(() -> SessionUpdate.none(null)));
  }

  private static ChannelSession withoutAuthentication(final ChannelSession session, final Instant now) {
    return session.withoutAuthentication().toBuilder().updatedAt(now).build();
  }

  private <T> CompletableFuture<T> updateSession(final String phoneNumber,
      final Function<Optional<ChannelSession>, SessionUpdate<T>> updater) {

    return sessionRepository.updateSession(phoneNumber, updater)
        .whenComplete((result, throwable) -> sessionCache.invalidate(phoneNumber));
  }
}
