/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.dispatch;

import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.Metrics;
import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.apache.commons.lang3.StringUtils;
import org.signal.channelauth.UpstreamUnavailableException;
import org.signal.channelauth.channel.ChannelDowngradedException;
import org.signal.channelauth.channel.ChannelPrefixClassifier;
import org.signal.channelauth.identity.IdentityProvider;
import org.signal.channelauth.identity.InvalidCredentialException;
import org.signal.channelauth.manager.SessionConfiguration;
import org.signal.channelauth.manager.SessionManager;
import org.signal.channelauth.metrics.MetricsUtil;
import org.signal.channelauth.ratelimit.RateLimitExceededException;
import org.signal.channelauth.session.AuthMethod;
import org.signal.channelauth.session.ChannelSession;
import org.signal.channelauth.transport.MessageTransport;
import org.signal.channelauth.util.CompletionExceptions;
import org.signal.channelauth.util.Durations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides how to respond to each inbound message and sends the response.
 * <p/>
 * Every message first passes through the session manager's inbound channel check, so a message that reveals a
 * channel downgrade revokes the sender's session before anything else happens. The message is then routed by its
 * content and the sender's session:
 *
 * <ol>
 *   <li>sign-in commands start a new authentication cycle and send a credential to the account's email address;</li>
 *   <li>six-digit codes complete a pending one-time-code authentication;</li>
 *   <li>sign-out commands clear the sender's authentication;</li>
 *   <li>anything else from an authenticated sender over a trusted channel goes to the
 *   {@link AuthenticatedRequestHandler};</li>
 *   <li>anything else prompts the sender to sign in.</li>
 * </ol>
 *
 * Replies that confirm a sign-in or answer an authenticated request are tracked so their delivery reports can update
 * the session's channel.
 */
@Singleton
public class InboundMessageDispatcher {

  private final SessionManager sessionManager;
  private final MessageTransport messageTransport;
  private final IdentityProvider identityProvider;
  private final EmailDirectory emailDirectory;
  private final AuthenticatedRequestHandler authenticatedRequestHandler;
  private final ChannelPrefixClassifier channelPrefixClassifier;
  private final ReplyMessageProvider replyMessageProvider;
  private final SessionConfiguration sessionConfiguration;
  private final Clock clock;

  private static final String DISPATCH_COUNTER_NAME = MetricsUtil.name(InboundMessageDispatcher.class, "dispatch");
  private static final String ROUTE_TAG_NAME = "route";

  private static final Logger logger = LoggerFactory.getLogger(InboundMessageDispatcher.class);

  @VisibleForTesting
  enum Route {
    UNPARSEABLE_SENDER,
    CHANNEL_REVOKED,
    LOGIN,
    CODE,
    LOGOUT,
    AUTHENTICATED_REQUEST,
    UNAUTHENTICATED_REQUEST
  }

  private record Reply(String body, boolean tracked) {
  }

  public InboundMessageDispatcher(final SessionManager sessionManager,
      final MessageTransport messageTransport,
      final IdentityProvider identityProvider,
      final EmailDirectory emailDirectory,
      final AuthenticatedRequestHandler authenticatedRequestHandler,
      final ChannelPrefixClassifier channelPrefixClassifier,
      final ReplyMessageProvider replyMessageProvider,
      final SessionConfiguration sessionConfiguration,
      final Clock clock) {

    this.sessionManager = sessionManager;
    this.messageTransport = messageTransport;
    this.identityProvider = identityProvider;
    this.emailDirectory = emailDirectory;
    this.authenticatedRequestHandler = authenticatedRequestHandler;
    this.channelPrefixClassifier = channelPrefixClassifier;
    this.replyMessageProvider = replyMessageProvider;
    this.sessionConfiguration = sessionConfiguration;
    this.clock = clock;
  }

  /**
   * Handles an inbound message and sends the reply, if any, to its sender.
   *
   * @param message the message to handle
   *
   * @return a future that completes when the reply has been sent
   */
  public CompletableFuture<Void> dispatch(final InboundMessage message) {
    final Optional<String> maybePhoneNumber = PhoneNumbers.normalize(message.from());

    if (maybePhoneNumber.isEmpty()) {
      logger.warn("Ignoring message from unparseable sender");
      incrementDispatchCounter(Route.UNPARSEABLE_SENDER);

      return CompletableFuture.completedFuture(null);
    }

    final String phoneNumber = maybePhoneNumber.get();

    return sessionManager.checkInboundChannel(phoneNumber, message.channelPrefix())
        .thenCompose(revoked -> {
          if (revoked) {
            incrementDispatchCounter(Route.CHANNEL_REVOKED);
            return CompletableFuture.completedFuture(untracked(ReplyMessageProvider.CHANNEL_UNTRUSTED, Map.of()));
          }

          return sessionManager.getSession(phoneNumber)
              .thenCompose(session -> route(phoneNumber, message, session));
        })
        .thenCompose(reply -> send(phoneNumber, reply))
        .whenComplete((ignored, throwable) -> {
          if (throwable != null) {
            logger.warn("Failed to handle message from {}", PhoneNumbers.redact(phoneNumber),
                CompletionExceptions.unwrap(throwable));
          }
        });
  }

  private CompletableFuture<Reply> route(final String phoneNumber,
      final InboundMessage message,
      @Nullable final ChannelSession session) {

    final Commands command = Commands.parse(message.body());
    final boolean authenticated = session != null && session.isAuthenticated(clock.instant());

    if (command == Commands.LOGIN) {
      incrementDispatchCounter(Route.LOGIN);
      return handleLogin(phoneNumber, session);
    } else if (command == Commands.CODE && session != null && session.authMethod() == AuthMethod.ONE_TIME_CODE
        && !authenticated && session.email() != null) {

      incrementDispatchCounter(Route.CODE);
      return handleCode(phoneNumber, message.body().trim(), session.email());
    } else if (command == Commands.LOGOUT) {
      incrementDispatchCounter(Route.LOGOUT);
      return sessionManager.invalidateSession(phoneNumber)
          .thenApply(ignored -> untracked(ReplyMessageProvider.LOGGED_OUT, Map.of()));
    } else if (authenticated) {
      incrementDispatchCounter(Route.AUTHENTICATED_REQUEST);
      return handleAuthenticatedRequest(phoneNumber, message, session);
    }

    incrementDispatchCounter(Route.UNAUTHENTICATED_REQUEST);
    return CompletableFuture.completedFuture(untracked(ReplyMessageProvider.AUTHENTICATION_REQUIRED, Map.of()));
  }

  private CompletableFuture<Reply> handleLogin(final String phoneNumber, @Nullable final ChannelSession session) {
    final CompletableFuture<Optional<String>> emailFuture = session != null && session.email() != null ?
        CompletableFuture.completedFuture(Optional.of(session.email())) :
        emailDirectory.findEmail(phoneNumber);

    return emailFuture.thenCompose(maybeEmail -> {
      if (maybeEmail.isEmpty()) {
        return CompletableFuture.completedFuture(untracked(ReplyMessageProvider.NOT_REGISTERED, Map.of()));
      }

      final String email = maybeEmail.get();
      final AuthMethod authMethod = sessionConfiguration.getDefaultAuthMethod();

      return sessionManager.upsertPendingSession(phoneNumber, email, authMethod,
              sessionConfiguration.isTrustRequired(), sessionConfiguration.getDurationDays())
          .thenCompose(pendingSession -> identityProvider.issueCredential(email, phoneNumber)
              .thenApply(ignored -> tracked(
                  authMethod == AuthMethod.ONE_TIME_CODE ?
                      ReplyMessageProvider.CODE_SENT : ReplyMessageProvider.MAGIC_LINK_SENT,
                  Map.of("email", maskEmail(email), "days", pendingSession.sessionDurationDays()))))
          .exceptionally(throwable -> {
            final Throwable unwrapped = CompletionExceptions.unwrap(throwable);

            if (unwrapped instanceof RateLimitExceededException rateLimitExceededException) {
              return untracked(ReplyMessageProvider.RATE_LIMITED,
                  Map.of("minutes", Durations.toMinutesRoundedUp(rateLimitExceededException.getRetryAfterDuration())));
            } else if (unwrapped instanceof InvalidCredentialException
                || unwrapped instanceof UpstreamUnavailableException) {

              logger.warn("Failed to issue credential", unwrapped);
              return untracked(ReplyMessageProvider.CREDENTIAL_FAILED, Map.of());
            }

            throw CompletionExceptions.wrap(throwable);
          });
    });
  }

  private CompletableFuture<Reply> handleCode(final String phoneNumber, final String code, final String email) {
    return sessionManager.checkAndRecordAttempt(phoneNumber).thenCompose(rateLimitResult -> {
      if (rateLimitResult.limited()) {
        return CompletableFuture.completedFuture(untracked(ReplyMessageProvider.CODE_ATTEMPTS_EXHAUSTED, Map.of()));
      }

      return identityProvider.verifyCode(email, code)
          .thenCompose(credential -> sessionManager.createSession(phoneNumber,
              email, credential.userId(), credential.accessToken(), AuthMethod.ONE_TIME_CODE))
          .thenApply(session -> tracked(ReplyMessageProvider.AUTHENTICATED,
              Map.of("days", session.sessionDurationDays())))
          .exceptionally(throwable -> {
            final Throwable unwrapped = CompletionExceptions.unwrap(throwable);

            if (unwrapped instanceof InvalidCredentialException) {
              final int remainingAttempts = rateLimitResult.remainingAttempts();

              return remainingAttempts > 0 ?
                  untracked(ReplyMessageProvider.CODE_REJECTED, Map.of("remaining", remainingAttempts)) :
                  untracked(ReplyMessageProvider.CODE_ATTEMPTS_EXHAUSTED, Map.of());
            } else if (unwrapped instanceof ChannelDowngradedException) {
              return untracked(ReplyMessageProvider.CHANNEL_UNTRUSTED, Map.of());
            } else if (unwrapped instanceof UpstreamUnavailableException) {
              logger.warn("Failed to verify code", unwrapped);
              return untracked(ReplyMessageProvider.CODE_FAILED, Map.of());
            }

            throw CompletionExceptions.wrap(throwable);
          });
    });
  }

  private CompletableFuture<Reply> handleAuthenticatedRequest(final String phoneNumber,
      final InboundMessage message,
      final ChannelSession session) {

    if (session.trustRequired() && !channelPrefixClassifier.isTrusted(message.channelPrefix())) {
      logger.warn("Refusing request from {} over untrusted channel {}",
          PhoneNumbers.redact(phoneNumber), message.channelPrefix());

      return CompletableFuture.completedFuture(untracked(ReplyMessageProvider.CHANNEL_UNTRUSTED, Map.of()));
    }

    return sessionManager.getUserContext(phoneNumber).thenCompose(userContext -> {
      if (userContext == null) {
        // The session manager clears rejected tokens itself; a session that is still authenticated here could not be
        // validated because the identity provider is unavailable
        return sessionManager.getSession(phoneNumber).thenApply(current ->
            current != null && current.isAuthenticated(clock.instant()) ?
                untracked(ReplyMessageProvider.REQUEST_FAILED, Map.of()) :
                untracked(ReplyMessageProvider.SESSION_EXPIRED, Map.of()));
      }

      return authenticatedRequestHandler.handleRequest(userContext, message.body())
          .thenApply(body -> new Reply(body, true))
          .exceptionally(throwable -> {
            logger.warn("Failed to handle authenticated request", CompletionExceptions.unwrap(throwable));
            return untracked(ReplyMessageProvider.REQUEST_FAILED, Map.of());
          });
    });
  }

  private CompletableFuture<Void> send(final String phoneNumber, final Reply reply) {
    return messageTransport.send(phoneNumber, reply.body(), reply.tracked())
        .thenCompose(messageId -> reply.tracked() ?
            sessionManager.recordOutboundMessage(phoneNumber, messageId).thenAccept(recorded -> {
              if (!recorded) {
                logger.debug("Session for {} disappeared before message could be tracked",
                    PhoneNumbers.redact(phoneNumber));
              }
            }) :
            CompletableFuture.completedFuture(null));
  }

  private Reply tracked(final String messageKey, final Map<String, Object> variables) {
    return new Reply(replyMessageProvider.getReply(messageKey, variables), true);
  }

  private Reply untracked(final String messageKey, final Map<String, Object> variables) {
    return new Reply(replyMessageProvider.getReply(messageKey, variables), false);
  }

  private static void incrementDispatchCounter(final Route route) {
    Metrics.counter(DISPATCH_COUNTER_NAME, ROUTE_TAG_NAME, route.name()).increment();
  }

  /**
   * Masks the local part of an email address, leaving its first character and domain visible.
   */
  @VisibleForTesting
  static String maskEmail(final String email) {
    final String localPart = StringUtils.substringBefore(email, "@");
    final String domain = StringUtils.substringAfter(email, "@");

    if (localPart.isEmpty() || domain.isEmpty()) {
      return "***";
    }

    return localPart.charAt(0) + "***@" + domain;
  }
}
