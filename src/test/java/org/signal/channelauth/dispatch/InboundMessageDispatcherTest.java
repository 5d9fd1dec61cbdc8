/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.micronaut.context.event.ApplicationEventPublisher;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.signal.channelauth.UpstreamUnavailableException;
import org.signal.channelauth.channel.ChannelDowngradedEvent;
import org.signal.channelauth.channel.ChannelPrefixClassifier;
import org.signal.channelauth.channel.ChannelTrustConfiguration;
import org.signal.channelauth.channel.ChannelTrustTracker;
import org.signal.channelauth.code.OneTimeCodeConfiguration;
import org.signal.channelauth.code.OneTimeCodeGenerator;
import org.signal.channelauth.code.OneTimeCodeStore;
import org.signal.channelauth.identity.IdentityProvider;
import org.signal.channelauth.identity.InvalidCredentialException;
import org.signal.channelauth.identity.TokenClaims;
import org.signal.channelauth.identity.VerifiedCredential;
import org.signal.channelauth.manager.SessionCache;
import org.signal.channelauth.manager.SessionConfiguration;
import org.signal.channelauth.manager.SessionManager;
import org.signal.channelauth.manager.UserContext;
import org.signal.channelauth.ratelimit.AttemptRateLimiter;
import org.signal.channelauth.ratelimit.RollingAttemptWindow;
import org.signal.channelauth.session.AuthMethod;
import org.signal.channelauth.session.ChannelSession;
import org.signal.channelauth.session.MemorySessionRepository;
import org.signal.channelauth.session.SessionRetentionConfiguration;
import org.signal.channelauth.session.SessionRetentionPolicy;
import org.signal.channelauth.transport.MessageTransport;

class InboundMessageDispatcherTest {

  private MemorySessionRepository sessionRepository;
  private SessionManager sessionManager;
  private MessageTransport messageTransport;
  private IdentityProvider identityProvider;
  private EmailDirectory emailDirectory;
  private AuthenticatedRequestHandler authenticatedRequestHandler;
  private SessionConfiguration sessionConfiguration;
  private ReplyMessageProvider replyMessageProvider;
  private InboundMessageDispatcher dispatcher;

  private static final String PHONE_NUMBER = "+12025550123";
  private static final String EMAIL = "user@example.com";
  private static final String MESSAGE_ID = "SM123";
  private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

  @BeforeEach
  void setUp() {
    final Clock clock = mock(Clock.class);
    when(clock.instant()).thenReturn(NOW);

    sessionRepository =
        new MemorySessionRepository(new SessionRetentionPolicy(new SessionRetentionConfiguration()),
            mock(ApplicationEventPublisher.class), clock);

    messageTransport = mock(MessageTransport.class);
    identityProvider = mock(IdentityProvider.class);
    emailDirectory = mock(EmailDirectory.class);
    authenticatedRequestHandler = mock(AuthenticatedRequestHandler.class);

    when(messageTransport.send(anyString(), anyString(), anyBoolean()))
        .thenReturn(CompletableFuture.completedFuture(MESSAGE_ID));

    when(emailDirectory.findEmail(anyString())).thenReturn(CompletableFuture.completedFuture(Optional.empty()));
    when(emailDirectory.findEmail(PHONE_NUMBER)).thenReturn(CompletableFuture.completedFuture(Optional.of(EMAIL)));

    when(identityProvider.issueCredential(anyString(), anyString()))
        .thenReturn(CompletableFuture.completedFuture(null));

    final RollingAttemptWindow attemptWindow = new RollingAttemptWindow(3, Duration.ofHours(1));
    final ChannelPrefixClassifier channelPrefixClassifier =
        new ChannelPrefixClassifier(new ChannelTrustConfiguration());

    //noinspection unchecked
    final ApplicationEventPublisher<ChannelDowngradedEvent> eventPublisher = mock(ApplicationEventPublisher.class);

    sessionConfiguration = new SessionConfiguration();

    sessionManager = new SessionManager(sessionRepository,
        mock(SessionCache.class),
        new AttemptRateLimiter(sessionRepository, attemptWindow, clock),
        attemptWindow,
        new OneTimeCodeStore(sessionRepository, clock),
        new OneTimeCodeGenerator(),
        new OneTimeCodeConfiguration(),
        new ChannelTrustTracker(sessionRepository, channelPrefixClassifier, eventPublisher, clock),
        identityProvider,
        sessionConfiguration,
        clock);

    replyMessageProvider = new ReplyMessageProvider();

    dispatcher = new InboundMessageDispatcher(sessionManager,
        messageTransport,
        identityProvider,
        emailDirectory,
        authenticatedRequestHandler,
        channelPrefixClassifier,
        replyMessageProvider,
        sessionConfiguration,
        clock);
  }

  @Test
  void dispatchUnparseableSender() {
    dispatcher.dispatch(new InboundMessage("not a phone number", "LOGIN", null, "RCS")).join();

    verifyNoInteractions(messageTransport);
    verifyNoInteractions(identityProvider);
  }

  @Test
  void dispatchUnauthenticated() {
    dispatcher.dispatch(new InboundMessage(PHONE_NUMBER, "What's on my calendar?", null, "RCS")).join();

    verify(messageTransport).send(PHONE_NUMBER, reply(ReplyMessageProvider.AUTHENTICATION_REQUIRED), false);
    assertNull(sessionManager.getSession(PHONE_NUMBER).join());
  }

  @Test
  void dispatchLoginNotRegistered() {
    final String unregisteredPhoneNumber = "+12025550188";

    dispatcher.dispatch(new InboundMessage(unregisteredPhoneNumber, "login", null, "RCS")).join();

    verify(messageTransport).send(unregisteredPhoneNumber, reply(ReplyMessageProvider.NOT_REGISTERED), false);
    verify(identityProvider, never()).issueCredential(any(), any());
    assertNull(sessionManager.getSession(unregisteredPhoneNumber).join());
  }

  @Test
  void dispatchLoginMagicLink() {
    dispatcher.dispatch(new InboundMessage("whatsapp:" + PHONE_NUMBER, "SignIn", null, "RCS")).join();

    verify(identityProvider).issueCredential(EMAIL, PHONE_NUMBER);
    verify(messageTransport).send(PHONE_NUMBER,
        reply(ReplyMessageProvider.MAGIC_LINK_SENT, Map.of("email", "u***@example.com", "days", 7)), true);

    final ChannelSession session = sessionManager.getSession(PHONE_NUMBER).join();

    assertFalse(session.isAuthenticated(NOW));
    assertEquals(EMAIL, session.email());
    assertEquals(AuthMethod.MAGIC_LINK, session.authMethod());
    assertEquals(MESSAGE_ID, session.lastMessageId());
  }

  @Test
  void dispatchLoginRateLimited() {
    for (int i = 0; i < 4; i++) {
      dispatcher.dispatch(new InboundMessage(PHONE_NUMBER, "LOGIN", null, "RCS")).join();
    }

    dispatcher.dispatch(new InboundMessage(PHONE_NUMBER, "LOGIN", null, "RCS")).join();

    verify(messageTransport).send(PHONE_NUMBER, reply(ReplyMessageProvider.RATE_LIMITED, Map.of("minutes", 60L)),
        false);
  }

  @Test
  void dispatchLoginCredentialFailed() {
    when(identityProvider.issueCredential(anyString(), anyString()))
        .thenReturn(CompletableFuture.failedFuture(new UpstreamUnavailableException("unavailable")));

    dispatcher.dispatch(new InboundMessage(PHONE_NUMBER, "LOGIN", null, "RCS")).join();

    verify(messageTransport).send(PHONE_NUMBER, reply(ReplyMessageProvider.CREDENTIAL_FAILED), false);
  }

  @Test
  void dispatchCode() {
    sessionConfiguration.setDefaultAuthMethod(AuthMethod.ONE_TIME_CODE);

    when(identityProvider.verifyCode(EMAIL, "123456"))
        .thenReturn(CompletableFuture.completedFuture(
            new VerifiedCredential("user-id", EMAIL, "access-token", Duration.ofHours(1))));

    dispatcher.dispatch(new InboundMessage(PHONE_NUMBER, "LOGIN", null, "RCS")).join();

    verify(messageTransport).send(PHONE_NUMBER,
        reply(ReplyMessageProvider.CODE_SENT, Map.of("email", "u***@example.com", "days", 7)), true);

    dispatcher.dispatch(new InboundMessage(PHONE_NUMBER, " 123456 ", null, "RCS")).join();

    verify(messageTransport).send(PHONE_NUMBER, reply(ReplyMessageProvider.AUTHENTICATED, Map.of("days", 7)), true);

    final ChannelSession session = sessionManager.getSession(PHONE_NUMBER).join();
    assertTrue(session.isAuthenticated(NOW));
    assertEquals(AuthMethod.ONE_TIME_CODE, session.authMethod());
    assertEquals("access-token", session.sessionToken());
  }

  @Test
  void dispatchCodeRejected() {
    sessionConfiguration.setDefaultAuthMethod(AuthMethod.ONE_TIME_CODE);

    when(identityProvider.verifyCode(anyString(), anyString()))
        .thenReturn(CompletableFuture.failedFuture(new InvalidCredentialException("invalid")));

    dispatcher.dispatch(new InboundMessage(PHONE_NUMBER, "LOGIN", null, "RCS")).join();

    dispatcher.dispatch(new InboundMessage(PHONE_NUMBER, "111111", null, "RCS")).join();
    verify(messageTransport).send(PHONE_NUMBER, reply(ReplyMessageProvider.CODE_REJECTED, Map.of("remaining", 2)),
        false);

    dispatcher.dispatch(new InboundMessage(PHONE_NUMBER, "222222", null, "RCS")).join();
    verify(messageTransport).send(PHONE_NUMBER, reply(ReplyMessageProvider.CODE_REJECTED, Map.of("remaining", 1)),
        false);

    dispatcher.dispatch(new InboundMessage(PHONE_NUMBER, "333333", null, "RCS")).join();
    dispatcher.dispatch(new InboundMessage(PHONE_NUMBER, "444444", null, "RCS")).join();

    verify(messageTransport, times(2))
        .send(PHONE_NUMBER, reply(ReplyMessageProvider.CODE_ATTEMPTS_EXHAUSTED), false);

    assertFalse(sessionManager.getSession(PHONE_NUMBER).join().isAuthenticated(NOW));
  }

  @Test
  void dispatchCodeWithoutPendingCodeSession() {
    // Six digits from a magic-link session are an ordinary message
    dispatcher.dispatch(new InboundMessage(PHONE_NUMBER, "LOGIN", null, "RCS")).join();
    dispatcher.dispatch(new InboundMessage(PHONE_NUMBER, "123456", null, "RCS")).join();

    verify(identityProvider, never()).verifyCode(any(), any());
    verify(messageTransport).send(PHONE_NUMBER, reply(ReplyMessageProvider.AUTHENTICATION_REQUIRED), false);
  }

  @Test
  void dispatchAuthenticatedRequest() {
    authenticate();

    when(identityProvider.validateToken("access-token"))
        .thenReturn(CompletableFuture.completedFuture(new TokenClaims("user-id", EMAIL, "org-id", "admin")));

    when(authenticatedRequestHandler.handleRequest(any(UserContext.class), anyString()))
        .thenReturn(CompletableFuture.completedFuture("Here you go"));

    dispatcher.dispatch(new InboundMessage(PHONE_NUMBER, "What's on my calendar?", null, "RCS")).join();

    verify(authenticatedRequestHandler).handleRequest(
        new UserContext("user-id", EMAIL, PHONE_NUMBER, "org-id", "admin", NOW.plus(Duration.ofDays(7)), Map.of()),
        "What's on my calendar?");

    verify(messageTransport).send(PHONE_NUMBER, "Here you go", true);
  }

  @Test
  void dispatchAuthenticatedRequestHandlerFailed() {
    authenticate();

    when(identityProvider.validateToken("access-token"))
        .thenReturn(CompletableFuture.completedFuture(new TokenClaims("user-id", EMAIL, null, null)));

    when(authenticatedRequestHandler.handleRequest(any(UserContext.class), anyString()))
        .thenReturn(CompletableFuture.failedFuture(new RuntimeException("OH NO")));

    dispatcher.dispatch(new InboundMessage(PHONE_NUMBER, "What's on my calendar?", null, "RCS")).join();

    verify(messageTransport).send(PHONE_NUMBER, reply(ReplyMessageProvider.REQUEST_FAILED), false);
  }

  @Test
  void dispatchAuthenticatedRequestTokenRejected() {
    authenticate();

    when(identityProvider.validateToken("access-token"))
        .thenReturn(CompletableFuture.failedFuture(new InvalidCredentialException("expired")));

    dispatcher.dispatch(new InboundMessage(PHONE_NUMBER, "What's on my calendar?", null, "RCS")).join();

    verify(messageTransport).send(PHONE_NUMBER, reply(ReplyMessageProvider.SESSION_EXPIRED), false);
    verifyNoInteractions(authenticatedRequestHandler);
    assertFalse(sessionManager.getSession(PHONE_NUMBER).join().isAuthenticated(NOW));
  }

  @Test
  void dispatchAuthenticatedRequestIdentityProviderUnavailable() {
    authenticate();

    when(identityProvider.validateToken("access-token"))
        .thenReturn(CompletableFuture.failedFuture(new UpstreamUnavailableException("unavailable")));

    dispatcher.dispatch(new InboundMessage(PHONE_NUMBER, "What's on my calendar?", null, "RCS")).join();

    verify(messageTransport).send(PHONE_NUMBER, reply(ReplyMessageProvider.REQUEST_FAILED), false);
    verifyNoInteractions(authenticatedRequestHandler);
    assertTrue(sessionManager.getSession(PHONE_NUMBER).join().isAuthenticated(NOW));
  }

  @Test
  void dispatchAuthenticatedRequestUntrustedChannel() {
    authenticate();

    dispatcher.dispatch(new InboundMessage(PHONE_NUMBER, "What's on my calendar?", null, "SM")).join();

    verify(messageTransport).send(PHONE_NUMBER, reply(ReplyMessageProvider.CHANNEL_UNTRUSTED), false);
    verifyNoInteractions(authenticatedRequestHandler);

    // The session was never observed over a trusted channel, so nothing was downgraded
    assertTrue(sessionManager.getSession(PHONE_NUMBER).join().isAuthenticated(NOW));
  }

  @Test
  void dispatchAuthenticatedRequestTrustNotRequired() {
    sessionConfiguration.setTrustRequired(false);
    authenticate();

    when(identityProvider.validateToken("access-token"))
        .thenReturn(CompletableFuture.completedFuture(new TokenClaims("user-id", EMAIL, null, null)));

    when(authenticatedRequestHandler.handleRequest(any(UserContext.class), anyString()))
        .thenReturn(CompletableFuture.completedFuture("Here you go"));

    dispatcher.dispatch(new InboundMessage(PHONE_NUMBER, "What's on my calendar?", null, "SM")).join();

    verify(messageTransport).send(PHONE_NUMBER, "Here you go", true);
  }

  @ParameterizedTest
  @ValueSource(strings = {"SM", "MM"})
  void dispatchAfterDowngrade(final String channelPrefix) {
    authenticate();
    sessionManager.recordOutboundMessage(PHONE_NUMBER, "SM-tracked").join();
    sessionManager.applyDeliveryStatus("SM-tracked", "RCS").join();

    dispatcher.dispatch(new InboundMessage(PHONE_NUMBER, "What's on my calendar?", null, channelPrefix)).join();

    verify(messageTransport).send(PHONE_NUMBER, reply(ReplyMessageProvider.CHANNEL_UNTRUSTED), false);
    verifyNoInteractions(authenticatedRequestHandler);

    final ChannelSession session = sessionManager.getSession(PHONE_NUMBER).join();
    assertTrue(session.channelDowngradeDetected());
    assertFalse(session.isAuthenticated(NOW));
  }

  @Test
  void dispatchLogout() {
    authenticate();

    dispatcher.dispatch(new InboundMessage(PHONE_NUMBER, "quit", null, "RCS")).join();

    verify(messageTransport).send(PHONE_NUMBER, reply(ReplyMessageProvider.LOGGED_OUT), false);
    assertFalse(sessionManager.getSession(PHONE_NUMBER).join().isAuthenticated(NOW));
  }

  @Test
  void dispatchSendFailed() {
    when(messageTransport.send(anyString(), anyString(), anyBoolean()))
        .thenReturn(CompletableFuture.failedFuture(new UpstreamUnavailableException("unavailable")));

    final CompletionException completionException = assertThrows(CompletionException.class,
        () -> dispatcher.dispatch(new InboundMessage(PHONE_NUMBER, "hello", null, "RCS")).join());

    assertInstanceOf(UpstreamUnavailableException.class, completionException.getCause());
  }

  @ParameterizedTest
  @CsvSource({
      "user@example.com, u***@example.com",
      "u@example.com, u***@example.com",
      "@example.com, ***",
      "user@, ***",
      "not-an-email, ***"
  })
  void maskEmail(final String email, final String expectedMaskedEmail) {
    assertEquals(expectedMaskedEmail, InboundMessageDispatcher.maskEmail(email));
  }

  private void authenticate() {
    sessionManager.upsertPendingSession(PHONE_NUMBER, EMAIL, AuthMethod.MAGIC_LINK,
        sessionConfiguration.isTrustRequired(), sessionConfiguration.getDurationDays()).join();

    sessionManager.createSession(PHONE_NUMBER, EMAIL, "user-id", "access-token", AuthMethod.MAGIC_LINK).join();
  }

  private String reply(final String messageKey) {
    return replyMessageProvider.getReply(messageKey);
  }

  private String reply(final String messageKey, final Map<String, Object> variables) {
    return replyMessageProvider.getReply(messageKey, variables);
  }
}
