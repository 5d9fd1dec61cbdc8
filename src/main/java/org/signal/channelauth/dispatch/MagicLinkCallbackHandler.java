/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.dispatch;

import jakarta.inject.Singleton;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.signal.channelauth.channel.ChannelDowngradedException;
import org.signal.channelauth.identity.IdentityProvider;
import org.signal.channelauth.identity.InvalidCredentialException;
import org.signal.channelauth.manager.SessionManager;
import org.signal.channelauth.session.AuthMethod;
import org.signal.channelauth.transport.MessageTransport;
import org.signal.channelauth.util.CompletionExceptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Completes magic-link authentication for the phone number on whose behalf a link was issued.
 */
@Singleton
public class MagicLinkCallbackHandler {

  private final IdentityProvider identityProvider;
  private final SessionManager sessionManager;
  private final MessageTransport messageTransport;
  private final ReplyMessageProvider replyMessageProvider;

  private static final Logger logger = LoggerFactory.getLogger(MagicLinkCallbackHandler.class);

  public enum Outcome {
    /**
     * The session was authenticated.
     */
    AUTHENTICATED,

    /**
     * The identity provider rejected the link; it may have expired or already been used.
     */
    INVALID_LINK,

    /**
     * The phone number has no session awaiting a magic link.
     */
    SESSION_NOT_FOUND,

    /**
     * The link was issued to an email address other than the one bound to the phone number's session.
     */
    EMAIL_MISMATCH,

    /**
     * The phone number's channel was downgraded after the link was issued.
     */
    CHANNEL_DOWNGRADED
  }

  public MagicLinkCallbackHandler(final IdentityProvider identityProvider,
      final SessionManager sessionManager,
      final MessageTransport messageTransport,
      final ReplyMessageProvider replyMessageProvider) {

    this.identityProvider = identityProvider;
    this.sessionManager = sessionManager;
    this.messageTransport = messageTransport;
    this.replyMessageProvider = replyMessageProvider;
  }

  /**
   * Verifies a magic link and, if it belongs to the given phone number's pending session, authenticates the session
   * and sends a confirmation message to the phone number. Failure to send the confirmation does not affect the
   * outcome.
   *
   * @param phoneNumber the phone number carried by the link's redirect
   * @param tokenHash the token hash carried by the link
   *
   * @return a future that yields the outcome of the callback, or fails with an
   * {@link org.signal.channelauth.UpstreamUnavailableException} if the identity provider could not be reached
   */
  public CompletableFuture<Outcome> handleCallback(final String phoneNumber, final String tokenHash) {
    final String normalizedPhoneNumber = PhoneNumbers.normalize(phoneNumber).orElse(phoneNumber);

    return identityProvider.verifyMagicLink(tokenHash)
        .thenCompose(credential -> sessionManager.getSession(normalizedPhoneNumber)
            .thenCompose(session -> {
              if (session == null) {
                return CompletableFuture.completedFuture(Outcome.SESSION_NOT_FOUND);
              }

              if (session.email() == null || !session.email().equalsIgnoreCase(credential.email())) {
                logger.warn("Magic link for {} was issued to a different email address",
                    PhoneNumbers.redact(normalizedPhoneNumber));

                return CompletableFuture.completedFuture(Outcome.EMAIL_MISMATCH);
              }

              return sessionManager.createSession(normalizedPhoneNumber,
                      credential.email(), credential.userId(), credential.accessToken(), AuthMethod.MAGIC_LINK)
                  .thenCompose(authenticated -> sendConfirmation(normalizedPhoneNumber,
                      authenticated.sessionDurationDays()))
                  .thenApply(ignored -> Outcome.AUTHENTICATED);
            }))
        .exceptionally(throwable -> {
          final Throwable unwrapped = CompletionExceptions.unwrap(throwable);

          if (unwrapped instanceof InvalidCredentialException) {
            return Outcome.INVALID_LINK;
          } else if (unwrapped instanceof ChannelDowngradedException) {
            logger.warn("Refusing magic link for {} after channel downgrade",
                PhoneNumbers.redact(normalizedPhoneNumber));

            return Outcome.CHANNEL_DOWNGRADED;
          }

          throw CompletionExceptions.wrap(throwable);
        });
  }

  private CompletableFuture<Void> sendConfirmation(final String phoneNumber, final int sessionDurationDays) {
    final String body = replyMessageProvider.getReply(ReplyMessageProvider.AUTHENTICATED,
        Map.of("days", sessionDurationDays));

    return messageTransport.send(phoneNumber, body, true)
        .thenCompose(messageId -> sessionManager.recordOutboundMessage(phoneNumber, messageId))
        .handle((recorded, throwable) -> {
          if (throwable != null) {
            logger.warn("Failed to send sign-in confirmation", CompletionExceptions.unwrap(throwable));
          }

          return null;
        });
  }
}
