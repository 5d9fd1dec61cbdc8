/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.channel;

import io.micrometer.core.instrument.Metrics;
import io.micronaut.context.event.ApplicationEventPublisher;
import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;
import org.signal.channelauth.metrics.MetricsUtil;
import org.signal.channelauth.session.ChannelSession;
import org.signal.channelauth.session.SessionRepository;
import org.signal.channelauth.session.SessionUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the channel over which each session is reached and revokes authentication when a session that requires a
 * trusted channel falls back to an untrusted one.
 * <p/>
 * Channel observations arrive two ways. Delivery reports for tracked outbound messages arrive asynchronously and
 * apply to every later request. Inbound messages carry their own channel prefix and are checked before the message is
 * acted upon, which closes the window between a fallback and the delivery report that would reveal it. Both paths
 * apply the same {@link ChannelTrustState} transition in a single atomic session update.
 */
@Singleton
public class ChannelTrustTracker {

  private final SessionRepository sessionRepository;
  private final ChannelPrefixClassifier channelPrefixClassifier;
  private final ApplicationEventPublisher<ChannelDowngradedEvent> downgradedEventPublisher;
  private final Clock clock;

  private static final String TRANSITION_COUNTER_NAME = MetricsUtil.name(ChannelTrustTracker.class, "transition");

  private static final Logger logger = LoggerFactory.getLogger(ChannelTrustTracker.class);

  public ChannelTrustTracker(final SessionRepository sessionRepository,
      final ChannelPrefixClassifier channelPrefixClassifier,
      final ApplicationEventPublisher<ChannelDowngradedEvent> downgradedEventPublisher,
      final Clock clock) {

    this.sessionRepository = sessionRepository;
    this.channelPrefixClassifier = channelPrefixClassifier;
    this.downgradedEventPublisher = downgradedEventPublisher;
    this.clock = clock;
  }

  /**
   * Applies a delivery report for an outbound message to the session that sent it. Reports without a recognized
   * channel prefix, reports for unknown messages, and reports for messages other than the session's most recently
   * tracked message are ignored.
   *
   * @param messageId the provider identifier of the delivered message
   * @param channelPrefix the channel prefix reported by the provider
   *
   * @return a future that yields the transition applied to the session, or empty if the report was ignored
   */
  public CompletableFuture<Optional<AppliedTransition>> onDeliveryStatus(final String messageId,
      @Nullable final String channelPrefix) {

    final Optional<ChannelEvent> maybeEvent = channelPrefixClassifier.classify(channelPrefix);

    if (maybeEvent.isEmpty()) {
      return CompletableFuture.completedFuture(Optional.empty());
    }

    return sessionRepository.findPhoneNumberByMessageId(messageId)
        .thenCompose(maybePhoneNumber -> maybePhoneNumber
            .map(phoneNumber -> applyEvent(phoneNumber, maybeEvent.get(),
                session -> messageId.equals(session.lastMessageId()),
                ChannelDowngradedEvent.DetectionSource.DELIVERY_REPORT))
            .orElseGet(() -> CompletableFuture.completedFuture(Optional.empty())));
  }

  /**
   * Checks the channel of an inbound message against its sender's session. If the session requires a trusted channel,
   * was last reached over a trusted channel, and the inbound message did not arrive over a trusted channel, the
   * session's authentication is revoked before this method returns.
   *
   * @param phoneNumber the sender of the inbound message
   * @param channelPrefix the channel prefix of the inbound message
   *
   * @return a future that yields {@code true} if the session was revoked or {@code false} otherwise
   */
  public CompletableFuture<Boolean> checkInbound(final String phoneNumber, @Nullable final String channelPrefix) {
    if (channelPrefixClassifier.isTrusted(channelPrefix)) {
      return CompletableFuture.completedFuture(false);
    }

    return applyEvent(phoneNumber, ChannelEvent.UNTRUSTED_CHANNEL_OBSERVED,
        session -> session.trustRequired() && session.channelType() == ChannelType.TRUSTED,
        ChannelDowngradedEvent.DetectionSource.INBOUND_MESSAGE)
        .thenApply(maybeTransition -> maybeTransition.map(applied -> applied.transition().isDowngrade()).orElse(false));
  }

  /**
   * Records the given message as the most recent tracked outbound message for the given phone number's session, so a
   * later delivery report for the message can find the session.
   *
   * @param phoneNumber the recipient of the message
   * @param messageId the provider identifier of the message
   *
   * @return a future that yields {@code true} if the message was recorded or {@code false} if the phone number has no
   * session
   */
  public CompletableFuture<Boolean> recordOutboundMessage(final String phoneNumber, final String messageId) {
    final Instant now = clock.instant();

    return sessionRepository.updateSession(phoneNumber, maybeSession -> maybeSession
        .map(session -> SessionUpdate.store(session.toBuilder()
            .lastMessageId(messageId)
            .updatedAt(now)
            .build(), true))
        .orElseGet(() -> SessionUpdate.none(false)));
  }

  private CompletableFuture<Optional<AppliedTransition>> applyEvent(final String phoneNumber,
      final ChannelEvent event,
      final Predicate<ChannelSession> precondition,
      final ChannelDowngradedEvent.DetectionSource detectionSource) {

    final Instant now = clock.instant();

    return sessionRepository.updateSession(phoneNumber, maybeSession -> {
          if (maybeSession.isEmpty() || !precondition.test(maybeSession.get())) {
            return SessionUpdate.<AppliedTransition>none(null);
          }

          final ChannelSession session = maybeSession.get();
          final ChannelTransition transition = ChannelTrustState.of(session).apply(event, session.trustRequired());
          final ChannelSession updatedSession =
              transition.state().applyTo(session).toBuilder().updatedAt(now).build();

          return SessionUpdate.store(updatedSession,
              new AppliedTransition(updatedSession, session.channelType(), transition));
        })
        .thenApply(appliedTransition -> {
          if (appliedTransition == null) {
            return Optional.empty();
          }

          final ChannelTransition transition = appliedTransition.transition();

          Metrics.counter(TRANSITION_COUNTER_NAME,
                  "from", appliedTransition.previousChannelType().name(),
                  "to", transition.state().channelType().name(),
                  "downgrade", String.valueOf(transition.isDowngrade()))
              .increment();

          if (transition.isDowngrade()) {
            logger.warn("Revoked authentication after channel downgrade detected by {}", detectionSource);
            downgradedEventPublisher.publishEventAsync(
                new ChannelDowngradedEvent(appliedTransition.session(), detectionSource));
          }

          return Optional.of(appliedTransition);
        });
  }

  /**
   * A channel transition that has been stored.
   *
   * @param session the session after the transition
   * @param previousChannelType the channel type before the transition
   * @param transition the transition that was applied
   */
  public record AppliedTransition(ChannelSession session,
                                  ChannelType previousChannelType,
                                  ChannelTransition transition) {
  }
}
