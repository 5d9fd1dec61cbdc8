/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.session;

import com.google.common.annotations.VisibleForTesting;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventPublisher;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A session repository that holds sessions in memory. Updates are serialized per phone number by
 * {@link ConcurrentHashMap#compute}, which makes each update function evaluation and its result a single atomic step.
 * Intended for development and testing only.
 */
@Singleton
@Requires(env = {"dev", "test"})
@Requires(missingBeans = SessionRepository.class)
public class MemorySessionRepository implements SessionRepository {

  private final SessionRetentionPolicy retentionPolicy;
  private final ApplicationEventPublisher<SessionsSweptEvent> sweptEventPublisher;
  private final Clock clock;

  private final Map<String, ChannelSession> sessionsByPhoneNumber = new ConcurrentHashMap<>();
  private final Map<String, String> phoneNumbersByMessageId = new ConcurrentHashMap<>();

  private static final Logger logger = LoggerFactory.getLogger(MemorySessionRepository.class);

  public MemorySessionRepository(final SessionRetentionPolicy retentionPolicy,
      final ApplicationEventPublisher<SessionsSweptEvent> sweptEventPublisher,
      final Clock clock) {

    this.retentionPolicy = retentionPolicy;
    this.sweptEventPublisher = sweptEventPublisher;
    this.clock = clock;
  }

  @Scheduled(fixedDelay = "${session-retention.sweep-interval:1h}")
  @VisibleForTesting
  long removeExpiredSessions() {
    final Instant now = clock.instant();

    final Map<String, SessionRetentionPolicy.Outcome> changes = new HashMap<>();

    for (final String phoneNumber : List.copyOf(sessionsByPhoneNumber.keySet())) {
      final SessionRetentionPolicy.Outcome outcome =
          updateSession(phoneNumber, maybeSession -> retentionPolicy.sweep(maybeSession, now)).join();

      if (outcome != SessionRetentionPolicy.Outcome.RETAINED) {
        changes.put(phoneNumber, outcome);
      }
    }

    final long removed = changes.values().stream()
        .filter(outcome -> outcome == SessionRetentionPolicy.Outcome.DELETED)
        .count();

    if (removed > 0) {
      logger.info("Removed {} expired sessions", removed);
    }

    if (!changes.isEmpty()) {
      sweptEventPublisher.publishEvent(new SessionsSweptEvent(Set.copyOf(changes.keySet())));
    }

    return removed;
  }

  @Override
  public CompletableFuture<ChannelSession> getSession(final String phoneNumber) {
    final ChannelSession session = sessionsByPhoneNumber.get(phoneNumber);

    return session != null ?
        CompletableFuture.completedFuture(session) :
        CompletableFuture.failedFuture(new SessionNotFoundException());
  }

  @Override
  public <T> CompletableFuture<T> updateSession(final String phoneNumber,
      final Function<Optional<ChannelSession>, SessionUpdate<T>> updater) {

    final AtomicReference<SessionUpdate<T>> appliedUpdate = new AtomicReference<>();

    try {
      sessionsByPhoneNumber.compute(phoneNumber, (ignored, existingSession) -> {
        final SessionUpdate<T> update = updater.apply(Optional.ofNullable(existingSession));
        appliedUpdate.set(update);

        return switch (update.action()) {
          case STORE -> {
            final ChannelSession updatedSession = update.session();

            if (!phoneNumber.equals(updatedSession.phoneNumber())) {
              throw new IllegalArgumentException("Updated session must have the same phone number as its key");
            }

            if (updatedSession.lastMessageId() != null && (existingSession == null ||
                !Objects.equals(existingSession.lastMessageId(), updatedSession.lastMessageId()))) {

              if (existingSession != null && existingSession.lastMessageId() != null) {
                phoneNumbersByMessageId.remove(existingSession.lastMessageId(), phoneNumber);
              }

              phoneNumbersByMessageId.put(updatedSession.lastMessageId(), phoneNumber);
            }

            yield updatedSession;
          }

          case DELETE -> {
            if (existingSession != null && existingSession.lastMessageId() != null) {
              phoneNumbersByMessageId.remove(existingSession.lastMessageId(), phoneNumber);
            }

            yield null;
          }

          case NONE -> existingSession;
        };
      });
    } catch (final RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }

    return CompletableFuture.completedFuture(appliedUpdate.get().result());
  }

  @Override
  public CompletableFuture<Optional<String>> findPhoneNumberByMessageId(final String messageId) {
    return CompletableFuture.completedFuture(Optional.ofNullable(phoneNumbersByMessageId.get(messageId))
        .filter(phoneNumber -> {
          final ChannelSession session = sessionsByPhoneNumber.get(phoneNumber);
          return session != null && messageId.equals(session.lastMessageId());
        }));
  }

  @Override
  public CompletableFuture<List<ChannelSession>> getAllSessions() {
    return CompletableFuture.completedFuture(List.copyOf(sessionsByPhoneNumber.values()));
  }

  @VisibleForTesting
  int size() {
    return sessionsByPhoneNumber.size();
  }
}
