/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.session.redis;

import com.google.common.annotations.VisibleForTesting;
import io.lettuce.core.RedisException;
import io.lettuce.core.ScanArgs;
import io.lettuce.core.ScanStream;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.SetArgs;
import io.lettuce.core.api.StatefulRedisConnection;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventPublisher;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import org.signal.channelauth.metrics.MetricsUtil;
import org.signal.channelauth.session.ChannelSession;
import org.signal.channelauth.session.ConflictingUpdateException;
import org.signal.channelauth.session.SessionNotFoundException;
import org.signal.channelauth.session.SessionRepository;
import org.signal.channelauth.session.SessionRetentionPolicy;
import org.signal.channelauth.session.SessionUpdate;
import org.signal.channelauth.session.SessionsSweptEvent;
import org.signal.channelauth.session.StoreUnavailableException;
import org.signal.channelauth.util.CompletionExceptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * A session repository that stores session data in a single (i.e. non-clustered) Redis instance.
 * <p/>
 * This repository stores one JSON-encoded session per key (see {@link #getSessionKey(String)}). Updates read the
 * current session, evaluate the caller's update function, and then apply the result with a compare-and-set script. If
 * another writer changed the session in the meantime, the update function is evaluated again against the fresh state
 * up to a configured number of times before the update fails with a {@link ConflictingUpdateException}.
 * <p/>
 * When a session names an outbound message, the repository also maintains an index entry from the message identifier
 * to the session's phone number so that delivery reports can find their sessions. Index entries expire on their own and
 * are only ever treated as hints; a lookup always confirms that the session still names the message.
 */
@Singleton
@Requires(property = "redis-session-repository.uri")
class RedisSessionRepository implements SessionRepository {

  private final StatefulRedisConnection<byte[], byte[]> redisConnection;
  private final ChannelSessionCodec codec;
  private final SessionRetentionPolicy retentionPolicy;
  private final ApplicationEventPublisher<SessionsSweptEvent> sweptEventPublisher;
  private final RedisSessionRepositoryConfiguration configuration;
  private final Clock clock;

  private final RedisLuaScript compareAndSetSessionScript;

  @VisibleForTesting
  static final String SESSION_KEY_PREFIX = "channel-session::";
  private static final String MESSAGE_INDEX_KEY_PREFIX = "channel-message::";

  private static final byte[] ABSENT = new byte[0];

  private static final Timer GET_SESSION_TIMER =
      Metrics.timer(MetricsUtil.name(RedisSessionRepository.class, "getSession"));
  private static final Timer UPDATE_SESSION_TIMER =
      Metrics.timer(MetricsUtil.name(RedisSessionRepository.class, "updateSession"));

  private static final Logger logger = LoggerFactory.getLogger(RedisSessionRepository.class);

  RedisSessionRepository(final StatefulRedisConnection<byte[], byte[]> redisConnection,
      final ChannelSessionCodec codec,
      final SessionRetentionPolicy retentionPolicy,
      final ApplicationEventPublisher<SessionsSweptEvent> sweptEventPublisher,
      final RedisSessionRepositoryConfiguration configuration,
      final Clock clock) throws IOException {

    this.redisConnection = redisConnection;
    this.codec = codec;
    this.retentionPolicy = retentionPolicy;
    this.sweptEventPublisher = sweptEventPublisher;
    this.configuration = configuration;
    this.clock = clock;

    this.compareAndSetSessionScript =
        RedisLuaScript.fromResource(getClass(), "compare-and-set-session.lua", ScriptOutputType.BOOLEAN);
  }

  @Scheduled(fixedDelay = "${session-retention.sweep-interval:1h}")
  @VisibleForTesting
  long removeExpiredSessions() {
    final Instant now = clock.instant();

    final Map<String, SessionRetentionPolicy.Outcome> changes = scanPhoneNumbers()
        .flatMap(phoneNumber ->
            Mono.fromFuture(() -> updateSession(phoneNumber, maybeSession -> retentionPolicy.sweep(maybeSession, now)))
                .map(outcome -> Map.entry(phoneNumber, outcome))
                .onErrorResume(throwable -> {
                  logger.warn("Failed to apply retention policy to session", CompletionExceptions.unwrap(throwable));
                  return Mono.empty();
                }))
        .filter(entry -> entry.getValue() != SessionRetentionPolicy.Outcome.RETAINED)
        .collectMap(Map.Entry::getKey, Map.Entry::getValue)
        .blockOptional()
        .orElse(Map.of());

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
    final Timer.Sample sample = Timer.start();

    return redisConnection.async().get(getSessionKey(phoneNumber))
        .thenApply(sessionBytes -> {
          if (sessionBytes != null) {
            return codec.decode(sessionBytes);
          } else {
            throw new CompletionException(new SessionNotFoundException());
          }
        })
        .toCompletableFuture()
        .handle(RedisSessionRepository::translateRedisException)
        .whenComplete((session, throwable) -> sample.stop(GET_SESSION_TIMER));
  }

  @Override
  public <T> CompletableFuture<T> updateSession(final String phoneNumber,
      final Function<Optional<ChannelSession>, SessionUpdate<T>> updater) {

    final Timer.Sample sample = Timer.start();

    return updateSession(phoneNumber, updater, configuration.getMaxUpdateAttempts())
        .handle(RedisSessionRepository::translateRedisException)
        .whenComplete((result, throwable) -> sample.stop(UPDATE_SESSION_TIMER));
  }

  private <T> CompletableFuture<T> updateSession(final String phoneNumber,
      final Function<Optional<ChannelSession>, SessionUpdate<T>> updater,
      final int remainingAttempts) {

    final byte[] sessionKey = getSessionKey(phoneNumber);

    return redisConnection.async().get(sessionKey).toCompletableFuture()
        .thenCompose(existingSessionBytes -> {
          final Optional<ChannelSession> maybeExistingSession =
              Optional.ofNullable(existingSessionBytes).map(codec::decode);

          final SessionUpdate<T> update = updater.apply(maybeExistingSession);

          if (update.action() == SessionUpdate.Action.NONE) {
            return CompletableFuture.completedFuture(update.result());
          }

          final byte[] updatedSessionBytes;

          if (update.action() == SessionUpdate.Action.STORE) {
            if (!phoneNumber.equals(update.session().phoneNumber())) {
              throw new IllegalArgumentException("Updated session must have the same phone number as its key");
            }

            updatedSessionBytes = codec.encode(update.session());
          } else {
            updatedSessionBytes = ABSENT;
          }

          final CompletableFuture<Boolean> compareAndSetFuture =
              compareAndSetSessionScript.execute(redisConnection, new byte[][] { sessionKey },
                  existingSessionBytes != null ? existingSessionBytes : ABSENT, updatedSessionBytes);

          return compareAndSetFuture.thenCompose(applied -> {
            if (applied) {
              return updateMessageIndex(phoneNumber, maybeExistingSession.orElse(null), update)
                  .thenApply(ignored -> update.result());
            } else if (remainingAttempts > 1) {
              return updateSession(phoneNumber, updater, remainingAttempts - 1);
            } else {
              return CompletableFuture.failedFuture(new ConflictingUpdateException());
            }
          });
        });
  }

  private CompletableFuture<Void> updateMessageIndex(final String phoneNumber,
      @Nullable final ChannelSession existingSession,
      final SessionUpdate<?> update) {

    if (update.action() == SessionUpdate.Action.STORE) {
      final String messageId = update.session().lastMessageId();

      if (messageId != null && (existingSession == null || !messageId.equals(existingSession.lastMessageId()))) {
        return redisConnection.async().set(getMessageIndexKey(messageId),
                phoneNumber.getBytes(StandardCharsets.UTF_8),
                SetArgs.Builder.px(configuration.getMessageIndexTtl()))
            .thenAccept(ignored -> {})
            .toCompletableFuture();
      }
    } else if (update.action() == SessionUpdate.Action.DELETE
        && existingSession != null && existingSession.lastMessageId() != null) {

      return redisConnection.async().del(getMessageIndexKey(existingSession.lastMessageId()))
          .thenAccept(ignored -> {})
          .toCompletableFuture();
    }

    return CompletableFuture.completedFuture(null);
  }

  @Override
  public CompletableFuture<Optional<String>> findPhoneNumberByMessageId(final String messageId) {
    return redisConnection.async().get(getMessageIndexKey(messageId)).toCompletableFuture()
        .thenCompose(phoneNumberBytes -> {
          if (phoneNumberBytes == null) {
            return CompletableFuture.completedFuture(Optional.<String>empty());
          }

          final String phoneNumber = new String(phoneNumberBytes, StandardCharsets.UTF_8);

          return redisConnection.async().get(getSessionKey(phoneNumber)).toCompletableFuture()
              .thenApply(sessionBytes -> Optional.ofNullable(sessionBytes)
                  .map(codec::decode)
                  .filter(session -> messageId.equals(session.lastMessageId()))
                  .map(ChannelSession::phoneNumber));
        })
        .handle(RedisSessionRepository::translateRedisException);
  }

  @Override
  public CompletableFuture<List<ChannelSession>> getAllSessions() {
    return ScanStream.scan(redisConnection.reactive(), ScanArgs.Builder.matches(SESSION_KEY_PREFIX + "*"))
        .flatMap(sessionKey -> redisConnection.reactive().get(sessionKey))
        .map(codec::decode)
        .collectList()
        .toFuture()
        .handle(RedisSessionRepository::translateRedisException);
  }

  private Flux<String> scanPhoneNumbers() {
    return ScanStream.scan(redisConnection.reactive(), ScanArgs.Builder.matches(SESSION_KEY_PREFIX + "*"))
        .map(sessionKey -> new String(sessionKey, StandardCharsets.UTF_8).substring(SESSION_KEY_PREFIX.length()));
  }

  private static <T> T translateRedisException(final T result, final Throwable throwable) {
    if (throwable == null) {
      return result;
    }

    final Throwable unwrapped = CompletionExceptions.unwrap(throwable);

    if (unwrapped instanceof RedisException) {
      throw new CompletionException(new StoreUnavailableException(unwrapped));
    }

    throw CompletionExceptions.wrap(unwrapped);
  }

  @VisibleForTesting
  static byte[] getSessionKey(final String phoneNumber) {
    return (SESSION_KEY_PREFIX + phoneNumber).getBytes(StandardCharsets.UTF_8);
  }

  private static byte[] getMessageIndexKey(final String messageId) {
    return (MESSAGE_INDEX_KEY_PREFIX + messageId).getBytes(StandardCharsets.UTF_8);
  }
}
