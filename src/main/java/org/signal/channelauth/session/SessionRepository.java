/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.session;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * A session repository stores and retrieves the single {@link ChannelSession} associated with each phone number.
 * <p/>
 * Session repositories are the only point of serialization between concurrent request handlers. Every change to a
 * stored session is made by way of {@link #updateSession(String, Function)}, which must evaluate its update function
 * against the current stored state of the session and apply the result as a single atomic conditional operation keyed
 * by phone number: an update must never be applied on top of a version of the session other than the one the update
 * function observed. Updates to sessions for different phone numbers must not block one another.
 * <p/>
 * Session repositories must also periodically remove sessions according to a {@link SessionRetentionPolicy}.
 */
public interface SessionRepository {

  /**
   * Returns the session stored for the given phone number.
   *
   * @param phoneNumber the E.164-formatted phone number for which to retrieve a session
   *
   * @return a future that yields the stored session or fails with a {@link SessionNotFoundException} if no session
   * exists for the given phone number; may also fail with a {@link StoreUnavailableException}
   */
  CompletableFuture<ChannelSession> getSession(String phoneNumber);

  /**
   * Atomically evaluates the given update function against the current state of the session for the given phone number
   * and applies the resulting change. The update function receives an empty optional if no session currently exists.
   * Implementations may evaluate the update function more than once if the stored session changes during evaluation;
   * update functions must therefore be free of side effects and derive their decisions only from their argument.
   *
   * @param phoneNumber the E.164-formatted phone number that identifies the session to update
   * @param updater a function that accepts the current session (if any) and returns the change to apply
   *
   * @return a future that yields the result of the applied update; may fail with a
   * {@link ConflictingUpdateException} if the update could not be applied because of concurrent modification or with a
   * {@link StoreUnavailableException}
   *
   * @param <T> the type of result produced by the update function
   */
  <T> CompletableFuture<T> updateSession(String phoneNumber,
      Function<Optional<ChannelSession>, SessionUpdate<T>> updater);

  /**
   * Resolves the phone number of the session whose most recent tracked outbound message had the given identifier.
   *
   * @param messageId the provider-assigned identifier of an outbound message
   *
   * @return a future that yields the phone number associated with the given message, or empty if no session recorded
   * the given message as its most recent outbound message
   */
  CompletableFuture<Optional<String>> findPhoneNumberByMessageId(String messageId);

  /**
   * Returns a snapshot of all stored sessions. This operation may be expensive and is intended for monitoring only.
   *
   * @return a future that yields all currently-stored sessions
   */
  CompletableFuture<List<ChannelSession>> getAllSessions();
}
