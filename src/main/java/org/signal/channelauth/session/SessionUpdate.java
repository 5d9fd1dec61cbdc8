/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.session;

import io.micronaut.core.annotation.Nullable;

/**
 * The outcome of evaluating an update function against the current state of a stored session. A session update tells
 * a {@link SessionRepository} whether to store a new version of a session, delete the session, or leave the stored
 * session untouched, and carries a caller-defined result that the repository returns once the update has been applied.
 *
 * @param action the change to apply to the stored session
 * @param session the new version of the session to store; must be non-null if and only if {@code action} is
 *                {@link Action#STORE}
 * @param result the value to yield to the caller once the update has been applied
 *
 * @param <T> the type of result produced by the update
 */
public record SessionUpdate<T>(Action action, @Nullable ChannelSession session, @Nullable T result) {

  public enum Action {
    STORE,
    DELETE,
    NONE
  }

  public SessionUpdate {
    if ((action == Action.STORE) != (session != null)) {
      throw new IllegalArgumentException("A session must be provided if and only if the session will be stored");
    }
  }

  public static <T> SessionUpdate<T> store(final ChannelSession session, @Nullable final T result) {
    return new SessionUpdate<>(Action.STORE, session, result);
  }

  public static <T> SessionUpdate<T> delete(@Nullable final T result) {
    return new SessionUpdate<>(Action.DELETE, null, result);
  }

  public static <T> SessionUpdate<T> none(@Nullable final T result) {
    return new SessionUpdate<>(Action.NONE, null, result);
  }
}
