/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.manager;

import java.util.Optional;
import org.signal.channelauth.session.ChannelSession;

/**
 * A read-through cache of recently-read sessions. Cached sessions may be stale and must never be the basis of a
 * security decision; callers that change a session must invalidate its cache entry.
 * <p/>
 * Readers that populate the cache from the store take an invalidation count before reading and pass it back to
 * {@link #put(ChannelSession, long)}, which discards the session if the phone number's entry was invalidated in the
 * meantime.
 */
public interface SessionCache {

  Optional<ChannelSession> get(String phoneNumber);

  /**
   * Returns a value that changes whenever the given phone number's entry is invalidated.
   */
  long getInvalidationCount(String phoneNumber);

  /**
   * Caches the given session unless its phone number's entry was invalidated after the given invalidation count was
   * observed.
   */
  void put(ChannelSession session, long invalidationCount);

  void invalidate(String phoneNumber);
}
