/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.manager;

import io.micronaut.context.event.ApplicationEventListener;
import jakarta.inject.Singleton;
import org.signal.channelauth.session.SessionsSweptEvent;

/**
 * Evicts cached sessions that a retention sweep deleted or changed.
 */
@Singleton
class SessionCacheSweepListener implements ApplicationEventListener<SessionsSweptEvent> {

  private final SessionCache sessionCache;

  SessionCacheSweepListener(final SessionCache sessionCache) {
    this.sessionCache = sessionCache;
  }

  @Override
  public void onApplicationEvent(final SessionsSweptEvent event) {
    event.phoneNumbers().forEach(sessionCache::invalidate);
  }
}
