/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.manager;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.inject.Singleton;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLongArray;
import org.signal.channelauth.session.ChannelSession;

@Singleton
class CaffeineSessionCache implements SessionCache {

  private final Cache<String, ChannelSession> sessionsByPhoneNumber;

  // Invalidation counts are shared by all phone numbers in a stripe
  private final AtomicLongArray invalidationCounts = new AtomicLongArray(INVALIDATION_STRIPES);

  private static final int INVALIDATION_STRIPES = 256;

  CaffeineSessionCache(final SessionCacheConfiguration configuration) {
    this.sessionsByPhoneNumber = Caffeine.newBuilder()
        .expireAfterWrite(configuration.getTtl())
        .maximumSize(configuration.getMaxSize())
        .build();
  }

  @Override
  public Optional<ChannelSession> get(final String phoneNumber) {
    return Optional.ofNullable(sessionsByPhoneNumber.getIfPresent(phoneNumber));
  }

  @Override
  public long getInvalidationCount(final String phoneNumber) {
    return invalidationCounts.get(getStripe(phoneNumber));
  }

  @Override
  public void put(final ChannelSession session, final long invalidationCount) {
    final int stripe = getStripe(session.phoneNumber());

    sessionsByPhoneNumber.asMap().compute(session.phoneNumber(), (ignored, cachedSession) ->
        invalidationCounts.get(stripe) == invalidationCount ? session : cachedSession);
  }

  @Override
  public void invalidate(final String phoneNumber) {
    // Counts change before eviction so a concurrent put either lands before the eviction or is discarded
    invalidationCounts.incrementAndGet(getStripe(phoneNumber));
    sessionsByPhoneNumber.invalidate(phoneNumber);
  }

  private static int getStripe(final String phoneNumber) {
    return Math.floorMod(phoneNumber.hashCode(), INVALIDATION_STRIPES);
  }
}
