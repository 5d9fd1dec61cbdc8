/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.manager;

import io.micronaut.context.annotation.ConfigurationProperties;
import java.time.Duration;

@ConfigurationProperties("sessions.cache")
public class SessionCacheConfiguration {

  private Duration ttl = Duration.ofSeconds(30);

  private long maxSize = 10_000;

  public Duration getTtl() {
    return ttl;
  }

  public void setTtl(final Duration ttl) {
    this.ttl = ttl;
  }

  public long getMaxSize() {
    return maxSize;
  }

  public void setMaxSize(final long maxSize) {
    this.maxSize = maxSize;
  }
}
