/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.session.redis;

import io.micronaut.context.annotation.ConfigurationProperties;
import java.time.Duration;

@ConfigurationProperties("redis-session-repository")
class RedisSessionRepositoryConfiguration {

  private String uri;

  private Duration commandTimeout = Duration.ofSeconds(1);

  private Duration messageIndexTtl = Duration.ofDays(2);

  private int maxUpdateAttempts = 5;

  public String getUri() {
    return uri;
  }

  public void setUri(final String uri) {
    this.uri = uri;
  }

  public Duration getCommandTimeout() {
    return commandTimeout;
  }

  public void setCommandTimeout(final Duration commandTimeout) {
    this.commandTimeout = commandTimeout;
  }

  /**
   * Returns the lifetime of an index entry mapping an outbound message identifier to a phone number. Delivery reports
   * for messages older than this will not find their sessions.
   */
  public Duration getMessageIndexTtl() {
    return messageIndexTtl;
  }

  public void setMessageIndexTtl(final Duration messageIndexTtl) {
    this.messageIndexTtl = messageIndexTtl;
  }

  /**
   * Returns the number of times an update function may be re-evaluated against fresh session state when a concurrent
   * writer changes a session between the read and the conditional write.
   */
  public int getMaxUpdateAttempts() {
    return maxUpdateAttempts;
  }

  public void setMaxUpdateAttempts(final int maxUpdateAttempts) {
    this.maxUpdateAttempts = maxUpdateAttempts;
  }
}
