/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.code;

import io.micronaut.context.annotation.ConfigurationProperties;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

@ConfigurationProperties("one-time-codes")
public class OneTimeCodeConfiguration {

  @NotNull
  private Duration ttl = Duration.ofMinutes(10);

  public Duration getTtl() {
    return ttl;
  }

  public void setTtl(final Duration ttl) {
    this.ttl = ttl;
  }
}
