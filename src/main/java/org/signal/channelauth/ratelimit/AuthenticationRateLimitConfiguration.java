/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.ratelimit;

import io.micronaut.context.annotation.ConfigurationProperties;
import jakarta.validation.constraints.Min;
import java.time.Duration;

@ConfigurationProperties("rate-limits.authentication")
public class AuthenticationRateLimitConfiguration {

  @Min(1)
  private int maxAttempts = 3;

  private Duration window = Duration.ofHours(1);

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(final int maxAttempts) {
    this.maxAttempts = maxAttempts;
  }

  public Duration getWindow() {
    return window;
  }

  public void setWindow(final Duration window) {
    this.window = window;
  }
}
