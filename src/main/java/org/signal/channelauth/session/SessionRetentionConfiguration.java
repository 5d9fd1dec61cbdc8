/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.session;

import io.micronaut.context.annotation.ConfigurationProperties;
import java.time.Duration;

@ConfigurationProperties("session-retention")
public class SessionRetentionConfiguration {

  private Duration expiredGrace = Duration.ofDays(30);

  private Duration downgradedGrace = Duration.ofDays(1);

  public Duration getExpiredGrace() {
    return expiredGrace;
  }

  public void setExpiredGrace(final Duration expiredGrace) {
    this.expiredGrace = expiredGrace;
  }

  public Duration getDowngradedGrace() {
    return downgradedGrace;
  }

  public void setDowngradedGrace(final Duration downgradedGrace) {
    this.downgradedGrace = downgradedGrace;
  }
}
