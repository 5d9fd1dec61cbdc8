/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.manager;

import io.micronaut.context.annotation.ConfigurationProperties;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.signal.channelauth.session.AuthMethod;

@ConfigurationProperties("sessions")
public class SessionConfiguration {

  @NotNull
  private Duration duration = Duration.ofDays(7);

  private boolean trustRequired = true;

  @NotNull
  private AuthMethod defaultAuthMethod = AuthMethod.MAGIC_LINK;

  /**
   * Returns the lifetime of an authentication for sessions that were not created with a lifetime of their own. Must
   * be a whole, positive number of days.
   */
  public Duration getDuration() {
    return duration;
  }

  public void setDuration(final Duration duration) {
    this.duration = duration;
  }

  public int getDurationDays() {
    return Math.max(1, (int) duration.toDays());
  }

  /**
   * Returns whether new authentication cycles require a trusted channel for the resulting session to remain
   * authenticated.
   */
  public boolean isTrustRequired() {
    return trustRequired;
  }

  public void setTrustRequired(final boolean trustRequired) {
    this.trustRequired = trustRequired;
  }

  public AuthMethod getDefaultAuthMethod() {
    return defaultAuthMethod;
  }

  public void setDefaultAuthMethod(final AuthMethod defaultAuthMethod) {
    this.defaultAuthMethod = defaultAuthMethod;
  }
}
