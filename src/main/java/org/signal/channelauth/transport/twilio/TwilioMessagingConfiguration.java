/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.transport.twilio;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Context;
import io.micronaut.core.annotation.Nullable;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Duration;

@Context
@ConfigurationProperties("twilio.messaging")
class TwilioMessagingConfiguration {

  @NotBlank
  private String messagingServiceSid;

  /**
   * The address to which Twilio reports delivery status (including the delivery channel) for tracked messages. If
   * absent, no messages are tracked.
   */
  @Nullable
  private URI statusCallbackUrl;

  @Min(0)
  private int maxRetries = 2;

  @NotNull
  private Duration minRetryWait = Duration.ofSeconds(1);

  public String getMessagingServiceSid() {
    return messagingServiceSid;
  }

  public void setMessagingServiceSid(final String messagingServiceSid) {
    this.messagingServiceSid = messagingServiceSid;
  }

  @Nullable
  public URI getStatusCallbackUrl() {
    return statusCallbackUrl;
  }

  public void setStatusCallbackUrl(@Nullable final URI statusCallbackUrl) {
    this.statusCallbackUrl = statusCallbackUrl;
  }

  /**
   * Returns the number of times a failed send may be retried after the first attempt.
   */
  public int getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(final int maxRetries) {
    this.maxRetries = maxRetries;
  }

  public Duration getMinRetryWait() {
    return minRetryWait;
  }

  public void setMinRetryWait(final Duration minRetryWait) {
    this.minRetryWait = minRetryWait;
  }
}
