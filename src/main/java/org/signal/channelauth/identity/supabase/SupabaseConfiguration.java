/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.identity.supabase;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Context;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Duration;

@Context
@ConfigurationProperties("supabase")
class SupabaseConfiguration {

  @NotNull
  private URI url;

  @NotBlank
  private String serviceRoleKey;

  @NotNull
  private URI magicLinkRedirectUrl;

  private Duration requestTimeout = Duration.ofSeconds(10);

  public URI getUrl() {
    return url;
  }

  public void setUrl(final URI url) {
    this.url = url;
  }

  public String getServiceRoleKey() {
    return serviceRoleKey;
  }

  public void setServiceRoleKey(final String serviceRoleKey) {
    this.serviceRoleKey = serviceRoleKey;
  }

  /**
   * Returns the address to which magic links send users after they have been verified. The requesting phone number is
   * appended as a {@code phone} query parameter.
   */
  public URI getMagicLinkRedirectUrl() {
    return magicLinkRedirectUrl;
  }

  public void setMagicLinkRedirectUrl(final URI magicLinkRedirectUrl) {
    this.magicLinkRedirectUrl = magicLinkRedirectUrl;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  public void setRequestTimeout(final Duration requestTimeout) {
    this.requestTimeout = requestTimeout;
  }
}
