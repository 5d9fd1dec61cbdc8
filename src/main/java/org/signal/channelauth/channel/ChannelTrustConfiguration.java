/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.channel;

import io.micronaut.context.annotation.ConfigurationProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

@ConfigurationProperties("channel-trust")
public class ChannelTrustConfiguration {

  @NotEmpty
  private List<@NotBlank String> trustedPrefixes = List.of("RCS");

  private List<@NotBlank String> untrustedPrefixes = List.of("SM", "MM");

  public List<String> getTrustedPrefixes() {
    return trustedPrefixes;
  }

  public void setTrustedPrefixes(final List<String> trustedPrefixes) {
    this.trustedPrefixes = trustedPrefixes;
  }

  public List<String> getUntrustedPrefixes() {
    return untrustedPrefixes;
  }

  public void setUntrustedPrefixes(final List<String> untrustedPrefixes) {
    this.untrustedPrefixes = untrustedPrefixes;
  }
}
