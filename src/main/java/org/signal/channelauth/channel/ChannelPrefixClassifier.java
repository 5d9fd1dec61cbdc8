/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.channel;

import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;

/**
 * Maps the channel prefixes reported by the messaging provider (for example, "RCS" for rich messaging or "SM" for plain
 * SMS) to channel observations.
 */
@Singleton
public class ChannelPrefixClassifier {

  private final Set<String> trustedPrefixes;
  private final Set<String> untrustedPrefixes;

  public ChannelPrefixClassifier(final ChannelTrustConfiguration configuration) {
    this.trustedPrefixes = normalize(configuration.getTrustedPrefixes());
    this.untrustedPrefixes = normalize(configuration.getUntrustedPrefixes());
  }

  /**
   * Returns the channel observation indicated by the given prefix.
   *
   * @param channelPrefix the prefix reported by the provider
   *
   * @return the corresponding observation, or empty if the prefix is absent or not recognized
   */
  public Optional<ChannelEvent> classify(@Nullable final String channelPrefix) {
    if (StringUtils.isBlank(channelPrefix)) {
      return Optional.empty();
    }

    final String normalized = channelPrefix.trim().toUpperCase(Locale.ROOT);

    if (trustedPrefixes.contains(normalized)) {
      return Optional.of(ChannelEvent.TRUSTED_CHANNEL_OBSERVED);
    } else if (untrustedPrefixes.contains(normalized)) {
      return Optional.of(ChannelEvent.UNTRUSTED_CHANNEL_OBSERVED);
    }

    return Optional.empty();
  }

  public boolean isTrusted(@Nullable final String channelPrefix) {
    return classify(channelPrefix).filter(event -> event == ChannelEvent.TRUSTED_CHANNEL_OBSERVED).isPresent();
  }

  private static Set<String> normalize(final List<String> prefixes) {
    return prefixes.stream()
        .map(prefix -> prefix.trim().toUpperCase(Locale.ROOT))
        .collect(Collectors.toUnmodifiableSet());
  }
}
