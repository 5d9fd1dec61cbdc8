/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.dispatch;

import jakarta.inject.Singleton;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.apache.commons.lang3.StringUtils;

/**
 * An email directory backed by a static list of phone number assignments from configuration.
 */
@Singleton
public class ConfiguredEmailDirectory implements EmailDirectory {

  private final Map<String, String> emailsByPhoneNumber;

  public ConfiguredEmailDirectory(final EmailDirectoryConfiguration configuration) {
    this(configuration.getAssignments());
  }

  ConfiguredEmailDirectory(final List<String> assignments) {
    final Map<String, String> emails = new HashMap<>();

    for (final String assignment : assignments) {
      final String phoneNumber = PhoneNumbers.normalize(StringUtils.substringBefore(assignment, "="))
          .orElseThrow(() -> new IllegalArgumentException("Invalid phone number in assignment: " + assignment));

      final String email = StringUtils.trimToNull(StringUtils.substringAfter(assignment, "="));

      if (email == null || !email.contains("@")) {
        throw new IllegalArgumentException(
            "Invalid email address in assignment for " + PhoneNumbers.redact(phoneNumber));
      }

      emails.put(phoneNumber, email);
    }

    this.emailsByPhoneNumber = Map.copyOf(emails);
  }

  @Override
  public CompletableFuture<Optional<String>> findEmail(final String phoneNumber) {
    return CompletableFuture.completedFuture(Optional.ofNullable(emailsByPhoneNumber.get(phoneNumber)));
  }
}
