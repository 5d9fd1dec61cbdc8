/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.dispatch;

import io.micronaut.core.annotation.Nullable;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The commands a sender may issue in the body of an inbound message.
 */
public enum Commands {
  LOGIN,
  LOGOUT,
  CODE,
  NONE;

  private static final Set<String> LOGIN_WORDS = Set.of("LOGIN", "SIGNIN", "AUTH", "AUTHENTICATE");
  private static final Set<String> LOGOUT_WORDS = Set.of("LOGOUT", "SIGNOUT", "EXIT", "QUIT");

  private static final Pattern CODE_PATTERN = Pattern.compile("^\\d{6}$");

  public static Commands parse(@Nullable final String body) {
    if (body == null) {
      return NONE;
    }

    final String trimmed = body.trim();
    final String upper = trimmed.toUpperCase(Locale.ROOT);

    if (LOGIN_WORDS.contains(upper)) {
      return LOGIN;
    } else if (LOGOUT_WORDS.contains(upper)) {
      return LOGOUT;
    } else if (CODE_PATTERN.matcher(trimmed).matches()) {
      return CODE;
    }

    return NONE;
  }
}
