/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.code;

import jakarta.inject.Singleton;
import java.security.SecureRandom;

/**
 * Generates random six-digit one-time codes.
 */
@Singleton
public class OneTimeCodeGenerator {

  private final SecureRandom random = new SecureRandom();

  public String generateCode() {
    return String.format("%06d", random.nextInt(1_000_000));
  }
}
