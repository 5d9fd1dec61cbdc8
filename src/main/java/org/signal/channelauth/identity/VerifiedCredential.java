/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.identity;

import java.time.Duration;

/**
 * A verified identity and the bearer token issued for it.
 *
 * @param userId the provider's identifier for the user
 * @param email the verified email address
 * @param accessToken the bearer token
 * @param expiresIn the lifetime of the bearer token
 */
public record VerifiedCredential(String userId, String email, String accessToken, Duration expiresIn) {

  @Override
  public String toString() {
    return "VerifiedCredential{userId=" + userId + ", expiresIn=" + expiresIn + '}';
  }
}
