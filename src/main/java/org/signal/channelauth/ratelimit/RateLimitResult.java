/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.ratelimit;

import io.micronaut.core.annotation.Nullable;
import java.time.Instant;

/**
 * The result of checking (and, if permitted, recording) an authentication attempt.
 *
 * @param limited whether the attempt was refused because the attempt budget is exhausted
 * @param remainingAttempts the number of further attempts permitted within the current window
 * @param resetAt the time at which the window will reset; present only if the attempt was refused
 */
public record RateLimitResult(boolean limited, int remainingAttempts, @Nullable Instant resetAt) {

  public static RateLimitResult permitted(final int remainingAttempts) {
    return new RateLimitResult(false, remainingAttempts, null);
  }

  public static RateLimitResult refused(final Instant resetAt) {
    return new RateLimitResult(true, 0, resetAt);
  }
}
