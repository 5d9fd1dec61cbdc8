/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Indicates that some action was not permitted because a caller has attempted the action too many times within the
 * current window. Callers that receive this exception may retry the action after the time indicated by
 * {@link #getRetryAfterDuration()}.
 */
public class RateLimitExceededException extends Exception {

  private final Duration retryAfterDuration;
  private final Instant resetAt;

  public RateLimitExceededException(final Duration retryAfterDuration, final Instant resetAt) {
    super(null, null, true, false);

    this.retryAfterDuration = retryAfterDuration;
    this.resetAt = resetAt;
  }

  /**
   * Returns the amount of time the caller must wait before the action blocked by this exception might succeed.
   *
   * @return the amount of time the caller must wait before the action blocked by this exception might succeed
   */
  public Duration getRetryAfterDuration() {
    return retryAfterDuration;
  }

  public Instant getResetAt() {
    return resetAt;
  }
}
