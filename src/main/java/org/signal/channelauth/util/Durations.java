/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.util;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

public final class Durations {

  private Durations() {
  }

  /**
   * Tests whether a duration has a non-zero, non-negative magnitude. Note that {@code Duration#isPositive()} is part
   * of the Java Duration API as of Java 18.
   *
   * @return {@code true} if the given duration has a non-zero, non-negative magnitude or {@code false} otherwise
   */
  public static boolean isPositive(final Duration duration) {
    return !(duration.isZero() || duration.isNegative());
  }

  /**
   * Returns the number of whole minutes in the given duration, rounded up, and never less than zero.
   */
  public static long toMinutesRoundedUp(final Duration duration) {
    if (!isPositive(duration)) {
      return 0;
    }

    final long minutes = duration.toMinutes();
    return duration.equals(Duration.of(minutes, ChronoUnit.MINUTES)) ? minutes : minutes + 1;
  }
}
