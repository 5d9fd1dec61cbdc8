/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.transport.twilio;

import com.twilio.exception.ApiConnectionException;
import com.twilio.exception.ApiException;
import io.micronaut.core.annotation.Nullable;
import java.util.Set;
import org.signal.channelauth.UpstreamUnavailableException;
import org.signal.channelauth.transport.MessageRejectedException;
import org.signal.channelauth.util.CompletionExceptions;

/**
 * Classifies errors reported by the Twilio API.
 */
class ApiExceptions {

  // Refusals that no amount of retrying will change
  private static final Set<Integer> PERMANENT_ERROR_CODES = Set.of(
      21211, // Invalid 'to' phone number
      21408, // Permission to send an SMS has not been enabled for the region indicated by the 'To' number
      21610, // Attempt to send to unsubscribed recipient
      21614  // 'To' number is not a valid mobile number
  );

  private ApiExceptions() {}

  static @Nullable String extractErrorCode(@Nullable final Throwable throwable) {
    if (throwable != null && CompletionExceptions.unwrap(throwable) instanceof ApiException apiException) {
      return String.valueOf(apiException.getCode());
    }

    return null;
  }

  /**
   * Tests whether a failed request may succeed if sent again. Connection failures and API errors are retriable unless
   * the API error is known to be permanent.
   */
  static boolean isRetriable(final Throwable throwable) {
    final Throwable unwrapped = CompletionExceptions.unwrap(throwable);

    if (unwrapped instanceof ApiConnectionException) {
      return true;
    }

    if (unwrapped instanceof ApiException apiException) {
      return apiException.getCode() == null || !PERMANENT_ERROR_CODES.contains(apiException.getCode());
    }

    return false;
  }

  /**
   * Converts a Twilio API error to a {@link MessageRejectedException} if the error is permanent or to an
   * {@link UpstreamUnavailableException} otherwise. Throwables that did not come from the Twilio API are returned
   * unchanged.
   */
  static Throwable toTransportException(final Throwable throwable) {
    final Throwable unwrapped = CompletionExceptions.unwrap(throwable);

    if (unwrapped instanceof ApiException apiException) {
      if (apiException.getCode() != null && PERMANENT_ERROR_CODES.contains(apiException.getCode())) {
        return new MessageRejectedException("Twilio rejected message with error code " + apiException.getCode(),
            apiException);
      }

      return new UpstreamUnavailableException("Failed to send message via Twilio", apiException);
    }

    return unwrapped;
  }
}
