/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.transport.twilio;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.twilio.exception.ApiConnectionException;
import com.twilio.exception.ApiException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Test;
import org.signal.channelauth.UpstreamUnavailableException;
import org.signal.channelauth.transport.MessageRejectedException;

class ApiExceptionsTest {

  @Test
  void extractErrorCode() {
    final ApiException apiException = apiException(21211);

    assertEquals("21211", ApiExceptions.extractErrorCode(apiException));
    assertEquals("21211", ApiExceptions.extractErrorCode(new CompletionException(apiException)));
    assertNull(ApiExceptions.extractErrorCode(new UncheckedIOException(new IOException())));
    assertNull(ApiExceptions.extractErrorCode(null));
  }

  @Test
  void isRetriable() {
    assertTrue(ApiExceptions.isRetriable(new ApiConnectionException("timeout")));
    assertTrue(ApiExceptions.isRetriable(new CompletionException(apiException(20500))));
    assertTrue(ApiExceptions.isRetriable(new ApiException("no code")));
    assertFalse(ApiExceptions.isRetriable(apiException(21610)));
    assertFalse(ApiExceptions.isRetriable(new IllegalStateException()));
  }

  @Test
  void toTransportException() {
    assertInstanceOf(MessageRejectedException.class,
        ApiExceptions.toTransportException(new CompletionException(apiException(21614))));

    assertInstanceOf(UpstreamUnavailableException.class, ApiExceptions.toTransportException(apiException(20429)));

    final IllegalStateException unrelated = new IllegalStateException();
    assertSame(unrelated, ApiExceptions.toTransportException(new CompletionException(unrelated)));
  }

  private static ApiException apiException(final int code) {
    return new ApiException("test", code, null, 400, null);
  }
}
