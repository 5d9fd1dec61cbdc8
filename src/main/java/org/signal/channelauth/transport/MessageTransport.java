/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.transport;

import java.util.concurrent.CompletableFuture;

/**
 * A message transport sends text messages to phone numbers.
 */
public interface MessageTransport {

  /**
   * Sends a text message to the given phone number.
   *
   * @param phoneNumber the E.164-formatted destination
   * @param body the text of the message; bodies longer than the transport permits are truncated
   * @param trackDelivery whether the provider should report the channel over which the message was delivered
   *
   * @return a future that yields the provider's identifier for the sent message, or fails with a
   * {@link MessageRejectedException} if the provider permanently refused the message or an
   * {@link org.signal.channelauth.UpstreamUnavailableException} if the message could not be sent
   */
  CompletableFuture<String> send(String phoneNumber, String body, boolean trackDelivery);
}
