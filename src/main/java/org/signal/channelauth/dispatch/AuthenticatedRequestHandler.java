/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.dispatch;

import java.util.concurrent.CompletableFuture;
import org.signal.channelauth.manager.UserContext;

/**
 * Handles requests from phone numbers with authenticated sessions over a trusted channel.
 */
public interface AuthenticatedRequestHandler {

  /**
   * Handles a request on behalf of the given user.
   *
   * @param userContext the identity of the user who sent the request
   * @param request the text of the request
   *
   * @return a future that yields the text of the reply to send to the user
   */
  CompletableFuture<String> handleRequest(UserContext userContext, String request);
}
