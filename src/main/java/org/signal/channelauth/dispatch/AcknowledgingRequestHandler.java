/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.dispatch;

import jakarta.inject.Singleton;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.apache.commons.lang3.StringUtils;
import org.signal.channelauth.manager.UserContext;

/**
 * A request handler that acknowledges each request with the organization and role of the user who sent it. Replace
 * this bean to connect authenticated requests to a real back end.
 */
@Singleton
public class AcknowledgingRequestHandler implements AuthenticatedRequestHandler {

  private final ReplyMessageProvider replyMessageProvider;

  public AcknowledgingRequestHandler(final ReplyMessageProvider replyMessageProvider) {
    this.replyMessageProvider = replyMessageProvider;
  }

  @Override
  public CompletableFuture<String> handleRequest(final UserContext userContext, final String request) {
    return CompletableFuture.completedFuture(replyMessageProvider.getReply(ReplyMessageProvider.REQUEST_ACKNOWLEDGED,
        Map.of("organization", StringUtils.defaultIfBlank(userContext.organizationId(), "no organization"),
            "role", StringUtils.defaultIfBlank(userContext.role(), "member"))));
  }
}
