/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.dispatch;

import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import java.util.concurrent.CompletableFuture;
import org.apache.commons.lang3.StringUtils;
import org.signal.channelauth.manager.SessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies delivery reports for tracked outbound messages to the channel state of the sessions that sent them.
 */
@Singleton
public class DeliveryStatusHandler {

  private final SessionManager sessionManager;

  private static final Logger logger = LoggerFactory.getLogger(DeliveryStatusHandler.class);

  public DeliveryStatusHandler(final SessionManager sessionManager) {
    this.sessionManager = sessionManager;
  }

  /**
   * Handles a delivery report. Reports without a channel prefix carry no channel information and are ignored.
   *
   * @param messageId the transport's identifier for the outbound message
   * @param status the transport's delivery status for the message (for example, {@code delivered})
   * @param channelPrefix the channel over which the message was delivered
   *
   * @return a future that yields {@code true} if the report changed a session's channel state
   */
  public CompletableFuture<Boolean> handleDeliveryStatus(final String messageId,
      @Nullable final String status,
      @Nullable final String channelPrefix) {

    if (StringUtils.isBlank(channelPrefix)) {
      logger.debug("Ignoring {} report for {} without a channel prefix", status, messageId);
      return CompletableFuture.completedFuture(false);
    }

    return sessionManager.applyDeliveryStatus(messageId, channelPrefix)
        .thenApply(maybeTransition -> {
          maybeTransition.ifPresent(applied -> logger.debug("{} report for {} moved session from {} to {}",
              status, messageId, applied.previousChannelType(), applied.transition().state().channelType()));

          return maybeTransition.isPresent();
        });
  }
}
