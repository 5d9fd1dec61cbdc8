/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.dispatch;

import io.micronaut.core.annotation.Nullable;

/**
 * A text message received from a phone number.
 *
 * @param from the sender's address as reported by the message transport
 * @param body the text of the message
 * @param messageId the transport's identifier for the message
 * @param channelPrefix the transport's indicator of the channel over which the message arrived (for example,
 *                      {@code RCS} or {@code SM}); may be absent for transports that do not report channels
 */
public record InboundMessage(String from, String body, @Nullable String messageId, @Nullable String channelPrefix) {
}
