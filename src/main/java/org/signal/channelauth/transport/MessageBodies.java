/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.transport;

import org.apache.commons.lang3.StringUtils;

public final class MessageBodies {

  /**
   * The longest message body, in characters, that providers will accept as a single (possibly multi-part) message.
   */
  public static final int MAX_BODY_LENGTH = 1600;

  private static final String ELLIPSIS = "...";

  private MessageBodies() {
  }

  /**
   * Shortens the given body to at most {@code maxLength} characters, breaking at the last word boundary that leaves
   * room for a trailing ellipsis.
   *
   * @param body the message body to shorten
   * @param maxLength the maximum length of the returned body
   *
   * @return the given body if it is short enough, or a truncated copy ending in an ellipsis otherwise
   */
  public static String truncate(final String body, final int maxLength) {
    if (body.length() <= maxLength) {
      return body;
    }

    final String prefix = body.substring(0, maxLength - ELLIPSIS.length());
    final int lastSpace = prefix.lastIndexOf(' ');

    return StringUtils.stripEnd(lastSpace > 0 ? prefix.substring(0, lastSpace) : prefix, null) + ELLIPSIS;
  }

  public static String truncate(final String body) {
    return truncate(body, MAX_BODY_LENGTH);
  }
}
