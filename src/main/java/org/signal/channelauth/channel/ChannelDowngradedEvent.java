/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.channel;

import org.signal.channelauth.session.ChannelSession;

/**
 * Published when a session's authentication is revoked because it was reached over an untrusted channel after having
 * been reached over a trusted one.
 *
 * @param session the session after revocation
 * @param detectedBy how the downgrade was detected
 */
public record ChannelDowngradedEvent(ChannelSession session, DetectionSource detectedBy) {

  public enum DetectionSource {
    DELIVERY_REPORT,
    INBOUND_MESSAGE
  }
}
