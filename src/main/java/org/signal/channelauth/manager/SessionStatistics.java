/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.manager;

import java.time.Duration;
import java.util.Map;
import org.signal.channelauth.session.AuthMethod;

/**
 * A snapshot of currently-authenticated sessions.
 *
 * @param activeSessions the number of authenticated, unexpired sessions
 * @param sessionsByAuthMethod the number of active sessions authenticated by each method
 * @param averageSessionAge the mean time since authentication of active sessions; zero if there are none
 */
public record SessionStatistics(long activeSessions,
                                Map<AuthMethod, Long> sessionsByAuthMethod,
                                Duration averageSessionAge) {
}
