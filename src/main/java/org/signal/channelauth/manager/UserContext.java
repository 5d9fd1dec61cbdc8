/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.manager;

import io.micronaut.core.annotation.Nullable;
import java.time.Instant;
import java.util.Map;

/**
 * The identity and authorization attributes of the user bound to an authenticated session.
 *
 * @param userId the identity provider's identifier for the user
 * @param email the user's email address
 * @param phoneNumber the phone number of the session
 * @param organizationId the user's organization, if any
 * @param role the user's role within its organization, if any
 * @param sessionExpiresAt the time at which the session's authentication expires
 * @param metadata opaque caller-defined context from the session
 */
public record UserContext(String userId,
                          @Nullable String email,
                          String phoneNumber,
                          @Nullable String organizationId,
                          @Nullable String role,
                          Instant sessionExpiresAt,
                          Map<String, String> metadata) {
}
