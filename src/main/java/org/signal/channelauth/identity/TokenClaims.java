/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.identity;

import io.micronaut.core.annotation.Nullable;

/**
 * The claims of a validated bearer token's subject.
 *
 * @param userId the provider's identifier for the user
 * @param email the user's email address, if known
 * @param organizationId the identifier of the organization to which the user belongs, if any
 * @param role the user's role within its organization, if any
 */
public record TokenClaims(String userId,
                          @Nullable String email,
                          @Nullable String organizationId,
                          @Nullable String role) {
}
