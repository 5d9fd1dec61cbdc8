/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.session;

import java.util.Set;

/**
 * Published after a retention sweep deletes sessions or clears their expired codes.
 *
 * @param phoneNumbers the phone numbers whose sessions were deleted or changed by the sweep
 */
public record SessionsSweptEvent(Set<String> phoneNumbers) {
}
