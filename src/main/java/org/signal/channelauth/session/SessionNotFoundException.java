/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.session;

/**
 * Indicates that no session exists for a given phone number.
 */
public class SessionNotFoundException extends Exception {

  public SessionNotFoundException() {
    super(null, null, true, false);
  }
}
