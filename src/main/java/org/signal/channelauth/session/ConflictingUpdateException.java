/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.session;

import java.util.function.Function;

/**
 * Indicates that a call to {@link SessionRepository#updateSession(String, Function)} failed because other processes
 * repeatedly modified the same session while the update was being evaluated.
 */
public class ConflictingUpdateException extends Exception {

  public ConflictingUpdateException() {
    super(null, null, true, false);
  }
}
