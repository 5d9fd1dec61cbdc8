/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.session;

/**
 * Indicates that the backing session store could not complete an operation, generally because of a transient failure
 * like a timeout or lost connection.
 */
public class StoreUnavailableException extends Exception {

  public StoreUnavailableException(final Throwable cause) {
    super(cause);
  }
}
