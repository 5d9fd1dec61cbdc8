/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth;

/**
 * Indicates that an upstream collaborator (an identity provider or message transport) could not complete a request
 * because of a transient failure. Callers may try again later.
 */
public class UpstreamUnavailableException extends Exception {

  public UpstreamUnavailableException(final String message) {
    super(message);
  }

  public UpstreamUnavailableException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
