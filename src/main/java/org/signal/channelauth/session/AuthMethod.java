/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.session;

/**
 * The means by which the owner of an email identity proves control of that identity for a phone number session.
 */
public enum AuthMethod {
  MAGIC_LINK,
  ONE_TIME_CODE
}
