/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth;

import io.micronaut.runtime.Micronaut;

public class Application {

  public static void main(final String... args) {
    Micronaut.run(Application.class, args);
  }
}
