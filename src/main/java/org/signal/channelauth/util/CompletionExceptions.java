/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class CompletionExceptions {

  private CompletionExceptions() {
  }

  /**
   * Returns the first cause in the given throwable's causal chain that is neither a {@link CompletionException} nor an
   * {@link ExecutionException}.
   *
   * @param throwable the throwable to unwrap
   *
   * @return the innermost "meaningful" cause of the given throwable
   */
  public static Throwable unwrap(Throwable throwable) {
    while ((throwable instanceof CompletionException || throwable instanceof ExecutionException)
        && throwable.getCause() != null) {

      throwable = throwable.getCause();
    }

    return throwable;
  }

  /**
   * Wraps the given throwable in a {@link CompletionException} unless it is already a {@code CompletionException}.
   *
   * @param throwable the throwable to wrap
   *
   * @return a {@code CompletionException} that can be thrown from a completion stage function
   */
  public static CompletionException wrap(final Throwable throwable) {
    return throwable instanceof CompletionException completionException ?
        completionException : new CompletionException(throwable);
  }
}
