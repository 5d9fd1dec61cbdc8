/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.dispatch;

import io.micronaut.context.annotation.ConfigurationProperties;
import jakarta.validation.constraints.NotBlank;
import java.util.List;

@ConfigurationProperties("email-directory")
public class EmailDirectoryConfiguration {

  /**
   * Assignments in the form {@code +18005550123=user@example.com}.
   */
  private List<@NotBlank String> assignments = List.of();

  public List<String> getAssignments() {
    return assignments;
  }

  public void setAssignments(final List<String> assignments) {
    this.assignments = assignments;
  }
}
