/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.metrics;

public class MetricsUtil {

  private static final String METRIC_NAME_PREFIX = "channelauth";

  public static final String OUTCOME_TAG_NAME = "outcome";

  /**
   * Returns a qualified name for a metric contained within the given class.
   *
   * @param clazz the class that contains the metric
   * @param metricName the name of the metrics
   *
   * @return a qualified name for the given metric
   */
  public static String name(final Class<?> clazz, final String metricName) {
    return METRIC_NAME_PREFIX + "." + clazz.getSimpleName() + "." + metricName;
  }
}
