/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micronaut.configuration.metrics.annotation.RequiresMetrics;
import io.micronaut.context.annotation.Context;
import io.micronaut.context.annotation.Factory;

/**
 * Registers the application's meter registry with Micrometer's global registry so that static meters (for example,
 * {@link Metrics#counter(String, String...)}) are published alongside injected ones.
 */
@Context
@RequiresMetrics
@Factory
public class GlobalMeterRegistryConfigurer {

  GlobalMeterRegistryConfigurer(final MeterRegistry meterRegistry) {
    Metrics.addRegistry(meterRegistry);
  }
}
