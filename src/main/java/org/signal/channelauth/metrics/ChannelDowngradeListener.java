/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.metrics;

import com.google.i18n.phonenumbers.NumberParseException;
import com.google.i18n.phonenumbers.PhoneNumberUtil;
import com.google.i18n.phonenumbers.Phonenumber;
import io.micrometer.core.instrument.MeterRegistry;
import io.micronaut.configuration.metrics.annotation.RequiresMetrics;
import io.micronaut.context.event.ApplicationEventListener;
import jakarta.inject.Singleton;
import java.util.Optional;
import org.signal.channelauth.channel.ChannelDowngradedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts channel downgrades by region and by the way in which they were detected.
 */
@Singleton
@RequiresMetrics
public class ChannelDowngradeListener implements ApplicationEventListener<ChannelDowngradedEvent> {

  private final MeterRegistry meterRegistry;

  private static final String COUNTER_NAME = MetricsUtil.name(ChannelDowngradeListener.class, "downgrades");

  private static final Logger logger = LoggerFactory.getLogger(ChannelDowngradeListener.class);

  public ChannelDowngradeListener(final MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onApplicationEvent(final ChannelDowngradedEvent event) {
    try {
      final Phonenumber.PhoneNumber phoneNumber =
          PhoneNumberUtil.getInstance().parse(event.session().phoneNumber(), null);

      meterRegistry.counter(COUNTER_NAME,
              "detectedBy", event.detectedBy().name(),
              "countryCode", String.valueOf(phoneNumber.getCountryCode()),
              "regionCode", Optional.ofNullable(PhoneNumberUtil.getInstance().getRegionCodeForNumber(phoneNumber))
                  .orElse("XX"))
          .increment();
    } catch (final NumberParseException e) {
      logger.warn("Failed to parse phone number from downgraded session", e);
    }
  }
}
