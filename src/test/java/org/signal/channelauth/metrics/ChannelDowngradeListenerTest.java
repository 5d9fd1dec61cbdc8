/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.signal.channelauth.channel.ChannelDowngradedEvent;
import org.signal.channelauth.channel.ChannelType;
import org.signal.channelauth.session.ChannelSession;

class ChannelDowngradeListenerTest {

  private SimpleMeterRegistry meterRegistry;
  private ChannelDowngradeListener listener;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    listener = new ChannelDowngradeListener(meterRegistry);
  }

  @Test
  void onApplicationEvent() {
    listener.onApplicationEvent(new ChannelDowngradedEvent(downgradedSession("+447911123456"),
        ChannelDowngradedEvent.DetectionSource.INBOUND_MESSAGE));

    assertEquals(1, meterRegistry.get(MetricsUtil.name(ChannelDowngradeListener.class, "downgrades"))
        .tag("detectedBy", "INBOUND_MESSAGE")
        .tag("countryCode", "44")
        .tag("regionCode", "GB")
        .counter()
        .count());
  }

  @Test
  void onApplicationEventUnparseablePhoneNumber() {
    listener.onApplicationEvent(new ChannelDowngradedEvent(downgradedSession("not a phone number"),
        ChannelDowngradedEvent.DetectionSource.DELIVERY_REPORT));

    assertEquals(0, meterRegistry.getMeters().size());
  }

  private static ChannelSession downgradedSession(final String phoneNumber) {
    return ChannelSession.newBuilder(phoneNumber)
        .channelType(ChannelType.UNTRUSTED)
        .channelDowngradeDetected(true)
        .build();
  }
}
