/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.session.redis;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.UncheckedIOException;
import org.signal.channelauth.session.ChannelSession;

/**
 * Converts channel sessions to and from the JSON documents stored in Redis.
 */
@Singleton
class ChannelSessionCodec {

  private final ObjectMapper objectMapper = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  byte[] encode(final ChannelSession session) {
    try {
      return objectMapper.writeValueAsBytes(session);
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  ChannelSession decode(final byte[] sessionBytes) {
    try {
      return objectMapper.readValue(sessionBytes, ChannelSession.class);
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
