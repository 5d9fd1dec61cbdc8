/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.session.redis;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.codec.ByteArrayCodec;
import io.lettuce.core.metrics.MicrometerCommandLatencyRecorder;
import io.lettuce.core.metrics.MicrometerOptions;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import io.micrometer.core.instrument.MeterRegistry;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

@Factory
@Requires(property = "redis-session-repository.uri")
class RedisConnectionFactory {

  @Singleton
  @Bean(preDestroy = "shutdown")
  RedisClient redisClient(final RedisSessionRepositoryConfiguration configuration, final MeterRegistry meterRegistry) {
    final MicrometerOptions options = MicrometerOptions.builder().histogram(true).build();

    final ClientResources clientResources = DefaultClientResources.builder()
        .commandLatencyRecorder(new MicrometerCommandLatencyRecorder(meterRegistry, options))
        .build();

    final RedisClient redisClient = RedisClient.create(clientResources, RedisURI.create(configuration.getUri()));

    // Fail fast instead of queueing commands while disconnected; callers see a store failure rather than a stall
    redisClient.setOptions(ClientOptions.builder()
        .timeoutOptions(TimeoutOptions.builder()
            .timeoutCommands(true)
            .fixedTimeout(configuration.getCommandTimeout())
            .build())
        .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
        .build());

    return redisClient;
  }

  @Singleton
  @Bean(preDestroy = "close")
  StatefulRedisConnection<byte[], byte[]> redisConnection(final RedisClient redisClient) {
    return redisClient.connect(ByteArrayCodec.INSTANCE);
  }
}
