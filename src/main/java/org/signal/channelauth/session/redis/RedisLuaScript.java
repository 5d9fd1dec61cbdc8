/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.session.redis;

import io.lettuce.core.RedisNoScriptException;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.StatefulRedisConnection;
import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A {@code RedisLuaScript} manages a Lua script executed by Redis. It attempts to execute the script via the Redis
 * <a href="https://redis.io/commands/evalsha/">EVALSHA</a> command and will load the script via the Redis
 * <a href="https://redis.io/commands/script-load/">SCRIPT LOAD</a> command if the script is not loaded on the target
 * Redis server. Redis runs each script atomically, so a script is the unit of atomicity for conditional updates.
 */
class RedisLuaScript {

  private final byte[] script;
  private final ScriptOutputType outputType;

  private final String sha;

  RedisLuaScript(final byte[] script, final ScriptOutputType outputType) {
    this.script = script;
    this.outputType = outputType;

    try {
      this.sha = HexFormat.of().formatHex(MessageDigest.getInstance("SHA-1").digest(script));
    } catch (final NoSuchAlgorithmException e) {
      // All Java implementations are required to support SHA-1
      throw new AssertionError(e);
    }
  }

  /**
   * Loads a script from a resource that lives alongside the given class.
   *
   * @param clazz the class relative to which to resolve the resource name
   * @param resourceName the name of the script resource
   * @param outputType the output type of the script
   *
   * @return a script with the contents of the named resource
   *
   * @throws IOException if the resource could not be read
   */
  static RedisLuaScript fromResource(final Class<?> clazz, final String resourceName, final ScriptOutputType outputType)
      throws IOException {

    try (final InputStream scriptInputStream =
        Objects.requireNonNull(clazz.getResourceAsStream(resourceName), "Missing script resource: " + resourceName)) {

      return new RedisLuaScript(scriptInputStream.readAllBytes(), outputType);
    }
  }

  String getSha() {
    return sha;
  }

  /**
   * Executes this script with the given keys and arguments via the given Redis connection, lazily loading the script
   * on the target Redis server if it is not already present.
   *
   * @param connection the Redis connection via which to execute this script
   * @param keys the keys acted upon by this script
   * @param values the arguments to be passed to this script
   *
   * @return the output of the script
   *
   * @param <T> the expected return type of the script
   */
  <T> CompletableFuture<T> execute(final StatefulRedisConnection<byte[], byte[]> connection,
      final byte[][] keys,
      final byte[]... values) {

    //noinspection unchecked
    return (CompletableFuture<T>) connection.async().evalsha(sha, outputType, keys, values)
        .exceptionallyCompose(throwable -> {
          if (throwable instanceof RedisNoScriptException) {
            // The script may not have been loaded yet, or it may have been flushed by an operator or a server restart
            return connection.async().scriptLoad(script)
                .thenCompose(loadedSha -> connection.async().evalsha(loadedSha, outputType, keys, values));
          } else {
            return CompletableFuture.failedFuture(throwable);
          }
        })
        .toCompletableFuture();
  }
}
