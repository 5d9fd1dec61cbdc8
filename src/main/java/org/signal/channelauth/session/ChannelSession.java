/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.session;

import io.micronaut.core.annotation.Nullable;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import org.signal.channelauth.channel.ChannelType;

/**
 * A channel session is the single stored record for a phone number. It binds the phone number to an email identity,
 * tracks whether (and until when) that binding has been authenticated, holds rate-limiting counters and one-time-code
 * material, and records the trust state of the transport channel over which the phone number has been reached.
 * <p/>
 * Instances are immutable; changes are made by way of {@link #toBuilder()} and stored with
 * {@link SessionRepository#updateSession(String, java.util.function.Function)}. Construction enforces the structural
 * invariants of a session: a session flagged for a channel downgrade carries no authentication material, a session
 * with an authentication time carries both a token and an expiration, and one-time-code fields are either both present
 * or both absent.
 *
 * @param phoneNumber the E.164-formatted phone number that identifies this session
 * @param userId the identity provider's identifier for the bound user, if known
 * @param email the email identity bound to this phone number, if known
 * @param sessionToken the bearer credential issued by the identity provider; present only while authenticated
 * @param authMethod the method by which this session authenticates (or last authenticated)
 * @param authenticatedAt the time of the most recent successful authentication
 * @param expiresAt the time after which the authentication is no longer valid
 * @param authAttempts the number of authentication attempts within the current rate-limiting window
 * @param lastAttemptAt the time of the most recent authentication attempt
 * @param pendingCode a one-time code awaiting verification
 * @param codeExpiresAt the time after which {@code pendingCode} may no longer be verified
 * @param channelType the most recently observed transport channel
 * @param channelDowngradeDetected whether a downgrade from a trusted channel has been detected; once set, the session
 *                                 is treated as compromised until a new authentication cycle begins
 * @param trustRequired whether this session must remain on a trusted channel to stay authenticated
 * @param lastMessageId the provider identifier of the most recent tracked outbound message
 * @param sessionDurationDays the lifetime, in days, of an authentication for this session
 * @param metadata opaque caller-defined context
 * @param createdAt the time at which this session was first stored
 * @param updatedAt the time at which this session was last stored
 */
public record ChannelSession(String phoneNumber,
                             @Nullable String userId,
                             @Nullable String email,
                             @Nullable String sessionToken,
                             AuthMethod authMethod,
                             @Nullable Instant authenticatedAt,
                             @Nullable Instant expiresAt,
                             int authAttempts,
                             @Nullable Instant lastAttemptAt,
                             @Nullable String pendingCode,
                             @Nullable Instant codeExpiresAt,
                             ChannelType channelType,
                             boolean channelDowngradeDetected,
                             boolean trustRequired,
                             @Nullable String lastMessageId,
                             int sessionDurationDays,
                             Map<String, String> metadata,
                             @Nullable Instant createdAt,
                             @Nullable Instant updatedAt) {

  public static final int DEFAULT_SESSION_DURATION_DAYS = 7;

  public ChannelSession {
    Objects.requireNonNull(phoneNumber, "Phone number must not be null");

    authMethod = Objects.requireNonNullElse(authMethod, AuthMethod.MAGIC_LINK);
    channelType = Objects.requireNonNullElse(channelType, ChannelType.UNKNOWN);
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);

    if (authAttempts < 0) {
      throw new IllegalArgumentException("Attempt count must not be negative");
    }

    if (sessionDurationDays <= 0) {
      throw new IllegalArgumentException("Session duration must be positive");
    }

    if (channelDowngradeDetected && (authenticatedAt != null || sessionToken != null || expiresAt != null)) {
      throw new IllegalStateException("Downgraded sessions must not carry authentication material");
    }

    if (authenticatedAt != null && (sessionToken == null || expiresAt == null)) {
      throw new IllegalStateException("Authenticated sessions must have a token and an expiration");
    }

    if ((pendingCode == null) != (codeExpiresAt == null)) {
      throw new IllegalStateException("Pending code and code expiration must be set or cleared together");
    }
  }

  /**
   * Tests whether this session is authenticated at the given instant, which requires an authentication time, a token,
   * and an expiration that has not yet passed.
   *
   * @param now the instant at which to evaluate this session
   *
   * @return {@code true} if this session is authenticated at the given time or {@code false} otherwise
   */
  public boolean isAuthenticated(final Instant now) {
    return authenticatedAt != null && sessionToken != null && expiresAt != null && expiresAt.isAfter(now);
  }

  /**
   * Tests whether this session carries an authentication that has lapsed but has not yet been cleared.
   */
  public boolean isExpired(final Instant now) {
    return expiresAt != null && !expiresAt.isAfter(now);
  }

  public static Builder newBuilder(final String phoneNumber) {
    return new Builder(phoneNumber);
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  /**
   * Returns a copy of this session with all authentication material cleared.
   */
  public ChannelSession withoutAuthentication() {
    return toBuilder()
        .sessionToken(null)
        .authenticatedAt(null)
        .expiresAt(null)
        .build();
  }

  /**
   * Returns a copy of this session with its one-time-code material cleared.
   */
  public ChannelSession withoutPendingCode() {
    return toBuilder()
        .pendingCode(null)
        .codeExpiresAt(null)
        .build();
  }

  @Override
  public String toString() {
    // Omits tokens and codes
    return "ChannelSession{" +
        "channelType=" + channelType +
        ", channelDowngradeDetected=" + channelDowngradeDetected +
        ", trustRequired=" + trustRequired +
        ", authMethod=" + authMethod +
        ", authenticatedAt=" + authenticatedAt +
        ", expiresAt=" + expiresAt +
        ", authAttempts=" + authAttempts +
        ", hasPendingCode=" + (pendingCode != null) +
        '}';
  }

  public static class Builder {

    private final String phoneNumber;
    private String userId;
    private String email;
    private String sessionToken;
    private AuthMethod authMethod = AuthMethod.MAGIC_LINK;
    private Instant authenticatedAt;
    private Instant expiresAt;
    private int authAttempts;
    private Instant lastAttemptAt;
    private String pendingCode;
    private Instant codeExpiresAt;
    private ChannelType channelType = ChannelType.UNKNOWN;
    private boolean channelDowngradeDetected;
    private boolean trustRequired = true;
    private String lastMessageId;
    private int sessionDurationDays = DEFAULT_SESSION_DURATION_DAYS;
    private Map<String, String> metadata = Map.of();
    private Instant createdAt;
    private Instant updatedAt;

    private Builder(final String phoneNumber) {
      this.phoneNumber = phoneNumber;
    }

    private Builder(final ChannelSession session) {
      this.phoneNumber = session.phoneNumber();
      this.userId = session.userId();
      this.email = session.email();
      this.sessionToken = session.sessionToken();
      this.authMethod = session.authMethod();
      this.authenticatedAt = session.authenticatedAt();
      this.expiresAt = session.expiresAt();
      this.authAttempts = session.authAttempts();
      this.lastAttemptAt = session.lastAttemptAt();
      this.pendingCode = session.pendingCode();
      this.codeExpiresAt = session.codeExpiresAt();
      this.channelType = session.channelType();
      this.channelDowngradeDetected = session.channelDowngradeDetected();
      this.trustRequired = session.trustRequired();
      this.lastMessageId = session.lastMessageId();
      this.sessionDurationDays = session.sessionDurationDays();
      this.metadata = session.metadata();
      this.createdAt = session.createdAt();
      this.updatedAt = session.updatedAt();
    }

    public Builder userId(@Nullable final String userId) {
      this.userId = userId;
      return this;
    }

    public Builder email(@Nullable final String email) {
      this.email = email;
      return this;
    }

    public Builder sessionToken(@Nullable final String sessionToken) {
      this.sessionToken = sessionToken;
      return this;
    }

    public Builder authMethod(final AuthMethod authMethod) {
      this.authMethod = authMethod;
      return this;
    }

    public Builder authenticatedAt(@Nullable final Instant authenticatedAt) {
      this.authenticatedAt = authenticatedAt;
      return this;
    }

    public Builder expiresAt(@Nullable final Instant expiresAt) {
      this.expiresAt = expiresAt;
      return this;
    }

    public Builder authAttempts(final int authAttempts) {
      this.authAttempts = authAttempts;
      return this;
    }

    public Builder lastAttemptAt(@Nullable final Instant lastAttemptAt) {
      this.lastAttemptAt = lastAttemptAt;
      return this;
    }

    public Builder pendingCode(@Nullable final String pendingCode) {
      this.pendingCode = pendingCode;
      return this;
    }

    public Builder codeExpiresAt(@Nullable final Instant codeExpiresAt) {
      this.codeExpiresAt = codeExpiresAt;
      return this;
    }

    public Builder channelType(final ChannelType channelType) {
      this.channelType = channelType;
      return this;
    }

    public Builder channelDowngradeDetected(final boolean channelDowngradeDetected) {
      this.channelDowngradeDetected = channelDowngradeDetected;
      return this;
    }

    public Builder trustRequired(final boolean trustRequired) {
      this.trustRequired = trustRequired;
      return this;
    }

    public Builder lastMessageId(@Nullable final String lastMessageId) {
      this.lastMessageId = lastMessageId;
      return this;
    }

    public Builder sessionDurationDays(final int sessionDurationDays) {
      this.sessionDurationDays = sessionDurationDays;
      return this;
    }

    public Builder metadata(@Nullable final Map<String, String> metadata) {
      this.metadata = metadata;
      return this;
    }

    public Builder createdAt(@Nullable final Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder updatedAt(@Nullable final Instant updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    public ChannelSession build() {
      return new ChannelSession(phoneNumber,
          userId,
          email,
          sessionToken,
          authMethod,
          authenticatedAt,
          expiresAt,
          authAttempts,
          lastAttemptAt,
          pendingCode,
          codeExpiresAt,
          channelType,
          channelDowngradeDetected,
          trustRequired,
          lastMessageId,
          sessionDurationDays,
          metadata,
          createdAt,
          updatedAt);
    }
  }
}
