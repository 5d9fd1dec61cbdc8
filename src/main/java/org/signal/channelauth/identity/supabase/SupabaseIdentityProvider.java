/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.identity.supabase;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.Metrics;
import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.apache.commons.lang3.StringUtils;
import org.signal.channelauth.UpstreamUnavailableException;
import org.signal.channelauth.identity.IdentityProvider;
import org.signal.channelauth.identity.InvalidCredentialException;
import org.signal.channelauth.identity.TokenClaims;
import org.signal.channelauth.identity.VerifiedCredential;
import org.signal.channelauth.metrics.MetricsUtil;
import org.signal.channelauth.util.CompletionExceptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An identity provider backed by the Supabase auth (GoTrue) REST API. Credentials are emailed by Supabase as magic
 * links or one-time codes; existing users only are eligible.
 */
@Singleton
public class SupabaseIdentityProvider implements IdentityProvider {

  private final HttpClient httpClient;
  private final SupabaseConfiguration configuration;

  private final ObjectMapper objectMapper = new ObjectMapper()
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private static final String API_CALL_COUNTER_NAME = MetricsUtil.name(SupabaseIdentityProvider.class, "apiCalls");

  private static final String ORGANIZATION_ID_ATTRIBUTE = "org_id";
  private static final String ROLE_ATTRIBUTE = "user_role";

  private static final Logger logger = LoggerFactory.getLogger(SupabaseIdentityProvider.class);

  @Inject
  public SupabaseIdentityProvider(final SupabaseConfiguration configuration) {
    this(HttpClient.newBuilder().connectTimeout(configuration.getRequestTimeout()).build(), configuration);
  }

  @VisibleForTesting
  SupabaseIdentityProvider(final HttpClient httpClient, final SupabaseConfiguration configuration) {
    this.httpClient = httpClient;
    this.configuration = configuration;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record User(String id,
              @Nullable String email,
              @Nullable @JsonProperty("user_metadata") Map<String, Object> userMetadata,
              @Nullable @JsonProperty("app_metadata") Map<String, Object> appMetadata) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record VerifyResponse(@JsonProperty("access_token") String accessToken,
                        @JsonProperty("expires_in") long expiresIn,
                        User user) {
  }

  @Override
  public CompletableFuture<Void> issueCredential(final String email, final String phoneNumber) {
    final URI redirectUri = URI.create(configuration.getMagicLinkRedirectUrl() + "?phone=" +
        URLEncoder.encode(phoneNumber, StandardCharsets.UTF_8));

    final HttpRequest request = newRequestBuilder("/auth/v1/otp?redirect_to=" +
            URLEncoder.encode(redirectUri.toString(), StandardCharsets.UTF_8), configuration.getServiceRoleKey())
        .POST(jsonBody(Map.of("email", email, "create_user", false)))
        .build();

    return send(request, "otp").thenAccept(ignored -> logger.debug("Requested credential email"));
  }

  @Override
  public CompletableFuture<VerifiedCredential> verifyCode(final String email, final String code) {
    final HttpRequest request = newRequestBuilder("/auth/v1/verify", configuration.getServiceRoleKey())
        .POST(jsonBody(Map.of("type", "email", "email", email, "token", code)))
        .build();

    return send(request, "verify").thenApply(this::parseVerifiedCredential);
  }

  @Override
  public CompletableFuture<VerifiedCredential> verifyMagicLink(final String tokenHash) {
    final HttpRequest request = newRequestBuilder("/auth/v1/verify", configuration.getServiceRoleKey())
        .POST(jsonBody(Map.of("type", "magiclink", "token_hash", tokenHash)))
        .build();

    return send(request, "verify").thenApply(this::parseVerifiedCredential);
  }

  @Override
  public CompletableFuture<TokenClaims> validateToken(final String token) {
    final HttpRequest request = newRequestBuilder("/auth/v1/user", token)
        .GET()
        .build();

    return send(request, "user").thenApply(responseBody -> {
      final User user = parse(responseBody, User.class);

      return new TokenClaims(user.id(),
          user.email(),
          getAttribute(user, ORGANIZATION_ID_ATTRIBUTE),
          getAttribute(user, ROLE_ATTRIBUTE));
    });
  }

  /**
   * Returns the named attribute from the user's own metadata, falling back to the application-managed metadata.
   */
  @VisibleForTesting
  @Nullable
  static String getAttribute(final User user, final String attributeName) {
    return Optional.ofNullable(user.userMetadata()).map(metadata -> metadata.get(attributeName))
        .or(() -> Optional.ofNullable(user.appMetadata()).map(metadata -> metadata.get(attributeName)))
        .map(String::valueOf)
        .filter(StringUtils::isNotBlank)
        .orElse(null);
  }

  private HttpRequest.Builder newRequestBuilder(final String path, final String bearerToken) {
    return HttpRequest.newBuilder()
        .uri(URI.create(StringUtils.removeEnd(configuration.getUrl().toString(), "/") + path))
        .timeout(configuration.getRequestTimeout())
        .header("apikey", configuration.getServiceRoleKey())
        .header("Authorization", "Bearer " + bearerToken)
        .header("Content-Type", "application/json");
  }

  private HttpRequest.BodyPublisher jsonBody(final Map<String, Object> body) {
    try {
      return HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body));
    } catch (final JsonProcessingException e) {
      // Maps of strings and booleans are always serializable
      throw new AssertionError(e);
    }
  }

  private CompletableFuture<String> send(final HttpRequest request, final String endpoint) {
    return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
        .handle((response, throwable) -> {
          if (throwable != null) {
            incrementApiCallCounter(endpoint, "error");
            throw new CompletionException(new UpstreamUnavailableException("Failed to reach identity provider",
                CompletionExceptions.unwrap(throwable)));
          }

          final int statusCode = response.statusCode();

          if (statusCode >= 200 && statusCode < 300) {
            incrementApiCallCounter(endpoint, "success");
            return response.body();
          } else if (statusCode >= 400 && statusCode < 500 && statusCode != 429) {
            incrementApiCallCounter(endpoint, "rejected");
            throw new CompletionException(
                new InvalidCredentialException("Identity provider rejected request with status " + statusCode));
          } else {
            incrementApiCallCounter(endpoint, "unavailable");
            throw new CompletionException(
                new UpstreamUnavailableException("Identity provider responded with status " + statusCode));
          }
        });
  }

  private static void incrementApiCallCounter(final String endpoint, final String outcome) {
    Metrics.counter(API_CALL_COUNTER_NAME, "endpoint", endpoint, MetricsUtil.OUTCOME_TAG_NAME, outcome).increment();
  }

  private VerifiedCredential parseVerifiedCredential(final String responseBody) {
    final VerifyResponse verifyResponse = parse(responseBody, VerifyResponse.class);

    if (verifyResponse.user() == null || StringUtils.isBlank(verifyResponse.accessToken())) {
      throw new CompletionException(new UpstreamUnavailableException("Identity provider returned no session"));
    }

    return new VerifiedCredential(verifyResponse.user().id(),
        verifyResponse.user().email(),
        verifyResponse.accessToken(),
        Duration.ofSeconds(verifyResponse.expiresIn()));
  }

  private <T> T parse(final String responseBody, final Class<T> type) {
    try {
      return objectMapper.readValue(responseBody, type);
    } catch (final IOException e) {
      throw new CompletionException(new UpstreamUnavailableException("Failed to parse identity provider response", e));
    }
  }
}
