/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.identity;

import java.util.concurrent.CompletableFuture;

/**
 * An identity provider proves ownership of an email address with single-use credentials (magic links or emailed
 * one-time codes) and issues bearer tokens for the identities it verifies.
 * <p/>
 * Futures returned by identity providers fail with an {@link InvalidCredentialException} if the provider rejected the
 * request or with an {@link org.signal.channelauth.UpstreamUnavailableException} if the provider could not be reached
 * or failed to respond meaningfully. Identity providers never retry requests on their own.
 */
public interface IdentityProvider {

  /**
   * Sends a single-use credential to the given email address.
   *
   * @param email the address to which to send the credential
   * @param phoneNumber the phone number on whose behalf the credential was requested; used to route the completed
   *                    credential back to the phone number's session
   *
   * @return a future that completes when the provider has accepted the request
   */
  CompletableFuture<Void> issueCredential(String email, String phoneNumber);

  /**
   * Verifies a one-time code that was sent to the given email address.
   *
   * @param email the address to which the code was sent
   * @param code the code presented by the user
   *
   * @return a future that yields the verified identity and its bearer token
   */
  CompletableFuture<VerifiedCredential> verifyCode(String email, String code);

  /**
   * Verifies the token hash carried by a magic link.
   *
   * @param tokenHash the token hash from the magic link
   *
   * @return a future that yields the verified identity and its bearer token
   */
  CompletableFuture<VerifiedCredential> verifyMagicLink(String tokenHash);

  /**
   * Validates a bearer token previously issued by this provider.
   *
   * @param token the token to validate
   *
   * @return a future that yields the claims of the token's subject
   */
  CompletableFuture<TokenClaims> validateToken(String token);
}
