/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.dispatch;

import com.google.common.annotations.VisibleForTesting;
import io.micronaut.context.MessageSource;
import io.micronaut.context.i18n.ResourceBundleMessageSource;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.Map;

/**
 * Supplies the text of replies sent to phone numbers. Reply text is defined in the {@code replies.properties} resource
 * file; translations may be added as language-specific properties files alongside it.
 */
@Singleton
public class ReplyMessageProvider {

  private final MessageSource messageSource;

  public static final String NOT_REGISTERED = "reply.not-registered";
  public static final String RATE_LIMITED = "reply.rate-limited";
  public static final String MAGIC_LINK_SENT = "reply.magic-link-sent";
  public static final String CODE_SENT = "reply.code-sent";
  public static final String CREDENTIAL_FAILED = "reply.credential-failed";
  public static final String CODE_REJECTED = "reply.code-rejected";
  public static final String CODE_ATTEMPTS_EXHAUSTED = "reply.code-attempts-exhausted";
  public static final String CODE_FAILED = "reply.code-failed";
  public static final String AUTHENTICATED = "reply.authenticated";
  public static final String LOGGED_OUT = "reply.logged-out";
  public static final String AUTHENTICATION_REQUIRED = "reply.authentication-required";
  public static final String SESSION_EXPIRED = "reply.session-expired";
  public static final String CHANNEL_UNTRUSTED = "reply.channel-untrusted";
  public static final String REQUEST_FAILED = "reply.request-failed";
  public static final String REQUEST_ACKNOWLEDGED = "reply.request-acknowledged";

  @Inject
  public ReplyMessageProvider() {
    this(new ResourceBundleMessageSource("org.signal.channelauth.dispatch.replies"));
  }

  @VisibleForTesting
  ReplyMessageProvider(final MessageSource messageSource) {
    this.messageSource = messageSource;
  }

  public String getReply(final String messageKey) {
    return getReply(messageKey, Map.of());
  }

  /**
   * Returns the text of the given reply with its placeholders replaced by the given variables.
   *
   * @param messageKey the key of the reply in the message properties
   * @param variables the values of the reply's placeholders
   *
   * @return the text of the reply
   *
   * @throws io.micronaut.context.exceptions.NoSuchMessageException if no reply has the given key
   */
  public String getReply(final String messageKey, final Map<String, Object> variables) {
    return messageSource.getRequiredMessage(messageKey, MessageSource.MessageContext.of(variables));
  }
}
