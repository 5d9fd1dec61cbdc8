/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.transport.twilio;

import com.twilio.http.TwilioRestClient;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.rest.api.v2010.account.MessageCreator;
import com.twilio.type.PhoneNumber;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import org.signal.channelauth.metrics.MetricsUtil;
import org.signal.channelauth.transport.MessageBodies;
import org.signal.channelauth.transport.MessageTransport;
import org.signal.channelauth.util.CompletionExceptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Sends text messages via a Twilio messaging service. Twilio chooses the channel for each message (for example, RCS
 * where the recipient supports it and SMS otherwise) and, for tracked messages, reports the chosen channel to the
 * configured status callback.
 * <p/>
 * Failed sends are retried with exponential backoff unless Twilio reports that the message was permanently refused.
 */
@Singleton
public class TwilioMessageTransport implements MessageTransport {

  private final TwilioRestClient twilioRestClient;
  private final TwilioMessagingConfiguration configuration;

  private static final String API_CALL_COUNTER_NAME = MetricsUtil.name(TwilioMessageTransport.class, "apiCalls");
  private static final String RETRY_COUNTER_NAME = MetricsUtil.name(TwilioMessageTransport.class, "retries");
  private static final Timer SEND_TIMER = Metrics.timer(MetricsUtil.name(TwilioMessageTransport.class, "send"));

  private static final Logger logger = LoggerFactory.getLogger(TwilioMessageTransport.class);

  public TwilioMessageTransport(final TwilioRestClient twilioRestClient,
      final TwilioMessagingConfiguration configuration) {

    this.twilioRestClient = twilioRestClient;
    this.configuration = configuration;
  }

  @Override
  public CompletableFuture<String> send(final String phoneNumber, final String body, final boolean trackDelivery) {
    final MessageCreator messageCreator =
        Message.creator(new PhoneNumber(phoneNumber), configuration.getMessagingServiceSid(),
            MessageBodies.truncate(body));

    if (trackDelivery && configuration.getStatusCallbackUrl() != null) {
      messageCreator.setStatusCallback(configuration.getStatusCallbackUrl());
    }

    final Timer.Sample sample = Timer.start();

    return withRetries(() -> messageCreator.createAsync(twilioRestClient))
        .thenApply(Message::getSid)
        .whenComplete((messageSid, throwable) -> {
          sample.stop(SEND_TIMER);

          if (throwable != null) {
            logger.warn("Failed to send message", CompletionExceptions.unwrap(throwable));
          }
        })
        .exceptionally(throwable -> {
          throw CompletionExceptions.wrap(ApiExceptions.toTransportException(throwable));
        });
  }

  private CompletableFuture<Message> withRetries(final Supplier<CompletableFuture<Message>> messageSupplier) {

    return Mono.fromFuture(messageSupplier)
        .doOnEach(signal -> {
          if (signal.isOnNext() || signal.isOnError()) {
            incrementApiCallCounter(signal.isOnNext(), ApiExceptions.extractErrorCode(signal.getThrowable()));
          }
        })
        .retryWhen(Retry.backoff(configuration.getMaxRetries(), configuration.getMinRetryWait())
            .jitter(0)
            .filter(ApiExceptions::isRetriable)
            .doBeforeRetry(retrySignal -> Metrics.counter(RETRY_COUNTER_NAME).increment()))
        .onErrorMap(Exceptions::isRetryExhausted, Throwable::getCause)
        .toFuture();
  }

  private static void incrementApiCallCounter(final boolean success, @Nullable final String errorCode) {
    Metrics.counter(API_CALL_COUNTER_NAME,
            "endpoint", "message.create",
            "success", String.valueOf(success),
            "code", errorCode != null ? errorCode : "none")
        .increment();
  }
}
