/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.channelauth.dispatch;

import com.google.i18n.phonenumbers.NumberParseException;
import com.google.i18n.phonenumbers.PhoneNumberUtil;
import com.google.i18n.phonenumbers.Phonenumber;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;

public final class PhoneNumbers {

  /**
   * The region assumed for sender addresses that carry no country calling code.
   */
  public static final String DEFAULT_REGION = "US";

  private PhoneNumbers() {
  }

  /**
   * Normalizes a sender address to E.164 form. Transport-specific prefixes like {@code whatsapp:} are removed before
   * parsing.
   *
   * @param address the sender address as reported by the message transport
   *
   * @return the E.164-formatted phone number, or empty if the address is not a possible phone number
   */
  public static Optional<String> normalize(final String address) {
    if (StringUtils.isBlank(address)) {
      return Optional.empty();
    }

    final String number = address.contains(":") ? StringUtils.substringAfterLast(address, ":") : address;

    try {
      final Phonenumber.PhoneNumber phoneNumber = PhoneNumberUtil.getInstance().parse(number.trim(), DEFAULT_REGION);

      if (!PhoneNumberUtil.getInstance().isPossibleNumber(phoneNumber)) {
        return Optional.empty();
      }

      return Optional.of(PhoneNumberUtil.getInstance().format(phoneNumber, PhoneNumberUtil.PhoneNumberFormat.E164));
    } catch (final NumberParseException e) {
      return Optional.empty();
    }
  }

  /**
   * Returns a form of the given phone number suitable for logs, revealing only its last four digits.
   */
  public static String redact(final String phoneNumber) {
    return phoneNumber.length() <= 4 ? "****" : "****" + StringUtils.right(phoneNumber, 4);
  }
}
