package com.acme.delivery.replication.core;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Checks shared by the {@code validate()} methods of the option classes. Every failure is an
 * {@link IllegalArgumentException} naming the offending field.
 */
public final class OptionValidation {

  private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

  private OptionValidation() {
  }

  public static void require(String fieldName, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " is required");
    }
  }

  public static void requireRange(String fieldName, long value, long minInclusive, long maxInclusive) {
    if (value < minInclusive || value > maxInclusive) {
      throw new IllegalArgumentException(
        fieldName + " must be between " + minInclusive + " and " + maxInclusive + " but was " + value);
    }
  }

  public static void requirePositive(String fieldName, Duration value) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(fieldName + " must be > 0");
    }
  }

  /**
   * Schema, view and slot names are spliced into SQL text, so only plain lower-case
   * identifiers are accepted.
   */
  public static void requireIdentifier(String fieldName, String value) {
    require(fieldName, value);
    if (!IDENTIFIER.matcher(value).matches()) {
      throw new IllegalArgumentException(fieldName + " must be a plain lower-case identifier: " + value);
    }
  }
}
