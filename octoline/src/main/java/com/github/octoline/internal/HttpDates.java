/*
 * Copyright (c) 2024 Moataz Abdelnasser
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.octoline.internal;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for parsing HTTP dates, delta seconds and epoch timestamps found in headers. */
public class HttpDates {
  private static final Logger logger = System.getLogger(HttpDates.class.getName());

  /** Maximum seconds a parsed duration can have, avoiding overflows in further calculations. */
  private static final BigDecimal MAX_SECONDS = BigDecimal.valueOf(Integer.MAX_VALUE);

  /** A formatter for the preferred format specified by rfc7231 Section 7.1.1.1. */
  private static final DateTimeFormatter PREFERRED_FORMATTER =
      DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US);

  /** Formatters to try in sequence till one succeeds. */
  private static final List<DateTimeFormatter> FORMATTERS =
      List.of(
          PREFERRED_FORMATTER,
          DateTimeFormatter.ofPattern("EEEE, dd-MMM-uu HH:mm:ss 'GMT'", Locale.US), // rfc850
          DateTimeFormatter.ofPattern("EEE MMM ppd HH:mm:ss uuuu", Locale.US), // asctime()
          DateTimeFormatter.RFC_1123_DATE_TIME);

  private HttpDates() {}

  public static String formatHttpDate(Instant instant) {
    return PREFERRED_FORMATTER.format(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
  }

  public static Optional<Instant> tryParseHttpDate(String value) {
    TemporalAccessor parsedTemporal = null;
    for (var formatter : FORMATTERS) {
      try {
        parsedTemporal = formatter.parse(value.trim());
        break;
      } catch (DateTimeException ignored) {
        // Try next formatter.
      }
    }

    DateTimeException malformedHttpDate = null;
    if (parsedTemporal != null) {
      try {
        var dateTime = LocalDateTime.from(parsedTemporal);
        var offset = parsedTemporal.query(TemporalQueries.offset());
        return Optional.of(dateTime.toInstant(offset != null ? offset : ZoneOffset.UTC));
      } catch (DateTimeException e) {
        malformedHttpDate = e;
      }
    }

    logger.log(
        Level.DEBUG, () -> "Malformed or unrecognized HTTP date: " + value, malformedHttpDate);
    return Optional.empty();
  }

  /**
   * Parses a non-negative number of seconds, which can be fractional (e.g. {@code 1.5}). Values
   * beyond {@code Integer.MAX_VALUE} seconds are truncated.
   */
  public static Optional<Duration> tryParseDeltaSeconds(String value) {
    var seconds = tryParseDecimal(value);
    if (seconds == null || seconds.signum() < 0) {
      return Optional.empty();
    }
    var truncated = seconds.min(MAX_SECONDS);
    return Optional.of(Duration.ofNanos(truncated.movePointRight(9).longValue()));
  }

  /** Parses a timestamp in seconds since the epoch. */
  public static Optional<Instant> tryParseEpochSeconds(String value) {
    var seconds = tryParseDecimal(value);
    if (seconds == null || seconds.signum() < 0) {
      return Optional.empty();
    }
    try {
      var wholeSeconds = seconds.toBigInteger().longValueExact();
      return Optional.of(Instant.ofEpochSecond(wholeSeconds));
    } catch (ArithmeticException | DateTimeException e) {
      return Optional.empty();
    }
  }

  private static @Nullable BigDecimal tryParseDecimal(String value) {
    try {
      return new BigDecimal(value.trim());
    } catch (NumberFormatException ignored) {
      return null;
    }
  }
}
