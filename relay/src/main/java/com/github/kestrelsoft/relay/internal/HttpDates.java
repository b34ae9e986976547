/*
 * Copyright (c) 2025 Moataz Hussein
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

package com.github.kestrelsoft.relay.internal;

import static com.github.kestrelsoft.relay.internal.Validate.requireArgument;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Clock;
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

/** Helpers for parsing/formatting HTTP dates & delta seconds, as found in {@code Retry-After}. */
public class HttpDates {
  private static final Logger logger = System.getLogger(HttpDates.class.getName());

  /** The preferred format specified by rfc7231 Section 7.1.1.1. */
  private static final DateTimeFormatter PREFERRED_FORMATTER =
      DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US);

  /** Formatters to try in sequence till one succeeds. */
  private static final List<DateTimeFormatter> FORMATTERS =
      List.of(
          PREFERRED_FORMATTER,
          DateTimeFormatter.ofPattern("EEEE, dd-MMM-uu HH:mm:ss 'GMT'", Locale.US), // rfc850
          DateTimeFormatter.ofPattern("EEE MMM ppd HH:mm:ss uuuu", Locale.US), // asctime()
          DateTimeFormatter.RFC_1123_DATE_TIME,
          DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'UTC'", Locale.US));

  private HttpDates() {}

  public static String formatHttpDate(LocalDateTime dateTime) {
    return PREFERRED_FORMATTER.format(dateTime);
  }

  public static Optional<LocalDateTime> tryParseHttpDate(String value) {
    TemporalAccessor parsedTemporal = null;
    for (var formatter : FORMATTERS) {
      try {
        parsedTemporal = formatter.parse(value);
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
        return Optional.of(
            (offset == null || offset.equals(ZoneOffset.UTC))
                ? dateTime
                : toUtcDateTime(dateTime.toInstant(offset)));
      } catch (DateTimeException e) {
        malformedHttpDate = e;
      }
    }

    logger.log(
        Level.WARNING, () -> "Malformed or unrecognized HTTP date: " + value, malformedHttpDate);
    return Optional.empty();
  }

  public static Duration parseDeltaSeconds(String value) {
    long secondsLong = Long.parseLong(value);
    requireArgument(secondsLong >= 0, "Delta seconds can't be negative");

    // Truncate to Integer.MAX_VALUE to avoid overflows on further calculations.
    int secondsInt = (int) Math.min(secondsLong, Integer.MAX_VALUE);
    return Duration.ofSeconds(secondsInt);
  }

  public static Optional<Duration> tryParseDeltaSeconds(String value) {
    try {
      return Optional.of(parseDeltaSeconds(value));
    } catch (IllegalArgumentException ignored) {
      return Optional.empty();
    }
  }

  /**
   * Returns the delay denoted by a {@code Retry-After} value, which is either delta seconds or an
   * HTTP date relative to the given clock's time. Dates in the past yield a zero delay.
   */
  public static Optional<Duration> tryParseRetryAfter(String value, Clock clock) {
    var trimmed = value.trim();
    var deltaSeconds = tryParseDeltaSeconds(trimmed);
    if (deltaSeconds.isPresent()) {
      return deltaSeconds;
    }
    return tryParseHttpDate(trimmed)
        .map(
            retryDate -> {
              var delay = Duration.between(clock.instant(), retryDate.toInstant(ZoneOffset.UTC));
              return delay.isNegative() ? Duration.ZERO : delay;
            });
  }

  public static LocalDateTime toUtcDateTime(Instant instant) {
    return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
  }
}
