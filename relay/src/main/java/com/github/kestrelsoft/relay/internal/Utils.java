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

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.BitSet;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Header grammar checks (RFC 7230), duration preconditions and other small helpers. */
public final class Utils {
  private static final Clock SYSTEM_MILLIS_UTC = Clock.tickMillis(ZoneOffset.UTC);

  /** tchar: ALPHA, DIGIT and the non-delimiter symbols. */
  private static final BitSet TCHAR = new BitSet(128);

  /** field-vchar = VCHAR / obs-text, plus SP and HTAB between them. */
  private static final BitSet FIELD_VALUE_CHAR = new BitSet(256);

  static {
    TCHAR.set('0', '9' + 1);
    TCHAR.set('a', 'z' + 1);
    TCHAR.set('A', 'Z' + 1);
    "!#$%&'*+-.^_`|~".chars().forEach(TCHAR::set);

    FIELD_VALUE_CHAR.set(0x21, 0x7e + 1);
    FIELD_VALUE_CHAR.set(0x80, 0xff + 1);
    FIELD_VALUE_CHAR.set(' ');
    FIELD_VALUE_CHAR.set('\t');
  }

  private Utils() {}

  private static boolean isToken(CharSequence value) {
    return value.length() > 0 && value.chars().allMatch(c -> c < 128 && TCHAR.get(c));
  }

  public static <S extends CharSequence> S requireValidToken(S token) {
    requireArgument(isToken(token), "illegal token: '%s'", token);
    return token;
  }

  public static String requireValidHeaderValue(String value) {
    requireArgument(
        value.chars().allMatch(c -> c < 256 && FIELD_VALUE_CHAR.get(c)),
        "illegal header value: '%s'",
        value);
    return value;
  }

  public static void requireValidHeader(String name, String value) {
    requireArgument(isToken(name), "illegal header name: '%s'", name);
    requireValidHeaderValue(value);
  }

  /**
   * Returns the value as is if it's a token, otherwise as a quoted-string, where only DQUOTE and
   * backslash are escaped.
   */
  public static String quoteIfNeeded(String value) {
    if (isToken(value)) {
      return value;
    }
    var quoted = new StringBuilder(value.length() + 2).append('"');
    value
        .chars()
        .forEach(
            c -> {
              if (c == '"' || c == '\\') {
                quoted.append('\\');
              }
              quoted.append((char) c);
            });
    return quoted.append('"').toString();
  }

  public static Duration requirePositiveDuration(Duration duration) {
    requireArgument(
        !(duration.isNegative() || duration.isZero()), "non-positive duration: %s", duration);
    return duration;
  }

  public static Duration requireNonNegativeDuration(Duration duration) {
    requireArgument(!duration.isNegative(), "negative duration: %s", duration);
    return duration;
  }

  public static Clock systemMillisUtc() {
    return SYSTEM_MILLIS_UTC;
  }

  /** Strips the {@code CompletionException} & {@code ExecutionException} wrappers of a failure. */
  public static Throwable unwrapCompletionCause(Throwable throwable) {
    var cause = throwable;
    while ((cause instanceof CompletionException || cause instanceof ExecutionException)
        && cause.getCause() != null) {
      cause = cause.getCause();
    }
    return cause;
  }

  public static String toStringIdentityPrefix(Object object) {
    return object.getClass().getSimpleName() + "@" + Integer.toHexString(object.hashCode());
  }
}
