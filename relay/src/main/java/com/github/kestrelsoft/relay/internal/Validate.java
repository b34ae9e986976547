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

import static java.lang.String.format;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import com.google.errorprone.annotations.FormatString;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Precondition checks. Misuse of the API fails fast with an {@code IllegalArgumentException} or an
 * {@code IllegalStateException}, never with an {@code HttpFailure}.
 */
public final class Validate {
  private Validate() {}

  @FormatMethod
  public static void requireArgument(
      boolean condition, @FormatString String messageFormat, @Nullable Object... args) {
    if (!condition) {
      throw new IllegalArgumentException(format(messageFormat, args));
    }
  }

  @FormatMethod
  public static void requireState(
      boolean condition, @FormatString String messageFormat, @Nullable Object... args) {
    if (!condition) {
      throw new IllegalStateException(format(messageFormat, args));
    }
  }

  @CanIgnoreReturnValue
  public static int requireNonNegative(int value, String name) {
    requireArgument(value >= 0, "%s must not be negative: %d", name, value);
    return value;
  }

  /** Status codes are three-digit numbers, though not all of them are registered ones. */
  @CanIgnoreReturnValue
  public static int requireStatusCode(int statusCode) {
    requireArgument(
        statusCode >= 100 && statusCode <= 999, "Invalid status code: %d", statusCode);
    return statusCode;
  }
}
