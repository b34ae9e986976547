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

package com.github.kestrelsoft.relay;

import static com.github.kestrelsoft.relay.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import java.util.Arrays;
import java.util.function.IntPredicate;
import java.util.stream.Collectors;

/**
 * A set of status codes. Response parsers use a {@code StatusRange} to state which status codes
 * they expect, which defaults to {@link #SUCCESSFUL}.
 */
public final class StatusRange {
  public static final StatusRange INFORMATIONAL = between(100, 199);
  public static final StatusRange SUCCESSFUL = between(200, 299);
  public static final StatusRange REDIRECTION = between(300, 399);
  public static final StatusRange CLIENT_ERROR = between(400, 499);
  public static final StatusRange SERVER_ERROR = between(500, 599);

  private final IntPredicate predicate;
  private final String description;

  private StatusRange(IntPredicate predicate, String description) {
    this.predicate = predicate;
    this.description = description;
  }

  public boolean contains(int statusCode) {
    return predicate.test(statusCode);
  }

  /** Returns a range containing the codes of this range and the given one. */
  public StatusRange or(StatusRange other) {
    requireNonNull(other);
    return new StatusRange(
        predicate.or(other.predicate), description + " or " + other.description);
  }

  @Override
  public String toString() {
    return description;
  }

  /** Returns the range of codes from {@code from} to {@code to}, both inclusive. */
  public static StatusRange between(int from, int to) {
    requireArgument(from <= to, "Expected %d to be at most %d", from, to);
    return new StatusRange(code -> code >= from && code <= to, from + "-" + to);
  }

  /** Returns a range containing exactly the given codes. */
  public static StatusRange of(int... codes) {
    requireArgument(codes.length > 0, "Expected at least one status code");
    var codeSet = Arrays.stream(codes).boxed().collect(Collectors.toUnmodifiableSet());
    return new StatusRange(codeSet::contains, codeSet.toString());
  }
}
