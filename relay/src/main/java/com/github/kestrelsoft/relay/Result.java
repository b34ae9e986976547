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

import static com.github.kestrelsoft.relay.internal.Validate.requireState;
import static java.util.Objects.requireNonNull;

import java.util.Optional;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The outcome of a call: either a success carrying a possibly absent value, or exactly one {@link
 * HttpFailure}. A success has an absent value when the response's status code was one the caller
 * declared as empty (e.g. {@code 204}), or when the parser discards the body.
 */
public final class Result<T> {
  private final @Nullable T value;
  private final @Nullable HttpFailure failure;

  private Result(@Nullable T value, @Nullable HttpFailure failure) {
    this.value = value;
    this.failure = failure;
  }

  public boolean isSuccess() {
    return failure == null;
  }

  public boolean isFailure() {
    return failure != null;
  }

  /** Returns the value of a successful result, or an empty {@code Optional} otherwise. */
  public Optional<T> value() {
    return Optional.ofNullable(value);
  }

  public Optional<HttpFailure> failure() {
    return Optional.ofNullable(failure);
  }

  /**
   * Returns the value of this result, which may be {@code null} for successful results without a
   * value.
   *
   * @throws HttpFailure if this result is a failure
   */
  public @Nullable T get() throws HttpFailure {
    if (failure != null) {
      throw failure;
    }
    return value;
  }

  /**
   * Returns the failure of this result.
   *
   * @throws IllegalStateException if this result is a success
   */
  public HttpFailure getFailure() {
    requireState(failure != null, "Not a failure");
    return failure;
  }

  /** Applies the given function to this result's value, if successful. */
  public <U> Result<U> map(Function<? super @Nullable T, ? extends @Nullable U> mapper) {
    requireNonNull(mapper);
    return failure == null ? success(mapper.apply(value)) : failure(failure);
  }

  /** Replaces this result by what the given function returns for its value, if successful. */
  public <U> Result<U> flatMap(Function<? super @Nullable T, Result<U>> mapper) {
    requireNonNull(mapper);
    return failure == null ? requireNonNull(mapper.apply(value)) : failure(failure);
  }

  @Override
  public String toString() {
    return failure == null ? "Result[success=" + value + "]" : "Result[failure=" + failure + "]";
  }

  public static <T> Result<T> success(@Nullable T value) {
    return new Result<>(value, null);
  }

  public static <T> Result<T> failure(HttpFailure failure) {
    return new Result<>(null, requireNonNull(failure));
  }
}
