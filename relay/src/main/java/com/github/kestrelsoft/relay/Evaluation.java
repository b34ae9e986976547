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

import static com.github.kestrelsoft.relay.internal.Utils.requireNonNegativeDuration;

import java.time.Duration;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/** An interceptor's verdict on a transport failure or a response. */
public final class Evaluation {
  private static final Evaluation PROCEED = new Evaluation(Verdict.PROCEED, null);
  private static final Evaluation RETRY = new Evaluation(Verdict.RETRY, null);

  /** What the pipeline should do next. */
  public enum Verdict {
    /** Let the next interceptor evaluate, or classify the outcome if there are none left. */
    PROCEED,

    /** Retry the call immediately. */
    RETRY,

    /** Retry the call after a delay. */
    RETRY_AFTER
  }

  private final Verdict verdict;
  private final @Nullable Duration delay;

  private Evaluation(Verdict verdict, @Nullable Duration delay) {
    this.verdict = verdict;
    this.delay = delay;
  }

  public Verdict verdict() {
    return verdict;
  }

  /** Returns the delay of a {@link Verdict#RETRY_AFTER} verdict. */
  public Optional<Duration> delay() {
    return Optional.ofNullable(delay);
  }

  /** Returns {@code true} if this evaluation asks for a retry, delayed or not. */
  public boolean isRetry() {
    return verdict != Verdict.PROCEED;
  }

  @Override
  public String toString() {
    return delay != null ? verdict + "(" + delay + ")" : verdict.toString();
  }

  public static Evaluation proceed() {
    return PROCEED;
  }

  public static Evaluation retry() {
    return RETRY;
  }

  /**
   * Returns an evaluation asking for a retry after the given delay.
   *
   * @throws IllegalArgumentException if the delay is negative
   */
  public static Evaluation retryAfter(Duration delay) {
    return new Evaluation(Verdict.RETRY_AFTER, requireNonNegativeDuration(delay));
  }
}
