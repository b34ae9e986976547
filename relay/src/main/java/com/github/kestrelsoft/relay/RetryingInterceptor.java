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

import static com.github.kestrelsoft.relay.internal.Utils.requirePositiveDuration;
import static com.github.kestrelsoft.relay.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import com.github.kestrelsoft.relay.internal.HttpDates;
import com.github.kestrelsoft.relay.internal.Utils;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An interceptor that asks for retries based on configurable conditions. Status-driven retries
 * only happen with an interceptor like this one; the pipeline never retries on its own.
 *
 * <p>Each attempt is matched against the conditions in the order they were added. If one matches,
 * the interceptor votes {@link Evaluation#retryAfter(Duration) retryAfter} with the delay computed
 * by its {@link BackoffStrategy}. Otherwise, or after {@code maxRetries} retries, it lets the
 * attempt proceed, so the last response or transport failure is classified as usual.
 *
 * <h2>Example:</h2>
 *
 * Retry server errors and connection failures with exponential backoff:
 *
 * <pre>{@code
 * var client = RelayClient.newBuilder()
 *     .interceptor(RetryingInterceptor.newBuilder()
 *         .maxRetries(3)
 *         .backoff(BackoffStrategy.exponential(
 *             Duration.ofMillis(100),
 *             Duration.ofSeconds(10)).withJitter())
 *         .onStatus(500, 502, 503, 504)
 *         .onException(ConnectException.class)
 *         .build())
 *     .build();
 * }</pre>
 *
 * <p>Note that the client's {@link Options#maxRetryCount()} still bounds the number of retries of
 * a call, whatever {@code maxRetries} is.
 */
public final class RetryingInterceptor implements Interceptor {
  private final Predicate<Request> selector;
  private final int maxRetries;
  private final List<Predicate<Attempt>> conditions;
  private final BackoffStrategy backoffStrategy;
  private final Listener listener;

  private RetryingInterceptor(Predicate<Request> selector, Builder builder) {
    this.selector = requireNonNull(selector);
    this.maxRetries = builder.maxRetries;
    this.conditions = List.copyOf(builder.conditions);
    this.backoffStrategy = builder.backoffStrategy;
    this.listener = builder.listener;
  }

  @Override
  public void prepare(MutableRequest request, Context context) {
    if (context.retryCount() == 0 && selector.test(context.request())) {
      listener.onFirstAttempt(context.request());
    }
  }

  @Override
  public Evaluation handle(Throwable transportError, Context context) {
    return selector.test(context.request())
        ? evaluate(Attempt.of(context.request(), null, transportError, context.retryCount()))
        : Evaluation.proceed();
  }

  @Override
  public Evaluation process(ResponseBuilder response, Context context) {
    return selector.test(context.request())
        ? evaluate(Attempt.of(response.request(), response.build(), null, context.retryCount()))
        : Evaluation.proceed();
  }

  private Evaluation evaluate(Attempt attempt) {
    if (conditions.stream().noneMatch(condition -> condition.test(attempt))) {
      listener.onComplete(attempt);
      return Evaluation.proceed();
    }
    if (attempt.retryCount() >= maxRetries) {
      listener.onExhaustion(attempt);
      return Evaluation.proceed();
    }

    var delay = backoffStrategy.backoff(attempt);
    listener.onRetry(attempt, delay);
    return Evaluation.retryAfter(delay);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** The outcome of an attempt, on which retry conditions are evaluated. */
  public static final class Attempt {
    private final Request request;
    private final @Nullable Response response;
    private final @Nullable Throwable exception;
    private final int retryCount;

    private Attempt(
        Request request,
        @Nullable Response response,
        @Nullable Throwable exception,
        int retryCount) {
      this.request = request;
      this.response = response;
      this.exception = exception;
      this.retryCount = retryCount;
    }

    /** Returns the request sent in this attempt. */
    public Request request() {
      return request;
    }

    /**
     * Returns the attempt's response. Exactly one of {@code response()} or {@link #exception()} is
     * present.
     */
    public Optional<Response> response() {
      return Optional.ofNullable(response);
    }

    /**
     * Returns the attempt's transport failure. Exactly one of {@link #response()} or {@code
     * exception()} is present.
     */
    public Optional<Throwable> exception() {
      return Optional.ofNullable(exception);
    }

    /** Returns the number of retries made before this attempt. */
    public int retryCount() {
      return retryCount;
    }

    @Override
    public String toString() {
      return "Attempt[request="
          + request
          + ", response="
          + response
          + ", exception="
          + exception
          + ", retryCount="
          + retryCount
          + "]";
    }

    /**
     * Creates a new attempt.
     *
     * @throws IllegalArgumentException if it is not the case that exactly one of {@code response}
     *     or {@code exception} is non-null, or if {@code retryCount} is negative
     */
    public static Attempt of(
        Request request,
        @Nullable Response response,
        @Nullable Throwable exception,
        int retryCount) {
      requireNonNull(request);
      requireArgument(
          response != null ^ exception != null,
          "Exactly one of response or exception must be present");
      requireArgument(retryCount >= 0, "Negative retryCount: %d", retryCount);
      return new Attempt(request, response, exception, retryCount);
    }
  }

  /** A strategy for computing the delay before a retry. */
  @FunctionalInterface
  public interface BackoffStrategy {

    /** Returns how long to wait before retrying the given attempt. */
    Duration backoff(Attempt attempt);

    /**
     * Returns a {@code BackoffStrategy} that applies <a
     * href="https://aws.amazon.com/blogs/architecture/exponential-backoff-and-jitter/">full
     * jitter</a> to this {@code BackoffStrategy}. Same as {@link #withJitter(double)
     * withJitter(1.0)}.
     */
    default BackoffStrategy withJitter() {
      return withJitter(1.0);
    }

    /**
     * Returns a {@code BackoffStrategy} that randomizes the delays of this one. A delay {@code d}
     * becomes a random delay between {@code d * (1 - factor)} and {@code d}.
     */
    default BackoffStrategy withJitter(double factor) {
      requireArgument(
          Double.compare(factor, 0.0) >= 0 && Double.compare(factor, 1.0) <= 0,
          "Expected %f to be between 0.0 and 1.0",
          factor);
      return attempt -> {
        long delayMillis = backoff(attempt).toMillis();
        long jitterRangeMillis = Math.round(delayMillis * factor);
        return Duration.ofMillis(
            Math.max(
                0,
                delayMillis
                    - jitterRangeMillis
                    + Math.round(jitterRangeMillis * ThreadLocalRandom.current().nextDouble())));
      };
    }

    /** Returns a {@code BackoffStrategy} that retries immediately. */
    static BackoffStrategy none() {
      return __ -> Duration.ZERO;
    }

    /** Returns a {@code BackoffStrategy} that waits the same delay before every retry. */
    static BackoffStrategy fixed(Duration delay) {
      requirePositiveDuration(delay);
      return __ -> delay;
    }

    /**
     * Returns a {@code BackoffStrategy} with a delay that grows linearly with each retry, starting
     * at {@code base} and never exceeding {@code cap}.
     */
    static BackoffStrategy linear(Duration base, Duration cap) {
      requirePositiveDuration(base);
      requirePositiveDuration(cap);
      return attempt -> {
        int retryCount = attempt.retryCount();
        return retryCount < Integer.MAX_VALUE // Avoid overflow.
            ? min(cap, base.multipliedBy(retryCount + 1L))
            : cap;
      };
    }

    /**
     * Returns a {@code BackoffStrategy} with a delay that doubles with each retry, starting at
     * {@code base} and never exceeding {@code cap}.
     */
    static BackoffStrategy exponential(Duration base, Duration cap) {
      requirePositiveDuration(base);
      requirePositiveDuration(cap);
      requireArgument(
          base.compareTo(cap) <= 0,
          "Base delay (%s) must be less than or equal to cap delay (%s)",
          base,
          cap);
      return attempt -> {
        int retryCount = attempt.retryCount();
        return retryCount < Long.SIZE - 2 // Avoid overflow.
            ? min(cap, base.multipliedBy(1L << retryCount))
            : cap;
      };
    }

    /**
     * Returns a {@code BackoffStrategy} that takes the delay from the response's {@code
     * Retry-After} header, which is either delta seconds or an HTTP date. Attempts without a usable
     * header, including transport failures, get the delay of the given strategy.
     */
    static BackoffStrategy retryAfterOr(BackoffStrategy fallback) {
      return retryAfterOrBackoffStrategy(fallback, Utils.systemMillisUtc());
    }

    private static Duration min(Duration left, Duration right) {
      return left.compareTo(right) <= 0 ? left : right;
    }
  }

  static BackoffStrategy retryAfterOrBackoffStrategy(BackoffStrategy fallback, Clock clock) {
    requireNonNull(fallback);
    requireNonNull(clock);
    return attempt ->
        attempt
            .response()
            .flatMap(response -> response.headers().firstValue(Header.RETRY_AFTER))
            .flatMap(value -> HttpDates.tryParseRetryAfter(value, clock))
            .orElseGet(() -> fallback.backoff(attempt));
  }

  /** A listener for {@link RetryingInterceptor} events, e.g. for logging or metrics. */
  public interface Listener {

    /** Called when a call is about to make its first attempt. */
    default void onFirstAttempt(Request request) {}

    /** Called when the interceptor asks for a retry of the given attempt after the given delay. */
    default void onRetry(Attempt attempt, Duration delay) {}

    /** Called when no retry condition matches the given attempt. */
    default void onComplete(Attempt attempt) {}

    /**
     * Called when a retry condition matches but {@code maxRetries} retries were made already. The
     * attempt then proceeds as is.
     */
    default void onExhaustion(Attempt attempt) {}
  }

  private enum EmptyListener implements Listener {
    INSTANCE
  }

  /**
   * A builder of {@link RetryingInterceptor} instances.
   *
   * <p><b>Note:</b> Retry conditions are evaluated in the order they are added, and the first
   * matching one wins.
   */
  public static final class Builder {
    private static final int DEFAULT_MAX_RETRIES = 5;

    private final List<Predicate<Attempt>> conditions = new ArrayList<>();
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private BackoffStrategy backoffStrategy = BackoffStrategy.none();
    private Listener listener = EmptyListener.INSTANCE;

    Builder() {}

    /**
     * Specifies the maximum number of retries the interceptor asks for. The default is 5.
     *
     * @throws IllegalArgumentException if {@code maxRetries} is not positive
     */
    @CanIgnoreReturnValue
    public Builder maxRetries(int maxRetries) {
      requireArgument(maxRetries > 0, "maxRetries must be positive");
      this.maxRetries = maxRetries;
      return this;
    }

    /** Sets the {@code BackoffStrategy}. The default is {@link BackoffStrategy#none()}. */
    @CanIgnoreReturnValue
    public Builder backoff(BackoffStrategy backoffStrategy) {
      this.backoffStrategy = requireNonNull(backoffStrategy);
      return this;
    }

    /** Retries transport failures that are instances of any of the given types. */
    @SafeVarargs
    @CanIgnoreReturnValue
    public final Builder onException(Class<? extends Throwable>... exceptionTypes) {
      var exceptionTypesCopy = Set.of(exceptionTypes);
      return onException(t -> exceptionTypesCopy.stream().anyMatch(c -> c.isInstance(t)));
    }

    /** Retries transport failures that satisfy the given predicate. */
    @CanIgnoreReturnValue
    public Builder onException(Predicate<Throwable> exceptionPredicate) {
      requireNonNull(exceptionPredicate);
      return on(attempt -> attempt.exception().map(exceptionPredicate::test).orElse(false));
    }

    /** Retries responses with any of the given status codes. */
    @CanIgnoreReturnValue
    public Builder onStatus(Integer... codes) {
      var codesCopy = Set.of(codes);
      return onStatus(codesCopy::contains);
    }

    /** Retries responses with a status code in the given range. */
    @CanIgnoreReturnValue
    public Builder onStatus(StatusRange range) {
      requireNonNull(range);
      return onStatus(range::contains);
    }

    /** Retries responses with a status code that satisfies the given predicate. */
    @CanIgnoreReturnValue
    public Builder onStatus(Predicate<Integer> statusPredicate) {
      requireNonNull(statusPredicate);
      return onResponse(response -> statusPredicate.test(response.statusCode()));
    }

    /** Retries responses that satisfy the given predicate. */
    @CanIgnoreReturnValue
    public Builder onResponse(Predicate<Response> responsePredicate) {
      requireNonNull(responsePredicate);
      return on(attempt -> attempt.response().map(responsePredicate::test).orElse(false));
    }

    /** Retries attempts that satisfy the given predicate. */
    @CanIgnoreReturnValue
    public Builder on(Predicate<Attempt> predicate) {
      conditions.add(requireNonNull(predicate));
      return this;
    }

    /** Sets the listener for retry events. */
    @CanIgnoreReturnValue
    public Builder listener(Listener listener) {
      this.listener = requireNonNull(listener);
      return this;
    }

    /** Builds a {@code RetryingInterceptor} that evaluates all requests. */
    public RetryingInterceptor build() {
      return build(__ -> true);
    }

    /**
     * Builds a {@code RetryingInterceptor} that only evaluates calls whose request satisfies the
     * given predicate, letting other calls proceed as they are.
     */
    public RetryingInterceptor build(Predicate<Request> selector) {
      return new RetryingInterceptor(selector, this);
    }
  }
}
