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

import com.github.kestrelsoft.relay.internal.Utils;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Runs a request through the interceptor chain, the transport and the retry loop. The whole call
 * runs on one thread: attempts never overlap, and each attempt finishes its evaluation before the
 * next one starts. Waiting on the transport or on a retry delay is the only blocking the pipeline
 * itself does, and both waits are aborted by {@link #cancel()}.
 */
final class PipelineCall implements RelayClient.Call {
  private static final Logger logger = System.getLogger(PipelineCall.class.getName());

  private final RelayClient client;
  private final Context initialContext;
  private final List<Interceptor> interceptors;
  private final AtomicBoolean executed = new AtomicBoolean();
  private final Object lock = new Object();

  private volatile boolean canceled;

  @GuardedBy("lock")
  private @Nullable CompletableFuture<?> inFlight;

  PipelineCall(RelayClient client, Context initialContext, List<Interceptor> interceptors) {
    this.client = requireNonNull(client);
    this.initialContext = requireNonNull(initialContext);
    this.interceptors = requireNonNull(interceptors);
  }

  @Override
  public Request request() {
    return initialContext.request();
  }

  @Override
  public Result<Response> execute() {
    markExecuted();
    return run();
  }

  @Override
  public CompletableFuture<Result<Response>> executeAsync() {
    markExecuted();
    var future = CompletableFuture.supplyAsync(this::run, client.executor());
    future.whenComplete(
        (__, e) -> {
          if (e instanceof CancellationException) {
            cancel();
          }
        });
    return future;
  }

  @Override
  public void cancel() {
    CompletableFuture<?> futureToCancel;
    synchronized (lock) {
      if (canceled) {
        return;
      }
      canceled = true;
      futureToCancel = inFlight;
    }
    if (futureToCancel != null) {
      futureToCancel.cancel(true);
    }
  }

  @Override
  public boolean isCanceled() {
    return canceled;
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this) + "[" + initialContext.request() + "]";
  }

  private void markExecuted() {
    requireState(executed.compareAndSet(false, true), "Call already executed: %s", this);
  }

  private Result<Response> run() {
    try {
      return Result.success(loop());
    } catch (HttpFailure failure) {
      logger.log(Level.DEBUG, () -> "Call failed: " + request(), failure);
      return Result.failure(failure);
    }
  }

  private Response loop() throws HttpFailure {
    int maxRetryCount = client.options().maxRetryCount();
    var context = initialContext;
    while (true) {
      var outcome = attempt(context);
      if (outcome.retry == null) {
        return classify(requireNonNull(outcome.response));
      }

      if (context.retryCount() >= maxRetryCount) {
        throw HttpFailure.maxRetryCountReached(maxRetryCount);
      }

      var delay = outcome.retry.delay();
      if (delay.isPresent() && !delay.get().isZero()) {
        var retryAfter = delay.get();
        logger.log(Level.DEBUG, () -> "Retrying " + request() + " after " + retryAfter);
        try {
          await(sleep(retryAfter));
        } catch (ExecutionException e) {
          // The retry can't be scheduled, so the call is abandoned.
          throw HttpFailure.canceled(Utils.unwrapCompletionCause(e.getCause()));
        }
      } else {
        logger.log(Level.DEBUG, () -> "Retrying " + request());
      }
      checkCanceled();
      context = context.nextAttempt();
    }
  }

  private AttemptOutcome attempt(Context context) throws HttpFailure {
    var request = prepare(context);
    notifyObservers(observer -> observer.onPrepared(request, context));

    TransportResponse transportResponse;
    try {
      transportResponse = await(send(request));
    } catch (ExecutionException e) {
      checkCanceled();
      return handle(Utils.unwrapCompletionCause(e.getCause()), context);
    }
    checkCanceled();
    notifyObservers(observer -> observer.onResponse(request, transportResponse, context));
    return process(ResponseBuilder.from(transportResponse, request), context);
  }

  private CompletableFuture<TransportResponse> send(Request request) {
    try {
      return client.transport().sendAsync(request, client.options().timeout());
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private CompletableFuture<Void> sleep(Duration delay) {
    try {
      return client.delayer().sleep(delay);
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

    private Request prepare(Context context) throws HttpFailure {
    checkCanceled();
    var request = MutableRequest.copyOf(context.request());
    var userAgent = client.userAgent();
    if (userAgent.isPresent()) {
      request.setHeaderIfAbsent(Header.USER_AGENT, userAgent.get());
    }
    for (var interceptor : interceptors) {
      checkCanceled();
      try {
        interceptor.prepare(request, context);
      } catch (Exception e) {
        throw HttpFailure.preparation(e);
      }
    }
    checkCanceled();
    return request.toImmutableRequest();
  }

  private AttemptOutcome handle(Throwable transportError, Context context) throws HttpFailure {
    notifyObservers(observer -> observer.onTransportError(transportError, context));
    for (int i = interceptors.size() - 1; i >= 0; i--) {
      checkCanceled();
      Evaluation evaluation;
      try {
        evaluation = requireNonNull(interceptors.get(i).handle(transportError, context));
      } catch (RuntimeException e) {
        var failure = HttpFailure.transport(transportError);
        failure.addSuppressed(e);
        throw failure;
      }
      checkCanceled();
      if (evaluation.isRetry()) {
        return AttemptOutcome.retry(evaluation);
      }
    }
    throw HttpFailure.transport(transportError);
  }

  private AttemptOutcome process(ResponseBuilder response, Context context) throws HttpFailure {
    for (int i = interceptors.size() - 1; i >= 0; i--) {
      checkCanceled();
      Evaluation evaluation;
      try {
        evaluation = requireNonNull(interceptors.get(i).process(response, context));
      } catch (Exception e) {
        throw HttpFailure.processing(e);
      }
      checkCanceled();
      if (evaluation.isRetry()) {
        return AttemptOutcome.retry(evaluation);
      }
    }
    return AttemptOutcome.proceed(response.build());
  }

  private static Response classify(Response response) throws HttpFailure {
    int statusCode = response.statusCode();
    if (HttpStatus.isSuccessful(statusCode) || HttpStatus.isRedirection(statusCode)) {
      return response;
    } else if (HttpStatus.isClientError(statusCode)) {
      throw HttpFailure.status(HttpFailure.Kind.CLIENT_ERROR, response);
    } else if (HttpStatus.isServerError(statusCode)) {
      throw HttpFailure.status(HttpFailure.Kind.SERVER_ERROR, response);
    } else {
      throw HttpFailure.status(HttpFailure.Kind.UNEXPECTED_STATUS, response);
    }
  }

  /**
   * Waits for the given future, cancelling it if the call is cancelled meanwhile. A failure of the
   * future is rethrown as an {@code ExecutionException}.
   */
  private <T> T await(CompletableFuture<T> future) throws HttpFailure, ExecutionException {
    synchronized (lock) {
      if (canceled) {
        future.cancel(true);
        throw HttpFailure.canceled();
      }
      inFlight = future;
    }

    try {
      return future.get();
    } catch (InterruptedException e) {
      cancel();
      Thread.currentThread().interrupt();
      throw HttpFailure.canceled(e);
    } catch (CancellationException e) {
      if (canceled) {
        throw HttpFailure.canceled(e);
      }
      throw new ExecutionException(e);
    } finally {
      synchronized (lock) {
        inFlight = null;
      }
    }
  }

  private void checkCanceled() throws HttpFailure {
    if (canceled) {
      throw HttpFailure.canceled();
    }
  }

  private void notifyObservers(Consumer<Observer> notification) {
    for (var observer : client.observers()) {
      try {
        notification.accept(observer);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Exception thrown by observer: " + observer, e);
      }
    }
  }

  /** Either the response of an attempt that all interceptors let through, or a retry verdict. */
  private static final class AttemptOutcome {
    final @Nullable Response response;
    final @Nullable Evaluation retry;

    private AttemptOutcome(@Nullable Response response, @Nullable Evaluation retry) {
      this.response = response;
      this.retry = retry;
    }

    static AttemptOutcome proceed(Response response) {
      return new AttemptOutcome(response, null);
    }

    static AttemptOutcome retry(Evaluation evaluation) {
      return new AttemptOutcome(null, evaluation);
    }
  }
}
