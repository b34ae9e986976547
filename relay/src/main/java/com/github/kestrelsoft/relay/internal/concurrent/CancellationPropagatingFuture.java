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

package com.github.kestrelsoft.relay.internal.concurrent;

import java.util.concurrent.CompletableFuture;

/**
 * A {@link CompletableFuture} that cancels its upstream when it, or any future depending on it, is
 * cancelled. Plain {@code CompletableFuture} dependents don't do that, so cancelling the result of
 * {@code transportFuture.thenApply(...)} would otherwise leave the exchange running.
 */
public final class CancellationPropagatingFuture<T> extends CompletableFuture<T> {
  private final CompletableFuture<Boolean> cancellation;

  private CancellationPropagatingFuture(CompletableFuture<Boolean> cancellation) {
    this.cancellation = cancellation;
  }

  @Override
  public <U> CompletableFuture<U> newIncompleteFuture() {
    return new CancellationPropagatingFuture<>(cancellation);
  }

  @Override
  public boolean cancel(boolean mayInterruptIfRunning) {
    if (!super.cancel(mayInterruptIfRunning)) {
      return false;
    }
    cancellation.complete(mayInterruptIfRunning);
    return true;
  }

  /** Returns a future that completes with the given upstream and cancels it when cancelled. */
  public static <T> CompletableFuture<T> of(CompletableFuture<T> upstream) {
    if (upstream instanceof CancellationPropagatingFuture) {
      return upstream;
    }

    var downstream = new CancellationPropagatingFuture<T>(new CompletableFuture<>());
    downstream.cancellation.thenAccept(upstream::cancel);
    upstream.whenComplete(
        (result, exception) -> {
          if (exception != null) {
            downstream.completeExceptionally(exception);
          } else {
            downstream.complete(result);
          }
        });
    return downstream;
  }
}
