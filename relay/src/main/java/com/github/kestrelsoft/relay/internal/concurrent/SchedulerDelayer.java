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

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

import com.github.kestrelsoft.relay.internal.Utils;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link Delayer} that times delays on a {@link ScheduledExecutorService}. The scheduler only
 * hands due tasks over to their executors, so a single scheduler thread can serve the retry waits
 * of all calls.
 */
final class SchedulerDelayer implements Delayer {
  private final ScheduledExecutorService scheduler;

  SchedulerDelayer(ScheduledExecutorService scheduler) {
    this.scheduler = requireNonNull(scheduler);
  }

  @Override
  @SuppressWarnings("FutureReturnValueIgnored")
  public CompletableFuture<Void> delay(Runnable task, Duration delay, Executor executor) {
    requireNonNull(task);
    requireNonNull(delay);
    requireNonNull(executor);
    var future = new CompletableFuture<Void>();
    if (delay.isZero() || delay.isNegative()) {
      return future.completeAsync(() -> run(task), executor);
    }

    ScheduledFuture<?> timer;
    try {
      timer =
          scheduler.schedule(
              () -> {
                future.completeAsync(() -> run(task), executor);
              },
              NANOSECONDS.convert(delay),
              NANOSECONDS);
    } catch (RejectedExecutionException e) {
      future.completeExceptionally(e);
      return future;
    }

    // Unschedule the timer if the wait is abandoned.
    future.whenComplete(
        (__, e) -> {
          if (future.isCancelled()) {
            timer.cancel(false);
          }
        });
    return future;
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this) + "[scheduler=" + scheduler + "]";
  }

  private static @Nullable Void run(Runnable task) {
    task.run();
    return null;
  }
}
