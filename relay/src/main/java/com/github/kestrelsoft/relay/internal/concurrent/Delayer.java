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

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

/** Schedules tasks to run after a delay. Cancelling a returned future unschedules its task. */
public interface Delayer {

  /**
   * Arranges for the given task to run on the given executor after the given delay. The returned
   * future completes when the task completes.
   */
  CompletableFuture<Void> delay(Runnable task, Duration delay, Executor executor);

  /** Returns a future that completes after the given delay, unless it's cancelled before that. */
  default CompletableFuture<Void> sleep(Duration delay) {
    return delay(() -> {}, delay, Runnable::run);
  }

  static Delayer of(ScheduledExecutorService scheduler) {
    return new SchedulerDelayer(scheduler);
  }

  static Delayer defaultDelayer() {
    return SharedExecutors.delayer();
  }
}
