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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The executor and delayer of clients that aren't given their own. Each is created on first use.
 * Their threads are daemons, so an idle client never keeps the JVM alive.
 */
public final class SharedExecutors {
  private SharedExecutors() {}

  /** Runs asynchronous calls. */
  public static ExecutorService executor() {
    return ExecutorHolder.EXECUTOR;
  }

  /** Times retry delays. */
  public static Delayer delayer() {
    return DelayerHolder.DELAYER;
  }

  private static ThreadFactory daemonThreadFactory(String namePrefix) {
    var nextId = new AtomicInteger();
    return runnable -> {
      var thread = new Thread(runnable, namePrefix + nextId.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    };
  }

  private static final class ExecutorHolder {
    static final ExecutorService EXECUTOR =
        Executors.newCachedThreadPool(daemonThreadFactory("relay-call-"));
  }

  private static final class DelayerHolder {
    static final Delayer DELAYER =
        new SchedulerDelayer(
            Executors.newSingleThreadScheduledExecutor(daemonThreadFactory("relay-delayer-")));
  }
}
