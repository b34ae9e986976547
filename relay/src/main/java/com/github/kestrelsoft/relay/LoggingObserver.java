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

import static java.util.Objects.requireNonNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;

/**
 * An {@link Observer} that logs the progress of calls to a {@link System.Logger}. Prepared requests
 * and responses are logged at the configured level, and transport failures at {@code WARNING}.
 */
public final class LoggingObserver implements Observer {
  private final Logger logger;
  private final Level level;

  private LoggingObserver(Logger logger, Level level) {
    this.logger = requireNonNull(logger);
    this.level = requireNonNull(level);
  }

  @Override
  public void onPrepared(Request request, Context context) {
    if (logger.isLoggable(level)) {
      logger.log(
          level,
          "Sending {0} (retryCount={1}, headers={2})",
          request,
          context.retryCount(),
          request.headers());
    }
  }

  @Override
  public void onTransportError(Throwable error, Context context) {
    logger.log(
        Level.WARNING,
        "Transport failed for " + context.request() + " (retryCount=" + context.retryCount() + ")",
        error);
  }

  @Override
  public void onResponse(Request request, TransportResponse response, Context context) {
    if (logger.isLoggable(level)) {
      logger.log(
          level,
          "Received {0} for {1} (retryCount={2}, headers={3})",
          response.statusCode(),
          request,
          context.retryCount(),
          response.headers());
    }
  }

  /** Returns an observer that logs to the {@code com.github.kestrelsoft.relay} logger. */
  public static LoggingObserver create() {
    return create(System.getLogger(LoggingObserver.class.getPackageName()), Level.DEBUG);
  }

  public static LoggingObserver create(Logger logger, Level level) {
    return new LoggingObserver(logger, level);
  }
}
