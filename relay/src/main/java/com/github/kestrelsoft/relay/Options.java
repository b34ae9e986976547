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
import static com.github.kestrelsoft.relay.internal.Validate.requireNonNegative;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.time.Duration;

/** Client-wide tuning of calls. */
public final class Options {
  private static final int DEFAULT_MAX_RETRY_COUNT = 5;
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  private static final Options DEFAULTS = newBuilder().build();

  private final int maxRetryCount;
  private final Duration timeout;

  private Options(Builder builder) {
    this.maxRetryCount = builder.maxRetryCount;
    this.timeout = builder.timeout;
  }

  /**
   * Returns the maximum number of retries a call makes. A call makes at most {@code maxRetryCount
   * + 1} attempts.
   */
  public int maxRetryCount() {
    return maxRetryCount;
  }

  /** Returns the timeout handed to the transport for each attempt. */
  public Duration timeout() {
    return timeout;
  }

  @Override
  public String toString() {
    return "Options[maxRetryCount=" + maxRetryCount + ", timeout=" + timeout + "]";
  }

  /** Returns options with a {@code maxRetryCount} of 5 and a timeout of 30 seconds. */
  public static Options defaults() {
    return DEFAULTS;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** A builder of {@code Options}. */
  public static final class Builder {
    private int maxRetryCount = DEFAULT_MAX_RETRY_COUNT;
    private Duration timeout = DEFAULT_TIMEOUT;

    Builder() {}

    @CanIgnoreReturnValue
    public Builder maxRetryCount(int maxRetryCount) {
      this.maxRetryCount = requireNonNegative(maxRetryCount, "maxRetryCount");
      return this;
    }

    @CanIgnoreReturnValue
    public Builder timeout(Duration timeout) {
      this.timeout = requirePositiveDuration(timeout);
      return this;
    }

    public Options build() {
      return new Options(this);
    }
  }
}
