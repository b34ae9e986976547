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

import static com.github.kestrelsoft.relay.internal.Validate.requireNonNegative;
import static java.util.Objects.requireNonNull;

import com.github.kestrelsoft.relay.internal.Utils;
import java.util.Map;
import java.util.Optional;

/**
 * State of one call as it moves through the pipeline. A call starts with a {@code retryCount} of
 * zero, and each retry gets a new {@code Context} with a count that's larger by one. The request,
 * tags and codec stay the same for all attempts of a call.
 */
public final class Context {
  private final Request request;
  private final Map<String, String> tags;
  private final int retryCount;
  private final AdapterCodec adapterCodec;

  private Context(
      Request request, Map<String, String> tags, int retryCount, AdapterCodec adapterCodec) {
    this.request = request;
    this.tags = tags;
    this.retryCount = retryCount;
    this.adapterCodec = adapterCodec;
  }

  /**
   * Returns the request the call was started with. Each attempt prepares a fresh copy of this
   * request, so headers set by interceptors don't pile up across retries.
   */
  public Request request() {
    return request;
  }

  /** Returns the caller-supplied tags of this call. */
  public Map<String, String> tags() {
    return tags;
  }

  public Optional<String> tag(String name) {
    return Optional.ofNullable(tags.get(name));
  }

  /** Returns the number of retries made before the current attempt. */
  public int retryCount() {
    return retryCount;
  }

  /** Returns the codec this call encodes & decodes with. */
  public AdapterCodec adapterCodec() {
    return adapterCodec;
  }

  /** Returns the context for the attempt following this one. */
  Context nextAttempt() {
    return new Context(request, tags, retryCount + 1, adapterCodec);
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this)
        + "[request="
        + request
        + ", tags="
        + tags
        + ", retryCount="
        + retryCount
        + "]";
  }

  /** Returns the context of a call's first attempt. */
  public static Context of(Request request, Map<String, String> tags, AdapterCodec adapterCodec) {
    return of(request, tags, 0, adapterCodec);
  }

  public static Context of(
      Request request, Map<String, String> tags, int retryCount, AdapterCodec adapterCodec) {
    return new Context(
        requireNonNull(request),
        Map.copyOf(tags),
        requireNonNegative(retryCount, "retryCount"),
        requireNonNull(adapterCodec));
  }
}
