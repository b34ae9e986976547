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

import java.net.URI;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable outgoing request. A request flowing through the pipeline is only changed by {@link
 * Interceptor#prepare(MutableRequest, Context) interceptors}, which see a {@link MutableRequest}
 * copy of it.
 */
public final class Request {
  private final URI uri;
  private final String method;
  private final byte @Nullable [] body;
  private final Headers headers;
  private final boolean followRedirects;

  Request(
      URI uri, String method, byte @Nullable [] body, Headers headers, boolean followRedirects) {
    this.uri = requireNonNull(uri);
    this.method = requireNonNull(method);
    this.body = body != null ? body.clone() : null;
    this.headers = requireNonNull(headers);
    this.followRedirects = followRedirects;
  }

  public URI uri() {
    return uri;
  }

  public String method() {
    return method;
  }

  /** Returns a copy of this request's body bytes, if it has a body. */
  public Optional<byte[]> body() {
    return body != null ? Optional.of(body.clone()) : Optional.empty();
  }

  public Headers headers() {
    return headers;
  }

  /** Returns whether the transport should follow redirects for this request. */
  public boolean followRedirects() {
    return followRedirects;
  }

  /** Returns a {@link MutableRequest} initialized with this request's fields. */
  public MutableRequest mutate() {
    return MutableRequest.copyOf(this);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof Request)) {
      return false;
    }
    var other = (Request) obj;
    return uri.equals(other.uri)
        && method.equals(other.method)
        && Arrays.equals(body, other.body)
        && headers.equals(other.headers)
        && followRedirects == other.followRedirects;
  }

  @Override
  public int hashCode() {
    return Objects.hash(uri, method, Arrays.hashCode(body), headers, followRedirects);
  }

  @Override
  public String toString() {
    return method + " " + uri;
  }
}
