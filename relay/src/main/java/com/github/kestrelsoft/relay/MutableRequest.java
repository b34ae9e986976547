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

import com.github.kestrelsoft.relay.internal.extensions.HeadersBuilder;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.net.URI;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A mutable {@link Request}. This is what {@link Interceptor#prepare(MutableRequest, Context)}
 * receives: interceptors add or replace headers, sign the request or change its target, and the
 * pipeline takes an {@link #toImmutableRequest() immutable snapshot} before it reaches the
 * transport.
 *
 * <p>{@code MutableRequest} also works as a builder when the request is created:
 *
 * <pre>{@code
 * client.send(
 *     MutableRequest.GET("https://example.com/articles?q=java")
 *         .header("Accept", "application/json")
 *         .toImmutableRequest());
 * }</pre>
 */
public final class MutableRequest {
  private final HeadersBuilder headersBuilder = new HeadersBuilder();

  private URI uri;
  private String method = HttpMethod.GET;
  private byte @Nullable [] body;
  private boolean followRedirects = true;

  private MutableRequest(URI uri) {
    this.uri = requireNonNull(uri);
  }

  public URI uri() {
    return uri;
  }

  public String method() {
    return method;
  }

  public Optional<byte[]> body() {
    return body != null ? Optional.of(body.clone()) : Optional.empty();
  }

  public Headers headers() {
    return headersBuilder.build();
  }

  public boolean followRedirects() {
    return followRedirects;
  }

  /** Sets this request's {@code URI}. */
  @CanIgnoreReturnValue
  public MutableRequest uri(URI uri) {
    this.uri = requireNonNull(uri);
    return this;
  }

  /**
   * Sets this request's {@code URI}.
   *
   * @throws IllegalArgumentException if the uri's syntax is invalid
   */
  @CanIgnoreReturnValue
  public MutableRequest uri(String uri) {
    return uri(URI.create(uri));
  }

  /**
   * Sets this request's method and body. A {@code null} body means the request has none.
   *
   * @throws IllegalArgumentException if the method is not a valid token
   */
  @CanIgnoreReturnValue
  public MutableRequest method(String method, byte @Nullable [] body) {
    this.method = HttpMethod.requireValid(method);
    this.body = body != null ? body.clone() : null;
    return this;
  }

  @CanIgnoreReturnValue
  public MutableRequest GET() {
    return method(HttpMethod.GET, null);
  }

  @CanIgnoreReturnValue
  public MutableRequest DELETE() {
    return method(HttpMethod.DELETE, null);
  }

  @CanIgnoreReturnValue
  public MutableRequest POST(byte[] body) {
    return method(HttpMethod.POST, requireNonNull(body));
  }

  @CanIgnoreReturnValue
  public MutableRequest PUT(byte[] body) {
    return method(HttpMethod.PUT, requireNonNull(body));
  }

  @CanIgnoreReturnValue
  public MutableRequest PATCH(byte[] body) {
    return method(HttpMethod.PATCH, requireNonNull(body));
  }

  /** Replaces this request's body, keeping the method. */
  @CanIgnoreReturnValue
  public MutableRequest body(byte @Nullable [] body) {
    return method(method, body);
  }

  /** Adds the given header, keeping any existing headers with the same name. */
  @CanIgnoreReturnValue
  public MutableRequest header(String name, String value) {
    headersBuilder.add(name, value);
    return this;
  }

  /** Adds each of the given name-value pairs as a header. */
  @CanIgnoreReturnValue
  public MutableRequest headers(String... nameValuePairs) {
    headersBuilder.addAll(nameValuePairs);
    return this;
  }

  @CanIgnoreReturnValue
  public MutableRequest headers(Headers headers) {
    headersBuilder.addAll(headers);
    return this;
  }

  /** Replaces any headers with the given name by a single header with the given value. */
  @CanIgnoreReturnValue
  public MutableRequest setHeader(String name, String value) {
    headersBuilder.set(name, value);
    return this;
  }

  @CanIgnoreReturnValue
  public MutableRequest setHeaderIfAbsent(String name, String value) {
    headersBuilder.setIfAbsent(name, value);
    return this;
  }

  @CanIgnoreReturnValue
  public MutableRequest removeHeader(String name) {
    headersBuilder.remove(name);
    return this;
  }

  @CanIgnoreReturnValue
  public MutableRequest removeHeaders() {
    headersBuilder.clear();
    return this;
  }

  @CanIgnoreReturnValue
  public MutableRequest followRedirects(boolean followRedirects) {
    this.followRedirects = followRedirects;
    return this;
  }

  /** Returns an immutable copy of this request. */
  public Request toImmutableRequest() {
    return new Request(uri, method, body, headersBuilder.build(), followRedirects);
  }

  /** Returns a copy of this request that's independent of it. */
  public MutableRequest copy() {
    var copy = new MutableRequest(uri);
    copy.method = method;
    copy.body = body;
    copy.followRedirects = followRedirects;
    copy.headersBuilder.addAll(headersBuilder.build());
    return copy;
  }

  @Override
  public String toString() {
    return method + " " + uri;
  }

  /** Returns a new {@code MutableRequest} for a GET request to the given {@code URI}. */
  public static MutableRequest create(URI uri) {
    return new MutableRequest(uri);
  }

  /** Returns a new {@code MutableRequest} initialized with the given request's fields. */
  public static MutableRequest copyOf(Request request) {
    var copy = new MutableRequest(request.uri());
    copy.method = request.method();
    copy.body = request.body().orElse(null);
    copy.followRedirects = request.followRedirects();
    copy.headersBuilder.addAll(request.headers());
    return copy;
  }

  /** Returns a new {@code MutableRequest} with the given {@code URI} and a GET method. */
  public static MutableRequest GET(String uri) {
    return new MutableRequest(URI.create(uri));
  }

  /** Returns a new {@code MutableRequest} with the given {@code URI} and a GET method. */
  public static MutableRequest GET(URI uri) {
    return new MutableRequest(uri);
  }

  /** Returns a new {@code MutableRequest} with the given {@code URI} and a DELETE method. */
  public static MutableRequest DELETE(URI uri) {
    return new MutableRequest(uri).DELETE();
  }

  /** Returns a new {@code MutableRequest} with the given {@code URI}, body and a POST method. */
  public static MutableRequest POST(String uri, byte[] body) {
    return new MutableRequest(URI.create(uri)).POST(body);
  }

  /** Returns a new {@code MutableRequest} with the given {@code URI}, body and a POST method. */
  public static MutableRequest POST(URI uri, byte[] body) {
    return new MutableRequest(uri).POST(body);
  }

  /** Returns a new {@code MutableRequest} with the given {@code URI}, body and a PUT method. */
  public static MutableRequest PUT(URI uri, byte[] body) {
    return new MutableRequest(uri).PUT(body);
  }
}
