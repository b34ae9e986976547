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
import static com.github.kestrelsoft.relay.internal.Validate.requireStatusCode;
import static java.util.Objects.requireNonNull;

import com.github.kestrelsoft.relay.internal.extensions.HeadersBuilder;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.nio.charset.Charset;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;

/**
 * A builder of {@link Response} instances. {@link Interceptor#process(ResponseBuilder, Context)}
 * receives one initialized from the transport's response, and may rewrite its status code, headers
 * or body in place (e.g. to unwrap an envelope).
 */
public final class ResponseBuilder {
  private static final int UNSET_STATUS_CODE = -1;

  private final HeadersBuilder headersBuilder = new HeadersBuilder();
  private int statusCode = UNSET_STATUS_CODE;
  private @MonotonicNonNull Request request;
  private byte[] body = new byte[0];

  private ResponseBuilder() {}

  public int statusCode() {
    return statusCode;
  }

  public Headers headers() {
    return headersBuilder.build();
  }

  /** Returns a copy of the current body. */
  public byte[] body() {
    return body.clone();
  }

  public Request request() {
    requireState(request != null, "request is not set");
    return request;
  }

  @CanIgnoreReturnValue
  public ResponseBuilder statusCode(int statusCode) {
    this.statusCode = requireStatusCode(statusCode);
    return this;
  }

  @CanIgnoreReturnValue
  public ResponseBuilder request(Request request) {
    this.request = requireNonNull(request);
    return this;
  }

  @CanIgnoreReturnValue
  public ResponseBuilder header(String name, String value) {
    headersBuilder.add(name, value);
    return this;
  }

  @CanIgnoreReturnValue
  public ResponseBuilder setHeader(String name, String value) {
    headersBuilder.set(name, value);
    return this;
  }

  @CanIgnoreReturnValue
  public ResponseBuilder removeHeader(String name) {
    headersBuilder.remove(name);
    return this;
  }

  @CanIgnoreReturnValue
  public ResponseBuilder headers(Headers headers) {
    headersBuilder.addAll(headers);
    return this;
  }

  /** Replaces all headers with the given ones. */
  @CanIgnoreReturnValue
  public ResponseBuilder setHeaders(Headers headers) {
    headersBuilder.clear();
    headersBuilder.addAll(headers);
    return this;
  }

  @CanIgnoreReturnValue
  public ResponseBuilder body(byte[] body) {
    this.body = body.clone();
    return this;
  }

  @CanIgnoreReturnValue
  public ResponseBuilder body(String body, Charset charset) {
    this.body = body.getBytes(charset);
    return this;
  }

  /**
   * Builds a new {@link Response}. The status code defaults to 200 if not set.
   *
   * @throws IllegalStateException if the request is not set
   */
  public Response build() {
    requireState(request != null, "request is not set");
    return new Response(
        request, statusCode == UNSET_STATUS_CODE ? 200 : statusCode, headersBuilder.build(), body);
  }

  public static ResponseBuilder create() {
    return new ResponseBuilder();
  }

  /** Returns a builder initialized with what the transport returned for the given request. */
  public static ResponseBuilder from(TransportResponse response, Request request) {
    var builder = new ResponseBuilder();
    builder.statusCode = response.statusCode();
    builder.request = requireNonNull(request);
    builder.headersBuilder.addAll(response.headers());
    builder.body = response.body();
    return builder;
  }

  public static ResponseBuilder from(Response response) {
    var builder = new ResponseBuilder();
    builder.statusCode = response.statusCode();
    builder.request = response.request();
    builder.headersBuilder.addAll(response.headers());
    builder.body = response.body();
    return builder;
  }
}
