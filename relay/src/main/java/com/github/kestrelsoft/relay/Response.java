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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.nio.charset.Charset;
import java.util.Optional;

/**
 * An immutable response. Responses are only created by the pipeline, after the transport has
 * returned and every interceptor has {@link Interceptor#process(ResponseBuilder, Context)
 * processed} the exchange. Failed calls with an error status carry their {@code Response} so that
 * callers can decode the error body.
 */
public final class Response {
  private final Request request;
  private final int statusCode;
  private final Headers headers;
  private final byte[] body;

  Response(Request request, int statusCode, Headers headers, byte[] body) {
    this.request = requireNonNull(request);
    this.statusCode = statusCode;
    this.headers = requireNonNull(headers);
    this.body = body.clone();
  }

  /** Returns the request that was sent to get this response. */
  public Request request() {
    return request;
  }

  public int statusCode() {
    return statusCode;
  }

  public Headers headers() {
    return headers;
  }

  /** Returns a copy of the body bytes. Bodiless responses have an empty body. */
  public byte[] body() {
    return body.clone();
  }

  /** Returns the media type in the {@code Content-Type} header, if present and valid. */
  public Optional<MediaType> mediaType() {
    return headers
        .firstValue(Header.CONTENT_TYPE)
        .flatMap(
            value -> {
              try {
                return Optional.of(MediaType.parse(value));
              } catch (IllegalArgumentException e) {
                return Optional.empty();
              }
            });
  }

  /** Decodes the body with the charset of the response's media type, or UTF-8 if absent. */
  public String bodyAsString() {
    return new String(body, mediaType().map(MediaType::charsetOrUtf8).orElse(UTF_8));
  }

  public String bodyAsString(Charset charset) {
    return new String(body, charset);
  }

  /**
   * Decodes the body into an object of the given type using the given codec. This is useful for
   * trying one or more error schemas on the response of a failed call.
   *
   * @throws UnsupportedOperationException if the codec has no suitable decoder
   */
  public <T> T decodeBody(TypeRef<T> typeRef, MediaType mediaType, AdapterCodec adapterCodec) {
    return adapterCodec.decode(body, typeRef, mediaType);
  }

  /** Returns a {@link ResponseBuilder} initialized with this response's fields. */
  public ResponseBuilder mutate() {
    return ResponseBuilder.from(this);
  }

  @Override
  public String toString() {
    return "Response[" + request + ", statusCode=" + statusCode + "]";
  }
}
