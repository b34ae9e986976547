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

import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts a {@link Response} into a value. A parser's media type is what the request's {@code
 * Accept} header is set to, so the header always matches how the body will be decoded.
 *
 * <p>Parsers check the response's status code before decoding, throwing an {@link
 * UnexpectedResponseException} if it's not one they expect.
 *
 * @param <T> the type of the parsed value
 */
public interface ResponseParser<T> {

  /** Returns the media type this parser decodes, if any. */
  Optional<MediaType> mediaType();

  /**
   * Parses the given response. Returning {@code null} means the response has no value.
   *
   * @throws UnexpectedResponseException if the response's status code is not expected
   * @throws Exception if the body can't be decoded
   */
  @Nullable T parse(Response response, AdapterCodec adapterCodec) throws Exception;

  /**
   * Returns a parser that returns {@code null} instead of parsing responses with a status code in
   * the given range.
   */
  default ResponseParser<T> ignoring(StatusRange ignored) {
    requireNonNull(ignored);
    return of(
        mediaType().orElse(null),
        (response, adapterCodec) ->
            ignored.contains(response.statusCode()) ? null : parse(response, adapterCodec));
  }

  /**
   * Returns a parser that decodes successful (2xx) responses into the given type with the call's
   * codec.
   */
  static <T> ResponseParser<T> decoding(TypeRef<T> typeRef, MediaType mediaType) {
    return decoding(typeRef, mediaType, StatusRange.SUCCESSFUL);
  }

  /**
   * Returns a parser that decodes successful (2xx) responses into the given type with the call's
   * codec.
   */
  static <T> ResponseParser<T> decoding(Class<T> type, MediaType mediaType) {
    return decoding(TypeRef.of(type), mediaType, StatusRange.SUCCESSFUL);
  }

  /**
   * Returns a parser that decodes responses with a status code in {@code expected} into the given
   * type with the call's codec.
   */
  static <T> ResponseParser<T> decoding(
      TypeRef<T> typeRef, MediaType mediaType, StatusRange expected) {
    requireNonNull(typeRef);
    requireNonNull(expected);
    return of(
        requireNonNull(mediaType),
        (response, adapterCodec) -> {
          requireExpected(response, expected);
          return response.decodeBody(typeRef, mediaType, adapterCodec);
        });
  }

  /** Returns a parser that drops the body of successful (2xx) responses. */
  static ResponseParser<Void> discarding() {
    return discarding(StatusRange.SUCCESSFUL);
  }

  /** Returns a parser that drops the body of responses with a status code in {@code expected}. */
  static ResponseParser<Void> discarding(StatusRange expected) {
    requireNonNull(expected);
    return of(
        null,
        (response, __) -> {
          requireExpected(response, expected);
          return null;
        });
  }

  /** Returns a parser that returns successful (2xx) responses as they are. */
  static ResponseParser<Response> passthrough() {
    return passthrough(StatusRange.SUCCESSFUL);
  }

  /** Returns a parser that returns responses with a status code in {@code expected} as they are. */
  static ResponseParser<Response> passthrough(StatusRange expected) {
    requireNonNull(expected);
    return of(
        null,
        (response, __) -> {
          requireExpected(response, expected);
          return response;
        });
  }

  /**
   * Returns a parser with the given media type and parsing function, which is responsible for its
   * own status code checks.
   */
  static <T> ResponseParser<T> of(@Nullable MediaType mediaType, Parse<T> parse) {
    requireNonNull(parse);
    return new ResponseParser<>() {
      @Override
      public Optional<MediaType> mediaType() {
        return Optional.ofNullable(mediaType);
      }

      @Override
      public @Nullable T parse(Response response, AdapterCodec adapterCodec) throws Exception {
        return parse.apply(response, adapterCodec);
      }
    };
  }

  /**
   * Throws an {@link UnexpectedResponseException} if the given response's status code is not in
   * {@code expected}.
   */
  static void requireExpected(Response response, StatusRange expected)
      throws UnexpectedResponseException {
    if (!expected.contains(response.statusCode())) {
      throw new UnexpectedResponseException(response, expected);
    }
  }

  /** A parsing function. */
  @FunctionalInterface
  interface Parse<T> {
    @Nullable T apply(Response response, AdapterCodec adapterCodec) throws Exception;
  }
}
