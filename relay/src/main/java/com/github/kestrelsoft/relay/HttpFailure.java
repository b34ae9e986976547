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
 * The failure of a call. Each failed call yields exactly one {@code HttpFailure} of a single {@link
 * Kind}; no other exception escapes the pipeline.
 */
public final class HttpFailure extends Exception {
  private static final long serialVersionUID = 1L;

  /** Kinds of call failures. */
  public enum Kind {
    /** The request payload couldn't be encoded. */
    ENCODING,

    /**
     * The response body couldn't be decoded, or its status code wasn't what the parser expected
     * (in which case the cause is an {@link UnexpectedResponseException}).
     */
    DECODING,

    /** An interceptor failed to prepare the request. */
    PREPARATION,

    /** An interceptor failed to process the response. */
    PROCESSING,

    /** The transport failed and no interceptor chose to retry. */
    TRANSPORT,

    /** The final status code is in the 4xx range. */
    CLIENT_ERROR,

    /** The final status code is in the 5xx range. */
    SERVER_ERROR,

    /** The final status code is outside the 2xx-5xx ranges. */
    UNEXPECTED_STATUS,

    /** An interceptor asked for a retry after all allowed retries were made. */
    MAX_RETRY_COUNT_REACHED,

    /** The call was cancelled, or its retry delay couldn't be scheduled. */
    CANCELED
  }

  private final Kind kind;
  private final transient @Nullable Response response;

  private HttpFailure(
      Kind kind, String message, @Nullable Response response, @Nullable Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.response = response;
  }

  public Kind kind() {
    return kind;
  }

  /**
   * Returns the response that caused this failure. It is present for {@link Kind#CLIENT_ERROR},
   * {@link Kind#SERVER_ERROR} and {@link Kind#UNEXPECTED_STATUS}, and for {@link Kind#DECODING}
   * failures that happened after a response was received.
   */
  public Optional<Response> response() {
    return Optional.ofNullable(response);
  }

  public static HttpFailure encoding(Throwable cause) {
    return new HttpFailure(Kind.ENCODING, "Couldn't encode request payload", null, cause);
  }

  public static HttpFailure decoding(Response response, Throwable cause) {
    return new HttpFailure(
        Kind.DECODING,
        "Couldn't decode response (statusCode=" + response.statusCode() + ")",
        requireNonNull(response),
        cause);
  }

  public static HttpFailure preparation(Throwable cause) {
    return new HttpFailure(Kind.PREPARATION, "Couldn't prepare request", null, cause);
  }

  public static HttpFailure processing(Throwable cause) {
    return new HttpFailure(Kind.PROCESSING, "Couldn't process response", null, cause);
  }

  public static HttpFailure transport(Throwable cause) {
    return new HttpFailure(Kind.TRANSPORT, "Transport failure: " + cause, null, cause);
  }

  /**
   * Returns a failure classifying the given response's status code as a client error, server error
   * or an unexpected status.
   */
  public static HttpFailure status(Kind kind, Response response) {
    requireNonNull(response);
    switch (kind) {
      case CLIENT_ERROR:
      case SERVER_ERROR:
      case UNEXPECTED_STATUS:
        return new HttpFailure(
            kind,
            "Got status code " + response.statusCode() + " for " + response.request(),
            response,
            null);
      default:
        throw new IllegalArgumentException("Not a status failure kind: " + kind);
    }
  }

  public static HttpFailure maxRetryCountReached(int maxRetryCount) {
    return new HttpFailure(
        Kind.MAX_RETRY_COUNT_REACHED,
        "Reached maximum retry count (" + maxRetryCount + ")",
        null,
        null);
  }

  public static HttpFailure canceled() {
    return new HttpFailure(Kind.CANCELED, "Call was canceled", null, null);
  }

  public static HttpFailure canceled(Throwable cause) {
    return new HttpFailure(Kind.CANCELED, "Call was canceled", null, cause);
  }
}
