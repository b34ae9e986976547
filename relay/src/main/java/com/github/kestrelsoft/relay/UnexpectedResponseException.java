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

/**
 * Thrown by a {@link ResponseParser} when a response's status code isn't one it expects. This
 * surfaces as the cause of an {@link HttpFailure.Kind#DECODING} failure, and carries the response
 * so that callers can still decode its body.
 */
public final class UnexpectedResponseException extends Exception {
  private static final long serialVersionUID = 1L;

  private final transient Response response;
  private final transient StatusRange expected;

  public UnexpectedResponseException(Response response, StatusRange expected) {
    super("Expected status code in " + expected + ", got " + response.statusCode());
    this.response = requireNonNull(response);
    this.expected = requireNonNull(expected);
  }

  public Response response() {
    return response;
  }

  /** Returns the status codes the parser expected. */
  public StatusRange expected() {
    return expected;
  }
}
