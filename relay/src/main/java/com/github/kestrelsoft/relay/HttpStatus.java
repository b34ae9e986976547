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

/** Static functions for checking response status codes. */
public class HttpStatus {
  public static final int OK = 200;
  public static final int CREATED = 201;
  public static final int NO_CONTENT = 204;
  public static final int NOT_FOUND = 404;
  public static final int TOO_MANY_REQUESTS = 429;
  public static final int SERVICE_UNAVAILABLE = 503;

  private HttpStatus() {}

  /** Returns {@code true} if {@code statusCode} is a 1xx informational status code. */
  public static boolean isInformational(int statusCode) {
    return StatusRange.INFORMATIONAL.contains(statusCode);
  }

  /** Returns {@code true} if {@code statusCode} is a 2xx success status code. */
  public static boolean isSuccessful(int statusCode) {
    return StatusRange.SUCCESSFUL.contains(statusCode);
  }

  /** Returns {@code true} if {@code response.statusCode()} is a 2xx successful status code. */
  public static boolean isSuccessful(Response response) {
    return isSuccessful(response.statusCode());
  }

  /** Returns {@code true} if {@code statusCode} is a 3xx redirection status code. */
  public static boolean isRedirection(int statusCode) {
    return StatusRange.REDIRECTION.contains(statusCode);
  }

  /** Returns {@code true} if {@code statusCode} is a 4xx client error status code. */
  public static boolean isClientError(int statusCode) {
    return StatusRange.CLIENT_ERROR.contains(statusCode);
  }

  /** Returns {@code true} if {@code response.statusCode()} is a 4xx client error status code. */
  public static boolean isClientError(Response response) {
    return isClientError(response.statusCode());
  }

  /** Returns {@code true} if {@code statusCode} is a 5xx server error status code. */
  public static boolean isServerError(int statusCode) {
    return StatusRange.SERVER_ERROR.contains(statusCode);
  }

  /** Returns {@code true} if {@code response.statusCode()} is a 5xx server error status code. */
  public static boolean isServerError(Response response) {
    return isServerError(response.statusCode());
  }
}
