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

/**
 * A participant in a call's pipeline. A call runs the interceptors of its client followed by its
 * own interceptors:
 *
 * <ul>
 *   <li>{@link #prepare(MutableRequest, Context) prepare} runs in list order, so the call's own
 *       interceptors have the last word on the request.
 *   <li>{@link #handle(Throwable, Context) handle} and {@link #process(ResponseBuilder, Context)
 *       process} run in reverse list order, so the call's own interceptors get to evaluate first.
 *       The first interceptor to ask for a retry ends the pass; those after it aren't consulted
 *       for the current attempt.
 * </ul>
 *
 * <p>Methods run on the thread executing the call and may block. An interceptor instance can be
 * invoked by concurrent calls, so any state it keeps must be thread-safe.
 */
public interface Interceptor {

  /**
   * Prepares the outgoing request of an attempt, e.g. by adding headers or signing it. Runs on
   * every attempt, which lets interceptors refresh volatile headers on retries.
   *
   * @throws Exception to fail the call with {@link HttpFailure.Kind#PREPARATION}
   */
  default void prepare(MutableRequest request, Context context) throws Exception {}

  /**
   * Evaluates a failure of the transport itself. This is not called for responses with error
   * status codes, as those are seen by {@link #process(ResponseBuilder, Context)}.
   */
  default Evaluation handle(Throwable transportError, Context context) {
    return Evaluation.proceed();
  }

  /**
   * Evaluates a response, whatever its status code. The interceptor may rewrite the response's
   * status code, headers or body in place.
   *
   * @throws Exception to fail the call with {@link HttpFailure.Kind#PROCESSING}
   */
  default Evaluation process(ResponseBuilder response, Context context) throws Exception {
    return Evaluation.proceed();
  }
}
