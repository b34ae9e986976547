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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import com.github.kestrelsoft.relay.Evaluation.Verdict;
import com.github.kestrelsoft.relay.RetryingInterceptor.Attempt;
import com.github.kestrelsoft.relay.RetryingInterceptor.BackoffStrategy;
import com.github.kestrelsoft.relay.RetryingInterceptor.Listener;
import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RetryingInterceptorTest {
  private static final Request request =
      MutableRequest.GET("https://example.com").toImmutableRequest();

  @Test
  void retryOnStatus() {
    var interceptor = RetryingInterceptor.newBuilder().onStatus(500, 503).build();
    assertThat(interceptor.process(response(503), context(0)).isRetry()).isTrue();
    assertThat(interceptor.process(response(500), context(0)).isRetry()).isTrue();
    assertThat(interceptor.process(response(502), context(0)).isRetry()).isFalse();
    assertThat(interceptor.process(response(200), context(0)).isRetry()).isFalse();
  }

  @Test
  void retryOnStatusRange() {
    var interceptor = RetryingInterceptor.newBuilder().onStatus(StatusRange.SERVER_ERROR).build();
    assertThat(interceptor.process(response(504), context(0)).isRetry()).isTrue();
    assertThat(interceptor.process(response(429), context(0)).isRetry()).isFalse();
  }

  @Test
  void retryOnResponsePredicate() {
    var interceptor =
        RetryingInterceptor.newBuilder()
            .onResponse(response -> response.headers().contains("X-Retry"))
            .build();
    assertThat(interceptor.process(response(200).header("X-Retry", "1"), context(0)).isRetry())
        .isTrue();
    assertThat(interceptor.process(response(200), context(0)).isRetry()).isFalse();
  }

  @Test
  void retryOnException() {
    var interceptor = RetryingInterceptor.newBuilder().onException(ConnectException.class).build();
    assertThat(interceptor.handle(new ConnectException(), context(0)).isRetry()).isTrue();
    assertThat(interceptor.handle(new IOException(), context(0)).isRetry()).isFalse();

    // Status conditions don't apply to transport failures.
    var statusInterceptor = RetryingInterceptor.newBuilder().onStatus(500).build();
    assertThat(statusInterceptor.handle(new IOException(), context(0)).isRetry()).isFalse();
  }

  @Test
  void retryOnExceptionPredicate() {
    var interceptor =
        RetryingInterceptor.newBuilder()
            .onException(e -> e.getMessage() != null && e.getMessage().contains("reset"))
            .build();
    assertThat(interceptor.handle(new IOException("connection reset"), context(0)).isRetry())
        .isTrue();
    assertThat(interceptor.handle(new IOException("closed"), context(0)).isRetry()).isFalse();
  }

  @Test
  void proceedsAfterMaxRetries() {
    var interceptor = RetryingInterceptor.newBuilder().maxRetries(2).onStatus(503).build();
    assertThat(interceptor.process(response(503), context(0)).isRetry()).isTrue();
    assertThat(interceptor.process(response(503), context(1)).isRetry()).isTrue();
    assertThat(interceptor.process(response(503), context(2)).isRetry()).isFalse();
  }

  @Test
  void delayComesFromBackoffStrategy() {
    var interceptor =
        RetryingInterceptor.newBuilder()
            .onStatus(503)
            .backoff(BackoffStrategy.linear(Duration.ofSeconds(1), Duration.ofSeconds(5)))
            .build();
    var evaluation = interceptor.process(response(503), context(2));
    assertThat(evaluation.verdict()).isEqualTo(Verdict.RETRY_AFTER);
    assertThat(evaluation.delay()).hasValue(Duration.ofSeconds(3));
  }

  @Test
  void defaultBackoffRetriesImmediately() {
    var evaluation =
        RetryingInterceptor.newBuilder().onStatus(503).build().process(response(503), context(0));
    assertThat(evaluation.delay()).hasValue(Duration.ZERO);
  }

  @Test
  void selectorSkipsOtherRequests() {
    var interceptor =
        RetryingInterceptor.newBuilder()
            .onStatus(503)
            .onException(IOException.class)
            .build(req -> req.method().equals("GET"));
    var postRequest = MutableRequest.POST("https://example.com", new byte[0]).toImmutableRequest();
    var postContext = Context.of(postRequest, Map.of(), AdapterCodec.basic());
    assertThat(interceptor.process(response(503).request(postRequest), postContext).isRetry())
        .isFalse();
    assertThat(interceptor.handle(new IOException(), postContext).isRetry()).isFalse();
    assertThat(interceptor.process(response(503), context(0)).isRetry()).isTrue();
  }

  @Test
  void listenerEvents() throws Exception {
    var events = new ArrayList<String>();
    var interceptor =
        RetryingInterceptor.newBuilder()
            .maxRetries(1)
            .onStatus(503)
            .backoff(BackoffStrategy.fixed(Duration.ofSeconds(1)))
            .listener(
                new Listener() {
                  @Override
                  public void onFirstAttempt(Request request) {
                    events.add("onFirstAttempt");
                  }

                  @Override
                  public void onRetry(Attempt attempt, Duration delay) {
                    events.add("onRetry(" + attempt.retryCount() + ", " + delay + ")");
                  }

                  @Override
                  public void onComplete(Attempt attempt) {
                    events.add("onComplete(" + attempt.response().orElseThrow().statusCode() + ")");
                  }

                  @Override
                  public void onExhaustion(Attempt attempt) {
                    events.add("onExhaustion(" + attempt.retryCount() + ")");
                  }
                })
            .build();

    interceptor.prepare(request.mutate(), context(0));
    interceptor.process(response(503), context(0));
    interceptor.prepare(request.mutate(), context(1));
    interceptor.process(response(503), context(1));
    interceptor.process(response(200), context(0));
    assertThat(events)
        .containsExactly(
            "onFirstAttempt", "onRetry(0, PT1S)", "onExhaustion(1)", "onComplete(200)");
  }

  @Test
  void firstMatchingConditionWins() {
    var matched = new ArrayList<String>();
    var interceptor =
        RetryingInterceptor.newBuilder()
            .on(attempt -> matched.add("first") && false)
            .on(attempt -> matched.add("second"))
            .on(attempt -> matched.add("third"))
            .build();
    assertThat(interceptor.process(response(200), context(0)).isRetry()).isTrue();
    assertThat(matched).isEqualTo(List.of("first", "second"));
  }

  @Test
  void invalidMaxRetries() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> RetryingInterceptor.newBuilder().maxRetries(0));
  }

  @Test
  void attemptRequiresExactlyOneOutcome() {
    var response = response(200).build();
    assertThatIllegalArgumentException().isThrownBy(() -> Attempt.of(request, null, null, 0));
    assertThatIllegalArgumentException()
        .isThrownBy(() -> Attempt.of(request, response, new IOException(), 0));
    assertThatIllegalArgumentException().isThrownBy(() -> Attempt.of(request, response, null, -1));
    assertThat(Attempt.of(request, response, null, 0).response()).containsSame(response);
  }

  private static ResponseBuilder response(int statusCode) {
    return ResponseBuilder.create().request(request).statusCode(statusCode);
  }

  private static Context context(int retryCount) {
    return Context.of(request, Map.of(), retryCount, AdapterCodec.basic());
  }
}
