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

package com.github.kestrelsoft.relay.tests;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import com.github.kestrelsoft.relay.Context;
import com.github.kestrelsoft.relay.Evaluation;
import com.github.kestrelsoft.relay.HttpFailure.Kind;
import com.github.kestrelsoft.relay.HttpMethod;
import com.github.kestrelsoft.relay.Interceptor;
import com.github.kestrelsoft.relay.MutableRequest;
import com.github.kestrelsoft.relay.RelayClient;
import com.github.kestrelsoft.relay.Request;
import com.github.kestrelsoft.relay.RequestPayload;
import com.github.kestrelsoft.relay.Response;
import com.github.kestrelsoft.relay.ResponseParser;
import com.github.kestrelsoft.relay.Result;
import com.github.kestrelsoft.relay.testing.ExecutorExtension;
import com.github.kestrelsoft.relay.testing.MockDelayer;
import com.github.kestrelsoft.relay.testing.RecordingTransport;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;

@Timeout(10)
@ExtendWith(ExecutorExtension.class)
class CancellationTest {
  private static final Request request =
      MutableRequest.GET("https://example.com/pokemon").toImmutableRequest();

  private RecordingTransport transport;
  private MockDelayer delayer;

  @BeforeEach
  void setUp() {
    transport = new RecordingTransport();
    delayer = new MockDelayer();
  }

  private RelayClient.Builder clientBuilder(Executor executor) {
    return RelayClient.newBuilder().transport(transport).delayer(delayer).executor(executor);
  }

  @Test
  void cancelBeforeExecution() {
    transport.echo();
    var call = RelayClient.newBuilder().transport(transport).build().newCall(request);
    call.cancel();
    assertThat(call.isCanceled()).isTrue();
    assertThat(call.execute().getFailure().kind()).isEqualTo(Kind.CANCELED);
    assertThat(transport.sendCount()).isZero();
  }

  @Test
  void cancelWhileWaitingForTransport(Executor executor) throws Exception {
    var call = clientBuilder(executor).build().newCall(request);
    var resultFuture = call.executeAsync();
    var transportCall = transport.awaitCall();
    call.cancel();

    assertThat(resultFuture.get(5, SECONDS).getFailure().kind()).isEqualTo(Kind.CANCELED);
    assertThat(catchThrowable(() -> transportCall.future().get(5, SECONDS)))
        .isInstanceOf(CancellationException.class);
    assertThat(transportCall.isCancelled()).isTrue();
  }

  @Test
  void cancelWhileWaitingForRetryDelay(Executor executor) throws Exception {
    transport.handleCalls(call -> call.complete(503, ""));
    var events = new CopyOnWriteArrayList<String>();
    var interceptor =
        new RecordingInterceptor("retrying", events)
            .onProcess((response, context) -> Evaluation.retryAfter(Duration.ofSeconds(30)));
    var call = clientBuilder(executor).build().newCall(request, List.of(interceptor), Map.of());
    var resultFuture = call.executeAsync();
    var delayedFuture = delayer.awaitingPeekLatestFuture();
    assertThat(delayedFuture.delay()).isEqualTo(Duration.ofSeconds(30));
    call.cancel();

    assertThat(resultFuture.get(5, SECONDS).getFailure().kind()).isEqualTo(Kind.CANCELED);
    assertThat(catchThrowable(() -> delayedFuture.get(5, SECONDS)))
        .isInstanceOf(CancellationException.class);

    // Nothing runs after the call is cancelled.
    delayer.drainQueuedTasks();
    assertThat(events).containsExactly("retrying.prepare", "retrying.process");
    assertThat(transport.sendCount()).isEqualTo(1);
  }

  @Test
  void cancelDuringInterceptor() {
    transport.echo();
    var callRef = new CompletableFuture<RelayClient.Call>();
    var laterInterceptorCalled = new AtomicBoolean();
    var client = RelayClient.newBuilder().transport(transport).build();
    var call =
        client.newCall(
            request,
            List.of(
                new Interceptor() {
                  @Override
                  public void prepare(MutableRequest request, Context context) {
                    callRef.join().cancel();
                  }
                },
                new Interceptor() {
                  @Override
                  public void prepare(MutableRequest request, Context context) {
                    laterInterceptorCalled.set(true);
                  }
                }),
            Map.of());
    callRef.complete(call);
    assertThat(call.execute().getFailure().kind()).isEqualTo(Kind.CANCELED);
    assertThat(laterInterceptorCalled).isFalse();
    assertThat(transport.sendCount()).isZero();
  }

  @Test
  void cancellingSendAsyncFutureCancelsCall(Executor executor) throws Exception {
    var resultFuture = clientBuilder(executor).build().sendAsync(request);
    var transportCall = transport.awaitCall();
    assertThat(resultFuture.cancel(true)).isTrue();

    assertThat(catchThrowable(() -> transportCall.future().get(5, SECONDS)))
        .isInstanceOf(CancellationException.class);
  }

  @Test
  void cancellingFetchAsyncFutureCancelsCall(Executor executor) throws Exception {
    CompletableFuture<Result<Response>> resultFuture =
        clientBuilder(executor)
            .build()
            .fetchAsync(
                URI.create("https://example.com/pokemon"),
                HttpMethod.GET,
                RequestPayload.empty(),
                ResponseParser.passthrough(),
                Set.of(),
                List.of());
    var transportCall = transport.awaitCall();
    assertThat(resultFuture.cancel(true)).isTrue();

    assertThat(catchThrowable(() -> transportCall.future().get(5, SECONDS)))
        .isInstanceOf(CancellationException.class);
  }

  @Test
  void interruptingExecuteCancelsCall() throws Exception {
    var call = RelayClient.newBuilder().transport(transport).build().newCall(request);
    var result = new CompletableFuture<Result<Response>>();
    var interruptedAfterwards = new AtomicBoolean();
    var thread =
        new Thread(
            () -> {
              result.complete(call.execute());
              interruptedAfterwards.set(Thread.currentThread().isInterrupted());
            });
    thread.start();
    var transportCall = transport.awaitCall();
    thread.interrupt();
    thread.join(5_000);

    assertThat(result.get(5, SECONDS).getFailure().kind()).isEqualTo(Kind.CANCELED);
    assertThat(interruptedAfterwards).isTrue();
    assertThat(call.isCanceled()).isTrue();
    assertThat(transportCall.isCancelled()).isTrue();
  }

  @Test
  void cancelIsIdempotent() {
    transport.echo();
    var call = RelayClient.newBuilder().transport(transport).build().newCall(request);
    call.cancel();
    call.cancel();
    assertThat(call.isCanceled()).isTrue();
  }

  @Test
  void completedCallIsUnaffectedByCancel() {
    transport.echo();
    var call =
        RelayClient.newBuilder()
            .transport(transport)
            .build()
            .newCall(
                MutableRequest.POST("https://example.com", new byte[] {1}).toImmutableRequest());
    var result = call.execute();
    call.cancel();
    assertThat(result.isSuccess()).isTrue();
  }
}
