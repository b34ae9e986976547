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

import static com.github.kestrelsoft.relay.internal.Utils.requireValidHeaderValue;
import static java.util.Objects.requireNonNull;

import com.github.kestrelsoft.relay.internal.Utils;
import com.github.kestrelsoft.relay.internal.concurrent.CancellationPropagatingFuture;
import com.github.kestrelsoft.relay.internal.concurrent.Delayer;
import com.github.kestrelsoft.relay.internal.concurrent.SharedExecutors;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Executes requests through a pipeline of {@link Interceptor interceptors}, retrying as they ask
 * and classifying the outcome into a {@link Result}.
 *
 * <p>{@link #send(Request, List, Map) send} is the low-level operation, returning the final {@link
 * Response}. {@link #fetch(URI, String, RequestPayload, ResponseParser, Set, List) fetch} builds
 * on it by encoding a payload and parsing the response into a value:
 *
 * <pre>{@code
 * var client = RelayClient.newBuilder()
 *     .adapterCodec(AdapterCodec.newBuilder()
 *         .encoder(JacksonAdapterFactory.createJsonEncoder())
 *         .decoder(JacksonAdapterFactory.createJsonDecoder())
 *         .build())
 *     .interceptor(RetryingInterceptor.newBuilder()
 *         .onStatus(503)
 *         .backoff(BackoffStrategy.retryAfterOr(BackoffStrategy.fixed(Duration.ofSeconds(1))))
 *         .build())
 *     .build();
 * Result<Article> article =
 *     client.fetch(URI.create("https://example.com/articles/1"), Article.class);
 * }</pre>
 *
 * <p>A {@code RelayClient} is immutable and safe for concurrent use. Calls share nothing but the
 * client's interceptors and observers.
 */
public final class RelayClient {
  private final Transport transport;
  private final AdapterCodec adapterCodec;
  private final List<Interceptor> interceptors;
  private final List<Observer> observers;
  private final Options options;
  private final Executor executor;
  private final Delayer delayer;
  private final @Nullable String userAgent;

  private RelayClient(Builder builder) {
    this.transport = builder.transport != null ? builder.transport : HttpClientTransport.create();
    this.adapterCodec = builder.adapterCodec;
    this.interceptors = List.copyOf(builder.interceptors);
    this.observers = List.copyOf(builder.observers);
    this.options = builder.options;
    this.executor = builder.executor != null ? builder.executor : SharedExecutors.executor();
    this.delayer = builder.delayer != null ? builder.delayer : Delayer.defaultDelayer();
    this.userAgent = builder.userAgent;
  }

  public Transport transport() {
    return transport;
  }

  /** Returns the codec calls use unless they specify their own. */
  public AdapterCodec adapterCodec() {
    return adapterCodec;
  }

  /** Returns the interceptors that run before each call's own interceptors. */
  public List<Interceptor> interceptors() {
    return interceptors;
  }

  public List<Observer> observers() {
    return observers;
  }

  public Options options() {
    return options;
  }

  public Executor executor() {
    return executor;
  }

  /** Returns the {@code User-Agent} set on requests that don't have one. */
  public Optional<String> userAgent() {
    return Optional.ofNullable(userAgent);
  }

  Delayer delayer() {
    return delayer;
  }

  /** Returns a call that executes the given request through the client's interceptors only. */
  public Call newCall(Request request) {
    return newCall(request, List.of(), Map.of());
  }

  /**
   * Returns a call that executes the given request through the client's interceptors followed by
   * the given ones. The given tags are visible to interceptors through the call's {@link Context}.
   */
  public Call newCall(Request request, List<Interceptor> interceptors, Map<String, String> tags) {
    return newCall(request, interceptors, tags, adapterCodec);
  }

  private Call newCall(
      Request request,
      List<Interceptor> callInterceptors,
      Map<String, String> tags,
      AdapterCodec callAdapterCodec) {
    requireNonNull(request);
    var allInterceptors = new ArrayList<Interceptor>(interceptors);
    allInterceptors.addAll(callInterceptors);
    return new PipelineCall(
        this, Context.of(request, tags, callAdapterCodec), List.copyOf(allInterceptors));
  }

  public Result<Response> send(Request request) {
    return newCall(request).execute();
  }

  /**
   * Sends the given request, returning either the final response or the failure classifying the
   * outcome. Responses with 4xx and 5xx status codes are failures carrying the response.
   */
  public Result<Response> send(
      Request request, List<Interceptor> interceptors, Map<String, String> tags) {
    return newCall(request, interceptors, tags).execute();
  }

  public CompletableFuture<Result<Response>> sendAsync(Request request) {
    return newCall(request).executeAsync();
  }

  /**
   * Asynchronously sends the given request on the client's executor. Cancelling the returned
   * future cancels the call.
   */
  public CompletableFuture<Result<Response>> sendAsync(
      Request request, List<Interceptor> interceptors, Map<String, String> tags) {
    return newCall(request, interceptors, tags).executeAsync();
  }

  /** Fetches a JSON resource with a GET request and decodes it into the given type. */
  public <T> Result<T> fetch(URI uri, Class<T> type) {
    return fetch(uri, HttpMethod.GET, RequestPayload.empty(), type, Set.of(), List.of());
  }

  /** Fetches a JSON resource with a GET request and decodes it into the given type. */
  public <T> Result<T> fetch(URI uri, TypeRef<T> typeRef) {
    return fetch(uri, HttpMethod.GET, RequestPayload.empty(), typeRef, Set.of(), List.of());
  }

  /**
   * Sends the given payload, decoding a successful JSON response into the given type with the
   * client's codec.
   */
  public <T> Result<T> fetch(
      URI uri,
      String method,
      RequestPayload payload,
      Class<T> type,
      Set<Integer> emptyStatusCodes,
      List<Interceptor> interceptors) {
    return fetch(uri, method, payload, TypeRef.of(type), emptyStatusCodes, interceptors);
  }

  /**
   * Sends the given payload, decoding a successful JSON response into the given type with the
   * client's codec.
   */
  public <T> Result<T> fetch(
      URI uri,
      String method,
      RequestPayload payload,
      TypeRef<T> typeRef,
      Set<Integer> emptyStatusCodes,
      List<Interceptor> interceptors) {
    return fetch(
        uri,
        method,
        payload,
        ResponseParser.decoding(typeRef, MediaType.APPLICATION_JSON),
        emptyStatusCodes,
        interceptors);
  }

  /**
   * Sends the given payload and parses the response with the given parser, using the client's
   * codec. The request's {@code Content-Type} comes from the payload and its {@code Accept} from
   * the parser.
   *
   * <p>A successful response with a status code in {@code emptyStatusCodes} yields a success
   * without a value, and the parser isn't called. Failing to encode the payload yields {@link
   * HttpFailure.Kind#ENCODING}, and failing to parse the response yields {@link
   * HttpFailure.Kind#DECODING}.
   */
  public <T> Result<T> fetch(
      URI uri,
      String method,
      RequestPayload payload,
      ResponseParser<T> parser,
      Set<Integer> emptyStatusCodes,
      List<Interceptor> interceptors) {
    return fetch(uri, method, payload, parser, emptyStatusCodes, interceptors, adapterCodec);
  }

  /**
   * Same as {@link #fetch(URI, String, RequestPayload, ResponseParser, Set, List)}, but encodes &
   * parses with the given codec instead of the client's.
   */
  public <T> Result<T> fetch(
      URI uri,
      String method,
      RequestPayload payload,
      ResponseParser<T> parser,
      Set<Integer> emptyStatusCodes,
      List<Interceptor> interceptors,
      AdapterCodec callAdapterCodec) {
    var emptyStatusCodesCopy = Set.copyOf(emptyStatusCodes);
    return fetchRequest(uri, method, payload, parser, callAdapterCodec)
        .flatMap(
            request -> newCall(request, interceptors, Map.of(), callAdapterCodec).execute())
        .flatMap(response -> parse(response, parser, emptyStatusCodesCopy, callAdapterCodec));
  }

  /**
   * Asynchronous variant of {@link #fetch(URI, String, RequestPayload, ResponseParser, Set,
   * List)}. Cancelling the returned future cancels the call.
   */
  public <T> CompletableFuture<Result<T>> fetchAsync(
      URI uri,
      String method,
      RequestPayload payload,
      ResponseParser<T> parser,
      Set<Integer> emptyStatusCodes,
      List<Interceptor> interceptors) {
    return fetchAsync(uri, method, payload, parser, emptyStatusCodes, interceptors, adapterCodec);
  }

  public <T> CompletableFuture<Result<T>> fetchAsync(
      URI uri,
      String method,
      RequestPayload payload,
      ResponseParser<T> parser,
      Set<Integer> emptyStatusCodes,
      List<Interceptor> interceptors,
      AdapterCodec callAdapterCodec) {
    var emptyStatusCodesCopy = Set.copyOf(emptyStatusCodes);
    var requestResult = fetchRequest(uri, method, payload, parser, callAdapterCodec);
    if (requestResult.isFailure()) {
      return CompletableFuture.completedFuture(Result.failure(requestResult.getFailure()));
    }
    var request = requestResult.value().orElseThrow();
    return CancellationPropagatingFuture.of(
            newCall(request, interceptors, Map.of(), callAdapterCodec).executeAsync())
        .thenApply(
            result ->
                result.flatMap(
                    response ->
                        parse(response, parser, emptyStatusCodesCopy, callAdapterCodec)));
  }

  private static Result<Request> fetchRequest(
      URI uri,
      String method,
      RequestPayload payload,
      ResponseParser<?> parser,
      AdapterCodec adapterCodec) {
    byte[] body;
    try {
      body = payload.encode(adapterCodec);
    } catch (RuntimeException e) {
      return Result.failure(HttpFailure.encoding(e));
    }

    var request = MutableRequest.create(uri).method(method, body);
    payload
        .mediaType()
        .ifPresent(mediaType -> request.setHeader(Header.CONTENT_TYPE, mediaType.toString()));
    parser
        .mediaType()
        .ifPresent(mediaType -> request.setHeader(Header.ACCEPT, mediaType.toString()));
    return Result.success(request.toImmutableRequest());
  }

  private static <T> Result<T> parse(
      @Nullable Response response,
      ResponseParser<T> parser,
      Set<Integer> emptyStatusCodes,
      AdapterCodec adapterCodec) {
    requireNonNull(response);
    if (emptyStatusCodes.contains(response.statusCode())) {
      return Result.success(null);
    }
    try {
      return Result.success(parser.parse(response, adapterCodec));
    } catch (Exception e) {
      return Result.failure(HttpFailure.decoding(response, e));
    }
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this)
        + "[transport="
        + transport
        + ", interceptors="
        + interceptors
        + ", options="
        + options
        + "]";
  }

  /** Returns a {@code RelayClient} with default settings. */
  public static RelayClient create() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * A single execution of a request through the pipeline. A call can be executed once, and can be
   * cancelled at any point.
   */
  public interface Call {

    /** Returns the request this call was created with, before any interceptor prepared it. */
    Request request();

    /**
     * Executes the call on the current thread. Interrupting the thread cancels the call.
     *
     * @throws IllegalStateException if the call was already executed
     */
    Result<Response> execute();

    /**
     * Executes the call on the client's executor. Cancelling the returned future cancels the call.
     *
     * @throws IllegalStateException if the call was already executed
     */
    CompletableFuture<Result<Response>> executeAsync();

    /**
     * Cancels this call. A cancelled call stops at its next step and yields {@link
     * HttpFailure.Kind#CANCELED}, cancelling the transport or retry delay it's waiting for. No
     * interceptor is invoked after the call notices it's cancelled.
     */
    void cancel();

    boolean isCanceled();
  }

  /** A builder of {@code RelayClient} instances. */
  public static final class Builder {
    private final List<Interceptor> interceptors = new ArrayList<>();
    private final List<Observer> observers = new ArrayList<>();
    private @MonotonicNonNull Transport transport;
    private AdapterCodec adapterCodec = AdapterCodec.basic();
    private Options options = Options.defaults();
    private @MonotonicNonNull Executor executor;
    private @MonotonicNonNull Delayer delayer;
    private @MonotonicNonNull String userAgent;

    Builder() {}

    /** Sets the transport. The default is an {@link HttpClientTransport}. */
    @CanIgnoreReturnValue
    public Builder transport(Transport transport) {
      this.transport = requireNonNull(transport);
      return this;
    }

    /**
     * Sets the codec calls encode payloads & decode responses with. The default is {@link
     * AdapterCodec#basic()}.
     */
    @CanIgnoreReturnValue
    public Builder adapterCodec(AdapterCodec adapterCodec) {
      this.adapterCodec = requireNonNull(adapterCodec);
      return this;
    }

    /** Adds an interceptor that runs for every call, before the call's own interceptors. */
    @CanIgnoreReturnValue
    public Builder interceptor(Interceptor interceptor) {
      interceptors.add(requireNonNull(interceptor));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder observer(Observer observer) {
      observers.add(requireNonNull(observer));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder options(Options options) {
      this.options = requireNonNull(options);
      return this;
    }

    /** Sets the executor that runs asynchronous calls. */
    @CanIgnoreReturnValue
    public Builder executor(Executor executor) {
      this.executor = requireNonNull(executor);
      return this;
    }

    /** Sets the delayer used to wait before delayed retries. */
    @CanIgnoreReturnValue
    public Builder delayer(Delayer delayer) {
      this.delayer = requireNonNull(delayer);
      return this;
    }

    /**
     * Sets the {@code User-Agent} of requests that don't specify one.
     *
     * @throws IllegalArgumentException if {@code userAgent} is an invalid header value
     */
    @CanIgnoreReturnValue
    public Builder userAgent(String userAgent) {
      this.userAgent = requireValidHeaderValue(userAgent);
      return this;
    }

    public RelayClient build() {
      return new RelayClient(this);
    }
  }
}
