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

import com.github.kestrelsoft.relay.internal.Utils;
import com.github.kestrelsoft.relay.internal.concurrent.CancellationPropagatingFuture;
import java.net.http.HttpClient;
import java.net.http.HttpClient.Redirect;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * The default {@link Transport}, sending requests with a {@link HttpClient}. Two clients are
 * created from the same builder, one that follows redirects and one that doesn't, and each request
 * goes to the one matching its redirect flag.
 */
public final class HttpClientTransport implements Transport {

  /** Headers the {@code HttpClient} sets itself, and refuses to accept from requests. */
  private static final Set<String> RESTRICTED_HEADERS =
      Set.of("connection", "content-length", "expect", "host", "upgrade");

  private final HttpClient redirectingClient;
  private final HttpClient nonRedirectingClient;

  private HttpClientTransport(HttpClient redirectingClient, HttpClient nonRedirectingClient) {
    this.redirectingClient = requireNonNull(redirectingClient);
    this.nonRedirectingClient = requireNonNull(nonRedirectingClient);
  }

  @Override
  public CompletableFuture<TransportResponse> sendAsync(Request request, Duration timeout) {
    var client = request.followRedirects() ? redirectingClient : nonRedirectingClient;
    return CancellationPropagatingFuture.of(
            client.sendAsync(toHttpRequest(request, timeout), BodyHandlers.ofByteArray()))
        .thenApply(HttpClientTransport::toTransportResponse);
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this) + "[client=" + redirectingClient + "]";
  }

  private static HttpRequest toHttpRequest(Request request, Duration timeout) {
    var builder =
        HttpRequest.newBuilder(request.uri())
            .timeout(timeout)
            .method(
                request.method(),
                request
                    .body()
                    .map(BodyPublishers::ofByteArray)
                    .orElseGet(BodyPublishers::noBody));
    for (var header : request.headers()) {
      if (!RESTRICTED_HEADERS.contains(header.name().toLowerCase(Locale.ROOT))) {
        builder.header(header.name(), header.value());
      }
    }
    return builder.build();
  }

  private static TransportResponse toTransportResponse(HttpResponse<byte[]> response) {
    var headers = new ArrayList<Header>();
    response
        .headers()
        .map()
        .forEach(
            (name, values) -> {
              if (!name.startsWith(":")) { // Skip HTTP/2 pseudo-headers.
                values.forEach(value -> headers.add(Header.of(name, value)));
              }
            });
    return TransportResponse.of(response.statusCode(), Headers.of(headers), response.body());
  }

  /** Returns a transport with a default {@code HttpClient}. */
  public static HttpClientTransport create() {
    return create(HttpClient.newBuilder());
  }

  /**
   * Returns a transport with clients built by the given builder. The builder's redirect policy is
   * overridden.
   */
  public static HttpClientTransport create(HttpClient.Builder builder) {
    var redirectingClient = builder.followRedirects(Redirect.NORMAL).build();
    var nonRedirectingClient = builder.followRedirects(Redirect.NEVER).build();
    return new HttpClientTransport(redirectingClient, nonRedirectingClient);
  }
}
