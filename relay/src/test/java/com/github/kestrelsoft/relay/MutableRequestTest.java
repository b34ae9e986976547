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
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.net.URI;
import org.junit.jupiter.api.Test;

class MutableRequestTest {
  @Test
  void defaults() {
    var request = MutableRequest.create(URI.create("https://example.com"));
    assertThat(request.uri()).isEqualTo(URI.create("https://example.com"));
    assertThat(request.method()).isEqualTo("GET");
    assertThat(request.body()).isEmpty();
    assertThat(request.headers().isEmpty()).isTrue();
    assertThat(request.followRedirects()).isTrue();
  }

  @Test
  void setFields() {
    var request =
        MutableRequest.POST("https://example.com", "abc".getBytes(UTF_8))
            .header("Accept", "text/plain")
            .headers("X-Foo", "a", "X-Foo", "b")
            .followRedirects(false);
    assertThat(request.method()).isEqualTo("POST");
    assertThat(request.body())
        .hasValueSatisfying(body -> assertThat(body).isEqualTo("abc".getBytes(UTF_8)));
    assertThat(request.headers())
        .isEqualTo(Headers.of("Accept", "text/plain", "X-Foo", "a", "X-Foo", "b"));
    assertThat(request.followRedirects()).isFalse();
  }

  @Test
  void setHeaderKeepsPosition() {
    var request =
        MutableRequest.GET("https://example.com")
            .headers("X-Foo", "a", "Accept", "text/plain", "X-Foo", "b")
            .setHeader("x-foo", "c");
    assertThat(request.headers()).isEqualTo(Headers.of("x-foo", "c", "Accept", "text/plain"));
  }

  @Test
  void setHeaderIfAbsent() {
    var request =
        MutableRequest.GET("https://example.com")
            .header("User-Agent", "me")
            .setHeaderIfAbsent("user-agent", "relay")
            .setHeaderIfAbsent("Accept", "text/plain");
    assertThat(request.headers()).isEqualTo(Headers.of("User-Agent", "me", "Accept", "text/plain"));
  }

  @Test
  void removeHeaders() {
    var request =
        MutableRequest.GET("https://example.com")
            .headers("X-Foo", "a", "Accept", "text/plain", "x-foo", "b");
    request.removeHeader("X-FOO");
    assertThat(request.headers()).isEqualTo(Headers.of("Accept", "text/plain"));
    request.removeHeaders();
    assertThat(request.headers().isEmpty()).isTrue();
  }

  @Test
  void immutableCopyIsIndependent() {
    var mutableRequest = MutableRequest.GET("https://example.com").header("Accept", "text/plain");
    var request = mutableRequest.toImmutableRequest();
    mutableRequest.uri("https://example.org").setHeader("Accept", "text/html").DELETE();
    assertThat(request.uri()).isEqualTo(URI.create("https://example.com"));
    assertThat(request.method()).isEqualTo("GET");
    assertThat(request.headers()).isEqualTo(Headers.of("Accept", "text/plain"));
  }

  @Test
  void copyOfRequest() {
    var request =
        MutableRequest.PUT(URI.create("https://example.com"), new byte[] {1, 2})
            .header("Accept", "text/plain")
            .followRedirects(false)
            .toImmutableRequest();
    var copy = MutableRequest.copyOf(request);
    assertThat(copy.toImmutableRequest()).isEqualTo(request).hasSameHashCodeAs(request);
    assertThat(request.mutate().toImmutableRequest()).isEqualTo(request);
    assertThat(copy.copy().toImmutableRequest()).isEqualTo(request);
    assertThat(request).hasToString("PUT https://example.com");
  }

  @Test
  void bodyIsCopied() {
    var body = new byte[] {1, 2, 3};
    var request = MutableRequest.POST(URI.create("https://example.com"), body);
    body[0] = 9;
    assertThat(request.body()).hasValueSatisfying(b -> assertThat(b).containsExactly(1, 2, 3));
  }

  @Test
  void invalidMethod() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> MutableRequest.GET("https://example.com").method("G T", null));
  }
}
