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
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.kestrelsoft.relay.HttpFailure.Kind;
import java.io.IOException;
import org.junit.jupiter.api.Test;

class ResultTest {
  @Test
  void success() throws HttpFailure {
    var result = Result.success("abc");
    assertThat(result.isSuccess()).isTrue();
    assertThat(result.isFailure()).isFalse();
    assertThat(result.value()).hasValue("abc");
    assertThat(result.failure()).isEmpty();
    assertThat(result.get()).isEqualTo("abc");
    assertThatIllegalStateException().isThrownBy(result::getFailure);
  }

  @Test
  void successWithoutValue() throws HttpFailure {
    var result = Result.<String>success(null);
    assertThat(result.isSuccess()).isTrue();
    assertThat(result.value()).isEmpty();
    assertThat(result.get()).isNull();
  }

  @Test
  void failure() {
    var failure = HttpFailure.transport(new IOException("closed"));
    var result = Result.<String>failure(failure);
    assertThat(result.isFailure()).isTrue();
    assertThat(result.value()).isEmpty();
    assertThat(result.failure()).hasValue(failure);
    assertThat(result.getFailure()).isSameAs(failure);
    assertThatThrownBy(result::get).isSameAs(failure);
  }

  @Test
  void mapAndFlatMap() throws HttpFailure {
    assertThat(Result.success("abc").map(String::length).get()).isEqualTo(3);
    assertThat(Result.success("abc").flatMap(s -> Result.success(s + "d")).get())
        .isEqualTo("abcd");

    var failure = HttpFailure.canceled();
    assertThat(Result.<String>failure(failure).map(String::length).getFailure()).isSameAs(failure);
    assertThat(
            Result.success("abc")
                .flatMap(__ -> Result.<Integer>failure(failure))
                .map(i -> i + 1)
                .getFailure())
        .isSameAs(failure);
  }

  @Test
  void failureKinds() {
    var request = MutableRequest.GET("https://example.com").toImmutableRequest();
    var response = ResponseBuilder.create().request(request).statusCode(404).build();
    assertThat(HttpFailure.status(Kind.CLIENT_ERROR, response))
        .returns(Kind.CLIENT_ERROR, HttpFailure::kind)
        .satisfies(failure -> assertThat(failure.response()).containsSame(response));
    assertThat(HttpFailure.maxRetryCountReached(5))
        .returns(Kind.MAX_RETRY_COUNT_REACHED, HttpFailure::kind)
        .hasMessageContaining("5");
    assertThat(HttpFailure.encoding(new IllegalStateException()).response()).isEmpty();
    assertThatThrownBy(() -> HttpFailure.status(Kind.TRANSPORT, response))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
