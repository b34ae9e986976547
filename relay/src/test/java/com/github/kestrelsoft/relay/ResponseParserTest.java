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
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.catchThrowable;

import org.junit.jupiter.api.Test;

class ResponseParserTest {
  private static final Request REQUEST =
      MutableRequest.GET("https://example.com").toImmutableRequest();

  @Test
  void decoding() throws Exception {
    var parser = ResponseParser.decoding(String.class, MediaType.TEXT_PLAIN);
    assertThat(parser.mediaType()).hasValue(MediaType.TEXT_PLAIN);
    assertThat(parser.parse(response(200, "Pikachu"), AdapterCodec.basic())).isEqualTo("Pikachu");
    assertThat(parser.parse(response(201, "Eevee"), AdapterCodec.basic())).isEqualTo("Eevee");
  }

  @Test
  void decodingUnexpectedStatus() {
    var parser = ResponseParser.decoding(String.class, MediaType.TEXT_PLAIN);
    var response = response(304, "");
    var thrown = catchThrowable(() -> parser.parse(response, AdapterCodec.basic()));
    assertThat(thrown).isInstanceOf(UnexpectedResponseException.class);
    assertThat(((UnexpectedResponseException) thrown).response()).isSameAs(response);
    assertThat(((UnexpectedResponseException) thrown).expected()).isSameAs(StatusRange.SUCCESSFUL);
  }

  @Test
  void decodingWithExpectedRange() throws Exception {
    var parser =
        ResponseParser.decoding(
            TypeRef.of(String.class), MediaType.TEXT_PLAIN, StatusRange.between(200, 399));
    assertThat(parser.parse(response(304, "cached"), AdapterCodec.basic())).isEqualTo("cached");
  }

  @Test
  void decodingUnsupportedType() {
    var parser = ResponseParser.decoding(Integer.class, MediaType.APPLICATION_JSON);
    assertThatExceptionOfType(UnsupportedOperationException.class)
        .isThrownBy(() -> parser.parse(response(200, "1"), AdapterCodec.basic()));
  }

  @Test
  void discarding() throws Exception {
    var parser = ResponseParser.discarding();
    assertThat(parser.mediaType()).isEmpty();
    assertThat(parser.parse(response(200, "ignored"), AdapterCodec.basic())).isNull();
    assertThatExceptionOfType(UnexpectedResponseException.class)
        .isThrownBy(() -> parser.parse(response(302, ""), AdapterCodec.basic()));
  }

  @Test
  void passthrough() throws Exception {
    var parser = ResponseParser.passthrough(StatusRange.SUCCESSFUL.or(StatusRange.of(404)));
    var response = response(404, "Not Found");
    assertThat(parser.parse(response, AdapterCodec.basic())).isSameAs(response);
    assertThatExceptionOfType(UnexpectedResponseException.class)
        .isThrownBy(() -> parser.parse(response(500, ""), AdapterCodec.basic()));
  }

  @Test
  void ignoring() throws Exception {
    var parser =
        ResponseParser.decoding(String.class, MediaType.TEXT_PLAIN)
            .ignoring(StatusRange.of(204, 304));
    assertThat(parser.mediaType()).hasValue(MediaType.TEXT_PLAIN);
    assertThat(parser.parse(response(204, ""), AdapterCodec.basic())).isNull();
    assertThat(parser.parse(response(304, ""), AdapterCodec.basic())).isNull();
    assertThat(parser.parse(response(200, "abc"), AdapterCodec.basic())).isEqualTo("abc");
  }

  @Test
  void customParser() throws Exception {
    var parser =
        ResponseParser.of(
            MediaType.TEXT_PLAIN, (response, codec) -> response.bodyAsString().length());
    assertThat(parser.mediaType()).hasValue(MediaType.TEXT_PLAIN);
    assertThat(parser.parse(response(500, "abcd"), AdapterCodec.basic())).isEqualTo(4);
  }

  private static Response response(int statusCode, String body) {
    return ResponseBuilder.create()
        .request(REQUEST)
        .statusCode(statusCode)
        .header("Content-Type", "text/plain")
        .body(body, UTF_8)
        .build();
  }
}
