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

import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.from;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;

import java.util.Map;
import org.junit.jupiter.api.Test;

class MediaTypeTest {
  @Test
  void constantsSanityTest() {
    assertThat(MediaType.ANY).hasToString("*/*");
    assertThat(MediaType.APPLICATION_ANY).hasToString("application/*");
    assertThat(MediaType.TEXT_ANY).hasToString("text/*");
    assertThat(MediaType.APPLICATION_FORM_URLENCODED)
        .hasToString("application/x-www-form-urlencoded");
    assertThat(MediaType.APPLICATION_JSON).hasToString("application/json");
    assertThat(MediaType.APPLICATION_OCTET_STREAM).hasToString("application/octet-stream");
    assertThat(MediaType.TEXT_HTML).hasToString("text/html");
    assertThat(MediaType.TEXT_PLAIN).hasToString("text/plain");
  }

  @Test
  void parseSimpleMediaType() {
    assertThat(MediaType.parse("text/plain"))
        .returns("text", from(MediaType::type))
        .returns("plain", from(MediaType::subtype))
        .hasToString("text/plain")
        .extracting(MediaType::parameters, MAP)
        .isEmpty();
  }

  @Test
  void parseWithParameters() {
    assertThat(MediaType.parse("Text/HTML; Charset=\"UTF-8\" ; foo=\"a \\\"b\\\"\""))
        .returns("text", from(MediaType::type))
        .returns("html", from(MediaType::subtype))
        .extracting(MediaType::parameters, MAP)
        .containsExactly(entry("charset", "utf-8"), entry("foo", "a \"b\""));
  }

  @Test
  void toStringQuotesNonTokenValues() {
    assertThat(MediaType.of("text", "plain", Map.of("foo", "a b")))
        .hasToString("text/plain; foo=\"a b\"");
  }

  @Test
  void charset() {
    assertThat(MediaType.parse("text/plain; charset=ascii").charset()).hasValue(US_ASCII);
    assertThat(MediaType.TEXT_PLAIN.charset()).isEmpty();
    assertThat(MediaType.TEXT_PLAIN.charsetOrUtf8()).isEqualTo(UTF_8);
    assertThat(MediaType.TEXT_PLAIN.charsetOrDefault(US_ASCII)).isEqualTo(US_ASCII);
    assertThat(MediaType.TEXT_PLAIN.withCharset(UTF_8)).hasToString("text/plain; charset=utf-8");
  }

  @Test
  void inclusion() {
    assertThat(MediaType.ANY.includes(MediaType.APPLICATION_JSON)).isTrue();
    assertThat(MediaType.APPLICATION_ANY.includes(MediaType.APPLICATION_JSON)).isTrue();
    assertThat(MediaType.APPLICATION_JSON.includes(MediaType.APPLICATION_ANY)).isFalse();
    assertThat(MediaType.APPLICATION_JSON.includes(MediaType.parse("application/problem+json")))
        .isTrue();
    assertThat(MediaType.TEXT_ANY.includes(MediaType.APPLICATION_JSON)).isFalse();
    assertThat(MediaType.APPLICATION_JSON.includes(MediaType.APPLICATION_JSON.withCharset(UTF_8)))
        .isTrue();
    assertThat(MediaType.APPLICATION_JSON.withCharset(UTF_8).includes(MediaType.APPLICATION_JSON))
        .isFalse();
  }

  @Test
  void compatibility() {
    assertThat(MediaType.APPLICATION_JSON.isCompatibleWith(MediaType.ANY)).isTrue();
    assertThat(MediaType.ANY.isCompatibleWith(MediaType.APPLICATION_JSON)).isTrue();
    assertThat(MediaType.APPLICATION_JSON.isCompatibleWith(MediaType.TEXT_PLAIN)).isFalse();
    assertThat(MediaType.APPLICATION_JSON.hasWildcard()).isFalse();
    assertThat(MediaType.APPLICATION_ANY.hasWildcard()).isTrue();
  }

  @Test
  void equality() {
    assertThat(MediaType.parse("APPLICATION/JSON"))
        .isEqualTo(MediaType.APPLICATION_JSON)
        .hasSameHashCodeAs(MediaType.APPLICATION_JSON);
    assertThat(MediaType.parse("application/json; charset=utf-8"))
        .isNotEqualTo(MediaType.APPLICATION_JSON);
  }

  @Test
  void invalidMediaTypes() {
    assertThatIllegalArgumentException().isThrownBy(() -> MediaType.parse("text"));
    assertThatIllegalArgumentException().isThrownBy(() -> MediaType.parse("text/pl ain"));
    assertThatIllegalArgumentException().isThrownBy(() -> MediaType.parse("text/plain; charset"));
    assertThatIllegalArgumentException().isThrownBy(() -> MediaType.of("*", "plain"));
    assertThatIllegalArgumentException().isThrownBy(() -> MediaType.of("text", "pl@in"));
  }
}
