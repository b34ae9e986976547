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

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TypeRefTest {
  @Test
  void capturedTypes() {
    var typeRef = new TypeRef<List<String>>() {};
    assertThat(typeRef.rawType()).isEqualTo(List.class);
    assertThat(typeRef.isRawType()).isFalse();
    assertThat(typeRef).hasToString("java.util.List<java.lang.String>");
  }

  @Test
  void rawTypes() {
    var typeRef = TypeRef.of(String.class);
    assertThat(typeRef.rawType()).isEqualTo(String.class);
    assertThat(typeRef.isRawType()).isTrue();
    assertThat(typeRef).isEqualTo(new TypeRef<String>() {});
  }

  @Test
  void genericArrays() {
    var typeRef = new TypeRef<List<String>[]>() {};
    assertThat(typeRef.rawType()).isEqualTo(List[].class);
  }

  @Test
  void equality() {
    assertThat(new TypeRef<Map<String, Integer>>() {})
        .isEqualTo(new TypeRef<Map<String, Integer>>() {})
        .hasSameHashCodeAs(new TypeRef<Map<String, Integer>>() {})
        .isNotEqualTo(new TypeRef<Map<String, Long>>() {});
  }

  @Test
  void runtimeType() {
    assertThat(TypeRef.ofRuntimeType("abc")).isEqualTo(TypeRef.of(String.class));
  }

  @Test
  @SuppressWarnings("rawtypes")
  void rawTypeRefIsRejected() {
    assertThatIllegalStateException().isThrownBy(() -> new TypeRef() {});
  }
}
