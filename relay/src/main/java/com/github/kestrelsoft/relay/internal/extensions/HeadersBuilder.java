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

package com.github.kestrelsoft.relay.internal.extensions;

import static com.github.kestrelsoft.relay.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import com.github.kestrelsoft.relay.Header;
import com.github.kestrelsoft.relay.Headers;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Accumulates header fields in insertion order. */
public final class HeadersBuilder {
  private final List<Header> headers = new ArrayList<>();

  public HeadersBuilder() {}

  public void add(String name, String value) {
    headers.add(Header.of(name, value));
  }

  public void add(Header header) {
    headers.add(requireNonNull(header));
  }

  public void addAll(String... nameValuePairs) {
    requireArgument(
        nameValuePairs.length % 2 == 0,
        "Expected an even-numbered array length: %d",
        nameValuePairs.length);
    for (int i = 0; i < nameValuePairs.length; i += 2) {
      add(nameValuePairs[i], nameValuePairs[i + 1]);
    }
  }

  public void addAll(Iterable<Header> headers) {
    headers.forEach(this::add);
  }

  /** Replaces all headers with the given name by a single header, kept at the first one's slot. */
  public void set(String name, String value) {
    var header = Header.of(name, value);
    int firstIndex = indexOf(name);
    remove(name);
    if (firstIndex >= 0) {
      headers.add(Math.min(firstIndex, headers.size()), header);
    } else {
      headers.add(header);
    }
  }

  public void setIfAbsent(String name, String value) {
    if (indexOf(name) < 0) {
      add(name, value);
    }
  }

  public boolean remove(String name) {
    requireNonNull(name);
    return headers.removeIf(header -> header.hasName(name));
  }

  public void clear() {
    headers.clear();
  }

  public Optional<String> firstValue(String name) {
    int index = indexOf(name);
    return index >= 0 ? Optional.of(headers.get(index).value()) : Optional.empty();
  }

  private int indexOf(String name) {
    requireNonNull(name);
    for (int i = 0; i < headers.size(); i++) {
      if (headers.get(i).hasName(name)) {
        return i;
      }
    }
    return -1;
  }

  public Headers build() {
    return Headers.of(headers);
  }
}
