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

import com.github.kestrelsoft.relay.internal.extensions.HeadersBuilder;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable, ordered list of header fields. The same name can appear more than once, and
 * lookups by name ignore case.
 */
public final class Headers implements Iterable<Header> {
  private static final Headers EMPTY = new Headers(List.of());

  private final List<Header> headers;

  private Headers(List<Header> headers) {
    this.headers = headers;
  }

  /** Returns the header fields in order. */
  public List<Header> list() {
    return headers;
  }

  /** Returns the value of the first header with the given name. */
  public Optional<String> firstValue(String name) {
    requireNonNull(name);
    return headers.stream().filter(header -> header.hasName(name)).map(Header::value).findFirst();
  }

  /** Returns the values of all headers with the given name, in order. */
  public List<String> allValues(String name) {
    requireNonNull(name);
    var values = new ArrayList<String>();
    for (var header : headers) {
      if (header.hasName(name)) {
        values.add(header.value());
      }
    }
    return List.copyOf(values);
  }

  public boolean contains(String name) {
    return firstValue(name).isPresent();
  }

  /** Returns the distinct header names in order of first appearance. */
  public Set<String> names() {
    var names = new LinkedHashSet<String>();
    for (var header : headers) {
      if (names.stream().noneMatch(header::hasName)) {
        names.add(header.name());
      }
    }
    return names;
  }

  public int size() {
    return headers.size();
  }

  public boolean isEmpty() {
    return headers.isEmpty();
  }

  @Override
  public Iterator<Header> iterator() {
    return headers.iterator();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    return obj == this || (obj instanceof Headers && headers.equals(((Headers) obj).headers));
  }

  @Override
  public int hashCode() {
    return headers.hashCode();
  }

  @Override
  public String toString() {
    return headers.toString();
  }

  public static Headers empty() {
    return EMPTY;
  }

  /**
   * Returns headers with the given name-value pairs, e.g. {@code Headers.of("Accept",
   * "text/plain", "User-Agent", "relay")}.
   *
   * @throws IllegalArgumentException if the array length is odd or any header is invalid
   */
  public static Headers of(String... nameValuePairs) {
    var builder = new HeadersBuilder();
    builder.addAll(nameValuePairs);
    return builder.build();
  }

  public static Headers of(List<Header> headers) {
    return headers.isEmpty() ? EMPTY : new Headers(List.copyOf(headers));
  }
}
