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

package com.github.kestrelsoft.relay.adapter;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import com.github.kestrelsoft.relay.BodyAdapter;
import com.github.kestrelsoft.relay.MediaType;
import com.github.kestrelsoft.relay.TypeRef;
import java.nio.charset.Charset;
import java.util.Set;

/**
 * An abstract {@link BodyAdapter} that implements {@link BodyAdapter#isCompatibleWith(MediaType)}
 * by allowing subclasses to specify a set of {@code MediaTypes} the adapter is compatible with.
 */
public abstract class AbstractBodyAdapter implements BodyAdapter {
  private final Set<MediaType> compatibleMediaTypes;

  /** Creates an {@code AbstractBodyAdapter} compatible with the given media types. */
  protected AbstractBodyAdapter(MediaType... compatibleMediaTypes) {
    this.compatibleMediaTypes = Set.of(compatibleMediaTypes);
  }

  @Override
  public final boolean isCompatibleWith(MediaType mediaType) {
    return compatibleMediaTypes.stream().anyMatch(mediaType::isCompatibleWith);
  }

  /** Returns an immutable set containing the media types this adapter is compatible with. */
  protected Set<MediaType> compatibleMediaTypes() {
    return compatibleMediaTypes;
  }

  /**
   * Requires that this adapter {@link #supportsType(TypeRef) supports} the given type and {@link
   * #isCompatibleWith(MediaType) is compatible with} the given media type.
   *
   * @throws UnsupportedOperationException if either requirement isn't met
   */
  protected void requireSupport(TypeRef<?> typeRef, MediaType mediaType) {
    if (!supportsType(typeRef)) {
      throw new UnsupportedOperationException("Unsupported type: " + typeRef);
    }
    if (!isCompatibleWith(mediaType)) {
      throw new UnsupportedOperationException(
          "This adapter is not compatible with: " + mediaType);
    }
  }

  /** Returns the charset of the given media type, or {@code defaultCharset} if it has none. */
  public static Charset charsetOrDefault(MediaType mediaType, Charset defaultCharset) {
    requireNonNull(defaultCharset);
    return mediaType.charsetOrDefault(defaultCharset);
  }

  /** Returns the charset of the given media type, or UTF-8 if it has none. */
  public static Charset charsetOrUtf8(MediaType mediaType) {
    return charsetOrDefault(mediaType, UTF_8);
  }
}
