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

import com.github.kestrelsoft.relay.internal.extensions.BasicAdapter;

/**
 * An object that converts objects to or from request or response bodies respectively, using a
 * defined format. The media type of a body adapter represents the format it uses to convert
 * objects (e.g. {@code application/json}). Adapters are plain stateless functions and are safe to
 * share between concurrent calls.
 *
 * <p>An adapter signals failure to convert a value by throwing an unchecked exception (e.g. an
 * {@link java.io.UncheckedIOException} wrapping a parser's {@code IOException}). The pipeline turns
 * such failures into {@link HttpFailure.Kind#ENCODING} or {@link HttpFailure.Kind#DECODING}
 * failures.
 */
public interface BodyAdapter {

  /**
   * Returns {@code true} if the format this adapter uses is {@link
   * MediaType#isCompatibleWith(MediaType) compatible} with the given media type.
   */
  boolean isCompatibleWith(MediaType mediaType);

  /** Returns {@code true} if this adapter supports the given type. */
  boolean supportsType(TypeRef<?> typeRef);

  /** A {@code BodyAdapter} that encodes objects into request bodies. */
  interface Encoder extends BodyAdapter {

    /**
     * Encodes the given object into bytes in the format of the given media type.
     *
     * @throws UnsupportedOperationException if the object's type or the media type isn't supported
     */
    byte[] encode(Object value, MediaType mediaType);

    /**
     * Returns the basic encoder, which encodes {@code CharSequence} using the media type's charset
     * (or UTF-8), and passes {@code byte[]} through as is.
     */
    static Encoder basic() {
      return BasicAdapter.encoder();
    }
  }

  /** A {@code BodyAdapter} that decodes response bodies into objects. */
  interface Decoder extends BodyAdapter {

    /**
     * Decodes the given bytes, which are in the format of the given media type, into an object of
     * the given type.
     *
     * @throws UnsupportedOperationException if the type or the media type isn't supported
     */
    <T> T decode(byte[] body, TypeRef<T> typeRef, MediaType mediaType);

    /**
     * Returns the basic decoder, which decodes into {@code String} using the media type's charset
     * (or UTF-8), or into {@code byte[]}.
     */
    static Decoder basic() {
      return BasicAdapter.decoder();
    }
  }
}
