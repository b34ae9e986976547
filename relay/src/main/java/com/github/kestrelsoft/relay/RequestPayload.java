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

import com.github.kestrelsoft.relay.BodyAdapter.Encoder;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The body of an outgoing request together with its media type. The media type is what the
 * request's {@code Content-Type} header is set to, so the header always matches how the body was
 * encoded.
 */
public abstract class RequestPayload {
  private static final RequestPayload EMPTY =
      new RequestPayload(null) {
        @Override
        byte @Nullable [] encode(AdapterCodec adapterCodec) {
          return null;
        }
      };

  private final @Nullable MediaType contentType;

  private RequestPayload(@Nullable MediaType contentType) {
    this.contentType = contentType;
  }

  /** Returns the media type of the encoded body, or an empty optional if there's no body. */
  public Optional<MediaType> mediaType() {
    return Optional.ofNullable(contentType);
  }

  /**
   * Returns the encoded body, or {@code null} if there's no body. Throws an unchecked exception if
   * encoding fails.
   */
  abstract byte @Nullable [] encode(AdapterCodec adapterCodec);

  /** Returns the payload of a request without a body. */
  public static RequestPayload empty() {
    return EMPTY;
  }

  /** Returns a payload with the given pre-encoded bytes. */
  public static RequestPayload ofBytes(byte[] bytes, MediaType mediaType) {
    var copy = bytes.clone();
    return new RequestPayload(requireNonNull(mediaType)) {
      @Override
      byte[] encode(AdapterCodec adapterCodec) {
        return copy.clone();
      }
    };
  }

  /** Returns a payload with the given string, encoded with the media type's charset or UTF-8. */
  public static RequestPayload ofString(String value, MediaType mediaType) {
    requireNonNull(value);
    return new RequestPayload(requireNonNull(mediaType)) {
      @Override
      byte[] encode(AdapterCodec adapterCodec) {
        return value.getBytes(mediaType.charsetOrUtf8());
      }
    };
  }

  /**
   * Returns a payload that encodes the given value with the call's {@link AdapterCodec} into the
   * given media type.
   */
  public static RequestPayload of(Object value, MediaType mediaType) {
    requireNonNull(value);
    return new RequestPayload(requireNonNull(mediaType)) {
      @Override
      byte[] encode(AdapterCodec adapterCodec) {
        return adapterCodec.encode(value, mediaType);
      }
    };
  }

  /**
   * Returns a payload that encodes the given value with the given encoder, bypassing the call's
   * {@link AdapterCodec}. This is meant for formats the codec doesn't know about.
   */
  public static RequestPayload custom(Object value, MediaType mediaType, Encoder encoder) {
    requireNonNull(value);
    requireNonNull(encoder);
    return new RequestPayload(requireNonNull(mediaType)) {
      @Override
      byte[] encode(AdapterCodec adapterCodec) {
        return encoder.encode(value, mediaType);
      }
    };
  }
}
