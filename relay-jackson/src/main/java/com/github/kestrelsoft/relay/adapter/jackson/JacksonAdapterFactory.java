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

package com.github.kestrelsoft.relay.adapter.jackson;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.github.kestrelsoft.relay.AdapterCodec;
import com.github.kestrelsoft.relay.BodyAdapter;
import com.github.kestrelsoft.relay.BodyAdapter.Decoder;
import com.github.kestrelsoft.relay.BodyAdapter.Encoder;
import com.github.kestrelsoft.relay.MediaType;
import com.github.kestrelsoft.relay.adapter.jackson.JacksonAdapter.BinaryFormatDecoder;
import com.github.kestrelsoft.relay.adapter.jackson.JacksonAdapter.BinaryFormatEncoder;
import com.github.kestrelsoft.relay.adapter.jackson.JacksonAdapter.TextFormatDecoder;
import com.github.kestrelsoft.relay.adapter.jackson.JacksonAdapter.TextFormatEncoder;
import java.util.Arrays;
import java.util.stream.Stream;

/**
 * Provides {@link BodyAdapter} implementations for the Jackson library, and {@link AdapterCodec
 * codecs} made of them. Mappers of binary formats (e.g. CBOR or Smile) are detected and get
 * adapters that ignore the charset of the media type.
 */
public class JacksonAdapterFactory {
  private JacksonAdapterFactory() {} // non-instantiable

  /** Returns a JSON {@code Encoder} that uses a default {@code JsonMapper}. */
  public static Encoder createJsonEncoder() {
    return createJsonEncoder(new JsonMapper());
  }

  /** Returns an {@code Encoder} that uses the given mapper for {@code application/json}. */
  public static Encoder createJsonEncoder(ObjectMapper mapper) {
    return createEncoder(mapper, MediaType.APPLICATION_JSON);
  }

  /** Returns an {@code Encoder} that uses the given mapper for the given media types. */
  public static Encoder createEncoder(
      ObjectMapper mapper, MediaType firstMediaType, MediaType... otherMediaTypes) {
    var mediaTypes = mediaTypes(firstMediaType, otherMediaTypes);
    return writesBinary(mapper.getFactory())
        ? new BinaryFormatEncoder(mapper, mediaTypes)
        : new TextFormatEncoder(mapper, mediaTypes);
  }

  /** Returns a JSON {@code Decoder} that uses a default {@code JsonMapper}. */
  public static Decoder createJsonDecoder() {
    return createJsonDecoder(new JsonMapper());
  }

  /** Returns a {@code Decoder} that uses the given mapper for {@code application/json}. */
  public static Decoder createJsonDecoder(ObjectMapper mapper) {
    return createDecoder(mapper, MediaType.APPLICATION_JSON);
  }

  /** Returns a {@code Decoder} that uses the given mapper for the given media types. */
  public static Decoder createDecoder(
      ObjectMapper mapper, MediaType firstMediaType, MediaType... otherMediaTypes) {
    var mediaTypes = mediaTypes(firstMediaType, otherMediaTypes);
    return writesBinary(mapper.getFactory())
        ? new BinaryFormatDecoder(mapper, mediaTypes)
        : new TextFormatDecoder(mapper, mediaTypes);
  }

  /** Returns a codec with a default JSON encoder & decoder, followed by the basic adapters. */
  public static AdapterCodec createJsonCodec() {
    return createJsonCodec(new JsonMapper());
  }

  /**
   * Returns a codec with a JSON encoder & decoder using the given mapper, followed by the basic
   * adapters. The basic adapters only handle what Jackson doesn't match first, e.g. plain text.
   */
  public static AdapterCodec createJsonCodec(ObjectMapper mapper) {
    return AdapterCodec.newBuilder()
        .encoder(createJsonEncoder(mapper))
        .decoder(createJsonDecoder(mapper))
        .basic()
        .build();
  }

  private static MediaType[] mediaTypes(MediaType firstMediaType, MediaType... otherMediaTypes) {
    return Stream.concat(Stream.of(requireNonNull(firstMediaType)), Arrays.stream(otherMediaTypes))
        .map(mediaType -> requireNonNull(mediaType))
        .toArray(MediaType[]::new);
  }

  private static boolean writesBinary(JsonFactory factory) {
    return factory.canHandleBinaryNatively() || !factory.canUseCharArrays();
  }
}
