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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.github.kestrelsoft.relay.MediaType;
import com.github.kestrelsoft.relay.TypeRef;
import com.github.kestrelsoft.relay.adapter.AbstractBodyAdapter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

abstract class JacksonAdapter extends AbstractBodyAdapter {
  final ObjectMapper mapper;

  JacksonAdapter(ObjectMapper mapper, MediaType... mediaTypes) {
    super(mediaTypes);
    this.mapper = requireNonNull(mapper);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[mediaTypes=" + compatibleMediaTypes() + "]";
  }

  private abstract static class AbstractEncoder extends JacksonAdapter implements Encoder {
    AbstractEncoder(ObjectMapper mapper, MediaType... mediaTypes) {
      super(mapper, mediaTypes);
    }

    @Override
    public boolean supportsType(TypeRef<?> typeRef) {
      return mapper.canSerialize(typeRef.rawType());
    }

    @Override
    public byte[] encode(Object value, MediaType mediaType) {
      requireSupport(TypeRef.ofRuntimeType(value), mediaType);
      try {
        return getBytes(value, charsetOrUtf8(mediaType));
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }

    abstract byte[] getBytes(Object value, Charset charset) throws IOException;
  }

  static final class TextFormatEncoder extends AbstractEncoder {
    TextFormatEncoder(ObjectMapper mapper, MediaType... mediaTypes) {
      super(mapper, mediaTypes);
    }

    @Override
    byte[] getBytes(Object value, Charset charset) throws IOException {
      if (charset.equals(StandardCharsets.UTF_8)) {
        return mapper.writeValueAsBytes(value); // Optimized for UTF-8.
      } else {
        return mapper.writeValueAsString(value).getBytes(charset);
      }
    }
  }

  static final class BinaryFormatEncoder extends AbstractEncoder {
    BinaryFormatEncoder(ObjectMapper mapper, MediaType... mediaTypes) {
      super(mapper, mediaTypes);
    }

    @Override
    byte[] getBytes(Object value, Charset ignored) throws IOException {
      return mapper.writeValueAsBytes(value);
    }
  }

  private abstract static class AbstractDecoder extends JacksonAdapter implements Decoder {
    AbstractDecoder(ObjectMapper mapper, MediaType... mediaTypes) {
      super(mapper, mediaTypes);
    }

    @Override
    public boolean supportsType(TypeRef<?> typeRef) {
      return mapper.canDeserialize(mapper.constructType(typeRef.type()));
    }

    @Override
    public <T> T decode(byte[] body, TypeRef<T> typeRef, MediaType mediaType) {
      requireSupport(typeRef, mediaType);
      var objectReader = mapper.readerFor(mapper.constructType(typeRef.type()));
      try {
        return typeRef.uncheckedCast(readValue(objectReader, body, charsetOrUtf8(mediaType)));
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }

    abstract Object readValue(ObjectReader objectReader, byte[] body, Charset charset)
        throws IOException;
  }

  static final class TextFormatDecoder extends AbstractDecoder {
    TextFormatDecoder(ObjectMapper mapper, MediaType... mediaTypes) {
      super(mapper, mediaTypes);
    }

    @Override
    Object readValue(ObjectReader objectReader, byte[] body, Charset charset) throws IOException {
      return charset.equals(StandardCharsets.UTF_8)
          ? objectReader.readValue(body)
          : objectReader.readValue(new String(body, charset));
    }
  }

  static final class BinaryFormatDecoder extends AbstractDecoder {
    BinaryFormatDecoder(ObjectMapper mapper, MediaType... mediaTypes) {
      super(mapper, mediaTypes);
    }

    @Override
    Object readValue(ObjectReader objectReader, byte[] body, Charset ignored) throws IOException {
      return objectReader.readValue(body);
    }
  }
}
