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

import com.github.kestrelsoft.relay.MediaType;
import com.github.kestrelsoft.relay.TypeRef;
import com.github.kestrelsoft.relay.adapter.AbstractBodyAdapter;

/** An adapter for basic types ({@code String}, {@code byte[]}), compatible with any media type. */
public abstract class BasicAdapter extends AbstractBodyAdapter {
  BasicAdapter() {
    super(MediaType.ANY);
  }

  public static Encoder encoder() {
    return BasicEncoder.INSTANCE;
  }

  public static Decoder decoder() {
    return BasicDecoder.INSTANCE;
  }

  private static final class BasicEncoder extends BasicAdapter implements Encoder {
    static final BasicEncoder INSTANCE = new BasicEncoder();

    private BasicEncoder() {}

    @Override
    public boolean supportsType(TypeRef<?> typeRef) {
      var rawType = typeRef.rawType();
      return CharSequence.class.isAssignableFrom(rawType) || rawType.equals(byte[].class);
    }

    @Override
    public byte[] encode(Object value, MediaType mediaType) {
      requireSupport(TypeRef.ofRuntimeType(value), mediaType);
      if (value instanceof byte[]) {
        return ((byte[]) value).clone();
      }
      return value.toString().getBytes(charsetOrUtf8(mediaType));
    }

    @Override
    public String toString() {
      return "BasicEncoder";
    }
  }

  private static final class BasicDecoder extends BasicAdapter implements Decoder {
    static final BasicDecoder INSTANCE = new BasicDecoder();

    private BasicDecoder() {}

    @Override
    public boolean supportsType(TypeRef<?> typeRef) {
      var rawType = typeRef.rawType();
      return rawType.equals(String.class) || rawType.equals(byte[].class);
    }

    @Override
    public <T> T decode(byte[] body, TypeRef<T> typeRef, MediaType mediaType) {
      requireSupport(typeRef, mediaType);
      if (typeRef.rawType().equals(byte[].class)) {
        return typeRef.uncheckedCast(body.clone());
      }
      return typeRef.uncheckedCast(new String(body, charsetOrUtf8(mediaType)));
    }

    @Override
    public String toString() {
      return "BasicDecoder";
    }
  }
}
