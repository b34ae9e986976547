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

package com.github.kestrelsoft.relay.adapter.gson;

import static java.util.Objects.requireNonNull;

import com.github.kestrelsoft.relay.MediaType;
import com.github.kestrelsoft.relay.TypeRef;
import com.github.kestrelsoft.relay.adapter.AbstractBodyAdapter;
import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;

abstract class GsonAdapter extends AbstractBodyAdapter {
  final Gson gson;

  GsonAdapter(Gson gson) {
    super(MediaType.APPLICATION_JSON);
    this.gson = requireNonNull(gson);
  }

  @Override
  public boolean supportsType(TypeRef<?> typeRef) {
    try {
      gson.getAdapter(TypeToken.get(typeRef.type()));
      return true;
    } catch (IllegalArgumentException ignored) {
      // Gson::getAdapter throws IAE if it can't de/serialize the type.
      return false;
    }
  }

  static final class JsonEncoder extends GsonAdapter implements Encoder {
    JsonEncoder(Gson gson) {
      super(gson);
    }

    @Override
    public byte[] encode(Object value, MediaType mediaType) {
      var typeRef = TypeRef.ofRuntimeType(value);
      requireSupport(typeRef, mediaType);
      return gson.toJson(value, typeRef.type()).getBytes(charsetOrUtf8(mediaType));
    }

    @Override
    public String toString() {
      return "GsonEncoder";
    }
  }

  static final class JsonDecoder extends GsonAdapter implements Decoder {
    JsonDecoder(Gson gson) {
      super(gson);
    }

    @Override
    public <T> T decode(byte[] body, TypeRef<T> typeRef, MediaType mediaType) {
      requireSupport(typeRef, mediaType);
      return typeRef.uncheckedCast(
          gson.fromJson(new String(body, charsetOrUtf8(mediaType)), typeRef.type()));
    }

    @Override
    public String toString() {
      return "GsonDecoder";
    }
  }
}
