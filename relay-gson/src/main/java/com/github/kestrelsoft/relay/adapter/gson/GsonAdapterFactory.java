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

import com.github.kestrelsoft.relay.AdapterCodec;
import com.github.kestrelsoft.relay.BodyAdapter;
import com.github.kestrelsoft.relay.BodyAdapter.Decoder;
import com.github.kestrelsoft.relay.BodyAdapter.Encoder;
import com.google.gson.Gson;

/**
 * Provides {@link BodyAdapter} implementations for the JSON format using Gson. The adapters are
 * compatible with {@code application/json}.
 */
public class GsonAdapterFactory {

  private GsonAdapterFactory() {} // non-instantiable

  /** Returns an {@code Encoder} that uses a default {@code Gson} instance. */
  public static Encoder createEncoder() {
    return createEncoder(new Gson());
  }

  /** Returns an {@code Encoder} that uses the given {@code Gson} instance. */
  public static Encoder createEncoder(Gson gson) {
    return new GsonAdapter.JsonEncoder(gson);
  }

  /** Returns a {@code Decoder} that uses a default {@code Gson} instance. */
  public static Decoder createDecoder() {
    return createDecoder(new Gson());
  }

  /** Returns a {@code Decoder} that uses the given {@code Gson} instance. */
  public static Decoder createDecoder(Gson gson) {
    return new GsonAdapter.JsonDecoder(gson);
  }

  /**
   * Returns a codec with an encoder & decoder using the given {@code Gson} instance, followed by
   * the basic adapters for non-JSON media types.
   */
  public static AdapterCodec createJsonCodec(Gson gson) {
    return AdapterCodec.newBuilder()
        .encoder(createEncoder(gson))
        .decoder(createDecoder(gson))
        .basic()
        .build();
  }
}
