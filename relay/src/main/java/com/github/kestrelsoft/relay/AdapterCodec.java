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

import com.github.kestrelsoft.relay.BodyAdapter.Decoder;
import com.github.kestrelsoft.relay.BodyAdapter.Encoder;
import com.github.kestrelsoft.relay.internal.Utils;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A group of {@link BodyAdapter adapters} ({@link Encoder encoders} & {@link Decoder decoders}),
 * typically targeting different mapping schemes. The correct adapter is selected based on the
 * object type and the {@link MediaType} of the mapping format. Encoders and decoders are tried in
 * the order they're added.
 */
public final class AdapterCodec {
  private static final AdapterCodec BASIC = newBuilder().basic().build();

  private final List<Encoder> encoders;
  private final List<Decoder> decoders;

  private AdapterCodec(List<Encoder> encoders, List<Decoder> decoders) {
    this.encoders = List.copyOf(encoders);
    this.decoders = List.copyOf(decoders);
  }

  /** Returns the list of encoders in this codec. */
  public List<Encoder> encoders() {
    return encoders;
  }

  /** Returns the list of decoders in this codec. */
  public List<Decoder> decoders() {
    return decoders;
  }

  /**
   * Encodes the given object into bytes of the given media type.
   *
   * @throws UnsupportedOperationException if no encoder that supports encoding the given object
   *     and is compatible with the given media type is found
   */
  public byte[] encode(Object value, MediaType mediaType) {
    var typeRef = TypeRef.ofRuntimeType(requireNonNull(value));
    return lookupEncoder(typeRef, mediaType)
        .orElseThrow(() -> unsupportedConversion("from", typeRef, mediaType))
        .encode(value, mediaType);
  }

  /**
   * Decodes the given bytes of the given media type into an object of the given type.
   *
   * @throws UnsupportedOperationException if no decoder that supports decoding to the given type
   *     and is compatible with the given media type is found
   */
  public <T> T decode(byte[] body, TypeRef<T> typeRef, MediaType mediaType) {
    requireNonNull(body);
    return lookupDecoder(typeRef, mediaType)
        .orElseThrow(() -> unsupportedConversion("to", typeRef, mediaType))
        .decode(body, typeRef, mediaType);
  }

  public Optional<Encoder> lookupEncoder(TypeRef<?> typeRef, MediaType mediaType) {
    return lookup(encoders, typeRef, mediaType);
  }

  public Optional<Decoder> lookupDecoder(TypeRef<?> typeRef, MediaType mediaType) {
    return lookup(decoders, typeRef, mediaType);
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this)
        + "[encoders="
        + encoders
        + ", decoders="
        + decoders
        + "]";
  }

  private static <T extends BodyAdapter> Optional<T> lookup(
      List<T> adapters, TypeRef<?> typeRef, MediaType mediaType) {
    requireNonNull(typeRef);
    requireNonNull(mediaType);
    return adapters.stream()
        .filter(adapter -> adapter.supportsType(typeRef) && adapter.isCompatibleWith(mediaType))
        .findFirst();
  }

  private static UnsupportedOperationException unsupportedConversion(
      String preposition, TypeRef<?> typeRef, MediaType mediaType) {
    return new UnsupportedOperationException(
        "Unsupported conversion "
            + preposition
            + " an object of type <"
            + typeRef
            + "> with media type <"
            + mediaType
            + ">");
  }

  /** Returns a codec with only the {@link Encoder#basic() basic encoder} & decoder. */
  public static AdapterCodec basic() {
    return BASIC;
  }

  /** Returns a new {@code AdapterCodec.Builder}. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /** A builder of {@code AdapterCodec} instances. */
  public static final class Builder {
    private final List<Encoder> encoders = new ArrayList<>();
    private final List<Decoder> decoders = new ArrayList<>();

    Builder() {}

    /** Adds the given encoder. */
    @CanIgnoreReturnValue
    public Builder encoder(Encoder encoder) {
      encoders.add(requireNonNull(encoder));
      return this;
    }

    /** Adds the given decoder. */
    @CanIgnoreReturnValue
    public Builder decoder(Decoder decoder) {
      decoders.add(requireNonNull(decoder));
      return this;
    }

    /** Adds the {@link Encoder#basic() basic encoder}. */
    @CanIgnoreReturnValue
    public Builder basicEncoder() {
      return encoder(Encoder.basic());
    }

    /** Adds the {@link Decoder#basic() basic decoder}. */
    @CanIgnoreReturnValue
    public Builder basicDecoder() {
      return decoder(Decoder.basic());
    }

    /**
     * Adds both the basic {@link Encoder#basic() encoder} {@code &} {@link Decoder#basic() decoder}
     * pair.
     */
    @CanIgnoreReturnValue
    public Builder basic() {
      return basicEncoder().basicDecoder();
    }

    /** Returns a new {@code AdapterCodec} containing the encoders and decoders added so far. */
    public AdapterCodec build() {
      return new AdapterCodec(encoders, decoders);
    }
  }
}
