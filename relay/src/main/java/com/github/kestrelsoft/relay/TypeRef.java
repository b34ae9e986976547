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

import static com.github.kestrelsoft.relay.internal.Validate.requireArgument;
import static com.github.kestrelsoft.relay.internal.Validate.requireState;
import static java.util.Objects.requireNonNull;

import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A generic object that holds a reference to the {@link Type} of its generic argument {@link T}.
 * This class utilizes the supertype-token idiom, which is used to capture complex types (e.g.
 * {@code List<String>}) that are otherwise impossible to represent using ordinary {@code Class}
 * objects.
 *
 * @param <T> represents the type this object holds a reference to
 */
public abstract class TypeRef<T> {
  private final Type type;
  private final Class<?> rawType;

  /**
   * Creates a new {@code TypeRef<T>} capturing the {@link Type} of {@link T}. This constructor is
   * typically invoked as an anonymous class expression (e.g. {@code new TypeRef<List<String>>()
   * {}}).
   *
   * @throws IllegalStateException if the raw version of this class is used
   */
  protected TypeRef() {
    var superclass = getClass().getGenericSuperclass();
    requireState(
        superclass instanceof ParameterizedType,
        "TypeRef must be used in parameterized form (i.e. new TypeRef<List<String>>() {})");
    this.type = ((ParameterizedType) superclass).getActualTypeArguments()[0];
    this.rawType = rawTypeOf(type);
  }

  private TypeRef(Type type) {
    this.type = type;
    this.rawType = rawTypeOf(type);
  }

  /** Returns the underlying {@link Type}. */
  public final Type type() {
    return type;
  }

  /**
   * Returns the {@code Class<? super T>} that represents the resolved raw type of {@link T}. The
   * returned class is {@code Class<? super T>} because {@code T} can possibly be a generic type,
   * and it is not semantically correct for a {@code Class} to be parameterized with such.
   */
  @SuppressWarnings("unchecked")
  public final Class<? super T> rawType() {
    return (Class<? super T>) rawType;
  }

  /** Returns {@code true} if {@link T} is a raw type (i.e. {@code Class<T>}). */
  public final boolean isRawType() {
    return type instanceof Class<?>;
  }

  /** Casts the given object to {@code T} without checking generic arguments. */
  @SuppressWarnings("unchecked")
  public final T uncheckedCast(@Nullable Object value) {
    return (T) value;
  }

  @Override
  public final boolean equals(@Nullable Object obj) {
    return obj == this || (obj instanceof TypeRef<?> && type.equals(((TypeRef<?>) obj).type));
  }

  @Override
  public final int hashCode() {
    return 31 * type.hashCode();
  }

  @Override
  public final String toString() {
    return type.getTypeName();
  }

  /**
   * Creates a new {@code TypeRef} for the given type.
   *
   * @throws IllegalArgumentException if the given type is not a standard specialization of a Java
   *     {@code Type}
   */
  public static TypeRef<?> of(Type type) {
    return new ExplicitTypeRef<>(type);
  }

  /** Creates a new {@code TypeRef} for the given class. */
  public static <U> TypeRef<U> of(Class<U> rawType) {
    return new ExplicitTypeRef<>(rawType);
  }

  /** Creates a new {@code TypeRef} for the runtime class of the given object. */
  @SuppressWarnings("unchecked")
  public static <T> TypeRef<? extends T> ofRuntimeType(T instance) {
    return of((Class<? extends T>) instance.getClass());
  }

  private static Class<?> rawTypeOf(Type type) {
    requireNonNull(type);
    if (type instanceof Class<?>) {
      return (Class<?>) type;
    } else if (type instanceof ParameterizedType) {
      return (Class<?>) ((ParameterizedType) type).getRawType();
    } else if (type instanceof GenericArrayType) {
      var componentRawType = rawTypeOf(((GenericArrayType) type).getGenericComponentType());
      return Array.newInstance(componentRawType, 0).getClass();
    } else if (type instanceof TypeVariable<?>) {
      var bounds = ((TypeVariable<?>) type).getBounds();
      return bounds.length > 0 ? rawTypeOf(bounds[0]) : Object.class;
    } else if (type instanceof WildcardType) {
      var upperBounds = ((WildcardType) type).getUpperBounds();
      return upperBounds.length > 0 ? rawTypeOf(upperBounds[0]) : Object.class;
    }
    requireArgument(false, "Unsupported type: %s", type);
    throw new AssertionError(); // Unreachable.
  }

  private static final class ExplicitTypeRef<T> extends TypeRef<T> {
    ExplicitTypeRef(Type type) {
      super(type);
    }
  }
}
