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

import static com.github.kestrelsoft.relay.internal.Utils.quoteIfNeeded;
import static com.github.kestrelsoft.relay.internal.Utils.requireValidToken;
import static com.github.kestrelsoft.relay.internal.Validate.requireArgument;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A <a href="https://tools.ietf.org/html/rfc2045#section-5.1">MIME type</a>. The codec boundary is
 * keyed by media types: a payload's media type becomes the request's {@code Content-Type}, and a
 * parser's media type becomes its {@code Accept}.
 *
 * <p>The type, subtype and parameter names are case-insensitive and are normalized to lowercase.
 */
public final class MediaType {
  private static final String CHARSET_ATTRIBUTE = "charset";
  private static final String WILDCARD = "*";

  private static final String APPLICATION_TYPE = "application";
  private static final String TEXT_TYPE = "text";

  /** {@code *}{@code /*} */
  public static final MediaType ANY = new MediaType(WILDCARD, WILDCARD);

  /** {@code application/*} */
  public static final MediaType APPLICATION_ANY = new MediaType(APPLICATION_TYPE, WILDCARD);

  /** {@code application/json} */
  public static final MediaType APPLICATION_JSON = new MediaType(APPLICATION_TYPE, "json");

  /** {@code application/octet-stream} */
  public static final MediaType APPLICATION_OCTET_STREAM =
      new MediaType(APPLICATION_TYPE, "octet-stream");

  /** {@code application/x-www-form-urlencoded} */
  public static final MediaType APPLICATION_FORM_URLENCODED =
      new MediaType(APPLICATION_TYPE, "x-www-form-urlencoded");

  /** {@code text/*} */
  public static final MediaType TEXT_ANY = new MediaType(TEXT_TYPE, WILDCARD);

  /** {@code text/plain} */
  public static final MediaType TEXT_PLAIN = new MediaType(TEXT_TYPE, "plain");

  /** {@code text/html} */
  public static final MediaType TEXT_HTML = new MediaType(TEXT_TYPE, "html");

  private final String type;
  private final String subtype;
  private final Map<String, String> parameters;
  private @MonotonicNonNull String lazyToString;

  private MediaType(String type, String subtype) {
    this(type, subtype, Map.of());
  }

  private MediaType(String type, String subtype, Map<String, String> parameters) {
    this.type = type;
    this.subtype = subtype;
    this.parameters = parameters;
  }

  /** Returns the general type. */
  public String type() {
    return type;
  }

  /** Returns the subtype. */
  public String subtype() {
    return subtype;
  }

  /** Returns an immutable map representing the parameters. */
  public Map<String, String> parameters() {
    return parameters;
  }

  /**
   * Returns the value of the charset parameter, or an empty {@code Optional} if there's no such
   * parameter.
   *
   * @throws IllegalCharsetNameException if the charset parameter's value is invalid
   * @throws UnsupportedCharsetException if the charset is not supported in this JVM
   */
  public Optional<Charset> charset() {
    var charsetName = parameters.get(CHARSET_ATTRIBUTE);
    return charsetName != null ? Optional.of(Charset.forName(charsetName)) : Optional.empty();
  }

  /**
   * Returns either the value of the charset parameter or the given default charset if no such
   * parameter exists or if it names a charset that's invalid or unsupported.
   */
  public Charset charsetOrDefault(Charset defaultCharset) {
    requireNonNull(defaultCharset);
    try {
      return charset().orElse(defaultCharset);
    } catch (IllegalCharsetNameException | UnsupportedCharsetException ignored) {
      return defaultCharset;
    }
  }

  /** Equivalent to {@code charsetOrDefault(UTF_8)}. */
  public Charset charsetOrUtf8() {
    return charsetOrDefault(UTF_8);
  }

  /** Returns {@code true} if this is {@code *}{@code /*} or has a wildcard subtype. */
  public boolean hasWildcard() {
    return type.equals(WILDCARD) || subtype.equals(WILDCARD);
  }

  /**
   * Returns whether this media type includes the given one. A media type includes another if the
   * former's parameters are a subset of the latter's, and the former is either a wildcard that
   * covers the latter or has the same type and subtype. A subtype also covers structured syntax
   * suffixes, so {@code application/json} includes {@code application/problem+json}.
   */
  public boolean includes(MediaType other) {
    return includes(other.type, other.subtype)
        && other.parameters.entrySet().containsAll(parameters.entrySet());
  }

  private boolean includes(String otherType, String otherSubtype) {
    return type.equals(WILDCARD) || (type.equals(otherType) && includesSubtype(otherSubtype));
  }

  private boolean includesSubtype(String otherSubtype) {
    if (subtype.equals(WILDCARD) || subtype.equals(otherSubtype)) {
      return true;
    }
    int suffixIndex = otherSubtype.lastIndexOf('+');
    return suffixIndex != -1 && otherSubtype.substring(suffixIndex + 1).equals(subtype);
  }

  /** Returns whether either of this media type or the given one includes the other. */
  public boolean isCompatibleWith(MediaType other) {
    return this.includes(other) || other.includes(this);
  }

  /** Returns a copy of this media type with the charset parameter set to the given charset. */
  public MediaType withCharset(Charset charset) {
    return withParameter(CHARSET_ATTRIBUTE, charset.name());
  }

  /**
   * Returns a copy of this media type with the given parameter set to the given value.
   *
   * @throws IllegalArgumentException if the given name or value is invalid
   */
  public MediaType withParameter(String name, String value) {
    var parameters = new LinkedHashMap<>(this.parameters);
    parameters.put(name, value);
    return of(type, subtype, parameters);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof MediaType)) {
      return false;
    }
    var other = (MediaType) obj;
    return type.equals(other.type)
        && subtype.equals(other.subtype)
        && parameters.equals(other.parameters);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, subtype, parameters);
  }

  /** Returns a text representation of this media type suitable for a {@code Content-Type}. */
  @Override
  public String toString() {
    var toString = lazyToString;
    if (toString == null) {
      var sb = new StringBuilder().append(type).append('/').append(subtype);
      parameters.forEach(
          (name, value) ->
              sb.append("; ").append(name).append('=').append(quoteIfNeeded(value)));
      toString = sb.toString();
      lazyToString = toString;
    }
    return toString;
  }

  /**
   * Returns a new {@code MediaType} with the given type and subtype.
   *
   * @throws IllegalArgumentException if the given type or subtype is invalid
   */
  public static MediaType of(String type, String subtype) {
    return of(type, subtype, Map.of());
  }

  /**
   * Returns a new {@code MediaType} with the given type, subtype and parameters.
   *
   * @throws IllegalArgumentException if any of the given arguments is invalid
   */
  public static MediaType of(String type, String subtype, Map<String, String> parameters) {
    requireNonNull(type);
    requireNonNull(subtype);
    requireArgument(
        !type.equals(WILDCARD) || subtype.equals(WILDCARD),
        "Cannot have a wildcard type with a concrete subtype");
    var normalizedParameters = new LinkedHashMap<String, String>();
    parameters.forEach(
        (name, value) -> {
          var normalizedName = normalizeToken(name);
          normalizedParameters.put(
              normalizedName,
              normalizedName.equals(CHARSET_ATTRIBUTE)
                  ? normalizeToken(value)
                  : requireNonNull(value));
        });
    return new MediaType(
        normalizeToken(type),
        normalizeToken(subtype),
        Collections.unmodifiableMap(normalizedParameters));
  }

  private static String normalizeToken(String token) {
    return requireValidToken(token).toLowerCase(Locale.ROOT);
  }

  /**
   * Parses the given string into a {@code MediaType}.
   *
   * @throws IllegalArgumentException if the given string is not a valid media type
   */
  public static MediaType parse(String value) {
    // media-type = type "/" subtype *( OWS ";" OWS parameter )
    // parameter  = token "=" ( token / quoted-string )
    try {
      var segments = value.split(";", -1);
      var typeAndSubtype = segments[0].trim();
      int slash = typeAndSubtype.indexOf('/');
      requireArgument(slash > 0, "Missing '/'");
      var parameters = new LinkedHashMap<String, String>();
      for (int i = 1; i < segments.length; i++) {
        var parameter = segments[i].trim();
        if (parameter.isEmpty()) {
          continue;
        }
        int equals = parameter.indexOf('=');
        requireArgument(equals > 0, "Malformed parameter: '%s'", parameter);
        parameters.put(
            parameter.substring(0, equals).trim(), unquote(parameter.substring(equals + 1).trim()));
      }
      return of(
          typeAndSubtype.substring(0, slash).trim(),
          typeAndSubtype.substring(slash + 1).trim(),
          parameters);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Couldn't parse: '" + value + "'", e);
    }
  }

  private static String unquote(String value) {
    if (value.length() < 2 || value.charAt(0) != '"' || value.charAt(value.length() - 1) != '"') {
      return value;
    }
    var unquoted = new StringBuilder();
    for (int i = 1; i < value.length() - 1; i++) {
      char c = value.charAt(i);
      if (c == '\\' && i + 1 < value.length() - 1) {
        c = value.charAt(++i);
      }
      unquoted.append(c);
    }
    return unquoted.toString();
  }
}
