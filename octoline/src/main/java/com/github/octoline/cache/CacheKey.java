/*
 * Copyright (c) 2024 Moataz Abdelnasser
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

package com.github.octoline.cache;

import static java.util.Objects.requireNonNull;

import java.net.http.HttpHeaders;
import java.util.Optional;

/**
 * A validator identifying a specific version of a stored response, sent back to the server to ask
 * whether that version is still current.
 */
public final class CacheKey {

  /** The kind of validator a {@code CacheKey} carries. */
  public enum Kind {
    /** An opaque entity tag, re-sent as {@code If-None-Match}. */
    ETAG("If-None-Match"),

    /** A {@code Last-Modified} date, re-sent as {@code If-Modified-Since}. */
    LAST_MODIFIED("If-Modified-Since");

    private final String conditionalHeaderName;

    Kind(String conditionalHeaderName) {
      this.conditionalHeaderName = conditionalHeaderName;
    }

    /** Returns the request header used to send a validator of this kind. */
    public String conditionalHeaderName() {
      return conditionalHeaderName;
    }
  }

  private final Kind kind;
  private final String value;

  private CacheKey(Kind kind, String value) {
    this.kind = requireNonNull(kind);
    this.value = requireNonNull(value);
  }

  public Kind kind() {
    return kind;
  }

  public String value() {
    return value;
  }

  public String conditionalHeaderName() {
    return kind.conditionalHeaderName();
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof CacheKey)) {
      return false;
    }
    var other = (CacheKey) obj;
    return kind == other.kind && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return 31 * kind.hashCode() + value.hashCode();
  }

  @Override
  public String toString() {
    return kind + "(" + value + ")";
  }

  public static CacheKey etag(String etag) {
    return new CacheKey(Kind.ETAG, etag);
  }

  public static CacheKey lastModified(String lastModified) {
    return new CacheKey(Kind.LAST_MODIFIED, lastModified);
  }

  /**
   * Extracts a validator from the given response headers, preferring {@code ETag} over {@code
   * Last-Modified}.
   */
  public static Optional<CacheKey> from(HttpHeaders headers) {
    return headers
        .firstValue("ETag")
        .map(CacheKey::etag)
        .or(() -> headers.firstValue("Last-Modified").map(CacheKey::lastModified));
  }
}
