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

package com.github.octoline.internal.extensions;

import static com.github.octoline.internal.Utils.requireValidHeaderName;
import static com.github.octoline.internal.Utils.requireValidHeaderValue;
import static java.util.Objects.requireNonNull;

import java.net.http.HttpHeaders;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** A mutable, case-insensitive set of headers that builds {@link HttpHeaders}. */
public final class HeadersBuilder {
  private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

  public HeadersBuilder() {}

  /** Copies the given headers, which are trusted to be valid as they come from a response. */
  public static HeadersBuilder from(HttpHeaders headers) {
    var builder = new HeadersBuilder();
    headers.map().forEach((name, values) -> builder.headers.put(name, new ArrayList<>(values)));
    return builder;
  }

  public void set(String name, String value) {
    set(name, List.of(value));
  }

  /** Replaces the values of the given header. */
  public void set(String name, List<String> values) {
    var validValues = new ArrayList<String>(values.size());
    for (var value : values) {
      validValues.add(requireValidHeaderValue(value));
    }
    headers.put(requireValidHeaderName(name), validValues);
  }

  public void remove(String name) {
    headers.remove(requireNonNull(name));
  }

  public HttpHeaders build() {
    return HttpHeaders.of(headers, (name, value) -> true);
  }
}
