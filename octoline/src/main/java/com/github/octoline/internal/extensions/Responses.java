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

import static java.util.Objects.requireNonNull;

import java.net.URI;
import java.net.http.HttpClient.Version;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Optional;
import javax.net.ssl.SSLSession;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Creates responses, or copies of responses with some of their properties replaced. */
public final class Responses {
  private Responses() {}

  /** Returns a copy of the given response with the given body. */
  public static <T> HttpResponse<T> withBody(HttpResponse<?> response, @Nullable T body) {
    return new SimpleResponse<>(response, response.statusCode(), response.headers(), body);
  }

  /** Returns a copy of the given response with the given status code and headers. */
  public static HttpResponse<?> withStatus(
      HttpResponse<?> response, int statusCode, HttpHeaders headers) {
    return new SimpleResponse<>(response, statusCode, headers, response.body());
  }

  /** Returns an {@code HTTP/1.1} response to the given request. */
  public static <T> HttpResponse<T> of(
      HttpRequest request, int statusCode, HttpHeaders headers, @Nullable T body) {
    return new SimpleResponse<>(
        request, request.uri(), Version.HTTP_1_1, statusCode, headers, body, null);
  }

  private static final class SimpleResponse<T> implements HttpResponse<T> {
    private final HttpRequest request;
    private final URI uri;
    private final Version version;
    private final int statusCode;
    private final HttpHeaders headers;
    private final @Nullable T body;
    private final @Nullable SSLSession sslSession;

    SimpleResponse(
        HttpResponse<?> source, int statusCode, HttpHeaders headers, @Nullable T body) {
      this(
          source.request(),
          source.uri(),
          source.version(),
          statusCode,
          headers,
          body,
          source.sslSession().orElse(null));
    }

    SimpleResponse(
        HttpRequest request,
        URI uri,
        Version version,
        int statusCode,
        HttpHeaders headers,
        @Nullable T body,
        @Nullable SSLSession sslSession) {
      this.request = requireNonNull(request);
      this.uri = requireNonNull(uri);
      this.version = requireNonNull(version);
      this.statusCode = statusCode;
      this.headers = requireNonNull(headers);
      this.body = body;
      this.sslSession = sslSession;
    }

    @Override
    public int statusCode() {
      return statusCode;
    }

    @Override
    public HttpRequest request() {
      return request;
    }

    /** Rewritten responses don't keep the responses that led to them. */
    @Override
    public Optional<HttpResponse<T>> previousResponse() {
      return Optional.empty();
    }

    @Override
    public HttpHeaders headers() {
      return headers;
    }

    @Override
    @SuppressWarnings("NullAway")
    public T body() {
      return body;
    }

    @Override
    public Optional<SSLSession> sslSession() {
      return Optional.ofNullable(sslSession);
    }

    @Override
    public URI uri() {
      return uri;
    }

    @Override
    public Version version() {
      return version;
    }

    @Override
    public String toString() {
      return request.method() + " " + uri + " -> " + statusCode;
    }
  }
}
