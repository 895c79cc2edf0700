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
import java.nio.ByteBuffer;

/** An immutable snapshot of a response that carried a validator. */
public final class CachedResponse {
  private final byte[] body;
  private final HttpHeaders headers;

  public CachedResponse(byte[] body, HttpHeaders headers) {
    this.body = body.clone();
    this.headers = requireNonNull(headers);
  }

  /** Returns a copy of the stored body. */
  public byte[] body() {
    return body.clone();
  }

  /** Returns a read-only view of the stored body. */
  public ByteBuffer bodyBuffer() {
    return ByteBuffer.wrap(body).asReadOnlyBuffer();
  }

  public int bodySize() {
    return body.length;
  }

  public HttpHeaders headers() {
    return headers;
  }

  @Override
  public String toString() {
    return "CachedResponse[bodySize=" + body.length + ", headers=" + headers.map() + "]";
  }
}
