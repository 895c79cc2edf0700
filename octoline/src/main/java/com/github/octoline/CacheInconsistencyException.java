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

package com.github.octoline;

import java.io.IOException;
import java.net.URI;

/**
 * Thrown when the server responds with {@code 304 Not Modified} to a request for which no cached
 * response exists, e.g. because the entry was removed after the request was made conditional.
 */
public final class CacheInconsistencyException extends IOException {
  private static final long serialVersionUID = 1L;

  private final URI uri;

  public CacheInconsistencyException(URI uri) {
    super("received 304 Not Modified for <" + uri + "> with no cached response");
    this.uri = uri;
  }

  /** Returns the {@code URI} for which no cached response was found. */
  public URI uri() {
    return uri;
  }
}
