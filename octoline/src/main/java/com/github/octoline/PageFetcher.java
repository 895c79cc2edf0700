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

import static java.util.Objects.requireNonNull;

import com.github.octoline.internal.concurrent.CancellationPropagatingFuture;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandler;
import java.util.concurrent.CompletableFuture;

/** Fetches the page at a given {@code URI}, typically one of a page's navigation links. */
@FunctionalInterface
public interface PageFetcher<T> {

  /** Asynchronously fetches the page at the given {@code URI}. */
  CompletableFuture<Page<T>> fetch(URI uri);

  /**
   * Returns a fetcher that sends a {@code GET} to the given client and decodes the response with
   * the given handler. Pages fetched through an {@link Octoline} client go through its whole
   * pipeline, including retries and caching. Cancelling a returned future cancels the exchange.
   */
  static <T> PageFetcher<T> of(HttpClient client, BodyHandler<Page<T>> pageHandler) {
    requireNonNull(client);
    requireNonNull(pageHandler);
    return uri ->
        CancellationPropagatingFuture.of(
                client.sendAsync(HttpRequest.newBuilder(uri).GET().build(), pageHandler))
            .thenApply(HttpResponse::body);
  }
}
