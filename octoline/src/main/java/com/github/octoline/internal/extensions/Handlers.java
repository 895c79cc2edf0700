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

import java.net.http.HttpClient.Version;
import java.net.http.HttpHeaders;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.ResponseInfo;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow.Publisher;
import java.util.function.Function;

/** Static functions for converting a raw response body into a usable body type. */
public class Handlers {
  private Handlers() {}

  /**
   * Handles the given publisher with the given handler, returning a copy of {@code response} with
   * the resulting body.
   */
  public static <T> CompletableFuture<HttpResponse<T>> handleAsync(
      HttpResponse<?> response,
      Publisher<List<ByteBuffer>> publisher,
      BodyHandler<T> handler,
      Executor executor) {
    return handleAsync(responseInfoOf(response), publisher, handler, executor)
        .thenApply(body -> Responses.withBody(response, body));
  }

  public static <T> CompletableFuture<T> handleAsync(
      ResponseInfo responseInfo,
      Publisher<List<ByteBuffer>> publisher,
      BodyHandler<T> handler,
      Executor executor) {
    var subscriber = handler.apply(responseInfo);

    // Publisher::subscribe can initiate body flow synchronously, which might block.
    CompletableFuture.runAsync(() -> publisher.subscribe(subscriber), executor);

    // BodySubscriber::getBody can block (see BodySubscribers::mapping's javadoc).
    return CompletableFuture.supplyAsync(subscriber::getBody, executor)
        .thenCompose(Function.identity());
  }

  public static ResponseInfo responseInfoOf(HttpResponse<?> response) {
    return new BasicResponseInfo(response.statusCode(), response.headers(), response.version());
  }

  private static final class BasicResponseInfo implements ResponseInfo {
    private final int statusCode;
    private final HttpHeaders headers;
    private final Version version;

    BasicResponseInfo(int statusCode, HttpHeaders headers, Version version) {
      this.statusCode = statusCode;
      this.headers = headers;
      this.version = version;
    }

    @Override
    public int statusCode() {
      return statusCode;
    }

    @Override
    public HttpHeaders headers() {
      return headers;
    }

    @Override
    public Version version() {
      return version;
    }
  }
}
