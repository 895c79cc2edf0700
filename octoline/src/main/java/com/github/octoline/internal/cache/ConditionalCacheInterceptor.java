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

package com.github.octoline.internal.cache;

import static java.util.Objects.requireNonNull;

import com.github.octoline.CacheInconsistencyException;
import com.github.octoline.Octoline.Interceptor;
import com.github.octoline.cache.CacheKey;
import com.github.octoline.cache.CacheStorage;
import com.github.octoline.cache.CachedResponse;
import com.github.octoline.internal.Utils;
import com.github.octoline.internal.concurrent.CancellationPropagatingFuture;
import com.github.octoline.internal.extensions.Handlers;
import com.github.octoline.internal.extensions.HeadersBuilder;
import com.github.octoline.internal.extensions.Responses;
import com.github.octoline.internal.flow.AbstractSubscription;
import com.github.octoline.internal.flow.FlowSupport;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.URI;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.BodyHandlers;
import java.net.http.HttpResponse.BodySubscribers;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow.Publisher;
import java.util.concurrent.Flow.Subscriber;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An {@link Interceptor} that revalidates {@code GET} responses against a {@link CacheStorage}.
 *
 * <p>If the storage has a validator for the request's {@code URI}, the request is sent with the
 * matching conditional header. A {@code 304 Not Modified} is then answered from storage as a
 * {@code 200 OK} carrying the stored body, with the stored {@code Content-Type}, {@code
 * Content-Length} and {@code Link} headers. A {@code 200 OK} with an {@code ETag} or {@code
 * Last-Modified} validator is stored as its body is consumed.
 *
 * <p>If a {@code 304} arrives with nothing in storage, the request is sent once more without
 * conditional headers. A {@link CacheInconsistencyException} is raised if that fails the same way.
 */
public final class ConditionalCacheInterceptor implements Interceptor {
  private static final Logger logger =
      System.getLogger(ConditionalCacheInterceptor.class.getName());

  private static final int HTTP_OK = 200;
  private static final int HTTP_NOT_MODIFIED = 304;

  /** Headers of a stored response that replace those of a {@code 304}. */
  private static final List<String> REPLACED_HEADERS =
      List.of("Content-Type", "Content-Length", "Link");

  private final CacheStorage storage;
  private final Executor handlerExecutor;

  public ConditionalCacheInterceptor(CacheStorage storage, Executor handlerExecutor) {
    this.storage = requireNonNull(storage);
    this.handlerExecutor = requireNonNull(handlerExecutor);
  }

  @Override
  public <T> HttpResponse<T> intercept(HttpRequest request, Chain<T> chain)
      throws IOException, InterruptedException {
    if (!isRevalidatable(request)) {
      return chain.forward(request);
    }

    var publisherChain = chain.with(BodyHandlers.ofPublisher());
    var response = publisherChain.forward(withValidator(request, tryHit(request.uri())));
    try {
      return Utils.get(handleAsync(request, response, chain.bodyHandler()));
    } catch (CacheInconsistencyException e) {
      logger.log(Level.WARNING, "Resending request without validators", e);
      return Utils.get(
          handleAsync(request, publisherChain.forward(request), chain.bodyHandler()));
    }
  }

  @Override
  public <T> CompletableFuture<HttpResponse<T>> interceptAsync(
      HttpRequest request, Chain<T> chain) {
    if (!isRevalidatable(request)) {
      return chain.forwardAsync(request);
    }

    var publisherChain = chain.with(BodyHandlers.ofPublisher());
    return CancellationPropagatingFuture.of(
            publisherChain.forwardAsync(withValidator(request, tryHit(request.uri()))))
        .thenCompose(response -> handleAsync(request, response, chain.bodyHandler()))
        .<CompletableFuture<HttpResponse<T>>>handle(
            (response, exception) -> {
              if (exception == null) {
                return CompletableFuture.completedFuture(response);
              }
              var cause = Utils.getDeepCompletionCause(exception);
              if (!(cause instanceof CacheInconsistencyException)) {
                return CompletableFuture.<HttpResponse<T>>failedFuture(cause);
              }
              logger.log(Level.WARNING, "Resending request without validators", cause);
              return CancellationPropagatingFuture.of(publisherChain.forwardAsync(request))
                  .thenCompose(resent -> handleAsync(request, resent, chain.bodyHandler()));
            })
        .thenCompose(Function.identity());
  }

  private <T> CompletableFuture<HttpResponse<T>> handleAsync(
      HttpRequest request,
      HttpResponse<Publisher<List<ByteBuffer>>> response,
      BodyHandler<T> bodyHandler) {
    if (response.statusCode() == HTTP_NOT_MODIFIED) {
      discardBody(response);
      var cached = load(request.uri());
      if (cached.isEmpty()) {
        return CompletableFuture.failedFuture(new CacheInconsistencyException(request.uri()));
      }
      logger.log(Level.DEBUG, () -> "Serving cached response for " + request.uri());
      return Handlers.handleAsync(
          toOkResponse(response, cached.get()),
          new CachedBodyPublisher(cached.get().bodyBuffer()),
          bodyHandler,
          handlerExecutor);
    }

    var key =
        response.statusCode() == HTTP_OK
            ? CacheKey.from(response.headers())
            : Optional.<CacheKey>empty();
    var publisher =
        key.isPresent() ? cacheWriting(request.uri(), response, key.get()) : response.body();
    return Handlers.handleAsync(response, publisher, bodyHandler, handlerExecutor);
  }

  /** Tees the body into a new entry, or leaves it alone if the storage can't open a writer. */
  private Publisher<List<ByteBuffer>> cacheWriting(
      URI uri, HttpResponse<Publisher<List<ByteBuffer>>> response, CacheKey key) {
    try {
      return new CacheWritingPublisher(
          response.body(), storage.writer(uri, key, response.headers()));
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, () -> "Couldn't open a cache writer for " + uri, e);
      return response.body();
    }
  }

  /** A failing lookup is treated as a miss. */
  private Optional<CacheKey> tryHit(URI uri) {
    try {
      return storage.tryHit(uri);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, () -> "Couldn't look up a validator for " + uri, e);
      return Optional.empty();
    }
  }

  /** A failing load is treated as a missing entry, which resends the request. */
  private Optional<CachedResponse> load(URI uri) {
    try {
      return storage.load(uri);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, () -> "Couldn't load the cached response for " + uri, e);
      return Optional.empty();
    }
  }

  /** Returns a {@code 200} carrying the stored response's representation headers. */
  private static HttpResponse<?> toOkResponse(
      HttpResponse<?> notModifiedResponse, CachedResponse cached) {
    var headers = HeadersBuilder.from(notModifiedResponse.headers());
    for (var name : REPLACED_HEADERS) {
      var cachedValues = cached.headers().allValues(name);
      if (cachedValues.isEmpty()) {
        headers.remove(name);
      } else {
        headers.set(name, cachedValues);
      }
    }
    return Responses.withStatus(notModifiedResponse, HTTP_OK, headers.build());
  }

  private static boolean isRevalidatable(HttpRequest request) {
    return request.method().equalsIgnoreCase("GET") && !hasValidator(request.headers());
  }

  /** Requests carrying their own validators are left to the caller. */
  private static boolean hasValidator(HttpHeaders headers) {
    for (var kind : CacheKey.Kind.values()) {
      if (headers.firstValue(kind.conditionalHeaderName()).isPresent()) {
        return true;
      }
    }
    return false;
  }

  private static HttpRequest withValidator(HttpRequest request, Optional<CacheKey> key) {
    if (key.isEmpty()) {
      return request;
    }
    return HttpRequest.newBuilder(request, (name, value) -> true)
        .setHeader(key.get().conditionalHeaderName(), key.get().value())
        .build();
  }

  private static void discardBody(HttpResponse<Publisher<List<ByteBuffer>>> response) {
    response.body().subscribe(BodySubscribers.discarding());
  }

  /** Publishes a stored body as a single item. */
  private static final class CachedBodyPublisher implements Publisher<List<ByteBuffer>> {
    private final ByteBuffer body;
    private final AtomicBoolean subscribed = new AtomicBoolean();

    CachedBodyPublisher(ByteBuffer body) {
      this.body = body;
    }

    @Override
    public void subscribe(Subscriber<? super List<ByteBuffer>> subscriber) {
      requireNonNull(subscriber);
      if (subscribed.compareAndSet(false, true)) {
        new CachedBodySubscription(subscriber, body).signal();
      } else {
        FlowSupport.rejectMulticast(subscriber);
      }
    }
  }

  private static final class CachedBodySubscription extends AbstractSubscription<List<ByteBuffer>> {
    private @Nullable ByteBuffer body;

    CachedBodySubscription(Subscriber<? super List<ByteBuffer>> downstream, ByteBuffer body) {
      super(downstream, FlowSupport.SYNC_EXECUTOR);
      this.body = body.hasRemaining() ? body : null;
    }

    @Override
    protected long emit(long demand) {
      var buffer = body;
      if (buffer == null) {
        complete();
        return 0;
      } else if (demand <= 0) {
        return 0;
      }
      body = null;
      return submit(List.of(buffer)) ? 1 : 0;
    }
  }
}
