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

package com.github.octoline.testing;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.octoline.internal.Utils;
import com.github.octoline.internal.concurrent.CancellationPropagatingFuture;
import com.github.octoline.internal.extensions.Handlers;
import com.github.octoline.internal.extensions.Responses;
import com.github.octoline.internal.flow.FlowSupport;
import java.io.IOException;
import java.net.Authenticator;
import java.net.CookieHandler;
import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.PushPromiseHandler;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow.Publisher;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An {@code HttpClient} that records calls, to be completed by the test either from a {@link
 * #handleCalls(Consumer) call handler} or after {@link #awaitCall() awaiting} them.
 */
public class RecordingHttpClient extends HttpClient {
  private final BlockingDeque<Call<?>> calls = new LinkedBlockingDeque<>();
  private final AtomicInteger sendCount = new AtomicInteger();
  private volatile @Nullable Consumer<Call<?>> callHandler;

  public RecordingHttpClient() {}

  public RecordingHttpClient handleCalls(@Nullable Consumer<Call<?>> callHandler) {
    this.callHandler = callHandler;
    return this;
  }

  @SuppressWarnings("unchecked")
  public <T> Call<T> awaitCall() {
    try {
      var call = calls.pollFirst(TestUtils.TIMEOUT_SECONDS, TimeUnit.SECONDS);
      assertThat(call).withFailMessage("expected a call").isNotNull();
      return (Call<T>) call;
    } catch (InterruptedException e) {
      throw new RuntimeException(e);
    }
  }

  public int sendCount() {
    return sendCount.get();
  }

  @Override
  public Optional<CookieHandler> cookieHandler() {
    return Optional.empty();
  }

  @Override
  public Optional<Duration> connectTimeout() {
    return Optional.empty();
  }

  @Override
  public Redirect followRedirects() {
    return Redirect.NEVER;
  }

  @Override
  public Optional<ProxySelector> proxy() {
    return Optional.empty();
  }

  @Override
  public SSLContext sslContext() {
    throw new UnsupportedOperationException();
  }

  @Override
  public SSLParameters sslParameters() {
    throw new UnsupportedOperationException();
  }

  @Override
  public Optional<Authenticator> authenticator() {
    return Optional.empty();
  }

  @Override
  public Version version() {
    return Version.HTTP_1_1;
  }

  @Override
  public Optional<Executor> executor() {
    return Optional.empty();
  }

  @Override
  public <T> HttpResponse<T> send(HttpRequest request, BodyHandler<T> bodyHandler)
      throws IOException, InterruptedException {
    return Utils.get(record(new Call<>(request, bodyHandler)));
  }

  @Override
  public <T> CompletableFuture<HttpResponse<T>> sendAsync(
      HttpRequest request, BodyHandler<T> bodyHandler) {
    return record(new Call<>(request, bodyHandler));
  }

  @Override
  public <T> CompletableFuture<HttpResponse<T>> sendAsync(
      HttpRequest request,
      BodyHandler<T> bodyHandler,
      @Nullable PushPromiseHandler<T> pushPromiseHandler) {
    return record(new Call<>(request, bodyHandler));
  }

  private <T> CompletableFuture<HttpResponse<T>> record(Call<T> call) {
    sendCount.incrementAndGet();
    var handler = callHandler;
    if (handler != null) {
      handler.accept(call);
    }
    calls.add(call);
    return call.future();
  }

  public static final class Call<T> {
    private final CompletableFuture<HttpResponse<T>> responseFuture =
        CancellationPropagatingFuture.create();
    private final HttpRequest request;
    private final BodyHandler<T> bodyHandler;

    private Call(HttpRequest request, BodyHandler<T> bodyHandler) {
      this.request = request;
      this.bodyHandler = bodyHandler;
    }

    public HttpRequest request() {
      return request;
    }

    public BodyHandler<T> bodyHandler() {
      return bodyHandler;
    }

    public CompletableFuture<HttpResponse<T>> future() {
      return responseFuture;
    }

    /** Completes this call with a response whose body is handled by the call's handler. */
    public void respond(int statusCode, String body, String... headers) {
      respond(statusCode, TestUtils.publisherOf(body.getBytes(StandardCharsets.UTF_8)), headers);
    }

    public void respond(int statusCode, Publisher<List<ByteBuffer>> body, String... headers) {
      var response = Responses.<Void>of(request, statusCode, headersOf(headers), null);
      Handlers.handleAsync(response, body, bodyHandler, FlowSupport.SYNC_EXECUTOR)
          .whenComplete(
              (handledResponse, exception) -> {
                if (exception != null) {
                  responseFuture.completeExceptionally(Utils.getDeepCompletionCause(exception));
                } else {
                  responseFuture.complete(handledResponse);
                }
              });
    }

    public void completeExceptionally(Throwable exception) {
      assertThat(responseFuture.completeExceptionally(exception)).isTrue();
    }

    private static HttpHeaders headersOf(String... headers) {
      assertThat(headers.length % 2).isZero();
      var map = new TreeMap<String, List<String>>(String.CASE_INSENSITIVE_ORDER);
      for (int i = 0; i < headers.length; i += 2) {
        map.computeIfAbsent(headers[i], __ -> new ArrayList<>()).add(headers[i + 1]);
      }
      return HttpHeaders.of(map, (name, value) -> true);
    }
  }
}
