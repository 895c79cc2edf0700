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

import static com.github.octoline.internal.Utils.requirePositiveDuration;
import static com.github.octoline.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import com.github.octoline.cache.CacheStorage;
import com.github.octoline.internal.Utils;
import com.github.octoline.internal.cache.ConditionalCacheInterceptor;
import com.github.octoline.internal.extensions.HeadersBuilder;
import com.github.octoline.internal.flow.FlowSupport;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.net.Authenticator;
import java.net.CookieHandler;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.PushPromiseHandler;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An {@code HttpClient} for the GitHub REST API that sends requests through an ordered pipeline of
 * {@link Interceptor interceptors}, with optional conditional caching and retries.
 *
 * <p>A request goes through the following stages, in order:
 *
 * <ol>
 *   <li>{@link BaseBuilder#interceptor(Interceptor) Client interceptors}.
 *   <li>Request decoration: default headers (e.g. {@code Accept}, {@code User-Agent} and {@code
 *       Authorization}) are added if absent, and the default timeout is applied if absent.
 *   <li>The {@link RetryingInterceptor} configured with {@link
 *       BaseBuilder#retryPolicy(RetryPolicy)}.
 *   <li>The conditional cache layer configured with {@link BaseBuilder#cache(CacheStorage)}.
 *   <li>{@link BaseBuilder#backendInterceptor(Interceptor) Backend interceptors}.
 *   <li>The backend {@code HttpClient}.
 * </ol>
 *
 * <p>Each retry attempt hence goes through the cache, and backend interceptors see each request
 * that actually goes to the network.
 */
public class Octoline extends HttpClient {
  /** The default base {@code URI} used for resolving relative paths. */
  public static final URI DEFAULT_BASE_URI = URI.create("https://api.github.com/");

  /** The media type GitHub recommends for its REST API. */
  public static final String GITHUB_JSON = "application/vnd.github+json";

  static final String DEFAULT_USER_AGENT = "octoline";

  private final HttpClient backend;
  private final URI baseUri;
  private final HttpHeaders defaultHeaders;
  private final Optional<Duration> requestTimeout;
  private final RetryPolicy retryPolicy;
  private final Optional<CacheStorage> cacheStorage;
  private final List<Interceptor> interceptors;
  private final List<Interceptor> backendInterceptors;

  /** Every stage a request goes through before reaching the backend, in order. */
  private final List<Interceptor> pipeline;

  private Octoline(BaseBuilder<?> builder) {
    backend = builder.buildBackend();
    baseUri = builder.baseUri;
    defaultHeaders = builder.defaultHeadersBuilder.build();
    requestTimeout = Optional.ofNullable(builder.requestTimeout);
    retryPolicy = builder.retryPolicy;
    cacheStorage = Optional.ofNullable(builder.cacheStorage);
    interceptors = List.copyOf(builder.interceptors);
    backendInterceptors = List.copyOf(builder.backendInterceptors);

    var stages = new ArrayList<>(interceptors);
    stages.add(new RequestDecoratingInterceptor(defaultHeaders, requestTimeout));
    if (retryPolicy.mode() != RetryPolicy.Mode.NONE) {
      stages.add(builder.retryInterceptorBuilder.policy(retryPolicy).build());
    }
    cacheStorage.ifPresent(
        storage ->
            stages.add(
                new ConditionalCacheInterceptor(
                    storage, backend.executor().orElse(FlowSupport.SYNC_EXECUTOR))));
    stages.addAll(backendInterceptors);
    pipeline = List.copyOf(stages);
  }

  /** Returns the underlying {@code HttpClient} used for sending requests. */
  public HttpClient underlyingClient() {
    return backend;
  }

  /** Returns the {@code URI} relative paths are resolved against. */
  public URI baseUri() {
    return baseUri;
  }

  /** Returns the headers added to each request if absent. */
  public HttpHeaders defaultHeaders() {
    return defaultHeaders;
  }

  /** Returns the default request timeout used when not set in an {@code HttpRequest}. */
  public Optional<Duration> requestTimeout() {
    return requestTimeout;
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  public Optional<CacheStorage> cacheStorage() {
    return cacheStorage;
  }

  /** Returns an immutable list of this client's interceptors. */
  public List<Interceptor> interceptors() {
    return interceptors;
  }

  /** Returns an immutable list of this client's backend interceptors. */
  public List<Interceptor> backendInterceptors() {
    return backendInterceptors;
  }

  /** Resolves the given path or absolute {@code URI} against this client's base {@code URI}. */
  public URI resolve(String pathOrUri) {
    var uri = URI.create(pathOrUri);
    if (uri.isAbsolute()) {
      return uri;
    }
    // Keep the base URI's path prefix (e.g. GitHub Enterprise's /api/v3/) for absolute paths.
    var relative = pathOrUri.startsWith("/") ? pathOrUri.substring(1) : pathOrUri;
    return baseUri.resolve(relative);
  }

  /** Sends a {@code GET} for the given path or {@code URI}. */
  public <T> HttpResponse<T> get(String pathOrUri, BodyHandler<T> bodyHandler)
      throws IOException, InterruptedException {
    return send(HttpRequest.newBuilder(resolve(pathOrUri)).GET().build(), bodyHandler);
  }

  /** Asynchronously sends a {@code GET} for the given path or {@code URI}. */
  public <T> CompletableFuture<HttpResponse<T>> getAsync(
      String pathOrUri, BodyHandler<T> bodyHandler) {
    return sendAsync(HttpRequest.newBuilder(resolve(pathOrUri)).GET().build(), bodyHandler);
  }

  /** Fetches the page at the given path or {@code URI}. */
  public <T> Page<T> getPage(String pathOrUri, BodyHandler<Page<T>> pageHandler)
      throws IOException, InterruptedException {
    return Utils.get(pageFetcher(pageHandler).fetch(resolve(pathOrUri)));
  }

  /**
   * Fetches the page at the given link if present, typically one of a page's {@link Page#next()
   * navigation links}. An empty optional is returned if the link is absent.
   */
  public <T> Optional<Page<T>> getPage(Optional<URI> link, BodyHandler<Page<T>> pageHandler)
      throws IOException, InterruptedException {
    return link.isPresent()
        ? Optional.of(Utils.get(pageFetcher(pageHandler).fetch(link.get())))
        : Optional.empty();
  }

  /**
   * Returns all items of the given page and the pages following it, fetching them one after
   * another.
   */
  public <T> List<T> allPages(Page<T> page, BodyHandler<Page<T>> pageHandler)
      throws IOException, InterruptedException {
    return Utils.get(page.collectAll(pageFetcher(pageHandler)));
  }

  /** Returns a {@code PageFetcher} that sends {@code GET} requests through this client. */
  public <T> PageFetcher<T> pageFetcher(BodyHandler<Page<T>> pageHandler) {
    return PageFetcher.of(this, pageHandler);
  }

  @Override
  public Optional<CookieHandler> cookieHandler() {
    return backend.cookieHandler();
  }

  @Override
  public Optional<Duration> connectTimeout() {
    return backend.connectTimeout();
  }

  @Override
  public Redirect followRedirects() {
    return backend.followRedirects();
  }

  @Override
  public Optional<ProxySelector> proxy() {
    return backend.proxy();
  }

  @Override
  public SSLContext sslContext() {
    return backend.sslContext();
  }

  @Override
  public SSLParameters sslParameters() {
    return backend.sslParameters();
  }

  @Override
  public Optional<Authenticator> authenticator() {
    return backend.authenticator();
  }

  @Override
  public Version version() {
    return backend.version();
  }

  @Override
  public Optional<Executor> executor() {
    return backend.executor();
  }

  @Override
  public WebSocket.Builder newWebSocketBuilder() {
    return backend.newWebSocketBuilder();
  }

  @Override
  public <T> HttpResponse<T> send(HttpRequest request, BodyHandler<T> bodyHandler)
      throws IOException, InterruptedException {
    return new InterceptorChain<>(backend, pipeline, 0, bodyHandler, null).forward(request);
  }

  @Override
  public <T> CompletableFuture<HttpResponse<T>> sendAsync(
      HttpRequest request, BodyHandler<T> bodyHandler) {
    return new InterceptorChain<>(backend, pipeline, 0, bodyHandler, null).forwardAsync(request);
  }

  @Override
  public <T> CompletableFuture<HttpResponse<T>> sendAsync(
      HttpRequest request,
      BodyHandler<T> bodyHandler,
      @Nullable PushPromiseHandler<T> pushPromiseHandler) {
    return new InterceptorChain<>(backend, pipeline, 0, bodyHandler, pushPromiseHandler)
        .forwardAsync(request);
  }

  /**
   * Returns a new builder that creates its own backend {@code HttpClient}. The returned builder
   * is also an {@code HttpClient.Builder} that configures the backend.
   */
  public static Builder newBuilder() {
    return new Builder();
  }

  /** Returns a new builder that uses the given backend {@code HttpClient}. */
  public static WithClientBuilder newBuilder(HttpClient backend) {
    return new WithClientBuilder(backend);
  }

  /** Creates a default client that creates its own backend {@code HttpClient}. */
  public static Octoline create() {
    return newBuilder().build();
  }

  /**
   * A step of the request pipeline. An interceptor typically rewrites the request, forwards it to
   * the given chain and possibly inspects or rewrites the response.
   */
  public interface Interceptor {

    <T> HttpResponse<T> intercept(HttpRequest request, Chain<T> chain)
        throws IOException, InterruptedException;

    <T> CompletableFuture<HttpResponse<T>> interceptAsync(HttpRequest request, Chain<T> chain);

    /** Returns an interceptor that forwards each request as rewritten by the given function. */
    static Interceptor create(Function<HttpRequest, HttpRequest> operator) {
      requireNonNull(operator);
      return new Interceptor() {
        @Override
        public <T> HttpResponse<T> intercept(HttpRequest request, Chain<T> chain)
            throws IOException, InterruptedException {
          return chain.forward(operator.apply(request));
        }

        @Override
        public <T> CompletableFuture<HttpResponse<T>> interceptAsync(
            HttpRequest request, Chain<T> chain) {
          return chain.forwardAsync(operator.apply(request));
        }
      };
    }

    /**
     * The rest of the pipeline following an interceptor, ending with the backend.
     *
     * @param <T> the response body type
     */
    interface Chain<T> {

      /** Returns the {@code BodyHandler} the response is handled with. */
      BodyHandler<T> bodyHandler();

      /** Returns a copy of this chain that handles the response with the given handler. */
      Chain<T> withBodyHandler(BodyHandler<T> bodyHandler);

      /**
       * Returns a copy of this chain that handles the response with the given handler, which may
       * produce another body type. Push promises aren't handled by the returned chain.
       */
      <U> Chain<U> with(BodyHandler<U> bodyHandler);

      /** Passes the request to the rest of the pipeline. */
      HttpResponse<T> forward(HttpRequest request) throws IOException, InterruptedException;

      /** Asynchronously passes the request to the rest of the pipeline. */
      CompletableFuture<HttpResponse<T>> forwardAsync(HttpRequest request);
    }
  }

  /** Options shared by the builders of {@code Octoline} instances. */
  public abstract static class BaseBuilder<B extends BaseBuilder<B>> {
    final HeadersBuilder defaultHeadersBuilder = new HeadersBuilder();
    final List<Interceptor> interceptors = new ArrayList<>();
    final List<Interceptor> backendInterceptors = new ArrayList<>();
    final RetryingInterceptor.Builder retryInterceptorBuilder = RetryingInterceptor.newBuilder();

    URI baseUri = DEFAULT_BASE_URI;
    @MonotonicNonNull Duration requestTimeout;
    RetryPolicy retryPolicy = RetryPolicy.none();
    @Nullable CacheStorage cacheStorage;

    BaseBuilder() {
      defaultHeadersBuilder.set("Accept", GITHUB_JSON);
      defaultHeadersBuilder.set("User-Agent", DEFAULT_USER_AGENT);
    }

    /** Calls the given consumer against this builder. */
    @CanIgnoreReturnValue
    public B apply(Consumer<? super B> consumer) {
      consumer.accept(self());
      return self();
    }

    /** Sets the {@code URI} relative paths are resolved against. */
    @CanIgnoreReturnValue
    public B baseUri(String uri) {
      return baseUri(URI.create(uri));
    }

    /** Sets the {@code URI} relative paths are resolved against. */
    @CanIgnoreReturnValue
    public B baseUri(URI uri) {
      var scheme = uri.getScheme();
      requireArgument(
          uri.isAbsolute()
              && ("https".equalsIgnoreCase(scheme) || "http".equalsIgnoreCase(scheme)),
          "unsupported base URI: %s",
          uri);
      var path = uri.getRawPath();
      this.baseUri = path == null || path.endsWith("/") ? uri : URI.create(uri + "/");
      return self();
    }

    /** Sets the {@code User-Agent} sent with each request. */
    @CanIgnoreReturnValue
    public B userAgent(String userAgent) {
      defaultHeadersBuilder.set("User-Agent", userAgent);
      return self();
    }

    /** Authenticates each request with the given personal access or OAuth token. */
    @CanIgnoreReturnValue
    public B personalToken(String token) {
      requireArgument(!token.isBlank(), "blank token");
      defaultHeadersBuilder.set("Authorization", "Bearer " + token);
      return self();
    }

    /** Adds the given default header, sent with each request that doesn't have it. */
    @CanIgnoreReturnValue
    public B defaultHeader(String name, String value) {
      defaultHeadersBuilder.set(name, value);
      return self();
    }

    /** Adds each of the given name-value pairs as a default header. */
    @CanIgnoreReturnValue
    public B defaultHeaders(String... headers) {
      requireArgument(
          headers.length > 0 && headers.length % 2 == 0,
          "Illegal number of headers: %d",
          headers.length);
      for (int i = 0; i < headers.length; i += 2) {
        defaultHeader(headers[i], headers[i + 1]);
      }
      return self();
    }

    /** Sets a default request timeout to use when not explicitly set by the request. */
    @CanIgnoreReturnValue
    public B requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requirePositiveDuration(requestTimeout);
      return self();
    }

    /** Sets the policy deciding whether and when failed requests are retried. */
    @CanIgnoreReturnValue
    public B retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = requireNonNull(retryPolicy);
      return self();
    }

    /** Sets a listener for retries made by this client. */
    @CanIgnoreReturnValue
    public B retryListener(RetryingInterceptor.Listener listener) {
      retryInterceptorBuilder.listener(listener);
      return self();
    }

    /** Configures the retry interceptor directly, e.g. to control time in tests. */
    @CanIgnoreReturnValue
    B retryInterceptor(Consumer<RetryingInterceptor.Builder> configurator) {
      configurator.accept(retryInterceptorBuilder);
      return self();
    }

    /** Enables conditional caching of responses in the given storage. */
    @CanIgnoreReturnValue
    public B cache(CacheStorage cacheStorage) {
      this.cacheStorage = requireNonNull(cacheStorage);
      return self();
    }

    /** Adds an interceptor that sees each request as the caller sent it. */
    @CanIgnoreReturnValue
    public B interceptor(Interceptor interceptor) {
      interceptors.add(requireNonNull(interceptor));
      return self();
    }

    /**
     * Adds an interceptor that sees each request right before the backend, after it's decorated,
     * retried and handled by the cache.
     */
    @CanIgnoreReturnValue
    public B backendInterceptor(Interceptor interceptor) {
      backendInterceptors.add(requireNonNull(interceptor));
      return self();
    }

    /** Creates a new {@code Octoline} instance. */
    public Octoline build() {
      return new Octoline(this);
    }

    abstract B self();

    abstract HttpClient buildBackend();
  }

  /** A builder of {@code Octoline} instances that send requests through a given backend. */
  public static final class WithClientBuilder extends BaseBuilder<WithClientBuilder> {
    private final HttpClient backend;

    WithClientBuilder(HttpClient backend) {
      this.backend = requireNonNull(backend);
    }

    @Override
    WithClientBuilder self() {
      return this;
    }

    @Override
    HttpClient buildBackend() {
      return backend;
    }
  }

  /**
   * A builder of {@code Octoline} instances that create their own backend, which is configured
   * through the {@code HttpClient.Builder} methods. Redirects are followed by default.
   */
  public static final class Builder extends BaseBuilder<Builder> implements HttpClient.Builder {
    private final HttpClient.Builder backendBuilder =
        HttpClient.newBuilder().followRedirects(Redirect.NORMAL);

    Builder() {}

    @Override
    @CanIgnoreReturnValue
    public Builder cookieHandler(CookieHandler cookieHandler) {
      backendBuilder.cookieHandler(cookieHandler);
      return this;
    }

    @Override
    @CanIgnoreReturnValue
    public Builder connectTimeout(Duration connectTimeout) {
      backendBuilder.connectTimeout(requirePositiveDuration(connectTimeout));
      return this;
    }

    @Override
    @CanIgnoreReturnValue
    public Builder sslContext(SSLContext sslContext) {
      backendBuilder.sslContext(sslContext);
      return this;
    }

    @Override
    @CanIgnoreReturnValue
    public Builder sslParameters(SSLParameters sslParameters) {
      backendBuilder.sslParameters(sslParameters);
      return this;
    }

    @Override
    @CanIgnoreReturnValue
    public Builder executor(Executor executor) {
      backendBuilder.executor(executor);
      return this;
    }

    @Override
    @CanIgnoreReturnValue
    public Builder followRedirects(Redirect policy) {
      backendBuilder.followRedirects(policy);
      return this;
    }

    @Override
    @CanIgnoreReturnValue
    public Builder version(Version version) {
      backendBuilder.version(version);
      return this;
    }

    @Override
    @CanIgnoreReturnValue
    public Builder priority(int priority) {
      backendBuilder.priority(priority);
      return this;
    }

    @Override
    @CanIgnoreReturnValue
    public Builder proxy(ProxySelector proxySelector) {
      backendBuilder.proxy(proxySelector);
      return this;
    }

    @Override
    @CanIgnoreReturnValue
    public Builder authenticator(Authenticator authenticator) {
      backendBuilder.authenticator(authenticator);
      return this;
    }

    @Override
    Builder self() {
      return this;
    }

    @Override
    HttpClient buildBackend() {
      return backendBuilder.build();
    }
  }

  /** The pipeline a request goes through, from a given stage to the backend. */
  private static final class InterceptorChain<T> implements Interceptor.Chain<T> {
    private final HttpClient backend;
    private final List<Interceptor> stages;
    private final int stage;
    private final BodyHandler<T> bodyHandler;
    private final @Nullable PushPromiseHandler<T> pushPromiseHandler;

    InterceptorChain(
        HttpClient backend,
        List<Interceptor> stages,
        int stage,
        BodyHandler<T> bodyHandler,
        @Nullable PushPromiseHandler<T> pushPromiseHandler) {
      this.backend = backend;
      this.stages = stages;
      this.stage = stage;
      this.bodyHandler = requireNonNull(bodyHandler);
      this.pushPromiseHandler = pushPromiseHandler;
    }

    @Override
    public BodyHandler<T> bodyHandler() {
      return bodyHandler;
    }

    @Override
    public Interceptor.Chain<T> withBodyHandler(BodyHandler<T> bodyHandler) {
      return new InterceptorChain<>(backend, stages, stage, bodyHandler, pushPromiseHandler);
    }

    @Override
    public <U> Interceptor.Chain<U> with(BodyHandler<U> bodyHandler) {
      return new InterceptorChain<>(backend, stages, stage, bodyHandler, null);
    }

    @Override
    public HttpResponse<T> forward(HttpRequest request) throws IOException, InterruptedException {
      requireNonNull(request);
      return stage < stages.size()
          ? stages.get(stage).intercept(request, next())
          : backend.send(request, bodyHandler);
    }

    @Override
    public CompletableFuture<HttpResponse<T>> forwardAsync(HttpRequest request) {
      requireNonNull(request);
      return stage < stages.size()
          ? stages.get(stage).interceptAsync(request, next())
          : backend.sendAsync(request, bodyHandler, pushPromiseHandler);
    }

    private InterceptorChain<T> next() {
      return new InterceptorChain<>(backend, stages, stage + 1, bodyHandler, pushPromiseHandler);
    }
  }

  /** An interceptor that adds default headers and the default timeout to requests. */
  private static final class RequestDecoratingInterceptor implements Interceptor {
    private final HttpHeaders defaultHeaders;
    private final Optional<Duration> requestTimeout;

    RequestDecoratingInterceptor(HttpHeaders defaultHeaders, Optional<Duration> requestTimeout) {
      this.defaultHeaders = defaultHeaders;
      this.requestTimeout = requestTimeout;
    }

    @Override
    public <T> HttpResponse<T> intercept(HttpRequest request, Chain<T> chain)
        throws IOException, InterruptedException {
      return chain.forward(decorate(request));
    }

    @Override
    public <T> CompletableFuture<HttpResponse<T>> interceptAsync(
        HttpRequest request, Chain<T> chain) {
      return chain.forwardAsync(decorate(request));
    }

    private HttpRequest decorate(HttpRequest request) {
      var absentHeaders =
          defaultHeaders.map().entrySet().stream()
              .filter(header -> request.headers().firstValue(header.getKey()).isEmpty())
              .collect(Collectors.toList());
      boolean applyTimeout = request.timeout().isEmpty() && requestTimeout.isPresent();
      if (absentHeaders.isEmpty() && !applyTimeout) {
        return request;
      }

      var builder = HttpRequest.newBuilder(request, (name, value) -> true);
      absentHeaders.forEach(
          header -> header.getValue().forEach(value -> builder.header(header.getKey(), value)));
      if (applyTimeout) {
        builder.timeout(requestTimeout.get());
      }
      return builder.build();
    }
  }
}
