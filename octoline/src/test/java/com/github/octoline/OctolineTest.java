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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import com.github.octoline.cache.MemoryCacheStorage;
import com.github.octoline.testing.RecordingHttpClient;
import com.github.octoline.testing.RecordingHttpClient.Call;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpClient.Redirect;
import java.net.http.HttpClient.Version;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.BodyHandlers;
import java.net.http.HttpResponse.BodySubscribers;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(5)
class OctolineTest {
  private final RecordingHttpClient backend = new RecordingHttpClient();

  /** Decodes a comma-separated body into a page, taking links from the response headers. */
  private static final BodyHandler<Page<String>> CSV_PAGE_HANDLER =
      responseInfo ->
          BodySubscribers.mapping(
              BodySubscribers.ofString(UTF_8),
              body ->
                  Page.of(
                      body.isEmpty() ? List.of() : Arrays.asList(body.split(",")),
                      PageLinks.from(responseInfo.headers())));

  private static void respondOk(Call<?> call) {
    call.respond(200, "ok");
  }

  @Test
  void defaultHeaders() throws Exception {
    backend.handleCalls(OctolineTest::respondOk);
    var client =
        Octoline.newBuilder(backend)
            .personalToken("ghp_secret")
            .defaultHeaders("X-GitHub-Api-Version", "2022-11-28")
            .build();
    client.get("/user", BodyHandlers.ofString());

    var request = backend.awaitCall().request();
    assertThat(request.headers().firstValue("Accept")).hasValue(Octoline.GITHUB_JSON);
    assertThat(request.headers().firstValue("User-Agent")).hasValue("octoline");
    assertThat(request.headers().firstValue("Authorization")).hasValue("Bearer ghp_secret");
    assertThat(request.headers().firstValue("X-GitHub-Api-Version")).hasValue("2022-11-28");
  }

  @Test
  void requestHeadersTakePrecedence() throws Exception {
    backend.handleCalls(OctolineTest::respondOk);
    var client = Octoline.newBuilder(backend).userAgent("my-app").build();
    var request =
        HttpRequest.newBuilder(URI.create("https://api.github.com/user"))
            .header("Accept", "application/vnd.github.raw+json")
            .build();
    client.send(request, BodyHandlers.ofString());

    var sent = backend.awaitCall().request();
    assertThat(sent.headers().allValues("Accept"))
        .containsExactly("application/vnd.github.raw+json");
    assertThat(sent.headers().firstValue("User-Agent")).hasValue("my-app");
    assertThat(sent.headers().firstValue("Authorization")).isEmpty();
  }

  @Test
  void defaultRequestTimeout() throws Exception {
    backend.handleCalls(OctolineTest::respondOk);
    var client = Octoline.newBuilder(backend).requestTimeout(Duration.ofSeconds(30)).build();
    client.get("user", BodyHandlers.ofString());
    client.send(
        HttpRequest.newBuilder(client.resolve("user")).timeout(Duration.ofSeconds(1)).build(),
        BodyHandlers.ofString());

    assertThat(backend.awaitCall().request().timeout()).hasValue(Duration.ofSeconds(30));
    assertThat(backend.awaitCall().request().timeout()).hasValue(Duration.ofSeconds(1));
  }

  @Test
  void resolveAgainstDefaultBaseUri() {
    var client = Octoline.newBuilder(backend).build();
    assertThat(client.resolve("/repos/o/r"))
        .isEqualTo(URI.create("https://api.github.com/repos/o/r"));
    assertThat(client.resolve("repos/o/r?per_page=100"))
        .isEqualTo(URI.create("https://api.github.com/repos/o/r?per_page=100"));
    assertThat(client.resolve("https://uploads.github.com/x"))
        .isEqualTo(URI.create("https://uploads.github.com/x"));
  }

  @Test
  void resolveKeepsBasePathPrefix() {
    var client = Octoline.newBuilder(backend).baseUri("https://ghe.example.com/api/v3").build();
    assertThat(client.baseUri()).isEqualTo(URI.create("https://ghe.example.com/api/v3/"));
    assertThat(client.resolve("/repos/o/r"))
        .isEqualTo(URI.create("https://ghe.example.com/api/v3/repos/o/r"));
  }

  @Test
  void unsupportedBaseUri() {
    var builder = Octoline.newBuilder(backend);
    assertThatIllegalArgumentException().isThrownBy(() -> builder.baseUri("ftp://example.com"));
    assertThatIllegalArgumentException().isThrownBy(() -> builder.baseUri("/relative"));
    assertThatIllegalArgumentException().isThrownBy(() -> builder.personalToken(" "));
  }

  @Test
  void interceptorsSeeRequestBeforeAndAfterDecoration() throws Exception {
    backend.handleCalls(OctolineTest::respondOk);
    var events = new CopyOnWriteArrayList<String>();
    var client =
        Octoline.newBuilder(backend)
            .interceptor(recording(events, "first"))
            .interceptor(recording(events, "second"))
            .backendInterceptor(recording(events, "backend"))
            .build();
    client.get("user", BodyHandlers.ofString());
    client.getAsync("user", BodyHandlers.ofString()).get();

    assertThat(events)
        .containsExactly(
            "first:undecorated",
            "second:undecorated",
            "backend:decorated",
            "first:undecorated",
            "second:undecorated",
            "backend:decorated");
  }

  private static Octoline.Interceptor recording(List<String> events, String name) {
    return new Octoline.Interceptor() {
      @Override
      public <T> HttpResponse<T> intercept(HttpRequest request, Chain<T> chain)
          throws IOException, InterruptedException {
        record(request);
        return chain.forward(request);
      }

      @Override
      public <T> CompletableFuture<HttpResponse<T>> interceptAsync(
          HttpRequest request, Chain<T> chain) {
        record(request);
        return chain.forwardAsync(request);
      }

      private void record(HttpRequest request) {
        boolean decorated = request.headers().firstValue("User-Agent").isPresent();
        events.add(name + ":" + (decorated ? "decorated" : "undecorated"));
      }
    };
  }

  @Test
  void interceptorFromFunction() throws Exception {
    backend.handleCalls(OctolineTest::respondOk);
    var client =
        Octoline.newBuilder(backend)
            .interceptor(
                Octoline.Interceptor.create(
                    request ->
                        HttpRequest.newBuilder(request, (n, v) -> true)
                            .header("X-Trace", "1")
                            .build()))
            .build();
    client.get("user", BodyHandlers.ofString());
    assertThat(backend.awaitCall().request().headers().firstValue("X-Trace")).hasValue("1");
  }

  @Test
  void getPageAndFollowLinks() throws Exception {
    backend.handleCalls(
        call -> {
          var uri = call.request().uri().toString();
          if (uri.endsWith("page=2")) {
            call.respond(200, "c");
          } else {
            call.respond(
                200,
                "a,b",
                "Link",
                "<https://api.github.com/user/repos?page=2>; rel=\"next\", "
                    + "<https://api.github.com/user/repos?page=2>; rel=\"last\"");
          }
        });
    var client = Octoline.newBuilder(backend).build();

    var page = client.getPage("/user/repos", CSV_PAGE_HANDLER);
    assertThat(page.items()).containsExactly("a", "b");
    assertThat(page.numberOfPages()).hasValue(2);

    var nextPage = client.getPage(page.next(), CSV_PAGE_HANDLER);
    assertThat(nextPage).hasValueSatisfying(p -> assertThat(p.items()).containsExactly("c"));
    assertThat(client.getPage(nextPage.orElseThrow().next(), CSV_PAGE_HANDLER)).isEmpty();
    assertThat(backend.sendCount()).isEqualTo(2);

    assertThat(client.allPages(page, CSV_PAGE_HANDLER)).containsExactly("a", "b", "c");
  }

  @Test
  void retriesThroughBuilder() throws Exception {
    backend.handleCalls(
        call -> {
          if (backend.sendCount() == 1) {
            call.respond(503, "unavailable");
          } else {
            call.respond(200, "ok");
          }
        });
    var retries = new CopyOnWriteArrayList<Integer>();
    var client =
        Octoline.newBuilder(backend)
            .retryPolicy(RetryPolicy.fixed(2))
            .retryListener((request, retryCount, delay) -> retries.add(retryCount))
            .build();

    var response = client.get("user", BodyHandlers.ofString());
    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).isEqualTo("ok");
    assertThat(retries).containsExactly(1);
  }

  @Test
  void cachesThroughBuilder() throws Exception {
    backend.handleCalls(
        call -> {
          if (call.request().headers().firstValue("If-None-Match").isPresent()) {
            call.respond(304, "");
          } else {
            call.respond(200, "[1]", "ETag", "\"v1\"", "Content-Type", "application/json");
          }
        });
    var storage = new MemoryCacheStorage();
    var client = Octoline.newBuilder(backend).cache(storage).build();

    assertThat(client.get("user/repos", BodyHandlers.ofString()).body()).isEqualTo("[1]");
    var revalidated = client.get("user/repos", BodyHandlers.ofString());
    assertThat(revalidated.statusCode()).isEqualTo(200);
    assertThat(revalidated.body()).isEqualTo("[1]");
    assertThat(client.cacheStorage()).hasValue(storage);

    backend.awaitCall();
    assertThat(backend.awaitCall().request().headers().firstValue("If-None-Match"))
        .hasValue("\"v1\"");
  }

  @Test
  void accessors() {
    var client = Octoline.newBuilder(backend).build();
    assertThat(client.underlyingClient()).isSameAs(backend);
    assertThat(client.baseUri()).isEqualTo(Octoline.DEFAULT_BASE_URI);
    assertThat(client.requestTimeout()).isEmpty();
    assertThat(client.retryPolicy()).isEqualTo(RetryPolicy.none());
    assertThat(client.cacheStorage()).isEqualTo(Optional.empty());
    assertThat(client.interceptors()).isEmpty();
  }

  @Test
  void builderConfiguresOwnBackend() {
    Executor executor = Runnable::run;
    var client =
        Octoline.newBuilder()
            .connectTimeout(Duration.ofSeconds(3))
            .followRedirects(Redirect.NEVER)
            .version(Version.HTTP_1_1)
            .executor(executor)
            .personalToken("t0ken")
            .build();
    assertThat(client.connectTimeout()).hasValue(Duration.ofSeconds(3));
    assertThat(client.followRedirects()).isEqualTo(Redirect.NEVER);
    assertThat(client.version()).isEqualTo(Version.HTTP_1_1);
    assertThat(client.executor()).hasValue(executor);
    assertThat(client.defaultHeaders().firstValue("Authorization")).hasValue("Bearer t0ken");
  }

  @Test
  void builderIsHttpClientBuilder() {
    HttpClient.Builder builder = Octoline.newBuilder();
    assertThat(builder.build()).isInstanceOf(Octoline.class);
    assertThat(Octoline.create().followRedirects()).isEqualTo(Redirect.NORMAL);
  }
}
