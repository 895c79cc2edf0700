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

package com.github.octoline.jackson;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.octoline.Octoline;
import com.github.octoline.Page;
import com.github.octoline.RetryPolicy;
import com.github.octoline.cache.MemoryCacheStorage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow.Subscriber;
import java.util.concurrent.Flow.Subscription;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/** Exercises pagination, caching and retries against a local server. */
@Timeout(10)
class GitHubApiTest {
  private final JacksonBodyHandlers handlers = JacksonBodyHandlers.create();
  private MockWebServer server;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  private Octoline.Builder clientBuilder() {
    return Octoline.newBuilder().baseUri(server.url("/").uri()).personalToken("t0ken");
  }

  private MockResponse issuesPage(String items, int page, int lastPage) {
    var response =
        new MockResponse().setHeader("Content-Type", "application/json").setBody(items);
    if (page < lastPage) {
      response.addHeader(
          "Link",
          "<" + server.url("/repos/o/r/issues?page=" + (page + 1)) + ">; rel=\"next\", "
              + "<" + server.url("/repos/o/r/issues?page=" + lastPage) + ">; rel=\"last\"");
    }
    return response;
  }

  @Test
  void streamAllPages() throws Exception {
    server.enqueue(issuesPage("[{\"number\":1},{\"number\":2}]", 1, 3));
    server.enqueue(issuesPage("[{\"number\":3}]", 2, 3));
    server.enqueue(issuesPage("[{\"number\":4}]", 3, 3));
    var client = clientBuilder().build();

    var firstPage = client.getPage("/repos/o/r/issues", handlers.ofPage(Issue.class));
    assertThat(firstPage.numberOfPages()).hasValue(3);

    var subscriber = new CollectingSubscriber<Issue>();
    firstPage.stream(client.pageFetcher(handlers.ofPage(Issue.class))).subscribe(subscriber);
    assertThat(subscriber.result.get(5, TimeUnit.SECONDS))
        .extracting(issue -> issue.number)
        .containsExactly(1L, 2L, 3L, 4L);

    var first = server.takeRequest();
    assertThat(first.getPath()).isEqualTo("/repos/o/r/issues");
    assertThat(first.getHeader("Authorization")).isEqualTo("Bearer t0ken");
    assertThat(first.getHeader("Accept")).isEqualTo(Octoline.GITHUB_JSON);
    assertThat(server.takeRequest().getPath()).isEqualTo("/repos/o/r/issues?page=2");
    assertThat(server.takeRequest().getPath()).isEqualTo("/repos/o/r/issues?page=3");
  }

  @Test
  void collectAllPages() throws Exception {
    server.enqueue(issuesPage("[{\"number\":1}]", 1, 2));
    server.enqueue(issuesPage("[{\"number\":2}]", 2, 2));
    var client = clientBuilder().build();

    var pageHandler = handlers.<Issue>ofPage(Issue.class);
    Page<Issue> firstPage = client.getPage("/repos/o/r/issues", pageHandler);
    assertThat(client.allPages(firstPage, pageHandler))
        .containsExactly(new Issue(1, null), new Issue(2, null));
  }

  @Test
  void retriedResponseIsCachedAndRevalidated() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(500));
    server.enqueue(
        new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setHeader("ETag", "\"v1\"")
            .setBody("{\"number\":9,\"title\":\"cached\"}"));
    server.enqueue(new MockResponse().setResponseCode(304).setHeader("ETag", "\"v1\""));
    var storage = new MemoryCacheStorage();
    var client = clientBuilder().retryPolicy(RetryPolicy.fixed(1)).cache(storage).build();

    var first = client.get("/repos/o/r/issues/9", handlers.ofObject(Issue.class));
    assertThat(first.statusCode()).isEqualTo(200);
    assertThat(first.body()).isEqualTo(new Issue(9, "cached"));
    assertThat(storage.size()).isOne();

    var second = client.get("/repos/o/r/issues/9", handlers.ofObject(Issue.class));
    assertThat(second.statusCode()).isEqualTo(200);
    assertThat(second.body()).isEqualTo(new Issue(9, "cached"));
    assertThat(second.headers().firstValue("Content-Type")).hasValue("application/json");

    assertThat(server.takeRequest().getHeader("If-None-Match")).isNull();
    assertThat(server.takeRequest().getHeader("If-None-Match")).isNull();
    assertThat(server.takeRequest().getHeader("If-None-Match")).isEqualTo("\"v1\"");
    assertThat(server.getRequestCount()).isEqualTo(3);
  }

  private static final class CollectingSubscriber<T> implements Subscriber<T> {
    final CompletableFuture<List<T>> result = new CompletableFuture<>();
    private final List<T> items = new ArrayList<>();

    CollectingSubscriber() {}

    @Override
    public void onSubscribe(Subscription subscription) {
      subscription.request(Long.MAX_VALUE);
    }

    @Override
    public void onNext(T item) {
      items.add(item);
    }

    @Override
    public void onError(Throwable throwable) {
      result.completeExceptionally(throwable);
    }

    @Override
    public void onComplete() {
      result.complete(List.copyOf(items));
    }
  }
}
