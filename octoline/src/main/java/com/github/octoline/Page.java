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
import com.github.octoline.internal.flow.FlowSupport;
import com.github.octoline.internal.page.PagePublisher;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow.Publisher;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One page of a paginated GitHub resource: the items of the page, along with the links to
 * neighbouring pages and, for search results, the total count of matching items.
 *
 * <p>A page can be turned into a lazy {@link #stream(PageFetcher) stream} of its items and those of
 * all the pages after it, or {@link #collectAll(PageFetcher) collected} with them into a list.
 *
 * @param <T> the type of the items
 */
public final class Page<T> implements Iterable<T> {
  private final List<T> items;
  private final @Nullable Long totalCount;
  private final @Nullable Boolean incompleteResults;
  private final PageLinks links;

  private Page(
      List<T> items,
      @Nullable Long totalCount,
      @Nullable Boolean incompleteResults,
      PageLinks links) {
    this.items = List.copyOf(items);
    this.totalCount = totalCount;
    this.incompleteResults = incompleteResults;
    this.links = requireNonNull(links);
  }

  /** Returns an immutable list of this page's items. */
  public List<T> items() {
    return items;
  }

  /** Returns the total number of items across all pages, if reported (e.g. by search). */
  public OptionalLong totalCount() {
    return totalCount != null ? OptionalLong.of(totalCount) : OptionalLong.empty();
  }

  /** Returns whether search results were cut short by a timeout, if reported. */
  public Optional<Boolean> incompleteResults() {
    return Optional.ofNullable(incompleteResults);
  }

  public PageLinks links() {
    return links;
  }

  public Optional<URI> first() {
    return links.first();
  }

  public Optional<URI> prev() {
    return links.prev();
  }

  public Optional<URI> next() {
    return links.next();
  }

  public Optional<URI> last() {
    return links.last();
  }

  /** Returns the number of pages as indicated by the {@code last} link, if present. */
  public OptionalInt numberOfPages() {
    return links.numberOfPages();
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  @Override
  public Iterator<T> iterator() {
    return items.iterator();
  }

  /**
   * Returns a publisher of this page's items followed by those of the pages after it. The next
   * page is fetched with the given fetcher only when the current page's items are all delivered
   * and more are requested. The stream completes normally when there's no next page or a fetched
   * page is empty. If fetching a page fails, the stream fails with the failure's cause after
   * delivering all previous items. Cancelling the subscription cancels any fetch in progress.
   */
  public Publisher<T> stream(PageFetcher<T> fetcher) {
    return stream(fetcher, FlowSupport.SYNC_EXECUTOR);
  }

  /**
   * Returns a publisher like {@link #stream(PageFetcher)}'s that signals its subscriber from the
   * given executor.
   */
  public Publisher<T> stream(PageFetcher<T> fetcher, Executor executor) {
    return new PagePublisher<>(this, fetcher, executor);
  }

  /**
   * Returns a future for all items of this page followed by those of the pages after it, fetched
   * one after another with the given fetcher.
   */
  public CompletableFuture<List<T>> collectAll(PageFetcher<T> fetcher) {
    requireNonNull(fetcher);
    return collectRemaining(this, fetcher, new ArrayList<>(items));
  }

  private static <T> CompletableFuture<List<T>> collectRemaining(
      Page<T> page, PageFetcher<T> fetcher, List<T> collected) {
    var next = page.next();
    if (next.isEmpty()) {
      return CompletableFuture.completedFuture(Collections.unmodifiableList(collected));
    }
    return CancellationPropagatingFuture.of(fetcher.fetch(next.get()))
        .thenCompose(
            nextPage -> {
              if (nextPage.isEmpty()) {
                return CompletableFuture.completedFuture(Collections.unmodifiableList(collected));
              }
              collected.addAll(nextPage.items());
              return collectRemaining(nextPage, fetcher, collected);
            });
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof Page<?>)) {
      return false;
    }
    var other = (Page<?>) obj;
    return items.equals(other.items)
        && Objects.equals(totalCount, other.totalCount)
        && Objects.equals(incompleteResults, other.incompleteResults)
        && links.equals(other.links);
  }

  @Override
  public int hashCode() {
    return Objects.hash(items, totalCount, incompleteResults, links);
  }

  @Override
  public String toString() {
    return "Page[items="
        + items
        + ", totalCount="
        + totalCount
        + ", incompleteResults="
        + incompleteResults
        + ", links="
        + links
        + "]";
  }

  /** Returns a page with the given items and links. */
  public static <T> Page<T> of(List<T> items, PageLinks links) {
    return new Page<>(items, null, null, links);
  }

  /** Returns a page with the given items, search metadata and links. */
  public static <T> Page<T> of(
      List<T> items,
      @Nullable Long totalCount,
      @Nullable Boolean incompleteResults,
      PageLinks links) {
    return new Page<>(items, totalCount, incompleteResults, links);
  }
}
