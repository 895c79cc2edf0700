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

package com.github.octoline.internal.page;

import static java.util.Objects.requireNonNull;

import com.github.octoline.Page;
import com.github.octoline.PageFetcher;
import com.github.octoline.internal.Utils;
import com.github.octoline.internal.flow.AbstractSubscription;
import com.github.octoline.internal.flow.FlowSupport;
import java.net.URI;
import java.util.Iterator;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow.Publisher;
import java.util.concurrent.Flow.Subscriber;
import java.util.concurrent.atomic.AtomicBoolean;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@code Publisher} of the items of a page followed by those of the pages after it. Pages are
 * fetched lazily, one at a time, when the previous page's items are delivered and there's demand
 * for more.
 */
public final class PagePublisher<T> implements Publisher<T> {
  private final Page<T> firstPage;
  private final PageFetcher<T> fetcher;
  private final Executor executor;
  private final AtomicBoolean subscribed = new AtomicBoolean();

  public PagePublisher(Page<T> firstPage, PageFetcher<T> fetcher, Executor executor) {
    this.firstPage = requireNonNull(firstPage);
    this.fetcher = requireNonNull(fetcher);
    this.executor = requireNonNull(executor);
  }

  @Override
  public void subscribe(Subscriber<? super T> subscriber) {
    requireNonNull(subscriber);
    if (subscribed.compareAndSet(false, true)) {
      new PageSubscription<>(subscriber, executor, firstPage, fetcher).signal();
    } else {
      FlowSupport.rejectMulticast(subscriber);
    }
  }

  private static final class PageSubscription<T> extends AbstractSubscription<T> {
    private final PageFetcher<T> fetcher;

    /** The current page's undelivered items. */
    private Iterator<T> items;

    /** The link to the page after the current one. */
    private @Nullable URI next;

    private volatile @Nullable CompletableFuture<Page<T>> inFlightFetch;
    private volatile @Nullable Page<T> fetchedPage;

    PageSubscription(
        Subscriber<? super T> downstream,
        Executor executor,
        Page<T> firstPage,
        PageFetcher<T> fetcher) {
      super(downstream, executor);
      this.fetcher = fetcher;
      this.items = firstPage.items().iterator();
      this.next = firstPage.next().orElse(null);
    }

    @Override
    protected long emit(long demand) {
      long submitted = 0;
      while (true) {
        Page<T> page;
        if (items.hasNext()) {
          if (submitted >= demand) {
            return submitted;
          } else if (submit(items.next())) {
            submitted++;
          } else {
            return 0;
          }
        } else if ((page = fetchedPage) != null) {
          fetchedPage = null;
          inFlightFetch = null;
          if (page.isEmpty()) {
            complete();
            return submitted;
          }
          items = page.items().iterator();
          next = page.next().orElse(null);
        } else if (next == null) {
          complete();
          return submitted;
        } else if (inFlightFetch == null && submitted < demand) {
          fetch(next);
          return submitted;
        } else {
          return submitted; // Wait for the fetched page or for more demand.
        }
      }
    }

    private void fetch(URI uri) {
      CompletableFuture<Page<T>> future;
      try {
        future = requireNonNull(fetcher.fetch(uri), "fetcher returned a null future");
      } catch (RuntimeException e) {
        future = CompletableFuture.failedFuture(e);
      }
      inFlightFetch = future;
      future.whenComplete(
          (page, exception) -> {
            if (isTerminated()) {
              return;
            }
            if (exception != null) {
              signalError(Utils.getDeepCompletionCause(exception));
            } else if (page == null) {
              signalError(new NullPointerException("fetched a null page: " + uri));
            } else {
              fetchedPage = page;
              signal();
            }
          });
    }

    @Override
    protected void abort(boolean flowInterrupted) {
      var future = inFlightFetch;
      if (future != null && flowInterrupted) {
        future.cancel(true);
      }
    }
  }
}
