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

import com.github.octoline.cache.CacheWriter;
import com.github.octoline.internal.flow.FlowSupport;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.Flow.Publisher;
import java.util.concurrent.Flow.Subscriber;
import java.util.concurrent.Flow.Subscription;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@code Publisher} that writes the body stream into a {@link CacheWriter} while forwarding it to
 * downstream. The writer is committed when the body completes, before downstream is completed, so
 * that a subsequent request observes the entry. The writer is discarded if the body fails or
 * downstream cancels before completion. Writer failures are logged and don't reach downstream.
 */
public final class CacheWritingPublisher implements Publisher<List<ByteBuffer>> {
  private static final Logger logger = System.getLogger(CacheWritingPublisher.class.getName());

  private final Publisher<List<ByteBuffer>> upstream;
  private final CacheWriter writer;
  private final AtomicBoolean subscribed = new AtomicBoolean();

  public CacheWritingPublisher(Publisher<List<ByteBuffer>> upstream, CacheWriter writer) {
    this.upstream = requireNonNull(upstream);
    this.writer = requireNonNull(writer);
  }

  @Override
  public void subscribe(Subscriber<? super List<ByteBuffer>> subscriber) {
    requireNonNull(subscriber);
    if (subscribed.compareAndSet(false, true)) {
      upstream.subscribe(new TeeSubscriber(subscriber, writer));
    } else {
      FlowSupport.rejectMulticast(subscriber);
    }
  }

  /** Sits between upstream and downstream, copying each item into the writer. */
  private static final class TeeSubscriber implements Subscriber<List<ByteBuffer>>, Subscription {
    private final AtomicReference<@Nullable Subscriber<? super List<ByteBuffer>>> downstream;
    private final AtomicReference<@Nullable Subscription> upstream = new AtomicReference<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CacheWriter writer;

    /** Serializes access to the writer, which can be discarded by a concurrent cancel(). */
    private final ReentrantLock writeLock = new ReentrantLock();

    @GuardedBy("writeLock")
    private boolean writerDone;

    TeeSubscriber(Subscriber<? super List<ByteBuffer>> downstream, CacheWriter writer) {
      this.downstream = new AtomicReference<>(downstream);
      this.writer = writer;
    }

    @Override
    public void onSubscribe(Subscription subscription) {
      requireNonNull(subscription);
      // Checking cancelled after publishing the subscription lets a racing cancel() reach it.
      if (!upstream.compareAndSet(null, subscription) || cancelled.get()) {
        subscription.cancel();
        return;
      }
      var subscriber = downstream.get();
      if (subscriber != null) {
        subscriber.onSubscribe(this);
      }
    }

    @Override
    public void onNext(List<ByteBuffer> buffers) {
      requireNonNull(buffers);
      writeLock.lock();
      try {
        if (!writerDone) {
          for (var buffer : buffers) {
            writer.write(buffer.duplicate());
          }
        }
      } catch (IOException | RuntimeException e) {
        logger.log(Level.WARNING, "Failed to write the response body to cache", e);
        finishWriter(false);
      } finally {
        writeLock.unlock();
      }

      var subscriber = downstream.get();
      if (subscriber != null) {
        subscriber.onNext(buffers);
      }
    }

    @Override
    public void onError(Throwable exception) {
      requireNonNull(exception);
      discard();
      var subscriber = downstream.getAndSet(null);
      if (subscriber != null) {
        subscriber.onError(exception);
      } else {
        FlowSupport.onDroppedException(exception);
      }
    }

    @Override
    public void onComplete() {
      commit();
      var subscriber = downstream.getAndSet(null);
      if (subscriber != null) {
        subscriber.onComplete();
      }
    }

    @Override
    public void request(long n) {
      var subscription = upstream.get();
      if (subscription != null) {
        subscription.request(n);
      }
    }

    @Override
    public void cancel() {
      downstream.set(null);
      if (cancelled.compareAndSet(false, true)) {
        var subscription = upstream.get();
        if (subscription != null) {
          subscription.cancel();
        }
      }
      discard(); // No-op if the body is complete, as the writer is then committed.
    }

    private void commit() {
      writeLock.lock();
      try {
        finishWriter(true);
      } finally {
        writeLock.unlock();
      }
    }

    private void discard() {
      writeLock.lock();
      try {
        finishWriter(false);
      } finally {
        writeLock.unlock();
      }
    }

    /** Commits or discards the writer once. A failed commit discards the writer. */
    @GuardedBy("writeLock")
    private void finishWriter(boolean commit) {
      if (writerDone) {
        return;
      }
      writerDone = true;
      if (commit) {
        try {
          writer.commit();
          return;
        } catch (IOException | RuntimeException e) {
          logger.log(Level.WARNING, "Failed to commit the cached response", e);
        }
      }
      try {
        writer.discard();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to discard the cached response", e);
      }
    }
  }
}
