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

package com.github.octoline.internal.flow;

import static java.util.Objects.requireNonNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow.Subscriber;
import java.util.concurrent.Flow.Subscription;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link Subscription} that delivers all downstream signals from a drain loop running on a given
 * executor, one round at a time. Subclasses say how many items they can emit now through {@link
 * #emit(long)}, and call {@link #signal()} whenever a source they wait on makes progress.
 *
 * <p>{@code emit}, {@link #submit(Object)}, {@link #complete()} and {@link #fail(Throwable)} are
 * only called from the drain loop, so subclasses may keep the state they use unsynchronized.
 */
public abstract class AbstractSubscription<T> implements Subscription {
  private static final Logger logger = System.getLogger(AbstractSubscription.class.getName());

  private final Subscriber<? super T> downstream;
  private final Executor executor;
  private final AtomicLong demand = new AtomicLong();

  /** Signals the drain loop has yet to observe. A drain is scheduled on a 0 to 1 transition. */
  private final AtomicInteger missedSignals = new AtomicInteger();

  private final AtomicReference<@Nullable Throwable> pendingError = new AtomicReference<>();
  private final AtomicBoolean terminated = new AtomicBoolean();

  /** Only accessed from the drain loop. */
  private boolean subscribed;

  protected AbstractSubscription(Subscriber<? super T> downstream, Executor executor) {
    this.downstream = requireNonNull(downstream);
    this.executor = requireNonNull(executor);
  }

  @Override
  public final void request(long n) {
    if (n <= 0) {
      signalError(new IllegalArgumentException("non-positive subscription request: " + n));
      return;
    }
    demand.getAndAccumulate(
        n,
        (current, added) -> {
          long sum = current + added;
          return sum < 0 ? Long.MAX_VALUE : sum;
        });
    signal();
  }

  @Override
  public final void cancel() {
    if (terminated.compareAndSet(false, true)) {
      abortQuietly(true);
      dropPendingError(null);
    }
  }

  /** Makes the drain loop run, or go another round if it's already running. */
  public final void signal() {
    if (missedSignals.getAndIncrement() == 0) {
      try {
        executor.execute(this::drain);
      } catch (RuntimeException | Error e) {
        logger.log(Level.ERROR, "Couldn't schedule the subscription's drain loop", e);
        cancel();
        throw e;
      }
    }
  }

  /** Arranges for downstream to be failed with the given exception. */
  public final void signalError(Throwable exception) {
    requireNonNull(exception);
    if (!terminated.get() && pendingError.compareAndSet(null, exception)) {
      signal();
    } else {
      FlowSupport.onDroppedException(exception);
    }
  }

  /** Returns {@code true} if downstream was completed or has cancelled. */
  protected final boolean isTerminated() {
    return terminated.get();
  }

  /**
   * Emits at most {@code demand} items with {@link #submit(Object)} and returns how many were
   * emitted, which is zero if nothing can be emitted right now. Calls {@link #complete()} once the
   * source is exhausted.
   */
  protected abstract long emit(long demand);

  /**
   * Releases resources held by this subscription. {@code flowInterrupted} tells whether downstream
   * cancelled or failed rather than the flow ending normally.
   */
  protected void abort(boolean flowInterrupted) {}

  /**
   * Passes the given item to downstream. Returns {@code false} if the item wasn't delivered, in
   * which case the caller must stop emitting.
   */
  protected final boolean submit(T item) {
    if (terminated.get() || pendingError.get() != null) {
      return false;
    }
    try {
      downstream.onNext(item);
      return true;
    } catch (Throwable t) {
      terminate(t, true);
      return false;
    }
  }

  /** Completes downstream normally. */
  protected final void complete() {
    if (terminated.compareAndSet(false, true)) {
      abortQuietly(false);
      dropPendingError(null);
      try {
        downstream.onComplete();
      } catch (Throwable t) {
        logger.log(Level.WARNING, "Exception thrown by subscriber's onComplete", t);
      }
    }
  }

  /** Fails downstream with the given exception. */
  protected final void fail(Throwable exception) {
    terminate(exception, true);
  }

  private void terminate(Throwable exception, boolean flowInterrupted) {
    if (!terminated.compareAndSet(false, true)) {
      FlowSupport.onDroppedException(exception);
      return;
    }
    abortQuietly(flowInterrupted);
    dropPendingError(exception);
    try {
      downstream.onError(exception);
    } catch (Throwable t) {
      t.addSuppressed(exception);
      logger.log(Level.WARNING, "Exception thrown by subscriber's onError", t);
    }
  }

  private void drain() {
    int missed = 1;
    do {
      if (!subscribed) {
        subscribed = true;
        try {
          downstream.onSubscribe(this);
        } catch (Throwable t) {
          terminate(t, true);
          return;
        }
      }

      while (!terminated.get()) {
        var error = pendingError.get();
        if (error != null) {
          terminate(error, false);
          return;
        }

        long emitted;
        try {
          emitted = emit(demand.get());
        } catch (Throwable t) {
          terminate(t, true);
          return;
        }
        if (emitted <= 0) {
          break;
        }
        demand.addAndGet(-emitted);
      }
      if (terminated.get()) {
        return;
      }
      missed = missedSignals.addAndGet(-missed);
    } while (missed != 0);
  }

  private void abortQuietly(boolean flowInterrupted) {
    try {
      abort(flowInterrupted);
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown while aborting the subscription", t);
    }
  }

  /** Logs a pending error other than the given one, as it can't reach downstream anymore. */
  private void dropPendingError(@Nullable Throwable delivered) {
    var error = pendingError.getAndSet(null);
    if (error != null && error != delivered) {
      FlowSupport.onDroppedException(error);
    }
  }
}
