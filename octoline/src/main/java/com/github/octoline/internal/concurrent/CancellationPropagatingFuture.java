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

package com.github.octoline.internal.concurrent;

import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Function;

/**
 * A {@link CompletableFuture} whose dependents share a cancellation scope with the stages they
 * were composed from. Cancelling any future in the scope, including the ones returned by {@code
 * thenCompose(...)}, cancels the upstream it wraps and every stage composed so far. This lets
 * cancelling a retried call reach the pending delay or the in-flight attempt.
 */
public final class CancellationPropagatingFuture<T> extends CompletableFuture<T> {
  private final Scope scope;

  private CancellationPropagatingFuture(Scope scope) {
    this.scope = scope;
  }

  @Override
  public <U> CompletableFuture<U> newIncompleteFuture() {
    return new CancellationPropagatingFuture<>(scope);
  }

  @Override
  public <U> CompletableFuture<U> thenCompose(
      Function<? super T, ? extends CompletionStage<U>> fn) {
    return super.thenCompose(result -> scope.track(fn.apply(result)));
  }

  @Override
  public boolean cancel(boolean mayInterruptIfRunning) {
    boolean cancelled = super.cancel(mayInterruptIfRunning);
    if (cancelled) {
      scope.cancel(mayInterruptIfRunning);
    }
    return cancelled;
  }

  /** Returns an incomplete future that is itself cancelled when any of its dependents is. */
  public static <T> CancellationPropagatingFuture<T> create() {
    var future = new CancellationPropagatingFuture<T>(new Scope());
    future.scope.track(future);
    return future;
  }

  /**
   * Returns a future that completes as the given one does and cancels it when itself or any of its
   * dependents is cancelled.
   */
  public static <T> CompletableFuture<T> of(CompletableFuture<T> upstream) {
    if (upstream instanceof CancellationPropagatingFuture) {
      return upstream;
    }

    var future = new CancellationPropagatingFuture<T>(new Scope());
    future.scope.track(upstream);
    upstream.whenComplete(
        (result, exception) -> {
          if (exception != null) {
            future.completeExceptionally(exception);
          } else {
            future.complete(result);
          }
        });
    return future;
  }

  /** The stages to cancel once any future sharing this scope is cancelled. */
  private static final class Scope {
    private final Queue<CompletableFuture<?>> stages = new ConcurrentLinkedQueue<>();
    private volatile boolean mayInterruptIfRunning;
    private volatile boolean cancelled;

    <S extends CompletionStage<?>> S track(S stage) {
      stages.add(stage.toCompletableFuture());
      if (cancelled) {
        cancelTracked();
      }
      return stage;
    }

    void cancel(boolean mayInterruptIfRunning) {
      this.mayInterruptIfRunning = mayInterruptIfRunning;
      cancelled = true;
      cancelTracked();
    }

    private void cancelTracked() {
      CompletableFuture<?> stage;
      while ((stage = stages.poll()) != null) {
        stage.cancel(mayInterruptIfRunning);
      }
    }
  }
}
