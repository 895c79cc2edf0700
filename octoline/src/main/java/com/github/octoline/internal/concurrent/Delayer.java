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

import static java.util.concurrent.TimeUnit.NANOSECONDS;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/** Delays the execution of a given task. */
@FunctionalInterface
public interface Delayer {

  /**
   * Arranges for the task to be submitted to the given executor after the delay is evaluated.
   * Cancelling the returned future cancels the pending submission.
   */
  CompletableFuture<Void> delay(Runnable task, Duration delay, Executor executor);

  /** A delayer that uses a shared daemon scheduler, created on first use. */
  static Delayer defaultDelayer() {
    return SchedulingDelayer.INSTANCE;
  }
}

final class SchedulingDelayer implements Delayer {
  static final SchedulingDelayer INSTANCE = new SchedulingDelayer(newScheduler());

  private final ScheduledExecutorService scheduler;

  private SchedulingDelayer(ScheduledExecutorService scheduler) {
    this.scheduler = scheduler;
  }

  @Override
  public CompletableFuture<Void> delay(Runnable task, Duration delay, Executor executor) {
    if (delay.isZero() || delay.isNegative()) {
      return CompletableFuture.runAsync(task, executor);
    }

    var future = new CompletableFuture<Void>();
    var scheduled =
        scheduler.schedule(
            () -> executor.execute(() -> runInto(future, task)),
            NANOSECONDS.convert(delay),
            NANOSECONDS);
    future.whenComplete(
        (__, e) -> {
          if (e instanceof CancellationException) {
            scheduled.cancel(false);
          }
        });
    return future;
  }

  private static void runInto(CompletableFuture<Void> future, Runnable task) {
    if (future.isDone()) {
      return;
    }
    try {
      task.run();
      future.complete(null);
    } catch (Throwable t) {
      future.completeExceptionally(t);
    }
  }

  private static ScheduledExecutorService newScheduler() {
    var threadCount = new AtomicInteger();
    return Executors.newSingleThreadScheduledExecutor(
        r -> {
          var thread = new Thread(r, "octoline-delayer-" + threadCount.getAndIncrement());
          thread.setDaemon(true);
          return thread;
        });
  }
}
