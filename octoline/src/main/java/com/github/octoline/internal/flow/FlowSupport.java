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

/** Helpers shared by the library's publishers. */
public final class FlowSupport {
  private static final Logger logger = System.getLogger(FlowSupport.class.getName());

  /** An executor that runs tasks in the calling thread. */
  public static final Executor SYNC_EXECUTOR = Runnable::run;

  private FlowSupport() {}

  /** Fails a subscriber to a publisher that only accepts one. */
  public static void rejectMulticast(Subscriber<?> subscriber) {
    requireNonNull(subscriber);
    var exception = new IllegalStateException("Multiple subscribers not supported");
    try {
      subscriber.onSubscribe(
          new Subscription() {
            @Override
            public void request(long n) {}

            @Override
            public void cancel() {}
          });
    } catch (Throwable t) {
      exception.addSuppressed(t);
    }
    subscriber.onError(exception);
  }

  /** Logs an exception that couldn't be passed to a subscriber. */
  public static void onDroppedException(Throwable exception) {
    logger.log(Level.WARNING, "Dropped exception", exception);
  }
}
