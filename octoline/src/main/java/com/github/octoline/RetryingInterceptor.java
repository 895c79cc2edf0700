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

import com.github.octoline.Octoline.Interceptor;
import com.github.octoline.RetryPolicy.Decision;
import com.github.octoline.internal.Utils;
import com.github.octoline.internal.concurrent.CancellationPropagatingFuture;
import com.github.octoline.internal.concurrent.Delayer;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.BodySubscriber;
import java.net.http.HttpResponse.BodySubscribers;
import java.net.http.HttpResponse.ResponseInfo;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An interceptor that retries requests according to a {@link RetryPolicy}.
 *
 * <p>The policy is consulted as soon as an attempt's status and headers arrive. The body of a
 * response that is going to be retried is discarded without reaching the caller's {@code
 * BodyHandler}, so only the final attempt's body is decoded. When retries are exhausted, the final
 * attempt's response or exception is returned as is.
 *
 * <p>Cancelling the future returned by {@link #interceptAsync(HttpRequest, Chain)} cancels the
 * pending delay or the in-flight attempt.
 */
public final class RetryingInterceptor implements Interceptor {
  private static final Logger logger = System.getLogger(RetryingInterceptor.class.getName());

  private final RetryPolicy policy;
  private final Clock clock;
  private final Delayer delayer;
  private final Listener listener;

  private RetryingInterceptor(Builder builder) {
    this.policy = builder.policy;
    this.clock = builder.clock;
    this.delayer = builder.delayer;
    this.listener = builder.listener;
  }

  public RetryPolicy policy() {
    return policy;
  }

  @Override
  public <T> HttpResponse<T> intercept(HttpRequest request, Chain<T> chain)
      throws IOException, InterruptedException {
    if (policy.mode() == RetryPolicy.Mode.NONE) {
      return chain.forward(request);
    }

    var state = policy.newState();
    for (int retryCount = 0; ; retryCount++) {
      var attempt = new Attempt<>(state, chain.bodyHandler());
      HttpResponse<T> response = null;
      IOException exception = null;
      try {
        response = chain.withBodyHandler(attempt).forward(request);
      } catch (IOException e) {
        exception = e;
      }

      var decision = attempt.evaluate(exception);
      if (!decision.shouldRetry()) {
        if (exception != null) {
          throw exception;
        }
        return requireNonNull(response);
      }

      onRetry(request, retryCount + 1, decision.delay(), exception);
      state = decision.nextState();
      if (!decision.delay().isZero()) {
        var delayFuture = delayer.delay(() -> {}, decision.delay(), Runnable::run);
        try {
          delayFuture.get();
        } catch (InterruptedException e) {
          delayFuture.cancel(true);
          throw e;
        } catch (ExecutionException e) {
          // Cannot happen.
          throw new AssertionError(e);
        }
      }
    }
  }

  @Override
  public <T> CompletableFuture<HttpResponse<T>> interceptAsync(
      HttpRequest request, Chain<T> chain) {
    return policy.mode() == RetryPolicy.Mode.NONE
        ? chain.forwardAsync(request)
        : new AsyncRetrier<>(request, chain).send();
  }

  private void onRetry(
      HttpRequest request, int retryCount, Duration delay, @Nullable Throwable exception) {
    if (exception != null) {
      logger.log(
          Level.DEBUG,
          () -> "Retrying " + request + " (" + retryCount + ") in " + delay + " after failure",
          exception);
    } else {
      logger.log(Level.DEBUG, () -> "Retrying " + request + " (" + retryCount + ") in " + delay);
    }

    try {
      listener.onRetry(request, retryCount, delay);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Exception thrown by Listener::onRetry", e);
    }
  }

  /** Returns a new builder of {@code RetryingInterceptor} instances. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /** Returns an interceptor that retries requests according to the given policy. */
  public static RetryingInterceptor create(RetryPolicy policy) {
    return newBuilder().policy(policy).build();
  }

  /** A listener for retries. */
  public interface Listener {

    /**
     * Called when the request is about to be retried for the {@code retryCount}-th time after the
     * given delay.
     */
    void onRetry(HttpRequest request, int retryCount, Duration delay);

    static Listener disabled() {
      return (request, retryCount, delay) -> {};
    }
  }

  /**
   * A {@code BodyHandler} that evaluates an attempt's response once its status and headers arrive.
   * Bodies of responses that are going to be retried are discarded.
   */
  private final class Attempt<T> implements BodyHandler<T> {
    private final RetryPolicy.State state;
    private final BodyHandler<T> bodyHandler;
    private volatile @Nullable Decision decision;

    Attempt(RetryPolicy.State state, BodyHandler<T> bodyHandler) {
      this.state = state;
      this.bodyHandler = bodyHandler;
    }

    @Override
    public BodySubscriber<T> apply(ResponseInfo responseInfo) {
      var decision =
          state.onResponse(responseInfo.statusCode(), responseInfo.headers(), clock.instant());
      this.decision = decision;
      return decision.shouldRetry()
          ? BodySubscribers.<T>replacing(null)
          : bodyHandler.apply(responseInfo);
    }

    /**
     * Returns the decision made for this attempt's response if one was received, or evaluates the
     * given exception otherwise.
     */
    Decision evaluate(@Nullable Throwable exception) {
      var responseDecision = decision;
      if (responseDecision != null) {
        return responseDecision;
      }
      return exception != null && isTransportFailure(exception)
          ? state.onTransportFailure()
          : Decision.complete(state);
    }
  }

  private static boolean isTransportFailure(Throwable exception) {
    var cause = Utils.getDeepCompletionCause(exception);
    return cause instanceof IOException && !(cause instanceof CacheInconsistencyException);
  }

  private final class AsyncRetrier<T> {
    private final HttpRequest request;
    private final Chain<T> chain;

    AsyncRetrier(HttpRequest request, Chain<T> chain) {
      this.request = request;
      this.chain = chain;
    }

    CompletableFuture<HttpResponse<T>> send() {
      return sendAttempt(policy.newState(), 0);
    }

    private CompletableFuture<HttpResponse<T>> sendAttempt(
        RetryPolicy.State state, int retryCount) {
      var attempt = new Attempt<>(state, chain.bodyHandler());
      return CancellationPropagatingFuture.of(chain.withBodyHandler(attempt).forwardAsync(request))
          .handle((response, exception) -> handleAttempt(attempt, response, exception, retryCount))
          .thenCompose(Function.identity());
    }

    private CompletableFuture<HttpResponse<T>> handleAttempt(
        Attempt<T> attempt,
        @Nullable HttpResponse<T> response,
        @Nullable Throwable exception,
        int retryCount) {
      var decision = attempt.evaluate(exception);
      if (!decision.shouldRetry()) {
        return exception != null
            ? CompletableFuture.failedFuture(Utils.getDeepCompletionCause(exception))
            : CompletableFuture.completedFuture(response);
      }

      var delay = decision.delay();
      onRetry(request, retryCount + 1, delay, exception);
      if (delay.isZero()) {
        return sendAttempt(decision.nextState(), retryCount + 1);
      }
      return CancellationPropagatingFuture.of(delayer.delay(() -> {}, delay, Runnable::run))
          .thenCompose(__ -> sendAttempt(decision.nextState(), retryCount + 1));
    }
  }

  /** A builder of {@code RetryingInterceptor} instances. */
  public static final class Builder {
    private RetryPolicy policy = RetryPolicy.none();
    private Clock clock = Utils.systemMillisUtc();
    private Delayer delayer = Delayer.defaultDelayer();
    private Listener listener = Listener.disabled();

    Builder() {}

    @CanIgnoreReturnValue
    public Builder policy(RetryPolicy policy) {
      this.policy = requireNonNull(policy);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder listener(Listener listener) {
      this.listener = requireNonNull(listener);
      return this;
    }

    @CanIgnoreReturnValue
    Builder clock(Clock clock) {
      this.clock = requireNonNull(clock);
      return this;
    }

    @CanIgnoreReturnValue
    Builder delayer(Delayer delayer) {
      this.delayer = requireNonNull(delayer);
      return this;
    }

    public RetryingInterceptor build() {
      return new RetryingInterceptor(this);
    }
  }
}
