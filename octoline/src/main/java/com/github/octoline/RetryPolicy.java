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

import static com.github.octoline.internal.Utils.requireNonNegativeDuration;
import static com.github.octoline.internal.Validate.requireArgument;
import static com.github.octoline.internal.Validate.requireState;
import static java.util.Objects.requireNonNull;

import com.github.octoline.internal.HttpDates;
import java.net.http.HttpHeaders;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Decides whether a request is retried, and after what delay, based on each attempt's response
 * status and headers, or on the attempt failing to get a response at all. A policy has one of the
 * following modes:
 *
 * <ul>
 *   <li>{@link #none()}: requests are never retried.
 *   <li>{@link #fixed(int)}: retryable outcomes are retried immediately, up to a number of times.
 *   <li>{@link #backoff(Duration, Duration, int)}: retryable outcomes are retried up to a number
 *       of times after a delay. The delay is taken from {@code Retry-After} if present, otherwise
 *       from the time remaining till {@code X-RateLimit-Reset} if present, otherwise from a
 *       fallback delay that doubles with each use. Delays never exceed a maximum.
 * </ul>
 *
 * <p>A response is retryable if it's a server error ({@code 5xx}), {@code 429 Too Many Requests},
 * or a {@code 400 Bad Request} whose headers specify a delay, which GitHub uses to signal secondary
 * rate limits. Failing to get a response is retryable in both the fixed and the backoff modes.
 *
 * <p>A policy is immutable and can be shared. Each call gets its own {@link State} through {@link
 * #newState()}, which is threaded through the call's attempts.
 */
public final class RetryPolicy {
  private static final RetryPolicy NONE = new RetryPolicy(Mode.NONE, 0, null, null);

  private static final int HTTP_BAD_REQUEST = 400;
  private static final int HTTP_TOO_MANY_REQUESTS = 429;

  private final Mode mode;
  private final int count;
  private final @Nullable Duration fallbackDelay;
  private final @Nullable Duration maxDelay;

  private RetryPolicy(
      Mode mode, int count, @Nullable Duration fallbackDelay, @Nullable Duration maxDelay) {
    this.mode = mode;
    this.count = count;
    this.fallbackDelay = fallbackDelay;
    this.maxDelay = maxDelay;
  }

  public Mode mode() {
    return mode;
  }

  /** Returns the maximum number of retries per call. */
  public int count() {
    return count;
  }

  /** Returns the initial fallback delay if this is a backoff policy. */
  public Optional<Duration> fallbackDelay() {
    return Optional.ofNullable(fallbackDelay);
  }

  /** Returns the maximum delay if this is a backoff policy. */
  public Optional<Duration> maxDelay() {
    return Optional.ofNullable(maxDelay);
  }

  /** Returns the state of a new call made under this policy. */
  public State newState() {
    return new State(this, count, fallbackDelay);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof RetryPolicy)) {
      return false;
    }
    var other = (RetryPolicy) obj;
    return mode == other.mode
        && count == other.count
        && Objects.equals(fallbackDelay, other.fallbackDelay)
        && Objects.equals(maxDelay, other.maxDelay);
  }

  @Override
  public int hashCode() {
    return Objects.hash(mode, count, fallbackDelay, maxDelay);
  }

  @Override
  public String toString() {
    switch (mode) {
      case FIXED:
        return "RetryPolicy[fixed(" + count + ")]";
      case BACKOFF:
        return "RetryPolicy[backoff(fallbackDelay="
            + fallbackDelay
            + ", maxDelay="
            + maxDelay
            + ", count="
            + count
            + ")]";
      default:
        return "RetryPolicy[none]";
    }
  }

  /** Returns a policy that never retries. */
  public static RetryPolicy none() {
    return NONE;
  }

  /** Returns a policy that immediately retries retryable outcomes up to {@code count} times. */
  public static RetryPolicy fixed(int count) {
    requireArgument(count >= 0, "negative count: %d", count);
    return new RetryPolicy(Mode.FIXED, count, null, null);
  }

  /**
   * Returns a policy that retries retryable outcomes up to {@code count} times after a delay
   * derived from response headers, or from a fallback delay that doubles each time it's used. No
   * delay exceeds {@code maxDelay}.
   */
  public static RetryPolicy backoff(Duration fallbackDelay, Duration maxDelay, int count) {
    requireNonNegativeDuration(fallbackDelay);
    requireNonNegativeDuration(maxDelay);
    requireArgument(count >= 0, "negative count: %d", count);
    return new RetryPolicy(Mode.BACKOFF, count, fallbackDelay, maxDelay);
  }

  /**
   * Returns the delay the server asks for through response headers, if any. {@code Retry-After}
   * takes precedence over {@code X-RateLimit-Reset}. Delays derived from points in time that have
   * passed are zero.
   */
  public static Optional<Duration> headerDelay(HttpHeaders headers, Instant now) {
    requireNonNull(now);
    var retryAfter = headers.firstValue("Retry-After");
    if (retryAfter.isPresent()) {
      var value = retryAfter.get();
      var delay =
          HttpDates.tryParseDeltaSeconds(value)
              .or(() -> HttpDates.tryParseHttpDate(value).map(date -> untilOrZero(now, date)));
      if (delay.isPresent()) {
        return delay;
      }
    }
    return headers
        .firstValue("X-RateLimit-Reset")
        .flatMap(HttpDates::tryParseEpochSeconds)
        .map(reset -> untilOrZero(now, reset));
  }

  /** Returns whether a response with the given status and headers can be retried. */
  public static boolean isRetryable(int statusCode, HttpHeaders headers, Instant now) {
    return (statusCode >= 500 && statusCode <= 599)
        || statusCode == HTTP_TOO_MANY_REQUESTS
        || (statusCode == HTTP_BAD_REQUEST && headerDelay(headers, now).isPresent());
  }

  private static Duration untilOrZero(Instant now, Instant then) {
    return now.isBefore(then) ? Duration.between(now, then) : Duration.ZERO;
  }

  /** The mode of a {@code RetryPolicy}. */
  public enum Mode {
    NONE,
    FIXED,
    BACKOFF
  }

  /**
   * The immutable state of a call made under a {@code RetryPolicy}. Each evaluation of an
   * attempt's outcome returns a {@link Decision} carrying the state of the next attempt.
   */
  public static final class State {
    private final RetryPolicy policy;
    private final int remainingRetries;
    private final @Nullable Duration nextFallbackDelay;

    State(RetryPolicy policy, int remainingRetries, @Nullable Duration nextFallbackDelay) {
      this.policy = policy;
      this.remainingRetries = remainingRetries;
      this.nextFallbackDelay = nextFallbackDelay;
    }

    public RetryPolicy policy() {
      return policy;
    }

    public int remainingRetries() {
      return remainingRetries;
    }

    /** Returns the delay the next fallback-path retry waits for, if this is a backoff policy. */
    public Optional<Duration> nextFallbackDelay() {
      return Optional.ofNullable(nextFallbackDelay);
    }

    /** Evaluates an attempt that got a response with the given status and headers. */
    public Decision onResponse(int statusCode, HttpHeaders headers, Instant now) {
      if (policy.mode == Mode.NONE
          || remainingRetries <= 0
          || !isRetryable(statusCode, headers, now)) {
        return Decision.complete(this);
      }
      if (policy.mode == Mode.FIXED) {
        return Decision.retry(Duration.ZERO, withRemaining(remainingRetries - 1));
      }
      var delay = headerDelay(headers, now);
      return delay.isPresent()
          ? Decision.retry(clamp(delay.get()), withRemaining(remainingRetries - 1))
          : fallback();
    }

    /** Evaluates an attempt that failed to get a response. */
    public Decision onTransportFailure() {
      if (policy.mode == Mode.NONE || remainingRetries <= 0) {
        return Decision.complete(this);
      }
      return policy.mode == Mode.FIXED
          ? Decision.retry(Duration.ZERO, withRemaining(remainingRetries - 1))
          : fallback();
    }

    private Decision fallback() {
      var delay = requireNonNull(nextFallbackDelay);
      var maxDelay = requireNonNull(policy.maxDelay);

      // Doubling past half the max would only be clamped, and might overflow.
      var doubled =
          delay.compareTo(maxDelay.dividedBy(2)) > 0 ? maxDelay : delay.multipliedBy(2);
      return Decision.retry(
          clamp(delay), new State(policy, remainingRetries - 1, doubled));
    }

    private Duration clamp(Duration delay) {
      var maxDelay = requireNonNull(policy.maxDelay);
      return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    private State withRemaining(int remainingRetries) {
      return new State(policy, remainingRetries, nextFallbackDelay);
    }

    @Override
    public String toString() {
      return "State[remainingRetries="
          + remainingRetries
          + ", nextFallbackDelay="
          + nextFallbackDelay
          + "]";
    }
  }

  /** The outcome of evaluating an attempt. */
  public static final class Decision {
    private final @Nullable Duration delay;
    private final State nextState;

    private Decision(@Nullable Duration delay, State nextState) {
      this.delay = delay;
      this.nextState = nextState;
    }

    /** Returns whether the request is to be sent again. */
    public boolean shouldRetry() {
      return delay != null;
    }

    /** Returns the delay before retrying. */
    public Duration delay() {
      requireState(delay != null, "not retrying");
      return delay;
    }

    /** Returns the state of the call's next attempt, if any. */
    public State nextState() {
      return nextState;
    }

    @Override
    public String toString() {
      return delay != null ? "Decision[retry after " + delay + "]" : "Decision[complete]";
    }

    static Decision retry(Duration delay, State nextState) {
      return new Decision(delay, nextState);
    }

    static Decision complete(State state) {
      return new Decision(null, state);
    }
  }
}
