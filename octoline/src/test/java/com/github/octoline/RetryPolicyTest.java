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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;

import com.github.octoline.internal.HttpDates;
import java.net.http.HttpHeaders;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {
  private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");
  private static final HttpHeaders NO_HEADERS = HttpHeaders.of(Map.of(), (n, v) -> true);

  private static HttpHeaders headers(String name, String value) {
    return HttpHeaders.of(Map.of(name, List.of(value)), (n, v) -> true);
  }

  @Test
  void noneNeverRetries() {
    var state = RetryPolicy.none().newState();
    assertThat(state.onResponse(500, NO_HEADERS, NOW).shouldRetry()).isFalse();
    assertThat(state.onTransportFailure().shouldRetry()).isFalse();
  }

  @Test
  void fixedCountsDownToZero() {
    var state = RetryPolicy.fixed(2).newState();
    var first = state.onResponse(500, NO_HEADERS, NOW);
    assertThat(first.shouldRetry()).isTrue();
    assertThat(first.delay()).isZero();
    assertThat(first.nextState().remainingRetries()).isOne();

    var second = first.nextState().onTransportFailure();
    assertThat(second.shouldRetry()).isTrue();
    assertThat(second.nextState().remainingRetries()).isZero();

    var third = second.nextState().onResponse(500, NO_HEADERS, NOW);
    assertThat(third.shouldRetry()).isFalse();
    assertThat(third.nextState().remainingRetries()).isZero();
  }

  @Test
  void fixedIgnoresHeaderDelays() {
    var decision =
        RetryPolicy.fixed(1).newState().onResponse(429, headers("Retry-After", "5"), NOW);
    assertThat(decision.delay()).isZero();
  }

  @Test
  void statesAreIndependentAcrossCalls() {
    var policy = RetryPolicy.backoff(Duration.ofSeconds(1), Duration.ofSeconds(10), 3);
    var state = policy.newState();
    var advanced = state.onTransportFailure().nextState();
    assertThat(advanced.nextFallbackDelay()).hasValue(Duration.ofSeconds(2));
    assertThat(state.nextFallbackDelay()).hasValue(Duration.ofSeconds(1));
    assertThat(policy.newState().remainingRetries()).isEqualTo(3);
  }

  @Test
  void hugeFallbackDelayDoesNotOverflow() {
    var huge = Duration.ofSeconds(Long.MAX_VALUE / 2 + 1);
    var max = Duration.ofSeconds(Long.MAX_VALUE);
    var state = RetryPolicy.backoff(huge, max, 3).newState();

    var first = state.onResponse(503, NO_HEADERS, NOW);
    assertThat(first.delay()).isEqualTo(huge);
    assertThat(first.nextState().nextFallbackDelay()).hasValue(max);

    var second = first.nextState().onTransportFailure();
    assertThat(second.delay()).isEqualTo(max);
    assertThat(second.nextState().nextFallbackDelay()).hasValue(max);
  }

  @Test
  void backoffDelaysDoubleAndAreClamped() {
    var state = RetryPolicy.backoff(Duration.ofMillis(300), Duration.ofSeconds(1), 5).newState();
    var delays = new ArrayList<Duration>();
    for (int i = 0; i < 5; i++) {
      var decision = state.onResponse(503, NO_HEADERS, NOW);
      delays.add(decision.delay());
      state = decision.nextState();
    }
    assertThat(delays)
        .containsExactly(
            Duration.ofMillis(300),
            Duration.ofMillis(600),
            Duration.ofSeconds(1),
            Duration.ofSeconds(1),
            Duration.ofSeconds(1));
    assertThat(state.onResponse(503, NO_HEADERS, NOW).shouldRetry()).isFalse();
  }

  @Test
  void headerDelaysDoNotAdvanceFallback() {
    var state = RetryPolicy.backoff(Duration.ofSeconds(1), Duration.ofMinutes(1), 3).newState();
    var decision = state.onResponse(500, headers("Retry-After", "7"), NOW);
    assertThat(decision.delay()).isEqualTo(Duration.ofSeconds(7));
    assertThat(decision.nextState().nextFallbackDelay()).hasValue(Duration.ofSeconds(1));
    assertThat(decision.nextState().remainingRetries()).isEqualTo(2);
  }

  @Test
  void retryablePredicate() {
    assertThat(RetryPolicy.isRetryable(500, NO_HEADERS, NOW)).isTrue();
    assertThat(RetryPolicy.isRetryable(599, NO_HEADERS, NOW)).isTrue();
    assertThat(RetryPolicy.isRetryable(429, NO_HEADERS, NOW)).isTrue();
    assertThat(RetryPolicy.isRetryable(400, NO_HEADERS, NOW)).isFalse();
    assertThat(RetryPolicy.isRetryable(400, headers("Retry-After", "1"), NOW)).isTrue();
    assertThat(RetryPolicy.isRetryable(403, headers("Retry-After", "1"), NOW)).isFalse();
    assertThat(RetryPolicy.isRetryable(404, NO_HEADERS, NOW)).isFalse();
    assertThat(RetryPolicy.isRetryable(200, NO_HEADERS, NOW)).isFalse();
  }

  @Test
  void headerDelayFromRetryAfter() {
    assertThat(RetryPolicy.headerDelay(headers("Retry-After", "5"), NOW))
        .hasValue(Duration.ofSeconds(5));
    assertThat(RetryPolicy.headerDelay(headers("Retry-After", "0.25"), NOW))
        .hasValue(Duration.ofMillis(250));
    assertThat(
            RetryPolicy.headerDelay(
                headers("Retry-After", HttpDates.formatHttpDate(NOW.plusSeconds(20))), NOW))
        .hasValue(Duration.ofSeconds(20));
    assertThat(RetryPolicy.headerDelay(headers("Retry-After", "-1"), NOW)).isEmpty();
    assertThat(RetryPolicy.headerDelay(headers("Retry-After", "soon"), NOW)).isEmpty();
  }

  @Test
  void headerDelayFromRateLimitReset() {
    var reset = Long.toString(NOW.plusSeconds(42).getEpochSecond());
    assertThat(RetryPolicy.headerDelay(headers("X-RateLimit-Reset", reset), NOW))
        .hasValue(Duration.ofSeconds(42));

    var pastReset = Long.toString(NOW.minusSeconds(42).getEpochSecond());
    assertThat(RetryPolicy.headerDelay(headers("X-RateLimit-Reset", pastReset), NOW))
        .hasValue(Duration.ZERO);
  }

  @Test
  void retryAfterTakesPrecedenceOverRateLimitReset() {
    var headers =
        HttpHeaders.of(
            Map.of(
                "Retry-After", List.of("3"),
                "X-RateLimit-Reset", List.of(Long.toString(NOW.plusSeconds(60).getEpochSecond()))),
            (n, v) -> true);
    assertThat(RetryPolicy.headerDelay(headers, NOW)).hasValue(Duration.ofSeconds(3));
  }

  @Test
  void invalidArguments() {
    assertThatIllegalArgumentException().isThrownBy(() -> RetryPolicy.fixed(-1));
    assertThatIllegalArgumentException()
        .isThrownBy(() -> RetryPolicy.backoff(Duration.ofSeconds(-1), Duration.ofSeconds(1), 1));
    assertThatIllegalArgumentException()
        .isThrownBy(() -> RetryPolicy.backoff(Duration.ofSeconds(1), Duration.ofSeconds(1), -1));
  }

  @Test
  void completeDecisionHasNoDelay() {
    var decision = RetryPolicy.fixed(0).newState().onResponse(500, NO_HEADERS, NOW);
    assertThatIllegalStateException().isThrownBy(decision::delay);
  }
}
