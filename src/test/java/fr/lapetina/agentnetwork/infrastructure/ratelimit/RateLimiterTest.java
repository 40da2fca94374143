package fr.lapetina.agentnetwork.infrastructure.ratelimit;

import fr.lapetina.agentnetwork.domain.model.ErrorType;
import fr.lapetina.agentnetwork.infrastructure.client.ModelClientException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    private ManualTicker ticker;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        ticker = new ManualTicker();
        rateLimiter = new RateLimiter(BackoffPolicy.fixed(Duration.ofSeconds(1), Duration.ofSeconds(60)), ticker);
        rateLimiter.configureEndpoint("gemini_api", 10, 1.0, 3);
    }

    @Test
    @DisplayName("should return the call result and count a success")
    void shouldReturnResult() {
        String result = rateLimiter.callWithLimit("gemini_api", () -> "ok");

        assertThat(result).isEqualTo("ok");
        EndpointMetrics metrics = rateLimiter.getCallMetrics("gemini_api");
        assertThat(metrics.totalCalls()).isEqualTo(1);
        assertThat(metrics.successfulCalls()).isEqualTo(1);
        assertThat(metrics.failedCalls()).isZero();
        assertThat(metrics.successRate()).isEqualTo(100.0);
        assertThat(metrics.callsLastMinute()).isEqualTo(1);
    }

    @Test
    @DisplayName("should report the success rate of finished calls and attempts in the last minute")
    void shouldReportSuccessRateAndRecentCalls() {
        rateLimiter.configureEndpoint("gemini_api", 100, 100.0, 0);
        assertThat(rateLimiter.getCallMetrics("gemini_api").successRate()).isEqualTo(100.0);

        rateLimiter.callWithLimit("gemini_api", () -> "ok");
        rateLimiter.callWithLimit("gemini_api", () -> "ok");
        rateLimiter.callWithLimit("gemini_api", () -> "ok");
        assertThatThrownBy(() -> rateLimiter.callWithLimit("gemini_api", () -> {
            throw ModelClientException.providerError("HTTP 500");
        })).isInstanceOf(ModelClientException.class);

        EndpointMetrics metrics = rateLimiter.getCallMetrics("gemini_api");
        assertThat(metrics.successRate()).isEqualTo(75.0);
        assertThat(metrics.callsLastMinute()).isEqualTo(4);

        ticker.advance(Duration.ofSeconds(61));
        rateLimiter.callWithLimit("gemini_api", () -> "ok");

        EndpointMetrics later = rateLimiter.getCallMetrics("gemini_api");
        assertThat(later.callsLastMinute()).isEqualTo(1);
        assertThat(later.totalCalls()).isEqualTo(5);
        assertThat(later.successRate()).isEqualTo(80.0);
    }

    @Test
    @DisplayName("should retry rate-limited calls with exponential backoff")
    void shouldRetryRateLimited() {
        AtomicInteger attempts = new AtomicInteger();

        String result = rateLimiter.callWithLimit("gemini_api", () -> {
            if (attempts.incrementAndGet() <= 2) {
                throw ModelClientException.rateLimited("429 Too Many Requests");
            }
            return "finally";
        });

        assertThat(result).isEqualTo("finally");
        assertThat(ticker.sleeps()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));

        EndpointMetrics metrics = rateLimiter.getCallMetrics("gemini_api");
        assertThat(metrics.totalCalls()).isEqualTo(3);
        assertThat(metrics.retries()).isEqualTo(2);
        assertThat(metrics.rateLimitHits()).isEqualTo(2);
        assertThat(metrics.successfulCalls()).isEqualTo(1);
        assertThat(metrics.totalWaitSeconds()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("should raise RateLimitExceededException once retries are exhausted")
    void shouldFailAfterMaxRetries() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> rateLimiter.callWithLimit("gemini_api", () -> {
            attempts.incrementAndGet();
            throw ModelClientException.timeout("read timed out");
        }))
                .isInstanceOf(RateLimitExceededException.class)
                .satisfies(e -> {
                    RateLimitExceededException exceeded = (RateLimitExceededException) e;
                    assertThat(exceeded.getErrorType()).isEqualTo(ErrorType.RATE_LIMIT_EXCEEDED);
                    assertThat(exceeded.getAttempts()).isEqualTo(4);
                    assertThat(exceeded.getLastErrorType()).isEqualTo(ErrorType.TIMEOUT);
                    assertThat(exceeded.getEndpoint()).isEqualTo("gemini_api");
                    assertThat(exceeded.getCause()).isInstanceOf(ModelClientException.class);
                });

        assertThat(attempts).hasValue(4);
        EndpointMetrics metrics = rateLimiter.getCallMetrics("gemini_api");
        assertThat(metrics.failedCalls()).isEqualTo(1);
        assertThat(metrics.retries()).isEqualTo(3);
    }

    @Test
    @DisplayName("should propagate non-transient failures without retrying")
    void shouldNotRetryProviderErrors() {
        AtomicInteger attempts = new AtomicInteger();
        ModelClientException failure = ModelClientException.providerError("HTTP 500");

        assertThatThrownBy(() -> rateLimiter.callWithLimit("gemini_api", () -> {
            attempts.incrementAndGet();
            throw failure;
        })).isSameAs(failure);

        assertThat(attempts).hasValue(1);
        assertThat(ticker.sleeps()).isEmpty();
        assertThat(rateLimiter.getCallMetrics("gemini_api").failedCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("should count unexpected exceptions as failures")
    void shouldCountUnexpectedFailures() {
        assertThatThrownBy(() -> rateLimiter.callWithLimit("gemini_api", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(rateLimiter.getCallMetrics("gemini_api").failedCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("should throttle calls once the bucket is empty")
    void shouldThrottleWhenBucketEmpty() {
        rateLimiter.configureEndpoint("small", 2, 0.5, 0);

        rateLimiter.callWithLimit("small", () -> 1);
        rateLimiter.callWithLimit("small", () -> 2);
        rateLimiter.callWithLimit("small", () -> 3);

        assertThat(ticker.sleeps()).containsExactly(Duration.ofSeconds(2));
        assertThat(rateLimiter.getCallMetrics("small").totalWaitSeconds()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("should create unknown endpoints with default limits")
    void shouldUseDefaultsForUnknownEndpoint() {
        assertThat(rateLimiter.isConfigured("other_api")).isFalse();

        assertThat(rateLimiter.callWithLimit("other_api", () -> "ok")).isEqualTo("ok");

        assertThat(rateLimiter.isConfigured("other_api")).isTrue();
        assertThat(rateLimiter.getCallMetrics()).containsOnlyKeys("gemini_api", "other_api");
    }

    @Test
    @DisplayName("should keep call metrics when an endpoint is reconfigured")
    void shouldKeepMetricsOnReconfigure() {
        rateLimiter.callWithLimit("gemini_api", () -> "ok");

        rateLimiter.configureEndpoint("gemini_api", 5, 2.0, 1);

        assertThat(rateLimiter.getCallMetrics("gemini_api").totalCalls()).isEqualTo(1);
    }
}
