package fr.lapetina.agentnetwork.infrastructure.ratelimit;

import fr.lapetina.agentnetwork.domain.model.AgentNetworkException;
import fr.lapetina.agentnetwork.domain.model.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.function.Supplier;

/**
 * Per-endpoint rate limiting with exponential backoff.
 *
 * Every attempt of a call takes one token from the endpoint's {@link TokenBucket}.
 * Failures classified as transient ({@link ErrorType#RATE_LIMITED}, {@link ErrorType#TIMEOUT})
 * are retried after a backoff delay, up to the endpoint's {@code maxRetries}. Other failures
 * propagate immediately. Exhausted retries surface as {@link RateLimitExceededException}.
 *
 * Call metrics are for monitoring only and never influence admission.
 */
public final class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    public static final int DEFAULT_MAX_TOKENS = 10;
    public static final double DEFAULT_REFILL_RATE = 1.0;
    public static final int DEFAULT_MAX_RETRIES = 3;

    private static final long MINUTE_NANOS = Duration.ofMinutes(1).toNanos();

    private final Map<String, Endpoint> endpoints = new ConcurrentHashMap<>();
    private final Map<String, Counters> counters = new ConcurrentHashMap<>();
    private final BackoffPolicy backoffPolicy;
    private final Ticker ticker;

    public RateLimiter(BackoffPolicy backoffPolicy, Ticker ticker) {
        this.backoffPolicy = Objects.requireNonNull(backoffPolicy);
        this.ticker = Objects.requireNonNull(ticker);
    }

    public RateLimiter(BackoffPolicy backoffPolicy) {
        this(backoffPolicy, Ticker.SYSTEM);
    }

    public RateLimiter() {
        this(BackoffPolicy.defaults(), Ticker.SYSTEM);
    }

    /**
     * Configures (or replaces) an endpoint. Replacing refills the bucket; metrics are kept.
     */
    public void configureEndpoint(String name, int maxTokens, double refillRate, int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        TokenBucket bucket = new TokenBucket(name, maxTokens, refillRate, ticker);
        Endpoint previous = endpoints.put(name, new Endpoint(bucket, maxRetries));
        counters.computeIfAbsent(name, k -> new Counters());

        log.info("Rate limit endpoint {}: name={}, maxTokens={}, refillRate={}, maxRetries={}",
                previous == null ? "configured" : "reconfigured", name, maxTokens, refillRate, maxRetries);
    }

    public boolean isConfigured(String name) {
        return endpoints.containsKey(name);
    }

    /**
     * Runs {@code call} under the endpoint's rate limit and retry policy.
     *
     * @throws RateLimitExceededException when transient failures outlast the retries
     * @throws AgentNetworkException      for non-transient failures, unchanged
     */
    public <T> T callWithLimit(String endpoint, Supplier<T> call) {
        Endpoint target = endpoint(endpoint);
        Counters stats = counters(endpoint);
        int retry = 0;

        while (true) {
            try {
                Duration wait = target.bucket().acquire();
                stats.waitSeconds.add(wait.toNanos() / 1e9);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stats.failedCalls.incrementAndGet();
                throw new RateLimitExceededException(endpoint, retry, ErrorType.INTERNAL_ERROR, e);
            }

            stats.recordAttempt(ticker.nanoTime());
            try {
                T result = call.get();
                stats.successfulCalls.incrementAndGet();
                return result;
            } catch (AgentNetworkException e) {
                ErrorType errorType = e.getErrorType();
                if (!errorType.isTransient()) {
                    stats.failedCalls.incrementAndGet();
                    throw e;
                }
                if (errorType == ErrorType.RATE_LIMITED) {
                    stats.rateLimitHits.incrementAndGet();
                }
                if (retry >= target.maxRetries()) {
                    stats.failedCalls.incrementAndGet();
                    log.warn("Retries exhausted: endpoint={}, attempts={}, errorType={}",
                            endpoint, retry + 1, errorType);
                    throw new RateLimitExceededException(endpoint, retry + 1, errorType, e);
                }

                Duration delay = backoffPolicy.delayFor(retry);
                retry++;
                stats.retries.incrementAndGet();
                stats.waitSeconds.add(delay.toNanos() / 1e9);

                log.warn("Transient failure, backing off: endpoint={}, retry={}/{}, errorType={}, delayMs={}",
                        endpoint, retry, target.maxRetries(), errorType, delay.toMillis());

                try {
                    ticker.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new RateLimitExceededException(endpoint, retry, errorType, e);
                }
            } catch (RuntimeException e) {
                stats.failedCalls.incrementAndGet();
                throw e;
            }
        }
    }

    /**
     * Snapshot of call metrics for every endpoint, sorted by name.
     */
    public Map<String, EndpointMetrics> getCallMetrics() {
        Map<String, EndpointMetrics> snapshot = new TreeMap<>();
        long now = ticker.nanoTime();
        counters.forEach((name, stats) -> snapshot.put(name, stats.snapshot(name, now)));
        return snapshot;
    }

    public EndpointMetrics getCallMetrics(String endpoint) {
        return counters(endpoint).snapshot(endpoint, ticker.nanoTime());
    }

    private Endpoint endpoint(String name) {
        return endpoints.computeIfAbsent(name, k -> {
            log.warn("Rate limit endpoint not configured, using defaults: name={}, maxTokens={}, refillRate={}, maxRetries={}",
                    k, DEFAULT_MAX_TOKENS, DEFAULT_REFILL_RATE, DEFAULT_MAX_RETRIES);
            counters.computeIfAbsent(k, c -> new Counters());
            return new Endpoint(new TokenBucket(k, DEFAULT_MAX_TOKENS, DEFAULT_REFILL_RATE, ticker), DEFAULT_MAX_RETRIES);
        });
    }

    private Counters counters(String name) {
        return counters.computeIfAbsent(name, k -> new Counters());
    }

    private record Endpoint(TokenBucket bucket, int maxRetries) {
    }

    private static final class Counters {
        final AtomicLong totalCalls = new AtomicLong();
        final AtomicLong successfulCalls = new AtomicLong();
        final AtomicLong failedCalls = new AtomicLong();
        final AtomicLong retries = new AtomicLong();
        final AtomicLong rateLimitHits = new AtomicLong();
        final DoubleAdder waitSeconds = new DoubleAdder();

        // Attempt timestamps within the last minute, oldest first
        private final Deque<Long> recentAttempts = new ArrayDeque<>();

        void recordAttempt(long nowNanos) {
            totalCalls.incrementAndGet();
            synchronized (recentAttempts) {
                recentAttempts.addLast(nowNanos);
                prune(nowNanos);
            }
        }

        private long attemptsSince(long nowNanos) {
            synchronized (recentAttempts) {
                prune(nowNanos);
                return recentAttempts.size();
            }
        }

        private void prune(long nowNanos) {
            while (!recentAttempts.isEmpty() && nowNanos - recentAttempts.peekFirst() >= MINUTE_NANOS) {
                recentAttempts.removeFirst();
            }
        }

        EndpointMetrics snapshot(String name, long nowNanos) {
            long succeeded = successfulCalls.get();
            long failed = failedCalls.get();
            long finished = succeeded + failed;
            return new EndpointMetrics(
                    name,
                    totalCalls.get(),
                    succeeded,
                    failed,
                    finished == 0 ? 100.0 : succeeded * 100.0 / finished,
                    attemptsSince(nowNanos),
                    retries.get(),
                    rateLimitHits.get(),
                    waitSeconds.sum());
        }
    }
}
