package fr.lapetina.agentnetwork.infrastructure.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket admission control for one endpoint.
 *
 * Tokens refill continuously at {@code refillRate} per second, capped at {@code maxTokens}.
 * Accounting and the grant decision happen under one fair lock. A caller that has to
 * wait keeps the lock while it sleeps, so waiters are served strictly in arrival order
 * and the token count never leaves {@code [0, maxTokens]}.
 */
public final class TokenBucket {

    private static final Logger log = LoggerFactory.getLogger(TokenBucket.class);
    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final String name;
    private final double maxTokens;
    private final double refillRate;
    private final Ticker ticker;
    private final ReentrantLock lock = new ReentrantLock(true);

    // Guarded by lock
    private double currentTokens;
    private long lastRefillNanos;

    public TokenBucket(String name, double maxTokens, double refillRate, Ticker ticker) {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
        if (refillRate <= 0) {
            throw new IllegalArgumentException("refillRate must be positive: " + refillRate);
        }
        this.name = name;
        this.maxTokens = maxTokens;
        this.refillRate = refillRate;
        this.ticker = ticker;
        this.currentTokens = maxTokens;
        this.lastRefillNanos = ticker.nanoTime();
    }

    public TokenBucket(String name, double maxTokens, double refillRate) {
        this(name, maxTokens, refillRate, Ticker.SYSTEM);
    }

    /**
     * Takes one token, waiting for refill if needed.
     *
     * @return how long the caller was suspended, zero if a token was available
     */
    public Duration acquire() throws InterruptedException {
        return acquire(1);
    }

    /**
     * Takes {@code tokens} tokens, waiting for refill if needed.
     * Requests above {@code maxTokens} are granted after the full deficit has refilled.
     *
     * @return how long the caller was suspended, zero if the tokens were available
     */
    public Duration acquire(double tokens) throws InterruptedException {
        if (tokens <= 0) {
            throw new IllegalArgumentException("tokens must be positive: " + tokens);
        }

        lock.lockInterruptibly();
        try {
            refill();
            if (currentTokens >= tokens) {
                currentTokens -= tokens;
                return Duration.ZERO;
            }

            double deficit = tokens - currentTokens;
            Duration wait = Duration.ofNanos((long) Math.ceil(deficit / refillRate * NANOS_PER_SECOND));

            log.debug("Token bucket exhausted, waiting: endpoint={}, requested={}, available={}, waitMs={}",
                    name, tokens, currentTokens, wait.toMillis());

            ticker.sleep(wait);

            // Everything refilled during the wait went to this caller
            currentTokens = 0;
            lastRefillNanos = Math.max(lastRefillNanos, ticker.nanoTime());
            return wait;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current token count after applying refill.
     */
    public double availableTokens() {
        lock.lock();
        try {
            refill();
            return currentTokens;
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public double getMaxTokens() {
        return maxTokens;
    }

    public double getRefillRate() {
        return refillRate;
    }

    private void refill() {
        long now = ticker.nanoTime();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        currentTokens = Math.min(maxTokens, currentTokens + elapsed / NANOS_PER_SECOND * refillRate);
        lastRefillNanos = now;
    }

    @Override
    public String toString() {
        return "TokenBucket{" +
                "name='" + name + '\'' +
                ", maxTokens=" + maxTokens +
                ", refillRate=" + refillRate +
                '}';
    }
}
