package fr.lapetina.agentnetwork.infrastructure.ratelimit;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff: {@code base * 2^retry}, capped at {@code maxDelay}, then scaled by a
 * jitter factor drawn from {@code [jitterMin, jitterMax]}.
 */
public final class BackoffPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterMin;
    private final double jitterMax;
    private final DoubleSupplier random;

    public BackoffPolicy(Duration baseDelay, Duration maxDelay, double jitterMin, double jitterMax) {
        this(baseDelay, maxDelay, jitterMin, jitterMax, () -> ThreadLocalRandom.current().nextDouble());
    }

    BackoffPolicy(Duration baseDelay, Duration maxDelay, double jitterMin, double jitterMax, DoubleSupplier random) {
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Backoff delays must not be negative");
        }
        if (jitterMin <= 0 || jitterMax < jitterMin) {
            throw new IllegalArgumentException(
                    "Invalid jitter range: [" + jitterMin + ", " + jitterMax + "]");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitterMin = jitterMin;
        this.jitterMax = jitterMax;
        this.random = random;
    }

    /**
     * 1s base, 60s cap, jitter 0.9 to 1.1.
     */
    public static BackoffPolicy defaults() {
        return new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), 0.9, 1.1);
    }

    /**
     * No jitter; delays are exact powers of two of the base.
     */
    public static BackoffPolicy fixed(Duration baseDelay, Duration maxDelay) {
        return new BackoffPolicy(baseDelay, maxDelay, 1.0, 1.0);
    }

    /**
     * Delay before retry number {@code retry} (0-based).
     */
    public Duration delayFor(int retry) {
        int exponent = Math.min(Math.max(retry, 0), 30);
        double raw = baseDelay.toMillis() * Math.pow(2, exponent);
        double capped = Math.min(raw, maxDelay.toMillis());
        double jitter = jitterMin + (jitterMax - jitterMin) * random.getAsDouble();
        return Duration.ofMillis(Math.round(capped * jitter));
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }
}
