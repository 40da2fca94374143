package fr.lapetina.agentnetwork.infrastructure.ratelimit;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Monotonic clock plus sleep, so token refill and backoff can run on virtual time in tests.
 */
public interface Ticker {

    long nanoTime();

    void sleep(Duration duration) throws InterruptedException;

    Ticker SYSTEM = new Ticker() {
        @Override
        public long nanoTime() {
            return System.nanoTime();
        }

        @Override
        public void sleep(Duration duration) throws InterruptedException {
            if (!duration.isNegative() && !duration.isZero()) {
                TimeUnit.NANOSECONDS.sleep(duration.toNanos());
            }
        }
    };
}
