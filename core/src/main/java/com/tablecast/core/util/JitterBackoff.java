package com.tablecast.core.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Jittered exponential backoff used when an external feed has to be re-subscribed.
 * <p>
 * <b>Formula:</b> {@code t = min(max, base * 2^attempt) + uniform(0, jitterMax)}
 * </p>
 */
public final class JitterBackoff {
    private JitterBackoff() {
    }

    /**
     * Computes the delay before the next attempt.
     *
     * @param attempt   attempt number (0-based)
     * @param base      first delay
     * @param max       cap before jitter
     * @param jitterMax upper bound of the random component
     * @return delay, never shorter than {@code min(base, max)}
     */
    public static Duration next(long attempt, Duration base, Duration max, Duration jitterMax) {
        long expMs = base.toMillis() * (1L << Math.min(attempt, 20));
        long cappedMs = Math.min(expMs, max.toMillis());
        long jitterMs = jitterMax.isZero() ? 0 : ThreadLocalRandom.current().nextLong(jitterMax.toMillis() + 1);
        return Duration.ofMillis(cappedMs + jitterMs);
    }

    /**
     * Defaults for change-feed reconnects: 500ms base, 30s cap, 1s jitter.
     */
    public static Duration next(long attempt) {
        return next(attempt, Duration.ofMillis(500), Duration.ofSeconds(30), Duration.ofSeconds(1));
    }
}
