package com.sandwich.orchestrator.source;

import com.google.common.util.concurrent.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Per-source request limits on top of Guava's {@link RateLimiter}.
 *
 * Every source owns its own limiter; waiting on one never delays another.
 */
final class SourceRateLimits {

    private static final Logger log = LoggerFactory.getLogger(SourceRateLimits.class);

    private SourceRateLimits() {}

    /** A limiter handing out {@code maxPerMinute} permits per minute, evenly spaced. */
    static RateLimiter perMinute(int maxPerMinute) {
        if (maxPerMinute <= 0) {
            throw new IllegalArgumentException("maxPerMinute must be positive, got " + maxPerMinute);
        }
        return RateLimiter.create(maxPerMinute / 60.0);
    }

    /**
     * Block until {@code limiter} grants the next request.
     *
     * @return seconds spent waiting
     */
    static double acquire(RateLimiter limiter, String source) {
        double waited = limiter.acquire();
        if (waited > 0) {
            log.debug("Source '{}' waited {}s for its rate limit", source, String.format(Locale.ROOT, "%.2f", waited));
        }
        return waited;
    }
}
