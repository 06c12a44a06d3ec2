package com.positionalert.engine.domain.marketdata;

import com.positionalert.engine.domain.exceptions.RateLimitTimeoutException;
import io.github.resilience4j.core.exception.AcquirePermissionCancelledException;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide gate admitting at most N provider requests per second.
 *
 * <p>Backed by a Resilience4j limiter handing out one permit per {@code 1/N} second period,
 * so M acquisitions on a fresh limiter take at least {@code (M-1)/N} seconds. A caller that
 * would wait longer than the maximum wait is refused with {@link RateLimitTimeoutException}
 * and reserves nothing.
 */
public class RateLimiter {

    private static final long NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    private final io.github.resilience4j.ratelimiter.RateLimiter delegate;
    private final Duration interval;
    private final Duration maxWait;

    public RateLimiter(int permitsPerSecond, Duration maxWait) {
        if (permitsPerSecond < 1) {
            throw new IllegalArgumentException("permitsPerSecond must be positive: " + permitsPerSecond);
        }
        this.interval = Duration.ofNanos((NANOS_PER_SECOND + permitsPerSecond - 1) / permitsPerSecond);
        this.maxWait = maxWait;
        this.delegate = io.github.resilience4j.ratelimiter.RateLimiter.of("market-data", RateLimiterConfig.custom()
                .limitForPeriod(1)
                .limitRefreshPeriod(interval)
                .timeoutDuration(maxWait)
                .build());
    }

    /** Blocks until the caller's slot arrives. */
    public void acquire() {
        try {
            io.github.resilience4j.ratelimiter.RateLimiter.waitForPermission(delegate);
        } catch (AcquirePermissionCancelledException e) {
            Thread.currentThread().interrupt();
            throw RateLimitTimeoutException.interrupted();
        } catch (RequestNotPermitted e) {
            throw RateLimitTimeoutException.waitExceeded(maxWait);
        }
    }

    public Duration interval() {
        return interval;
    }
}
