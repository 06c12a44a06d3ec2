package com.positionalert.engine.domain.exceptions;

import java.time.Duration;

public class RateLimitTimeoutException extends RuntimeException {

    private RateLimitTimeoutException(String message) {
        super(message);
    }

    public static RateLimitTimeoutException waitExceeded(Duration maxWait) {
        return new RateLimitTimeoutException(
                "No rate limiter slot within max wait of " + maxWait.toMillis() + " ms");
    }

    public static RateLimitTimeoutException interrupted() {
        return new RateLimitTimeoutException("Interrupted while waiting for a rate limiter slot");
    }
}
