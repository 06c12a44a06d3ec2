package com.positionalert.engine.domain.exceptions;

import java.util.Optional;

/** Provider or network failure for one ticker. Never aborts the run. */
public class FetchException extends RuntimeException {

    private final Integer httpStatus;

    private FetchException(String message, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    public static FetchException forStatus(String ticker, int status) {
        return switch (status) {
            case 429 -> new FetchException("Provider rate limit exceeded for " + ticker, status, null);
            case 403 -> new FetchException(
                    "Provider authentication failed for " + ticker + ", check the API key", status, null);
            default -> new FetchException("Provider returned HTTP " + status + " for " + ticker, status, null);
        };
    }

    public static FetchException providerError(String ticker, String detail) {
        return new FetchException("Provider error for " + ticker + ": " + detail, null, null);
    }

    public static FetchException malformedPayload(String ticker, Throwable cause) {
        return new FetchException("Unreadable provider payload for " + ticker, null, cause);
    }

    public static FetchException network(String ticker, Throwable cause) {
        return new FetchException(
                "Network error fetching " + ticker + ": " + cause.getMessage(), null, cause);
    }

    public Optional<Integer> httpStatus() {
        return Optional.ofNullable(httpStatus);
    }
}
