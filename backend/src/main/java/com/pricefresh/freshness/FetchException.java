package com.pricefresh.freshness;

/**
 * A fetcher broke its contract (e.g. produced no value) or an upstream reported an error payload.
 */
public class FetchException extends RuntimeException {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
