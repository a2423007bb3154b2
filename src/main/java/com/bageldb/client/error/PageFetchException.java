package com.bageldb.client.error;

import java.util.OptionalInt;

/**
 * Thrown when a page could not be fetched: the backend answered with a
 * status other than 200, or the transport kept failing until the retry
 * budget ran out.
 */
public class PageFetchException extends PageFailureException {

    private final int statusCode;
    private final int attempts;
    private final String responseBody;

    private PageFetchException(int pageNumber, String message, int statusCode, int attempts,
                               String responseBody, Throwable cause) {
        super(pageNumber, message, cause);
        this.statusCode = statusCode;
        this.attempts = attempts;
        this.responseBody = responseBody;
    }

    /**
     * Creates the exception for an unexpected HTTP status.
     */
    public static PageFetchException forStatus(int pageNumber, int statusCode, String responseBody) {
        return new PageFetchException(
                pageNumber,
                "Page " + pageNumber + " failed with HTTP " + statusCode,
                statusCode,
                1,
                responseBody,
                null
        );
    }

    /**
     * Creates the exception for a transport failure that outlived the retry budget.
     */
    public static PageFetchException retriesExhausted(int pageNumber, int attempts, Throwable lastFailure) {
        return new PageFetchException(
                pageNumber,
                "Page " + pageNumber + " failed after " + attempts + " attempts",
                -1,
                attempts,
                null,
                lastFailure
        );
    }

    /**
     * Returns the HTTP status, or empty when no response was ever received.
     */
    public OptionalInt getStatusCode() {
        return statusCode < 0 ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }

    public int getAttempts() {
        return attempts;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
