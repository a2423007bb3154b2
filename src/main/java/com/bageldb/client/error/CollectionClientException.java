package com.bageldb.client.error;

/**
 * Base type for every failure raised by the collection client.
 *
 * <p>Caller mistakes (blank collection name, malformed predicate) are not
 * represented here; they surface as {@link IllegalArgumentException} or
 * {@link NullPointerException} before anything is sent.
 */
public class CollectionClientException extends RuntimeException {

    public CollectionClientException(String message) {
        super(message);
    }

    public CollectionClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
