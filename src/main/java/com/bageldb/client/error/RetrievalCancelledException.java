package com.bageldb.client.error;

/**
 * Thrown when the fetching thread is interrupted while a request or a retry
 * backoff is in progress.
 */
public class RetrievalCancelledException extends CollectionClientException {

    public RetrievalCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
