package com.bageldb.client.error;

/**
 * A failure scoped to a single page of a bulk retrieval.
 *
 * <p>The sequential strategy turns these into a partial result; the concurrent
 * strategy fails the whole call with them.
 */
public abstract class PageFailureException extends CollectionClientException {

    private final int pageNumber;

    protected PageFailureException(int pageNumber, String message) {
        super(message);
        this.pageNumber = pageNumber;
    }

    protected PageFailureException(int pageNumber, String message, Throwable cause) {
        super(message, cause);
        this.pageNumber = pageNumber;
    }

    public int getPageNumber() {
        return pageNumber;
    }
}
