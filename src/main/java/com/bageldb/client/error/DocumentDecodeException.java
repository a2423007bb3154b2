package com.bageldb.client.error;

/**
 * Thrown when a page answered 200 but its body is not a JSON array of documents.
 * Never retried.
 */
public class DocumentDecodeException extends PageFailureException {

    public DocumentDecodeException(int pageNumber, String message) {
        super(pageNumber, message);
    }

    public DocumentDecodeException(int pageNumber, String message, Throwable cause) {
        super(pageNumber, message, cause);
    }
}
