package com.bageldb.client.error;

import java.time.Duration;

/**
 * Thrown (or reported on a partial result) when a retrieval runs past its call deadline.
 */
public class RetrievalDeadlineExceededException extends CollectionClientException {

    private final Duration deadline;

    public RetrievalDeadlineExceededException(Duration deadline) {
        super("Retrieval did not finish within " + deadline);
        this.deadline = deadline;
    }

    public RetrievalDeadlineExceededException(Duration deadline, Throwable cause) {
        super("Retrieval did not finish within " + deadline, cause);
        this.deadline = deadline;
    }

    public Duration getDeadline() {
        return deadline;
    }
}
