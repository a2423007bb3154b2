package com.bageldb.client.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Logs a line per settled page, e.g. {@code Getting articles pages: 3/12}.
 *
 * <p>Counters live in the per-call handle, so nothing is retained once a call ends.
 */
public class LoggingProgressListener implements ProgressListener {

    private static final Logger logger = LoggerFactory.getLogger(LoggingProgressListener.class);

    @Override
    public CallProgress onStart(String collectionName, int totalPages) {
        logger.info("Getting {} pages: 0/{}", collectionName, totalPages);
        return new LoggedCallProgress(collectionName, totalPages);
    }

    @Override
    public void onFirstPageFailed(String collectionName, Throwable error) {
        logger.info("Getting {} pages: page 1 failed ({})", collectionName, error.getMessage());
    }

    static final class LoggedCallProgress implements CallProgress {
        private final String collectionName;
        private final int totalPages;
        private final AtomicInteger settled = new AtomicInteger();
        private final AtomicBoolean finished = new AtomicBoolean();

        private LoggedCallProgress(String collectionName, int totalPages) {
            this.collectionName = collectionName;
            this.totalPages = totalPages;
        }

        @Override
        public void onPageSettled(int pageNumber, boolean success) {
            int count = settled.incrementAndGet();
            if (success) {
                logger.info("Getting {} pages: {}/{}", collectionName, count, totalPages);
            } else {
                logger.info("Getting {} pages: {}/{} (page {} failed)",
                        collectionName, count, totalPages, pageNumber);
            }
        }

        @Override
        public void onFinished(boolean complete) {
            if (finished.compareAndSet(false, true) && !complete) {
                logger.info("Getting {} pages: stopped at {}/{}", collectionName, settled.get(), totalPages);
            }
        }

        int settled() {
            return settled.get();
        }

        boolean isFinished() {
            return finished.get();
        }
    }
}
