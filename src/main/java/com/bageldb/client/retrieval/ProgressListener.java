package com.bageldb.client.retrieval;

/**
 * Observes the progress of a bulk retrieval. Purely informational: nothing a
 * listener does changes the outcome.
 *
 * <p>Each retrieval call gets its own {@link CallProgress} from {@link #onStart},
 * so one listener can serve overlapping calls, including calls on the same collection.
 * In concurrent mode {@link CallProgress#onPageSettled} is invoked from fetch worker
 * threads, so implementations must be thread-safe.
 */
public interface ProgressListener {

    /**
     * A listener that ignores every event.
     */
    ProgressListener NONE = new ProgressListener() {
    };

    /**
     * Called once per call, after page 1 revealed how many pages the query spans.
     *
     * @return the handle that receives the rest of this call's events
     */
    default CallProgress onStart(String collectionName, int totalPages) {
        return CallProgress.NONE;
    }

    /**
     * Called instead of {@link #onStart} when page 1 itself could not be fetched.
     */
    default void onFirstPageFailed(String collectionName, Throwable error) {
    }

    /**
     * Progress of one retrieval call.
     */
    interface CallProgress {

        CallProgress NONE = new CallProgress() {
        };

        /**
         * Called once per settled page fetch, whether it succeeded or not.
         */
        default void onPageSettled(int pageNumber, boolean success) {
        }

        /**
         * Called exactly once when the call ends, whether or not it completed.
         *
         * @param complete true only if every page was fetched
         */
        default void onFinished(boolean complete) {
        }
    }
}
