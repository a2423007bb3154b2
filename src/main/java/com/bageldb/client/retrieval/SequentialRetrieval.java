package com.bageldb.client.retrieval;

import com.bageldb.client.error.CollectionClientException;
import com.bageldb.client.error.PageFailureException;
import com.bageldb.client.error.RetrievalDeadlineExceededException;
import com.bageldb.client.fetch.PageFetcher;
import com.bageldb.client.model.ProbeResult;
import com.bageldb.client.model.RetrievalResult;
import com.bageldb.client.query.EncodedQuery;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetches the pages of a query one after another, in increasing order.
 *
 * <p>Lifecycle of a call:
 * <pre>
 * INIT -> PROBE_PAGE_ONE -> FETCH_NEXT (page 2..n) -> DONE
 *                 \               \
 *                  +---------------+--> ABORTED
 * </pre>
 * A page that fails (bad status, exhausted retries, undecodable body) or an
 * expired deadline moves the call to {@code ABORTED}: no later page is
 * requested and the documents gathered so far are returned together with the
 * failure.
 *
 * <p>Example:
 * <pre>{@code
 * RetrievalResult result = sequential.retrieve(encoder.encode(query, PredicateStyle.REPEATED));
 * if (result.isPartial()) {
 *     log.warn("stopped early", result.failure().get());
 * }
 * }</pre>
 */
public class SequentialRetrieval {

    private static final Logger logger = LoggerFactory.getLogger(SequentialRetrieval.class);

    enum State {
        INIT,
        PROBE_PAGE_ONE,
        FETCH_NEXT,
        DONE,
        ABORTED
    }

    private final PageFetcher fetcher;
    private final PageProber prober;
    private final ProgressListener progressListener;
    private final Duration deadline;

    /**
     * @param deadline upper bound for one call, or null for none
     */
    public SequentialRetrieval(PageFetcher fetcher, ProgressListener progressListener, Duration deadline) {
        this.fetcher = fetcher;
        this.prober = new PageProber(fetcher);
        this.progressListener = progressListener;
        this.deadline = deadline;
    }

    public RetrievalResult retrieve(EncodedQuery encoded) {
        long deadlineAt = deadline != null ? System.nanoTime() + deadline.toNanos() : 0L;
        String collection = encoded.collectionName();
        List<JsonNode> items = new ArrayList<>();
        int totalPages = 0;
        int pagesFetched = 0;
        int nextPage = 2;
        CollectionClientException failure = null;
        ProgressListener.CallProgress progress = ProgressListener.CallProgress.NONE;

        State state = State.INIT;
        while (true) {
            switch (state) {
                case INIT:
                    state = State.PROBE_PAGE_ONE;
                    break;

                case PROBE_PAGE_ONE:
                    try {
                        ProbeResult probe = prober.probe(encoded);
                        totalPages = probe.totalPages();
                        progress = progressListener.onStart(collection, totalPages);
                        if (totalPages > 0) {
                            items.addAll(probe.firstPageItems());
                            pagesFetched = 1;
                            progress.onPageSettled(1, true);
                        }
                        state = nextPage <= totalPages ? State.FETCH_NEXT : State.DONE;
                    } catch (PageFailureException e) {
                        progressListener.onFirstPageFailed(collection, e);
                        failure = e;
                        state = State.ABORTED;
                    }
                    break;

                case FETCH_NEXT:
                    if (deadline != null && System.nanoTime() - deadlineAt > 0) {
                        failure = new RetrievalDeadlineExceededException(deadline);
                        state = State.ABORTED;
                        break;
                    }
                    try {
                        items.addAll(fetcher.fetchPage(encoded.pageRequest(nextPage)));
                        pagesFetched++;
                        progress.onPageSettled(nextPage, true);
                        nextPage++;
                        state = nextPage <= totalPages ? State.FETCH_NEXT : State.DONE;
                    } catch (PageFailureException e) {
                        progress.onPageSettled(nextPage, false);
                        failure = e;
                        state = State.ABORTED;
                    }
                    break;

                case DONE:
                    logger.debug("Fetched {} items from {} pages of {}", items.size(), totalPages, collection);
                    progress.onFinished(true);
                    return RetrievalResult.complete(items, totalPages);

                case ABORTED:
                    logger.warn("Stopped fetching {} after {} of {} pages: {}",
                            collection, pagesFetched, totalPages, failure.getMessage());
                    progress.onFinished(false);
                    return RetrievalResult.partial(items, totalPages, pagesFetched, failure);

                default:
                    throw new IllegalStateException("Unknown state " + state);
            }
        }
    }
}
