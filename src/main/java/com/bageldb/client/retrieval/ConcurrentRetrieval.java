package com.bageldb.client.retrieval;

import com.bageldb.client.error.RetrievalDeadlineExceededException;
import com.bageldb.client.fetch.PageFetcher;
import com.bageldb.client.model.PageRequest;
import com.bageldb.client.model.PageResult;
import com.bageldb.client.model.ProbeResult;
import com.bageldb.client.model.RetrievalResult;
import com.bageldb.client.query.EncodedQuery;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Fetches the pages of a query in parallel, at most {@code maxConcurrency} at a time,
 * and merges them back into page order.
 *
 * <p>How a call runs:
 * <ol>
 *   <li>A fixed pool of {@code maxConcurrency} threads is created for this call only.</li>
 *   <li>Page 1 is probed to learn the page count; its documents are kept.</li>
 *   <li>Pages {@code 2..n} are dispatched with {@link Flux#flatMap(java.util.function.Function, int)},
 *       each writing its own slot of an array indexed by page number.</li>
 *   <li>Once every page has settled the slots are concatenated in index order.</li>
 *   <li>The pool is shut down, interrupting anything still in flight.</li>
 * </ol>
 *
 * <p>The first failing page fails the whole call: the remaining fetches are
 * cancelled and the page's exception is rethrown. A configured deadline is
 * enforced the same way and surfaces as {@link RetrievalDeadlineExceededException}.
 *
 * <p>Example:
 * <pre>{@code
 * ConcurrentRetrieval concurrent = new ConcurrentRetrieval(fetcher, 10, ProgressListener.NONE, null);
 * RetrievalResult result = concurrent.retrieve(encoder.encode(query, PredicateStyle.JOINED));
 * }</pre>
 */
public class ConcurrentRetrieval {

    private static final Logger logger = LoggerFactory.getLogger(ConcurrentRetrieval.class);

    private final PageFetcher fetcher;
    private final PageProber prober;
    private final int maxConcurrency;
    private final ProgressListener progressListener;
    private final Duration deadline;

    /**
     * @param maxConcurrency upper bound on in-flight page fetches
     * @param deadline upper bound for one call, or null for none
     */
    public ConcurrentRetrieval(PageFetcher fetcher, int maxConcurrency,
                               ProgressListener progressListener, Duration deadline) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1, was " + maxConcurrency);
        }
        this.fetcher = fetcher;
        this.prober = new PageProber(fetcher);
        this.maxConcurrency = maxConcurrency;
        this.progressListener = progressListener;
        this.deadline = deadline;
    }

    /**
     * Retrieves every page, blocking until all of them have settled.
     *
     * @throws com.bageldb.client.error.CollectionClientException if any page fails
     */
    public RetrievalResult retrieve(EncodedQuery encoded) {
        return retrieveMono(encoded).block();
    }

    /**
     * Starts the retrieval without blocking. Cancelling the returned future
     * cancels the in-flight fetches.
     */
    public CompletableFuture<RetrievalResult> retrieveAsync(EncodedQuery encoded) {
        CompletableFuture<RetrievalResult> future = new CompletableFuture<>();
        Disposable subscription = retrieveMono(encoded).subscribe(future::complete, future::completeExceptionally);
        future.whenComplete((result, error) -> {
            if (future.isCancelled()) {
                logger.debug("Retrieval of {} cancelled by caller", encoded.collectionName());
                subscription.dispose();
            }
        });
        return future;
    }

    /**
     * The retrieval as a lazy {@link Mono}; nothing is fetched until it is subscribed.
     */
    public Mono<RetrievalResult> retrieveMono(EncodedQuery encoded) {
        Mono<RetrievalResult> retrieval = Mono.using(
                () -> Executors.newFixedThreadPool(maxConcurrency, new FetchThreadFactory(encoded.collectionName())),
                executor -> {
                    Scheduler scheduler = Schedulers.fromExecutorService(executor);
                    return Mono.fromCallable(() -> prober.probe(encoded))
                            .subscribeOn(scheduler)
                            .doOnError(e -> progressListener.onFirstPageFailed(encoded.collectionName(), e))
                            .flatMap(probe -> fetchRemaining(encoded, probe, scheduler));
                },
                ExecutorService::shutdownNow
        );

        if (deadline == null) {
            return retrieval;
        }
        return retrieval
                .timeout(deadline)
                .onErrorMap(TimeoutException.class, e -> new RetrievalDeadlineExceededException(deadline, e));
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    private Mono<RetrievalResult> fetchRemaining(EncodedQuery encoded, ProbeResult probe, Scheduler scheduler) {
        String collection = encoded.collectionName();
        int totalPages = probe.totalPages();
        ProgressListener.CallProgress progress = progressListener.onStart(collection, totalPages);

        if (totalPages == 0) {
            progress.onFinished(true);
            return Mono.just(RetrievalResult.complete(List.of(), 0));
        }
        progress.onPageSettled(1, true);
        if (totalPages == 1) {
            progress.onFinished(true);
            return Mono.just(RetrievalResult.complete(probe.firstPageItems(), 1));
        }

        AtomicReferenceArray<PageResult> slots = new AtomicReferenceArray<>(totalPages);
        slots.set(0, new PageResult(1, probe.firstPageItems()));

        return Flux.range(2, totalPages - 1)
                .map(encoded::pageRequest)
                .flatMap(request -> fetchInto(slots, request, collection, progress, scheduler), maxConcurrency)
                .then(Mono.fromCallable(() -> merge(slots, totalPages, collection)))
                .doOnSuccess(result -> progress.onFinished(true))
                .doOnError(e -> progress.onFinished(false))
                .doOnCancel(() -> progress.onFinished(false));
    }

    private Mono<PageResult> fetchInto(AtomicReferenceArray<PageResult> slots, PageRequest request,
                                       String collection, ProgressListener.CallProgress progress,
                                       Scheduler scheduler) {
        return Mono.fromCallable(() -> fetcher.fetch(request).toResult())
                .subscribeOn(scheduler)
                .doOnSuccess(page -> {
                    slots.set(page.pageNumber() - 1, page);
                    progress.onPageSettled(page.pageNumber(), true);
                })
                .doOnError(e -> {
                    logger.warn("Page {} of {} failed, cancelling the retrieval: {}",
                            request.pageNumber(), collection, e.getMessage());
                    progress.onPageSettled(request.pageNumber(), false);
                });
    }

    private RetrievalResult merge(AtomicReferenceArray<PageResult> slots, int totalPages, String collection) {
        List<JsonNode> items = new ArrayList<>();
        for (int i = 0; i < totalPages; i++) {
            PageResult page = slots.get(i);
            if (page == null) {
                throw new IllegalStateException("Page " + (i + 1) + " of " + collection + " never settled");
            }
            items.addAll(page.items());
        }
        logger.debug("Fetched {} items from {} pages of {}", items.size(), totalPages, collection);
        return RetrievalResult.complete(items, totalPages);
    }

    private static final class FetchThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private FetchThreadFactory(String collection) {
            this.prefix = "bageldb-fetch-" + collection + "-";
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
