package com.bageldb.client.retrieval;

import com.bageldb.client.error.ProtocolContractException;
import com.bageldb.client.fetch.FetchedPage;
import com.bageldb.client.fetch.PageFetcher;
import com.bageldb.client.model.ProbeResult;
import com.bageldb.client.query.EncodedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches page 1 and derives the page count from its {@code item-count} header.
 */
public class PageProber {

    private static final Logger logger = LoggerFactory.getLogger(PageProber.class);

    public static final String ITEM_COUNT_HEADER = "item-count";

    /**
     * Largest page count a retrieval accepts. Every page is held in memory until the merge.
     */
    public static final int MAX_PAGES = 1_000_000;

    private final PageFetcher fetcher;

    public PageProber(PageFetcher fetcher) {
        this.fetcher = fetcher;
    }

    /**
     * Fetches page 1 of the query.
     *
     * @return page 1's documents with the total item and page counts
     * @throws ProtocolContractException if {@code item-count} is missing, not a number, negative,
     *         or implies more than {@link #MAX_PAGES} pages
     */
    public ProbeResult probe(EncodedQuery encoded) {
        FetchedPage firstPage = fetcher.fetch(encoded.pageRequest(1));

        String header = firstPage.response().firstHeader(ITEM_COUNT_HEADER)
                .orElseThrow(() -> new ProtocolContractException(
                        "Response for " + encoded.collectionName() + " has no " + ITEM_COUNT_HEADER + " header"));

        long itemCount;
        try {
            itemCount = Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            throw new ProtocolContractException(
                    ITEM_COUNT_HEADER + " header is not a number: '" + header + "'", e);
        }
        if (itemCount < 0) {
            throw new ProtocolContractException(ITEM_COUNT_HEADER + " header is negative: " + itemCount);
        }

        long pageCount = ProbeResult.pageCount(itemCount, encoded.pageSize());
        if (pageCount > MAX_PAGES) {
            throw new ProtocolContractException(ITEM_COUNT_HEADER + " header " + itemCount + " implies "
                    + pageCount + " pages of " + encoded.pageSize() + ", more than " + MAX_PAGES);
        }
        int totalPages = (int) pageCount;
        logger.debug("Collection {} reports {} items over {} pages of {}",
                encoded.collectionName(), itemCount, totalPages, encoded.pageSize());
        return new ProbeResult(firstPage.items(), itemCount, totalPages);
    }
}
