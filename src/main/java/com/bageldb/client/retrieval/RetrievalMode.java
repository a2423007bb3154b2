package com.bageldb.client.retrieval;

import com.bageldb.client.query.PredicateStyle;

/**
 * The two bulk-retrieval strategies.
 */
public enum RetrievalMode {

    /**
     * Page by page in increasing order; a failing page ends the retrieval with a partial result.
     */
    SEQUENTIAL(PredicateStyle.REPEATED),

    /**
     * Bounded-parallel fetches merged back into page order; a failing page fails the call.
     */
    CONCURRENT(PredicateStyle.JOINED);

    private final PredicateStyle predicateStyle;

    RetrievalMode(PredicateStyle predicateStyle) {
        this.predicateStyle = predicateStyle;
    }

    public PredicateStyle predicateStyle() {
        return predicateStyle;
    }
}
