package com.bageldb.client.query;

/**
 * How several predicates are laid out in the query string.
 */
public enum PredicateStyle {

    /**
     * One {@code query=} parameter per predicate: {@code query=a:x&query=b:=:y}.
     */
    REPEATED,

    /**
     * A single {@code query=} parameter with terms separated by an encoded plus:
     * {@code query=a:x%2Bb:=:y}.
     */
    JOINED
}
