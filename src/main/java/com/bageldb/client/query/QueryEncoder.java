package com.bageldb.client.query;

import com.bageldb.client.model.CollectionQuery;
import com.bageldb.client.model.Predicate;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a {@link CollectionQuery} into the query string understood by the
 * collection API.
 *
 * <p>Parameters are appended in a fixed order so the output is deterministic:
 * <ol>
 *   <li>raw passthrough parameters, verbatim</li>
 *   <li>{@code projectOn=<comma-joined fields>}</li>
 *   <li>{@code query=} predicate terms, laid out per {@link PredicateStyle}</li>
 *   <li>{@code pageNumber} and {@code perPage}, added per page by {@link EncodedQuery}</li>
 * </ol>
 * The first parameter is introduced with {@code ?}, every other with {@code &}.
 * Predicate values are form-encoded ({@code "x y"} becomes {@code x+y}).
 *
 * <p>Example:
 * <pre>{@code
 * QueryEncoder encoder = new QueryEncoder("https://api.bagelstudio.co/api/public");
 * EncodedQuery encoded = encoder.encode(query, PredicateStyle.REPEATED);
 * PageRequest page3 = encoded.pageRequest(3);
 * }</pre>
 */
public class QueryEncoder {

    static final String PROJECT_ON = "projectOn";
    static final String QUERY = "query";
    static final String JOINED_TERM_SEPARATOR = URLEncoder.encode("+", StandardCharsets.UTF_8);

    private final String baseUrl;

    /**
     * @param baseUrl root of the API, e.g. {@code https://api.bagelstudio.co/api/public}
     */
    public QueryEncoder(String baseUrl) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl must not be null");
    }

    public EncodedQuery encode(CollectionQuery query, PredicateStyle style) {
        return new EncodedQuery(
                query.collectionName(),
                resourceUrl(query.collectionName()),
                encodeFragment(query, style),
                query.pageSize()
        );
    }

    /**
     * Returns {@code {baseUrl}/collection/{collectionName}/items}.
     */
    public String resourceUrl(String collectionName) {
        Objects.requireNonNull(collectionName, "collectionName must not be null");
        if (collectionName.isBlank()) {
            throw new IllegalArgumentException("collectionName must not be blank");
        }
        return baseUrl + "/collection/" + encodePathSegment(collectionName) + "/items";
    }

    /**
     * Encodes the filter part of the query string, without pagination parameters.
     *
     * @return the fragment including its leading {@code ?}, or an empty string
     */
    public static String encodeFragment(CollectionQuery query, PredicateStyle style) {
        List<String> params = new ArrayList<>(query.rawParams());

        if (!query.projection().isEmpty()) {
            params.add(PROJECT_ON + "=" + String.join(",", query.projection()));
        }

        if (!query.predicates().isEmpty()) {
            if (style == PredicateStyle.JOINED) {
                List<String> terms = new ArrayList<>();
                for (Predicate predicate : query.predicates()) {
                    terms.add(encodeTerm(predicate));
                }
                params.add(QUERY + "=" + String.join(JOINED_TERM_SEPARATOR, terms));
            } else {
                for (Predicate predicate : query.predicates()) {
                    params.add(QUERY + "=" + encodeTerm(predicate));
                }
            }
        }

        StringBuilder fragment = new StringBuilder();
        String symbol = "?";
        for (String param : params) {
            fragment.append(symbol).append(param);
            symbol = "&";
        }
        return fragment.toString();
    }

    /**
     * Encodes one predicate as {@code field:operator:value} or {@code field:value}.
     */
    public static String encodeTerm(Predicate predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        String value = URLEncoder.encode(predicate.value(), StandardCharsets.UTF_8);
        if (predicate instanceof Predicate.WithOperator withOperator) {
            return withOperator.field() + ":" + withOperator.operator() + ":" + value;
        }
        if (predicate instanceof Predicate.Implicit) {
            return predicate.field() + ":" + value;
        }
        throw new IllegalArgumentException("Unsupported predicate type: " + predicate.getClass().getName());
    }

    /**
     * Percent-encodes one path segment. Spaces become {@code %20}, never {@code +}.
     */
    public static String encodePathSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
