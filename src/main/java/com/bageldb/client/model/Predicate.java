package com.bageldb.client.model;

import java.util.Objects;

/**
 * A single server-side filter condition.
 *
 * <p>Two shapes exist: {@link WithOperator} is sent as {@code field:operator:value},
 * {@link Implicit} as {@code field:value} and lets the backend apply its default
 * equality operator.
 *
 * <pre>{@code
 * Predicate.of("author.itemRefID", "=", "5e89a0a573c14625b8850a05");
 * Predicate.of("status", "published");
 * }</pre>
 */
public interface Predicate {

    String field();

    String value();

    static Predicate of(String field, String operator, String value) {
        return new WithOperator(field, operator, value);
    }

    static Predicate of(String field, String value) {
        return new Implicit(field, value);
    }

    /**
     * Builds a predicate from the tuple form {@code (field, value)} or
     * {@code (field, operator, value)}.
     *
     * @throws IllegalArgumentException for any other number of parts
     */
    static Predicate fromParts(String... parts) {
        Objects.requireNonNull(parts, "parts must not be null");
        switch (parts.length) {
            case 2:
                return new Implicit(parts[0], parts[1]);
            case 3:
                return new WithOperator(parts[0], parts[1], parts[2]);
            default:
                throw new IllegalArgumentException(
                        "Predicate needs 2 or 3 parts (field[, operator], value), got " + parts.length);
        }
    }

    record WithOperator(String field, String operator, String value) implements Predicate {
        public WithOperator {
            requireField(field);
            Objects.requireNonNull(operator, "operator must not be null");
            if (operator.isEmpty()) {
                throw new IllegalArgumentException("operator must not be empty");
            }
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record Implicit(String field, String value) implements Predicate {
        public Implicit {
            requireField(field);
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    private static void requireField(String field) {
        Objects.requireNonNull(field, "field must not be null");
        if (field.isBlank()) {
            throw new IllegalArgumentException("field must not be blank");
        }
    }
}
