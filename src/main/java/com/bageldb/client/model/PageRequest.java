package com.bageldb.client.model;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A fully qualified request for one page.
 *
 * @param url the complete URL, query string included
 * @param pageNumber 1-based page number
 */
public record PageRequest(
        String url,
        int pageNumber
) {
    private static final String LEGAL_PUNCTUATION = "-._~:/?#[]@!$&'()*+,;=%";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    public PageRequest {
        Objects.requireNonNull(url, "url must not be null");
        if (pageNumber < 1) {
            throw new IllegalArgumentException("pageNumber must be at least 1, was " + pageNumber);
        }
    }

    /**
     * Returns the URL as a {@link URI}, percent-escaping characters that may not
     * appear in a URI (operators such as {@code >}, spaces in raw parameters).
     * Existing escapes are left alone.
     */
    public URI uri() {
        return URI.create(escapeIllegalCharacters(url));
    }

    static String escapeIllegalCharacters(String url) {
        StringBuilder escaped = null;
        for (int i = 0; i < url.length(); i++) {
            char c = url.charAt(i);
            if (isLegal(c)) {
                if (escaped != null) {
                    escaped.append(c);
                }
                continue;
            }
            if (escaped == null) {
                escaped = new StringBuilder(url.length() + 16).append(url, 0, i);
            }
            int end = Character.isHighSurrogate(c) && i + 1 < url.length() ? i + 2 : i + 1;
            for (byte b : url.substring(i, end).getBytes(StandardCharsets.UTF_8)) {
                escaped.append('%').append(HEX[(b >> 4) & 0xF]).append(HEX[b & 0xF]);
            }
            i = end - 1;
        }
        return escaped != null ? escaped.toString() : url;
    }

    private static boolean isLegal(char c) {
        return (c >= 'a' && c <= 'z')
                || (c >= 'A' && c <= 'Z')
                || (c >= '0' && c <= '9')
                || LEGAL_PUNCTUATION.indexOf(c) >= 0;
    }
}
