package com.lexicon.enrichment.api;

import java.util.List;

/**
 * A page of results from a range-paginated read.
 * The store reports no totals; a page shorter than its request is the last one.
 *
 * @param content the content of this page
 * @param request the request that produced it
 * @param <T>     the element type
 */
public record Page<T>(List<T> content, PageRequest request) {

    public Page {
        content = content != null ? List.copyOf(content) : List.of();
        if (request == null) {
            throw new IllegalArgumentException("request is required");
        }
    }

    /**
     * Whether another read may return more rows.
     */
    public boolean hasNext() {
        return content.size() >= request.limit();
    }

    public int numberOfElements() {
        return content.size();
    }

    public boolean hasContent() {
        return !content.isEmpty();
    }

    /**
     * Slices an in-memory list the way a store applies SKIP/LIMIT.
     */
    public static <T> Page<T> slice(List<T> all, PageRequest request) {
        if (request.offset() >= all.size()) {
            return new Page<>(List.of(), request);
        }
        int end = (int) Math.min((long) request.offset() + request.limit(), all.size());
        return new Page<>(all.subList(request.offset(), end), request);
    }

    public static <T> Page<T> empty(PageRequest request) {
        return new Page<>(List.of(), request);
    }
}
