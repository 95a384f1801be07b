package com.catalog.reconciliation.api;

import java.util.List;

/**
 * One page of a paginated listing.
 *
 * @param content       elements on this page
 * @param totalElements elements across all pages
 * @param pageNumber    0-based page number
 * @param pageSize      requested page size
 */
public record Page<T>(List<T> content, long totalElements, int pageNumber, int pageSize) {

    public Page {
        content = content != null ? List.copyOf(content) : List.of();
        if (totalElements < 0) {
            throw new IllegalArgumentException("totalElements must be >= 0");
        }
    }

    public boolean hasNext() {
        return (long) (pageNumber + 1) * pageSize < totalElements;
    }

    public int totalPages() {
        return pageSize == 0 ? 0 : (int) Math.ceil((double) totalElements / pageSize);
    }

    /**
     * Slices {@code all} according to {@code request}.
     */
    public static <T> Page<T> of(List<T> all, PageRequest request) {
        int total = all.size();
        int from = Math.min(request.offset(), total);
        int to = Math.min(request.offset() + request.limit(), total);
        return new Page<>(all.subList(from, to), total, request.pageNumber(), request.limit());
    }
}
