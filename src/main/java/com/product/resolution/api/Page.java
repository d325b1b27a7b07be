package com.product.resolution.api;

import java.util.List;

/**
 * One page of a paginated query.
 *
 * @param content       items on this page
 * @param totalElements number of items across all pages
 * @param pageNumber    0-based page index
 * @param pageSize      requested page size
 */
public record Page<T>(List<T> content, long totalElements, int pageNumber, int pageSize) {

    public Page {
        content = content != null ? List.copyOf(content) : List.of();
        if (totalElements < 0) {
            throw new IllegalArgumentException("totalElements must be >= 0");
        }
    }

    /**
     * Cuts a page out of a fully materialized, already ordered list.
     */
    public static <T> Page<T> slice(List<T> all, PageRequest request) {
        int total = all.size();
        int from = Math.min(request.offset(), total);
        int to = Math.min(request.offset() + request.limit(), total);
        return new Page<>(all.subList(from, to), total, request.pageNumber(), request.limit());
    }

    public boolean hasNext() {
        return (long) (pageNumber + 1) * pageSize < totalElements;
    }

    public int totalPages() {
        return pageSize == 0 ? 0 : (int) Math.ceil((double) totalElements / pageSize);
    }
}
