package com.supplier.catalog.api;

import java.util.List;

/**
 * One page of a paginated listing, such as the match review queue.
 *
 * @param content       page content (copied)
 * @param totalElements total number of elements across all pages
 * @param pageNumber    0-based page number
 * @param pageSize      requested page size
 * @param <T>           element type
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
     * Cuts one page out of an already sorted list.
     */
    public static <T> Page<T> of(List<T> sorted, PageRequest request) {
        int total = sorted.size();
        int from = Math.min(request.offset(), total);
        int to = Math.min(request.offset() + request.limit(), total);
        return new Page<>(sorted.subList(from, to), total, request.pageNumber(), request.limit());
    }

    public static <T> Page<T> empty(PageRequest request) {
        return new Page<>(List.of(), 0, request.pageNumber(), request.limit());
    }
}
