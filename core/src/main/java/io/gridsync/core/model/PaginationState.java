package io.gridsync.core.model;

/**
 * Pagination position.
 *
 * @param pageSize    rows per page
 * @param currentPage zero-based current page
 * @param totalPages  page count at capture time
 */
public record PaginationState(Integer pageSize, Integer currentPage, Integer totalPages) {}
