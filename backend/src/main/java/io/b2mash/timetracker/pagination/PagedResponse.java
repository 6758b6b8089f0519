package io.b2mash.timetracker.pagination;

import java.util.List;

/**
 * One page of view models plus paging metadata. {@code totalCount} is the size of the whole
 * collection, not of this page.
 */
public record PagedResponse<T>(
    List<T> items, int page, int pageSize, long totalCount, long totalPages) {

  public static <T> PagedResponse<T> of(List<T> items, PageQuery query, long totalCount) {
    return new PagedResponse<>(
        List.copyOf(items),
        query.page(),
        query.size(),
        totalCount,
        Paginator.totalPages(totalCount, query.size()));
  }
}
