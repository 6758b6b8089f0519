package io.b2mash.timetracker.pagination;

import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * Turns a {@link PageQuery} into a store slice and wraps the projected result in a {@link
 * PagedResponse}. The projection receives the whole slice so it can batch-resolve related names.
 */
public final class Paginator {

  private static final Logger log = LoggerFactory.getLogger(Paginator.class);

  /** Stable order so consecutive pages partition the collection. */
  public static final Sort BY_ID = Sort.by(Sort.Direction.ASC, "id");

  private Paginator() {}

  public static <E, V> PagedResponse<V> paginate(
      PageQuery query,
      Function<Pageable, Page<E>> fetch,
      Function<List<E>, List<V>> projection) {
    Page<E> slice = fetch.apply(query.toPageable(BY_ID));
    log.debug(
        "Fetched page {} (offset {}, size {}): {} of {} records",
        query.page(),
        query.offset(),
        query.size(),
        slice.getNumberOfElements(),
        slice.getTotalElements());
    return PagedResponse.of(projection.apply(slice.getContent()), query, slice.getTotalElements());
  }

  /** Ceiling of {@code totalCount / pageSize}; zero for an empty collection. */
  public static long totalPages(long totalCount, int pageSize) {
    if (pageSize < 1) {
      throw new IllegalArgumentException("pageSize must be positive but was " + pageSize);
    }
    if (totalCount <= 0) {
      return 0;
    }
    return (totalCount - 1) / pageSize + 1;
  }
}
