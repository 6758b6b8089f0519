package io.b2mash.timetracker.pagination;

import io.b2mash.timetracker.exception.InvalidRequestException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * A validated one-based page request. Construction rejects {@code page < 1}, {@code size < 1},
 * {@code size > MAX_SIZE} and offsets beyond {@link #MAX_OFFSET}, so every instance maps to a
 * legal store query.
 */
public record PageQuery(int page, int size) {

  public static final int DEFAULT_PAGE = 1;
  public static final int DEFAULT_SIZE = 5;
  public static final int MAX_SIZE = 100;

  /** JPA addresses the first result with an {@code int}. */
  public static final long MAX_OFFSET = Integer.MAX_VALUE;

  public PageQuery {
    if (page < 1) {
      throw new InvalidRequestException(
          "Invalid page request", "Page must be 1 or greater but was " + page);
    }
    if (size < 1 || size > MAX_SIZE) {
      throw new InvalidRequestException(
          "Invalid page request",
          "Page size must be between 1 and " + MAX_SIZE + " but was " + size);
    }
    if ((long) (page - 1) * size > MAX_OFFSET) {
      throw new InvalidRequestException(
          "Invalid page request",
          "Page " + page + " of size " + size + " starts beyond the addressable range");
    }
  }

  public static PageQuery of(int page, int size) {
    return new PageQuery(page, size);
  }

  public static PageQuery firstPage() {
    return new PageQuery(DEFAULT_PAGE, DEFAULT_SIZE);
  }

  /** Number of records the store skips before taking {@link #size()}. */
  public long offset() {
    return (long) (page - 1) * size;
  }

  public Pageable toPageable(Sort sort) {
    return PageRequest.of(page - 1, size, sort);
  }
}
