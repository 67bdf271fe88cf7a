package io.relata.orm.query;

/**
 * A 1-based page window. {@code total} and {@code totalPages} are null until a count has been taken.
 */
public record Pagination(int page, int perPage, Long total, Long totalPages) {
  public Pagination {
    if (page < 1) throw new IllegalArgumentException("page must be >= 1");
    if (perPage < 1) throw new IllegalArgumentException("perPage must be >= 1");
    if (total != null && total < 0) throw new IllegalArgumentException("total must be >= 0");
  }

  public Pagination(int page, int perPage) {
    this(page, perPage, null, null);
  }

  public long offset() {
    return (long) (page - 1) * perPage;
  }

  public int limit() {
    return perPage;
  }

  public Pagination withTotal(long total) {
    if (total < 0) throw new IllegalArgumentException("total must be >= 0");
    long pages = (total + perPage - 1) / perPage;
    return new Pagination(page, perPage, total, pages);
  }
}
