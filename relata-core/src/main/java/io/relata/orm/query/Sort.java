package io.relata.orm.query;

import java.util.Objects;

public record Sort(String column, SortOrder order) {
  public Sort {
    Objects.requireNonNull(column, "column");
    if (column.isBlank()) throw new IllegalArgumentException("sort column must not be blank");
    order = (order == null) ? SortOrder.ASC : order;
  }

  public static Sort asc(String column) {
    return new Sort(column, SortOrder.ASC);
  }

  public static Sort desc(String column) {
    return new Sort(column, SortOrder.DESC);
  }
}
