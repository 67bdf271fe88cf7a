package io.relata.orm.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Substring search of one term over several text columns. */
public record SearchFilter(String term, List<String> columns) {
  public SearchFilter {
    Objects.requireNonNull(term, "term");
    columns = columns == null ? List.of() : List.copyOf(columns);
  }

  public static SearchFilter of(String term, String... columns) {
    return new SearchFilter(term, List.of(columns));
  }

  /** {@code col1 LIKE %term% OR col2 LIKE %term% ...}; no columns matches nothing. */
  public FilterOperator toFilterOperator() {
    String pattern = "%" + term + "%";
    List<FilterOperator> likes = new ArrayList<>(columns.size());
    for (String c : columns) likes.add(FilterOperator.single(Filter.like(c, pattern)));
    return new FilterOperator.Or(likes);
  }
}
