package io.relata.orm.query;

import java.util.List;
import java.util.Objects;

public record PaginatedResult<T>(List<T> data, Pagination pagination) {
  public PaginatedResult {
    data = data == null ? List.of() : List.copyOf(data);
    Objects.requireNonNull(pagination, "pagination");
  }
}
