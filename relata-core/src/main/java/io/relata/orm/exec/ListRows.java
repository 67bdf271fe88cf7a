package io.relata.orm.exec;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/** {@link Rows} over a fully materialized result. */
public final class ListRows implements Rows {
  private final Iterator<Row> it;

  public ListRows(List<? extends Row> rows) {
    this.it = List.<Row>copyOf(rows).iterator();
  }

  public static ListRows empty() {
    return new ListRows(List.of());
  }

  @Override
  public Optional<Row> next() {
    return it.hasNext() ? Optional.of(it.next()) : Optional.empty();
  }
}
