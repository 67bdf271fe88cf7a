package io.relata.orm.exec;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Forward-only cursor over a result; once drained it stays drained. */
public interface Rows {
  Optional<Row> next();

  default List<Row> remaining() {
    List<Row> out = new ArrayList<>();
    for (Optional<Row> r = next(); r.isPresent(); r = next()) out.add(r.get());
    return out;
  }
}
