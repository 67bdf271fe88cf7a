package io.relata.orm.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/** A predicate tree: single filters combined with AND / OR, nested to any depth. */
@JsonSerialize(using = FilterOperatorJsonSerializer.class)
@JsonDeserialize(using = FilterOperatorJsonDeserializer.class)
public sealed interface FilterOperator permits FilterOperator.Single, FilterOperator.And, FilterOperator.Or {

  static FilterOperator single(Filter filter) {
    return new Single(filter);
  }

  static FilterOperator and(FilterOperator... children) {
    return new And(Arrays.asList(children));
  }

  static FilterOperator and(List<FilterOperator> children) {
    return new And(children);
  }

  static FilterOperator or(FilterOperator... children) {
    return new Or(Arrays.asList(children));
  }

  static FilterOperator or(List<FilterOperator> children) {
    return new Or(children);
  }

  record Single(Filter filter) implements FilterOperator {
    public Single {
      Objects.requireNonNull(filter, "filter");
    }
  }

  /** Empty And is always true. */
  record And(List<FilterOperator> children) implements FilterOperator {
    public And {
      children = copyChildren(children);
    }
  }

  /** Empty Or is always false. */
  record Or(List<FilterOperator> children) implements FilterOperator {
    public Or {
      children = copyChildren(children);
    }
  }

  private static List<FilterOperator> copyChildren(List<FilterOperator> children) {
    if (children == null) return List.of();
    for (FilterOperator c : children) Objects.requireNonNull(c, "child filter");
    return List.copyOf(children);
  }
}
