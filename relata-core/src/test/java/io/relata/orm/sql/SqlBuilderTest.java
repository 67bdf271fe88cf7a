package io.relata.orm.sql;

import io.relata.orm.model.ColumnValue;
import io.relata.orm.query.Filter;
import io.relata.orm.query.FilterOperator;
import io.relata.orm.query.Sort;
import io.relata.orm.value.Value;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.relata.orm.query.FilterOperator.single;
import static org.junit.jupiter.api.Assertions.*;

final class SqlBuilderTest {
  @Test
  void rendersEachOperator() {
    assertEquals("age = ?", SqlBuilder.render(single(Filter.eq("age", 1))).sql());
    assertEquals("age != ?", SqlBuilder.render(single(Filter.ne("age", 1))).sql());
    assertEquals("age > ?", SqlBuilder.render(single(Filter.gt("age", 1))).sql());
    assertEquals("age >= ?", SqlBuilder.render(single(Filter.gte("age", 1))).sql());
    assertEquals("age < ?", SqlBuilder.render(single(Filter.lt("age", 1))).sql());
    assertEquals("age <= ?", SqlBuilder.render(single(Filter.lte("age", 1))).sql());
    assertEquals("name LIKE ?", SqlBuilder.render(single(Filter.like("name", "a%"))).sql());
    assertEquals("age IS NULL", SqlBuilder.render(single(Filter.isNull("age"))).sql());
    assertEquals("age IS NOT NULL", SqlBuilder.render(single(Filter.isNotNull("age"))).sql());
  }

  @Test
  void inExpandsOnePlaceholderPerValue() {
    SqlStatement s = SqlBuilder.render(single(Filter.in("id", List.of(3, 1, 2))));
    assertEquals("id IN (?, ?, ?)", s.sql());
    assertEquals(List.of(Value.of(3L), Value.of(1L), Value.of(2L)), s.params());
  }

  @Test
  void emptyInMatchesNothing() {
    SqlStatement s = SqlBuilder.render(single(Filter.in("id", List.of())));
    assertEquals("1 = 0", s.sql());
    assertTrue(s.params().isEmpty());
  }

  @Test
  void emptyGroupsAreConstants() {
    assertEquals("1 = 1", SqlBuilder.render(FilterOperator.and()).sql());
    assertEquals("1 = 0", SqlBuilder.render(FilterOperator.or()).sql());
  }

  @Test
  void paramsFollowPlaceholdersDepthFirst() {
    FilterOperator tree = FilterOperator.and(
        single(Filter.eq("a", 1)),
        FilterOperator.or(
            single(Filter.gt("b", 2)),
            single(Filter.isNull("c")),
            single(Filter.in("d", List.of(3, 4)))),
        single(Filter.like("e", "5")));

    SqlStatement s = SqlBuilder.render(tree);
    assertEquals("(a = ?) AND ((b > ?) OR (c IS NULL) OR (d IN (?, ?))) AND (e LIKE ?)", s.sql());
    assertEquals(List.of(Value.of(1L), Value.of(2L), Value.of(3L), Value.of(4L), Value.of("5")), s.params());
    assertEquals(placeholders(s.sql()), s.params().size());
  }

  @Test
  void selectWithSortLimitOffset() {
    SqlStatement s = SqlBuilder.select("users", List.of("id", "name"), single(Filter.eq("age", 40)),
        List.of(Sort.asc("name"), Sort.desc("id")), 10L, 20L);
    assertEquals("SELECT id, name FROM users WHERE age = ? ORDER BY name ASC, id DESC LIMIT 10 OFFSET 20", s.sql());
    assertEquals(List.of(Value.of(40L)), s.params());
  }

  @Test
  void offsetWithoutLimitMeansNoLimit() {
    assertEquals(" LIMIT -1 OFFSET 5", SqlBuilder.limitOffset(null, 5L));
    assertEquals(" LIMIT 3", SqlBuilder.limitOffset(3L, null));
    assertEquals("", SqlBuilder.limitOffset(null, null));
  }

  @Test
  void updateBindsSetValuesBeforeWhere() {
    SqlStatement s = SqlBuilder.update("users",
        List.of(new ColumnValue("name", Value.of("Bob")), new ColumnValue("age", Value.NULL)),
        single(Filter.eq("id", 7)));
    assertEquals("UPDATE users SET name = ?, age = ? WHERE id = ?", s.sql());
    assertEquals(List.of(Value.of("Bob"), Value.NULL, Value.of(7L)), s.params());
  }

  @Test
  void insertAndDelete() {
    SqlStatement ins = SqlBuilder.insert("users", List.of(new ColumnValue("name", Value.of("A"))));
    assertEquals("INSERT INTO users (name) VALUES (?)", ins.sql());
    assertThrows(IllegalArgumentException.class, () -> SqlBuilder.insert("users", List.of()));

    assertEquals("DELETE FROM users", SqlBuilder.delete("users", null).sql());
  }

  private static int placeholders(String sql) {
    int n = 0;
    for (char c : sql.toCharArray()) if (c == '?') n++;
    return n;
  }
}
