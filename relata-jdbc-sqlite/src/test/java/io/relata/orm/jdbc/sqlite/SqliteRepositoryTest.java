package io.relata.orm.jdbc.sqlite;

import io.relata.orm.error.NotFoundException;
import io.relata.orm.exec.Database;
import io.relata.orm.query.Filter;
import io.relata.orm.query.FilterOperator;
import io.relata.orm.query.PaginatedResult;
import io.relata.orm.query.Pagination;
import io.relata.orm.query.SearchFilter;
import io.relata.orm.repository.Repository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static io.relata.orm.query.FilterOperator.single;
import static org.junit.jupiter.api.Assertions.*;

final class SqliteRepositoryTest {
  private Database db;
  private Repository<User> users;

  @BeforeEach
  void setUp() {
    db = SqliteDatabases.inMemory();
    db.execute(User.MODEL.migrationSql(), List.of());
    users = new Repository<>(db, User.MODEL);
  }

  @AfterEach
  void tearDown() {
    db.close();
  }

  /** The generated key is not returned by create, so read the row back by its unique email. */
  private User insert(User u) {
    users.create(u);
    return users.findWhere(single(Filter.eq("email", u.email()))).stream()
        .max(Comparator.comparing(User::id))
        .orElseThrow(() -> new NotFoundException("inserted row not found"));
  }

  @Test
  void createThenReadBack() {
    User inserted = insert(User.of("Alice", "alice@example.com", 30L, 98.5, true));
    assertNotNull(inserted.id());
    assertEquals("Alice", inserted.name());
    assertEquals(30L, inserted.age());
    assertEquals(98.5, inserted.score());
    assertTrue(inserted.isActive());
  }

  @Test
  void insertsGetDistinctIds() {
    User a = insert(User.of("A", "a@example.com", 20L, null, true));
    User b = insert(User.of("B", "b@example.com", 21L, null, true));
    assertNotEquals(a.id(), b.id());
  }

  @Test
  void findById() {
    User inserted = insert(User.of("Find", "find@example.com", null, null, true));
    assertEquals("find@example.com", users.findById(inserted.id()).orElseThrow().email());
    assertTrue(users.findById(999_999L).isEmpty());
  }

  @Test
  void findAllOnEmptyAndFilledTable() {
    assertTrue(users.findAll().isEmpty());
    insert(User.of("A", "a@example.com", 1L, null, true));
    insert(User.of("B", "b@example.com", 2L, null, true));
    assertEquals(2, users.findAll().size());
  }

  @Test
  void findWhereComparisons() {
    insert(User.of("Young", "young@example.com", 20L, null, true));
    insert(User.of("Old", "old@example.com", 40L, null, false));

    List<User> eq = users.findWhere(single(Filter.eq("age", 40)));
    assertEquals(List.of("Old"), names(eq));

    List<User> gt = users.findWhere(single(Filter.gt("age", 30)));
    assertEquals(List.of("Old"), names(gt));

    List<User> like = users.findWhere(single(Filter.like("email", "you%")));
    assertEquals(List.of("Young"), names(like));
  }

  @Test
  void findWhereAndOr() {
    insert(User.of("AndA", "anda@example.com", 35L, null, true));
    insert(User.of("AndB", "andb@example.com", 35L, null, false));
    insert(User.of("AndC", "andc@example.com", 20L, null, false));

    List<User> both = users.findWhere(FilterOperator.and(
        single(Filter.gt("age", 30)),
        single(Filter.eq("is_active", false))));
    assertEquals(List.of("AndB"), names(both));

    List<User> either = users.findWhere(FilterOperator.or(
        single(Filter.eq("name", "AndA")),
        single(Filter.eq("name", "AndC"))));
    assertEquals(Set.of("AndA", "AndC"), Set.copyOf(names(either)));
  }

  @Test
  void emptyGroupsMatchAllOrNothing() {
    insert(User.of("A", "a@example.com", 1L, null, true));
    assertEquals(1, users.findWhere(FilterOperator.and()).size());
    assertEquals(0, users.findWhere(FilterOperator.or()).size());
    assertEquals(0, users.findWhere(single(Filter.in("id", List.of()))).size());
  }

  @Test
  void nullChecks() {
    insert(User.of("NoAge", "noage@example.com", null, null, true));
    insert(User.of("Aged", "aged@example.com", 5L, null, true));
    assertEquals(List.of("NoAge"), names(users.findWhere(single(Filter.isNull("age")))));
    assertEquals(List.of("Aged"), names(users.findWhere(single(Filter.isNotNull("age")))));
  }

  @Test
  void updateChangesFields() {
    User u = insert(User.of("Before", "upd@example.com", 18L, 10.0, true));
    users.update(new User(u.id(), "After", u.email(), 19L, 77.25, false));

    User fetched = users.findById(u.id()).orElseThrow();
    assertEquals("After", fetched.name());
    assertEquals(19L, fetched.age());
    assertEquals(77.25, fetched.score());
    assertFalse(fetched.isActive());
  }

  @Test
  void updateOfMissingRowIsNotAnError() {
    assertDoesNotThrow(() -> users.update(User.of("Ghost", "ghost@example.com", null, null, true).withId(424242L)));
    assertEquals(0L, users.count());
  }

  @Test
  void deleteSingleRow() {
    User u = insert(User.of("Del", "del@example.com", null, null, true));
    assertTrue(users.delete(u));
    assertTrue(users.findById(u.id()).isEmpty());
  }

  @Test
  void deleteOfMissingRowStillSucceeds() {
    assertTrue(users.delete(User.of("Nobody", "nobody@example.com", null, null, true).withId(123456L)));
    assertEquals(0L, users.count());
  }

  @Test
  void bulkDeleteRemovesExactlyTheGivenIds() {
    User a = insert(User.of("A", "a@example.com", null, null, true));
    User b = insert(User.of("B", "b@example.com", null, null, true));
    User c = insert(User.of("C", "c@example.com", null, null, true));

    assertEquals(2L, users.bulkDelete(List.of(a.id(), b.id())));
    List<User> left = users.findAll();
    assertEquals(1, left.size());
    assertEquals(c.id(), left.get(0).id());
  }

  @Test
  void deleteWhereRemovesMatches() {
    insert(User.of("DW1", "dw1@example.com", 10L, null, true));
    insert(User.of("DW2", "dw2@example.com", 50L, null, true));
    assertEquals(1L, users.deleteWhere(single(Filter.gt("age", 20))));
    assertEquals(List.of("DW1"), names(users.findAll()));
  }

  @Test
  void countAndCountWhere() {
    assertEquals(0L, users.count());
    insert(User.of("C1", "c1@example.com", 10L, null, true));
    insert(User.of("C2", "c2@example.com", 20L, null, false));
    insert(User.of("C3", "c3@example.com", 30L, null, true));
    assertEquals(3L, users.count());
    assertEquals(2L, users.countWhere(single(Filter.eq("is_active", true))));
  }

  @Test
  void paginationWindows() {
    for (int i = 1; i <= 5; i++) {
      insert(User.of("P" + i, "p" + i + "@example.com", (long) i, null, true));
    }

    PaginatedResult<User> first = users.findPaginated(new Pagination(1, 2));
    assertEquals(2, first.data().size());
    assertEquals(5L, first.pagination().total());
    assertEquals(3L, first.pagination().totalPages());

    PaginatedResult<User> last = users.findPaginated(new Pagination(3, 2));
    assertEquals(1, last.data().size());
    assertEquals(3L, last.pagination().totalPages());

    PaginatedResult<User> beyond = users.findPaginated(new Pagination(4, 2));
    assertTrue(beyond.data().isEmpty());
    assertEquals(5L, beyond.pagination().total());
  }

  @Test
  void paginationWithFilter() {
    for (int i = 1; i <= 5; i++) {
      insert(User.of("F" + i, "f" + i + "@example.com", (long) i, null, i % 2 == 0));
    }
    PaginatedResult<User> r = users.findWherePaginated(single(Filter.eq("is_active", false)), new Pagination(1, 2));
    assertEquals(2, r.data().size());
    assertEquals(3L, r.pagination().total());
    assertEquals(2L, r.pagination().totalPages());
  }

  @Test
  void searchAcrossColumns() {
    insert(User.of("Hay", "hay@example.com", null, null, true));
    insert(User.of("Stack", "needle@example.com", null, null, true));

    PaginatedResult<User> r = users.search(SearchFilter.of("needle", "name", "email"), null);
    assertEquals(1, r.data().size());
    assertEquals("needle@example.com", r.data().get(0).email());
    assertEquals(1L, r.pagination().total());

    PaginatedResult<User> paged = users.search(SearchFilter.of("example", "email"), new Pagination(2, 1));
    assertEquals(1, paged.data().size());
    assertEquals(2L, paged.pagination().totalPages());
  }

  @Test
  void createOrUpdateCreatesWithoutKey() {
    users.createOrUpdate(User.of("New", "cou@example.com", 20L, null, true));
    assertEquals(1L, users.count());
  }

  @Test
  void createOrUpdateUpdatesInPlace() {
    User u = insert(User.of("Old", "cou2@example.com", 20L, null, true));
    users.createOrUpdate(new User(u.id(), "New", u.email(), 21L, null, true));

    assertEquals(1L, users.count());
    User fetched = users.findById(u.id()).orElseThrow();
    assertEquals("New", fetched.name());
    assertEquals(21L, fetched.age());
  }

  @Test
  void valuesRoundTrip() {
    User nulls = insert(User.of("Nulls", "nulls@example.com", null, null, true));
    assertNull(nulls.age());
    assertNull(nulls.score());

    assertEquals(42.125, insert(User.of("F", "float@example.com", null, 42.125, true)).score());
    assertFalse(insert(User.of("B", "bool@example.com", null, null, false)).isActive());

    String special = "O'Reilly & Sons (R&D)";
    assertEquals(special, insert(User.of(special, "special@example.com", null, null, true)).name());

    String unicode = "你好 世界";
    assertEquals(unicode, insert(User.of(unicode, "unicode@example.com", null, null, true)).name());
  }

  private static List<String> names(List<User> list) {
    return list.stream().map(User::name).collect(Collectors.toList());
  }
}
