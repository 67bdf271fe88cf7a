package io.relata.orm.query;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class PaginationTest {
  @Test
  void computesWindowAndPages() {
    Pagination p = new Pagination(3, 2);
    assertEquals(4, p.offset());
    assertEquals(2, p.limit());
    assertNull(p.total());

    Pagination counted = p.withTotal(5);
    assertEquals(5L, counted.total());
    assertEquals(3L, counted.totalPages());
    assertEquals(3, counted.page());
  }

  @Test
  void zeroTotalHasZeroPages() {
    assertEquals(0L, new Pagination(1, 10).withTotal(0).totalPages());
    assertEquals(1L, new Pagination(1, 10).withTotal(10).totalPages());
    assertEquals(2L, new Pagination(1, 10).withTotal(11).totalPages());
  }

  @Test
  void rejectsNonPositivePageOrSize() {
    assertThrows(IllegalArgumentException.class, () -> new Pagination(0, 10));
    assertThrows(IllegalArgumentException.class, () -> new Pagination(1, 0));
    assertThrows(IllegalArgumentException.class, () -> new Pagination(1, 10).withTotal(-1));
  }
}
