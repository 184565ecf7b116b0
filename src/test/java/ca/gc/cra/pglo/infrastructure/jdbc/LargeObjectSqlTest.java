package ca.gc.cra.pglo.infrastructure.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class LargeObjectSqlTest {

  @Test
  void placeholderObjectIdsAreCastToOid() {
    assertEquals("SELECT lo_create(?::oid)", LargeObjectSql.select(LargeObjectSql.loCreate()));
    assertEquals("SELECT lo_open(?::oid, ?)", LargeObjectSql.select(LargeObjectSql.loOpen()));
  }

  @Test
  void expressionsArePassedThrough() {
    assertEquals("lo_unlink(doc.blob)", LargeObjectSql.loUnlink("doc.blob"));
    assertEquals("lo_lseek64(fd, 0, 2)", LargeObjectSql.loLseek64("fd", "0", "2"));
    assertEquals("loread(?, ?)", LargeObjectSql.loRead());
    assertEquals("lowrite(?, ?)", LargeObjectSql.loWrite());
  }
}
