package ca.gc.cra.pglo.domain.lob;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pglo.domain.error.ErrorKind;
import ca.gc.cra.pglo.domain.error.InvalidModeException;
import org.junit.jupiter.api.Test;

class OpenModeTest {

  @Test
  void flagsMatchServerBits() {
    assertEquals(0x40000, OpenMode.READ.flags());
    assertEquals(0x20000, OpenMode.WRITE.flags());
    assertEquals(0x60000, OpenMode.READ_WRITE.flags());
    assertEquals(0x60000, OpenMode.APPEND.flags());
  }

  @Test
  void onlyAppendSeeksToEnd() {
    assertTrue(OpenMode.APPEND.seekToEnd());
    assertFalse(OpenMode.READ_WRITE.seekToEnd());
    assertFalse(OpenMode.READ.writable());
    assertTrue(OpenMode.WRITE.writable());
  }

  @Test
  void parseAcceptsCaseAndHyphens() throws InvalidModeException {
    assertEquals(OpenMode.READ_WRITE, OpenMode.parse("read-write"));
    assertEquals(OpenMode.APPEND, OpenMode.parse(" Append "));
  }

  @Test
  void parseRejectsUnknownMode() {
    InvalidModeException ex = assertThrows(InvalidModeException.class, () -> OpenMode.parse("readwrite!"));
    assertEquals(ErrorKind.INVALID_MODE, ex.kind());
    assertThrows(InvalidModeException.class, () -> OpenMode.parse(" "));
  }
}
