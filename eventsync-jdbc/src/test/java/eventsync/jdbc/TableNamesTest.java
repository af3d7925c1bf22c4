package eventsync.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableNamesTest {

  @Test
  void validTableNameReturnsName() {
    assertEquals("sync_event", TableNames.validate("sync_event"));
    assertEquals("MyTable", TableNames.validate("MyTable"));
    assertEquals("_log2", TableNames.validate("_log2"));
  }

  @Test
  void defaultTableConstants() {
    assertEquals("sync_event", TableNames.DEFAULT_EVENT_TABLE);
    assertEquals("sync_log", TableNames.DEFAULT_LOG_TABLE);
  }

  @Test
  void nullTableNameThrows() {
    assertThrows(NullPointerException.class, () -> TableNames.validate(null));
  }

  @Test
  void invalidTableNamesThrow() {
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1table"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("my-table"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("t; DROP TABLE x"));
  }
}
