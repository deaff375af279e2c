package io.shortcast.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableNamesTest {

  @Test
  void plainIdentifiersAreAccepted() {
    assertEquals("shortcast_queue", TableNames.validate("shortcast_queue"));
    assertEquals("_state2", TableNames.validate("_state2"));
  }

  @Test
  void nullIsRejected() {
    assertThrows(NullPointerException.class, () -> TableNames.validate(null));
  }

  @Test
  void injectionShapedNamesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1queue"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("app.queue"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("queue;drop"));
  }
}
