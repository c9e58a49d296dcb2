package ca.gc.cra.docket.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void acceptsInclusiveBounds() {
    assertEquals(1, Numbers.requireRange("pageLimit", 1, 1, 500));
    assertEquals(500, Numbers.requireRange("pageLimit", 500, 1, 500));
  }

  @Test
  void rejectsOutOfRangeWithName() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("enrichWorkers", 33, 1, 32));
    assertTrue(ex.getMessage().startsWith("enrichWorkers must be between 1 and 32"));
  }
}
