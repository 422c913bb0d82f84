package com.urbancanopy.raster;

import static com.urbancanopy.TestUtils.field;
import static com.urbancanopy.TestUtils.mask;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class FieldTest {

  @Test
  void testStatistics() {
    Field values = field(2, 2, 1, 2, 3, 4);
    assertEquals(1, values.min());
    assertEquals(4, values.max());
    assertEquals(2.5, values.mean(mask("##", "##")));
    assertEquals(3.5, values.mean(mask("..", "##")));
    assertEquals(0, values.mean(Mask.empty(2, 2)));
  }

  @Test
  void testThresholds() {
    Field values = field(4, 1, 10, 20, 30, 40);
    assertEquals(mask("..##"), values.atLeast(30));
    assertEquals(mask(".##."), values.between(20, 40));
  }

  @Test
  void testMapAndMask() {
    Field values = field(2, 1, 1, 2);
    assertEquals(4, values.map(v -> v * 2).get(1, 0));
    Field masked = values.maskedBy(mask("#."));
    assertEquals(1, masked.get(0));
    assertEquals(0, masked.get(1));
  }

  @Test
  void testRejectsNonFinite() {
    assertThrows(IllegalStateException.class, () -> Field.constant(2, 2, Double.NaN));
    assertThrows(IllegalStateException.class, () -> field(1, 1, 1).map(v -> v / 0));
  }

  @Test
  void testRejectsEmpty() {
    assertThrows(IllegalArgumentException.class, () -> Field.builder(0, 3));
  }
}
