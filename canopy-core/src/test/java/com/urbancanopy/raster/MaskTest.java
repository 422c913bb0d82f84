package com.urbancanopy.raster;

import static com.urbancanopy.TestUtils.mask;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class MaskTest {

  @Test
  void testBooleanOps() {
    Mask a = mask("##..", "....");
    Mask b = mask(".##.", "....");
    assertEquals(mask("###.", "...."), a.or(b));
    assertEquals(mask(".#..", "...."), a.and(b));
    assertEquals(mask("#...", "...."), a.andNot(b));
    assertEquals(mask("..##", "####"), a.not());
    assertEquals(2, a.count());
    assertFalse(a.isEmpty());
    assertTrue(Mask.empty(3, 3).isEmpty());
  }

  @Test
  void testIndexing() {
    Mask m = mask("...", "..#");
    assertTrue(m.get(2, 1));
    assertTrue(m.get(5));
    assertFalse(m.get(0, 0));
    assertEquals(6, m.size());
  }

  @Test
  void testShapeMismatch() {
    assertThrows(IllegalArgumentException.class, () -> mask("##").or(mask("#", "#")));
  }

  @Test
  void testBuilderIsolation() {
    Mask.Builder builder = Mask.builder(2, 1).set(0, 0);
    Mask first = builder.build();
    builder.set(1, 0);
    assertEquals(1, first.count());
    assertEquals(2, builder.build().count());
  }
}
