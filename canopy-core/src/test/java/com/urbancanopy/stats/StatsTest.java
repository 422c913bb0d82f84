package com.urbancanopy.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.urbancanopy.util.LogUtil;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StatsTest {

  @Test
  void testDataErrorsAndCounters() {
    Stats stats = Stats.inMemory();
    stats.dataError("buildings_zero_area_polygon");
    stats.dataError("buildings_zero_area_polygon");
    stats.dataError("street_unmatched_tier");
    stats.increment("locations_succeeded");

    assertEquals(Map.of("buildings_zero_area_polygon", 2L, "street_unmatched_tier", 1L), stats.dataErrors());
    assertEquals(Map.of("locations_succeeded", 1L), stats.counters());
    stats.printSummary();
  }

  @Test
  void testStageSetsAndRestoresLogPrefix() {
    Stats stats = Stats.inMemory();
    assertNull(LogUtil.getStage());
    try (var outer = stats.startStage("overall")) {
      assertEquals("overall", LogUtil.getStage());
      var inner = stats.startStage("aster_hill", "detect");
      assertEquals("aster_hill:detect", LogUtil.getStage());
      assertTrue(stats.timers().all().get("aster_hill:detect").running());
      inner.stop();
      assertFalse(stats.timers().all().get("aster_hill:detect").running());
      assertEquals("overall", LogUtil.getStage());
    }
    assertNull(LogUtil.getStage());
  }
}
