package com.urbancanopy.spots;

import static com.urbancanopy.TestUtils.config;
import static com.urbancanopy.TestUtils.mask;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.urbancanopy.geo.Grid;
import com.urbancanopy.raster.Field;
import com.urbancanopy.raster.Mask;
import java.util.List;
import org.junit.jupiter.api.Test;

class CriticalSpotExtractorTest {

  private static final Grid GRID = Grid.fromCenter(3.139, 101.6869, 10, 10, 18);

  private static final Mask TWO_CLUSTERS = mask(
    "#####.....",
    "#####.....",
    "#####.....",
    "#####.....",
    "#####.....",
    "..........",
    "..........",
    "........##",
    "........##",
    ".........#"
  );

  @Test
  void testSmallClustersDropped() {
    Field composite = Field.constant(10, 10, 90);
    List<CriticalSpot> spots = CriticalSpotExtractor.extract(TWO_CLUSTERS, composite, GRID, 20);
    assertEquals(1, spots.size());
    CriticalSpot spot = spots.get(0);
    assertEquals(1, spot.id());
    assertEquals(25, spot.pixelCount());
    assertEquals(2, spot.pixelX(), 1e-9);
    assertEquals(2, spot.pixelY(), 1e-9);
    assertEquals(GRID.lat(2.5), spot.lat(), 1e-12);
    assertEquals(GRID.lon(2.5), spot.lon(), 1e-12);
    assertEquals(25 * GRID.pixelAreaM2(), spot.areaM2(), 1e-9);
    assertEquals(90, spot.meanScore(), 1e-5);
  }

  @Test
  void testSinglePixelSpotLocatedAtPixelCenter() {
    Mask single = Mask.fromIndex(10, 10, i -> i == 3 * 10 + 7);
    List<CriticalSpot> spots = CriticalSpotExtractor.extract(single, Field.constant(10, 10, 90), GRID, 1);
    assertEquals(1, spots.size());
    CriticalSpot spot = spots.get(0);
    assertEquals(7, spot.pixelX(), 1e-9);
    assertEquals(3, spot.pixelY(), 1e-9);
    var pixel = GRID.toPixel(spot.lon(), spot.lat());
    assertEquals(7.5, pixel.x, 1e-6);
    assertEquals(3.5, pixel.y, 1e-6);
  }

  @Test
  void testRankedByMeanScore() {
    Field composite = Field.fromIndex(10, 10, i -> i % 10 >= 5 ? 95 : 85);
    List<CriticalSpot> spots = CriticalSpotExtractor.extract(TWO_CLUSTERS, composite, GRID, 1);
    assertEquals(2, spots.size());
    assertEquals(1, spots.get(0).id());
    assertEquals(5, spots.get(0).pixelCount());
    assertEquals(95, spots.get(0).meanScore(), 1e-5);
    assertEquals(2, spots.get(1).id());
    assertEquals(25, spots.get(1).pixelCount());
    assertEquals(85, spots.get(1).meanScore(), 1e-5);
  }

  @Test
  void testDiagonalPixelsConnect() {
    Mask diagonal = mask(
      "#...",
      ".#..",
      "..#.",
      "...#"
    );
    Grid grid = Grid.fromCenter(3.139, 101.6869, 4, 4, 18);
    List<CriticalSpot> spots = CriticalSpotExtractor.extract(diagonal, Field.constant(4, 4, 85), grid, 1);
    assertEquals(1, spots.size());
    assertEquals(4, spots.get(0).pixelCount());
    assertEquals(1.5, spots.get(0).pixelX(), 1e-9);
  }

  @Test
  void testOnlyPlantableCriticalPixels() {
    var extractor = new CriticalSpotExtractor(config("min_spot_size", 3));
    Field composite = Field.fromIndex(10, 10, i -> i < 10 ? 85 : 50);
    Mask plantable = Mask.fromIndex(10, 10, i -> i != 4 && i != 5);
    List<CriticalSpot> spots = extractor.extract(composite, plantable, GRID);
    assertEquals(2, spots.size());
    assertEquals(4, spots.get(0).pixelCount());
    assertEquals(4, spots.get(1).pixelCount());
    assertTrue(spots.get(0).pixelX() < spots.get(1).pixelX());
  }

  @Test
  void testNoCriticalPixels() {
    var extractor = new CriticalSpotExtractor(config());
    List<CriticalSpot> spots = extractor.extract(Field.constant(10, 10, 79.9), Mask.fromIndex(10, 10, i -> true), GRID);
    assertTrue(spots.isEmpty());
  }
}
