package com.urbancanopy.geo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

class GridTest {

  private static final Grid KL = Grid.fromCenter(3.1390, 101.6869, 640, 640, 18);

  @Test
  void testFromCenter() {
    double expectedMpp = 156_543.03392 * Math.cos(Math.toRadians(3.1390)) / Math.pow(2, 18);
    assertEquals(expectedMpp, KL.metersPerPixel(), 1e-9);
    assertEquals(expectedMpp * expectedMpp, KL.pixelAreaM2(), 1e-9);
    assertEquals(3.1390, KL.centerLat(), 1e-12);
    assertEquals(101.6869, KL.centerLon(), 1e-12);
    assertEquals(640 * 640, KL.pixelCount());
    assertEquals(Math.hypot(640, 640) * expectedMpp, KL.diagonalMeters(), 1e-6);
  }

  @ParameterizedTest
  @CsvSource({
    "0,0",
    "320,320",
    "639,639",
    "12.5,600.25",
  })
  void testPixelRoundTrip(double x, double y) {
    Coordinate lonLat = KL.toLonLat(x, y);
    Coordinate pixel = KL.toPixel(lonLat.x, lonLat.y);
    assertEquals(x, pixel.x, 1e-6);
    assertEquals(y, pixel.y, 1e-6);
  }

  @Test
  void testOrientation() {
    Grid grid = Grid.fromBounds(new Envelope(10, 20, 40, 50), 100, 50);
    assertEquals(10, grid.lon(0));
    assertEquals(20, grid.lon(100));
    assertEquals(50, grid.lat(0));
    assertEquals(40, grid.lat(50));
    assertEquals(new Envelope(10, 20, 40, 50), grid.bounds());
  }

  @Test
  void testContains() {
    Grid grid = Grid.fromBounds(new Envelope(0, 1, 0, 1), 10, 5);
    assertTrue(grid.contains(0, 0));
    assertTrue(grid.contains(9, 4));
    assertFalse(grid.contains(10, 4));
    assertFalse(grid.contains(-1, 0));
  }

  @Test
  void testInvalid() {
    assertThrows(IllegalArgumentException.class, () -> new Grid(0, 10, 0, 1, 0, 1));
    assertThrows(IllegalArgumentException.class, () -> new Grid(10, 10, 1, 1, 0, 1));
  }
}
