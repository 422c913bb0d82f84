package com.urbancanopy.geo;

import static com.urbancanopy.TestUtils.config;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.urbancanopy.config.CanopyConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.Geometry;

class MetricProjectionTest {

  @ParameterizedTest
  @CsvSource({
    "-180,1",
    "-177,1",
    "0,31",
    "101.6869,47",
    "179.9,60",
    "180,60",
  })
  void testUtmZone(double lon, int zone) {
    assertEquals(zone, MetricProjection.utmZone(lon));
  }

  @Test
  void testHemisphere() {
    assertEquals("UTM 47N", MetricProjection.utmZoneOf(3.139, 101.6869).name());
    assertEquals("UTM 56S", MetricProjection.utmZoneOf(-33.86, 151.2).name());
  }

  @Test
  void testRoundTrip() {
    MetricProjection projection = MetricProjection.utmZoneOf(3.139, 101.6869);
    Coordinate metric = projection.project(101.6869, 3.139);
    Coordinate lonLat = projection.unproject(metric.x, metric.y);
    assertEquals(101.6869, lonLat.x, 1e-8);
    assertEquals(3.139, lonLat.y, 1e-8);
  }

  @Test
  void testDistancesAreMeters() {
    MetricProjection projection = MetricProjection.utmZoneOf(3.139, 101.6869);
    Coordinate a = projection.project(101.6869, 3.139);
    Coordinate b = projection.project(101.6869, 3.139 + GeoUtils.metersToLatDegrees(100));
    // 111km per degree is an approximation of the true meridian length
    assertEquals(100, a.distance(b), 1.5);
  }

  @Test
  void testGeometryRoundTrip() {
    MetricProjection projection = MetricProjection.utmZoneOf(3.139, 101.6869);
    Geometry line = GeoUtils.JTS_FACTORY.createLineString(new Coordinate[]{
      new CoordinateXY(101.686, 3.138), new CoordinateXY(101.688, 3.140)
    });
    Geometry back = projection.unproject(projection.project(line));
    for (int i = 0; i < line.getNumPoints(); i++) {
      assertEquals(line.getCoordinates()[i].x, back.getCoordinates()[i].x, 1e-8);
      assertEquals(line.getCoordinates()[i].y, back.getCoordinates()[i].y, 1e-8);
    }
  }

  @Test
  void testForLocation() {
    assertEquals("UTM 47N", MetricProjection.forLocation(CanopyConfig.defaults(), 3.139, 101.6869).name());
    CanopyConfig override = config("metric_crs", "+proj=utm +zone=48 +datum=WGS84 +units=m +no_defs");
    assertEquals("metric_crs", MetricProjection.forLocation(override, 3.139, 101.6869).name());
  }

  @Test
  void testInvalidDefinition() {
    assertThrows(IllegalArgumentException.class, () -> MetricProjection.fromProj4("bad", "+proj=notreal"));
  }
}
