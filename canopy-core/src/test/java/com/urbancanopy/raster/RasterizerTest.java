package com.urbancanopy.raster;

import static com.urbancanopy.TestUtils.mask;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.urbancanopy.geo.GeoUtils;
import com.urbancanopy.geo.Grid;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LinearRing;

class RasterizerTest {

  private static LinearRing ring(double minX, double minY, double maxX, double maxY) {
    return GeoUtils.JTS_FACTORY.createLinearRing(new Coordinate[]{
      new CoordinateXY(minX, minY),
      new CoordinateXY(maxX, minY),
      new CoordinateXY(maxX, maxY),
      new CoordinateXY(minX, maxY),
      new CoordinateXY(minX, minY)
    });
  }

  private static Geometry rectangle(double minX, double minY, double maxX, double maxY) {
    return GeoUtils.JTS_FACTORY.createPolygon(ring(minX, minY, maxX, maxY));
  }

  @Test
  void testSquareInPixelCoordinates() {
    Mask.Builder builder = Mask.builder(6, 6);
    Rasterizer.fill(rectangle(2, 2, 5, 5), builder);
    assertEquals(mask(
      "......",
      "......",
      "..###.",
      "..###.",
      "..###.",
      "......"
    ), builder.build());
  }

  @Test
  void testHoleStaysEmpty() {
    Mask.Builder builder = Mask.builder(5, 5);
    Rasterizer.fill(GeoUtils.JTS_FACTORY.createPolygon(ring(0, 0, 5, 5), new LinearRing[]{ring(2, 2, 3, 3)}),
      builder);
    Mask result = builder.build();
    assertEquals(24, result.count());
    assertEquals(false, result.get(2, 2));
  }

  @Test
  void testClipsToRaster() {
    Mask.Builder builder = Mask.builder(3, 3);
    Rasterizer.fill(rectangle(-10, -10, 1.6, 20), builder);
    assertEquals(mask(
      "##.",
      "##.",
      "##."
    ), builder.build());
  }

  @Test
  void testLonLatUsesGridOrientation() {
    Grid grid = Grid.fromBounds(new Envelope(0, 10, 0, 10), 10, 10);
    // lat 5..8 is rows 2..5 because rows grow southward
    Mask result = Rasterizer.rasterize(grid, List.of(rectangle(2, 5, 5, 8)));
    assertEquals(9, result.count());
    assertEquals(true, result.get(2, 2));
    assertEquals(true, result.get(4, 4));
    assertEquals(false, result.get(2, 5));
  }

  @Test
  void testMultiPolygonAndIgnoresLines() {
    Geometry multi = GeoUtils.JTS_FACTORY.createGeometryCollection(new Geometry[]{
      rectangle(0, 0, 1, 1),
      rectangle(3, 3, 4, 4),
      GeoUtils.JTS_FACTORY.createLineString(new Coordinate[]{new CoordinateXY(0, 4), new CoordinateXY(4, 0)})
    });
    Mask.Builder builder = Mask.builder(5, 5);
    Rasterizer.fill(multi, builder);
    Mask result = builder.build();
    assertEquals(2, result.count());
    assertEquals(true, result.get(0, 0));
    assertEquals(true, result.get(3, 3));
  }
}
