package com.urbancanopy.raster;

import com.carrotsearch.hppc.DoubleArrayList;
import com.urbancanopy.geo.Grid;
import java.util.Arrays;
import java.util.Collection;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Polygon;

/**
 * Burns polygons into a {@link Mask} by scanline filling: a pixel is set when its center lies inside a polygon under
 * the even-odd rule, so holes stay empty.
 */
public class Rasterizer {

  private Rasterizer() {}

  /** Returns a mask of the pixels of {@code grid} covered by any of the longitude/latitude {@code geometries}. */
  public static Mask rasterize(Grid grid, Collection<? extends Geometry> geometries) {
    Mask.Builder builder = Mask.builder(grid.width(), grid.height());
    for (Geometry geometry : geometries) {
      fill(grid.toPixelCoords(geometry), builder);
    }
    return builder.build();
  }

  /** Sets the pixels of {@code builder} covered by polygons in {@code pixelGeometry}, which is in pixel coordinates. */
  public static void fill(Geometry pixelGeometry, Mask.Builder builder) {
    for (int i = 0; i < pixelGeometry.getNumGeometries(); i++) {
      Geometry part = pixelGeometry.getGeometryN(i);
      if (part instanceof Polygon polygon) {
        fillPolygon(polygon, builder);
      } else if (part != pixelGeometry) {
        fill(part, builder);
      }
    }
  }

  private static void fillPolygon(Polygon polygon, Mask.Builder builder) {
    if (polygon.isEmpty()) {
      return;
    }
    Envelope env = polygon.getEnvelopeInternal();
    int minRow = Math.max(0, (int) Math.floor(env.getMinY() - 0.5));
    int maxRow = Math.min(builder.height() - 1, (int) Math.ceil(env.getMaxY() - 0.5));
    DoubleArrayList crossings = new DoubleArrayList();
    for (int row = minRow; row <= maxRow; row++) {
      double scanY = row + 0.5;
      crossings.clear();
      addCrossings(polygon.getExteriorRing(), scanY, crossings);
      for (int h = 0; h < polygon.getNumInteriorRing(); h++) {
        addCrossings(polygon.getInteriorRingN(h), scanY, crossings);
      }
      double[] xs = crossings.toArray();
      Arrays.sort(xs);
      for (int c = 0; c + 1 < xs.length; c += 2) {
        // pixel columns whose center x + 0.5 lies in [xs[c], xs[c+1])
        int startCol = Math.max(0, (int) Math.ceil(xs[c] - 0.5));
        int endCol = Math.min(builder.width() - 1, (int) Math.ceil(xs[c + 1] - 0.5) - 1);
        for (int col = startCol; col <= endCol; col++) {
          builder.set(col, row);
        }
      }
    }
  }

  private static void addCrossings(LineString ring, double scanY, DoubleArrayList crossings) {
    CoordinateSequence coords = ring.getCoordinateSequence();
    int n = coords.size();
    for (int i = 0; i + 1 < n; i++) {
      double y0 = coords.getY(i);
      double y1 = coords.getY(i + 1);
      // half-open so shared vertices are counted once
      if ((y0 <= scanY && y1 > scanY) || (y1 <= scanY && y0 > scanY)) {
        double x0 = coords.getX(i);
        double x1 = coords.getX(i + 1);
        crossings.add(x0 + (scanY - y0) / (y1 - y0) * (x1 - x0));
      }
    }
  }
}
