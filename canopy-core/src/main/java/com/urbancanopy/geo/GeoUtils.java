package com.urbancanopy.geo;

import java.util.Collection;
import java.util.List;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.geom.impl.PackedCoordinateSequence;
import org.locationtech.jts.geom.impl.PackedCoordinateSequenceFactory;
import org.locationtech.jts.geom.util.GeometryTransformer;
import org.locationtech.jts.operation.union.UnaryUnionOp;
import org.locationtech.jts.operation.valid.IsValidOp;
import org.locationtech.jts.operation.valid.TopologyValidationError;

/**
 * A collection of utilities for working with JTS data structures and geographic data.
 * <p>
 * Longitude is stored as {@code x} and latitude as {@code y} in every JTS geometry.
 */
public class GeoUtils {

  public static final GeometryFactory JTS_FACTORY = new GeometryFactory(PackedCoordinateSequenceFactory.DOUBLE_FACTORY);
  public static final Geometry EMPTY_GEOMETRY = JTS_FACTORY.createGeometryCollection();
  /** Meters per degree of latitude, also used along a parallel scaled by {@code cos(lat)}. */
  public static final double METERS_PER_DEGREE = 111_000;
  /** Ground resolution at the equator of a 256px web mercator tile at zoom 0. */
  public static final double WEB_MERCATOR_METERS_PER_PIXEL_Z0 = 156_543.03392;

  // should not instantiate
  private GeoUtils() {}

  /** Returns the number of degrees of latitude that span {@code metersNorth}. */
  public static double metersToLatDegrees(double metersNorth) {
    return metersNorth / METERS_PER_DEGREE;
  }

  /** Returns the number of degrees of longitude that span {@code metersEast} at {@code latitude}. */
  public static double metersToLonDegrees(double metersEast, double latitude) {
    return metersEast / (METERS_PER_DEGREE * Math.cos(Math.toRadians(latitude)));
  }

  /** Returns the distance north in meters that {@code latDegrees} spans. */
  public static double latDegreesToMeters(double latDegrees) {
    return latDegrees * METERS_PER_DEGREE;
  }

  /** Returns the distance east in meters that {@code lonDegrees} spans at {@code latitude}. */
  public static double lonDegreesToMeters(double lonDegrees, double latitude) {
    return lonDegrees * METERS_PER_DEGREE * Math.cos(Math.toRadians(latitude));
  }

  /** Returns the ground resolution of a web mercator image pixel at {@code latitude} and {@code zoom}. */
  public static double webMercatorMetersPerPixel(double latitude, int zoom) {
    return WEB_MERCATOR_METERS_PER_PIXEL_Z0 * Math.cos(Math.toRadians(latitude)) / Math.pow(2, zoom);
  }

  public static Point point(double x, double y) {
    return JTS_FACTORY.createPoint(new CoordinateXY(x, y));
  }

  /** Returns the union of {@code geometries}, or an empty geometry if there are none. */
  public static Geometry union(Collection<? extends Geometry> geometries) {
    if (geometries.isEmpty()) {
      return EMPTY_GEOMETRY;
    }
    Geometry result = UnaryUnionOp.union(List.copyOf(geometries));
    return result == null ? EMPTY_GEOMETRY : result;
  }

  /**
   * Returns a copy of {@code geom} with every coordinate passed through {@code transform}.
   */
  public static Geometry transform(Geometry geom, CoordinateTransform transform) {
    return new GeometryTransformer() {
      @Override
      protected CoordinateSequence transformCoordinates(CoordinateSequence coords, Geometry parent) {
        CoordinateSequence copy = new PackedCoordinateSequence.Double(coords.size(), 2, 0);
        Coordinate scratch = new CoordinateXY();
        for (int i = 0; i < coords.size(); i++) {
          transform.apply(coords.getX(i), coords.getY(i), scratch);
          copy.setOrdinate(i, 0, scratch.x);
          copy.setOrdinate(i, 1, scratch.y);
        }
        return copy;
      }
    }.transform(geom);
  }

  /**
   * Returns {@code geom} if it is a valid polygon with area. Invalid polygons are rejected, not repaired.
   *
   * @throws GeometryException if {@code geom} is not a polygon, has no area, or is invalid
   */
  public static Geometry validPolygon(Geometry geom) throws GeometryException {
    if (!(geom instanceof Polygonal)) {
      throw new GeometryException("not_polygon", "Expected a polygon but got " + geom.getGeometryType());
    }
    if (geom.isEmpty() || !(geom.getEnvelopeInternal().getArea() > 0)) {
      throw new GeometryException("zero_area_polygon", "polygon has no area").addGeometryDetails("input", geom);
    }
    TopologyValidationError error = new IsValidOp(geom).getValidationError();
    if (error != null) {
      int type = error.getErrorType();
      String stat = type == TopologyValidationError.SELF_INTERSECTION ||
        type == TopologyValidationError.RING_SELF_INTERSECTION ? "self_intersecting_polygon" : "invalid_polygon";
      throw new GeometryException(stat, error.getMessage() + " at " + error.getCoordinate())
        .addGeometryDetails("input", geom);
    }
    if (!(geom.getArea() > 0)) {
      throw new GeometryException("zero_area_polygon", "polygon has no area").addGeometryDetails("input", geom);
    }
    return geom;
  }

  /** Maps an {@code (x, y)} coordinate into {@code out}. */
  @FunctionalInterface
  public interface CoordinateTransform {

    void apply(double x, double y, Coordinate out);
  }
}
