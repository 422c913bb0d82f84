package com.urbancanopy.geo;

import com.urbancanopy.config.CanopyConfig;
import java.util.Locale;
import javax.annotation.concurrent.NotThreadSafe;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.ProjCoordinate;

/**
 * Converts geometries between WGS84 longitude/latitude and a projected coordinate system measured in meters, so that
 * distances and buffers are isotropic.
 * <p>
 * Instances hold scratch coordinates so each location should create its own.
 */
@NotThreadSafe
public class MetricProjection {

  private static final CRSFactory CRS_FACTORY = new CRSFactory();
  private static final CoordinateTransformFactory TRANSFORM_FACTORY = new CoordinateTransformFactory();
  private static final String WGS84_DEFINITION = "+proj=longlat +datum=WGS84 +no_defs";

  private final String name;
  private final CoordinateTransform forward;
  private final CoordinateTransform inverse;
  private final ProjCoordinate in = new ProjCoordinate();
  private final ProjCoordinate out = new ProjCoordinate();

  private MetricProjection(String name, String definition) {
    this.name = name;
    CoordinateReferenceSystem wgs84 = CRS_FACTORY.createFromParameters("WGS84", WGS84_DEFINITION);
    CoordinateReferenceSystem metric = CRS_FACTORY.createFromParameters(name, definition);
    this.forward = TRANSFORM_FACTORY.createTransform(wgs84, metric);
    this.inverse = TRANSFORM_FACTORY.createTransform(metric, wgs84);
  }

  /**
   * Returns a projection from a proj4 {@code definition} like {@code "+proj=utm +zone=48 +datum=WGS84 +units=m"}.
   *
   * @throws IllegalArgumentException if proj4j cannot parse the definition
   */
  public static MetricProjection fromProj4(String name, String definition) {
    try {
      return new MetricProjection(name, definition);
    } catch (RuntimeException e) {
      throw new IllegalArgumentException("Invalid metric CRS '" + definition + "': " + e.getMessage(), e);
    }
  }

  /** Returns the UTM zone projection that contains {@code (lat, lon)}. */
  public static MetricProjection utmZoneOf(double lat, double lon) {
    int zone = utmZone(lon);
    boolean south = lat < 0;
    String name = "UTM " + zone + (south ? "S" : "N");
    String definition = String.format(Locale.ROOT, "+proj=utm +zone=%d%s +datum=WGS84 +units=m +no_defs", zone,
      south ? " +south" : "");
    return new MetricProjection(name, definition);
  }

  /** Returns the configured metric CRS, or the UTM zone of {@code (lat, lon)} if none is configured. */
  public static MetricProjection forLocation(CanopyConfig config, double lat, double lon) {
    return config.hasMetricCrsOverride() ? fromProj4("metric_crs", config.metricCrs()) : utmZoneOf(lat, lon);
  }

  static int utmZone(double lon) {
    int zone = (int) Math.floor((lon + 180) / 6) + 1;
    return Math.max(1, Math.min(60, zone));
  }

  public String name() {
    return name;
  }

  /** Returns {@code (easting, northing)} in meters of {@code (lon, lat)}. */
  public Coordinate project(double lon, double lat) {
    Coordinate result = new CoordinateXY();
    apply(forward, lon, lat, result);
    return result;
  }

  /** Returns {@code (lon, lat)} of {@code (easting, northing)}. */
  public Coordinate unproject(double easting, double northing) {
    Coordinate result = new CoordinateXY();
    apply(inverse, easting, northing, result);
    return result;
  }

  /** Returns a copy of a longitude/latitude {@code geometry} in meters. */
  public Geometry project(Geometry geometry) {
    return GeoUtils.transform(geometry, (x, y, result) -> apply(forward, x, y, result));
  }

  /** Returns a copy of a metric {@code geometry} in longitude/latitude. */
  public Geometry unproject(Geometry geometry) {
    return GeoUtils.transform(geometry, (x, y, result) -> apply(inverse, x, y, result));
  }

  private void apply(CoordinateTransform transform, double x, double y, Coordinate result) {
    in.x = x;
    in.y = y;
    transform.transform(in, out);
    result.x = out.x;
    result.y = out.y;
  }

  @Override
  public String toString() {
    return "MetricProjection[" + name + "]";
  }
}
