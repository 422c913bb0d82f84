package com.urbancanopy.geo;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;

/**
 * The spatial frame shared by every raster of a location: pixel dimensions plus the geographic bounding box they
 * cover.
 * <p>
 * Pixel {@code (0,0)} is the top-left corner. {@code x} maps linearly to longitude and {@code y} maps linearly and
 * inversely to latitude. Pixel coordinates are continuous, so the center of pixel {@code (i,j)} is at
 * {@code (i+0.5, j+0.5)}.
 */
public record Grid(int width, int height, double minLat, double maxLat, double minLon, double maxLon) {

  public Grid {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("Grid must have positive size, was " + width + "x" + height);
    }
    if (!(maxLat > minLat) || !(maxLon > minLon)) {
      throw new IllegalArgumentException("Grid bounds must have positive extent, was lat=[" + minLat + "," + maxLat +
        "] lon=[" + minLon + "," + maxLon + "]");
    }
  }

  /**
   * Returns the grid of a {@code width x height} web mercator image at {@code zoom} centered on
   * {@code (lat, lon)}.
   */
  public static Grid fromCenter(double lat, double lon, int width, int height, int zoom) {
    double metersPerPixel = GeoUtils.webMercatorMetersPerPixel(lat, zoom);
    double latOffset = GeoUtils.metersToLatDegrees(height / 2d * metersPerPixel);
    double lonOffset = GeoUtils.metersToLonDegrees(width / 2d * metersPerPixel, lat);
    return new Grid(width, height, lat - latOffset, lat + latOffset, lon - lonOffset, lon + lonOffset);
  }

  /** Returns a grid covering {@code bounds} (x=longitude, y=latitude). */
  public static Grid fromBounds(Envelope bounds, int width, int height) {
    return new Grid(width, height, bounds.getMinY(), bounds.getMaxY(), bounds.getMinX(), bounds.getMaxX());
  }

  public double centerLat() {
    return (minLat + maxLat) / 2;
  }

  public double centerLon() {
    return (minLon + maxLon) / 2;
  }

  public int pixelCount() {
    return width * height;
  }

  /** Returns the ground distance in meters covered by one pixel. */
  public double metersPerPixel() {
    return GeoUtils.latDegreesToMeters(maxLat - minLat) / height;
  }

  public double pixelAreaM2() {
    double mpp = metersPerPixel();
    return mpp * mpp;
  }

  /** Returns the length in meters of the diagonal of the grid. */
  public double diagonalMeters() {
    return Math.hypot(width, height) * metersPerPixel();
  }

  public Envelope bounds() {
    return new Envelope(minLon, maxLon, minLat, maxLat);
  }

  /** Returns the longitude at continuous pixel column {@code x}. */
  public double lon(double x) {
    return minLon + x / width * (maxLon - minLon);
  }

  /** Returns the latitude at continuous pixel row {@code y}. */
  public double lat(double y) {
    return maxLat - y / height * (maxLat - minLat);
  }

  /** Returns the continuous pixel column of {@code lon}. */
  public double x(double lon) {
    return (lon - minLon) / (maxLon - minLon) * width;
  }

  /** Returns the continuous pixel row of {@code lat}. */
  public double y(double lat) {
    return (maxLat - lat) / (maxLat - minLat) * height;
  }

  /** Returns {@code (lon, lat)} of continuous pixel {@code (x, y)}. */
  public Coordinate toLonLat(double x, double y) {
    return new CoordinateXY(lon(x), lat(y));
  }

  /** Returns continuous pixel {@code (x, y)} of {@code (lon, lat)}. */
  public Coordinate toPixel(double lon, double lat) {
    return new CoordinateXY(x(lon), y(lat));
  }

  /** Returns a copy of {@code lonLatGeometry} in continuous pixel coordinates. */
  public Geometry toPixelCoords(Geometry lonLatGeometry) {
    return GeoUtils.transform(lonLatGeometry, (lon, lat, out) -> {
      out.x = x(lon);
      out.y = y(lat);
    });
  }

  /** Returns {@code true} if the integer pixel {@code (x, y)} lies in this grid. */
  public boolean contains(int x, int y) {
    return x >= 0 && y >= 0 && x < width && y < height;
  }
}
