package com.urbancanopy.geo;

import com.urbancanopy.stats.Stats;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.WKTWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An error caused by unexpected input geometry that should be handled by skipping the geometry, without halting the
 * rest of a location for bad data we are sure to encounter in the wild.
 */
public class GeometryException extends Exception {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeometryException.class);

  private final String stat;
  private final List<Supplier<String>> detailsSuppliers = new ArrayList<>();

  /**
   * Constructs a new exception with a detailed error message caused by {@code cause}.
   *
   * @param stat    string that uniquely defines this error that will be used to count number of occurrences in stats
   * @param message description of the error to log that should be detailed enough to find the offending geometry
   * @param cause   the original exception that was thrown
   */
  public GeometryException(String stat, String message, Throwable cause) {
    super(message, cause);
    this.stat = stat;
  }

  public GeometryException(String stat, String message) {
    super(message);
    this.stat = stat;
  }

  public GeometryException addDetails(Supplier<String> detailsSupplier) {
    this.detailsSuppliers.add(detailsSupplier);
    return this;
  }

  /** Adds the WKT of {@code geometry} to the logged details. */
  public GeometryException addGeometryDetails(String name, Geometry geometry) {
    return addDetails(() -> name + " (wkt): " + new WKTWriter().write(geometry));
  }

  /** Returns the unique code for this error condition to use for counting the number of occurrences in stats. */
  public String stat() {
    return stat;
  }

  /** Increments a stat counter for this error and logs it. */
  public void log(Stats stats, String statPrefix, String logPrefix) {
    stats.dataError(statPrefix + "_" + stat());
    log(logPrefix);
  }

  /** Logs the error but does not increment any stats. */
  public void log(String logPrefix) {
    StringBuilder log = new StringBuilder(logPrefix + ": " + getMessage());
    if (LOGGER.isDebugEnabled()) {
      for (var details : detailsSuppliers) {
        log.append("\n").append(details.get());
      }
    }
    LOGGER.warn(log.toString());
  }
}
