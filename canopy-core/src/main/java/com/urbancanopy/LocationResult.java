package com.urbancanopy;

import com.urbancanopy.reader.Location;
import java.util.Optional;

/**
 * Outcome of processing one location in a batch: either its analysis or the exception that stopped it.
 */
public record LocationResult(Location location, Optional<LocationAnalysis> analysis, Optional<Exception> failure) {

  public static LocationResult success(LocationAnalysis analysis) {
    return new LocationResult(analysis.location(), Optional.of(analysis), Optional.empty());
  }

  public static LocationResult failed(Location location, Exception failure) {
    return new LocationResult(location, Optional.empty(), Optional.of(failure));
  }

  public boolean isSuccess() {
    return analysis.isPresent();
  }
}
