package com.urbancanopy.reader;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Locale;

/**
 * A place to analyze, identified by name and centered on {@code (lat, lon)}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Location(String name, String description, double lat, double lon) {

  public Location {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Location name is required");
    }
    if (!(lat >= -90 && lat <= 90) || !(lon >= -180 && lon <= 180)) {
      throw new IllegalArgumentException("Location " + name + " has invalid coordinates: " + lat + "," + lon);
    }
    description = description == null ? "" : description;
  }

  /** Returns a file-system safe identifier, for example {@code "aster_hill"} for {@code "Aster Hill"}. */
  public String slug() {
    String slug = name.strip().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_").replaceAll("^_+|_+$", "");
    return slug.isEmpty() ? "location" : slug;
  }
}
