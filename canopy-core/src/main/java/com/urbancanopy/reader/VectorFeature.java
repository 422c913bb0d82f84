package com.urbancanopy.reader;

import java.util.Map;
import org.locationtech.jts.geom.Geometry;

/**
 * A geometry in longitude/latitude coordinates with its source attributes.
 */
public record VectorFeature(Geometry geometry, @Override Map<String, Object> tags) implements WithTags {

  public VectorFeature {
    tags = tags == null ? Map.of() : tags;
  }

  public VectorFeature(Geometry geometry) {
    this(geometry, Map.of());
  }

  /** Returns a copy of this feature with {@code newGeometry} and the same tags. */
  public VectorFeature withGeometry(Geometry newGeometry) {
    return new VectorFeature(newGeometry, tags);
  }
}
