package com.urbancanopy.reader;

import java.util.List;
import java.util.function.UnaryOperator;
import org.locationtech.jts.geom.Geometry;

/**
 * An ordered, read-only collection of features that share a role at a location, like buildings or streets.
 */
public record VectorLayer(String name, List<VectorFeature> features) {

  public VectorLayer {
    features = List.copyOf(features);
  }

  public static VectorLayer empty(String name) {
    return new VectorLayer(name, List.of());
  }

  public int size() {
    return features.size();
  }

  public boolean isEmpty() {
    return features.isEmpty();
  }

  public List<Geometry> geometries() {
    return features.stream().map(VectorFeature::geometry).toList();
  }

  /** Returns a new layer with {@code transform} applied to every geometry, keeping tags. */
  public VectorLayer mapGeometries(UnaryOperator<Geometry> transform) {
    return new VectorLayer(name, features.stream().map(f -> f.withGeometry(transform.apply(f.geometry()))).toList());
  }
}
