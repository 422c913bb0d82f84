package com.urbancanopy.geo;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.locationtech.jts.geom.Geometry;

/**
 * Street geometries of a location grouped by {@link StreetTier}.
 *
 * @param byTier    geometries of each tier in longitude/latitude, with an entry for every tier
 * @param unmatched number of streets whose tag matched no tier and were assigned the default tier
 */
public record StreetNetwork(Map<StreetTier, List<Geometry>> byTier, int unmatched) {

  public StreetNetwork {
    Map<StreetTier, List<Geometry>> copy = new EnumMap<>(StreetTier.class);
    for (StreetTier tier : StreetTier.values()) {
      copy.put(tier, List.copyOf(byTier.getOrDefault(tier, List.of())));
    }
    byTier = copy;
  }

  public static StreetNetwork empty() {
    return new StreetNetwork(Map.of(), 0);
  }

  public List<Geometry> streets(StreetTier tier) {
    return byTier.get(tier);
  }

  /** Returns the geometries of every tier in {@code tiers}. */
  public List<Geometry> streets(Collection<StreetTier> tiers) {
    List<Geometry> result = new ArrayList<>();
    for (StreetTier tier : tiers) {
      result.addAll(byTier.get(tier));
    }
    return result;
  }

  public int count(StreetTier tier) {
    return byTier.get(tier).size();
  }

  public int total() {
    return byTier.values().stream().mapToInt(List::size).sum();
  }

  public boolean isEmpty() {
    return total() == 0;
  }
}
