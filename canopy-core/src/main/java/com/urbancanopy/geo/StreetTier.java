package com.urbancanopy.geo;

import java.util.Locale;
import java.util.Set;

/**
 * Traffic classification of a street, derived from its OpenStreetMap {@code highway} tag.
 */
public enum StreetTier {
  PEDESTRIAN("pedestrian", Set.of("footway", "pedestrian", "living_street", "path", "steps")),
  LOW("low", Set.of("residential", "tertiary", "unclassified", "service")),
  MEDIUM("medium", Set.of("secondary", "secondary_link")),
  HIGH("high", Set.of("primary", "primary_link", "trunk", "trunk_link", "motorway", "motorway_link"));

  private final String id;
  private final Set<String> highwayTags;

  StreetTier(String id, Set<String> highwayTags) {
    this.id = id;
    this.highwayTags = highwayTags;
  }

  public String id() {
    return id;
  }

  public Set<String> highwayTags() {
    return highwayTags;
  }

  /** Returns the tier whose tag set contains {@code highway}, or {@code null} if none does. */
  public static StreetTier forHighwayTag(String highway) {
    if (highway == null) {
      return null;
    }
    String normalized = highway.strip().toLowerCase(Locale.ROOT);
    for (StreetTier tier : values()) {
      if (tier.highwayTags.contains(normalized)) {
        return tier;
      }
    }
    return null;
  }

  /**
   * Returns the tier with {@code id} (case-insensitive, also accepts {@code low_traffic} style names).
   *
   * @throws IllegalArgumentException if no tier has that id
   */
  public static StreetTier from(String id) {
    String normalized = id.strip().toLowerCase(Locale.ROOT).replaceFirst("[_-]traffic$", "");
    for (StreetTier tier : values()) {
      if (tier.id.equals(normalized)) {
        return tier;
      }
    }
    throw new IllegalArgumentException("Unknown street tier: " + id);
  }
}
