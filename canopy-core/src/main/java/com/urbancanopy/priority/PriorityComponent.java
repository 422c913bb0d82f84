package com.urbancanopy.priority;

import com.urbancanopy.config.CanopyConfig;

/** The weighted factors that add up to the priority score of a pixel. */
public enum PriorityComponent {
  SIDEWALK_PROXIMITY("sidewalk_proximity"),
  BUILDING_COOLING("building_cooling"),
  SUN_EXPOSURE("sun_exposure"),
  AMENITY_DENSITY("amenity_density");

  private final String id;

  PriorityComponent(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  /** Returns the most points this component can contribute under {@code config}. */
  public double maxPossible(CanopyConfig config) {
    return switch (this) {
      case SIDEWALK_PROXIMITY -> config.sidewalkPoints();
      case BUILDING_COOLING -> config.buildingPoints();
      case SUN_EXPOSURE -> config.sunPoints();
      case AMENITY_DENSITY -> config.amenityPoints();
    };
  }
}
