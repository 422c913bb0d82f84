package com.urbancanopy.priority;

import com.urbancanopy.raster.Field;

/**
 * Component fields, composite score and classification of one location.
 * <p>
 * The composite is 0 on every pixel that is not plantable and those pixels are classified
 * {@link PriorityClass#NOT_PLANTABLE}.
 */
public record PriorityResult(
  Field sidewalkProximity,
  Field buildingCooling,
  Field sunExposure,
  Field amenityDensity,
  Field gapFilling,
  Field composite,
  Classification classification
) {

  public Field component(PriorityComponent component) {
    return switch (component) {
      case SIDEWALK_PROXIMITY -> sidewalkProximity;
      case BUILDING_COOLING -> buildingCooling;
      case SUN_EXPOSURE -> sunExposure;
      case AMENITY_DENSITY -> amenityDensity;
    };
  }
}
