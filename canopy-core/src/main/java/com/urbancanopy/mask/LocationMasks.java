package com.urbancanopy.mask;

import com.urbancanopy.raster.Field;
import com.urbancanopy.raster.Mask;

/**
 * Obstacle masks and distance fields of one location. Distances are in meters.
 *
 * @param buildings        building footprints
 * @param streets          streets buffered by the radius of their tier
 * @param sidewalks        pedestrian and low traffic streets buffered by the sidewalk radius
 * @param vegetation       existing vegetation
 * @param plantable        pixels that are not a building, street or vegetation
 * @param buildingDistance distance to the nearest building pixel
 * @param sidewalkDistance distance to the nearest sidewalk pixel
 */
public record LocationMasks(
  Mask buildings,
  Mask streets,
  Mask sidewalks,
  Mask vegetation,
  Mask plantable,
  Field buildingDistance,
  Field sidewalkDistance
) {}
