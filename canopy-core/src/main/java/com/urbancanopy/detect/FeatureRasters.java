package com.urbancanopy.detect;

import com.urbancanopy.raster.Field;
import com.urbancanopy.raster.Mask;

/**
 * Image-derived rasters of one location.
 *
 * @param ndvi            green/red vegetation index, in {@code [-1, 1]}
 * @param brightness      HSV value channel, in {@code [0, 255]}
 * @param saturation      HSV saturation channel, in {@code [0, 255]}
 * @param vegetation      pixels that are green and bright enough to be vegetation
 * @param shadow          cleaned shadow regions, never overlapping vegetation
 * @param shadowIntensity smoothed darkness in {@code [0, 1]} where 1 is fully dark
 */
public record FeatureRasters(
  Field ndvi,
  Field brightness,
  Field saturation,
  Mask vegetation,
  Mask shadow,
  Field shadowIntensity
) {}
