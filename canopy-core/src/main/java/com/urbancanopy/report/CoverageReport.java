package com.urbancanopy.report;

import com.urbancanopy.detect.FeatureRasters;
import com.urbancanopy.geo.Grid;
import com.urbancanopy.mask.LocationMasks;
import com.urbancanopy.priority.PriorityClass;
import com.urbancanopy.priority.PriorityResult;
import com.urbancanopy.util.Format;
import java.util.Map;

/**
 * Pixel-count based coverage breakdown of one location.
 * <p>
 * Percentages are 0 rather than undefined when their denominator is 0.
 */
public record CoverageReport(
  int totalPixels,
  double pixelAreaM2,
  int buildingPixels,
  int vegetationPixels,
  int streetPixels,
  int shadowPixels,
  int plantablePixels,
  Map<PriorityClass, Integer> priorityPixels
) {

  public CoverageReport {
    priorityPixels = Map.copyOf(priorityPixels);
  }

  public static CoverageReport of(Grid grid, FeatureRasters features, LocationMasks masks, PriorityResult priority) {
    return new CoverageReport(
      grid.pixelCount(),
      grid.pixelAreaM2(),
      masks.buildings().count(),
      masks.vegetation().count(),
      masks.streets().count(),
      features.shadow().count(),
      masks.plantable().count(),
      priority.classification().counts()
    );
  }

  public double totalAreaM2() {
    return areaM2(totalPixels);
  }

  public double areaM2(int pixels) {
    return pixels * pixelAreaM2;
  }

  /** Returns {@code pixels} as a percentage of the whole grid. */
  public double percentOfTotal(int pixels) {
    return Format.percentage(pixels, totalPixels);
  }

  public int pixels(PriorityClass priorityClass) {
    return priorityPixels.getOrDefault(priorityClass, 0);
  }

  /** Returns the pixels in {@code priorityClass} as a percentage of plantable pixels. */
  public double percentOfPlantable(PriorityClass priorityClass) {
    return Format.percentage(pixels(priorityClass), plantablePixels);
  }
}
