package com.urbancanopy.config;

import com.urbancanopy.geo.StreetTier;
import java.util.stream.Stream;

/**
 * Holder for every tunable constant of the pipeline, explicitly passed into each stage.
 * <p>
 * Defaults are the values validated for Kuala Lumpur imagery at zoom 18. Construction validates the values so that
 * invalid configuration fails before any location is processed.
 */
public record CanopyConfig(
  int threads,
  int imageWidth,
  int imageHeight,
  int zoom,
  String regionName,
  double alignScale,
  double northOffsetMeters,
  double eastOffsetMeters,
  String metricCrs,
  double highTrafficBufferMeters,
  double mediumTrafficBufferMeters,
  double lowTrafficBufferMeters,
  double pedestrianBufferMeters,
  double sidewalkBufferMeters,
  StreetTier unmatchedStreetTier,
  double ndviThreshold,
  double ndviEpsilon,
  int vegetationMinBrightness,
  int shadowBrightnessThreshold,
  int shadowDesaturationThreshold,
  int shadowVeryDarkThreshold,
  int shadowMinSizePixels,
  double shadowBlurSigma,
  double sidewalkPoints,
  double buildingPoints,
  double sunPoints,
  double amenityPoints,
  double gapPoints,
  Breakpoints sidewalkBreakpoints,
  Breakpoints buildingBreakpoints,
  Breakpoints sunBreakpoints,
  double amenityRadiusMeters,
  double criticalMinScore,
  double highMinScore,
  double mediumMinScore,
  int minSpotSizePixels
) {

  public static final double TOTAL_POINTS = 100;

  public CanopyConfig {
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be >= 1, was " + threads);
    }
    if (imageWidth <= 0 || imageHeight <= 0) {
      throw new IllegalArgumentException("Image size must be positive, was " + imageWidth + "x" + imageHeight);
    }
    if (zoom < 0 || zoom > 23) {
      throw new IllegalArgumentException("zoom must be in [0,23], was " + zoom);
    }
    if (!(alignScale > 0) || !Double.isFinite(alignScale)) {
      throw new IllegalArgumentException("align_scale must be positive, was " + alignScale);
    }
    requireNonNegative("high_traffic_buffer", highTrafficBufferMeters);
    requireNonNegative("medium_traffic_buffer", mediumTrafficBufferMeters);
    requireNonNegative("low_traffic_buffer", lowTrafficBufferMeters);
    requireNonNegative("pedestrian_buffer", pedestrianBufferMeters);
    requireNonNegative("sidewalk_buffer", sidewalkBufferMeters);
    requireNonNegative("ndvi_epsilon", ndviEpsilon);
    requireNonNegative("shadow_min_size", shadowMinSizePixels);
    requireNonNegative("shadow_blur_sigma", shadowBlurSigma);
    requireNonNegative("amenity_radius", amenityRadiusMeters);
    requireNonNegative("min_spot_size", minSpotSizePixels);
    if (unmatchedStreetTier == null) {
      throw new IllegalArgumentException("unmatched_street_tier must name a street tier");
    }
    for (double points : new double[]{sidewalkPoints, buildingPoints, sunPoints, amenityPoints, gapPoints}) {
      requireNonNegative("points", points);
    }
    double total = sidewalkPoints + buildingPoints + sunPoints + amenityPoints + gapPoints;
    if (Math.abs(total - TOTAL_POINTS) > 1e-9) {
      throw new IllegalArgumentException("Component points must sum to " + TOTAL_POINTS + ", was " + total);
    }
    requireWithinBudget("sidewalk_breakpoints", sidewalkBreakpoints, sidewalkPoints);
    requireWithinBudget("building_breakpoints", buildingBreakpoints, buildingPoints);
    requireWithinBudget("sun_breakpoints", sunBreakpoints, sunPoints);
    if (!(0 < mediumMinScore && mediumMinScore < highMinScore && highMinScore < criticalMinScore &&
      criticalMinScore <= TOTAL_POINTS)) {
      throw new IllegalArgumentException("Classification thresholds must increase inside (0,100], was medium=" +
        mediumMinScore + " high=" + highMinScore + " critical=" + criticalMinScore);
    }
  }

  private static void requireNonNegative(String name, double value) {
    if (!(value >= 0) || !Double.isFinite(value)) {
      throw new IllegalArgumentException(name + " must be >= 0, was " + value);
    }
  }

  private static void requireWithinBudget(String name, Breakpoints breakpoints, double budget) {
    if (breakpoints == null) {
      throw new IllegalArgumentException(name + " is required");
    }
    if (breakpoints.minValue() < 0 || breakpoints.maxValue() > budget) {
      throw new IllegalArgumentException(name + " values must be within [0," + budget + "], was " + breakpoints);
    }
  }

  public static CanopyConfig defaults() {
    return from(Arguments.of());
  }

  public static CanopyConfig from(Arguments arguments) {
    return new CanopyConfig(
      arguments.threads(),
      arguments.getInteger("image_width", "satellite image width in pixels", 640),
      arguments.getInteger("image_height", "satellite image height in pixels", 640),
      arguments.getInteger("zoom", "web mercator zoom level the satellite image was captured at", 18),
      arguments.getString("region", "name of the region the alignment calibration was validated for",
        "kuala_lumpur"),
      arguments.getDouble("align_scale", "scale factor applied to vector data around the location center", 1.95),
      arguments.getDouble("align_north_offset", "meters to shift vector data north after scaling", -5),
      arguments.getDouble("align_east_offset", "meters to shift vector data east after scaling", -10),
      arguments.getString("metric_crs",
        "proj4 definition of the metric CRS to buffer streets in, or blank for the UTM zone of the location", ""),
      arguments.getDouble("high_traffic_buffer", "buffer radius in meters around high traffic streets", 25),
      arguments.getDouble("medium_traffic_buffer", "buffer radius in meters around medium traffic streets", 15),
      arguments.getDouble("low_traffic_buffer", "buffer radius in meters around low traffic streets", 10),
      arguments.getDouble("pedestrian_buffer", "buffer radius in meters around pedestrian streets", 5),
      arguments.getDouble("sidewalk_buffer", "buffer radius in meters of the sidewalk mask", 5),
      arguments.getObject("unmatched_street_tier",
        "tier assigned to streets whose highway tag matches no tier, one of " +
          Stream.of(StreetTier.values()).map(StreetTier::id).toList(),
        StreetTier.LOW, StreetTier::from),
      arguments.getDouble("ndvi_threshold", "minimum NDVI of a vegetation pixel", 0.2),
      arguments.getDouble("ndvi_epsilon", "added to the NDVI denominator to avoid dividing by zero", 1e-8),
      arguments.getInteger("vegetation_min_brightness", "minimum brightness (0-255) of a vegetation pixel", 60),
      arguments.getInteger("shadow_brightness", "brightness (0-255) below which a desaturated pixel is shadow", 95),
      arguments.getInteger("shadow_desaturation", "saturation (0-255) below which a dark pixel is shadow", 60),
      arguments.getInteger("shadow_very_dark", "brightness (0-255) below which any pixel is shadow", 70),
      arguments.getInteger("shadow_min_size", "minimum pixels in a shadow region to keep", 20),
      arguments.getDouble("shadow_blur_sigma", "gaussian sigma in pixels used to smooth shadow intensity", 2),
      arguments.getDouble("sidewalk_points", "points budget for sidewalk proximity", 35),
      arguments.getDouble("building_points", "points budget for building cooling", 25),
      arguments.getDouble("sun_points", "points budget for sun exposure", 20),
      arguments.getDouble("amenity_points", "points budget for amenity density", 10),
      arguments.getDouble("gap_points", "points reserved for gap filling", 10),
      arguments.getObject("sidewalk_breakpoints", "points by meters to the nearest sidewalk",
        Breakpoints.parse("<=5:35,<=10:25,<=20:15,<=30:5,else:0"), Breakpoints::parse),
      arguments.getObject("building_breakpoints", "points by meters to the nearest building",
        Breakpoints.parse("<5:0,<=15:25,<=30:15,<=50:5,else:0"), Breakpoints::parse),
      arguments.getObject("sun_breakpoints", "points by shadow intensity (0-1)",
        Breakpoints.parse("<0.3:20,<0.6:12,else:5"), Breakpoints::parse),
      arguments.getDouble("amenity_radius", "radius in meters that amenities attract pedestrians from", 50),
      arguments.getDouble("critical_min_score", "minimum score of critical priority pixels", 80),
      arguments.getDouble("high_min_score", "minimum score of high priority pixels", 60),
      arguments.getDouble("medium_min_score", "minimum score of medium priority pixels", 40),
      arguments.getInteger("min_spot_size", "minimum pixels in a critical planting spot", 20)
    );
  }

  /** Returns the buffer radius in meters for streets of {@code tier}. */
  public double bufferMeters(StreetTier tier) {
    return switch (tier) {
      case PEDESTRIAN -> pedestrianBufferMeters;
      case LOW -> lowTrafficBufferMeters;
      case MEDIUM -> mediumTrafficBufferMeters;
      case HIGH -> highTrafficBufferMeters;
    };
  }

  /** Returns {@code true} if a metric CRS override was configured instead of the location's UTM zone. */
  public boolean hasMetricCrsOverride() {
    return metricCrs != null && !metricCrs.isBlank();
  }
}
