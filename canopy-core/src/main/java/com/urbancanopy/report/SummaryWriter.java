package com.urbancanopy.report;

import static com.fasterxml.jackson.annotation.JsonInclude.Include.NON_NULL;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.urbancanopy.config.CanopyConfig;
import com.urbancanopy.geo.Grid;
import com.urbancanopy.geo.MetricProjection;
import com.urbancanopy.geo.StreetNetwork;
import com.urbancanopy.geo.StreetTier;
import com.urbancanopy.priority.PriorityClass;
import com.urbancanopy.reader.Location;
import com.urbancanopy.spots.CriticalSpot;
import com.urbancanopy.util.Format;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the {@link Summary} of a location and writes it as pretty-printed JSON.
 * <p>
 * Areas, scores and percentages are rounded to 1 decimal and coordinates to 8.
 */
public class SummaryWriter {

  private static final ObjectWriter WRITER = new ObjectMapper()
    .setSerializationInclusion(NON_NULL)
    .writerWithDefaultPrettyPrinter();

  private static final Map<String, String> RECOMMENDATIONS = new LinkedHashMap<>();

  static {
    RECOMMENDATIONS.put("immediate_action",
      "Focus on critical priority spots (80-100 score) for immediate tree planting");
    RECOMMENDATIONS.put("secondary_targets", "High priority areas (60-80) are excellent for phase 2");
    RECOMMENDATIONS.put("long_term_planning", "Medium priority areas (40-60) for long-term urban greening");
    RECOMMENDATIONS.put("note", "Low priority areas (0-40) have minimal cooling/environmental impact");
  }

  private final CanopyConfig config;

  public SummaryWriter(CanopyConfig config) {
    this.config = config;
  }

  public Summary summarize(Location location, String timestamp, Grid grid, MetricProjection projection,
    CoverageReport coverage, StreetNetwork streets, int buildingCount, int amenityCount, List<CriticalSpot> spots) {
    var metadata = new Summary.Metadata(
      timestamp,
      round1(coverage.totalAreaM2()),
      Format.round(grid.metersPerPixel(), 4),
      new Summary.ImageDimensions(grid.width(), grid.height()),
      new Summary.Alignment(config.regionName(), config.alignScale(), config.northOffsetMeters(),
        config.eastOffsetMeters(), projection.name())
    );
    var land = new Summary.LandCoverage(
      coverage(coverage, coverage.buildingPixels(), buildingCount),
      coverage(coverage, coverage.vegetationPixels(), null),
      coverage(coverage, coverage.streetPixels(), null),
      coverage(coverage, coverage.shadowPixels(), null),
      coverage(coverage, coverage.plantablePixels(), null)
    );
    Map<String, Summary.PriorityBand> distribution = new LinkedHashMap<>();
    distribution.put("critical", band(coverage, PriorityClass.CRITICAL,
      range(config.criticalMinScore(), CanopyConfig.TOTAL_POINTS), spots.size()));
    distribution.put("high", band(coverage, PriorityClass.HIGH,
      range(config.highMinScore(), config.criticalMinScore()), null));
    distribution.put("medium", band(coverage, PriorityClass.MEDIUM,
      range(config.mediumMinScore(), config.highMinScore()), null));
    distribution.put("low", band(coverage, PriorityClass.LOW, range(0, config.mediumMinScore()), null));

    var network = new Summary.StreetNetworkInfo(
      streets.total(),
      streets.count(StreetTier.PEDESTRIAN),
      streets.count(StreetTier.LOW),
      streets.count(StreetTier.MEDIUM),
      streets.count(StreetTier.HIGH),
      streets.unmatched()
    );
    List<Summary.Spot> spotSummaries = spots.stream().map(SummaryWriter::spot).toList();

    return new Summary(
      new Summary.LocationInfo(location.name(), location.description(),
        new Summary.Coordinates(location.lat(), location.lon())),
      metadata,
      land,
      distribution,
      network,
      new Summary.AmenityInfo(amenityCount),
      spotSummaries,
      Collections.unmodifiableMap(RECOMMENDATIONS)
    );
  }

  private static Summary.Spot spot(CriticalSpot spot) {
    double lat = Format.round(spot.lat(), 8);
    double lon = Format.round(spot.lon(), 8);
    return new Summary.Spot(
      spot.id(),
      new Summary.Coordinates(lat, lon),
      round1(spot.meanScore()),
      round1(spot.areaM2()),
      spot.pixelCount(),
      Format.streetViewUrl(lat, lon),
      Format.mapsUrl(lat, lon)
    );
  }

  private static Summary.Coverage coverage(CoverageReport coverage, int pixels, Integer count) {
    return new Summary.Coverage(round1(coverage.areaM2(pixels)), round1(coverage.percentOfTotal(pixels)), count);
  }

  private static Summary.PriorityBand band(CoverageReport coverage, PriorityClass priorityClass, String range,
    Integer spots) {
    return new Summary.PriorityBand(range, round1(coverage.areaM2(coverage.pixels(priorityClass))),
      round1(coverage.percentOfPlantable(priorityClass)), spots);
  }

  private static String range(double min, double max) {
    return String.format(Locale.ROOT, "%.0f-%.0f", min, max);
  }

  private static double round1(double value) {
    return Format.round(value, 1);
  }

  public static String toJson(Summary summary) {
    try {
      return WRITER.writeValueAsString(summary);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to serialize summary", e);
    }
  }

  /** Writes {@code summary} to {@code path}, creating parent directories. */
  public static void write(Summary summary, Path path) throws IOException {
    if (path.getParent() != null) {
      Files.createDirectories(path.getParent());
    }
    WRITER.writeValue(path.toFile(), summary);
  }
}
