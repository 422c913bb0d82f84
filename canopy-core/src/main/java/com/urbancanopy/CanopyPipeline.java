package com.urbancanopy;

import com.urbancanopy.config.CanopyConfig;
import com.urbancanopy.detect.FeatureDetector;
import com.urbancanopy.detect.FeatureRasters;
import com.urbancanopy.geo.GeometryAligner;
import com.urbancanopy.geo.Grid;
import com.urbancanopy.geo.MetricProjection;
import com.urbancanopy.geo.StreetNetwork;
import com.urbancanopy.mask.LocationMasks;
import com.urbancanopy.mask.MaskGenerator;
import com.urbancanopy.priority.PriorityResult;
import com.urbancanopy.priority.PriorityScorer;
import com.urbancanopy.reader.Location;
import com.urbancanopy.reader.LocationInputs;
import com.urbancanopy.reader.VectorLayer;
import com.urbancanopy.report.CoverageReport;
import com.urbancanopy.report.PriorityImageWriter;
import com.urbancanopy.report.Summary;
import com.urbancanopy.report.SummaryWriter;
import com.urbancanopy.spots.CriticalSpot;
import com.urbancanopy.spots.CriticalSpotExtractor;
import com.urbancanopy.stats.Stats;
import com.urbancanopy.util.Format;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every stage of the analysis for a single location: align vector data, classify streets, detect vegetation and
 * shadow, build obstacle masks, score priority, then extract critical spots and coverage statistics.
 * <p>
 * Instances are stateless apart from their configuration so one pipeline may analyze several locations concurrently.
 */
public class CanopyPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(CanopyPipeline.class);
  public static final String SUMMARY_FILE = "summary.json";
  public static final String PRIORITY_IMAGE_FILE = "priority.png";

  private final CanopyConfig config;
  private final Stats stats;
  private final Clock clock;

  public CanopyPipeline(CanopyConfig config, Stats stats) {
    this(config, stats, Clock.systemUTC());
  }

  CanopyPipeline(CanopyConfig config, Stats stats, Clock clock) {
    this.config = config;
    this.stats = stats;
    this.clock = clock;
  }

  public LocationAnalysis analyze(Location location, LocationInputs inputs) {
    String id = location.slug();
    double lat = location.lat();
    double lon = location.lon();
    BufferedImage image = inputs.satellite();
    if (image.getWidth() != config.imageWidth() || image.getHeight() != config.imageHeight()) {
      LOGGER.warn("{} satellite image is {}x{}, expected {}x{}", location.name(), image.getWidth(), image.getHeight(),
        config.imageWidth(), config.imageHeight());
    }
    Grid grid = Grid.fromCenter(lat, lon, image.getWidth(), image.getHeight(), config.zoom());
    MetricProjection projection = MetricProjection.forLocation(config, lat, lon);
    GeometryAligner aligner = new GeometryAligner(config, stats);

    VectorLayer buildings;
    VectorLayer streets;
    try (var ignored = stats.startStage(id, "align")) {
      buildings = aligner.align(inputs.buildings(), projection, lat, lon);
      streets = aligner.align(inputs.streets(), projection, lat, lon);
    }

    StreetNetwork network;
    try (var ignored = stats.startStage(id, "streets")) {
      network = aligner.classifyStreets(streets);
    }

    FeatureRasters features;
    try (var ignored = stats.startStage(id, "detect")) {
      features = new FeatureDetector(config).detect(image, grid);
    }

    LocationMasks masks;
    try (var ignored = stats.startStage(id, "masks")) {
      masks = new MaskGenerator(config, stats).generate(grid, projection, buildings, network, features.vegetation());
    }

    PriorityResult priority;
    try (var ignored = stats.startStage(id, "score")) {
      priority = new PriorityScorer(config).score(grid, masks.sidewalkDistance(), masks.buildingDistance(),
        features.shadowIntensity(), inputs.amenities(), masks.plantable());
    }

    List<CriticalSpot> spots;
    try (var ignored = stats.startStage(id, "spots")) {
      spots = new CriticalSpotExtractor(config).extract(priority.composite(), masks.plantable(), grid);
    }

    CoverageReport coverage = CoverageReport.of(grid, features, masks, priority);
    Summary summary = new SummaryWriter(config).summarize(location, timestamp(), grid, projection, coverage, network,
      inputs.buildings().size(), inputs.amenities().size(), spots);

    if (LOGGER.isInfoEnabled()) {
      Format format = Format.defaultInstance();
      LOGGER.info("{}: plantable {} of {}, {} critical spots", location.name(),
        format.area(coverage.areaM2(coverage.plantablePixels())), format.area(coverage.totalAreaM2()), spots.size());
    }
    return new LocationAnalysis(location, image, grid, projection, network, features, masks, priority, spots,
      coverage, summary);
  }

  /** Writes {@value #SUMMARY_FILE} and {@value #PRIORITY_IMAGE_FILE} for {@code analysis} into {@code directory}. */
  public void write(LocationAnalysis analysis, Path directory) throws IOException {
    try (var ignored = stats.startStage(analysis.location().slug(), "write")) {
      SummaryWriter.write(analysis.summary(), directory.resolve(SUMMARY_FILE));
      PriorityImageWriter.write(analysis.satellite(), analysis.priority().classification(),
        directory.resolve(PRIORITY_IMAGE_FILE));
      LOGGER.debug("Wrote outputs to {}", directory);
    }
  }

  private String timestamp() {
    return Instant.now(clock).truncatedTo(ChronoUnit.SECONDS).toString();
  }
}
