package com.urbancanopy;

import com.urbancanopy.config.CanopyConfig;
import com.urbancanopy.reader.Location;
import com.urbancanopy.reader.LocationInputs;
import com.urbancanopy.stats.Stats;
import com.urbancanopy.util.Try;
import com.urbancanopy.worker.Worker;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Analyzes a batch of locations in parallel, reading inputs from {@code <input>/<location slug>/} and writing outputs
 * to {@code <output>/<location slug>/}.
 * <p>
 * A location that fails is logged and reported as a failed {@link LocationResult} without stopping the others.
 */
public class Canopy {

  private static final Logger LOGGER = LoggerFactory.getLogger(Canopy.class);

  private final CanopyConfig config;
  private final Stats stats;
  private final CanopyPipeline pipeline;

  public Canopy(CanopyConfig config, Stats stats) {
    this(config, stats, new CanopyPipeline(config, stats));
  }

  Canopy(CanopyConfig config, Stats stats, CanopyPipeline pipeline) {
    this.config = config;
    this.stats = stats;
    this.pipeline = pipeline;
  }

  /** Returns one result per location in the same order as {@code locations}. */
  public List<LocationResult> run(List<Location> locations, Path inputDir, Path outputDir) {
    if (locations.isEmpty()) {
      LOGGER.warn("No locations to analyze");
      return List.of();
    }
    LOGGER.info("Analyzing {} locations from {} into {} with {} threads", locations.size(), inputDir, outputDir,
      Math.min(config.threads(), locations.size()));
    AtomicReferenceArray<LocationResult> results = new AtomicReferenceArray<>(locations.size());
    List<Integer> indices = IntStream.range(0, locations.size()).boxed().toList();
    Worker.forEach("analyze", stats, config.threads(), indices,
      i -> results.set(i, process(locations.get(i), inputDir, outputDir)))
      .await();

    List<LocationResult> ordered = new ArrayList<>(locations.size());
    for (int i = 0; i < locations.size(); i++) {
      ordered.add(results.get(i));
    }
    long failed = ordered.stream().filter(result -> !result.isSuccess()).count();
    LOGGER.info("Finished {} locations, {} failed", ordered.size(), failed);
    return ordered;
  }

  /** Analyzes one location, catching any failure. */
  public LocationResult process(Location location, Path inputDir, Path outputDir) {
    String slug = location.slug();
    LOGGER.info("Analyzing {} ({}, {})", location.name(), location.lat(), location.lon());
    Try<LocationAnalysis> result = Try.apply(() -> {
      LocationInputs inputs = LocationInputs.load(inputDir.resolve(slug));
      LocationAnalysis analysis = pipeline.analyze(location, inputs);
      pipeline.write(analysis, outputDir.resolve(slug));
      return analysis;
    });
    return result.fold(
      analysis -> {
        stats.increment("locations_succeeded");
        return LocationResult.success(analysis);
      },
      exception -> {
        stats.increment("locations_failed");
        LOGGER.error("Failed to analyze {}", location.name(), exception);
        return LocationResult.failed(location, exception);
      }
    );
  }
}
