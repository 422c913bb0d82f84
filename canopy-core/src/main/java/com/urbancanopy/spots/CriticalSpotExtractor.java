package com.urbancanopy.spots;

import com.urbancanopy.config.CanopyConfig;
import com.urbancanopy.geo.Grid;
import com.urbancanopy.raster.ConnectedComponents;
import com.urbancanopy.raster.Field;
import com.urbancanopy.raster.Mask;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups critical priority plantable pixels into 8-connected clusters and ranks them by mean score.
 */
public class CriticalSpotExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(CriticalSpotExtractor.class);

  private final CanopyConfig config;

  public CriticalSpotExtractor(CanopyConfig config) {
    this.config = config;
  }

  /** Returns the spots of pixels scoring at least the critical threshold that are also plantable. */
  public List<CriticalSpot> extract(Field composite, Mask plantable, Grid grid) {
    Mask critical = composite.atLeast(config.criticalMinScore()).and(plantable);
    return extract(critical, composite, grid, config.minSpotSizePixels());
  }

  /**
   * Returns a spot for each 8-connected cluster of {@code critical} with at least {@code minSize} pixels, sorted by
   * descending mean score with ties broken by the order clusters were found in, and numbered from 1.
   * <p>
   * The centroid is the mean of member pixel indices, so it may fall outside a non-convex cluster. It is geocoded at
   * the center of that pixel position.
   */
  public static List<CriticalSpot> extract(Mask critical, Field composite, Grid grid, int minSize) {
    ConnectedComponents components = ConnectedComponents.label(critical);
    double[] sums = components.sums(composite);
    double pixelArea = grid.pixelAreaM2();

    record Candidate(int label, double meanScore) {}
    List<Candidate> candidates = new ArrayList<>();
    for (int label = 1; label <= components.count(); label++) {
      int size = components.size(label);
      if (size >= minSize) {
        candidates.add(new Candidate(label, sums[label] / size));
      }
    }
    candidates.sort(Comparator.comparingDouble(Candidate::meanScore).reversed()
      .thenComparingInt(Candidate::label));

    List<CriticalSpot> spots = new ArrayList<>(candidates.size());
    for (Candidate candidate : candidates) {
      int label = candidate.label();
      double cx = components.centroidX(label);
      double cy = components.centroidY(label);
      int size = components.size(label);
      spots.add(new CriticalSpot(
        spots.size() + 1,
        cx,
        cy,
        grid.lat(cy + 0.5),
        grid.lon(cx + 0.5),
        size,
        size * pixelArea,
        candidate.meanScore()
      ));
    }
    LOGGER.debug("Found {} critical spots from {} clusters", spots.size(), components.count());
    return spots;
  }
}
