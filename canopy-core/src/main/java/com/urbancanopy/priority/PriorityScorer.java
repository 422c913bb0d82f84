package com.urbancanopy.priority;

import com.urbancanopy.config.CanopyConfig;
import com.urbancanopy.geo.Grid;
import com.urbancanopy.raster.Field;
import com.urbancanopy.raster.Mask;
import com.urbancanopy.reader.VectorFeature;
import com.urbancanopy.reader.VectorLayer;
import com.urbancanopy.util.Format;
import java.util.ArrayList;
import java.util.List;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Puntal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores each pixel for tree planting out of 100 points.
 * <p>
 * Sidewalk proximity, building cooling and sun exposure are piecewise functions of a distance or shadow field.
 * Amenity density is a sum of gaussian kernels around amenity points, normalized so the densest pixel gets the full
 * budget. The gap filling budget is reserved and always contributes 0.
 */
public class PriorityScorer {

  private static final Logger LOGGER = LoggerFactory.getLogger(PriorityScorer.class);
  private static final Format FORMAT = Format.defaultInstance();

  private final CanopyConfig config;

  public PriorityScorer(CanopyConfig config) {
    this.config = config;
  }

  public PriorityResult score(Grid grid, Field sidewalkDistance, Field buildingDistance, Field shadowIntensity,
    VectorLayer amenities, Mask plantable) {
    Field sidewalk = sidewalkDistance.map(config.sidewalkBreakpoints()::apply);
    Field building = buildingDistance.map(config.buildingBreakpoints()::apply);
    Field sun = shadowIntensity.map(config.sunBreakpoints()::apply);
    Field amenity = amenityDensity(grid, amenities);
    Field gap = gapFilling(grid);
    Field composite = composite(List.of(sidewalk, building, sun, amenity, gap), plantable);
    Classification classification = classify(composite, plantable);

    if (LOGGER.isDebugEnabled() && plantable.count() > 0) {
      double total = plantable.count();
      LOGGER.debug("Priority critical: {} high: {} medium: {} low: {}",
        FORMAT.percent(classification.count(PriorityClass.CRITICAL) / total),
        FORMAT.percent(classification.count(PriorityClass.HIGH) / total),
        FORMAT.percent(classification.count(PriorityClass.MEDIUM) / total),
        FORMAT.percent(classification.count(PriorityClass.LOW) / total));
    }
    return new PriorityResult(sidewalk, building, sun, amenity, gap, composite, classification);
  }

  /** Returns the sum of {@code components} clamped to {@code [0, 100]}, and 0 where {@code plantable} is not set. */
  public static Field composite(List<Field> components, Mask plantable) {
    return Field.fromIndex(plantable.width(), plantable.height(), i -> {
      if (!plantable.get(i)) {
        return 0;
      }
      double sum = 0;
      for (Field component : components) {
        sum += component.get(i);
      }
      return Math.max(0, Math.min(CanopyConfig.TOTAL_POINTS, sum));
    });
  }

  /** Returns the class of every pixel, {@link PriorityClass#NOT_PLANTABLE} where {@code plantable} is not set. */
  public Classification classify(Field composite, Mask plantable) {
    byte[] classes = new byte[composite.size()];
    for (int i = 0; i < classes.length; i++) {
      PriorityClass priorityClass =
        plantable.get(i) ? PriorityClass.of(composite.get(i), config) : PriorityClass.NOT_PLANTABLE;
      classes[i] = (byte) priorityClass.ordinal();
    }
    return new Classification(composite.width(), composite.height(), classes);
  }

  /** Reserved for a future gap filling bonus. */
  Field gapFilling(Grid grid) {
    return Field.constant(grid.width(), grid.height(), 0);
  }

  /**
   * Returns the amenity density component: each amenity adds {@code exp(-(d/r)^2)} to pixels within {@code r} of it,
   * where {@code r} is the amenity radius in pixels, then the result is scaled so the maximum is the amenity budget.
   */
  public Field amenityDensity(Grid grid, VectorLayer amenities) {
    int width = grid.width();
    int height = grid.height();
    List<Coordinate> points = amenityPoints(amenities);
    if (points.isEmpty()) {
      return Field.constant(width, height, 0);
    }
    int radius = (int) Math.round(config.amenityRadiusMeters() / grid.metersPerPixel());
    double[] kernel = new double[(2 * radius + 1) * (2 * radius + 1)];
    int kernelWidth = 2 * radius + 1;
    for (int dy = -radius; dy <= radius; dy++) {
      for (int dx = -radius; dx <= radius; dx++) {
        double dist = Math.hypot(dx, dy);
        double weight = radius == 0 ? 1 : (dist <= radius ? Math.exp(-Math.pow(dist / radius, 2)) : 0);
        kernel[(dy + radius) * kernelWidth + dx + radius] = weight;
      }
    }
    double[] density = new double[width * height];
    for (Coordinate point : points) {
      int px = (int) Math.floor(grid.x(point.x));
      int py = (int) Math.floor(grid.y(point.y));
      for (int y = Math.max(0, py - radius); y <= Math.min(height - 1, py + radius); y++) {
        for (int x = Math.max(0, px - radius); x <= Math.min(width - 1, px + radius); x++) {
          density[y * width + x] += kernel[(y - py + radius) * kernelWidth + x - px + radius];
        }
      }
    }
    double max = 0;
    for (double value : density) {
      max = Math.max(max, value);
    }
    if (max <= 0) {
      return Field.constant(width, height, 0);
    }
    double scale = config.amenityPoints() / max;
    return Field.fromIndex(width, height, i -> density[i] * scale);
  }

  private static List<Coordinate> amenityPoints(VectorLayer amenities) {
    List<Coordinate> result = new ArrayList<>();
    for (VectorFeature amenity : amenities.features()) {
      Geometry geometry = amenity.geometry();
      if (geometry instanceof Puntal) {
        for (int i = 0; i < geometry.getNumGeometries(); i++) {
          Point point = (Point) geometry.getGeometryN(i);
          if (!point.isEmpty()) {
            result.add(point.getCoordinate());
          }
        }
      } else {
        LOGGER.trace("Ignoring {} amenity", geometry.getGeometryType());
      }
    }
    return result;
  }
}
