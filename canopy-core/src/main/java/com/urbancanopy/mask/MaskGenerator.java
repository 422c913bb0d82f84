package com.urbancanopy.mask;

import com.urbancanopy.config.CanopyConfig;
import com.urbancanopy.geo.GeoUtils;
import com.urbancanopy.geo.GeometryException;
import com.urbancanopy.geo.Grid;
import com.urbancanopy.geo.MetricProjection;
import com.urbancanopy.geo.StreetNetwork;
import com.urbancanopy.geo.StreetTier;
import com.urbancanopy.raster.DistanceTransform;
import com.urbancanopy.raster.Field;
import com.urbancanopy.raster.Mask;
import com.urbancanopy.raster.Rasterizer;
import com.urbancanopy.reader.VectorFeature;
import com.urbancanopy.reader.VectorLayer;
import com.urbancanopy.stats.Stats;
import com.urbancanopy.util.Format;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.TopologyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rasterizes vector layers into obstacle masks and computes the distance fields used for scoring.
 * <p>
 * Streets are buffered in a metric projection so that buffer radii are isotropic meters at any latitude, then the
 * union is projected back and rasterized.
 */
public class MaskGenerator {

  private static final Logger LOGGER = LoggerFactory.getLogger(MaskGenerator.class);
  private static final Format FORMAT = Format.defaultInstance();
  public static final Set<StreetTier> SIDEWALK_TIERS = EnumSet.of(StreetTier.PEDESTRIAN, StreetTier.LOW);

  private final CanopyConfig config;
  private final Stats stats;

  public MaskGenerator(CanopyConfig config, Stats stats) {
    this.config = config;
    this.stats = stats;
  }

  /** Returns the plantable mask: pixels that are not a building, a street or vegetation. */
  public static Mask plantable(Mask buildings, Mask streets, Mask vegetation) {
    return buildings.or(streets).or(vegetation).not();
  }

  public LocationMasks generate(Grid grid, MetricProjection projection, VectorLayer buildings, StreetNetwork streets,
    Mask vegetation) {
    Mask buildingMask = buildingMask(grid, buildings);
    Mask streetMask = streetMask(grid, projection, streets);
    Mask sidewalkMask = sidewalkMask(grid, projection, streets);
    Mask plantable = plantable(buildingMask, streetMask, vegetation);

    double mpp = grid.metersPerPixel();
    Field buildingDistance = DistanceTransform.distanceToNearest(buildingMask, mpp);
    Field sidewalkDistance = DistanceTransform.distanceToNearest(sidewalkMask, mpp);

    if (LOGGER.isDebugEnabled()) {
      double total = grid.pixelCount();
      LOGGER.debug("Buildings: {} Streets: {} Sidewalks: {} Plantable: {}",
        FORMAT.percent(buildingMask.count() / total), FORMAT.percent(streetMask.count() / total),
        FORMAT.percent(sidewalkMask.count() / total), FORMAT.percent(plantable.count() / total));
    }
    return new LocationMasks(buildingMask, streetMask, sidewalkMask, vegetation, plantable, buildingDistance,
      sidewalkDistance);
  }

  /**
   * Rasterizes building footprints. Self-intersecting or otherwise invalid polygons, polygons without area and other
   * geometry types are skipped with a warning and counted as {@code buildings_<reason>} data errors.
   */
  public Mask buildingMask(Grid grid, VectorLayer buildings) {
    List<Geometry> valid = new ArrayList<>(buildings.size());
    for (VectorFeature building : buildings.features()) {
      try {
        valid.add(GeoUtils.validPolygon(building.geometry()));
      } catch (GeometryException e) {
        e.log(stats, "buildings", "Skipping building " + building.tags());
      }
    }
    return Rasterizer.rasterize(grid, valid);
  }

  /** Rasterizes every street buffered by the radius of its tier. */
  public Mask streetMask(Grid grid, MetricProjection projection, StreetNetwork streets) {
    List<Geometry> tiers = new ArrayList<>();
    for (StreetTier tier : StreetTier.values()) {
      tiers.add(bufferedUnion(streets.streets(tier), config.bufferMeters(tier), projection, tier.id()));
    }
    Geometry union = GeoUtils.union(tiers);
    return union.isEmpty() ? Mask.empty(grid.width(), grid.height()) :
      Rasterizer.rasterize(grid, List.of(projection.unproject(union)));
  }

  /** Rasterizes pedestrian and low traffic streets buffered by the sidewalk radius. */
  public Mask sidewalkMask(Grid grid, MetricProjection projection, StreetNetwork streets) {
    Geometry union = bufferedUnion(streets.streets(SIDEWALK_TIERS), config.sidewalkBufferMeters(), projection,
      "sidewalk");
    return union.isEmpty() ? Mask.empty(grid.width(), grid.height()) :
      Rasterizer.rasterize(grid, List.of(projection.unproject(union)));
  }

  /**
   * Returns the union, in meters of {@code projection}, of every longitude/latitude {@code geometry} buffered by
   * {@code radiusMeters}.
   */
  public Geometry bufferedUnion(List<Geometry> geometries, double radiusMeters, MetricProjection projection,
    String name) {
    if (geometries.isEmpty() || radiusMeters <= 0) {
      return GeoUtils.EMPTY_GEOMETRY;
    }
    List<Geometry> buffered = new ArrayList<>(geometries.size());
    for (Geometry geometry : geometries) {
      try {
        buffered.add(buffer(projection.project(geometry), radiusMeters));
      } catch (GeometryException e) {
        e.log(stats, "streets", "Skipping " + name + " street");
      }
    }
    return GeoUtils.union(buffered);
  }

  private static Geometry buffer(Geometry metric, double radiusMeters) throws GeometryException {
    try {
      return metric.buffer(radiusMeters);
    } catch (TopologyException | IllegalArgumentException e) {
      throw new GeometryException("buffer_error", "Unable to buffer street: " + e, e)
        .addGeometryDetails("street", metric);
    }
  }
}
