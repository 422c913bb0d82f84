package com.urbancanopy.geo;

import com.urbancanopy.config.CanopyConfig;
import com.urbancanopy.reader.VectorFeature;
import com.urbancanopy.reader.VectorLayer;
import com.urbancanopy.stats.Stats;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Lineal;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Corrects the systematic misregistration between OpenStreetMap vector data and satellite imagery of a region, and
 * classifies streets into traffic tiers.
 * <p>
 * Every geometry is projected to meters, scaled around the location center by the regional scale factor, shifted by
 * the regional east/north offsets, then projected back to longitude/latitude. Buildings and streets get the identical
 * transform so their relative geometry is preserved.
 */
public class GeometryAligner {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeometryAligner.class);
  public static final String HIGHWAY_TAG = "highway";

  private final CanopyConfig config;
  private final Stats stats;

  public GeometryAligner(CanopyConfig config, Stats stats) {
    this.config = config;
    this.stats = stats;
  }

  /**
   * Returns the metric transform that scales by {@code scale} around {@code center} then translates by
   * {@code (eastMeters, northMeters)}.
   */
  public static AffineTransformation alignment(Coordinate center, double scale, double eastMeters,
    double northMeters) {
    return AffineTransformation.scaleInstance(scale, scale, center.x, center.y)
      .translate(eastMeters, northMeters);
  }

  /** Returns a copy of {@code layer} with the regional correction applied around {@code (centerLat, centerLon)}. */
  public VectorLayer align(VectorLayer layer, MetricProjection projection, double centerLat, double centerLon) {
    if (layer.isEmpty()) {
      return layer;
    }
    Coordinate center = projection.project(centerLon, centerLat);
    AffineTransformation transform = alignment(center, config.alignScale(), config.eastOffsetMeters(),
      config.northOffsetMeters());
    VectorLayer result = layer.mapGeometries(geom -> transform(geom, projection, transform));
    LOGGER.debug("Aligned {} {} with scale={} east={}m north={}m in {}", result.size(), layer.name(),
      config.alignScale(), config.eastOffsetMeters(), config.northOffsetMeters(), projection.name());
    return result;
  }

  /** Applies a metric {@code transform} to a longitude/latitude geometry. */
  public static Geometry transform(Geometry lonLat, MetricProjection projection, AffineTransformation transform) {
    Geometry metric = projection.project(lonLat);
    return projection.unproject(transform.transform(metric));
  }

  /**
   * Groups line and area features of {@code streets} by the tier their {@code highway} tag belongs to. Areas such as
   * pedestrian plazas are buffered like lines further on, other geometry types are skipped.
   * <p>
   * A {@code highway} tag holding a list uses its first value. Streets whose tag matches no tier get the configured
   * default tier and are counted as unmatched, never dropped.
   */
  public StreetNetwork classifyStreets(VectorLayer streets) {
    Map<StreetTier, List<Geometry>> byTier = new EnumMap<>(StreetTier.class);
    int unmatched = 0;
    for (VectorFeature street : streets.features()) {
      Geometry geometry = street.geometry();
      if (!(geometry instanceof Lineal) && !(geometry instanceof Polygonal)) {
        stats.dataError("street_unsupported_geometry");
        LOGGER.warn("Skipping street with {} geometry, expected a line or area", geometry.getGeometryType());
        continue;
      }
      String highway = street.getFirstString(HIGHWAY_TAG);
      StreetTier tier = StreetTier.forHighwayTag(highway);
      if (tier == null) {
        tier = config.unmatchedStreetTier();
        unmatched++;
        stats.dataError("street_unmatched_tier");
        LOGGER.warn("Street highway={} matches no tier, treating as {}", highway, tier.id());
      }
      byTier.computeIfAbsent(tier, t -> new ArrayList<>()).add(geometry);
    }
    StreetNetwork network = new StreetNetwork(byTier, unmatched);
    if (LOGGER.isDebugEnabled()) {
      for (StreetTier tier : StreetTier.values()) {
        LOGGER.debug("{} {} streets", network.count(tier), tier.id());
      }
    }
    return network;
  }
}
