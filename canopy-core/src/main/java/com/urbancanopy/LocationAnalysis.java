package com.urbancanopy;

import com.urbancanopy.detect.FeatureRasters;
import com.urbancanopy.geo.Grid;
import com.urbancanopy.geo.MetricProjection;
import com.urbancanopy.geo.StreetNetwork;
import com.urbancanopy.mask.LocationMasks;
import com.urbancanopy.priority.PriorityResult;
import com.urbancanopy.reader.Location;
import com.urbancanopy.report.CoverageReport;
import com.urbancanopy.report.Summary;
import com.urbancanopy.spots.CriticalSpot;
import java.awt.image.BufferedImage;
import java.util.List;

/** Everything computed for one location, from the aligned grid through to the summary document. */
public record LocationAnalysis(
  Location location,
  BufferedImage satellite,
  Grid grid,
  MetricProjection projection,
  StreetNetwork streets,
  FeatureRasters features,
  LocationMasks masks,
  PriorityResult priority,
  List<CriticalSpot> spots,
  CoverageReport coverage,
  Summary summary
) {}
