package com.urbancanopy.spots;

/**
 * A connected cluster of critical priority plantable pixels.
 *
 * @param id         rank of this spot, starting at 1 for the highest mean score
 * @param pixelX     mean pixel column of the cluster
 * @param pixelY     mean pixel row of the cluster
 * @param lat        latitude of the center of the centroid pixel
 * @param lon        longitude of the center of the centroid pixel
 * @param pixelCount number of pixels in the cluster
 * @param areaM2     ground area of the cluster in square meters
 * @param meanScore  mean composite score over the cluster
 */
public record CriticalSpot(
  int id,
  double pixelX,
  double pixelY,
  double lat,
  double lon,
  int pixelCount,
  double areaM2,
  double meanScore
) {}
