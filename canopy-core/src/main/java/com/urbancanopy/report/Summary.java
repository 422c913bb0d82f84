package com.urbancanopy.report;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;

/**
 * JSON document describing the result of analyzing one location. All numbers are plain JSON numbers.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Summary(
  LocationInfo location,
  Metadata analysisMetadata,
  LandCoverage landCoverage,
  Map<String, PriorityBand> priorityDistribution,
  StreetNetworkInfo streetNetwork,
  AmenityInfo amenities,
  List<Spot> criticalPrioritySpots,
  Map<String, String> recommendations
) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record LocationInfo(String name, String description, Coordinates centerCoordinates) {}

  public record Coordinates(double latitude, double longitude) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Metadata(
    String timestamp,
    double totalAreaM2,
    double metersPerPixel,
    ImageDimensions imageDimensions,
    Alignment alignment
  ) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ImageDimensions(int widthPx, int heightPx) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Alignment(String region, double scale, double northOffsetM, double eastOffsetM, String metricCrs) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record LandCoverage(
    Coverage buildings,
    Coverage existingVegetation,
    Coverage streets,
    Coverage shadows,
    Coverage plantableArea
  ) {}

  /** {@code count} is the number of input features, or {@code null} when it does not apply. */
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Coverage(double areaM2, double percentage, Integer count) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record PriorityBand(String scoreRange, double areaM2, double percentageOfPlantable, Integer spotsCount) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record StreetNetworkInfo(
    int totalStreets,
    int pedestrianStreets,
    int lowTrafficStreets,
    int mediumTrafficStreets,
    int highTrafficStreets,
    int unmatchedStreets
  ) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record AmenityInfo(int totalCount) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Spot(
    int spotId,
    Coordinates coordinates,
    double priorityScore,
    double areaM2,
    int areaPixels,
    String googleStreetViewUrl,
    String googleMapsUrl
  ) {}
}
