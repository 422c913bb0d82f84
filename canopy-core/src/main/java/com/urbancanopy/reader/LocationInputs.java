package com.urbancanopy.reader;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The already-acquired inputs of one location: the satellite image and the building, street and amenity layers in
 * longitude/latitude.
 */
public record LocationInputs(
  BufferedImage satellite,
  VectorLayer buildings,
  VectorLayer streets,
  VectorLayer amenities
) {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocationInputs.class);
  public static final String SATELLITE_FILE = "satellite.png";
  public static final String BUILDINGS_FILE = "buildings.geojson";
  public static final String STREETS_FILE = "streets.geojson";
  public static final String AMENITIES_FILE = "amenities.geojson";

  public LocationInputs {
    if (satellite == null) {
      throw new IllegalArgumentException("satellite image is required");
    }
    buildings = buildings == null ? VectorLayer.empty("buildings") : buildings;
    streets = streets == null ? VectorLayer.empty("streets") : streets;
    amenities = amenities == null ? VectorLayer.empty("amenities") : amenities;
  }

  /**
   * Reads inputs from {@code directory}. The satellite image is required but a missing vector file is read as an empty
   * layer.
   *
   * @throws FileFormatException if the satellite image is missing or cannot be decoded
   */
  public static LocationInputs load(Path directory) {
    Path imagePath = directory.resolve(SATELLITE_FILE);
    if (!Files.isRegularFile(imagePath)) {
      throw new FileFormatException("Missing satellite image " + imagePath);
    }
    BufferedImage image;
    try {
      image = ImageIO.read(imagePath.toFile());
    } catch (IOException e) {
      throw new FileFormatException("Unable to read satellite image " + imagePath, e);
    }
    if (image == null) {
      throw new FileFormatException("Unsupported image format " + imagePath);
    }
    return new LocationInputs(
      image,
      layer(directory, BUILDINGS_FILE, "buildings"),
      layer(directory, STREETS_FILE, "streets"),
      layer(directory, AMENITIES_FILE, "amenities")
    );
  }

  private static VectorLayer layer(Path directory, String file, String name) {
    Path path = directory.resolve(file);
    if (!Files.isRegularFile(path)) {
      LOGGER.warn("No {} found at {}, using an empty layer", name, path);
      return VectorLayer.empty(name);
    }
    VectorLayer layer = GeoJson.from(path).toLayer(name);
    LOGGER.debug("Read {} {} from {}", layer.size(), name, path);
    return layer;
  }
}
