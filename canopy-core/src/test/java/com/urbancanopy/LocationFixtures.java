package com.urbancanopy;

import com.urbancanopy.reader.Location;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import javax.imageio.ImageIO;

/** Writes a small synthetic location to disk: a satellite image plus building, street and amenity layers. */
class LocationFixtures {

  static final int SIZE = 120;
  static final Location ASTER_HILL = new Location("Aster Hill", "Residential street", 3.139, 101.6869);
  static final Location MISSING = new Location("Missing Place", "No inputs on disk", 3.2, 101.7);

  private LocationFixtures() {}

  /** Config overrides that match the fixture image and disable vector alignment. */
  static Object[] configArgs(Object... extra) {
    Object[] base = {
      "image_width", SIZE,
      "image_height", SIZE,
      "align_scale", 1,
      "align_north_offset", 0,
      "align_east_offset", 0,
      "threads", 2,
      "min_spot_size", 5
    };
    Object[] result = new Object[base.length + extra.length];
    System.arraycopy(base, 0, result, 0, base.length);
    System.arraycopy(extra, 0, result, base.length, extra.length);
    return result;
  }

  /**
   * Light gray pavement with a vegetated square in the north-west corner and a dark shadow square in the south-east.
   */
  static BufferedImage satellite() {
    BufferedImage image = new BufferedImage(SIZE, SIZE, BufferedImage.TYPE_INT_RGB);
    for (int y = 0; y < SIZE; y++) {
      for (int x = 0; x < SIZE; x++) {
        int rgb = 0xb4b4b4;
        if (x < 30 && y < 30) {
          rgb = 0x208020;
        } else if (x >= 90 && y >= 90) {
          rgb = 0x202020;
        }
        image.setRGB(x, y, rgb);
      }
    }
    return image;
  }

  static void writeInputs(Path locationDir, Location location) {
    double lat = location.lat();
    double lon = location.lon();
    try {
      Files.createDirectories(locationDir);
      ImageIO.write(satellite(), "png", locationDir.resolve("satellite.png").toFile());
      Files.writeString(locationDir.resolve("buildings.geojson"), featureCollection(String.format(Locale.ROOT, """
        {"type": "Feature", "properties": {"building": "yes"}, "geometry": {"type": "Polygon", "coordinates": [[
          [%1$.7f, %3$.7f], [%2$.7f, %3$.7f], [%2$.7f, %4$.7f], [%1$.7f, %4$.7f], [%1$.7f, %3$.7f]
        ]]}}
        """, lon + 0.0001, lon + 0.0002, lat + 0.0001, lat + 0.0002)));
      Files.writeString(locationDir.resolve("streets.geojson"), featureCollection(String.format(Locale.ROOT, """
        {"type": "Feature", "properties": {"highway": "residential", "name": "Jalan Aster"},
         "geometry": {"type": "LineString", "coordinates": [[%1$.7f, %3$.7f], [%2$.7f, %3$.7f]]}}
        """, lon - 0.0005, lon + 0.0005, lat - 0.00005)));
      Files.writeString(locationDir.resolve("amenities.geojson"), featureCollection(String.format(Locale.ROOT, """
        {"type": "Feature", "properties": {"amenity": "school"},
         "geometry": {"type": "Point", "coordinates": [%.7f, %.7f]}}
        """, lon - 0.0002, lat + 0.0001)));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  static void writeLocationsFile(Path path, Location... locations) {
    StringBuilder json = new StringBuilder("{\"locations\": [");
    for (int i = 0; i < locations.length; i++) {
      Location location = locations[i];
      if (i > 0) {
        json.append(",");
      }
      json.append(String.format(Locale.ROOT, "{\"name\": \"%s\", \"description\": \"%s\", \"lat\": %s, \"lon\": %s}",
        location.name(), location.description(), location.lat(), location.lon()));
    }
    json.append("]}");
    try {
      Files.writeString(path, json);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static String featureCollection(String feature) {
    return "{\"type\": \"FeatureCollection\", \"features\": [" + feature + "]}";
  }
}
