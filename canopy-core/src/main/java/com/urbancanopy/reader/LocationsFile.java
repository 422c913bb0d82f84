package com.urbancanopy.reader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the list of locations to analyze from a JSON file like:
 *
 * <pre>
 * {@code
 * {"locations": [{"name": "Aster Hill", "description": "...", "lat": 3.15, "lon": 101.71}]}
 * }
 * </pre>
 */
public class LocationsFile {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final List<String> REQUIRED_FIELDS = List.of("name", "description", "lat", "lon");

  private LocationsFile() {}

  /**
   * Returns every location in {@code path}.
   *
   * @throws FileFormatException if the file cannot be read, lacks a {@code locations} array, or a location lacks a
   *                             required field
   */
  public static List<Location> read(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new FileFormatException("Locations file not found: " + path);
    }
    try {
      return parse(MAPPER.readTree(path.toFile()), path.toString());
    } catch (IOException e) {
      throw new FileFormatException("Unable to read locations file " + path, e);
    }
  }

  /** Parses locations from a JSON string. */
  public static List<Location> parse(String json) {
    try {
      return parse(MAPPER.readTree(json), "string");
    } catch (IOException e) {
      throw new FileFormatException("Unable to parse locations", e);
    }
  }

  private static List<Location> parse(JsonNode root, String source) {
    JsonNode array = root == null ? null : root.get("locations");
    if (array == null || !array.isArray()) {
      throw new FileFormatException(source + " must contain a 'locations' array");
    }
    List<Location> result = new ArrayList<>();
    for (JsonNode node : array) {
      List<String> missing = REQUIRED_FIELDS.stream().filter(field -> !node.hasNonNull(field)).toList();
      if (!missing.isEmpty()) {
        throw new FileFormatException("Location " + node + " in " + source + " is missing required fields: " + missing);
      }
      try {
        result.add(MAPPER.treeToValue(node, Location.class));
      } catch (IOException e) {
        throw new FileFormatException("Invalid location " + node + " in " + source, e);
      }
    }
    return result;
  }

  /**
   * Returns the location named {@code name} (case-insensitive, also matching its slug).
   *
   * @throws IllegalArgumentException if there is no such location
   */
  public static Location find(List<Location> locations, String name) {
    for (Location location : locations) {
      if (location.name().equalsIgnoreCase(name) || location.slug().equalsIgnoreCase(name)) {
        return location;
      }
    }
    throw new IllegalArgumentException("Location '" + name + "' not found, available: " +
      locations.stream().map(Location::name).toList());
  }
}
