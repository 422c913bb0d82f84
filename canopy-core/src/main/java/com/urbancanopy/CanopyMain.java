package com.urbancanopy;

import com.urbancanopy.config.Arguments;
import com.urbancanopy.config.CanopyConfig;
import com.urbancanopy.reader.Location;
import com.urbancanopy.reader.LocationsFile;
import com.urbancanopy.stats.Stats;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entrypoint that analyzes every location in a locations file, or a single one by name.
 * <p>
 * Example: {@code java -jar canopy-core.jar locations=data/locations.json input=data/input output=data/output}
 */
public class CanopyMain {

  private CanopyMain() {}

  public static void main(String[] args) {
    List<LocationResult> results = run(Arguments.fromArgsOrConfigFile(args));
    if (results.stream().anyMatch(result -> !result.isSuccess())) {
      System.exit(1);
    }
  }

  static List<LocationResult> run(Arguments arguments) {
    Path locationsFile = arguments.inputFile("locations", "JSON file listing locations to analyze",
      Path.of("data", "locations.json"));
    Path input = arguments.file("input", "directory holding one input directory per location",
      Path.of("data", "input"));
    Path output = arguments.file("output", "directory to write one output directory per location into",
      Path.of("data", "output"));
    String locationName = arguments.getString("location_name", "analyze only the location with this name", "");
    CanopyConfig config = CanopyConfig.from(arguments);

    List<Location> locations = LocationsFile.read(locationsFile);
    if (!locationName.isBlank()) {
      locations = List.of(LocationsFile.find(locations, locationName));
    }
    try (Stats stats = Stats.inMemory()) {
      var overall = stats.startStage("overall");
      List<LocationResult> results = new Canopy(config, stats).run(locations, input, output);
      overall.stop();
      stats.printSummary();
      return results;
    }
  }
}
