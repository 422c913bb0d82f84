package com.urbancanopy.reader;

import com.urbancanopy.util.CloseableIterator;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Streams features out of a GeoJSON {@code FeatureCollection}, a single {@code Feature}, or newline-delimited
 * features.
 */
public class GeoJson implements Iterable<VectorFeature> {

  private final InputStreamSupplier inputStreamSupplier;
  private final String name;

  private GeoJson(String name, InputStreamSupplier inputStreamSupplier) {
    this.inputStreamSupplier = inputStreamSupplier;
    this.name = name;
  }

  public static GeoJson from(Path path) {
    return new GeoJson(path.toString(), () -> Files.newInputStream(path));
  }

  public static GeoJson from(String json) {
    return new GeoJson("string", () -> new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
  }

  public Stream<VectorFeature> stream() {
    return iterator().stream();
  }

  @Override
  public CloseableIterator<VectorFeature> iterator() {
    try {
      return new GeoJsonFeatureIterator(inputStreamSupplier.get(), name);
    } catch (IOException e) {
      throw new FileFormatException("Unable to read geojson " + name, e);
    }
  }

  /** Reads every feature into a {@link VectorLayer} called {@code layerName}. */
  public VectorLayer toLayer(String layerName) {
    List<VectorFeature> features = new ArrayList<>();
    try (var iter = iterator()) {
      while (iter.hasNext()) {
        features.add(iter.next());
      }
    }
    return new VectorLayer(layerName, features);
  }

  @FunctionalInterface
  public interface InputStreamSupplier {
    InputStream get() throws IOException;
  }
}
