package com.urbancanopy;

import com.urbancanopy.config.Arguments;
import com.urbancanopy.config.CanopyConfig;
import com.urbancanopy.raster.Field;
import com.urbancanopy.raster.Mask;
import java.awt.image.BufferedImage;
import java.nio.file.Path;

public class TestUtils {

  private TestUtils() {}

  public static Path pathToResource(String resource) {
    Path cwd = Path.of("").toAbsolutePath();
    Path pathFromRoot = Path.of("canopy-core", "src", "test", "resources", resource);
    return cwd.resolveSibling(pathFromRoot);
  }

  /** Returns default configuration overridden by {@code keyValues}. */
  public static CanopyConfig config(Object... keyValues) {
    return CanopyConfig.from(Arguments.of(keyValues).silence());
  }

  /**
   * Returns a mask drawn from rows of text where {@code #} is set, for example {@code mask("#.", ".#")}.
   */
  public static Mask mask(String... rows) {
    int height = rows.length;
    int width = rows[0].length();
    Mask.Builder builder = Mask.builder(width, height);
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        if (rows[y].charAt(x) == '#') {
          builder.set(x, y);
        }
      }
    }
    return builder.build();
  }

  public static Field field(int width, int height, double... values) {
    return Field.fromIndex(width, height, i -> values[i]);
  }

  public static BufferedImage solidImage(int width, int height, int rgb) {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        image.setRGB(x, y, rgb);
      }
    }
    return image;
  }
}
