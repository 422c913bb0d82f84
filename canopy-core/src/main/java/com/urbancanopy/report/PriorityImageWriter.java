package com.urbancanopy.report;

import com.urbancanopy.priority.Classification;
import com.urbancanopy.priority.PriorityClass;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;

/**
 * Paints priority classes over the satellite image: critical red, high orange, medium yellow and low light green,
 * more opaque for more urgent classes.
 */
public class PriorityImageWriter {

  private PriorityImageWriter() {}

  /** Returns the RGB overlay color of {@code priorityClass}, or -1 if it is not painted. */
  static int color(PriorityClass priorityClass) {
    return switch (priorityClass) {
      case CRITICAL -> 0xff0000;
      case HIGH -> 0xffa500;
      case MEDIUM -> 0xffff00;
      case LOW -> 0x90ee90;
      case NOT_PLANTABLE -> -1;
    };
  }

  static double opacity(PriorityClass priorityClass) {
    return switch (priorityClass) {
      case CRITICAL -> 0.8;
      case HIGH -> 0.7;
      case MEDIUM -> 0.6;
      case LOW -> 0.5;
      case NOT_PLANTABLE -> 0;
    };
  }

  public static BufferedImage render(BufferedImage satellite, Classification classification) {
    int width = classification.width();
    int height = classification.height();
    BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        int base = satellite.getRGB(x, y) & 0xffffff;
        PriorityClass priorityClass = classification.get(x, y);
        int color = color(priorityClass);
        result.setRGB(x, y, color < 0 ? base : blend(base, color, opacity(priorityClass)));
      }
    }
    return result;
  }

  static int blend(int base, int color, double alpha) {
    int r = mix((base >> 16) & 0xff, (color >> 16) & 0xff, alpha);
    int g = mix((base >> 8) & 0xff, (color >> 8) & 0xff, alpha);
    int b = mix(base & 0xff, color & 0xff, alpha);
    return (r << 16) | (g << 8) | b;
  }

  private static int mix(int base, int color, double alpha) {
    return (int) Math.round(base * (1 - alpha) + color * alpha);
  }

  /** Renders the overlay and writes it as a PNG to {@code path}. */
  public static void write(BufferedImage satellite, Classification classification, Path path) throws IOException {
    if (path.getParent() != null) {
      Files.createDirectories(path.getParent());
    }
    if (!ImageIO.write(render(satellite, classification), "png", path.toFile())) {
      throw new IOException("No PNG writer available for " + path);
    }
  }
}
