package com.urbancanopy.detect;

import com.urbancanopy.config.CanopyConfig;
import com.urbancanopy.geo.Grid;
import com.urbancanopy.raster.ConnectedComponents;
import com.urbancanopy.raster.Field;
import com.urbancanopy.raster.GaussianBlur;
import com.urbancanopy.raster.Mask;
import com.urbancanopy.raster.Morphology;
import com.urbancanopy.util.Format;
import java.awt.image.BufferedImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives vegetation and shadow rasters from an RGB satellite image.
 * <p>
 * Vegetation is detected with a green/red NDVI and a minimum brightness. Shadows are dark and desaturated (or very
 * dark) pixels that are not vegetation, cleaned with a 3x3 closing and by discarding small regions. Brightness and
 * saturation follow the 8-bit HSV convention: {@code V = max(R,G,B)}, {@code S = 255 * (V - min(R,G,B)) / V}.
 */
public class FeatureDetector {

  private static final Logger LOGGER = LoggerFactory.getLogger(FeatureDetector.class);
  private static final Format FORMAT = Format.defaultInstance();

  private final CanopyConfig config;

  public FeatureDetector(CanopyConfig config) {
    this.config = config;
  }

  /** Returns the NDVI of one pixel, {@code (g - r) / (g + r + epsilon)}. */
  public static double ndvi(int red, int green, double epsilon) {
    return (green - red) / (green + red + epsilon);
  }

  /** Returns the 8-bit HSV saturation of one pixel. */
  public static double saturation(int red, int green, int blue) {
    int max = Math.max(red, Math.max(green, blue));
    int min = Math.min(red, Math.min(green, blue));
    return max == 0 ? 0 : 255d * (max - min) / max;
  }

  /** Returns the 8-bit HSV value (brightness) of one pixel. */
  public static double brightness(int red, int green, int blue) {
    return Math.max(red, Math.max(green, blue));
  }

  /**
   * Detects features in {@code image}, which must have the dimensions of {@code grid}.
   *
   * @throws IllegalArgumentException if the image size does not match the grid
   */
  public FeatureRasters detect(BufferedImage image, Grid grid) {
    int width = grid.width();
    int height = grid.height();
    if (image.getWidth() != width || image.getHeight() != height) {
      throw new IllegalArgumentException("Image is " + image.getWidth() + "x" + image.getHeight() +
        " but grid is " + width + "x" + height);
    }
    Field.Builder ndvi = Field.builder(width, height);
    Field.Builder value = Field.builder(width, height);
    Field.Builder saturation = Field.builder(width, height);
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        int rgb = image.getRGB(x, y);
        int r = (rgb >> 16) & 0xff;
        int g = (rgb >> 8) & 0xff;
        int b = rgb & 0xff;
        ndvi.set(x, y, ndvi(r, g, config.ndviEpsilon()));
        value.set(x, y, brightness(r, g, b));
        saturation.set(x, y, saturation(r, g, b));
      }
    }
    return detect(ndvi.build(), value.build(), saturation.build());
  }

  /** Detects features from precomputed NDVI, brightness and saturation channels. */
  public FeatureRasters detect(Field ndvi, Field brightness, Field saturation) {
    int width = ndvi.width();
    int height = ndvi.height();
    Mask vegetation = Mask.fromIndex(width, height,
      i -> ndvi.get(i) > config.ndviThreshold() && brightness.get(i) > config.vegetationMinBrightness());

    Mask shadowCandidates = Mask.fromIndex(width, height, i -> {
      double v = brightness.get(i);
      boolean darkAndDesaturated =
        v < config.shadowBrightnessThreshold() && saturation.get(i) < config.shadowDesaturationThreshold();
      boolean veryDark = v < config.shadowVeryDarkThreshold();
      return (darkAndDesaturated || veryDark) && !vegetation.get(i);
    });
    // closing can re-cover thin strips of vegetation
    Mask closed = Morphology.close3x3(shadowCandidates).andNot(vegetation);
    Mask shadow = ConnectedComponents.removeSmall(closed, config.shadowMinSizePixels());

    Field darkness = brightness.map(v -> 1 - v / 255d);
    Field shadowIntensity = GaussianBlur.blur(darkness, config.shadowBlurSigma()).map(v -> Math.max(0, Math.min(1, v)));

    if (LOGGER.isDebugEnabled()) {
      double total = width * (double) height;
      LOGGER.debug("Vegetation: {} Shadows: {}", FORMAT.percent(vegetation.count() / total),
        FORMAT.percent(shadow.count() / total));
    }
    return new FeatureRasters(ndvi, brightness, saturation, vegetation, shadow, shadowIntensity);
  }
}
