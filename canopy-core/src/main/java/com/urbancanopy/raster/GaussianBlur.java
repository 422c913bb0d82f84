package com.urbancanopy.raster;

/**
 * Separable gaussian smoothing with a kernel radius of {@code ceil(3 * sigma)} and replicated edge pixels.
 */
public class GaussianBlur {

  private GaussianBlur() {}

  public static Field blur(Field input, double sigma) {
    if (sigma <= 0) {
      return input;
    }
    int width = input.width();
    int height = input.height();
    double[] kernel = kernel(sigma);
    int radius = kernel.length / 2;

    double[] horizontal = new double[width * height];
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        double sum = 0;
        for (int k = -radius; k <= radius; k++) {
          int xx = clamp(x + k, width);
          sum += kernel[k + radius] * input.get(xx, y);
        }
        horizontal[y * width + x] = sum;
      }
    }
    Field.Builder result = Field.builder(width, height);
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        double sum = 0;
        for (int k = -radius; k <= radius; k++) {
          int yy = clamp(y + k, height);
          sum += kernel[k + radius] * horizontal[yy * width + x];
        }
        result.set(x, y, sum);
      }
    }
    return result.build();
  }

  static double[] kernel(double sigma) {
    int radius = (int) Math.ceil(3 * sigma);
    double[] kernel = new double[2 * radius + 1];
    double sum = 0;
    for (int i = -radius; i <= radius; i++) {
      double value = Math.exp(-(i * i) / (2 * sigma * sigma));
      kernel[i + radius] = value;
      sum += value;
    }
    for (int i = 0; i < kernel.length; i++) {
      kernel[i] /= sum;
    }
    return kernel;
  }

  private static int clamp(int value, int size) {
    return value < 0 ? 0 : (value >= size ? size - 1 : value);
  }
}
