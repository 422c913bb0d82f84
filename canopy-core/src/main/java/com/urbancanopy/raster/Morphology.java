package com.urbancanopy.raster;

/**
 * Binary morphology with a 3x3 square structuring element. Neighbors beyond the raster edge are ignored.
 */
public class Morphology {

  private Morphology() {}

  /** Sets every pixel that has a set pixel in its 3x3 neighborhood. */
  public static Mask dilate3x3(Mask mask) {
    return neighborhood(mask, true);
  }

  /** Keeps only pixels whose whole 3x3 neighborhood is set. */
  public static Mask erode3x3(Mask mask) {
    return neighborhood(mask, false);
  }

  /** Dilation followed by erosion, which fills gaps and holes narrower than the structuring element. */
  public static Mask close3x3(Mask mask) {
    return erode3x3(dilate3x3(mask));
  }

  private static Mask neighborhood(Mask mask, boolean any) {
    int width = mask.width();
    int height = mask.height();
    Mask.Builder result = Mask.builder(width, height);
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        boolean value = !any;
        for (int dy = -1; dy <= 1 && value != any; dy++) {
          int yy = y + dy;
          if (yy < 0 || yy >= height) {
            continue;
          }
          for (int dx = -1; dx <= 1; dx++) {
            int xx = x + dx;
            if (xx >= 0 && xx < width && mask.get(xx, yy) == any) {
              value = any;
              break;
            }
          }
        }
        if (value) {
          result.set(x, y);
        }
      }
    }
    return result.build();
  }
}
