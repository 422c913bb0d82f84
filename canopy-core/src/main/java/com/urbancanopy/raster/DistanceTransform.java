package com.urbancanopy.raster;

/**
 * Exact Euclidean distance transform using the lower-envelope-of-parabolas algorithm from Felzenszwalb and
 * Huttenlocher, "Distance Transforms of Sampled Functions" (2012), in linear time per row and column.
 */
public class DistanceTransform {

  private static final double FAR = 1e20;

  private DistanceTransform() {}

  /**
   * Returns the distance from each pixel to the nearest pixel set in {@code mask}, multiplied by {@code scale}.
   * <p>
   * Pixels inside the mask have distance 0. When the mask is empty every pixel gets the length of the raster diagonal,
   * a finite value farther than any real distance.
   */
  public static Field distanceToNearest(Mask mask, double scale) {
    int width = mask.width();
    int height = mask.height();
    if (mask.isEmpty()) {
      return Field.constant(width, height, Math.hypot(width, height) * scale);
    }
    double[] grid = new double[width * height];
    for (int i = 0; i < grid.length; i++) {
      grid[i] = mask.get(i) ? 0 : FAR;
    }
    int n = Math.max(width, height);
    double[] f = new double[n];
    double[] d = new double[n];
    int[] v = new int[n];
    double[] z = new double[n + 1];

    for (int x = 0; x < width; x++) {
      for (int y = 0; y < height; y++) {
        f[y] = grid[y * width + x];
      }
      transform1d(f, height, d, v, z);
      for (int y = 0; y < height; y++) {
        grid[y * width + x] = d[y];
      }
    }
    for (int y = 0; y < height; y++) {
      System.arraycopy(grid, y * width, f, 0, width);
      transform1d(f, width, d, v, z);
      System.arraycopy(d, 0, grid, y * width, width);
    }
    return Field.fromIndex(width, height, i -> Math.sqrt(grid[i]) * scale);
  }

  /** Squared distance transform of the first {@code n} values of {@code f} into {@code d}. */
  private static void transform1d(double[] f, int n, double[] d, int[] v, double[] z) {
    int k = 0;
    v[0] = 0;
    z[0] = Double.NEGATIVE_INFINITY;
    z[1] = Double.POSITIVE_INFINITY;
    for (int q = 1; q < n; q++) {
      double s = intersection(f, q, v[k]);
      while (s <= z[k]) {
        k--;
        s = intersection(f, q, v[k]);
      }
      k++;
      v[k] = q;
      z[k] = s;
      z[k + 1] = Double.POSITIVE_INFINITY;
    }
    k = 0;
    for (int q = 0; q < n; q++) {
      while (z[k + 1] < q) {
        k++;
      }
      double dq = q - v[k];
      d[q] = dq * dq + f[v[k]];
    }
  }

  private static double intersection(double[] f, int q, int p) {
    return ((f[q] + (double) q * q) - (f[p] + (double) p * p)) / (2d * q - 2d * p);
  }
}
