package com.urbancanopy.raster;

import com.carrotsearch.hppc.IntArrayList;
import com.carrotsearch.hppc.IntStack;
import com.carrotsearch.hppc.LongArrayList;

/**
 * Labels 8-connected regions of a {@link Mask}.
 * <p>
 * Labels start at 1 and are assigned in raster-scan order of each region's first pixel, 0 marks background.
 */
public final class ConnectedComponents {

  private final int width;
  private final int height;
  private final int[] labels;
  private final IntArrayList sizes = new IntArrayList();
  private final LongArrayList sumX = new LongArrayList();
  private final LongArrayList sumY = new LongArrayList();

  private ConnectedComponents(Mask mask) {
    this.width = mask.width();
    this.height = mask.height();
    this.labels = new int[width * height];
    // index 0 is the background
    sizes.add(0);
    sumX.add(0);
    sumY.add(0);
    IntStack stack = new IntStack();
    for (int start = 0; start < labels.length; start++) {
      if (mask.get(start) && labels[start] == 0) {
        int label = sizes.size();
        int size = 0;
        long sx = 0;
        long sy = 0;
        labels[start] = label;
        stack.push(start);
        while (!stack.isEmpty()) {
          int index = stack.pop();
          int x = index % width;
          int y = index / width;
          size++;
          sx += x;
          sy += y;
          for (int dy = -1; dy <= 1; dy++) {
            int yy = y + dy;
            if (yy < 0 || yy >= height) {
              continue;
            }
            for (int dx = -1; dx <= 1; dx++) {
              int xx = x + dx;
              int neighbor = yy * width + xx;
              if (xx >= 0 && xx < width && labels[neighbor] == 0 && mask.get(neighbor)) {
                labels[neighbor] = label;
                stack.push(neighbor);
              }
            }
          }
        }
        sizes.add(size);
        sumX.add(sx);
        sumY.add(sy);
      }
    }
  }

  public static ConnectedComponents label(Mask mask) {
    return new ConnectedComponents(mask);
  }

  /**
   * Returns {@code mask} without the 8-connected regions smaller than {@code minSize} pixels.
   */
  public static Mask removeSmall(Mask mask, int minSize) {
    if (minSize <= 1 || mask.isEmpty()) {
      return mask;
    }
    ConnectedComponents components = label(mask);
    return Mask.fromIndex(mask.width(), mask.height(), i -> {
      int label = components.labels[i];
      return label > 0 && components.size(label) >= minSize;
    });
  }

  /** Returns the number of regions. */
  public int count() {
    return sizes.size() - 1;
  }

  /** Returns the label of pixel {@code (x, y)}, or 0 if it is background. */
  public int label(int x, int y) {
    return labels[y * width + x];
  }

  public int label(int index) {
    return labels[index];
  }

  public int size(int label) {
    return sizes.get(label);
  }

  /** Returns the mean pixel column of region {@code label}. */
  public double centroidX(int label) {
    return sumX.get(label) / (double) sizes.get(label);
  }

  /** Returns the mean pixel row of region {@code label}. */
  public double centroidY(int label) {
    return sumY.get(label) / (double) sizes.get(label);
  }

  /** Returns the sum of {@code field} over each region, indexed by label. */
  public double[] sums(Field field) {
    double[] result = new double[sizes.size()];
    for (int i = 0; i < labels.length; i++) {
      int label = labels[i];
      if (label > 0) {
        result[label] += field.get(i);
      }
    }
    return result;
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }
}
