package com.urbancanopy.priority;

import com.urbancanopy.raster.Mask;
import java.util.EnumMap;
import java.util.Map;
import javax.annotation.concurrent.Immutable;

/**
 * An immutable raster of {@link PriorityClass} values, one byte per pixel.
 */
@Immutable
public final class Classification {

  private final int width;
  private final int height;
  private final byte[] classes;
  private final int[] counts = new int[PriorityClass.values().length];

  Classification(int width, int height, byte[] classes) {
    this.width = width;
    this.height = height;
    this.classes = classes;
    for (byte value : classes) {
      counts[value]++;
    }
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public PriorityClass get(int x, int y) {
    return get(y * width + x);
  }

  public PriorityClass get(int index) {
    return PriorityClass.fromOrdinal(classes[index]);
  }

  /** Returns the number of pixels in {@code priorityClass}. */
  public int count(PriorityClass priorityClass) {
    return counts[priorityClass.ordinal()];
  }

  /** Returns the number of pixels in each class. */
  public Map<PriorityClass, Integer> counts() {
    Map<PriorityClass, Integer> result = new EnumMap<>(PriorityClass.class);
    for (PriorityClass priorityClass : PriorityClass.values()) {
      result.put(priorityClass, counts[priorityClass.ordinal()]);
    }
    return result;
  }

  /** Returns the pixels in {@code priorityClass}. */
  public Mask mask(PriorityClass priorityClass) {
    byte ordinal = (byte) priorityClass.ordinal();
    return Mask.fromIndex(width, height, i -> classes[i] == ordinal);
  }
}
