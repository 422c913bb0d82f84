package com.urbancanopy.raster;

import java.util.Arrays;
import java.util.function.IntPredicate;
import javax.annotation.concurrent.Immutable;

/**
 * An immutable boolean raster where pixel {@code (x, y)} is stored at index {@code y * width + x}.
 */
@Immutable
public final class Mask {

  private final int width;
  private final int height;
  private final boolean[] values;
  private final int count;

  private Mask(int width, int height, boolean[] values) {
    this.width = width;
    this.height = height;
    this.values = values;
    int c = 0;
    for (boolean value : values) {
      if (value) {
        c++;
      }
    }
    this.count = c;
  }

  public static Mask empty(int width, int height) {
    return new Builder(width, height).build();
  }

  /** Returns a mask where each pixel is set if {@code predicate} accepts its index. */
  public static Mask fromIndex(int width, int height, IntPredicate predicate) {
    Builder builder = new Builder(width, height);
    for (int i = 0; i < width * height; i++) {
      if (predicate.test(i)) {
        builder.set(i);
      }
    }
    return builder.build();
  }

  public static Builder builder(int width, int height) {
    return new Builder(width, height);
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public int size() {
    return values.length;
  }

  public boolean get(int x, int y) {
    return values[y * width + x];
  }

  public boolean get(int index) {
    return values[index];
  }

  /** Returns the number of pixels that are set. */
  public int count() {
    return count;
  }

  public boolean isEmpty() {
    return count == 0;
  }

  public Mask and(Mask other) {
    checkSameShape(other);
    return fromIndex(width, height, i -> values[i] && other.values[i]);
  }

  public Mask or(Mask other) {
    checkSameShape(other);
    return fromIndex(width, height, i -> values[i] || other.values[i]);
  }

  /** Returns pixels set in this mask but not in {@code other}. */
  public Mask andNot(Mask other) {
    checkSameShape(other);
    return fromIndex(width, height, i -> values[i] && !other.values[i]);
  }

  public Mask not() {
    return fromIndex(width, height, i -> !values[i]);
  }

  void checkSameShape(Mask other) {
    if (other.width != width || other.height != height) {
      throw new IllegalArgumentException(
        "Mask size " + other.width + "x" + other.height + " does not match " + width + "x" + height);
    }
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Mask other && other.width == width && other.height == height &&
      Arrays.equals(values, other.values));
  }

  @Override
  public int hashCode() {
    return 31 * (31 * width + height) + Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return "Mask[" + width + "x" + height + ", count=" + count + "]";
  }

  /** Mutable builder for a {@link Mask}, not safe to share between threads. */
  public static final class Builder {

    private final int width;
    private final int height;
    private boolean[] values;

    private Builder(int width, int height) {
      if (width <= 0 || height <= 0) {
        throw new IllegalArgumentException("Mask must have positive size, was " + width + "x" + height);
      }
      this.width = width;
      this.height = height;
      this.values = new boolean[width * height];
    }

    public int width() {
      return width;
    }

    public int height() {
      return height;
    }

    public Builder set(int x, int y) {
      values[y * width + x] = true;
      return this;
    }

    public Builder set(int index) {
      values[index] = true;
      return this;
    }

    public Builder clear(int index) {
      values[index] = false;
      return this;
    }

    public boolean get(int index) {
      return values[index];
    }

    public Mask build() {
      boolean[] result = values;
      values = result.clone();
      return new Mask(width, height, result);
    }
  }
}
