package com.urbancanopy.raster;

import java.util.function.DoubleUnaryOperator;
import java.util.function.IntToDoubleFunction;
import javax.annotation.concurrent.Immutable;

/**
 * An immutable raster of finite {@code float} values where pixel {@code (x, y)} is stored at index
 * {@code y * width + x}.
 */
@Immutable
public final class Field {

  private final int width;
  private final int height;
  private final float[] values;

  private Field(int width, int height, float[] values) {
    this.width = width;
    this.height = height;
    this.values = values;
    for (int i = 0; i < values.length; i++) {
      if (!Float.isFinite(values[i])) {
        throw new IllegalStateException("Non-finite value " + values[i] + " at pixel " + (i % width) + "," +
          (i / width));
      }
    }
  }

  /** Returns a field where every pixel is {@code value}. */
  public static Field constant(int width, int height, double value) {
    return fromIndex(width, height, i -> value);
  }

  /** Returns a field where each pixel value is computed from its index. */
  public static Field fromIndex(int width, int height, IntToDoubleFunction fn) {
    Builder builder = new Builder(width, height);
    for (int i = 0; i < width * height; i++) {
      builder.set(i, fn.applyAsDouble(i));
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

  public float get(int x, int y) {
    return values[y * width + x];
  }

  public float get(int index) {
    return values[index];
  }

  public Field map(DoubleUnaryOperator fn) {
    return fromIndex(width, height, i -> fn.applyAsDouble(values[i]));
  }

  /** Returns a field with {@code 0} wherever {@code mask} is not set. */
  public Field maskedBy(Mask mask) {
    checkSameShape(mask.width(), mask.height());
    return fromIndex(width, height, i -> mask.get(i) ? values[i] : 0);
  }

  public double min() {
    double min = Double.POSITIVE_INFINITY;
    for (float value : values) {
      min = Math.min(min, value);
    }
    return min;
  }

  public double max() {
    double max = Double.NEGATIVE_INFINITY;
    for (float value : values) {
      max = Math.max(max, value);
    }
    return max;
  }

  /** Returns the mean over pixels set in {@code mask}, or 0 if none are set. */
  public double mean(Mask mask) {
    checkSameShape(mask.width(), mask.height());
    double sum = 0;
    int n = 0;
    for (int i = 0; i < values.length; i++) {
      if (mask.get(i)) {
        sum += values[i];
        n++;
      }
    }
    return n == 0 ? 0 : sum / n;
  }

  /** Returns pixels where {@code min <= value < max}. */
  public Mask between(double min, double max) {
    return Mask.fromIndex(width, height, i -> values[i] >= min && values[i] < max);
  }

  /** Returns pixels where {@code value >= min}. */
  public Mask atLeast(double min) {
    return Mask.fromIndex(width, height, i -> values[i] >= min);
  }

  /** Returns a copy of the underlying values. */
  public float[] toArray() {
    return values.clone();
  }

  private void checkSameShape(int otherWidth, int otherHeight) {
    if (otherWidth != width || otherHeight != height) {
      throw new IllegalArgumentException(
        "Size " + otherWidth + "x" + otherHeight + " does not match " + width + "x" + height);
    }
  }

  @Override
  public String toString() {
    return "Field[" + width + "x" + height + "]";
  }

  /** Mutable builder for a {@link Field}, not safe to share between threads. */
  public static final class Builder {

    private final int width;
    private final int height;
    private float[] values;

    private Builder(int width, int height) {
      if (width <= 0 || height <= 0) {
        throw new IllegalArgumentException("Field must have positive size, was " + width + "x" + height);
      }
      this.width = width;
      this.height = height;
      this.values = new float[width * height];
    }

    public Builder set(int x, int y, double value) {
      values[y * width + x] = (float) value;
      return this;
    }

    public Builder set(int index, double value) {
      values[index] = (float) value;
      return this;
    }

    public Builder add(int index, double value) {
      values[index] += (float) value;
      return this;
    }

    public float get(int index) {
      return values[index];
    }

    /**
     * Returns the immutable field.
     *
     * @throws IllegalStateException if any value is {@code NaN} or infinite
     */
    public Field build() {
      float[] result = values;
      values = result.clone();
      return new Field(width, height, result);
    }
  }
}
