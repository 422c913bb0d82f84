package com.urbancanopy.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Utilities for formatting values as strings for logs and rounding values for reports.
 */
public class Format {

  public static final Locale DEFAULT_LOCALE = Locale.getDefault(Locale.Category.FORMAT);

  private static final ConcurrentMap<Locale, Format> instances = new ConcurrentHashMap<>();

  // `NumberFormat` instances are not thread safe, so we need to wrap them inside a `ThreadLocal`.
  @SuppressWarnings("java:S5164")
  private final ThreadLocal<NumberFormat> pf;
  @SuppressWarnings("java:S5164")
  private final ThreadLocal<NumberFormat> nf;
  @SuppressWarnings("java:S5164")
  private final ThreadLocal<NumberFormat> intF;

  private Format(Locale locale) {
    pf = ThreadLocal.withInitial(() -> {
      var f = NumberFormat.getPercentInstance(locale);
      f.setMaximumFractionDigits(1);
      return f;
    });
    nf = ThreadLocal.withInitial(() -> {
      var f = NumberFormat.getNumberInstance(locale);
      f.setMaximumFractionDigits(1);
      return f;
    });
    intF = ThreadLocal.withInitial(() -> {
      var f = NumberFormat.getNumberInstance(locale);
      f.setMaximumFractionDigits(0);
      return f;
    });
  }

  public static Format forLocale(Locale locale) {
    return instances.computeIfAbsent(locale, Format::new);
  }

  public static Format defaultInstance() {
    return forLocale(DEFAULT_LOCALE);
  }

  public static String padRight(String str, int size) {
    StringBuilder strBuilder = new StringBuilder(str);
    while (strBuilder.length() < size) {
      strBuilder.append(" ");
    }
    return strBuilder.toString();
  }

  /**
   * Returns {@code value} rounded half-up to {@code digits} decimal places, or 0 for non-finite input so that reports
   * never contain {@code NaN}.
   */
  public static double round(double value, int digits) {
    if (!Double.isFinite(value)) {
      return 0;
    }
    return BigDecimal.valueOf(value).setScale(digits, RoundingMode.HALF_UP).doubleValue();
  }

  /** Returns {@code numerator / denominator * 100}, or 0 when the denominator is 0. */
  public static double percentage(long numerator, long denominator) {
    return denominator <= 0 ? 0 : numerator * 100d / denominator;
  }

  /** Returns a URL opening Google Street View at a lat/lon. */
  public static String streetViewUrl(double lat, double lon) {
    return "https://www.google.com/maps/@?api=1&map_action=pano&viewpoint=" + lat + "," + lon;
  }

  /** Returns a URL dropping a Google Maps pin at a lat/lon. */
  public static String mapsUrl(double lat, double lon) {
    return "https://www.google.com/maps?q=" + lat + "," + lon;
  }

  /** Returns 0.0-1.0 as a "0%" - "100%" with up to 1 decimal point. */
  public String percent(double value) {
    return pf.get().format(value);
  }

  /** Returns a number formatted with 1 decimal point. */
  public String decimal(double value) {
    return nf.get().format(value);
  }

  /** Returns a number formatted with 0 decimal points. */
  public String integer(Number value) {
    return intF.get().format(value);
  }

  /** Returns an area in square meters formatted like "1,234.5m²". */
  public String area(double squareMeters) {
    return decimal(squareMeters) + "m²";
  }

  /** Returns a duration formatted like "1h2m" or "2m3s", or fractional seconds when under 1 second. */
  public String duration(Duration duration) {
    double seconds = duration.toNanos() * 1d / Duration.ofSeconds(1).toNanos();
    if (seconds < 1) {
      return decimal(seconds) + "s";
    }
    Duration simplified = Duration.ofSeconds(Math.round(seconds));
    return simplified.toString().replace("PT", "").toLowerCase(Locale.ROOT);
  }
}
