package com.urbancanopy.stats;

import com.urbancanopy.util.Format;
import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * A snapshot of the wall and CPU time that this JVM has consumed.
 * <p>
 * For example:
 *
 * <pre>
 * {@code
 * var start = ProcessTime.now();
 * // score a location...
 * var end = ProcessTime.now();
 * LOGGER.info("Scoring took " + end.minus(start));
 * }
 * </pre>
 */
public record ProcessTime(Duration wall, Optional<Duration> cpu) {

  /** Takes a snapshot of current wall and CPU time of this JVM. */
  public static ProcessTime now() {
    return new ProcessTime(Duration.ofNanos(System.nanoTime()), processCpuTime());
  }

  private static Optional<Duration> processCpuTime() {
    if (ManagementFactory.getOperatingSystemMXBean() instanceof com.sun.management.OperatingSystemMXBean os) {
      long nanos = os.getProcessCpuTime();
      return nanos < 0 ? Optional.empty() : Optional.of(Duration.ofNanos(nanos));
    }
    return Optional.empty();
  }

  /** Returns the amount of time elapsed between {@code other} and {@code this}. */
  ProcessTime minus(ProcessTime other) {
    return new ProcessTime(
      wall.minus(other.wall),
      cpu.flatMap(thisCpu -> other.cpu.map(thisCpu::minus))
    );
  }

  public String toString(Locale locale) {
    Format format = Format.forLocale(locale);
    String deltaCpu = cpu.map(format::duration).orElse("-");
    String avgCpus = cpu.map(cpuTime -> " avg:" + format.decimal(cpuTime.toNanos() * 1d / Math.max(1, wall.toNanos())))
      .orElse("");
    return format.duration(wall) + " cpu:" + deltaCpu + avgCpus;
  }

  @Override
  public String toString() {
    return toString(Format.DEFAULT_LOCALE);
  }
}
