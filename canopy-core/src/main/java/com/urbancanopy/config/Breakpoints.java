package com.urbancanopy.config;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A monotone piecewise-constant function over one input value, parsed from a compact string.
 * <p>
 * Format: comma-separated steps {@code <=bound:value} or {@code <bound:value} evaluated in order, followed by an
 * optional {@code else:value} fallback (default 0). For example {@code "<5:0,<=15:25,<=30:15,<=50:5,else:0"} returns 0
 * below 5, 25 for {@code [5,15]}, 15 for {@code (15,30]}, 5 for {@code (30,50]} and 0 beyond.
 *
 * @param steps     the steps, in order of non-decreasing bound
 * @param otherwise value returned when the input passes every step's bound
 */
public record Breakpoints(List<Step> steps, double otherwise) {

  public Breakpoints {
    steps = List.copyOf(steps);
    for (int i = 1; i < steps.size(); i++) {
      if (steps.get(i).bound < steps.get(i - 1).bound) {
        throw new IllegalArgumentException("Breakpoint bounds must not decrease: " + steps);
      }
    }
  }

  /**
   * Parses breakpoints from {@code "<=5:35,<=10:25,else:0"}.
   *
   * @throws IllegalArgumentException if the string is malformed
   */
  public static Breakpoints parse(String text) {
    List<Step> steps = new ArrayList<>();
    double otherwise = 0;
    for (String part : text.split(",")) {
      String token = part.strip();
      if (token.isEmpty()) {
        continue;
      }
      String[] kv = token.split(":", 2);
      if (kv.length != 2) {
        throw new IllegalArgumentException("Expected <bound:value in breakpoint '" + token + "' of '" + text + "'");
      }
      String condition = kv[0].strip();
      double value = parseNumber(kv[1], text);
      if ("else".equalsIgnoreCase(condition)) {
        otherwise = value;
      } else if (condition.startsWith("<=")) {
        steps.add(new Step(parseNumber(condition.substring(2), text), true, value));
      } else if (condition.startsWith("<")) {
        steps.add(new Step(parseNumber(condition.substring(1), text), false, value));
      } else {
        throw new IllegalArgumentException("Unrecognized breakpoint condition '" + condition + "' in '" + text + "'");
      }
    }
    return new Breakpoints(steps, otherwise);
  }

  private static double parseNumber(String value, String text) {
    try {
      return Double.parseDouble(value.strip());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid number '" + value + "' in breakpoints '" + text + "'", e);
    }
  }

  /** Returns the value of the first step whose bound {@code input} falls under, or {@link #otherwise()}. */
  public double apply(double input) {
    for (Step step : steps) {
      if (step.matches(input)) {
        return step.value;
      }
    }
    return otherwise;
  }

  /** Returns the largest value this function can return. */
  public double maxValue() {
    double max = otherwise;
    for (Step step : steps) {
      max = Math.max(max, step.value);
    }
    return max;
  }

  /** Returns the smallest value this function can return. */
  public double minValue() {
    double min = otherwise;
    for (Step step : steps) {
      min = Math.min(min, step.value);
    }
    return min;
  }

  @Override
  public String toString() {
    return steps.stream().map(Step::toString).collect(Collectors.joining(",")) + ",else:" + otherwise;
  }

  /** One {@code <bound:value} or {@code <=bound:value} step. */
  public record Step(double bound, boolean inclusive, double value) {

    boolean matches(double input) {
      return inclusive ? input <= bound : input < bound;
    }

    @Override
    public String toString() {
      return (inclusive ? "<=" : "<") + bound + ":" + value;
    }
  }
}
