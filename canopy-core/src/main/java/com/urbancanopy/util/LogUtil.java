package com.urbancanopy.util;

import org.slf4j.MDC;

/**
 * Wrapper for SLF4j {@link MDC} log utility to prepend {@code [location:stage]} to log output.
 */
public class LogUtil {

  private static final String STAGE_KEY = "stage";

  private LogUtil() {}

  /** Prepends {@code [stage]} to all subsequent logs from this thread. */
  public static void setStage(String stage) {
    MDC.put(STAGE_KEY, "[%s] ".formatted(stage));
  }

  /** Prepends {@code [location:stage]} to all subsequent logs from this thread. */
  public static void setStage(String location, String stage) {
    if (location == null) {
      setStage(stage);
    } else {
      setStage(location + ":" + stage);
    }
  }

  /** Removes {@code [stage]} from subsequent logs from this thread. */
  public static void clearStage() {
    MDC.remove(STAGE_KEY);
  }

  /** Returns the current {@code [stage]} value prepended to log for this thread, without the brackets. */
  public static String getStage() {
    String value = MDC.get(STAGE_KEY);
    return value == null ? null : value.substring(1, value.length() - 2);
  }
}
