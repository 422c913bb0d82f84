package com.urbancanopy.stats;

import com.urbancanopy.util.Format;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A registry of pipeline stages that are being timed.
 * <p>
 * Stages for different locations may run concurrently on worker threads, so each stage name should be unique per
 * location (see {@link Stats#startStage(String, String)}).
 */
@ThreadSafe
public class Timers {

  private static final Logger LOGGER = LoggerFactory.getLogger(Timers.class);
  private final Map<String, Timer> timers = Collections.synchronizedMap(new LinkedHashMap<>());

  public void printSummary() {
    var all = all();
    int maxLength = (int) all.keySet().stream().mapToLong(String::length).max().orElse(0);
    for (var entry : all.entrySet()) {
      LOGGER.info("\t{} {}", Format.padRight(entry.getKey(), maxLength), entry.getValue().elapsed());
    }
  }

  public Finishable startTimer(String name, boolean log) {
    Timer timer = Timer.start();
    timers.put(name, timer);
    if (log) {
      LOGGER.debug("Starting...");
    }
    return () -> {
      timer.stop();
      if (log) {
        LOGGER.debug("Finished in {}", timer);
      }
    };
  }

  /** Returns a snapshot of all timers. Will not reflect timers that start after it's called. */
  public Map<String, Timer> all() {
    synchronized (timers) {
      return new LinkedHashMap<>(timers);
    }
  }

  /** A handle that callers can use to indicate a task has finished. */
  @FunctionalInterface
  public interface Finishable extends AutoCloseable {

    void stop();

    @Override
    default void close() {
      stop();
    }
  }
}
