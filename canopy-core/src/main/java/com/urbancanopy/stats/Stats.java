package com.urbancanopy.stats;

import com.urbancanopy.util.Format;
import com.urbancanopy.util.LogUtil;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects timings and counts of discarded inputs while locations are processed, to report at the end of a run.
 */
public interface Stats extends AutoCloseable {

  /** Returns a new stat collector that stores stats in-memory to report through {@link #printSummary()}. */
  static Stats inMemory() {
    return new InMemory();
  }

  /** Logs how long each stage took and how many inputs were discarded for each kind of error. */
  default void printSummary() {
    Logger logger = LoggerFactory.getLogger(getClass());
    Format format = Format.defaultInstance();
    logger.info("");
    logger.info("-".repeat(40));
    timers().printSummary();
    logger.info("-".repeat(40));
    var errors = dataErrors();
    if (!errors.isEmpty()) {
      logger.info("Discarded inputs:");
      errors.forEach((code, count) -> logger.info("\t{}\t{}", code, format.integer(count)));
    }
    var counts = counters();
    if (!counts.isEmpty()) {
      counts.forEach((name, count) -> logger.info("\t{}\t{}", name, format.integer(count)));
    }
  }

  /**
   * Records that a stage with {@code name} has started and returns a handle to call when finished.
   * <p>
   * Also sets the "stage" prefix that shows up in the logs to {@code name}.
   */
  default Timers.Finishable startStage(String name) {
    return startStage(null, name);
  }

  /**
   * Records that {@code stage} has started for {@code location} and returns a handle to call when finished.
   * <p>
   * Also sets the log prefix of the current thread to {@code [location:stage]} until the handle is stopped.
   */
  default Timers.Finishable startStage(String location, String stage) {
    String previous = LogUtil.getStage();
    LogUtil.setStage(location, stage);
    var timer = timers().startTimer(location == null ? stage : (location + ":" + stage), true);
    return () -> {
      timer.stop();
      if (previous == null) {
        LogUtil.clearStage();
      } else {
        LogUtil.setStage(previous);
      }
    };
  }

  /** Returns the timers for all stages started with {@link #startStage(String)}. */
  Timers timers();

  /**
   * Records that an invalid input feature was discarded where {@code errorCode} can be used to identify the kind of
   * failure.
   */
  void dataError(String errorCode);

  /** Returns the number of times each error code passed to {@link #dataError(String)} has been recorded. */
  Map<String, Long> dataErrors();

  /** Increments a named counter, for example the number of locations that completed. */
  void increment(String counter);

  /** Returns the current value of every counter passed to {@link #increment(String)}. */
  Map<String, Long> counters();

  @Override
  default void close() {}

  /**
   * A stat collector that stores counters and timers in-memory.
   */
  class InMemory implements Stats {

    private final Timers timers = new Timers();
    private final ConcurrentMap<String, LongAdder> dataErrors = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LongAdder> counters = new ConcurrentHashMap<>();

    /** use {@link #inMemory()} */
    private InMemory() {}

    @Override
    public Timers timers() {
      return timers;
    }

    @Override
    public void dataError(String errorCode) {
      dataErrors.computeIfAbsent(errorCode, k -> new LongAdder()).increment();
    }

    @Override
    public Map<String, Long> dataErrors() {
      return snapshot(dataErrors);
    }

    @Override
    public void increment(String counter) {
      counters.computeIfAbsent(counter, k -> new LongAdder()).increment();
    }

    @Override
    public Map<String, Long> counters() {
      return snapshot(counters);
    }

    private static Map<String, Long> snapshot(Map<String, LongAdder> values) {
      Map<String, Long> result = new TreeMap<>();
      values.forEach((key, value) -> result.put(key, value.sum()));
      return result;
    }
  }
}
