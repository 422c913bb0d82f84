package com.urbancanopy.worker;

import static com.urbancanopy.util.Exceptions.throwFatalException;

import com.urbancanopy.stats.Stats;
import com.urbancanopy.util.LogUtil;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes a task in parallel across multiple threads.
 * <p>
 * A task that throws aborts the whole worker, so per-item failures that should not stop a batch must be handled inside
 * the task.
 */
public class Worker {

  private static final Logger LOGGER = LoggerFactory.getLogger(Worker.class);
  private final CompletableFuture<Void> done;

  /**
   * Constructs a new worker and immediately starts {@code threads} threads all running {@code task}.
   *
   * @param prefix  string ID to add to thread names, logs and stats
   * @param stats   stats collector for this thread pool
   * @param threads number of parallel threads to run {@code task} in
   * @param task    the work to do in each thread
   */
  public Worker(String prefix, Stats stats, int threads, Task task) {
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be >= 1, was " + threads);
    }
    var es = Executors.newFixedThreadPool(threads, new NamedThreadFactory(prefix));
    String parentStage = LogUtil.getStage();
    List<CompletableFuture<?>> results = new ArrayList<>();
    for (int i = 0; i < threads; i++) {
      results.add(CompletableFuture.runAsync(() -> {
        LogUtil.setStage(parentStage, prefix);
        LOGGER.trace("Starting worker");
        try {
          task.run();
          stats.increment(prefix + "_workers_finished");
        } catch (Exception e) {
          LOGGER.error("Worker {} died", Thread.currentThread().getName(), e);
          throwFatalException(e);
        } finally {
          LogUtil.clearStage();
          LOGGER.trace("Finished worker");
        }
      }, es));
    }
    es.shutdown();
    done = joinFutures(results);
  }

  /**
   * Starts a worker where {@code threads} threads take items from {@code items} until none are left, and passes each
   * one to {@code handler}.
   */
  public static <T> Worker forEach(String prefix, Stats stats, int threads, Collection<T> items, Consumer<T> handler) {
    Queue<T> queue = new ConcurrentLinkedQueue<>(items);
    return new Worker(prefix, stats, Math.max(1, Math.min(threads, items.size())), () -> {
      T item;
      while ((item = queue.poll()) != null) {
        handler.accept(item);
      }
    });
  }

  /**
   * Returns a future that completes successfully when all {@code futures} complete, or fails immediately when the first
   * one fails.
   */
  public static CompletableFuture<Void> joinFutures(Collection<CompletableFuture<?>> futures) {
    CompletableFuture<Void> result = CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new));
    for (CompletableFuture<?> f : futures) {
      f.whenComplete((res, ex) -> {
        if (ex != null) {
          result.completeExceptionally(ex);
          futures.forEach(other -> other.cancel(true));
        }
      });
    }
    return result;
  }

  public CompletableFuture<Void> done() {
    return done;
  }

  /**
   * Blocks until all tasks are complete.
   *
   * @throws RuntimeException if interrupted or if one of the threads throws.
   */
  public void await() {
    try {
      done().get();
    } catch (ExecutionException e) {
      throwFatalException(e.getCause());
    } catch (InterruptedException e) {
      throwFatalException(e);
    }
  }

  /** Work each thread runs once. */
  @FunctionalInterface
  public interface Task {

    @SuppressWarnings("java:S112")
    void run() throws Exception;
  }

  /** A thread factory that names threads {@code name-N}. */
  private static class NamedThreadFactory implements ThreadFactory {

    private final AtomicInteger threadNumber = new AtomicInteger(1);
    private final String namePrefix;

    private NamedThreadFactory(String name) {
      namePrefix = name + "-";
    }

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(r, namePrefix + threadNumber.getAndIncrement());
      t.setDaemon(true);
      return t;
    }
  }
}
