package com.urbancanopy.worker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.urbancanopy.ExpectedException;
import com.urbancanopy.stats.Stats;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class WorkerTest {

  @Test
  @Timeout(10)
  void testExceptionHandled() {
    AtomicInteger started = new AtomicInteger();
    var worker = new Worker("prefix", Stats.inMemory(), 4, () -> {
      if (started.incrementAndGet() == 1) {
        throw new ExpectedException();
      } else {
        Thread.sleep(5000);
      }
    });
    assertThrows(ExpectedException.class, worker::await);
  }

  @Test
  @Timeout(10)
  void testCheckedExceptionWrapped() {
    var worker = new Worker("prefix", Stats.inMemory(), 1, () -> {
      throw new IOException("boom");
    });
    assertThrows(UncheckedIOException.class, worker::await);
  }

  @Test
  @Timeout(10)
  void testForEachProcessesEveryItem() {
    Stats stats = Stats.inMemory();
    List<Integer> items = IntStream.range(0, 100).boxed().toList();
    Set<Integer> seen = ConcurrentHashMap.newKeySet();
    AtomicInteger calls = new AtomicInteger();
    Worker.forEach("items", stats, 4, items, item -> {
      calls.incrementAndGet();
      seen.add(item);
    }).await();
    assertEquals(100, calls.get());
    assertEquals(items.stream().collect(Collectors.toSet()), seen);
    assertEquals(4L, (long) stats.counters().get("items_workers_finished"));
  }

  @Test
  @Timeout(10)
  void testForEachUsesNoMoreThreadsThanItems() {
    Stats stats = Stats.inMemory();
    Worker.forEach("items", stats, 8, List.of("a", "b"), item -> {}).await();
    assertEquals(2L, (long) stats.counters().get("items_workers_finished"));
  }

  @Test
  void testRejectsZeroThreads() {
    Stats stats = Stats.inMemory();
    assertThrows(IllegalArgumentException.class, () -> new Worker("prefix", stats, 0, () -> {}));
  }
}
