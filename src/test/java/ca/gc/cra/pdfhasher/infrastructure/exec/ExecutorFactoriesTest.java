package ca.gc.cra.pdfhasher.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void workersAreNamedWithPrefix() throws Exception {
    ExecutorService pool = ExecutorFactories.newIngestPool(2, "ingest-test", null);
    try {
      String name = pool.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);
      assertTrue(name.startsWith("ingest-test-"), name);
    } finally {
      pool.shutdown();
    }
  }

  @Test
  void fullQueueRunsWorkOnSubmitter() throws Exception {
    ExecutorService pool = ExecutorFactories.newIngestPool(1, "ingest-test", null);
    List<Future<String>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < 20; i++) {
        futures.add(pool.submit(() -> {
          TimeUnit.MILLISECONDS.sleep(5);
          return Thread.currentThread().getName();
        }));
      }
      int done = 0;
      for (Future<String> future : futures) {
        future.get(10, TimeUnit.SECONDS);
        done++;
      }
      assertEquals(20, done);
    } finally {
      pool.shutdown();
      assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
    }
  }

  @Test
  void sizeMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newIngestPool(0, "x", null));
  }
}
