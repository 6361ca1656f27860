package ca.gc.cra.warden.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void workersCarryPrefix() throws Exception {
    ExecutorService pool = ExecutorFactories.newAnalysisPool(2, "analysis", null);
    try {
      String name = pool.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);
      assertTrue(name.startsWith("analysis-"), name);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void blankPrefixFallsBackToDefault() throws Exception {
    ExecutorService pool = ExecutorFactories.newAnalysisPool(1, " ", null);
    try {
      assertEquals("warden-worker-0", pool.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS));
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void rejectsNonPositiveSize() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newAnalysisPool(0, "x", null));
  }

  @Test
  void defaultWorkersIsAtLeastTwo() {
    assertTrue(ExecutorFactories.defaultWorkers() >= 2);
  }
}
