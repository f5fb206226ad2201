package org.cellpainting.loaddata.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void workerThreadsCarryPrefix() throws Exception {
    ExecutorService pool = ExecutorFactories.newGroupPool(2, "bind-test", null);
    try {
      String name = pool.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);
      assertTrue(name.startsWith("bind-test-"), name);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void blankPrefixFallsBackToDefault() throws Exception {
    ExecutorService pool = ExecutorFactories.newGroupPool(1, " ", null);
    try {
      String name = pool.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);
      assertEquals("loaddata-group-0", name);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void rejectsNonPositiveSize() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newGroupPool(0, "x", null));
  }
}
