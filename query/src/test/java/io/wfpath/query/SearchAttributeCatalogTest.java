package io.wfpath.query;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class SearchAttributeCatalogTest {

  @Test
  void startsWithBuiltins() {
    SearchAttributeCatalog catalog = new SearchAttributeCatalog();
    assertSame(TypeRegistry.builtins(), catalog.current());
  }

  @Test
  void replaceSwapsWholeRegistry() {
    SearchAttributeCatalog catalog = new SearchAttributeCatalog();
    TypeRegistry before = catalog.current();

    TypeRegistry previous = catalog.replaceCustomFields(Map.of("CustomerId", FieldType.KEYWORD));

    assertSame(before, previous);
    assertTrue(catalog.current().find("CustomerId").isPresent());
    assertTrue(before.find("CustomerId").isEmpty());
  }

  @Test
  void rejectsNullRegistry() {
    assertThrows(IllegalArgumentException.class, () -> new SearchAttributeCatalog().replace(null));
  }

  @Test
  void readersAlwaysSeeACompleteRegistry() throws Exception {
    SearchAttributeCatalog catalog = new SearchAttributeCatalog();
    TypeRegistry a =
        TypeRegistry.withCustomFields(Map.of("A1", FieldType.INT, "A2", FieldType.INT));
    TypeRegistry b =
        TypeRegistry.withCustomFields(Map.of("B1", FieldType.INT, "B2", FieldType.INT));
    ExecutorService pool = Executors.newFixedThreadPool(4);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int w = 0; w < 2; w++) {
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < 1000; i++) {
                    catalog.replace(i % 2 == 0 ? a : b);
                  }
                  return null;
                }));
      }
      for (int r = 0; r < 2; r++) {
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < 1000; i++) {
                    TypeRegistry snapshot = catalog.current();
                    boolean hasA = snapshot.find("A1").isPresent();
                    assertEquals(hasA, snapshot.find("A2").isPresent());
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> f : futures) {
        f.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }
  }
}
