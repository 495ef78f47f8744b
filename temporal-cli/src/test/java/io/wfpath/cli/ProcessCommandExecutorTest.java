package io.wfpath.cli;

import static org.junit.jupiter.api.Assertions.*;

import io.wfpath.cli.TemporalCliException.ErrorType;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ForkJoinPool;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

class ProcessCommandExecutorTest {

  @Test
  void missingBinaryIsCliNotFound() {
    ProcessCommandExecutor executor = new ProcessCommandExecutor();
    List<String> cmd = List.of("/nonexistent/wfpath-temporal-binary", "workflow", "count");

    TemporalCliException e = assertThrows(TemporalCliException.class, () -> executor.execute(cmd));

    assertEquals(ErrorType.CLI_NOT_FOUND, e.getType());
    assertEquals(cmd, e.getCommand());
  }

  @Test
  void rejectsNonPositiveTimeout() {
    assertThrows(IllegalArgumentException.class, () -> new ProcessCommandExecutor(Duration.ZERO));
    assertEquals(Duration.ofSeconds(60), new ProcessCommandExecutor().timeout());
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void capturesOutputAndExitCode() throws Exception {
    CommandResult r =
        new ProcessCommandExecutor()
            .execute(List.of("sh", "-c", "echo '{\"count\": 1}'; echo oops >&2; exit 3"));

    assertEquals(3, r.exitCode());
    assertFalse(r.isSuccess());
    assertEquals("{\"count\": 1}", r.stdout().strip());
    assertEquals("oops", r.stderr().strip());
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void killsCommandsThatOverrunTheTimeout() {
    ProcessCommandExecutor executor = new ProcessCommandExecutor(Duration.ofMillis(200));

    TemporalCliException e =
        assertThrows(
            TemporalCliException.class, () -> executor.execute(List.of("sh", "-c", "sleep 10")));

    assertEquals(ErrorType.TIMEOUT, e.getType());
    assertTrue(e.isRetryable());
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void drainsOutputWhileTheCommonPoolIsBusy() throws Exception {
    int parallelism = ForkJoinPool.getCommonPoolParallelism();
    CountDownLatch release = new CountDownLatch(1);
    List<CompletableFuture<Void>> blockers = new ArrayList<>();
    for (int i = 0; i < parallelism; i++) {
      blockers.add(
          CompletableFuture.runAsync(
              () -> {
                try {
                  release.await();
                } catch (InterruptedException e) {
                  Thread.currentThread().interrupt();
                }
              }));
    }
    try (ProcessCommandExecutor executor = new ProcessCommandExecutor(Duration.ofSeconds(10))) {
      // Well past a pipe buffer, so the command only exits if its output is read.
      CommandResult r =
          executor.execute(List.of("sh", "-c", "head -c 300000 /dev/zero | tr '\\0' x"));

      assertTrue(r.isSuccess());
      assertEquals(300000, r.stdout().length());
    } finally {
      release.countDown();
      CompletableFuture.allOf(blockers.toArray(new CompletableFuture[0])).join();
    }
  }
}

