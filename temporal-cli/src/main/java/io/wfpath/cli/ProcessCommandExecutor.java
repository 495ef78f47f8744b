package io.wfpath.cli;

import io.wfpath.cli.TemporalCliException.ErrorType;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CommandExecutor} backed by {@link ProcessBuilder}. Both output streams are drained on
 * threads owned by this executor, one per stream, so a chatty process cannot block on a full pipe
 * however many commands run at once. A process still running when the timeout expires is
 * destroyed.
 */
public final class ProcessCommandExecutor implements CommandExecutor, AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(ProcessCommandExecutor.class);

  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

  private final Duration timeout;
  private final AtomicInteger drainThreads = new AtomicInteger();
  private final ExecutorService drainPool =
      Executors.newCachedThreadPool(
          r -> {
            Thread t = new Thread(r, "wfpath-cli-drain-" + drainThreads.incrementAndGet());
            t.setDaemon(true);
            return t;
          });

  public ProcessCommandExecutor() {
    this(DEFAULT_TIMEOUT);
  }

  public ProcessCommandExecutor(Duration timeout) {
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("Timeout must be positive: " + timeout);
    }
    this.timeout = timeout;
  }

  public Duration timeout() {
    return timeout;
  }

  @Override
  public CommandResult execute(List<String> command) throws TemporalCliException {
    LOG.info("Executing: {}", String.join(" ", command));
    long start = System.nanoTime();

    Process process;
    try {
      process = new ProcessBuilder(command).start();
    } catch (IOException e) {
      throw new TemporalCliException(
          ErrorType.CLI_NOT_FOUND,
          "Cannot run '" + command.get(0) + "'. Is the Temporal CLI installed and on the PATH?",
          command,
          e);
    }

    CompletableFuture<String> stdout = drain(process.getInputStream());
    CompletableFuture<String> stderr = drain(process.getErrorStream());
    try {
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        throw new TemporalCliException(
            ErrorType.TIMEOUT,
            "Command timed out after " + timeout.toSeconds() + "s",
            command,
            -1,
            "Timeout",
            null);
      }
      int exitCode = process.exitValue();
      Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
      CommandResult result =
          new CommandResult(command, exitCode, stdout.get(), stderr.get(), elapsed);
      if (!result.isSuccess()) {
        LOG.error("Command failed with exit code {}: {}", exitCode, result.stderr().strip());
      } else {
        LOG.debug("Command finished in {} ms", elapsed.toMillis());
      }
      return result;
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new TemporalCliException(
          ErrorType.INTERRUPTED, "Interrupted while waiting for command", command, e);
    } catch (ExecutionException e) {
      throw new TemporalCliException(
          ErrorType.INVALID_OUTPUT, "Failed to read command output", command, e.getCause());
    }
  }

  private CompletableFuture<String> drain(InputStream in) {
    return CompletableFuture.supplyAsync(
        () -> {
          try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
          } catch (IOException e) {
            throw new UncheckedIOException(e);
          }
        },
        drainPool);
  }

  @Override
  public void close() {
    drainPool.shutdown();
  }
}
