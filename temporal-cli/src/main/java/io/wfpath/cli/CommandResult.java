package io.wfpath.cli;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one finished process.
 *
 * @param command the command line that ran
 * @param exitCode process exit status
 * @param stdout captured standard output
 * @param stderr captured standard error
 * @param elapsed wall-clock run time
 */
public record CommandResult(
    List<String> command, int exitCode, String stdout, String stderr, Duration elapsed) {

  public CommandResult {
    command = List.copyOf(command);
    stdout = stdout == null ? "" : stdout;
    stderr = stderr == null ? "" : stderr;
  }

  public boolean isSuccess() {
    return exitCode == 0;
  }
}
