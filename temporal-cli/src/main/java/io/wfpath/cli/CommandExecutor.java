package io.wfpath.cli;

import java.util.List;

/** Runs a command line to completion. */
@FunctionalInterface
public interface CommandExecutor {
  /**
   * @param command program and arguments
   * @return the finished process, whatever its exit status
   * @throws TemporalCliException if the program cannot be started, times out, or the wait is
   *     interrupted
   */
  CommandResult execute(List<String> command) throws TemporalCliException;
}
