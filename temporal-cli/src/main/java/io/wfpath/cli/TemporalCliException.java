package io.wfpath.cli;

import java.util.List;

/**
 * Thrown when a {@code temporal} invocation fails. The error type tells callers whether a retry
 * can help.
 */
public class TemporalCliException extends Exception {

  /** What went wrong. */
  public enum ErrorType {
    /** The {@code temporal} binary could not be started. */
    CLI_NOT_FOUND,
    /** The command did not finish within the timeout and was killed. */
    TIMEOUT,
    /** The command exited with a non-zero status. */
    COMMAND_FAILED,
    /** The command succeeded but its output is not the expected JSON. */
    INVALID_OUTPUT,
    /** The calling thread was interrupted while waiting. */
    INTERRUPTED
  }

  private final ErrorType type;
  private final List<String> command;
  private final int exitCode;
  private final String stderr;

  public TemporalCliException(ErrorType type, String message, List<String> command) {
    this(type, message, command, -1, "", null);
  }

  public TemporalCliException(
      ErrorType type, String message, List<String> command, Throwable cause) {
    this(type, message, command, -1, "", cause);
  }

  /**
   * @param type the error type
   * @param message the error message
   * @param command the command line that failed
   * @param exitCode process exit status, -1 if the process did not exit normally
   * @param stderr captured standard error, empty if none
   * @param cause underlying cause, may be null
   */
  public TemporalCliException(
      ErrorType type,
      String message,
      List<String> command,
      int exitCode,
      String stderr,
      Throwable cause) {
    super(message, cause);
    this.type = type;
    this.command = List.copyOf(command);
    this.exitCode = exitCode;
    this.stderr = stderr == null ? "" : stderr;
  }

  public ErrorType getType() {
    return type;
  }

  /** Timeouts and interruptions are transient; everything else fails the same way again. */
  public boolean isRetryable() {
    return switch (type) {
      case TIMEOUT, INTERRUPTED -> true;
      case CLI_NOT_FOUND, COMMAND_FAILED, INVALID_OUTPUT -> false;
    };
  }

  public List<String> getCommand() {
    return command;
  }

  public int getExitCode() {
    return exitCode;
  }

  public String getStderr() {
    return stderr;
  }
}
