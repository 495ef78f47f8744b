package io.wfpath.query;

import java.util.Arrays;
import java.util.List;

/** Values the {@code ExecutionStatus} search attribute can take. */
public enum ExecutionStatus {
  Running,
  Completed,
  Failed,
  Canceled,
  Terminated,
  ContinuedAsNew,
  TimedOut;

  /** Status names as they appear in query literals. */
  public static List<String> names() {
    return Arrays.stream(values()).map(Enum::name).toList();
  }
}
