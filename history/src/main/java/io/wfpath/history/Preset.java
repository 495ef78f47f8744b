package io.wfpath.history;

import java.util.Locale;
import java.util.Set;

/** Named event selections. A preset replaces any include or exclude list. */
public enum Preset {
  /** Execution lifecycle, child starts and activity outcomes. */
  SUMMARY(
      "summary",
      Set.of(
          EventTypes.WORKFLOW_EXECUTION_STARTED,
          EventTypes.WORKFLOW_EXECUTION_COMPLETED,
          EventTypes.WORKFLOW_EXECUTION_FAILED,
          EventTypes.WORKFLOW_EXECUTION_TIMED_OUT,
          EventTypes.WORKFLOW_EXECUTION_TERMINATED,
          EventTypes.WORKFLOW_EXECUTION_CANCELED,
          EventTypes.WORKFLOW_EXECUTION_CONTINUED_AS_NEW,
          EventTypes.CHILD_WORKFLOW_EXECUTION_STARTED,
          EventTypes.ACTIVITY_TASK_COMPLETED,
          EventTypes.ACTIVITY_TASK_FAILED),
      Set.of()),
  /** Everything except timer, marker and workflow task bookkeeping. */
  CRITICAL_PATH(
      "critical_path",
      Set.of(),
      Set.of(
          EventTypes.TIMER_FIRED,
          EventTypes.TIMER_STARTED,
          EventTypes.MARKER_RECORDED,
          EventTypes.WORKFLOW_TASK_SCHEDULED,
          EventTypes.WORKFLOW_TASK_STARTED)),
  /** The last failure and the events leading up to it. */
  LAST_FAILURE_CONTEXT("last_failure_context", Set.of(), Set.of()),
  /** Workflow task failures, the points a reset usually targets. */
  RESETS("resets", Set.of(EventTypes.WORKFLOW_TASK_FAILED), Set.of());

  private final String id;
  private final Set<String> include;
  private final Set<String> exclude;

  Preset(String id, Set<String> include, Set<String> exclude) {
    this.id = id;
    this.include = include;
    this.exclude = exclude;
  }

  /** Name used by callers, e.g. {@code critical_path}. */
  public String id() {
    return id;
  }

  public Set<String> include() {
    return include;
  }

  public Set<String> exclude() {
    return exclude;
  }

  /**
   * @param text preset id, case-insensitive; dashes are accepted for underscores
   * @throws IllegalArgumentException for unknown presets
   */
  public static Preset fromText(String text) {
    String key = text.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    for (Preset p : values()) {
      if (p.id.equals(key)) {
        return p;
      }
    }
    throw new IllegalArgumentException(
        "Unknown preset: " + text + " (expected summary, critical_path, last_failure_context or"
            + " resets)");
  }
}
