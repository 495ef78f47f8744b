package io.wfpath.history;

import java.util.Locale;
import java.util.Set;

/** Workflow history event type names. */
public final class EventTypes {
  private EventTypes() {}

  public static final String WORKFLOW_EXECUTION_STARTED = "WorkflowExecutionStarted";
  public static final String WORKFLOW_EXECUTION_COMPLETED = "WorkflowExecutionCompleted";
  public static final String WORKFLOW_EXECUTION_FAILED = "WorkflowExecutionFailed";
  public static final String WORKFLOW_EXECUTION_TIMED_OUT = "WorkflowExecutionTimedOut";
  public static final String WORKFLOW_EXECUTION_TERMINATED = "WorkflowExecutionTerminated";
  public static final String WORKFLOW_EXECUTION_CANCELED = "WorkflowExecutionCanceled";
  public static final String WORKFLOW_EXECUTION_CONTINUED_AS_NEW =
      "WorkflowExecutionContinuedAsNew";
  public static final String WORKFLOW_EXECUTION_SIGNALED = "WorkflowExecutionSignaled";
  public static final String WORKFLOW_TASK_SCHEDULED = "WorkflowTaskScheduled";
  public static final String WORKFLOW_TASK_STARTED = "WorkflowTaskStarted";
  public static final String WORKFLOW_TASK_COMPLETED = "WorkflowTaskCompleted";
  public static final String WORKFLOW_TASK_FAILED = "WorkflowTaskFailed";
  public static final String ACTIVITY_TASK_SCHEDULED = "ActivityTaskScheduled";
  public static final String ACTIVITY_TASK_STARTED = "ActivityTaskStarted";
  public static final String ACTIVITY_TASK_COMPLETED = "ActivityTaskCompleted";
  public static final String ACTIVITY_TASK_FAILED = "ActivityTaskFailed";
  public static final String TIMER_STARTED = "TimerStarted";
  public static final String TIMER_FIRED = "TimerFired";
  public static final String MARKER_RECORDED = "MarkerRecorded";
  public static final String START_CHILD_WORKFLOW_EXECUTION_INITIATED =
      "StartChildWorkflowExecutionInitiated";
  public static final String CHILD_WORKFLOW_EXECUTION_STARTED = "ChildWorkflowExecutionStarted";

  /** Every event type a Temporal server writes to a workflow history. */
  public static final Set<String> ALL =
      Set.of(
          WORKFLOW_EXECUTION_STARTED,
          WORKFLOW_EXECUTION_COMPLETED,
          WORKFLOW_EXECUTION_FAILED,
          WORKFLOW_EXECUTION_TIMED_OUT,
          WORKFLOW_EXECUTION_TERMINATED,
          WORKFLOW_EXECUTION_CANCELED,
          WORKFLOW_EXECUTION_CONTINUED_AS_NEW,
          WORKFLOW_EXECUTION_SIGNALED,
          "WorkflowExecutionCancelRequested",
          WORKFLOW_TASK_SCHEDULED,
          WORKFLOW_TASK_STARTED,
          WORKFLOW_TASK_COMPLETED,
          WORKFLOW_TASK_FAILED,
          "WorkflowTaskTimedOut",
          ACTIVITY_TASK_SCHEDULED,
          ACTIVITY_TASK_STARTED,
          ACTIVITY_TASK_COMPLETED,
          ACTIVITY_TASK_FAILED,
          "ActivityTaskTimedOut",
          "ActivityTaskCancelRequested",
          "ActivityTaskCanceled",
          TIMER_STARTED,
          TIMER_FIRED,
          "TimerCanceled",
          MARKER_RECORDED,
          "RequestCancelExternalWorkflowExecutionInitiated",
          "RequestCancelExternalWorkflowExecutionFailed",
          "ExternalWorkflowExecutionCancelRequested",
          START_CHILD_WORKFLOW_EXECUTION_INITIATED,
          "StartChildWorkflowExecutionFailed",
          CHILD_WORKFLOW_EXECUTION_STARTED,
          "ChildWorkflowExecutionCompleted",
          "ChildWorkflowExecutionFailed",
          "ChildWorkflowExecutionCanceled",
          "ChildWorkflowExecutionTimedOut",
          "ChildWorkflowExecutionTerminated",
          "SignalExternalWorkflowExecutionInitiated",
          "SignalExternalWorkflowExecutionFailed",
          "ExternalWorkflowExecutionSignaled",
          "UpsertWorkflowSearchAttributes",
          "WorkflowPropertiesModified",
          "WorkflowPropertiesModifiedExternally",
          "ActivityPropertiesModifiedExternally",
          "WorkflowExecutionUpdateAdmitted",
          "WorkflowExecutionUpdateAccepted",
          "WorkflowExecutionUpdateRejected",
          "WorkflowExecutionUpdateCompleted",
          "NexusOperationScheduled",
          "NexusOperationStarted",
          "NexusOperationCompleted",
          "NexusOperationFailed",
          "NexusOperationCanceled",
          "NexusOperationTimedOut",
          "NexusOperationCancelRequested");

  /**
   * Converts any spelling of an event type to its CamelCase name: {@code
   * EVENT_TYPE_ACTIVITY_TASK_FAILED}, {@code ACTIVITY_TASK_FAILED}, {@code activity_task_failed}
   * and {@code ActivityTaskFailed} all become {@code ActivityTaskFailed}.
   *
   * @param name event type as written in a record or by a caller
   * @return the CamelCase name
   */
  public static String canonicalize(String name) {
    String n = name.trim();
    if (n.regionMatches(true, 0, "EVENT_TYPE_", 0, 11)) {
      n = n.substring(11);
    }
    if (n.indexOf('_') >= 0 || n.equals(n.toUpperCase(Locale.ROOT))) {
      StringBuilder sb = new StringBuilder(n.length());
      for (String part : n.split("_")) {
        if (part.isEmpty()) {
          continue;
        }
        sb.append(Character.toUpperCase(part.charAt(0)))
            .append(part.substring(1).toLowerCase(Locale.ROOT));
      }
      return sb.toString();
    }
    if (!n.isEmpty() && Character.isLowerCase(n.charAt(0))) {
      return Character.toUpperCase(n.charAt(0)) + n.substring(1);
    }
    return n;
  }

  public static boolean isKnown(String canonicalName) {
    return ALL.contains(canonicalName);
  }

  /** Whether the type belongs to the failure taxonomy, i.e. its name ends in {@code Failed}. */
  public static boolean isFailure(String canonicalName) {
    return canonicalName.endsWith("Failed");
  }
}
