package io.wfpath.history;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Summarizes a whole history: event counts, lifecycle, children, failures, signals, activities. */
public final class HistoryAnalyzer {

  private static final Set<String> LIFECYCLE =
      Set.of(
          EventTypes.WORKFLOW_EXECUTION_STARTED,
          EventTypes.WORKFLOW_EXECUTION_COMPLETED,
          EventTypes.WORKFLOW_EXECUTION_FAILED,
          EventTypes.WORKFLOW_EXECUTION_TIMED_OUT,
          EventTypes.WORKFLOW_EXECUTION_TERMINATED,
          EventTypes.WORKFLOW_EXECUTION_CANCELED,
          EventTypes.WORKFLOW_EXECUTION_CONTINUED_AS_NEW);

  private HistoryAnalyzer() {}

  /**
   * Analysis of one history.
   *
   * @param totalEvents number of events
   * @param eventTypeCounts events per type, in order of first appearance
   * @param timeline execution lifecycle events
   * @param childWorkflows child workflow initiations
   * @param failures events of the failure taxonomy with their messages
   * @param signals signals received or sent
   * @param activityTypes scheduled activities per activity type
   */
  public record Analysis(
      int totalEvents,
      Map<String, Integer> eventTypeCounts,
      List<Map<String, Object>> timeline,
      List<Map<String, Object>> childWorkflows,
      List<Map<String, Object>> failures,
      List<Map<String, Object>> signals,
      Map<String, Integer> activityTypes) {

    /** Type of the last lifecycle event, e.g. {@code WorkflowExecutionFailed}, or null. */
    public String finalState() {
      if (timeline.isEmpty()) {
        return null;
      }
      return (String) timeline.get(timeline.size() - 1).get("eventType");
    }

    public Map<String, Object> toMap() {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("totalEvents", totalEvents);
      map.put("finalState", finalState());
      map.put("eventTypeCounts", eventTypeCounts);
      map.put("timeline", timeline);
      map.put("childWorkflows", childWorkflows);
      map.put("failures", failures);
      map.put("signals", signals);
      map.put("activityTypes", activityTypes);
      return map;
    }
  }

  public static Analysis analyze(List<WorkflowEvent> events) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    List<Map<String, Object>> timeline = new ArrayList<>();
    List<Map<String, Object>> children = new ArrayList<>();
    List<Map<String, Object>> failures = new ArrayList<>();
    List<Map<String, Object>> signals = new ArrayList<>();
    Map<String, Integer> activities = new LinkedHashMap<>();

    for (WorkflowEvent e : events) {
      String type = e.eventType();
      counts.merge(type, 1, Integer::sum);

      if (LIFECYCLE.contains(type)) {
        timeline.add(entry(e));
      }
      if (type.equals(EventTypes.START_CHILD_WORKFLOW_EXECUTION_INITIATED)) {
        Map<String, Object> child = entry(e);
        child.put("workflowId", e.childWorkflowId());
        child.put("workflowType", e.workflowType());
        children.add(child);
      }
      if (EventTypes.isFailure(type)) {
        Map<String, Object> failure = entry(e);
        failure.put("message", e.failureMessage());
        failures.add(failure);
      }
      if (type.contains("Signal")) {
        Map<String, Object> signal = entry(e);
        signal.put("signalName", e.signalName());
        signals.add(signal);
      }
      if (type.equals(EventTypes.ACTIVITY_TASK_SCHEDULED) && e.activityType() != null) {
        activities.merge(e.activityType(), 1, Integer::sum);
      }
    }
    return new Analysis(
        events.size(), counts, timeline, children, failures, signals, activities);
  }

  private static Map<String, Object> entry(WorkflowEvent e) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("eventId", e.eventId());
    map.put("eventType", e.eventType());
    map.put("eventTime", e.eventTime() != null ? e.eventTime().toString() : null);
    return map;
  }
}
