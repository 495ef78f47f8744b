package io.wfpath.history;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.time.Instant;
import java.util.List;

/**
 * One event of a workflow execution history.
 *
 * @param eventId position of the event in its history, strictly increasing
 * @param eventType CamelCase event type, see {@link EventTypes}
 * @param eventTime when the event was recorded, null if the record carries no time
 * @param attributesKey name of the attributes member in the raw record, null if there was none
 * @param attributes the type-specific attributes, an empty object if there were none
 * @param payloads payload references in depth-first order
 */
public record WorkflowEvent(
    long eventId,
    String eventType,
    Instant eventTime,
    String attributesKey,
    JsonNode attributes,
    List<Payload> payloads) {

  public WorkflowEvent {
    attributes =
        attributes == null ? JsonNodeFactory.instance.objectNode() : attributes.deepCopy();
    payloads = payloads == null ? List.of() : List.copyOf(payloads);
  }

  /** Failure message carried by failure-class events, null otherwise. */
  public String failureMessage() {
    return text(attributes.path("failure").path("message"));
  }

  /** Activity type name on activity events. */
  public String activityType() {
    return text(attributes.path("activityType").path("name"));
  }

  public String signalName() {
    return text(attributes.path("signalName"));
  }

  /** Workflow type name on start and child workflow events. */
  public String workflowType() {
    return text(attributes.path("workflowType").path("name"));
  }

  public String timerId() {
    return text(attributes.path("timerId"));
  }

  public String markerName() {
    return text(attributes.path("markerName"));
  }

  /** Child workflow id on child workflow events. */
  public String childWorkflowId() {
    if (eventType.equals(EventTypes.START_CHILD_WORKFLOW_EXECUTION_INITIATED)) {
      return text(attributes.path("workflowId"));
    }
    if (eventType.startsWith("ChildWorkflowExecution")) {
      return text(attributes.path("workflowExecution").path("workflowId"));
    }
    return null;
  }

  /** Id of the scheduling event that a started/completed/failed event refers back to. */
  public String scheduledEventId() {
    return text(attributes.path("scheduledEventId"));
  }

  private static String text(JsonNode node) {
    if (node.isMissingNode() || node.isNull() || node.isContainerNode()) {
      return null;
    }
    String s = node.asText();
    return s.isEmpty() ? null : s;
  }
}
