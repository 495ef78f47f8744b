package io.wfpath.history;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class EventParserTest {

  @ParameterizedTest
  @ValueSource(
      strings = {
        "EVENT_TYPE_ACTIVITY_TASK_FAILED",
        "ACTIVITY_TASK_FAILED",
        "activity_task_failed",
        "ActivityTaskFailed",
        "activityTaskFailed"
      })
  void canonicalizesEventTypeSpellings(String spelling) {
    assertEquals("ActivityTaskFailed", EventTypes.canonicalize(spelling));
  }

  @Test
  void parsesWrappedHistory() {
    String json =
        """
        {"events": [
          {"eventId": "1", "eventTime": "2024-05-01T10:00:00.123Z",
           "eventType": "EVENT_TYPE_WORKFLOW_EXECUTION_STARTED",
           "workflowExecutionStartedEventAttributes": {
             "workflowType": {"name": "OrderWorkflow"},
             "input": {"payloads": [
               {"metadata": {"encoding": "anNvbi9wbGFpbg=="}, "data": "eyJpZCI6MX0="}
             ]}
           }},
          {"eventId": 2, "eventType": "WorkflowTaskScheduled"}
        ]}
        """;

    List<WorkflowEvent> events = EventParser.parseHistory(json);

    assertEquals(2, events.size());
    WorkflowEvent started = events.get(0);
    assertEquals(1L, started.eventId());
    assertEquals("WorkflowExecutionStarted", started.eventType());
    assertEquals(Instant.parse("2024-05-01T10:00:00.123Z"), started.eventTime());
    assertEquals("workflowExecutionStartedEventAttributes", started.attributesKey());
    assertEquals("OrderWorkflow", started.workflowType());
    assertEquals(1, started.payloads().size());
    assertEquals("input", started.payloads().get(0).path());
    assertEquals("json/plain", started.payloads().get(0).encoding());
    assertEquals("eyJpZCI6MX0=", started.payloads().get(0).data());

    WorkflowEvent scheduled = events.get(1);
    assertNull(scheduled.eventTime());
    assertNull(scheduled.attributesKey());
    assertTrue(scheduled.attributes().isEmpty());
    assertTrue(scheduled.payloads().isEmpty());
  }

  @Test
  void acceptsBareArray() {
    List<WorkflowEvent> events =
        EventParser.parseHistory("[{\"eventId\": 7, \"eventType\": \"TimerFired\"}]");
    assertEquals(7L, events.get(0).eventId());
  }

  @Test
  void unknownEventTypeIsKeptCanonicalized() {
    List<WorkflowEvent> events =
        EventParser.parseHistory("[{\"eventId\": 1, \"eventType\": \"EVENT_TYPE_SHINY_NEW\"}]");
    assertEquals("ShinyNew", events.get(0).eventType());
    assertFalse(EventTypes.isKnown("ShinyNew"));
  }

  @Test
  void unreadableTimeBecomesNull() {
    List<WorkflowEvent> events =
        EventParser.parseHistory(
            "[{\"eventId\": 1, \"eventType\": \"TimerFired\", \"eventTime\": \"yesterday\"}]");
    assertNull(events.get(0).eventTime());
  }

  @Test
  void missingEventIdIsMalformed() {
    MalformedEventException e =
        assertThrows(
            MalformedEventException.class,
            () -> EventParser.parseHistory("[{\"eventType\": \"TimerFired\"}]"));
    assertEquals("event at position 0", e.getLocation());
    assertTrue(e.getMessage().contains("missing eventId"));
  }

  @Test
  void missingEventTypeIsMalformed() {
    MalformedEventException e =
        assertThrows(
            MalformedEventException.class,
            () -> EventParser.parseHistory("[{\"eventId\": 3}]"));
    assertEquals("event 3", e.getLocation());
  }

  @Test
  void nonNumericIdIsMalformed() {
    assertThrows(
        MalformedEventException.class,
        () -> EventParser.parseHistory("[{\"eventId\": \"x1\", \"eventType\": \"TimerFired\"}]"));
  }

  @Test
  void idsMustStrictlyIncrease() {
    String json =
        "[{\"eventId\": 1, \"eventType\": \"TimerStarted\"},"
            + " {\"eventId\": 1, \"eventType\": \"TimerFired\"}]";
    MalformedEventException e =
        assertThrows(MalformedEventException.class, () -> EventParser.parseHistory(json));
    assertTrue(e.getMessage().contains("strictly increase"));
  }

  @Test
  void rejectsNonHistoryDocuments() {
    assertThrows(MalformedEventException.class, () -> EventParser.parseHistory("{\"a\": 1}"));
    assertThrows(MalformedEventException.class, () -> EventParser.parseHistory("not json"));
  }

  @Test
  void failureMessageAndChildWorkflowAccessors() {
    String json =
        """
        [
          {"eventId": 1, "eventType": "ActivityTaskFailed",
           "activityTaskFailedEventAttributes": {
             "failure": {"message": "boom"}, "scheduledEventId": "5"}},
          {"eventId": 2, "eventType": "StartChildWorkflowExecutionInitiated",
           "startChildWorkflowExecutionInitiatedEventAttributes": {
             "workflowId": "child-1", "workflowType": {"name": "Child"}}}
        ]
        """;
    List<WorkflowEvent> events = EventParser.parseHistory(json);
    assertEquals("boom", events.get(0).failureMessage());
    assertEquals("5", events.get(0).scheduledEventId());
    assertEquals("child-1", events.get(1).childWorkflowId());
    assertEquals("Child", events.get(1).workflowType());
  }
}
