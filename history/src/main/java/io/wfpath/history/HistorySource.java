package io.wfpath.history;

import com.fasterxml.jackson.databind.JsonNode;

/** Fetches the raw history of a workflow execution. */
@FunctionalInterface
public interface HistorySource {
  /**
   * @param workflowId workflow id
   * @param runId run id, or null for the latest run
   * @return the raw history document, as accepted by {@link EventParser#parseHistory(JsonNode)}
   */
  JsonNode fetchEvents(String workflowId, String runId) throws Exception;
}
