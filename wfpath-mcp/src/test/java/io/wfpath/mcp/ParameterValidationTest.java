package io.wfpath.mcp;

import static io.wfpath.mcp.McpTestSupport.assertError;
import static io.wfpath.mcp.McpTestSupport.invokeHandler;
import static org.mockito.Mockito.verifyNoInteractions;

import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.wfpath.cli.CommandExecutor;
import io.wfpath.cli.TemporalCli;
import io.wfpath.cli.TemporalCommandBuilder;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Argument checks of every handler. None of them may reach the CLI. */
@ExtendWith(MockitoExtension.class)
class ParameterValidationTest {

  @Mock private CommandExecutor executor;

  private WfPathMcpServer server;

  @BeforeEach
  void setUp() {
    server =
        new WfPathMcpServer(
            WfPathConfig.defaults(), new TemporalCli(executor, new TemporalCommandBuilder()));
  }

  @AfterEach
  void noCliCalls() {
    verifyNoInteractions(executor);
  }

  private CallToolResult invoke(String handler, Map<String, Object> args) throws Exception {
    return invokeHandler(server, handler, args);
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // workflowId
  // ─────────────────────────────────────────────────────────────────────────────

  @ParameterizedTest
  @ValueSource(
      strings = {
        "handleDescribeWorkflow",
        "handleTraceWorkflow",
        "handleQueryWorkflow",
        "handleGetHistory",
        "handleAnalyzeHistory",
        "handleGetFailedRuns"
      })
  void rejectsMissingWorkflowId(String handler) throws Exception {
    Map<String, Object> args = new HashMap<>();
    args.put("workflowId", null);
    assertError(invoke(handler, args), "workflowId is required");
  }

  @Test
  void queryRequiresQueryType() throws Exception {
    assertError(
        invoke("handleQueryWorkflow", Map.of("workflowId", "order-1", "queryType", " ")),
        "queryType is required");
  }

  @Test
  void rejectsBlankWorkflowId() throws Exception {
    assertError(invoke("handleGetHistory", Map.of("workflowId", "   ")), "workflowId is required");
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // validate_workflow_query / build_workflow_query
  // ─────────────────────────────────────────────────────────────────────────────

  @Test
  void validateRejectsEmptyQuery() throws Exception {
    assertError(invoke("handleValidateQuery", Map.of("query", "")), "Query is required");
  }

  @Test
  void buildRejectsMissingFilters() throws Exception {
    assertError(invoke("handleBuildQuery", Map.of()), "At least one filter is required");
    assertError(
        invoke("handleBuildQuery", Map.of("filters", List.of())),
        "At least one filter is required");
  }

  @Test
  void buildRejectsUnknownLogicalOperator() throws Exception {
    Map<String, Object> args =
        Map.of(
            "filters",
            List.of(Map.of("field", "WorkflowId", "operator", "=", "value", "a")),
            "logicalOperator",
            "XOR");
    assertError(invoke("handleBuildQuery", args), "logicalOperator must be AND or OR");
  }

  @Test
  void buildRejectsFilterWithoutOperator() throws Exception {
    Map<String, Object> args = Map.of("filters", List.of(Map.of("field", "WorkflowId")));
    assertError(invoke("handleBuildQuery", args), "needs a field and an operator");
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // count_workflows / list_workflows
  // ─────────────────────────────────────────────────────────────────────────────

  @Test
  void countRejectsInvalidQueryBeforeCallingCli() throws Exception {
    assertError(
        invoke("handleCountWorkflows", Map.of("query", "WorkflowType LIKE '%order%'")),
        "Invalid query");
  }

  @Test
  void listRejectsNonPositiveLimit() throws Exception {
    assertError(invoke("handleListWorkflows", Map.of("limit", 0)), "Limit must be positive");
    assertError(invoke("handleListWorkflows", Map.of("limit", -3)), "Limit must be positive");
  }

  @Test
  void listRejectsUnbalancedQuery() throws Exception {
    assertError(
        invoke("handleListWorkflows", Map.of("query", "(WorkflowType = 'a'")), "Invalid query");
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // get_workflow_history
  // ─────────────────────────────────────────────────────────────────────────────

  @Test
  void historyRejectsIncludeWithExclude() throws Exception {
    Map<String, Object> args =
        Map.of(
            "workflowId", "wf",
            "eventTypes", List.of("ActivityTaskFailed"),
            "excludeEventTypes", List.of("TimerFired"));
    assertError(invoke("handleGetHistory", args), "mutually exclusive");
  }

  @Test
  void historyRejectsUnknownPreset() throws Exception {
    assertError(
        invoke("handleGetHistory", Map.of("workflowId", "wf", "preset", "everything")),
        "Unknown preset");
  }

  @Test
  void historyRejectsUnknownFields() throws Exception {
    assertError(
        invoke("handleGetHistory", Map.of("workflowId", "wf", "fields", "most")),
        "Unknown fields projection");
  }

  @Test
  void historyRejectsBadSizes() throws Exception {
    assertError(
        invoke("handleGetHistory", Map.of("workflowId", "wf", "maxPayloadLength", 0)),
        "maxPayloadLength must be positive");
    assertError(
        invoke("handleGetHistory", Map.of("workflowId", "wf", "limit", -1)),
        "Limit must be positive");
  }
}
