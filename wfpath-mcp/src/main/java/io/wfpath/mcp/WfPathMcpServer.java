package io.wfpath.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletSseServerTransportProvider;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.ServerCapabilities;
import io.modelcontextprotocol.spec.McpSchema.TextContent;
import io.modelcontextprotocol.spec.McpSchema.Tool;
import io.wfpath.cli.ProcessCommandExecutor;
import io.wfpath.cli.TemporalCli;
import io.wfpath.cli.TemporalCliException;
import io.wfpath.cli.TemporalCommandBuilder;
import io.wfpath.history.EventParser;
import io.wfpath.history.HistoryAnalyzer;
import io.wfpath.history.HistoryFilter;
import io.wfpath.history.HistoryPipeline;
import io.wfpath.history.HistoryView;
import io.wfpath.history.Preset;
import io.wfpath.history.Projection;
import io.wfpath.history.WorkflowEvent;
import io.wfpath.query.ExecutionStatus;
import io.wfpath.query.FallbackResolver;
import io.wfpath.query.FieldDescriptor;
import io.wfpath.query.Operator;
import io.wfpath.query.Query;
import io.wfpath.query.QueryBuilder;
import io.wfpath.query.QueryException;
import io.wfpath.query.QueryParser;
import io.wfpath.query.QueryValidator;
import io.wfpath.query.ScopeAdvisor;
import io.wfpath.query.SearchAttributeCatalog;
import io.wfpath.query.TypeRegistry;
import jakarta.servlet.Servlet;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.server.Server;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MCP Server for Temporal workflow inspection.
 *
 * <p>Exposes typed visibility queries and event-history filtering via the Model Context Protocol.
 * Every tool is read-only; cluster access goes through the {@code temporal} CLI.
 *
 * <p>Available tools:
 *
 * <ul>
 *   <li>{@code build_workflow_query} - Build a visibility query from typed filters
 *   <li>{@code validate_workflow_query} - Check a query for common mistakes
 *   <li>{@code count_workflows} - Count executions, falling back to workflow id prefix
 *   <li>{@code list_workflows} - List executions, bounded by a prior count
 *   <li>{@code describe_workflow} - Describe one execution
 *   <li>{@code trace_workflow} - Stack trace of a running execution
 *   <li>{@code query_workflow} - Run a workflow query handler
 *   <li>{@code get_workflow_history} - Filtered, projected and decoded event history
 *   <li>{@code analyze_workflow_history} - Event counts, lifecycle, failures, signals
 *   <li>{@code get_failed_runs} - Count failed runs of a workflow id
 *   <li>{@code list_search_attributes} - Known search attributes and their types
 * </ul>
 */
public final class WfPathMcpServer {

  private static final Logger LOG = LoggerFactory.getLogger(WfPathMcpServer.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final String VERSION = "0.3.0";

  private final WfPathConfig config;
  private final SearchAttributeCatalog catalog;
  private final TemporalCli cli;

  public WfPathMcpServer(WfPathConfig config) {
    this(
        config,
        new TemporalCli(
            new ProcessCommandExecutor(Duration.ofSeconds(config.timeoutSeconds())),
            new TemporalCommandBuilder(config.cliPath(), config.env())));
  }

  public WfPathMcpServer(WfPathConfig config, TemporalCli cli) {
    this.config = config;
    this.cli = cli;
    this.catalog = new SearchAttributeCatalog();
    if (!config.searchAttributes().isEmpty()) {
      catalog.replaceCustomFields(config.searchAttributes());
    }
  }

  public static void main(String[] args) {
    WfPathConfig config;
    try {
      config = WfPathConfig.fromArgs(args);
    } catch (Exception e) {
      LOG.error("Invalid configuration: {}", e.getMessage());
      System.exit(2);
      return;
    }

    var server = new WfPathMcpServer(config);
    if (config.stdio()) {
      server.runStdio();
    } else {
      server.runSse();
    }
  }

  public SearchAttributeCatalog catalog() {
    return catalog;
  }

  /** Run server with stdio transport. */
  public void runStdio() {
    LOG.info("Starting wfpath MCP Server with stdio transport");

    try {
      var transportProvider = new StdioServerTransportProvider(MAPPER);

      // The transport starts reading stdin as soon as the server is built.
      McpSyncServer mcpServer =
          McpServer.sync(transportProvider)
              .serverInfo("wfpath-mcp", VERSION)
              .capabilities(ServerCapabilities.builder().tools(true).logging().build())
              .tools(createToolSpecifications())
              .build();

      LOG.info("wfpath MCP Server ready (stdio mode, env={})", envName());

      Runtime.getRuntime()
          .addShutdownHook(
              new Thread(
                  () -> {
                    LOG.info("Shutting down...");
                    mcpServer.close();
                  }));

      // Exits when stdin closes or on SIGTERM.
      var latch = new java.util.concurrent.CountDownLatch(1);
      latch.await();

    } catch (InterruptedException e) {
      LOG.info("Server interrupted, shutting down");
      Thread.currentThread().interrupt();
    } catch (Exception e) {
      LOG.error("Failed to start server: {}", e.getMessage(), e);
      System.exit(1);
    }
  }

  /** Run server with HTTP/SSE transport. */
  public void runSse() {
    int port = config.port();
    LOG.info("Starting wfpath MCP Server on port {}", port);

    try {
      var transportProvider =
          HttpServletSseServerTransportProvider.builder()
              .objectMapper(MAPPER)
              .messageEndpoint("/mcp/message")
              .build();

      McpSyncServer mcpServer =
          McpServer.sync(transportProvider)
              .serverInfo("wfpath-mcp", VERSION)
              .capabilities(ServerCapabilities.builder().tools(true).logging().build())
              .tools(createToolSpecifications())
              .build();

      Server jettyServer = new Server(port);
      ServletContextHandler context = new ServletContextHandler(ServletContextHandler.SESSIONS);
      context.setContextPath("/");
      jettyServer.setHandler(context);
      context.addServlet(new ServletHolder((Servlet) transportProvider), "/mcp/*");

      Runtime.getRuntime()
          .addShutdownHook(
              new Thread(
                  () -> {
                    LOG.info("Shutting down...");
                    mcpServer.close();
                    try {
                      jettyServer.stop();
                    } catch (Exception e) {
                      LOG.warn("Error stopping Jetty: {}", e.getMessage());
                    }
                  }));

      jettyServer.start();
      LOG.info("wfpath MCP Server started at http://localhost:{}/mcp", port);
      LOG.info("SSE endpoint: http://localhost:{}/mcp/sse", port);
      LOG.info("Message endpoint: http://localhost:{}/mcp/message", port);
      jettyServer.join();

    } catch (Exception e) {
      LOG.error("Failed to start server: {}", e.getMessage(), e);
      System.exit(1);
    }
  }

  private String envName() {
    return config.env() != null ? config.env() : "default";
  }

  List<McpServerFeatures.SyncToolSpecification> createToolSpecifications() {
    return List.of(
        createBuildQueryTool(),
        createValidateQueryTool(),
        createCountWorkflowsTool(),
        createListWorkflowsTool(),
        createDescribeWorkflowTool(),
        createTraceWorkflowTool(),
        createQueryWorkflowTool(),
        createGetHistoryTool(),
        createAnalyzeHistoryTool(),
        createGetFailedRunsTool(),
        createListSearchAttributesTool());
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // build_workflow_query
  // ─────────────────────────────────────────────────────────────────────────────

  private McpServerFeatures.SyncToolSpecification createBuildQueryTool() {
    String schema =
        """
        {
          "type": "object",
          "properties": {
            "filters": {
              "type": "array",
              "description": "Conditions to combine",
              "items": {
                "type": "object",
                "properties": {
                  "field": {"type": "string", "description": "Search attribute, e.g. WorkflowType"},
                  "operator": {"type": "string", "description": "=, !=, >, >=, <, <=, STARTS_WITH, IN, BETWEEN, IS NULL, IS NOT NULL"},
                  "value": {"description": "Literal; a list for IN, two bounds for BETWEEN, omitted for null checks"}
                },
                "required": ["field", "operator"]
              }
            },
            "logicalOperator": {
              "type": "string",
              "enum": ["AND", "OR"],
              "description": "How the filters are combined (default: AND)"
            }
          },
          "required": ["filters"]
        }
        """;

    return new McpServerFeatures.SyncToolSpecification(
        new Tool(
            "build_workflow_query",
            "Builds a Temporal visibility query from typed filters. "
                + "Each filter is checked against the search attribute's type, so the result is "
                + "always well-formed. Returns the query string and its validation.",
            schema),
        (exchange, args) -> handleBuildQuery(args));
  }

  private CallToolResult handleBuildQuery(Map<String, Object> args) {
    if (!(args.get("filters") instanceof List<?> filters) || filters.isEmpty()) {
      return errorResult("At least one filter is required");
    }
    String logical = stringArg(args, "logicalOperator");
    boolean or = logical != null && logical.trim().equalsIgnoreCase("OR");
    if (logical != null && !or && !logical.trim().equalsIgnoreCase("AND")) {
      return errorResult("logicalOperator must be AND or OR: " + logical);
    }

    TypeRegistry registry = catalog.current();
    try {
      QueryBuilder combined = new QueryBuilder(registry);
      for (Object f : filters) {
        if (!(f instanceof Map<?, ?> filter)) {
          return errorResult("Each filter must be an object with field and operator");
        }
        Object field = filter.get("field");
        Object operator = filter.get("operator");
        if (!(field instanceof String) || !(operator instanceof String)) {
          return errorResult("Each filter needs a field and an operator");
        }
        QueryBuilder one =
            new QueryBuilder(registry)
                .where((String) field, Operator.fromText((String) operator), filter.get("value"));
        combined = or ? combined.or(one) : combined.and(one);
      }

      Query query = combined.build();
      String rendered = query.render();
      LOG.debug("Built query: {}", rendered);

      Map<String, Object> result = new LinkedHashMap<>();
      result.put("query", rendered);
      result.put("filterCount", filters.size());
      result.put("validation", new QueryValidator(registry).validate(rendered).toMap());
      return successResult(result);

    } catch (IllegalArgumentException e) {
      LOG.warn("Query error: {}", e.getMessage());
      return errorResult("Query error: " + e.getMessage());
    } catch (Exception e) {
      LOG.error("Failed to build query: {}", e.getMessage(), e);
      return errorResult("Failed to build query: " + e.getMessage());
    }
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // validate_workflow_query
  // ─────────────────────────────────────────────────────────────────────────────

  private McpServerFeatures.SyncToolSpecification createValidateQueryTool() {
    String schema =
        """
        {
          "type": "object",
          "properties": {
            "query": {
              "type": "string",
              "description": "Visibility query to check"
            }
          },
          "required": ["query"]
        }
        """;

    return new McpServerFeatures.SyncToolSpecification(
        new Tool(
            "validate_workflow_query",
            "Checks a visibility query for unbalanced quotes or parentheses, unsupported "
                + "operators (LIKE, CONTAINS, wildcards), lowercase and/or and miscased field "
                + "names. Returns findings with suggestions plus the supported syntax.",
            schema),
        (exchange, args) -> handleValidateQuery(args));
  }

  private CallToolResult handleValidateQuery(Map<String, Object> args) {
    String query = stringArg(args, "query");
    if (query == null || query.isBlank()) {
      return errorResult("Query is required");
    }

    try {
      TypeRegistry registry = catalog.current();
      QueryValidator validator = new QueryValidator(registry);

      Map<String, Object> result = new LinkedHashMap<>();
      result.put("query", query);
      result.putAll(validator.validate(query).toMap());
      try {
        result.put("normalized", QueryParser.parse(query, registry).render());
      } catch (QueryException e) {
        result.put("parseError", e.getMessage());
      }
      result.put("help", validator.help());
      return successResult(result);

    } catch (Exception e) {
      LOG.error("Failed to validate query: {}", e.getMessage(), e);
      return errorResult("Validation failed: " + e.getMessage());
    }
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // count_workflows
  // ─────────────────────────────────────────────────────────────────────────────

  private McpServerFeatures.SyncToolSpecification createCountWorkflowsTool() {
    String schema =
        """
        {
          "type": "object",
          "properties": {
            "query": {
              "type": "string",
              "description": "Visibility query (counts every execution if omitted)"
            },
            "fallback": {
              "type": "boolean",
              "description": "Retry WorkflowType = 'X' as WorkflowId STARTS_WITH 'X' when nothing matches (default: true)"
            }
          }
        }
        """;

    return new McpServerFeatures.SyncToolSpecification(
        new Tool(
            "count_workflows",
            "Counts workflow executions matching a visibility query. Cheap; use it before "
                + "list_workflows. A query of the form WorkflowType = 'X' that matches nothing is "
                + "retried as WorkflowId STARTS_WITH 'X'.",
            schema),
        (exchange, args) -> handleCountWorkflows(args));
  }

  private CallToolResult handleCountWorkflows(Map<String, Object> args) {
    String query = stringArg(args, "query");
    boolean fallback = args.get("fallback") instanceof Boolean b ? b : true;

    try {
      TypeRegistry registry = catalog.current();
      CallToolResult invalid = rejectInvalid(query, registry);
      if (invalid != null) {
        return invalid;
      }

      Map<String, Object> result = new LinkedHashMap<>();
      if (fallback && query != null && !query.isBlank()) {
        result.putAll(new FallbackResolver(cli, registry).resolve(query).toMap());
      } else {
        result.put("query", query);
        result.put("count", cli.count(query));
      }
      return successResult(result);

    } catch (IllegalArgumentException e) {
      LOG.warn("Query error: {}", e.getMessage());
      return errorResult("Query error: " + e.getMessage());
    } catch (TemporalCliException e) {
      return cliErrorResult("Count failed", e);
    } catch (Exception e) {
      LOG.error("Failed to count workflows: {}", e.getMessage(), e);
      return errorResult("Count failed: " + e.getMessage());
    }
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // list_workflows
  // ─────────────────────────────────────────────────────────────────────────────

  private McpServerFeatures.SyncToolSpecification createListWorkflowsTool() {
    String schema =
        """
        {
          "type": "object",
          "properties": {
            "query": {
              "type": "string",
              "description": "Visibility query (lists every execution if omitted)"
            },
            "limit": {
              "type": "integer",
              "description": "Maximum executions to return (default: 10)"
            }
          }
        }
        """;

    return new McpServerFeatures.SyncToolSpecification(
        new Tool(
            "list_workflows",
            "Lists workflow executions matching a visibility query. Counts first and sizes "
                + "the request from the count, so an empty result costs one cheap call and a "
                + "large one returns a capped sample with the total.",
            schema),
        (exchange, args) -> handleListWorkflows(args));
  }

  private CallToolResult handleListWorkflows(Map<String, Object> args) {
    String query = stringArg(args, "query");
    Integer limit = args.get("limit") instanceof Number n ? n.intValue() : null;

    if (limit != null && limit <= 0) {
      return errorResult("Limit must be positive");
    }
    int requested = limit != null ? limit : config.defaultListLimit();
    int maxLimit = Math.min(requested, config.maxListLimit());

    try {
      TypeRegistry registry = catalog.current();
      CallToolResult invalid = rejectInvalid(query, registry);
      if (invalid != null) {
        return invalid;
      }

      Map<String, Object> result = new LinkedHashMap<>();
      String effective = query;
      long total;
      if (query != null && !query.isBlank()) {
        FallbackResolver.Resolution resolution =
            new FallbackResolver(cli, registry).resolve(query);
        effective = resolution.query();
        total = resolution.count();
        result.put("query", effective);
        result.put("resolution", resolution.state().name());
      } else {
        total = cli.count(query);
        result.put("query", query);
      }

      ScopeAdvisor.Scope scope = ScopeAdvisor.decide(total, maxLimit);
      ArrayNode workflows =
          scope.strategy() == ScopeAdvisor.Strategy.EMPTY
              ? MAPPER.createArrayNode()
              : cli.list(effective, scope.limit());

      result.put("totalCount", total);
      result.put("strategy", scope.strategy().name());
      result.put("returned", workflows.size());
      result.put("workflows", workflows);
      if (scope.strategy() == ScopeAdvisor.Strategy.SAMPLED) {
        result.put(
            "message",
            "Showing "
                + workflows.size()
                + " of "
                + total
                + " executions. Narrow the query or raise 'limit' (max "
                + config.maxListLimit()
                + ").");
      }
      return successResult(result);

    } catch (IllegalArgumentException e) {
      LOG.warn("Query error: {}", e.getMessage());
      return errorResult("Query error: " + e.getMessage());
    } catch (TemporalCliException e) {
      return cliErrorResult("List failed", e);
    } catch (Exception e) {
      LOG.error("Failed to list workflows: {}", e.getMessage(), e);
      return errorResult("List failed: " + e.getMessage());
    }
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // describe_workflow
  // ─────────────────────────────────────────────────────────────────────────────

  private McpServerFeatures.SyncToolSpecification createDescribeWorkflowTool() {
    return new McpServerFeatures.SyncToolSpecification(
        new Tool(
            "describe_workflow",
            "Describes one workflow execution: status, type, times, pending activities and "
                + "children. Uses the latest run unless runId is given.",
            executionSchema()),
        (exchange, args) -> handleDescribeWorkflow(args));
  }

  private CallToolResult handleDescribeWorkflow(Map<String, Object> args) {
    String workflowId = stringArg(args, "workflowId");
    String runId = stringArg(args, "runId");

    if (workflowId == null || workflowId.isBlank()) {
      return errorResult("workflowId is required");
    }

    try {
      JsonNode description = cli.describe(workflowId, runId);
      Map<String, Object> result = new LinkedHashMap<>();
      result.put("workflowId", workflowId);
      result.put("description", description);
      return successResult(result);

    } catch (TemporalCliException e) {
      return cliErrorResult("Describe failed", e);
    } catch (Exception e) {
      LOG.error("Failed to describe workflow: {}", e.getMessage(), e);
      return errorResult("Describe failed: " + e.getMessage());
    }
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // trace_workflow
  // ─────────────────────────────────────────────────────────────────────────────

  private McpServerFeatures.SyncToolSpecification createTraceWorkflowTool() {
    return new McpServerFeatures.SyncToolSpecification(
        new Tool(
            "trace_workflow",
            "Returns the current stack trace of a running workflow, showing where it is blocked "
                + "or what it is waiting for. Useful for stuck or long-running executions.",
            executionSchema()),
        (exchange, args) -> handleTraceWorkflow(args));
  }

  private CallToolResult handleTraceWorkflow(Map<String, Object> args) {
    String workflowId = stringArg(args, "workflowId");
    String runId = stringArg(args, "runId");

    if (workflowId == null || workflowId.isBlank()) {
      return errorResult("workflowId is required");
    }

    try {
      JsonNode trace = cli.stack(workflowId, runId);
      Map<String, Object> result = new LinkedHashMap<>();
      result.put("workflowId", workflowId);
      if (runId != null && !runId.isBlank()) {
        result.put("runId", runId);
      }
      result.put("stackTrace", trace.isTextual() ? trace.asText() : trace);
      return successResult(result);

    } catch (TemporalCliException e) {
      return cliErrorResult("Trace failed", e);
    } catch (Exception e) {
      LOG.error("Failed to trace workflow: {}", e.getMessage(), e);
      return errorResult("Trace failed: " + e.getMessage());
    }
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // query_workflow
  // ─────────────────────────────────────────────────────────────────────────────

  private McpServerFeatures.SyncToolSpecification createQueryWorkflowTool() {
    String schema =
        """
        {
          "type": "object",
          "properties": {
            "workflowId": {"type": "string", "description": "Workflow id"},
            "runId": {"type": "string", "description": "Run id (latest run if omitted)"},
            "queryType": {"type": "string", "description": "Query handler name registered by the workflow"},
            "input": {"description": "Argument for the handler; sent to the CLI as JSON"}
          },
          "required": ["workflowId", "queryType"]
        }
        """;

    return new McpServerFeatures.SyncToolSpecification(
        new Tool(
            "query_workflow",
            "Runs a query handler on a workflow execution and returns its result. Queries read "
                + "workflow state and never change it.",
            schema),
        (exchange, args) -> handleQueryWorkflow(args));
  }

  private CallToolResult handleQueryWorkflow(Map<String, Object> args) {
    String workflowId = stringArg(args, "workflowId");
    String runId = stringArg(args, "runId");
    String queryType = stringArg(args, "queryType");

    if (workflowId == null || workflowId.isBlank()) {
      return errorResult("workflowId is required");
    }
    if (queryType == null || queryType.isBlank()) {
      return errorResult("queryType is required");
    }

    try {
      Object input = args.get("input");
      String inputJson = input == null ? null : MAPPER.writeValueAsString(input);
      JsonNode answer = cli.query(workflowId, runId, queryType, inputJson);
      Map<String, Object> result = new LinkedHashMap<>();
      result.put("workflowId", workflowId);
      result.put("queryType", queryType);
      result.put("result", answer);
      return successResult(result);

    } catch (TemporalCliException e) {
      return cliErrorResult("Query failed", e);
    } catch (Exception e) {
      LOG.error("Failed to query workflow: {}", e.getMessage(), e);
      return errorResult("Query failed: " + e.getMessage());
    }
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // get_workflow_history
  // ─────────────────────────────────────────────────────────────────────────────

  private McpServerFeatures.SyncToolSpecification createGetHistoryTool() {
    String schema =
        """
        {
          "type": "object",
          "properties": {
            "workflowId": {"type": "string", "description": "Workflow id"},
            "runId": {"type": "string", "description": "Run id (latest run if omitted)"},
            "eventTypes": {
              "type": "array",
              "items": {"type": "string"},
              "description": "Keep only these event types, e.g. ActivityTaskFailed"
            },
            "excludeEventTypes": {
              "type": "array",
              "items": {"type": "string"},
              "description": "Drop these event types (not with eventTypes)"
            },
            "preset": {
              "type": "string",
              "enum": ["summary", "critical_path", "last_failure_context", "resets"],
              "description": "Named selection; replaces eventTypes/excludeEventTypes"
            },
            "limit": {"type": "integer", "description": "Maximum events to return"},
            "reverse": {"type": "boolean", "description": "Newest first (default: false)"},
            "fields": {
              "type": "string",
              "enum": ["minimal", "standard", "full"],
              "description": "How much of each event to return (default: standard)"
            },
            "decodePayloads": {"type": "boolean", "description": "Decode base64 payloads (default: true)"},
            "maxPayloadLength": {"type": "integer", "description": "Truncate decoded payloads to this many characters (default: 4000)"}
          },
          "required": ["workflowId"]
        }
        """;

    return new McpServerFeatures.SyncToolSpecification(
        new Tool(
            "get_workflow_history",
            "Returns the event history of a workflow execution, filtered and shaped to keep "
                + "responses small. Start with preset=summary or preset=last_failure_context; "
                + "use fields=full only for the few events you need in detail.",
            schema),
        (exchange, args) -> handleGetHistory(args));
  }

  private CallToolResult handleGetHistory(Map<String, Object> args) {
    String workflowId = stringArg(args, "workflowId");
    String runId = stringArg(args, "runId");

    if (workflowId == null || workflowId.isBlank()) {
      return errorResult("workflowId is required");
    }

    HistoryFilter filter;
    try {
      filter = historyFilter(args);
    } catch (IllegalArgumentException e) {
      LOG.warn("Invalid history arguments: {}", e.getMessage());
      return errorResult("Invalid arguments: " + e.getMessage());
    }

    try {
      List<WorkflowEvent> events = EventParser.parseHistory(cli.fetchEvents(workflowId, runId));
      HistoryView view = HistoryPipeline.run(events, filter);

      Map<String, Object> result = new LinkedHashMap<>();
      result.put("workflowId", workflowId);
      if (runId != null) {
        result.put("runId", runId);
      }
      result.putAll(view.toMap());
      return successResult(result);

    } catch (TemporalCliException e) {
      return cliErrorResult("History fetch failed", e);
    } catch (Exception e) {
      LOG.error("Failed to get workflow history: {}", e.getMessage(), e);
      return errorResult("History failed: " + e.getMessage());
    }
  }

  private HistoryFilter historyFilter(Map<String, Object> args) {
    HistoryFilter.Builder builder =
        HistoryFilter.builder()
            .maxPayloadLength(config.maxPayloadLength())
            .failureContextSize(config.failureContextSize());

    List<String> include = stringListArg(args, "eventTypes");
    List<String> exclude = stringListArg(args, "excludeEventTypes");
    builder.includeTypes(include).excludeTypes(exclude);

    String preset = stringArg(args, "preset");
    if (preset != null && !preset.isBlank()) {
      builder.preset(Preset.fromText(preset));
    }
    String fields = stringArg(args, "fields");
    if (fields != null && !fields.isBlank()) {
      builder.projection(Projection.fromText(fields));
    }
    if (args.get("limit") instanceof Number n) {
      if (n.intValue() <= 0) {
        throw new IllegalArgumentException("Limit must be positive");
      }
      builder.limit(n.intValue());
    }
    if (args.get("reverse") instanceof Boolean b) {
      builder.reverse(b);
    }
    if (args.get("decodePayloads") instanceof Boolean b) {
      builder.decodePayloads(b);
    }
    if (args.get("maxPayloadLength") instanceof Number n) {
      builder.maxPayloadLength(n.intValue());
    }
    return builder.build();
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // analyze_workflow_history
  // ─────────────────────────────────────────────────────────────────────────────

  private McpServerFeatures.SyncToolSpecification createAnalyzeHistoryTool() {
    return new McpServerFeatures.SyncToolSpecification(
        new Tool(
            "analyze_workflow_history",
            "Summarizes a workflow execution's whole history: event counts by type, lifecycle "
                + "timeline, child workflows, failures with messages, signals and activity "
                + "types. Use it before get_workflow_history to decide what to look at.",
            executionSchema()),
        (exchange, args) -> handleAnalyzeHistory(args));
  }

  private CallToolResult handleAnalyzeHistory(Map<String, Object> args) {
    String workflowId = stringArg(args, "workflowId");
    String runId = stringArg(args, "runId");

    if (workflowId == null || workflowId.isBlank()) {
      return errorResult("workflowId is required");
    }

    try {
      List<WorkflowEvent> events = EventParser.parseHistory(cli.fetchEvents(workflowId, runId));
      HistoryAnalyzer.Analysis analysis = HistoryAnalyzer.analyze(events);

      Map<String, Object> result = new LinkedHashMap<>();
      result.put("workflowId", workflowId);
      result.putAll(analysis.toMap());
      return successResult(result);

    } catch (TemporalCliException e) {
      return cliErrorResult("History fetch failed", e);
    } catch (Exception e) {
      LOG.error("Failed to analyze workflow history: {}", e.getMessage(), e);
      return errorResult("Analysis failed: " + e.getMessage());
    }
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // get_failed_runs
  // ─────────────────────────────────────────────────────────────────────────────

  private McpServerFeatures.SyncToolSpecification createGetFailedRunsTool() {
    String schema =
        """
        {
          "type": "object",
          "properties": {
            "workflowId": {"type": "string", "description": "Workflow id"}
          },
          "required": ["workflowId"]
        }
        """;

    return new McpServerFeatures.SyncToolSpecification(
        new Tool(
            "get_failed_runs",
            "Counts the failed runs of a workflow id, including runs before the current one. "
                + "A quick check for retry loops; works while the workflow is still running.",
            schema),
        (exchange, args) -> handleGetFailedRuns(args));
  }

  private CallToolResult handleGetFailedRuns(Map<String, Object> args) {
    String workflowId = stringArg(args, "workflowId");

    if (workflowId == null || workflowId.isBlank()) {
      return errorResult("workflowId is required");
    }

    try {
      String query =
          new QueryBuilder(catalog.current())
              .workflowId(workflowId)
              .executionStatus(ExecutionStatus.Failed)
              .build()
              .render();
      long failed = cli.count(query);

      Map<String, Object> result = new LinkedHashMap<>();
      result.put("workflowId", workflowId);
      result.put("failedCount", failed);
      result.put("query", query);
      return successResult(result);

    } catch (TemporalCliException e) {
      return cliErrorResult("Count failed", e);
    } catch (Exception e) {
      LOG.error("Failed to count failed runs: {}", e.getMessage(), e);
      return errorResult("Count failed: " + e.getMessage());
    }
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // list_search_attributes
  // ─────────────────────────────────────────────────────────────────────────────

  private McpServerFeatures.SyncToolSpecification createListSearchAttributesTool() {
    String schema =
        """
        {
          "type": "object",
          "properties": {}
        }
        """;

    return new McpServerFeatures.SyncToolSpecification(
        new Tool(
            "list_search_attributes",
            "Lists the search attributes queries may use, builtin and custom, with their types "
                + "and the operators each type supports.",
            schema),
        (exchange, args) -> handleListSearchAttributes(args));
  }

  private CallToolResult handleListSearchAttributes(Map<String, Object> args) {
    TypeRegistry registry = catalog.current();
    List<Map<String, Object>> attributes = new ArrayList<>();
    for (FieldDescriptor d : registry.fields()) {
      Map<String, Object> a = new LinkedHashMap<>();
      a.put("name", d.name());
      a.put("type", d.type().name());
      a.put("custom", d.custom());
      a.put("operators", d.type().allowedOperators().stream().map(Operator::keyword).toList());
      if (d.isRestricted()) {
        a.put("allowedValues", d.allowedValues());
      }
      attributes.add(a);
    }

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("attributes", attributes);
    result.put("customCount", registry.customFields().size());
    return successResult(result);
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // Helper methods
  // ─────────────────────────────────────────────────────────────────────────────

  private static String executionSchema() {
    return """
        {
          "type": "object",
          "properties": {
            "workflowId": {"type": "string", "description": "Workflow id"},
            "runId": {"type": "string", "description": "Run id (latest run if omitted)"}
          },
          "required": ["workflowId"]
        }
        """;
  }

  /** Validation error result for a query with findings, or null if the query may be sent. */
  private CallToolResult rejectInvalid(String query, TypeRegistry registry) {
    if (query == null || query.isBlank()) {
      return null;
    }
    QueryValidator.ValidationResult validation = new QueryValidator(registry).validate(query);
    if (validation.valid()) {
      return null;
    }
    LOG.warn("Rejected query '{}': {} issue(s)", query, validation.issues().size());
    Map<String, Object> error = new LinkedHashMap<>();
    error.put("error", "Invalid query: " + validation.issues().get(0).description());
    error.put("success", false);
    error.put("issues", validation.toMap().get("issues"));
    return jsonResult(error, true);
  }

  private static String stringArg(Map<String, Object> args, String key) {
    return args.get(key) instanceof String s ? s : null;
  }

  /** Accepts a JSON array of strings or a comma-separated string. */
  private static List<String> stringListArg(Map<String, Object> args, String key) {
    Object value = args.get(key);
    List<String> out = new ArrayList<>();
    if (value instanceof List<?> list) {
      for (Object o : list) {
        if (o != null && !o.toString().isBlank()) {
          out.add(o.toString().trim());
        }
      }
    } else if (value instanceof String s) {
      for (String part : s.split(",")) {
        if (!part.isBlank()) {
          out.add(part.trim());
        }
      }
    }
    return out;
  }

  private CallToolResult cliErrorResult(String prefix, TemporalCliException e) {
    if (e.isRetryable()) {
      LOG.warn("{}: {}", prefix, e.getMessage());
    } else {
      LOG.error("{}: {}", prefix, e.getMessage());
    }
    Map<String, Object> error = new LinkedHashMap<>();
    error.put("error", prefix + ": " + e.getMessage());
    error.put("success", false);
    error.put("errorType", e.getType().name());
    error.put("retryable", e.isRetryable());
    return jsonResult(error, true);
  }

  private CallToolResult successResult(Map<String, Object> data) {
    try {
      String json = MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(data);
      return new CallToolResult(List.of(new TextContent(json)), false);
    } catch (Exception e) {
      return new CallToolResult(List.of(new TextContent(data.toString())), false);
    }
  }

  private CallToolResult errorResult(String message) {
    return jsonResult(Map.of("error", message, "success", false), true);
  }

  private CallToolResult jsonResult(Map<String, Object> data, boolean isError) {
    try {
      String json = MAPPER.writeValueAsString(data);
      return new CallToolResult(List.of(new TextContent(json)), isError);
    } catch (Exception e) {
      String text = String.valueOf(data.get("error"));
      return new CallToolResult(List.of(new TextContent(text)), isError);
    }
  }
}
