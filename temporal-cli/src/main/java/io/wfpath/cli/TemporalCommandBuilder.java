package io.wfpath.cli;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@code temporal} command lines. Every command carries the global flags {@code [--env E]
 * -o json --time-format iso} ahead of the workflow subcommand.
 */
public final class TemporalCommandBuilder {

  public static final String DEFAULT_CLI = "temporal";

  private final String cliPath;
  private final String env;

  public TemporalCommandBuilder() {
    this(DEFAULT_CLI, null);
  }

  /**
   * @param cliPath the binary to run, {@code temporal} if null or blank
   * @param env CLI environment name, omitted if null or blank
   */
  public TemporalCommandBuilder(String cliPath, String env) {
    this.cliPath = cliPath == null || cliPath.isBlank() ? DEFAULT_CLI : cliPath;
    this.env = env == null || env.isBlank() ? null : env;
  }

  public String cliPath() {
    return cliPath;
  }

  /** The environment name, or null. */
  public String env() {
    return env;
  }

  public List<String> count(String query) {
    List<String> args = new ArrayList<>(List.of("workflow", "count"));
    addQuery(args, query);
    return full(args);
  }

  public List<String> list(String query, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive: " + limit);
    }
    List<String> args =
        new ArrayList<>(List.of("workflow", "list", "--limit", Integer.toString(limit)));
    addQuery(args, query);
    return full(args);
  }

  public List<String> describe(String workflowId, String runId) {
    return full(execution("describe", workflowId, runId));
  }

  public List<String> show(String workflowId, String runId) {
    return full(execution("show", workflowId, runId));
  }

  /** Stack trace of a running execution. */
  public List<String> stack(String workflowId, String runId) {
    return full(execution("stack", workflowId, runId));
  }

  /**
   * Sends a read-only query to a running execution.
   *
   * @param queryType query handler name registered by the workflow
   * @param input JSON argument for the handler, omitted if null or blank
   */
  public List<String> query(String workflowId, String runId, String queryType, String input) {
    if (queryType == null || queryType.isBlank()) {
      throw new IllegalArgumentException("queryType is required");
    }
    List<String> args = execution("query", workflowId, runId);
    args.add("--type");
    args.add(queryType);
    if (input != null && !input.isBlank()) {
      args.add("--input");
      args.add(input);
    }
    return full(args);
  }

  private static List<String> execution(String verb, String workflowId, String runId) {
    if (workflowId == null || workflowId.isBlank()) {
      throw new IllegalArgumentException("workflowId is required");
    }
    List<String> args = new ArrayList<>(List.of("workflow", verb, "--workflow-id", workflowId));
    if (runId != null && !runId.isBlank()) {
      args.add("--run-id");
      args.add(runId);
    }
    return args;
  }

  private static void addQuery(List<String> args, String query) {
    if (query != null && !query.isBlank()) {
      args.add("--query");
      args.add(query);
    }
  }

  private List<String> full(List<String> workflowArgs) {
    List<String> cmd = new ArrayList<>();
    cmd.add(cliPath);
    if (env != null) {
      cmd.add("--env");
      cmd.add(env);
    }
    cmd.addAll(List.of("-o", "json", "--time-format", "iso"));
    cmd.addAll(workflowArgs);
    return List.copyOf(cmd);
  }
}
