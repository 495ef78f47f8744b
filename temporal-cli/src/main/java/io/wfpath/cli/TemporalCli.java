package io.wfpath.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.wfpath.cli.TemporalCliException.ErrorType;
import io.wfpath.history.HistorySource;
import io.wfpath.query.CountFunction;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only access to a Temporal cluster through the {@code temporal} CLI. Serves as the count
 * function of the fallback resolver and as the history source of the history tools.
 */
public final class TemporalCli implements CountFunction, HistorySource {

  private static final Logger LOG = LoggerFactory.getLogger(TemporalCli.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final CommandExecutor executor;
  private final TemporalCommandBuilder commands;

  public TemporalCli(CommandExecutor executor, TemporalCommandBuilder commands) {
    this.executor = executor;
    this.commands = commands;
  }

  public TemporalCommandBuilder commands() {
    return commands;
  }

  /**
   * Counts executions matching a visibility query.
   *
   * @param query rendered query, or null or blank for every execution
   */
  @Override
  public long count(String query) throws TemporalCliException {
    List<String> cmd = commands.count(query);
    JsonNode out = run(cmd);
    JsonNode count = out.get("count");
    if (count == null) {
      // An empty object is a zero count.
      if (out.isObject() && out.isEmpty()) {
        return 0;
      }
      throw invalid(cmd, "no count in output: " + out);
    }
    if (count.isIntegralNumber()) {
      return count.asLong();
    }
    if (count.isTextual()) {
      try {
        return Long.parseLong(count.asText().trim());
      } catch (NumberFormatException e) {
        throw invalid(cmd, "count is not a number: " + count.asText());
      }
    }
    throw invalid(cmd, "count is not a number: " + count);
  }

  /**
   * Lists executions matching a visibility query.
   *
   * @return one JSON object per execution, at most {@code limit}
   */
  public ArrayNode list(String query, int limit) throws TemporalCliException {
    List<String> cmd = commands.list(query, limit);
    CommandResult result = checked(cmd);
    String stdout = result.stdout().strip();
    if (stdout.isEmpty()) {
      return MAPPER.createArrayNode();
    }
    if (stdout.startsWith("[")) {
      JsonNode node = parse(cmd, stdout);
      if (!node.isArray()) {
        throw invalid(cmd, "expected a JSON array");
      }
      return (ArrayNode) node;
    }
    // JSON lines
    ArrayNode rows = MAPPER.createArrayNode();
    for (String line : stdout.split("\\R")) {
      if (!line.isBlank()) {
        rows.add(parse(cmd, line));
      }
    }
    return rows;
  }

  public JsonNode describe(String workflowId, String runId) throws TemporalCliException {
    return run(commands.describe(workflowId, runId));
  }

  /**
   * Stack trace of a running execution. Output that is not a JSON document comes back as a text
   * node.
   */
  public JsonNode stack(String workflowId, String runId) throws TemporalCliException {
    List<String> cmd = commands.stack(workflowId, runId);
    String stdout = checked(cmd).stdout().strip();
    if (stdout.startsWith("{") || stdout.startsWith("[")) {
      return parse(cmd, stdout);
    }
    return TextNode.valueOf(stdout);
  }

  /** Result of a workflow query handler. */
  public JsonNode query(String workflowId, String runId, String queryType, String input)
      throws TemporalCliException {
    return run(commands.query(workflowId, runId, queryType, input));
  }

  /** Raw history, {@code {"events": [...]}}. */
  @Override
  public JsonNode fetchEvents(String workflowId, String runId) throws TemporalCliException {
    JsonNode history = run(commands.show(workflowId, runId));
    LOG.debug("Fetched history of {} ({} events)", workflowId, history.path("events").size());
    return history;
  }

  private JsonNode run(List<String> cmd) throws TemporalCliException {
    CommandResult result = checked(cmd);
    String stdout = result.stdout().strip();
    if (stdout.isEmpty()) {
      throw invalid(cmd, "empty output");
    }
    return parse(cmd, stdout);
  }

  private CommandResult checked(List<String> cmd) throws TemporalCliException {
    CommandResult result = executor.execute(cmd);
    if (!result.isSuccess()) {
      String stderr = result.stderr().strip();
      String message = "temporal exited with code " + result.exitCode();
      throw new TemporalCliException(
          ErrorType.COMMAND_FAILED,
          stderr.isEmpty() ? message : message + ": " + stderr,
          cmd,
          result.exitCode(),
          result.stderr(),
          null);
    }
    return result;
  }

  private static JsonNode parse(List<String> cmd, String text) throws TemporalCliException {
    try {
      return MAPPER.readTree(text);
    } catch (JsonProcessingException e) {
      throw new TemporalCliException(
          ErrorType.INVALID_OUTPUT,
          "Failed to parse JSON output from temporal: " + e.getOriginalMessage(),
          cmd,
          e);
    }
  }

  private static TemporalCliException invalid(List<String> cmd, String message) {
    return new TemporalCliException(ErrorType.INVALID_OUTPUT, message, cmd);
  }
}
