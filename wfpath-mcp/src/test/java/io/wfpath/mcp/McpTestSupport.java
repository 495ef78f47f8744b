package io.wfpath.mcp;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.TextContent;
import java.lang.reflect.Method;
import java.util.Map;

/** Calls private tool handlers and reads their JSON results. */
final class McpTestSupport {

  static final ObjectMapper MAPPER = new ObjectMapper();

  private McpTestSupport() {}

  static CallToolResult invokeHandler(
      WfPathMcpServer server, String methodName, Map<String, Object> args) throws Exception {
    Method method = WfPathMcpServer.class.getDeclaredMethod(methodName, Map.class);
    method.setAccessible(true);
    return (CallToolResult) method.invoke(server, args);
  }

  static JsonNode json(CallToolResult result) throws Exception {
    String text = ((TextContent) result.content().get(0)).text();
    return MAPPER.readTree(text);
  }

  static JsonNode assertSuccess(CallToolResult result) throws Exception {
    JsonNode json = json(result);
    assertFalse(result.isError(), () -> "Expected success but got: " + json);
    return json;
  }

  static JsonNode assertError(CallToolResult result, String expectedMessage) throws Exception {
    assertTrue(result.isError(), "Expected error result");
    JsonNode json = json(result);
    assertFalse(json.path("success").asBoolean(true));
    String error = json.path("error").asText();
    assertTrue(
        error.contains(expectedMessage),
        () -> "Expected error containing '" + expectedMessage + "' but got: " + error);
    return json;
  }
}
