package io.wfpath.query;

import static org.junit.jupiter.api.Assertions.*;

import io.wfpath.query.Expression.Comparison;
import io.wfpath.query.Expression.Connective;
import io.wfpath.query.Expression.Logical;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class QueryRendererTest {

  private final TypeRegistry registry =
      TypeRegistry.withCustomFields(
          Map.of(
              "Score", FieldType.DOUBLE,
              "IsVip", FieldType.BOOL,
              "My-Attr", FieldType.KEYWORD,
              "Notes", FieldType.TEXT));

  private Comparison eq(String field, Object value) {
    return Comparisons.make(registry, field, Operator.EQ, value);
  }

  @Test
  void rendersKeywordEquality() {
    assertEquals("WorkflowType = 'Foo'", new QueryBuilder().workflowType("Foo").build().render());
  }

  @Test
  void doublesEmbeddedQuotes() {
    assertEquals("WorkflowId = 'it''s'", new QueryBuilder().workflowId("it's").build().render());
  }

  @Test
  void rendersInList() {
    Query q = new QueryBuilder().workflowIdIn(List.of("a", "b")).build();
    assertEquals("WorkflowId IN ('a', 'b')", q.render());
  }

  @Test
  void rendersBetween() {
    Query q =
        new QueryBuilder()
            .timeRange("StartTime", "2025-01-01T00:00:00Z", "2025-02-01T00:00:00Z")
            .build();
    assertEquals(
        "StartTime BETWEEN '2025-01-01T00:00:00Z' AND '2025-02-01T00:00:00Z'", q.render());
  }

  @Test
  void rendersNullChecks() {
    Query q = new QueryBuilder().isNull("ParentWorkflowId").isNotNull("CloseTime").build();
    assertEquals("ParentWorkflowId IS NULL AND CloseTime IS NOT NULL", q.render());
  }

  @Test
  void rendersUnquotedTypes() {
    assertEquals(
        "HistoryLength > 100",
        QueryRenderer.render(Comparisons.make(registry, "HistoryLength", Operator.GT, 100)));
    assertEquals("IsVip = true", QueryRenderer.render(eq("IsVip", true)));
    assertEquals("Score = 0.5", QueryRenderer.render(eq("Score", 0.5)));
  }

  @Test
  void rendersDoublesInPlainNotation() {
    assertEquals("Score = 1000000000000000000000", QueryRenderer.render(eq("Score", 1e21)));
    assertEquals("Score = 0.0000001", QueryRenderer.render(eq("Score", 1e-7)));
    assertEquals("Score = 0", QueryRenderer.render(eq("Score", -0.0)));
    assertEquals("Score = 2", QueryRenderer.render(eq("Score", 2.0)));
  }

  @Test
  void backTicksNamesOutsideTheBareAlphabet() {
    assertEquals("`My-Attr` = 'x'", QueryRenderer.render(eq("My-Attr", "x")));
  }

  @Test
  void parenthesizesMixedConnectives() {
    Expression e =
        new Logical(
            Connective.AND,
            List.of(
                eq("WorkflowType", "A"),
                new Logical(
                    Connective.OR,
                    List.of(eq("ExecutionStatus", "Failed"), eq("ExecutionStatus", "TimedOut")),
                    false)),
            false);
    assertEquals(
        "WorkflowType = 'A' AND (ExecutionStatus = 'Failed' OR ExecutionStatus = 'TimedOut')",
        QueryRenderer.render(e));
  }

  @Test
  void parenthesizesAnyLogicalUnderOr() {
    Expression e =
        new Logical(
            Connective.OR,
            List.of(
                new Logical(
                    Connective.AND, List.of(eq("WorkflowId", "a"), eq("RunId", "r")), false),
                eq("WorkflowId", "b")),
            false);
    assertEquals("(WorkflowId = 'a' AND RunId = 'r') OR WorkflowId = 'b'", QueryRenderer.render(e));
  }

  @Test
  void flattensSameConnectiveUnderAnd() {
    Expression e =
        new Logical(
            Connective.AND,
            List.of(
                new Logical(
                    Connective.AND, List.of(eq("WorkflowId", "a"), eq("RunId", "r")), false),
                eq("TaskQueue", "q")),
            false);
    assertEquals("WorkflowId = 'a' AND RunId = 'r' AND TaskQueue = 'q'", QueryRenderer.render(e));
  }

  @Test
  void keepsExplicitGroups() {
    Logical or =
        new Logical(Connective.OR, List.of(eq("WorkflowId", "a"), eq("WorkflowId", "b")), true);
    assertEquals("(WorkflowId = 'a' OR WorkflowId = 'b')", QueryRenderer.render(or));

    Logical and =
        new Logical(Connective.AND, List.of(eq("WorkflowId", "a"), eq("RunId", "r")), true);
    Expression outer = new Logical(Connective.AND, List.of(and, eq("TaskQueue", "q")), false);
    assertEquals(
        "(WorkflowId = 'a' AND RunId = 'r') AND TaskQueue = 'q'", QueryRenderer.render(outer));
  }

  @Test
  void renderIsDeterministic() {
    Query q = new QueryBuilder().workflowType("A").executionStatus(ExecutionStatus.Failed).build();
    assertEquals(q.render(), q.render());
    Query same =
        new QueryBuilder().workflowType("A").executionStatus(ExecutionStatus.Failed).build();
    assertEquals(q, same);
  }
}
