package io.wfpath.query;

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TypeRegistryTest {

  @Test
  void describesBuiltins() {
    TypeRegistry r = TypeRegistry.builtins();
    assertEquals(FieldType.KEYWORD, r.describe("WorkflowId").type());
    assertEquals(FieldType.DATETIME, r.describe("StartTime").type());
    assertEquals(FieldType.KEYWORD_LIST, r.describe("BuildIds").type());
    assertEquals(FieldType.KEYWORD_LIST, r.describe("TemporalReportedProblems").type());
    assertEquals(FieldType.INT, r.describe("HistoryLength").type());
    assertFalse(r.describe("TaskQueue").custom());
  }

  @Test
  void lookupIsCaseSensitiveWithHint() {
    UnknownFieldException e =
        assertThrows(
            UnknownFieldException.class, () -> TypeRegistry.builtins().describe("workflowtype"));
    assertEquals("workflowtype", e.getFieldName());
    assertEquals("WorkflowType", e.getSuggestion());
    assertTrue(e.getMessage().contains("did you mean `WorkflowType`"));
  }

  @Test
  void unknownFieldWithoutNearMissHasNoHint() {
    UnknownFieldException e =
        assertThrows(UnknownFieldException.class, () -> TypeRegistry.builtins().describe("Nope"));
    assertNull(e.getSuggestion());
    assertFalse(e.getMessage().contains("did you mean"));
  }

  @Test
  void customFieldsFollowBuiltins() {
    Map<String, FieldType> custom = new LinkedHashMap<>();
    custom.put("CustomerId", FieldType.KEYWORD);
    custom.put("Amount", FieldType.DOUBLE);
    TypeRegistry r = TypeRegistry.withCustomFields(custom);

    assertTrue(r.describe("CustomerId").custom());
    assertEquals(FieldType.DOUBLE, r.describe("Amount").type());
    assertEquals("Amount", r.fields().get(r.fields().size() - 1).name());
    assertEquals(2, r.customFields().size());
    assertTrue(TypeRegistry.builtins().find("CustomerId").isEmpty());
  }

  @Test
  void customFieldsCannotShadowBuiltins() {
    assertThrows(
        IllegalArgumentException.class,
        () -> TypeRegistry.withCustomFields(Map.of("WorkflowId", FieldType.TEXT)));
  }

  @Test
  void rejectsUnwritableNames() {
    assertThrows(
        InvalidFieldNameException.class,
        () -> TypeRegistry.withCustomFields(Map.of("bad`name", FieldType.KEYWORD)));
    assertThrows(
        InvalidFieldNameException.class, () -> new FieldDescriptor(" ", FieldType.KEYWORD, true));
  }

  @Test
  void fieldTypeNamesFromConfiguration() {
    assertEquals(FieldType.KEYWORD_LIST, FieldType.fromText("KeywordList"));
    assertEquals(FieldType.DATETIME, FieldType.fromText("Datetime"));
    assertEquals(FieldType.INT, FieldType.fromText("int"));
    assertThrows(IllegalArgumentException.class, () -> FieldType.fromText("Float"));
  }

  @Test
  void operatorFromText() {
    assertEquals(Operator.GTE, Operator.fromText(">="));
    assertEquals(Operator.STARTS_WITH, Operator.fromText("starts_with"));
    assertEquals(Operator.IS_NOT_NULL, Operator.fromText("is  not null"));
    assertEquals(Operator.NEQ, Operator.fromText("<>"));
    assertThrows(IllegalArgumentException.class, () -> Operator.fromText("LIKE"));
  }
}
