package io.wfpath.query;

import static org.junit.jupiter.api.Assertions.*;

import io.wfpath.query.QueryValidator.Issue;
import io.wfpath.query.QueryValidator.IssueType;
import io.wfpath.query.QueryValidator.ValidationResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class QueryValidatorTest {

  private final QueryValidator validator = new QueryValidator();

  @ParameterizedTest
  @ValueSource(strings = {"", "   "})
  void blankIsValid(String query) {
    ValidationResult r = validator.validate(query);
    assertTrue(r.valid());
    assertTrue(r.issues().isEmpty());
  }

  @Test
  void doubleQuotedLiteralsBalanceOnTheirOwnQuote() {
    assertTrue(validator.validate("WorkflowType = \"it's\"").valid());

    List<Issue> issues = validator.validate("WorkflowType = \"open").issues();
    assertEquals(1, issues.size());
    assertEquals(IssueType.UNBALANCED_QUOTES, issues.get(0).type());
  }

  @Test
  void nullIsValid() {
    assertTrue(validator.validate(null).valid());
  }

  @Test
  void wellFormedQueryIsValid() {
    ValidationResult r =
        validator.validate(
            "WorkflowType = 'it''s' AND (ExecutionStatus = 'Failed' OR StartTime >"
                + " '2025-01-01T00:00:00Z')");
    assertTrue(r.valid(), () -> r.issues().toString());
  }

  @Test
  void unclosedLiteral() {
    ValidationResult r = validator.validate("WorkflowType = 'A");
    assertFalse(r.valid());
    assertEquals(1, r.issues().size());
    assertEquals(IssueType.UNBALANCED_QUOTES, r.issues().get(0).type());
  }

  @Test
  void unclosedParenthesis() {
    ValidationResult r = validator.validate("(A = 'x'");
    assertEquals(1, r.issues().size());
    assertEquals(IssueType.UNBALANCED_PARENS, r.issues().get(0).type());
  }

  @Test
  void strayClosingParenthesisReportedOnce() {
    ValidationResult r = validator.validate("WorkflowId = 'a')) AND ((RunId = 'b'");
    assertEquals(1, r.count(IssueType.UNBALANCED_PARENS));
  }

  @Test
  void likeWithPrefixPatternSuggestsStartsWith() {
    ValidationResult r = validator.validate("WorkflowType LIKE 'onboard%'");
    assertEquals(1, r.issues().size());
    Issue issue = r.issues().get(0);
    assertEquals(IssueType.UNSUPPORTED_OPERATOR, issue.type());
    assertEquals("Use WorkflowType STARTS_WITH 'onboard'", issue.suggestion());
  }

  @Test
  void wildcardInEqualityLiteral() {
    ValidationResult r = validator.validate("WorkflowId = 'order-*'");
    assertEquals(1, r.issues().size());
    assertEquals(IssueType.UNSUPPORTED_OPERATOR, r.issues().get(0).type());
    assertEquals("Use WorkflowId STARTS_WITH 'order-'", r.issues().get(0).suggestion());
  }

  @Test
  void bareWildcard() {
    ValidationResult r = validator.validate("WorkflowId = foo%");
    assertEquals(1, r.count(IssueType.UNSUPPORTED_OPERATOR));
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "WorkflowType ILIKE 'a'",
        "WorkflowType CONTAINS 'a'",
        "WorkflowType MATCH 'a'",
        "WorkflowType REGEX 'a'",
        "WorkflowType REGEXP 'a'",
        "WorkflowType SIMILAR TO 'a'",
        "WorkflowType ~ 'a'",
        "WorkflowType ~~ 'a'",
        "WorkflowType NOT LIKE 'a'",
        "WorkflowType !~~ 'a'",
        "WorkflowType like 'a'"
      })
  void unsupportedOperatorsReportedOnce(String query) {
    ValidationResult r = validator.validate(query);
    assertEquals(1, r.issues().size(), () -> r.issues().toString());
    assertEquals(IssueType.UNSUPPORTED_OPERATOR, r.issues().get(0).type());
  }

  @Test
  void negatedPatternSuggestsInequality() {
    Issue issue = validator.validate("WorkflowType NOT LIKE 'a%'").issues().get(0);
    assertEquals("Unsupported operator: NOT LIKE", issue.description());
    assertTrue(issue.suggestion().contains("!="));
  }

  @Test
  void operatorWordsInsideLiteralsAreIgnored() {
    assertTrue(validator.validate("WorkflowType = 'LIKE ~ CONTAINS'").valid());
  }

  @Test
  void lowercaseConnectives() {
    ValidationResult r =
        validator.validate(
            "WorkflowType = 'a' and ExecutionStatus = 'Failed' Or RunId = 'r'");
    assertEquals(2, r.issues().size());
    assertEquals(2, r.count(IssueType.CASE));
  }

  @Test
  void fieldCaseNearMiss() {
    ValidationResult r = validator.validate("workflowType = 'x'");
    assertEquals(1, r.issues().size());
    Issue issue = r.issues().get(0);
    assertEquals(IssueType.FIELD_CASE, issue.type());
    assertTrue(issue.description().contains("did you mean `WorkflowType`"));
  }

  @Test
  void backTickedFieldCase() {
    assertEquals(1, validator.validate("`workflowId` = 'x'").count(IssueType.FIELD_CASE));
  }

  @Test
  void unclosedBackTick() {
    ValidationResult r = validator.validate("`WorkflowId = 'x'");
    assertEquals(1, r.issues().size());
    assertEquals(IssueType.UNBALANCED_QUOTES, r.issues().get(0).type());
  }

  @Test
  void customFieldsParticipateInCaseHints() {
    QueryValidator custom =
        new QueryValidator(TypeRegistry.withCustomFields(Map.of("CustomerId", FieldType.KEYWORD)));
    assertTrue(custom.validate("CustomerId = 'c1'").valid());
    assertEquals(1, custom.validate("customerid = 'c1'").count(IssueType.FIELD_CASE));
  }

  @Test
  void collectsEveryFindingInOnePass() {
    ValidationResult r = validator.validate("(WorkflowType LIKE 'a%' and workflowid = 'x'");
    assertEquals(1, r.count(IssueType.UNBALANCED_PARENS));
    assertEquals(1, r.count(IssueType.UNSUPPORTED_OPERATOR));
    assertEquals(1, r.count(IssueType.CASE));
    assertEquals(1, r.count(IssueType.FIELD_CASE));
    assertEquals(4, r.issues().size());
  }

  @Test
  void validationIsIdempotent() {
    String query = "(WorkflowType LIKE 'a%' and workflowid = 'x' OR RunId = 'open";
    ValidationResult first = validator.validate(query);
    ValidationResult second = validator.validate(query);
    assertEquals(first, second);
  }

  @Test
  void resultMapListsIssues() {
    Map<String, Object> map = validator.validate("WorkflowType = 'A").toMap();
    assertEquals(false, map.get("valid"));
    List<?> issues = (List<?>) map.get("issues");
    assertEquals(1, issues.size());
    assertEquals("UNBALANCED_QUOTES", ((Map<?, ?>) issues.get(0)).get("type"));
  }

  @Test
  void helpListsFieldsAndStatuses() {
    Map<String, Object> help = validator.help();
    assertTrue(((List<?>) help.get("executionStatuses")).contains("ContinuedAsNew"));
    assertTrue(((List<?>) help.get("supportedOperators")).contains("STARTS_WITH"));
    assertFalse(((List<?>) help.get("examples")).isEmpty());
  }
}
