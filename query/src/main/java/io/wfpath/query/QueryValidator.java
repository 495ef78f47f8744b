package io.wfpath.query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Rule-based pre-flight checker for visibility filter strings. Catches the mistakes that would
 * otherwise cost a round trip to the server: wildcard and regex operators the store does not
 * support, unclosed quotes and parentheses, lowercase connectives and field names with the wrong
 * case.
 *
 * <p>The validator never fails and never contacts a server. Every finding is collected in one pass.
 */
public class QueryValidator {

  private static final Set<String> UNSUPPORTED_WORDS =
      Set.of("LIKE", "ILIKE", "CONTAINS", "MATCH", "REGEX", "REGEXP");

  private static final Set<String> KEYWORDS =
      Set.of(
          "AND", "OR", "NOT", "IN", "BETWEEN", "IS", "NULL", "STARTS_WITH", "TRUE", "FALSE",
          "LIKE", "ILIKE", "CONTAINS", "MATCH", "REGEX", "REGEXP", "SIMILAR", "TO");

  private static final Set<String> OPERATOR_WORDS =
      Set.of("NOT", "STARTS_WITH", "SIMILAR", "TO", "LIKE", "ILIKE", "CONTAINS", "MATCH",
          "REGEX", "REGEXP");

  private final TypeRegistry registry;

  public QueryValidator() {
    this(TypeRegistry.builtins());
  }

  /**
   * Creates a validator that knows the given fields.
   *
   * @param registry fields used for case suggestions
   */
  public QueryValidator(TypeRegistry registry) {
    this.registry = registry;
  }

  /**
   * Validate a filter string.
   *
   * @param query filter text, may be blank
   * @return validation result with every issue found
   */
  public ValidationResult validate(String query) {
    List<Issue> issues = new ArrayList<>();
    if (query == null || query.isBlank()) {
      return new ValidationResult(true, issues);
    }

    List<Token> tokens = QueryLexer.tokenize(query);

    // Rule 1: every literal and back-tick name is closed
    for (Token t : tokens) {
      if (!t.terminated()) {
        issues.add(
            new Issue(
                IssueType.UNBALANCED_QUOTES,
                "Unbalanced quotes: literal starting at position " + t.start() + " is not closed",
                "Close the literal with a matching " + t.text().charAt(0)));
      }
    }

    // Rule 2: parentheses balance, reported once
    int depth = 0;
    boolean negative = false;
    for (Token t : tokens) {
      if (t.type() == TokenType.LPAREN) {
        depth++;
      } else if (t.type() == TokenType.RPAREN) {
        depth--;
        if (depth < 0) {
          negative = true;
        }
      }
    }
    if (negative || depth != 0) {
      issues.add(
          new Issue(
              IssueType.UNBALANCED_PARENS,
              negative
                  ? "Unbalanced parentheses: ')' without matching '('"
                  : "Unbalanced parentheses: " + depth + " '(' not closed",
              "Check that every '(' has a matching ')'"));
    }

    // Rule 3: wildcard and regex operators
    for (int i = 0; i < tokens.size(); i++) {
      Token t = tokens.get(i);
      int operandIndex = -1;
      String operatorText = null;
      boolean negated = false;
      if (t.type() == TokenType.IDENT) {
        String upper = t.text().toUpperCase(Locale.ROOT);
        Token next = tokens.get(Math.min(i + 1, tokens.size() - 1));
        if (upper.equals("NOT") && (next.isWord("LIKE") || next.isWord("ILIKE"))) {
          operatorText = "NOT " + next.text().toUpperCase(Locale.ROOT);
          operandIndex = i + 2;
          negated = true;
        } else if (upper.equals("SIMILAR") && next.isWord("TO")) {
          operatorText = "SIMILAR TO";
          operandIndex = i + 2;
        } else if (UNSUPPORTED_WORDS.contains(upper)) {
          operatorText = upper;
          operandIndex = i + 1;
        }
      } else if (t.type() == TokenType.OPERATOR && t.text().contains("~")) {
        operatorText = t.text();
        operandIndex = i + 1;
        negated = t.text().startsWith("!");
      }
      if (operatorText != null) {
        issues.add(
            new Issue(
                IssueType.UNSUPPORTED_OPERATOR,
                "Unsupported operator: " + operatorText,
                negated
                    ? "Negated pattern matching is not supported; use != for an exact value"
                    : prefixSuggestion(fieldBefore(tokens, i), tokenAt(tokens, operandIndex))));
        i = skipOperand(tokens, operandIndex);
        continue;
      }
      if (isWildcard(t)) {
        boolean literal = t.type() == TokenType.STRING;
        String where = literal ? "in literal " + t.text() : "'" + t.text() + "'";
        issues.add(
            new Issue(
                IssueType.UNSUPPORTED_OPERATOR,
                "Unsupported wildcard " + where,
                prefixSuggestion(literal ? fieldBefore(tokens, i) : null, t)));
      }
    }

    // Rule 4: connectives must be uppercase
    for (Token t : tokens) {
      if ((t.isWord("AND") || t.isWord("OR"))
          && !t.text().equals(t.text().toUpperCase(Locale.ROOT))) {
        String fixed = t.text().toUpperCase(Locale.ROOT);
        issues.add(
            new Issue(
                IssueType.CASE,
                "Logical operator '" + t.text() + "' must be uppercase",
                "Use " + fixed + " instead of " + t.text()));
      }
    }

    // Rule 5: field names are case-sensitive
    for (Token t : tokens) {
      boolean candidate =
          t.type() == TokenType.QUOTED_IDENT
              || (t.type() == TokenType.IDENT
                  && !KEYWORDS.contains(t.text().toUpperCase(Locale.ROOT)));
      if (!candidate || !t.terminated() || registry.find(t.value()).isPresent()) {
        continue;
      }
      registry
          .findIgnoreCase(t.value())
          .ifPresent(
              d ->
                  issues.add(
                      new Issue(
                          IssueType.FIELD_CASE,
                          "Unknown field '" + t.value() + "', did you mean `" + d.name() + "`?",
                          "Field names are case-sensitive: use " + d.renderedName())));
    }

    return new ValidationResult(issues.isEmpty(), issues);
  }

  /** Fields, operators, statuses and example queries, for callers that want to show help. */
  public Map<String, Object> help() {
    Map<String, Object> help = new LinkedHashMap<>();
    List<Map<String, Object>> fields = new ArrayList<>();
    for (FieldDescriptor d : registry.fields()) {
      Map<String, Object> f = new LinkedHashMap<>();
      f.put("name", d.name());
      f.put("type", d.type().name());
      f.put("custom", d.custom());
      fields.add(f);
    }
    help.put("supportedFields", fields);
    List<String> operators = new ArrayList<>();
    for (Operator op : Operator.values()) {
      operators.add(op.keyword());
    }
    help.put("supportedOperators", operators);
    help.put("executionStatuses", ExecutionStatus.names());
    help.put(
        "examples",
        List.of(
            "WorkflowType = 'OnboardingFlow'",
            "WorkflowType STARTS_WITH 'patient'",
            "ExecutionStatus = 'Failed'",
            "WorkflowId IN ('id1', 'id2')",
            "StartTime > '2025-01-01T00:00:00Z'",
            "ExecutionStatus = 'Running' AND StartTime BETWEEN '2025-01-01T00:00:00Z' AND"
                + " '2025-02-01T00:00:00Z'"));
    return help;
  }

  private static boolean isWildcard(Token t) {
    if (t.type() == TokenType.STRING) {
      return t.value().indexOf('%') >= 0 || t.value().indexOf('*') >= 0;
    }
    return t.type() == TokenType.UNKNOWN && (t.text().equals("%") || t.text().equals("*"));
  }

  // The literal right after an unsupported operator belongs to that finding.
  private static int skipOperand(List<Token> tokens, int operandIndex) {
    Token operand = tokenAt(tokens, operandIndex);
    if (operand != null && operand.type() == TokenType.STRING) {
      return operandIndex;
    }
    return operandIndex - 1;
  }

  private static Token tokenAt(List<Token> tokens, int index) {
    return index >= 0 && index < tokens.size() ? tokens.get(index) : null;
  }

  // Walks back over operator symbols and words to the field the operator applies to.
  private static String fieldBefore(List<Token> tokens, int index) {
    for (int i = index - 1; i >= 0; i--) {
      Token t = tokens.get(i);
      if (t.type() == TokenType.QUOTED_IDENT) {
        return t.text();
      }
      if (t.type() == TokenType.IDENT) {
        String upper = t.text().toUpperCase(Locale.ROOT);
        if (!KEYWORDS.contains(upper)) {
          return t.text();
        }
        if (!OPERATOR_WORDS.contains(upper)) {
          return null;
        }
      } else if (t.type() != TokenType.OPERATOR) {
        return null;
      }
    }
    return null;
  }

  private static String prefixSuggestion(String field, Token pattern) {
    String target = field != null ? field : "WorkflowType";
    if (pattern != null && pattern.type() == TokenType.STRING) {
      String prefix = simplePrefix(pattern.value());
      if (prefix != null) {
        return "Use " + target + " STARTS_WITH '" + prefix.replace("'", "''") + "'";
      }
    }
    return "Use " + target + " STARTS_WITH 'prefix' for prefix matching or = for exact values";
  }

  // "foo%", "foo*" and "^foo" are simple prefixes; anything else is not
  private static String simplePrefix(String pattern) {
    String p = pattern;
    if (p.startsWith("^")) {
      p = p.substring(1);
      if (p.endsWith(".*")) {
        p = p.substring(0, p.length() - 2);
      }
    } else if (p.endsWith("%") || p.endsWith("*")) {
      p = p.substring(0, p.length() - 1);
    } else {
      return null;
    }
    if (p.isEmpty() || p.chars().anyMatch(ch -> "%*_.^$[]()?+|\\".indexOf(ch) >= 0)) {
      return null;
    }
    return p;
  }

  /** Types of validation issues. */
  public enum IssueType {
    /**
     * A quoted literal or back-tick name is not closed. Literals may use single or double quotes,
     * and a quote of the other kind inside a literal is plain text.
     */
    UNBALANCED_QUOTES,
    /** Parentheses do not pair up. */
    UNBALANCED_PARENS,
    /** LIKE, regex operators or wildcards, none of which the visibility store supports. */
    UNSUPPORTED_OPERATOR,
    /** Lowercase AND/OR. */
    CASE,
    /** Field name that only matches a known field when case is ignored. */
    FIELD_CASE
  }

  /**
   * Validation issue found in query.
   *
   * @param type type of issue
   * @param description human-readable description
   * @param suggestion how to fix the issue
   */
  public record Issue(IssueType type, String description, String suggestion) {
    public Map<String, Object> toMap() {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("type", type.name());
      map.put("description", description);
      map.put("suggestion", suggestion);
      return map;
    }
  }

  /**
   * Result of validation.
   *
   * @param valid true if query is valid (no issues)
   * @param issues list of validation issues found
   */
  public record ValidationResult(boolean valid, List<Issue> issues) {
    public ValidationResult {
      issues = List.copyOf(issues);
    }

    public long count(IssueType type) {
      return issues.stream().filter(i -> i.type() == type).count();
    }

    public Map<String, Object> toMap() {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("valid", valid);
      map.put("issues", issues.stream().map(Issue::toMap).toList());
      return map;
    }
  }
}
