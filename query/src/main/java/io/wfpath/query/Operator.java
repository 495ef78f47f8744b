package io.wfpath.query;

import java.util.Locale;

/** Comparison operators of the visibility filter language. */
public enum Operator {
  EQ("="),
  NEQ("!="),
  GT(">"),
  GTE(">="),
  LT("<"),
  LTE("<="),
  STARTS_WITH("STARTS_WITH"),
  IN("IN"),
  BETWEEN("BETWEEN"),
  IS_NULL("IS NULL"),
  IS_NOT_NULL("IS NOT NULL");

  private final String keyword;

  Operator(String keyword) {
    this.keyword = keyword;
  }

  /** Text of the operator as it appears in a rendered query. */
  public String keyword() {
    return keyword;
  }

  /** True for operators that take no operand. */
  public boolean isNullCheck() {
    return this == IS_NULL || this == IS_NOT_NULL;
  }

  /**
   * Resolves an operator from either its enum name ({@code STARTS_WITH}, {@code GTE}) or its
   * keyword ({@code >=}, {@code IS NOT NULL}). Matching ignores case and collapses whitespace.
   *
   * @param text operator text
   * @return the operator
   * @throws IllegalArgumentException if the text names no operator
   */
  public static Operator fromText(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Operator is required");
    }
    String normalized = text.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    if (normalized.equals("==")) {
      return EQ;
    }
    if (normalized.equals("<>")) {
      return NEQ;
    }
    for (Operator op : values()) {
      if (op.keyword.equals(normalized) || op.name().equals(normalized.replace(' ', '_'))) {
        return op;
      }
    }
    throw new IllegalArgumentException("Unsupported operator: " + text);
  }
}
