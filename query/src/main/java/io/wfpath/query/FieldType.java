package io.wfpath.query;

import static io.wfpath.query.Operator.*;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Search attribute types. Each type knows which operators it accepts and how its literals are
 * written in a rendered query.
 */
public enum FieldType {
  KEYWORD(
      true,
      EnumSet.of(EQ, NEQ, GT, GTE, LT, LTE, STARTS_WITH, IN, BETWEEN, IS_NULL, IS_NOT_NULL)),
  TEXT(true, EnumSet.of(EQ, NEQ, IS_NULL, IS_NOT_NULL)),
  INT(false, EnumSet.of(EQ, NEQ, GT, GTE, LT, LTE, IN, BETWEEN, IS_NULL, IS_NOT_NULL)),
  DOUBLE(false, EnumSet.of(EQ, NEQ, GT, GTE, LT, LTE, IN, BETWEEN, IS_NULL, IS_NOT_NULL)),
  BOOL(false, EnumSet.of(EQ, NEQ, IS_NULL, IS_NOT_NULL)),
  DATETIME(true, EnumSet.of(EQ, NEQ, GT, GTE, LT, LTE, IN, BETWEEN, IS_NULL, IS_NOT_NULL)),
  KEYWORD_LIST(true, EnumSet.of(EQ, NEQ, IN, IS_NULL, IS_NOT_NULL));

  private final boolean quoted;
  private final Set<Operator> operators;

  FieldType(boolean quoted, Set<Operator> operators) {
    this.quoted = quoted;
    this.operators = Set.copyOf(operators);
  }

  public boolean isQuoted() {
    return quoted;
  }

  public Set<Operator> allowedOperators() {
    return operators;
  }

  public boolean allows(Operator op) {
    return operators.contains(op);
  }

  /**
   * Writes a normalized literal value the way the filter language expects it. Quoted types get
   * single quotes with embedded quotes doubled; numbers are written in plain decimal notation and
   * booleans in lowercase.
   *
   * @param value a value already normalized by {@link Comparisons}
   * @return literal text
   */
  public String renderLiteral(Object value) {
    if (quoted) {
      return "'" + value.toString().replace("'", "''") + "'";
    }
    return switch (this) {
      case INT -> Long.toString(((Number) value).longValue());
      case DOUBLE ->
          BigDecimal.valueOf(((Number) value).doubleValue()).stripTrailingZeros().toPlainString();
      case BOOL -> value.toString().toLowerCase(Locale.ROOT);
      default -> throw new IllegalStateException("Unquoted literal for " + this);
    };
  }

  /**
   * Reads a literal written by {@link #renderLiteral(Object)} back into its value.
   *
   * @param literal literal text
   * @return String for quoted types, Long, Double or Boolean otherwise
   * @throws TypeMismatchException if the text is not a literal of this type
   */
  public Object coerce(String literal) {
    if (quoted) {
      if (literal.length() < 2 || !literal.startsWith("'") || !literal.endsWith("'")) {
        throw new TypeMismatchException("literal", this, "expected quoted literal: " + literal);
      }
      return literal.substring(1, literal.length() - 1).replace("''", "'");
    }
    try {
      return switch (this) {
        case INT -> Long.parseLong(literal);
        case DOUBLE -> Double.parseDouble(literal);
        case BOOL -> {
          if (!literal.equals("true") && !literal.equals("false")) {
            throw new TypeMismatchException("literal", this, "expected true or false: " + literal);
          }
          yield Boolean.valueOf(literal);
        }
        default -> throw new IllegalStateException("Unquoted literal for " + this);
      };
    } catch (NumberFormatException e) {
      throw new TypeMismatchException("literal", this, "not a number: " + literal);
    }
  }

  /**
   * Resolves a type from configuration text. Accepts enum names as well as the names Temporal
   * uses ({@code Keyword}, {@code Int}, {@code Datetime}, {@code KeywordList}).
   *
   * @param text type name
   * @return the field type
   * @throws IllegalArgumentException if the name is unknown
   */
  public static FieldType fromText(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Field type is required");
    }
    String key = text.trim().replace("_", "").toUpperCase(Locale.ROOT);
    for (FieldType t : values()) {
      if (t.name().replace("_", "").equals(key)) {
        return t;
      }
    }
    throw new IllegalArgumentException("Unknown field type: " + text);
  }
}
