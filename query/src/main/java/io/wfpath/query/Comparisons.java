package io.wfpath.query;

import io.wfpath.query.Expression.Comparison;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** Factory for type-checked {@link Comparison}s. */
public final class Comparisons {

  private Comparisons() {}

  /**
   * Resolves {@code fieldName} in {@code registry} and builds a comparison against it.
   *
   * @throws UnknownFieldException if the field is not known
   * @throws TypeMismatchException if the operator or value does not fit the field type
   */
  public static Comparison make(
      TypeRegistry registry, String fieldName, Operator operator, Object value) {
    return make(registry.describe(fieldName), operator, value);
  }

  /**
   * Builds a comparison, normalizing the operand to the representation the renderer writes: Long
   * for INT, Double for DOUBLE, Boolean for BOOL and String otherwise. IN operands become lists,
   * BETWEEN operands become two-element lists with the lower bound first; equal bounds are
   * allowed.
   *
   * @param field target field
   * @param operator comparison operator
   * @param value raw operand
   * @return the comparison
   * @throws TypeMismatchException if the operator or value does not fit the field type
   */
  public static Comparison make(FieldDescriptor field, Operator operator, Object value) {
    if (field == null) {
      throw new IllegalArgumentException("Field is required");
    }
    return new Comparison(field, operator, value);
  }

  /**
   * Checks {@code operator} and {@code value} against the field type and returns the normalized
   * operand. Normalizing an already normalized operand returns an equal value.
   */
  static Object checkOperand(FieldDescriptor field, Operator operator, Object value) {
    if (operator == null) {
      throw new IllegalArgumentException("Operator is required");
    }
    if (!field.type().allows(operator)) {
      throw mismatch(field, "operator " + operator.keyword() + " is not supported for this type");
    }
    switch (operator) {
      case IS_NULL:
      case IS_NOT_NULL:
        if (value != null) {
          throw mismatch(field, operator.keyword() + " takes no value");
        }
        return null;
      case IN:
        {
          Collection<?> items = asCollection(field, operator, value);
          if (items.isEmpty()) {
            throw mismatch(field, "IN requires at least one value");
          }
          List<Object> normalized = new ArrayList<>(items.size());
          for (Object item : items) {
            normalized.add(normalize(field, item));
          }
          return List.copyOf(normalized);
        }
      case BETWEEN:
        {
          Collection<?> bounds = asCollection(field, operator, value);
          if (bounds.size() != 2) {
            throw mismatch(field, "BETWEEN requires exactly two bounds, got " + bounds.size());
          }
          List<Object> normalized = new ArrayList<>(2);
          for (Object bound : bounds) {
            normalized.add(normalize(field, bound));
          }
          if (compareBounds(field, normalized.get(0), normalized.get(1)) > 0) {
            throw mismatch(
                field,
                "BETWEEN bounds are reversed: "
                    + field.type().renderLiteral(normalized.get(0))
                    + " > "
                    + field.type().renderLiteral(normalized.get(1)));
          }
          return List.copyOf(normalized);
        }
      default:
        return normalize(field, value);
    }
  }

  private static Collection<?> asCollection(
      FieldDescriptor field, Operator operator, Object value) {
    if (value instanceof Collection<?> c) {
      return c;
    }
    if (value instanceof Object[] arr) {
      return List.of(arr);
    }
    throw mismatch(field, operator.keyword() + " requires a list of values");
  }

  static Object normalize(FieldDescriptor field, Object value) {
    if (value == null) {
      throw mismatch(field, "value is required");
    }
    switch (field.type()) {
      case INT:
        if (value instanceof Long || value instanceof Integer || value instanceof Short
            || value instanceof Byte) {
          return ((Number) value).longValue();
        }
        if (value instanceof Number) {
          throw mismatch(field, "expected a 64-bit integer, got " + describe(value));
        }
        throw mismatch(field, "expected an integer, got " + describe(value));
      case DOUBLE:
        if (value instanceof Number n) {
          double d = n.doubleValue();
          if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw mismatch(field, "value must be finite, got " + value);
          }
          return d == 0.0 ? 0.0 : d;
        }
        throw mismatch(field, "expected a number, got " + describe(value));
      case BOOL:
        if (value instanceof Boolean b) {
          return b;
        }
        if ("true".equals(value) || "false".equals(value)) {
          return Boolean.valueOf((String) value);
        }
        throw mismatch(field, "expected true or false, got " + describe(value));
      case DATETIME:
        return datetime(field, value);
      default:
        if (!(value instanceof CharSequence)) {
          throw mismatch(field, "expected a string, got " + describe(value));
        }
        String s = value.toString();
        if (field.isRestricted() && !field.allowedValues().contains(s)) {
          throw mismatch(
              field, "'" + s + "' is not one of " + String.join(", ", field.allowedValues()));
        }
        return s;
    }
  }

  private static String datetime(FieldDescriptor field, Object value) {
    if (value instanceof Instant
        || value instanceof OffsetDateTime
        || value instanceof ZonedDateTime
        || value instanceof LocalDateTime
        || value instanceof LocalDate) {
      if (value instanceof ZonedDateTime z) {
        return z.toOffsetDateTime().toString();
      }
      return ((TemporalAccessor) value).toString();
    }
    if (!(value instanceof CharSequence)) {
      throw mismatch(field, "expected an ISO-8601 datetime, got " + describe(value));
    }
    String s = value.toString();
    if (!isIsoDateTime(s)) {
      throw mismatch(field, "expected an ISO-8601 datetime, got '" + s + "'");
    }
    return s;
  }

  private static int compareBounds(FieldDescriptor field, Object low, Object high) {
    switch (field.type()) {
      case INT:
        return Long.compare((Long) low, (Long) high);
      case DOUBLE:
        return Double.compare((Double) low, (Double) high);
      case DATETIME:
        return toInstant((String) low).compareTo(toInstant((String) high));
      default:
        return low.toString().compareTo(high.toString());
    }
  }

  // Local dates and times are read as UTC so that mixed forms still order.
  private static Instant toInstant(String s) {
    try {
      return OffsetDateTime.parse(s).toInstant();
    } catch (DateTimeParseException ignored) {
      // try the next form
    }
    try {
      return Instant.parse(s);
    } catch (DateTimeParseException ignored) {
      // try the next form
    }
    try {
      return LocalDateTime.parse(s).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException ignored) {
      // try the next form
    }
    return LocalDate.parse(s).atStartOfDay().toInstant(ZoneOffset.UTC);
  }

  /** Whether {@code s} is an ISO-8601 instant, offset or local datetime, or a plain date. */
  public static boolean isIsoDateTime(String s) {
    try {
      OffsetDateTime.parse(s);
      return true;
    } catch (DateTimeParseException ignored) {
      // try the next form
    }
    try {
      Instant.parse(s);
      return true;
    } catch (DateTimeParseException ignored) {
      // try the next form
    }
    try {
      LocalDateTime.parse(s);
      return true;
    } catch (DateTimeParseException ignored) {
      // try the next form
    }
    try {
      LocalDate.parse(s);
      return true;
    } catch (DateTimeParseException e) {
      return false;
    }
  }

  private static String describe(Object value) {
    if (value instanceof CharSequence) {
      return "string '" + value + "'";
    }
    return value.getClass().getSimpleName() + " " + value;
  }

  private static TypeMismatchException mismatch(FieldDescriptor field, String message) {
    return new TypeMismatchException(field.name(), field.type(), message);
  }
}
