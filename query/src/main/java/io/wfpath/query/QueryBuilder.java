package io.wfpath.query;

import io.wfpath.query.Expression.Connective;
import io.wfpath.query.Expression.Logical;
import java.util.ArrayList;
import java.util.List;

/**
 * Fluent builder for visibility queries. Conditions added one after another are joined with AND;
 * {@link #and(QueryBuilder)} and {@link #or(QueryBuilder)} combine whole builders, keeping each
 * side in parentheses.
 *
 * <pre>{@code
 * Query q = new QueryBuilder()
 *     .workflowTypeStartsWith("onboarding")
 *     .executionStatus(ExecutionStatus.Failed)
 *     .build();
 * // WorkflowType STARTS_WITH 'onboarding' AND ExecutionStatus = 'Failed'
 * }</pre>
 */
public final class QueryBuilder {

  private final TypeRegistry registry;
  private final List<Expression> conditions = new ArrayList<>();

  public QueryBuilder() {
    this(TypeRegistry.builtins());
  }

  public QueryBuilder(TypeRegistry registry) {
    this.registry = registry;
  }

  public QueryBuilder workflowId(String value) {
    return where("WorkflowId", Operator.EQ, value);
  }

  public QueryBuilder workflowId(String value, Operator operator) {
    return where("WorkflowId", operator, value);
  }

  public QueryBuilder workflowType(String value) {
    return where("WorkflowType", Operator.EQ, value);
  }

  public QueryBuilder workflowType(String value, Operator operator) {
    return where("WorkflowType", operator, value);
  }

  public QueryBuilder executionStatus(ExecutionStatus status) {
    return where("ExecutionStatus", Operator.EQ, status.name());
  }

  public QueryBuilder executionStatus(ExecutionStatus status, Operator operator) {
    return where("ExecutionStatus", operator, status.name());
  }

  /** {@code StartTime > time}. */
  public QueryBuilder startTime(Object time) {
    return where("StartTime", Operator.GT, time);
  }

  public QueryBuilder startTime(Object time, Operator operator) {
    return where("StartTime", operator, time);
  }

  /** {@code CloseTime < time}. */
  public QueryBuilder closeTime(Object time) {
    return where("CloseTime", Operator.LT, time);
  }

  public QueryBuilder closeTime(Object time, Operator operator) {
    return where("CloseTime", operator, time);
  }

  /** {@code ExecutionTime > time}. */
  public QueryBuilder executionTime(Object time) {
    return where("ExecutionTime", Operator.GT, time);
  }

  public QueryBuilder executionTime(Object time, Operator operator) {
    return where("ExecutionTime", operator, time);
  }

  public QueryBuilder workflowIdIn(List<String> workflowIds) {
    return where("WorkflowId", Operator.IN, workflowIds);
  }

  public QueryBuilder workflowTypeStartsWith(String prefix) {
    return where("WorkflowType", Operator.STARTS_WITH, prefix);
  }

  /**
   * Adds {@code field BETWEEN start AND end} for a datetime field.
   *
   * @throws TypeMismatchException if {@code field} is not a DATETIME attribute
   */
  public QueryBuilder timeRange(String field, Object start, Object end) {
    FieldDescriptor d = registry.describe(field);
    if (d.type() != FieldType.DATETIME) {
      throw new TypeMismatchException(
          field, d.type(), "time range filters are only supported for datetime fields");
    }
    conditions.add(Comparisons.make(d, Operator.BETWEEN, List.of(start, end)));
    return this;
  }

  public QueryBuilder where(String field, Operator operator, Object value) {
    conditions.add(Comparisons.make(registry, field, operator, value));
    return this;
  }

  public QueryBuilder isNull(String field) {
    return where(field, Operator.IS_NULL, null);
  }

  public QueryBuilder isNotNull(String field) {
    return where(field, Operator.IS_NOT_NULL, null);
  }

  /** Adds an already built expression as one more AND-ed condition. */
  public QueryBuilder condition(Expression expression) {
    conditions.add(expression);
    return this;
  }

  public QueryBuilder and(QueryBuilder other) {
    return combine(Connective.AND, other);
  }

  public QueryBuilder or(QueryBuilder other) {
    return combine(Connective.OR, other);
  }

  public boolean isEmpty() {
    return conditions.isEmpty();
  }

  /**
   * Builds the query.
   *
   * @throws IllegalStateException if no condition was added
   */
  public Query build() {
    if (conditions.isEmpty()) {
      throw new IllegalStateException("Query has no conditions");
    }
    return new Query(current());
  }

  private QueryBuilder combine(Connective connective, QueryBuilder other) {
    if (other.conditions.isEmpty()) {
      return this;
    }
    Expression right = grouped(other.current());
    if (conditions.isEmpty()) {
      conditions.add(right);
      return this;
    }
    Expression left = grouped(current());
    conditions.clear();
    conditions.add(new Logical(connective, List.of(left, right), false));
    return this;
  }

  private Expression current() {
    return conditions.size() == 1
        ? conditions.get(0)
        : new Logical(Connective.AND, conditions, false);
  }

  private static Expression grouped(Expression e) {
    return e instanceof Logical l ? l.withGrouped(true) : e;
  }
}
