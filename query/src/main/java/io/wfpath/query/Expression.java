package io.wfpath.query;

import java.util.List;

/**
 * Filter expression tree. Leaves are {@link Comparison}s, inner nodes are {@link Logical}
 * connectives.
 */
public sealed interface Expression permits Expression.Comparison, Expression.Logical {

  enum Connective {
    AND,
    OR
  }

  /**
   * A single typed comparison. The operator is checked against the field type and the operand is
   * normalized on construction, see {@link Comparisons#make(FieldDescriptor, Operator, Object)}.
   *
   * @param field the field being compared
   * @param operator the comparison operator
   * @param operand normalized operand; a list for IN and BETWEEN, null for the null checks
   * @throws TypeMismatchException if the operator or operand does not fit the field type
   */
  record Comparison(FieldDescriptor field, Operator operator, Object operand)
      implements Expression {
    public Comparison {
      if (field == null || operator == null) {
        throw new IllegalArgumentException("Field and operator are required");
      }
      operand = Comparisons.checkOperand(field, operator, operand);
    }
  }

  /**
   * AND/OR over two or more children. {@code grouped} records explicit parentheses.
   *
   * @param connective AND or OR
   * @param children operands, at least two
   * @param grouped whether the node is written in parentheses
   */
  record Logical(Connective connective, List<Expression> children, boolean grouped)
      implements Expression {
    public Logical {
      if (connective == null) {
        throw new IllegalArgumentException("Connective is required");
      }
      if (children == null || children.size() < 2) {
        throw new IllegalArgumentException(connective + " needs at least two operands");
      }
      children = List.copyOf(children);
    }

    public Logical withGrouped(boolean grouped) {
      return new Logical(connective, children, grouped);
    }
  }
}
