package io.wfpath.query;

import io.wfpath.query.Expression.Comparison;
import io.wfpath.query.Expression.Connective;
import io.wfpath.query.Expression.Logical;
import java.util.List;

/** Writes expression trees as visibility filter strings. Stateless and thread-safe. */
public final class QueryRenderer {

  private QueryRenderer() {}

  public static String render(Expression expression) {
    StringBuilder sb = new StringBuilder();
    if (expression instanceof Logical l && l.grouped()) {
      sb.append('(');
      appendLogical(sb, l);
      sb.append(')');
    } else {
      append(sb, expression, null);
    }
    return sb.toString();
  }

  private static void append(StringBuilder sb, Expression expression, Connective parent) {
    if (expression instanceof Comparison c) {
      appendComparison(sb, c);
      return;
    }
    Logical l = (Logical) expression;
    boolean parens =
        parent != null && (l.grouped() || l.connective() != parent || parent == Connective.OR);
    if (parens) {
      sb.append('(');
    }
    appendLogical(sb, l);
    if (parens) {
      sb.append(')');
    }
  }

  private static void appendLogical(StringBuilder sb, Logical l) {
    List<Expression> children = l.children();
    for (int i = 0; i < children.size(); i++) {
      if (i > 0) {
        sb.append(' ').append(l.connective().name()).append(' ');
      }
      append(sb, children.get(i), l.connective());
    }
  }

  private static void appendComparison(StringBuilder sb, Comparison c) {
    FieldType type = c.field().type();
    sb.append(c.field().renderedName()).append(' ').append(c.operator().keyword());
    switch (c.operator()) {
      case IS_NULL:
      case IS_NOT_NULL:
        return;
      case IN:
        {
          sb.append(" (");
          List<?> items = (List<?>) c.operand();
          for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
              sb.append(", ");
            }
            sb.append(type.renderLiteral(items.get(i)));
          }
          sb.append(')');
          return;
        }
      case BETWEEN:
        {
          List<?> bounds = (List<?>) c.operand();
          sb.append(' ')
              .append(type.renderLiteral(bounds.get(0)))
              .append(" AND ")
              .append(type.renderLiteral(bounds.get(1)));
          return;
        }
      default:
        sb.append(' ').append(type.renderLiteral(c.operand()));
    }
  }
}
