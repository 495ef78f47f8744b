package io.wfpath.query;

import io.wfpath.query.Expression.Connective;
import io.wfpath.query.Expression.Logical;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recursive-descent parser for visibility filter strings. Accepts everything {@link QueryRenderer}
 * writes: OR binds looser than AND, parentheses mark a node as grouped and keywords are matched
 * ignoring case.
 *
 * <pre>
 * or         := and ('OR' and)*
 * and        := primary ('AND' primary)*
 * primary    := '(' or ')' | comparison
 * comparison := field ( cmpOp literal | 'STARTS_WITH' literal | 'IN' '(' literal (',' literal)* ')'
 *                     | 'BETWEEN' literal 'AND' literal | 'IS' ['NOT'] 'NULL' )
 * </pre>
 */
public final class QueryParser {
  private final List<Token> tokens;
  private final TypeRegistry registry;
  private int pos = 0;

  private QueryParser(String input, TypeRegistry registry) {
    this.tokens = QueryLexer.tokenize(input);
    this.registry = registry;
  }

  /**
   * Parses a filter string against the given fields.
   *
   * @param input filter text
   * @param registry known search attributes
   * @return the parsed query
   * @throws QuerySyntaxException if the text is malformed
   * @throws UnknownFieldException if a field is not in {@code registry}
   * @throws TypeMismatchException if an operator or literal does not fit its field
   */
  public static Query parse(String input, TypeRegistry registry) {
    if (input == null || input.isBlank()) {
      throw new QuerySyntaxException("Empty query", 0);
    }
    QueryParser parser = new QueryParser(input, registry);
    Expression root = parser.parseOr();
    if (parser.peek().type() != TokenType.EOF) {
      throw parser.error("Unexpected " + describe(parser.peek()));
    }
    return new Query(root);
  }

  private Expression parseOr() {
    List<Expression> children = new ArrayList<>();
    children.add(parseAnd());
    while (peek().isWord("OR")) {
      pos++;
      children.add(parseAnd());
    }
    return children.size() == 1 ? children.get(0) : new Logical(Connective.OR, children, false);
  }

  private Expression parseAnd() {
    List<Expression> children = new ArrayList<>();
    children.add(parsePrimary());
    while (peek().isWord("AND")) {
      pos++;
      children.add(parsePrimary());
    }
    return children.size() == 1 ? children.get(0) : new Logical(Connective.AND, children, false);
  }

  private Expression parsePrimary() {
    if (peek().type() == TokenType.LPAREN) {
      pos++;
      Expression inner = parseOr();
      expect(TokenType.RPAREN, "')'");
      return inner instanceof Logical l ? l.withGrouped(true) : inner;
    }
    return parseComparison();
  }

  private Expression parseComparison() {
    Token fieldTok = next();
    String fieldName;
    if (fieldTok.type() == TokenType.QUOTED_IDENT) {
      if (!fieldTok.terminated()) {
        throw error("Unclosed back-tick name", fieldTok);
      }
      fieldName = fieldTok.value();
    } else if (fieldTok.type() == TokenType.IDENT) {
      fieldName = fieldTok.text();
    } else {
      throw error("Expected field name but found " + describe(fieldTok), fieldTok);
    }
    FieldDescriptor field = registry.describe(fieldName);

    Token opTok = next();
    if (opTok.type() == TokenType.OPERATOR) {
      Operator op;
      try {
        op = Operator.fromText(opTok.text());
      } catch (IllegalArgumentException e) {
        throw error("Unsupported operator " + describe(opTok), opTok);
      }
      return Comparisons.make(field, op, parseLiteral(field));
    }
    if (opTok.type() != TokenType.IDENT) {
      throw error("Expected operator but found " + describe(opTok), opTok);
    }
    String word = opTok.text().toUpperCase(Locale.ROOT);
    switch (word) {
      case "STARTS_WITH":
        return Comparisons.make(field, Operator.STARTS_WITH, parseLiteral(field));
      case "IN":
        {
          expect(TokenType.LPAREN, "'(' after IN");
          List<Object> values = new ArrayList<>();
          values.add(parseLiteral(field));
          while (peek().type() == TokenType.COMMA) {
            pos++;
            values.add(parseLiteral(field));
          }
          expect(TokenType.RPAREN, "')' closing IN list");
          return Comparisons.make(field, Operator.IN, values);
        }
      case "BETWEEN":
        {
          Object low = parseLiteral(field);
          Token and = next();
          if (!and.isWord("AND")) {
            throw error("Expected AND in BETWEEN", and);
          }
          Object high = parseLiteral(field);
          return Comparisons.make(field, Operator.BETWEEN, List.of(low, high));
        }
      case "IS":
        {
          boolean not = false;
          if (peek().isWord("NOT")) {
            pos++;
            not = true;
          }
          Token nullTok = next();
          if (!nullTok.isWord("NULL")) {
            throw error("Expected NULL", nullTok);
          }
          return Comparisons.make(field, not ? Operator.IS_NOT_NULL : Operator.IS_NULL, null);
        }
      default:
        throw error("Unsupported operator " + describe(opTok), opTok);
    }
  }

  private Object parseLiteral(FieldDescriptor field) {
    Token t = next();
    switch (t.type()) {
      case STRING:
        if (!t.terminated()) {
          throw error("Unclosed string literal", t);
        }
        return t.value();
      case NUMBER:
        try {
          if (t.text().indexOf('.') < 0 && t.text().indexOf('e') < 0 && t.text().indexOf('E') < 0) {
            return Long.parseLong(t.text());
          }
          return Double.parseDouble(t.text());
        } catch (NumberFormatException e) {
          throw error("Invalid number " + describe(t), t);
        }
      case IDENT:
        if (t.text().equals("true") || t.text().equals("false")) {
          return Boolean.valueOf(t.text());
        }
        if (field.type() == FieldType.BOOL && (t.isWord("true") || t.isWord("false"))) {
          throw new TypeMismatchException(
              field.name(), field.type(), "boolean literals are lowercase, found " + t.text());
        }
        throw error("Expected literal but found " + describe(t), t);
      default:
        throw error("Expected literal but found " + describe(t), t);
    }
  }

  private Token peek() {
    return tokens.get(pos);
  }

  private Token next() {
    Token t = tokens.get(pos);
    if (t.type() != TokenType.EOF) {
      pos++;
    }
    return t;
  }

  private void expect(TokenType type, String what) {
    Token t = next();
    if (t.type() != type) {
      throw error("Expected " + what + " but found " + describe(t), t);
    }
  }

  private QuerySyntaxException error(String message) {
    return error(message, peek());
  }

  private QuerySyntaxException error(String message, Token at) {
    return new QuerySyntaxException(message, at.start());
  }

  private static String describe(Token t) {
    return t.type() == TokenType.EOF ? "end of input" : "'" + t.text() + "'";
  }
}
