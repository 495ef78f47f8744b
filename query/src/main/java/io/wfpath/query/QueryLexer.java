package io.wfpath.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-pass tokenizer for visibility filter strings.
 *
 * <p>The lexer never fails: unclosed literals come back as tokens with {@code terminated=false}
 * and characters the language does not use become {@link TokenType#UNKNOWN} tokens, so the
 * validator can report them. Whitespace is skipped. The token list always ends with an EOF token.
 */
public final class QueryLexer {

  private QueryLexer() {}

  public static List<Token> tokenize(String input) {
    if (input == null || input.isEmpty()) {
      return List.of(new Token(TokenType.EOF, "", 0, 0));
    }

    List<Token> tokens = new ArrayList<>();
    int pos = 0;
    int len = input.length();

    while (pos < len) {
      char c = input.charAt(pos);

      if (Character.isWhitespace(c)) {
        pos++;
        continue;
      }

      Token token;
      if (c == '\'' || c == '"') {
        token = quoted(input, pos, c, TokenType.STRING);
      } else if (c == '`') {
        token = quoted(input, pos, '`', TokenType.QUOTED_IDENT);
      } else if (Character.isDigit(c)
          || (c == '-' && pos + 1 < len && Character.isDigit(input.charAt(pos + 1)))) {
        token = number(input, pos);
      } else if (c == '(') {
        token = new Token(TokenType.LPAREN, "(", pos, pos + 1);
      } else if (c == ')') {
        token = new Token(TokenType.RPAREN, ")", pos, pos + 1);
      } else if (c == ',') {
        token = new Token(TokenType.COMMA, ",", pos, pos + 1);
      } else if (c == '=' || c == '!' || c == '<' || c == '>' || c == '~') {
        token = operator(input, pos);
      } else if (Character.isLetter(c) || c == '_') {
        int end = pos + 1;
        while (end < len
            && (Character.isLetterOrDigit(input.charAt(end)) || input.charAt(end) == '_')) {
          end++;
        }
        token = new Token(TokenType.IDENT, input.substring(pos, end), pos, end);
      } else {
        token = new Token(TokenType.UNKNOWN, String.valueOf(c), pos, pos + 1);
      }
      tokens.add(token);
      pos = token.end();
    }

    tokens.add(new Token(TokenType.EOF, "", len, len));
    return tokens;
  }

  // Quotes inside a literal are escaped by doubling them.
  private static Token quoted(String input, int start, char quote, TokenType type) {
    StringBuilder value = new StringBuilder();
    int pos = start + 1;
    int len = input.length();
    while (pos < len) {
      char c = input.charAt(pos);
      if (c == quote) {
        if (quote != '`' && pos + 1 < len && input.charAt(pos + 1) == quote) {
          value.append(quote);
          pos += 2;
          continue;
        }
        return new Token(
            type, input.substring(start, pos + 1), value.toString(), start, pos + 1, true);
      }
      value.append(c);
      pos++;
    }
    return new Token(type, input.substring(start), value.toString(), start, len, false);
  }

  private static Token number(String input, int start) {
    int pos = start;
    int len = input.length();
    if (input.charAt(pos) == '-') {
      pos++;
    }
    while (pos < len && Character.isDigit(input.charAt(pos))) {
      pos++;
    }
    if (pos + 1 < len && input.charAt(pos) == '.' && Character.isDigit(input.charAt(pos + 1))) {
      pos++;
      while (pos < len && Character.isDigit(input.charAt(pos))) {
        pos++;
      }
    }
    if (pos < len && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
      int exp = pos + 1;
      if (exp < len && (input.charAt(exp) == '+' || input.charAt(exp) == '-')) {
        exp++;
      }
      if (exp < len && Character.isDigit(input.charAt(exp))) {
        pos = exp;
        while (pos < len && Character.isDigit(input.charAt(pos))) {
          pos++;
        }
      }
    }
    return new Token(TokenType.NUMBER, input.substring(start, pos), start, pos);
  }

  private static Token operator(String input, int start) {
    int pos = start + 1;
    int len = input.length();
    char first = input.charAt(start);
    if (first == '~' || (first == '!' && pos < len && input.charAt(pos) == '~')) {
      while (pos < len && input.charAt(pos) == '~') {
        pos++;
      }
    } else if (pos < len) {
      char second = input.charAt(pos);
      if (second == '=' || (first == '<' && second == '>')) {
        pos++;
      }
    }
    return new Token(TokenType.OPERATOR, input.substring(start, pos), start, pos);
  }
}
