package io.wfpath.query;

/** Token categories produced by {@link QueryLexer}. */
public enum TokenType {
  /** Bare word: field names, keywords, boolean literals. */
  IDENT,
  /** Back-tick quoted field name. */
  QUOTED_IDENT,
  /** Single or double quoted literal. */
  STRING,
  NUMBER,
  /** Comparison symbols: = != <> == > >= < <= and the ~ family. */
  OPERATOR,
  LPAREN,
  RPAREN,
  COMMA,
  /** Any character the filter language does not use. */
  UNKNOWN,
  EOF
}
