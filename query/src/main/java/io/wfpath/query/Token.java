package io.wfpath.query;

/**
 * A lexical token with its exact position in the input.
 *
 * @param type token category
 * @param text raw text as it appears in the input, quotes included
 * @param value unescaped content for strings and back-tick names, {@code text} otherwise
 * @param start start offset (inclusive)
 * @param end end offset (exclusive)
 * @param terminated false when a string or back-tick name runs to the end of input unclosed
 */
public record Token(
    TokenType type, String text, String value, int start, int end, boolean terminated) {

  public Token(TokenType type, String text, int start, int end) {
    this(type, text, text, start, end, true);
  }

  /** Whether this is a bare word equal to {@code keyword} ignoring case. */
  public boolean isWord(String keyword) {
    return type == TokenType.IDENT && text.equalsIgnoreCase(keyword);
  }
}
