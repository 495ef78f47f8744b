package io.wfpath.query;

/**
 * Base class for errors raised while constructing a visibility query.
 *
 * <p>These are construction-time failures scoped to a single comparison or query string. They
 * extend {@link IllegalArgumentException} so callers that already treat bad arguments as user
 * errors handle them without special casing.
 */
public class QueryException extends IllegalArgumentException {

  public QueryException(String message) {
    super(message);
  }

  public QueryException(String message, Throwable cause) {
    super(message, cause);
  }
}
