package io.wfpath.query;

/** Thrown by {@link QueryParser} when the query text does not follow the filter grammar. */
public final class QuerySyntaxException extends QueryException {

  private final int position;

  public QuerySyntaxException(String message, int position) {
    super(message + " at position " + position);
    this.position = position;
  }

  public int getPosition() {
    return position;
  }
}
