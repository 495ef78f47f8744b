package io.wfpath.query;

/** Thrown when a field name cannot be represented in the filter language at all. */
public final class InvalidFieldNameException extends QueryException {

  public InvalidFieldNameException(String fieldName, String reason) {
    super("Invalid field name '" + fieldName + "': " + reason);
  }
}
