package io.wfpath.query;

/**
 * Thrown when an operator is not allowed for a field's type, or when a literal does not have the
 * shape the field's type requires.
 */
public final class TypeMismatchException extends QueryException {

  private final String fieldName;
  private final FieldType fieldType;

  public TypeMismatchException(String fieldName, FieldType fieldType, String message) {
    super(fieldName + " (" + fieldType + "): " + message);
    this.fieldName = fieldName;
    this.fieldType = fieldType;
  }

  public String getFieldName() {
    return fieldName;
  }

  public FieldType getFieldType() {
    return fieldType;
  }
}
