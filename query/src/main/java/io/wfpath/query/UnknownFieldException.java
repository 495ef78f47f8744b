package io.wfpath.query;

/** Thrown when a field name resolves neither to a builtin nor to a custom search attribute. */
public final class UnknownFieldException extends QueryException {

  private final String fieldName;
  private final String suggestion;

  public UnknownFieldException(String fieldName, String suggestion) {
    super(
        "Unknown field: "
            + fieldName
            + (suggestion != null ? " (did you mean `" + suggestion + "`?)" : ""));
    this.fieldName = fieldName;
    this.suggestion = suggestion;
  }

  public String getFieldName() {
    return fieldName;
  }

  /**
   * Returns the known field that matches {@link #getFieldName()} case-insensitively.
   *
   * @return the suggested field name, or {@code null} if there is no near miss
   */
  public String getSuggestion() {
    return suggestion;
  }
}
