package io.wfpath.history;

/**
 * Thrown when a history record cannot become a {@link WorkflowEvent}: a missing or non-numeric
 * event id, a missing event type, or ids that do not strictly increase.
 */
public final class MalformedEventException extends RuntimeException {

  private final String location;

  public MalformedEventException(String location, String message) {
    super(location + ": " + message);
    this.location = location;
  }

  /** The offending event id, or its position in the history when the id itself is missing. */
  public String getLocation() {
    return location;
  }
}
