package io.wfpath.query;

import java.util.List;
import java.util.regex.Pattern;

/**
 * A search attribute known to a {@link TypeRegistry}.
 *
 * @param name field name as the server knows it
 * @param type search attribute type
 * @param custom whether the field was declared by configuration rather than built in
 * @param allowedValues literal values the field accepts, empty for unrestricted
 */
public record FieldDescriptor(
    String name, FieldType type, boolean custom, List<String> allowedValues) {

  private static final Pattern BARE_NAME = Pattern.compile("[A-Za-z0-9_]+");

  public FieldDescriptor {
    if (name == null || name.isBlank()) {
      throw new InvalidFieldNameException(String.valueOf(name), "field name is blank");
    }
    if (name.indexOf('`') >= 0) {
      throw new InvalidFieldNameException(name, "field name contains a back-tick");
    }
    if (type == null) {
      throw new IllegalArgumentException("Field type is required for " + name);
    }
    allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
  }

  public FieldDescriptor(String name, FieldType type, boolean custom) {
    this(name, type, custom, List.of());
  }

  /** Field name as written in a query: bare when possible, back-tick wrapped otherwise. */
  public String renderedName() {
    return BARE_NAME.matcher(name).matches() ? name : "`" + name + "`";
  }

  public boolean isRestricted() {
    return !allowedValues.isEmpty();
  }
}
