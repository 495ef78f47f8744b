package io.wfpath.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable table of search attributes: the builtins every Temporal server exposes plus the custom
 * attributes declared for a namespace.
 */
public final class TypeRegistry {

  private static final TypeRegistry BUILTINS = new TypeRegistry(builtinFields(), Map.of());

  private final Map<String, FieldDescriptor> builtins;
  private final Map<String, FieldDescriptor> custom;

  private TypeRegistry(
      Map<String, FieldDescriptor> builtins, Map<String, FieldDescriptor> custom) {
    this.builtins = builtins;
    this.custom = custom;
  }

  /** Registry holding only the builtin search attributes. */
  public static TypeRegistry builtins() {
    return BUILTINS;
  }

  /**
   * Creates a registry with the given custom attributes on top of the builtins.
   *
   * @param customFields custom attribute name to type
   * @return a new registry
   * @throws IllegalArgumentException if a custom name shadows a builtin
   * @throws InvalidFieldNameException if a custom name cannot be written in a query
   */
  public static TypeRegistry withCustomFields(Map<String, FieldType> customFields) {
    Map<String, FieldDescriptor> custom = new LinkedHashMap<>();
    for (Map.Entry<String, FieldType> e : customFields.entrySet()) {
      if (BUILTINS.builtins.containsKey(e.getKey())) {
        throw new IllegalArgumentException(
            "Custom search attribute shadows builtin: " + e.getKey());
      }
      custom.put(e.getKey(), new FieldDescriptor(e.getKey(), e.getValue(), true));
    }
    return new TypeRegistry(BUILTINS.builtins, Collections.unmodifiableMap(custom));
  }

  /**
   * Looks a field up by its exact name, builtins first.
   *
   * @param name field name
   * @return the descriptor
   * @throws UnknownFieldException if no field has this exact name
   */
  public FieldDescriptor describe(String name) {
    return find(name)
        .orElseThrow(
            () ->
                new UnknownFieldException(
                    name, findIgnoreCase(name).map(FieldDescriptor::name).orElse(null)));
  }

  public Optional<FieldDescriptor> find(String name) {
    if (name == null) {
      return Optional.empty();
    }
    FieldDescriptor d = builtins.get(name);
    if (d == null) {
      d = custom.get(name);
    }
    return Optional.ofNullable(d);
  }

  /** Finds a field whose name equals {@code name} ignoring case. */
  public Optional<FieldDescriptor> findIgnoreCase(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String lower = name.toLowerCase(Locale.ROOT);
    for (FieldDescriptor d : fields()) {
      if (d.name().toLowerCase(Locale.ROOT).equals(lower)) {
        return Optional.of(d);
      }
    }
    return Optional.empty();
  }

  /** All fields, builtins first, each group in declaration order. */
  public List<FieldDescriptor> fields() {
    List<FieldDescriptor> all = new ArrayList<>(builtins.size() + custom.size());
    all.addAll(builtins.values());
    all.addAll(custom.values());
    return Collections.unmodifiableList(all);
  }

  public Collection<FieldDescriptor> customFields() {
    return custom.values();
  }

  @Override
  public String toString() {
    return "TypeRegistry{builtins=" + builtins.size() + ", custom=" + custom.keySet() + "}";
  }

  private static Map<String, FieldDescriptor> builtinFields() {
    Map<String, FieldDescriptor> m = new LinkedHashMap<>();
    for (String keyword :
        List.of(
            "WorkflowId",
            "WorkflowType",
            "RunId",
            "TaskQueue",
            "ParentWorkflowId",
            "ParentRunId",
            "RootWorkflowId",
            "RootRunId")) {
      m.put(keyword, new FieldDescriptor(keyword, FieldType.KEYWORD, false));
    }
    m.put(
        "ExecutionStatus",
        new FieldDescriptor(
            "ExecutionStatus", FieldType.KEYWORD, false, ExecutionStatus.names()));
    for (String datetime : List.of("StartTime", "CloseTime", "ExecutionTime")) {
      m.put(datetime, new FieldDescriptor(datetime, FieldType.DATETIME, false));
    }
    for (String integer :
        List.of("HistoryLength", "HistorySizeBytes", "ExecutionDuration", "StateTransitionCount")) {
      m.put(integer, new FieldDescriptor(integer, FieldType.INT, false));
    }
    for (String list : List.of("BuildIds", "TemporalReportedProblems", "TemporalChangeVersion")) {
      m.put(list, new FieldDescriptor(list, FieldType.KEYWORD_LIST, false));
    }
    return Collections.unmodifiableMap(m);
  }
}
