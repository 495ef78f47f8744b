package io.wfpath.history;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a {@link HistoryPipeline} run.
 *
 * @param events projected events in output order
 * @param filterInfo summary of what was applied
 * @param warnings payloads that could not be decoded
 */
public record HistoryView(
    List<ProjectedEvent> events, FilterInfo filterInfo, List<DecodeWarning> warnings) {

  public HistoryView {
    events = List.copyOf(events);
    warnings = List.copyOf(warnings);
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("events", events.stream().map(ProjectedEvent::toMap).toList());
    map.put("filterInfo", filterInfo.toMap());
    if (!warnings.isEmpty()) {
      map.put("decodeWarnings", warnings.stream().map(DecodeWarning::toMap).toList());
    }
    return map;
  }
}
