package io.wfpath.history;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a pipeline run did.
 *
 * @param filtersApplied settings that shaped the result, e.g. {@code preset=summary}, {@code
 *     limit=5}
 * @param originalEventCount events in the history
 * @param filteredEventCount events returned
 */
public record FilterInfo(
    List<String> filtersApplied, int originalEventCount, int filteredEventCount) {

  public FilterInfo {
    filtersApplied = List.copyOf(filtersApplied);
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("filtersApplied", filtersApplied);
    map.put("originalEventCount", originalEventCount);
    map.put("filteredEventCount", filteredEventCount);
    return map;
  }
}
