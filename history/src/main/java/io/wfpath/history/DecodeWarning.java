package io.wfpath.history;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A payload that could not be decoded. Non-fatal: the rest of the batch is still decoded.
 *
 * @param eventId event carrying the payload
 * @param payloadIndex index of the payload within the event
 * @param message what went wrong
 */
public record DecodeWarning(long eventId, int payloadIndex, String message) {
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("eventId", eventId);
    map.put("payloadIndex", payloadIndex);
    map.put("message", message);
    return map;
  }
}
