package io.wfpath.history;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An event after projection. Fields that the projection drops are null.
 *
 * @param eventId event id, unchanged from the history
 * @param eventType CamelCase event type
 * @param eventTime event time, may be null
 * @param failureMessage failure message (standard and full)
 * @param primaryAttribute name of the identifying attribute, e.g. {@code activityType} (standard)
 * @param primaryValue value of the identifying attribute (standard)
 * @param attributes all attributes as recorded (full)
 * @param payloadSources payload references the decoded payloads came from
 * @param payloads decoded payloads, same order as {@code payloadSources}
 */
public record ProjectedEvent(
    long eventId,
    String eventType,
    Instant eventTime,
    String failureMessage,
    String primaryAttribute,
    String primaryValue,
    JsonNode attributes,
    List<Payload> payloadSources,
    List<DecodedPayload> payloads) {

  public ProjectedEvent {
    payloadSources = payloadSources == null ? List.of() : List.copyOf(payloadSources);
    payloads = payloads == null ? List.of() : List.copyOf(payloads);
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("eventId", eventId);
    map.put("eventType", eventType);
    map.put("eventTime", eventTime != null ? eventTime.toString() : null);
    if (failureMessage != null) {
      map.put("failureMessage", failureMessage);
    }
    if (primaryAttribute != null) {
      map.put(primaryAttribute, primaryValue);
    }
    if (attributes != null) {
      map.put("attributes", attributes);
    }
    if (!payloads.isEmpty()) {
      List<Map<String, Object>> decoded = new ArrayList<>(payloads.size());
      for (int i = 0; i < payloads.size(); i++) {
        Payload source = i < payloadSources.size() ? payloadSources.get(i) : null;
        decoded.add(payloads.get(i).toMap(source));
      }
      map.put("payloads", decoded);
    }
    return map;
  }
}
